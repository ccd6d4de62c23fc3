// file: src/main/java/io/kvbridge/core/Value.java
package io.kvbridge.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged variant for every value a bin can hold.
 * <p>
 * Variants:
 *  - IntegerValue: signed 64-bit integer.
 *  - DoubleValue:  IEEE-754 double.
 *  - StringValue:  UTF-16 string.
 *  - BytesValue:   opaque byte sequence (copied on input and output).
 *  - ListValue:    ordered list of values.
 *  - MapValue:     insertion-ordered map of value -> value.
 *  - NullValue:    explicit null; written to a bin it removes that bin.
 * <p>
 * Lists and maps nest without any depth limit. Walks over a value (conversion,
 * size estimation) use an explicit stack, not recursion.
 */
public sealed interface Value
        permits Value.IntegerValue, Value.DoubleValue, Value.StringValue,
                Value.BytesValue, Value.ListValue, Value.MapValue, Value.NullValue {

    /** Discriminator, handy for switch statements and error messages. */
    Type type();

    enum Type { INTEGER, DOUBLE, STRING, BYTES, LIST, MAP, NULL }

    static Value of(long v) { return new IntegerValue(v); }

    static Value of(double v) { return new DoubleValue(v); }

    static Value of(String v) { return v == null ? NullValue.INSTANCE : new StringValue(v); }

    static Value of(byte[] v) { return v == null ? NullValue.INSTANCE : new BytesValue(v); }

    static Value nil() { return NullValue.INSTANCE; }

    record IntegerValue(long value) implements Value {
        @Override public Type type() { return Type.INTEGER; }
    }

    record DoubleValue(double value) implements Value {
        @Override public Type type() { return Type.DOUBLE; }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override public Type type() { return Type.STRING; }
    }

    final class BytesValue implements Value {
        private final byte[] value;

        public BytesValue(byte[] value) {
            this.value = Arrays.copyOf(Objects.requireNonNull(value, "value"), value.length);
        }

        public byte[] value() { return Arrays.copyOf(value, value.length); }

        public int length() { return value.length; }

        @Override public Type type() { return Type.BYTES; }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BytesValue other)) return false;
            return Arrays.equals(value, other.value);
        }

        @Override public int hashCode() { return Arrays.hashCode(value); }

        @Override public String toString() { return "BytesValue[length=" + value.length + "]"; }
    }

    record ListValue(List<Value> values) implements Value {
        public ListValue {
            values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values")));
        }

        @Override public Type type() { return Type.LIST; }
    }

    record MapValue(Map<Value, Value> entries) implements Value {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(entries, "entries")));
        }

        @Override public Type type() { return Type.MAP; }
    }

    final class NullValue implements Value {
        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override public Type type() { return Type.NULL; }

        @Override public String toString() { return "NullValue"; }
    }
}
