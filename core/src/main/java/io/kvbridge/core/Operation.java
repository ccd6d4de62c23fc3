// file: src/main/java/io/kvbridge/core/Operation.java
package io.kvbridge.core;

import java.util.Locale;
import java.util.Objects;

/**
 * One step of an atomic multi-operation ("operate") on a single record.
 * <p>
 * Shape by operator:
 *  - WRITE:          binName + any value (NullValue drops the bin)
 *  - READ:           binName, no value
 *  - INCR:           binName + IntegerValue delta
 *  - PREPEND/APPEND: binName + StringValue
 *  - TOUCH:          neither; refreshes TTL and bumps generation
 */
public record Operation(Operator operator, String binName, Value value) {

    public Operation {
        Objects.requireNonNull(operator, "operator");
        switch (operator) {
            case TOUCH -> {
                binName = null;
                value = null;
            }
            case READ -> {
                StoreRecord.checkBinName(binName);
                value = null;
            }
            case INCR -> {
                StoreRecord.checkBinName(binName);
                if (!(value instanceof Value.IntegerValue)) {
                    throw new IllegalArgumentException("INCR requires an integer value");
                }
            }
            case PREPEND, APPEND -> {
                StoreRecord.checkBinName(binName);
                if (!(value instanceof Value.StringValue)) {
                    throw new IllegalArgumentException(operator + " requires a string value");
                }
            }
            case WRITE -> {
                StoreRecord.checkBinName(binName);
                Objects.requireNonNull(value, "value");
            }
        }
    }

    public static Operation write(String bin, Value value) { return new Operation(Operator.WRITE, bin, value); }

    public static Operation read(String bin) { return new Operation(Operator.READ, bin, null); }

    public static Operation incr(String bin, long delta) { return new Operation(Operator.INCR, bin, Value.of(delta)); }

    public static Operation append(String bin, String s) { return new Operation(Operator.APPEND, bin, Value.of(s)); }

    public static Operation prepend(String bin, String s) { return new Operation(Operator.PREPEND, bin, Value.of(s)); }

    public static Operation touch() { return new Operation(Operator.TOUCH, null, null); }

    /** Whether applying this step modifies the record. */
    public boolean isWrite() {
        return operator != Operator.READ;
    }

    public enum Operator {
        WRITE, READ, INCR, PREPEND, APPEND, TOUCH;

        public int code() {
            return ordinal();
        }

        public static Operator fromCode(int code) {
            Operator[] all = values();
            if (code < 0 || code >= all.length) {
                throw new IllegalArgumentException("unknown operator code: " + code);
            }
            return all[code];
        }

        public static Operator fromName(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }
}
