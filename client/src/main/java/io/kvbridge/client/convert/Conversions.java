// file: src/main/java/io/kvbridge/client/convert/Conversions.java
package io.kvbridge.client.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.kvbridge.core.BatchRead;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.Operation;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreError;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping between Jackson trees (the dynamic object model seen by
 * callers) and the native store structures.
 * <p>
 * Native -> dynamic:
 *  - never fails for keys, errors and metadata;
 *  - fails with {@link ConversionException} only for map values whose keys are
 *    neither strings nor integers.
 * <p>
 * Dynamic -> native:
 *  - validates shape and throws {@link ParameterException} on anything malformed;
 *  - never throws unchecked exceptions for bad input.
 * <p>
 * Nested lists and maps are converted without recursion, so depth is
 * bounded by the heap only.
 */
public final class Conversions {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Conversions() {
        // utility
    }

    // =========================================================
    // native -> dynamic
    // =========================================================

    /** {code, message, file, line} */
    public static ObjectNode errorToJson(StoreError error) {
        ObjectNode out = NODES.objectNode();
        out.put("code", error.code().code());
        out.put("message", error.message());
        out.put("file", error.file());
        out.put("line", error.line());
        return out;
    }

    /** {ns, set, key} with key typed as number, text or binary. */
    public static ObjectNode keyToJson(Key key) {
        ObjectNode out = NODES.objectNode();
        out.put("ns", key.namespace());
        out.put("set", key.set());
        Key.UserKey uk = key.userKey();
        if (uk instanceof Key.UserKey.IntegerKey ik) {
            out.put("key", ik.value());
        } else if (uk instanceof Key.UserKey.StringKey sk) {
            out.put("key", sk.value());
        } else if (uk instanceof Key.UserKey.BytesKey bk) {
            out.put("key", bk.value());
        }
        return out;
    }

    /** {ttl, gen} */
    public static ObjectNode metaToJson(RecordMeta meta) {
        ObjectNode out = NODES.objectNode();
        out.put("ttl", meta.ttl());
        out.put("gen", meta.generation());
        return out;
    }

    public static ObjectNode metaToJson(StoreRecord record) {
        return metaToJson(record.meta());
    }

    /** {binName: value, ...} in the record's bin order. */
    public static ObjectNode binsToJson(StoreRecord record) {
        ObjectNode out = NODES.objectNode();
        for (Map.Entry<String, Value> bin : record.bins().entrySet()) {
            out.set(bin.getKey(), valueToJson(bin.getValue()));
        }
        return out;
    }

    /**
     * Tagged-variant dispatch. Bytes are copied into the BinaryNode, so the
     * native buffer and the dynamic one never alias.
     * <p>
     * Containers are created empty, attached to their parent in order, and
     * filled later from a work stack, so nesting depth costs heap, not stack.
     */
    public static JsonNode valueToJson(Value value) {
        JsonNode root = emptyOrScalarToJson(value);
        Deque<Fill> pending = new ArrayDeque<>();
        if (root.isContainerNode()) {
            pending.push(new Fill(value, root));
        }
        while (!pending.isEmpty()) {
            Fill fill = pending.pop();
            if (fill.source instanceof Value.ListValue list) {
                ArrayNode arr = (ArrayNode) fill.target;
                for (Value item : list.values()) {
                    JsonNode child = emptyOrScalarToJson(item);
                    arr.add(child);
                    if (child.isContainerNode()) pending.push(new Fill(item, child));
                }
            } else {
                ObjectNode obj = (ObjectNode) fill.target;
                for (Map.Entry<Value, Value> e : ((Value.MapValue) fill.source).entries().entrySet()) {
                    JsonNode child = emptyOrScalarToJson(e.getValue());
                    obj.set(mapKeyToJson(e.getKey()), child);
                    if (child.isContainerNode()) pending.push(new Fill(e.getValue(), child));
                }
            }
        }
        return root;
    }

    private static JsonNode emptyOrScalarToJson(Value value) {
        if (value instanceof Value.IntegerValue v) return NODES.numberNode(v.value());
        if (value instanceof Value.DoubleValue v) return NODES.numberNode(v.value());
        if (value instanceof Value.StringValue v) return NODES.textNode(v.value());
        if (value instanceof Value.BytesValue v) return NODES.binaryNode(v.value());
        if (value instanceof Value.ListValue v) return NODES.arrayNode(v.values().size());
        if (value instanceof Value.MapValue) return NODES.objectNode();
        if (value == null || value instanceof Value.NullValue) return NullNode.getInstance();
        throw new ConversionException("unsupported value type: " + value.type());
    }

    /** A native container whose dynamic counterpart still has to be filled. */
    private record Fill(Value source, JsonNode target) {
    }

    /**
     * One entry per key, in request order:
     * {status, key, meta} plus {bins} when {@code withBins} and the entry was found.
     */
    public static ArrayNode batchToJson(List<BatchRead> results, boolean withBins) {
        ArrayNode out = NODES.arrayNode(results.size());
        for (BatchRead r : results) {
            ObjectNode entry = NODES.objectNode();
            entry.put("status", r.status().code());
            entry.set("key", keyToJson(r.key()));
            if (r.status() == ErrorCode.OK) {
                if (withBins) {
                    entry.set("bins", binsToJson(r.record()));
                }
                entry.set("meta", metaToJson(r.record()));
            }
            out.add(entry);
        }
        return out;
    }

    private static String mapKeyToJson(Value key) {
        if (key instanceof Value.StringValue s) return s.value();
        if (key instanceof Value.IntegerValue i) return Long.toString(i.value());
        throw new ConversionException("map key of type " + key.type() + " cannot be represented as an object field");
    }

    // =========================================================
    // dynamic -> native
    // =========================================================

    /**
     * Key in object form {ns, set, key} or positional form [ns, set, key].
     * The user key must be an integral number, a string or binary.
     */
    public static Key keyFromJson(JsonNode node) throws ParameterException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new ParameterException("key is required");
        }
        JsonNode ns;
        JsonNode set;
        JsonNode userKey;
        if (node.isArray()) {
            if (node.size() != 3) {
                throw new ParameterException("key array must be [ns, set, key], got " + node.size() + " elements");
            }
            ns = node.get(0);
            set = node.get(1);
            userKey = node.get(2);
        } else if (node.isObject()) {
            ns = node.get("ns");
            set = node.get("set");
            userKey = node.get("key");
        } else {
            throw new ParameterException("key must be an object or an array, got " + node.getNodeType());
        }

        if (ns == null || !ns.isTextual() || ns.textValue().isBlank()) {
            throw new ParameterException("key.ns must be a non-empty string");
        }
        String setName = "";
        if (set != null && !set.isNull()) {
            if (!set.isTextual()) {
                throw new ParameterException("key.set must be a string");
            }
            setName = set.textValue();
        }
        if (userKey == null || userKey.isNull() || userKey.isMissingNode()) {
            throw new ParameterException("key.key is required");
        }
        if (userKey.isIntegralNumber()) {
            if (!userKey.canConvertToLong()) {
                throw new ParameterException("key.key does not fit in 64 bits");
            }
            return Key.of(ns.textValue(), setName, userKey.longValue());
        }
        if (userKey.isTextual()) {
            return Key.of(ns.textValue(), setName, userKey.textValue());
        }
        if (userKey.isBinary()) {
            return Key.of(ns.textValue(), setName, ((BinaryNode) userKey).binaryValue());
        }
        throw new ParameterException("key.key must be an integer, a string or bytes, got " + userKey.getNodeType());
    }

    /** Non-empty array of keys, order preserved. */
    public static List<Key> keysFromJson(JsonNode node) throws ParameterException {
        if (node == null || !node.isArray()) {
            throw new ParameterException("keys must be an array");
        }
        if (node.isEmpty()) {
            throw new ParameterException("keys must not be empty");
        }
        List<Key> keys = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            try {
                keys.add(keyFromJson(node.get(i)));
            } catch (ParameterException e) {
                throw new ParameterException("keys[" + i + "]: " + e.getMessage(), e);
            }
        }
        return keys;
    }

    /** {binName: value} -> ordered native bins. */
    public static Map<String, Value> binsFromJson(JsonNode node) throws ParameterException {
        if (node == null || !node.isObject()) {
            throw new ParameterException("bins must be an object");
        }
        Map<String, Value> bins = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            checkBinName(field.getKey());
            try {
                bins.put(field.getKey(), valueFromJson(field.getValue()));
            } catch (ParameterException e) {
                throw new ParameterException("bin '" + field.getKey() + "': " + e.getMessage(), e);
            }
        }
        return bins;
    }

    /** Non-empty array of bin names. */
    public static List<String> binNamesFromJson(JsonNode node) throws ParameterException {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ParameterException("bin names must be a non-empty array");
        }
        List<String> names = new ArrayList<>(node.size());
        for (JsonNode n : node) {
            if (!n.isTextual()) {
                throw new ParameterException("bin names must be strings, got " + n.getNodeType());
            }
            checkBinName(n.textValue());
            names.add(n.textValue());
        }
        return names;
    }

    /**
     * Lists and objects are built bottom-up from an explicit stack of
     * partially filled frames; a child container is finished before its
     * parent takes the next element.
     */
    public static Value valueFromJson(JsonNode node) throws ParameterException {
        if (node == null || !node.isContainerNode()) {
            return scalarFromJson(node);
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node));
        Value finished = null;
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (finished != null) {
                top.accept(finished);
                finished = null;
            }
            if (top.hasNext()) {
                JsonNode child = top.next();
                if (child.isContainerNode()) {
                    stack.push(new Frame(child));
                } else {
                    top.accept(scalarFromJson(child));
                }
            } else {
                stack.pop();
                finished = top.build();
            }
        }
        return finished;
    }

    private static Value scalarFromJson(JsonNode node) throws ParameterException {
        if (node == null || node.isNull()) {
            return Value.nil();
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new ParameterException("integer does not fit in 64 bits: " + node);
            }
            return Value.of(node.longValue());
        }
        if (node.isFloatingPointNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isBinary()) {
            return Value.of(((BinaryNode) node).binaryValue());
        }
        throw new ParameterException("unsupported value type: " + node.getNodeType());
    }

    /** One list or object being converted; object fields keep their order. */
    private static final class Frame {
        private final Iterator<JsonNode> items;
        private final Iterator<Map.Entry<String, JsonNode>> fields;
        private final List<Value> values;
        private final Map<Value, Value> entries;
        private String field;

        Frame(JsonNode node) {
            if (node.isArray()) {
                this.items = node.elements();
                this.fields = null;
                this.values = new ArrayList<>(node.size());
                this.entries = null;
            } else {
                this.items = null;
                this.fields = node.fields();
                this.values = null;
                this.entries = new LinkedHashMap<>();
            }
        }

        boolean hasNext() {
            return items != null ? items.hasNext() : fields.hasNext();
        }

        JsonNode next() {
            if (items != null) {
                return items.next();
            }
            Map.Entry<String, JsonNode> f = fields.next();
            field = f.getKey();
            return f.getValue();
        }

        void accept(Value v) {
            if (values != null) {
                values.add(v);
            } else {
                entries.put(Value.of(field), v);
            }
        }

        Value build() {
            return values != null ? new Value.ListValue(values) : new Value.MapValue(entries);
        }
    }

    /** {ttl, gen}, both optional; absent fields fall back to "no change" / "unset". */
    public static RecordMeta metaFromJson(JsonNode node) throws ParameterException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RecordMeta.NONE;
        }
        if (!node.isObject()) {
            throw new ParameterException("metadata must be an object");
        }
        return new RecordMeta(generationFromJson(node), ttlFromJson(node));
    }

    public static long ttlFromJson(JsonNode meta) throws ParameterException {
        JsonNode ttl = meta.get("ttl");
        if (ttl == null || ttl.isNull()) {
            return RecordMeta.TTL_NO_CHANGE;
        }
        if (!ttl.isIntegralNumber() || !ttl.canConvertToLong()) {
            throw new ParameterException("meta.ttl must be an integer");
        }
        long v = ttl.longValue();
        if (v < RecordMeta.TTL_NO_CHANGE || v > RecordMeta.TTL_MAX) {
            throw new ParameterException("meta.ttl out of range: " + v);
        }
        return v;
    }

    public static int generationFromJson(JsonNode meta) throws ParameterException {
        JsonNode gen = meta.get("gen");
        if (gen == null || gen.isNull()) {
            return RecordMeta.GENERATION_UNSET;
        }
        if (!gen.isIntegralNumber() || !gen.canConvertToInt()) {
            throw new ParameterException("meta.gen must be an integer");
        }
        int v = gen.intValue();
        if (v < 0 || v > RecordMeta.GENERATION_MAX) {
            throw new ParameterException("meta.gen out of range: " + v);
        }
        return v;
    }

    /**
     * [{operation, binName, binValue}, ...]; operation is an operator code or name.
     */
    public static List<Operation> operationsFromJson(JsonNode node) throws ParameterException {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new ParameterException("operations must be a non-empty array");
        }
        List<Operation> ops = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            try {
                ops.add(operationFromJson(node.get(i)));
            } catch (ParameterException e) {
                throw new ParameterException("operations[" + i + "]: " + e.getMessage(), e);
            }
        }
        return ops;
    }

    private static Operation operationFromJson(JsonNode node) throws ParameterException {
        if (!node.isObject()) {
            throw new ParameterException("operation must be an object");
        }
        Operation.Operator operator = operatorFromJson(node.get("operation"));

        String bin = null;
        JsonNode binName = node.get("binName");
        if (operator != Operation.Operator.TOUCH) {
            if (binName == null || !binName.isTextual()) {
                throw new ParameterException(operator + " requires a string binName");
            }
            bin = binName.textValue();
            checkBinName(bin);
        }

        Value value = null;
        JsonNode binValue = node.get("binValue");
        switch (operator) {
            case WRITE -> value = valueFromJson(binValue);
            case INCR -> {
                if (binValue == null || !binValue.isIntegralNumber() || !binValue.canConvertToLong()) {
                    throw new ParameterException("INCR requires an integer binValue");
                }
                value = Value.of(binValue.longValue());
            }
            case APPEND, PREPEND -> {
                if (binValue == null || !binValue.isTextual()) {
                    throw new ParameterException(operator + " requires a string binValue");
                }
                value = Value.of(binValue.textValue());
            }
            case READ, TOUCH -> {
                // no value
            }
        }
        return new Operation(operator, bin, value);
    }

    private static Operation.Operator operatorFromJson(JsonNode op) throws ParameterException {
        if (op == null || op.isNull()) {
            throw new ParameterException("operation is required");
        }
        try {
            if (op.isIntegralNumber() && op.canConvertToInt()) {
                return Operation.Operator.fromCode(op.intValue());
            }
            if (op.isTextual()) {
                return Operation.Operator.fromName(op.textValue());
            }
        } catch (IllegalArgumentException e) {
            throw new ParameterException("unknown operation: " + op, e);
        }
        throw new ParameterException("operation must be a code or a name, got " + op.getNodeType());
    }

    private static void checkBinName(String name) throws ParameterException {
        try {
            StoreRecord.checkBinName(name);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }

    /** Shorthand used by commands to build the fixed-arity callback argument list. */
    public static JsonNode nil() {
        return NullNode.getInstance();
    }

    /** Error record for a failed parse. */
    public static StoreError paramError(ParameterException e) {
        return StoreError.of(ErrorCode.PARAM, e.getMessage());
    }
}
