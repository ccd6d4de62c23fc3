// file: src/test/java/io/kvbridge/client/convert/ConversionsTest.java
package io.kvbridge.client.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BinaryNode;
import io.kvbridge.core.BatchRead;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.Operation;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreError;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dynamic <-> native mapping: keys in both forms, values of every variant,
 * metadata, sub-operations, and the error shapes for malformed input.
 */
class ConversionsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String s) throws Exception {
        return MAPPER.readTree(s);
    }

    @Test
    void key_object_and_array_forms_are_equivalent() throws Exception {
        Key fromObject = Conversions.keyFromJson(json("{\"ns\":\"test\",\"set\":\"demo\",\"key\":\"a\"}"));
        Key fromArray = Conversions.keyFromJson(json("[\"test\",\"demo\",\"a\"]"));
        assertEquals(fromObject, fromArray);
        assertEquals(Key.of("test", "demo", "a"), fromObject);
    }

    @Test
    void integer_and_bytes_user_keys_are_supported() throws Exception {
        assertEquals(Key.of("test", "", 17L), Conversions.keyFromJson(json("{\"ns\":\"test\",\"key\":17}")));

        var node = MAPPER.createObjectNode();
        node.put("ns", "test");
        node.set("key", new BinaryNode(new byte[]{1, 2}));
        assertEquals(Key.of("test", "", new byte[]{1, 2}), Conversions.keyFromJson(node));
    }

    @Test
    void malformed_keys_are_parameter_errors() {
        for (String bad : List.of(
                "{\"set\":\"demo\",\"key\":1}",
                "{\"ns\":\"\",\"key\":1}",
                "{\"ns\":\"test\"}",
                "{\"ns\":\"test\",\"key\":null}",
                "{\"ns\":\"test\",\"key\":1.5}",
                "{\"ns\":\"test\",\"key\":true}",
                "{\"ns\":\"test\",\"key\":[1,2]}",
                "{\"ns\":\"test\",\"set\":5,\"key\":1}",
                "[\"test\",\"demo\"]",
                "[\"test\",\"demo\",1,2]",
                "\"test:demo:1\"")) {
            assertThrows(ParameterException.class, () -> Conversions.keyFromJson(json(bad)), bad);
        }
        assertThrows(ParameterException.class, () -> Conversions.keyFromJson(null));
    }

    @Test
    void key_to_json_keeps_the_user_key_type() {
        JsonNode node = Conversions.keyToJson(Key.of("test", "demo", 9L));
        assertEquals("test", node.get("ns").asText());
        assertEquals("demo", node.get("set").asText());
        assertTrue(node.get("key").isIntegralNumber());
        assertEquals(9L, node.get("key").longValue());
    }

    @Test
    void bins_convert_every_value_variant_and_nest() throws Exception {
        JsonNode input = json("""
                {"i": 7, "d": 1.25, "s": "hi", "l": [1, "two", [3]], "m": {"a": {"b": null}}, "n": null}
                """);
        Map<String, Value> bins = Conversions.binsFromJson(input);

        assertEquals(Value.of(7L), bins.get("i"));
        assertEquals(Value.of(1.25), bins.get("d"));
        assertEquals(Value.of("hi"), bins.get("s"));
        assertEquals(Value.Type.LIST, bins.get("l").type());
        assertEquals(Value.Type.MAP, bins.get("m").type());
        assertSame(Value.NullValue.INSTANCE, bins.get("n"));

        // Integers come back as 64-bit nodes, so compare the rendered text.
        JsonNode back = Conversions.binsToJson(StoreRecord.of(bins));
        assertEquals(input.toString(), back.toString());
    }

    @Test
    void sibling_order_survives_interleaved_containers() throws Exception {
        JsonNode input = json("""
                {"x": [[1], 2, [3, [4, {"k": [5]}]], {"p": 6, "q": [7]}, 8], "y": {"z": [], "w": {}}}
                """);
        JsonNode back = Conversions.binsToJson(StoreRecord.of(Conversions.binsFromJson(input)));
        assertEquals(input.toString(), back.toString());
    }

    @Test
    void bytes_become_binary_nodes_and_are_copied() {
        byte[] raw = {5, 6, 7};
        JsonNode node = Conversions.valueToJson(Value.of(raw));
        assertTrue(node.isBinary());
        raw[0] = 0;
        assertArrayEquals(new byte[]{5, 6, 7}, ((BinaryNode) node).binaryValue());
    }

    @Test
    void integer_map_keys_render_as_decimal_fields_and_others_fail() {
        Map<Value, Value> ok = new LinkedHashMap<>();
        ok.put(Value.of(12L), Value.of("x"));
        assertEquals("x", Conversions.valueToJson(new Value.MapValue(ok)).get("12").asText());

        Map<Value, Value> bad = new LinkedHashMap<>();
        bad.put(Value.of(1.5), Value.of("x"));
        assertThrows(ConversionException.class, () -> Conversions.valueToJson(new Value.MapValue(bad)));
    }

    @Test
    void invalid_bins_are_parameter_errors() {
        assertThrows(ParameterException.class, () -> Conversions.binsFromJson(json("{\"a_bin_name_too_long\":1}")));
        assertThrows(ParameterException.class, () -> Conversions.binsFromJson(json("{\"\":1}")));
        assertThrows(ParameterException.class, () -> Conversions.binsFromJson(json("{\"flag\":true}")));
        assertThrows(ParameterException.class, () -> Conversions.binsFromJson(json("[1]")));
        assertThrows(ParameterException.class, () -> Conversions.binsFromJson(json("{\"big\":18446744073709551616}")));
    }

    @Test
    void meta_defaults_and_ranges() throws Exception {
        assertEquals(RecordMeta.NONE, Conversions.metaFromJson(null));
        assertEquals(new RecordMeta(3, 600), Conversions.metaFromJson(json("{\"gen\":3,\"ttl\":600}")));
        assertEquals(new RecordMeta(0, RecordMeta.TTL_NO_CHANGE), Conversions.metaFromJson(json("{}")));
        assertThrows(ParameterException.class, () -> Conversions.metaFromJson(json("{\"gen\":70000}")));
        assertThrows(ParameterException.class, () -> Conversions.metaFromJson(json("{\"ttl\":-2}")));
        assertThrows(ParameterException.class, () -> Conversions.metaFromJson(json("{\"ttl\":\"1h\"}")));
    }

    @Test
    void operations_accept_codes_and_names() throws Exception {
        List<Operation> ops = Conversions.operationsFromJson(json("""
                [
                  {"operation": 2, "binName": "n", "binValue": 10},
                  {"operation": "append", "binName": "s", "binValue": "x"},
                  {"operation": "READ", "binName": "n"},
                  {"operation": 5}
                ]
                """));
        assertEquals(List.of(
                Operation.incr("n", 10),
                Operation.append("s", "x"),
                Operation.read("n"),
                Operation.touch()), ops);
    }

    @Test
    void malformed_operations_are_parameter_errors() {
        for (String bad : List.of(
                "[]",
                "{}",
                "[{\"binName\":\"n\"}]",
                "[{\"operation\":9,\"binName\":\"n\"}]",
                "[{\"operation\":\"SHIFT\",\"binName\":\"n\"}]",
                "[{\"operation\":\"INCR\",\"binName\":\"n\",\"binValue\":\"1\"}]",
                "[{\"operation\":\"APPEND\",\"binName\":\"n\",\"binValue\":1}]",
                "[{\"operation\":\"READ\"}]")) {
            assertThrows(ParameterException.class, () -> Conversions.operationsFromJson(json(bad)), bad);
        }
    }

    @Test
    void error_json_carries_code_message_and_location() {
        JsonNode err = Conversions.errorToJson(StoreError.of(ErrorCode.RECORD_NOT_FOUND, "gone"));
        assertEquals(2, err.get("code").asInt());
        assertEquals("gone", err.get("message").asText());
        assertEquals("ConversionsTest.java", err.get("file").asText());
        assertTrue(err.get("line").asInt() > 0);
    }

    @Test
    void batch_json_has_one_entry_per_key_with_status() {
        Key a = Key.of("test", "demo", "a");
        Key b = Key.of("test", "demo", "b");
        var results = List.of(
                BatchRead.found(a, new StoreRecord(Map.of("v", Value.of(1L)), new RecordMeta(4, 0))),
                BatchRead.failed(b, ErrorCode.RECORD_NOT_FOUND));

        JsonNode withBins = Conversions.batchToJson(results, true);
        assertEquals(2, withBins.size());
        assertEquals(0, withBins.get(0).get("status").asInt());
        assertEquals(1, withBins.get(0).get("bins").get("v").asInt());
        assertEquals(4, withBins.get(0).get("meta").get("gen").asInt());
        assertEquals(2, withBins.get(1).get("status").asInt());
        assertEquals("b", withBins.get(1).get("key").get("key").asText());
        assertFalse(withBins.get(1).has("bins"));

        JsonNode metaOnly = Conversions.batchToJson(results, false);
        assertFalse(metaOnly.get(0).has("bins"));
        assertTrue(metaOnly.get(0).has("meta"));
    }
}
