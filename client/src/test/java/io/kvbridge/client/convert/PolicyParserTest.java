// file: src/test/java/io/kvbridge/client/convert/PolicyParserTest.java
package io.kvbridge.client.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kvbridge.core.policy.BatchPolicy;
import io.kvbridge.core.policy.CommitLevel;
import io.kvbridge.core.policy.ExistsPolicy;
import io.kvbridge.core.policy.GenerationPolicy;
import io.kvbridge.core.policy.KeyPolicy;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.core.policy.RetryPolicy;
import io.kvbridge.core.policy.WritePolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PolicyParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String s) throws Exception {
        return MAPPER.readTree(s);
    }

    @Test
    void absent_policy_returns_fallback() throws Exception {
        assertSame(ReadPolicy.DEFAULT, PolicyParser.readPolicyFromJson(null, ReadPolicy.DEFAULT));
        assertSame(WritePolicy.DEFAULT, PolicyParser.writePolicyFromJson(json("null"), WritePolicy.DEFAULT));
    }

    @Test
    void option_names_are_case_insensitive_and_enums_take_codes_or_names() throws Exception {
        WritePolicy p = PolicyParser.writePolicyFromJson(
                json("{\"Timeout\":50,\"Gen\":1,\"KEY\":\"send\",\"exists\":\"CREATE\",\"commit_level\":1,\"Retry\":1}"),
                WritePolicy.DEFAULT);
        assertEquals(50, p.timeoutMillis());
        assertEquals(GenerationPolicy.EQ, p.gen());
        assertEquals(KeyPolicy.SEND, p.key());
        assertEquals(ExistsPolicy.CREATE, p.exists());
        assertEquals(CommitLevel.MASTER, p.commitLevel());
        assertEquals(RetryPolicy.ONCE, p.retry());
    }

    @Test
    void unspecified_options_keep_fallback_values() throws Exception {
        var fallback = new ReadPolicy(75, KeyPolicy.SEND, RetryPolicy.ONCE);
        ReadPolicy p = PolicyParser.readPolicyFromJson(json("{\"retry\":\"none\"}"), fallback);
        assertEquals(75, p.timeoutMillis());
        assertEquals(KeyPolicy.SEND, p.key());
        assertEquals(RetryPolicy.NONE, p.retry());
    }

    @Test
    void unknown_options_are_ignored() throws Exception {
        BatchPolicy p = PolicyParser.batchPolicyFromJson(json("{\"timeout\":10,\"concurrent\":true}"), BatchPolicy.DEFAULT);
        assertEquals(10, p.timeoutMillis());
    }

    @Test
    void bad_values_are_parameter_errors() {
        assertThrows(ParameterException.class,
                () -> PolicyParser.readPolicyFromJson(json("{\"timeout\":-1}"), ReadPolicy.DEFAULT));
        assertThrows(ParameterException.class,
                () -> PolicyParser.readPolicyFromJson(json("{\"timeout\":\"fast\"}"), ReadPolicy.DEFAULT));
        assertThrows(ParameterException.class,
                () -> PolicyParser.writePolicyFromJson(json("{\"exists\":9}"), WritePolicy.DEFAULT));
        assertThrows(ParameterException.class,
                () -> PolicyParser.removePolicyFromJson(json("{\"generation\":70000}"), RemovePolicy.DEFAULT));
        assertThrows(ParameterException.class,
                () -> PolicyParser.readPolicyFromJson(json("[1]"), ReadPolicy.DEFAULT));
    }

    @Test
    void remove_policy_reads_expected_generation() throws Exception {
        RemovePolicy p = PolicyParser.removePolicyFromJson(json("{\"gen\":\"EQ\",\"generation\":4}"), RemovePolicy.DEFAULT);
        assertEquals(GenerationPolicy.EQ, p.gen());
        assertEquals(4, p.generation());
    }

    @Test
    void policies_object_fills_missing_families_with_defaults() throws Exception {
        Policies p = PolicyParser.policiesFromJson(json("{\"read\":{\"timeout\":30},\"batch\":{\"timeout\":90}}"));
        assertEquals(30, p.read().timeoutMillis());
        assertEquals(90, p.batch().timeoutMillis());
        assertSame(WritePolicy.DEFAULT, p.write());
        assertSame(Policies.DEFAULT, PolicyParser.policiesFromJson(null));
    }
}
