// file: src/main/java/io/kvbridge/client/convert/PolicyParser.java
package io.kvbridge.client.convert;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.policy.BatchPolicy;
import io.kvbridge.core.policy.CommitLevel;
import io.kvbridge.core.policy.ExistsPolicy;
import io.kvbridge.core.policy.GenerationPolicy;
import io.kvbridge.core.policy.KeyPolicy;
import io.kvbridge.core.policy.OperatePolicy;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.core.policy.RetryPolicy;
import io.kvbridge.core.policy.WritePolicy;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dynamic policy objects -> immutable policy records.
 * <p>
 * Rules:
 *  - null / missing input yields the supplied fallback (usually the client default).
 *  - Option names are matched case-insensitively ("Gen", "gen" and "GEN" are the same).
 *  - Options not recognized for the family are ignored and logged at FINE.
 *  - Enum options accept either the numeric code or the constant name.
 *  - A recognized option with a value of the wrong type is a {@link ParameterException}.
 */
public final class PolicyParser {
    private static final Logger log = Logger.getLogger(PolicyParser.class.getName());

    private PolicyParser() {
        // utility
    }

    public static ReadPolicy readPolicyFromJson(JsonNode node, ReadPolicy fallback) throws ParameterException {
        if (absent(node)) return fallback;
        long timeout = fallback.timeoutMillis();
        KeyPolicy key = fallback.key();
        RetryPolicy retry = fallback.retry();
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(node, "read"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            switch (normalize(f.getKey())) {
                case "timeout" -> timeout = timeout(f.getValue());
                case "key" -> key = enumValue(f.getValue(), KeyPolicy.class, "key");
                case "retry" -> retry = enumValue(f.getValue(), RetryPolicy.class, "retry");
                default -> ignored("read", f.getKey());
            }
        }
        return new ReadPolicy(timeout, key, retry);
    }

    public static WritePolicy writePolicyFromJson(JsonNode node, WritePolicy fallback) throws ParameterException {
        if (absent(node)) return fallback;
        long timeout = fallback.timeoutMillis();
        GenerationPolicy gen = fallback.gen();
        KeyPolicy key = fallback.key();
        ExistsPolicy exists = fallback.exists();
        CommitLevel commitLevel = fallback.commitLevel();
        RetryPolicy retry = fallback.retry();
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(node, "write"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            switch (normalize(f.getKey())) {
                case "timeout" -> timeout = timeout(f.getValue());
                case "gen" -> gen = enumValue(f.getValue(), GenerationPolicy.class, "gen");
                case "key" -> key = enumValue(f.getValue(), KeyPolicy.class, "key");
                case "exists" -> exists = enumValue(f.getValue(), ExistsPolicy.class, "exists");
                case "commitlevel" -> commitLevel = enumValue(f.getValue(), CommitLevel.class, "commitLevel");
                case "retry" -> retry = enumValue(f.getValue(), RetryPolicy.class, "retry");
                default -> ignored("write", f.getKey());
            }
        }
        return new WritePolicy(timeout, gen, key, exists, commitLevel, retry);
    }

    public static RemovePolicy removePolicyFromJson(JsonNode node, RemovePolicy fallback) throws ParameterException {
        if (absent(node)) return fallback;
        long timeout = fallback.timeoutMillis();
        GenerationPolicy gen = fallback.gen();
        int generation = fallback.generation();
        KeyPolicy key = fallback.key();
        RetryPolicy retry = fallback.retry();
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(node, "remove"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            switch (normalize(f.getKey())) {
                case "timeout" -> timeout = timeout(f.getValue());
                case "gen" -> gen = enumValue(f.getValue(), GenerationPolicy.class, "gen");
                case "generation" -> generation = generation(f.getValue());
                case "key" -> key = enumValue(f.getValue(), KeyPolicy.class, "key");
                case "retry" -> retry = enumValue(f.getValue(), RetryPolicy.class, "retry");
                default -> ignored("remove", f.getKey());
            }
        }
        return new RemovePolicy(timeout, gen, generation, key, retry);
    }

    public static OperatePolicy operatePolicyFromJson(JsonNode node, OperatePolicy fallback) throws ParameterException {
        if (absent(node)) return fallback;
        long timeout = fallback.timeoutMillis();
        GenerationPolicy gen = fallback.gen();
        KeyPolicy key = fallback.key();
        CommitLevel commitLevel = fallback.commitLevel();
        RetryPolicy retry = fallback.retry();
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(node, "operate"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            switch (normalize(f.getKey())) {
                case "timeout" -> timeout = timeout(f.getValue());
                case "gen" -> gen = enumValue(f.getValue(), GenerationPolicy.class, "gen");
                case "key" -> key = enumValue(f.getValue(), KeyPolicy.class, "key");
                case "commitlevel" -> commitLevel = enumValue(f.getValue(), CommitLevel.class, "commitLevel");
                case "retry" -> retry = enumValue(f.getValue(), RetryPolicy.class, "retry");
                default -> ignored("operate", f.getKey());
            }
        }
        return new OperatePolicy(timeout, gen, key, commitLevel, retry);
    }

    public static BatchPolicy batchPolicyFromJson(JsonNode node, BatchPolicy fallback) throws ParameterException {
        if (absent(node)) return fallback;
        long timeout = fallback.timeoutMillis();
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(node, "batch"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            if ("timeout".equals(normalize(f.getKey()))) {
                timeout = timeout(f.getValue());
            } else {
                ignored("batch", f.getKey());
            }
        }
        return new BatchPolicy(timeout);
    }

    /**
     * {read, write, remove, operate, batch}; each family falls back to its DEFAULT.
     */
    public static Policies policiesFromJson(JsonNode node) throws ParameterException {
        if (absent(node)) return Policies.DEFAULT;
        if (!node.isObject()) {
            throw new ParameterException("policies must be an object");
        }
        return new Policies(
                readPolicyFromJson(node.get("read"), ReadPolicy.DEFAULT),
                writePolicyFromJson(node.get("write"), WritePolicy.DEFAULT),
                removePolicyFromJson(node.get("remove"), RemovePolicy.DEFAULT),
                operatePolicyFromJson(node.get("operate"), OperatePolicy.DEFAULT),
                batchPolicyFromJson(node.get("batch"), BatchPolicy.DEFAULT)
        );
    }

    // ---------- helpers ----------

    private static boolean absent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode node, String family) throws ParameterException {
        if (!node.isObject()) {
            throw new ParameterException(family + " policy must be an object, got " + node.getNodeType());
        }
        return node.fields();
    }

    private static String normalize(String option) {
        return option.replace("_", "").toLowerCase(Locale.ROOT);
    }

    private static long timeout(JsonNode v) throws ParameterException {
        if (!v.isIntegralNumber() || !v.canConvertToLong() || v.longValue() < 0) {
            throw new ParameterException("policy timeout must be a non-negative integer (ms), got " + v);
        }
        return v.longValue();
    }

    private static int generation(JsonNode v) throws ParameterException {
        if (!v.isIntegralNumber() || !v.canConvertToInt()
                || v.intValue() < 0 || v.intValue() > RecordMeta.GENERATION_MAX) {
            throw new ParameterException("policy generation must be an integer in [0, 65535], got " + v);
        }
        return v.intValue();
    }

    static <E extends Enum<E>> E enumValue(JsonNode v, Class<E> type, String option) throws ParameterException {
        E[] constants = type.getEnumConstants();
        if (v.isIntegralNumber() && v.canConvertToInt()) {
            int code = v.intValue();
            if (code >= 0 && code < constants.length) {
                return constants[code];
            }
        } else if (v.isTextual()) {
            String name = v.textValue().trim().toUpperCase(Locale.ROOT);
            for (E c : constants) {
                if (c.name().equals(name)) {
                    return c;
                }
            }
        }
        throw new ParameterException("policy option '%s' has invalid value %s".formatted(option, v));
    }

    private static void ignored(String family, String option) {
        log.log(Level.FINE, "ignoring unknown {0} policy option ''{1}''", new Object[]{family, option});
    }
}
