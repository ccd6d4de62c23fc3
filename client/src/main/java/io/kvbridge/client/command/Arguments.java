// file: src/main/java/io/kvbridge/client/command/Arguments.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.kvbridge.client.convert.ParameterException;

import java.util.ArrayList;
import java.util.List;

/**
 * Positional arguments of one call, callback excluded.
 * Java nulls and JSON nulls are the same thing: "argument not supplied".
 */
public final class Arguments {

    private final List<JsonNode> args;

    public Arguments(List<JsonNode> args) {
        this.args = new ArrayList<>(args.size());
        for (JsonNode a : args) {
            this.args.add(a == null ? NullNode.getInstance() : a);
        }
    }

    public static Arguments of(JsonNode... args) {
        return new Arguments(List.of(nonNull(args)));
    }

    public int size() {
        return args.size();
    }

    /** Argument at {@code i}, or null when absent or JSON null. */
    public JsonNode optional(int i) {
        if (i >= args.size()) return null;
        JsonNode n = args.get(i);
        return n.isNull() || n.isMissingNode() ? null : n;
    }

    public JsonNode required(int i, String what) throws ParameterException {
        JsonNode n = optional(i);
        if (n == null) {
            throw new ParameterException(what + " is required");
        }
        return n;
    }

    public void expectAtMost(int max, String command) throws ParameterException {
        if (args.size() > max) {
            throw new ParameterException("%s takes at most %d arguments, got %d".formatted(command, max, args.size()));
        }
    }

    private static JsonNode[] nonNull(JsonNode[] args) {
        JsonNode[] out = new JsonNode[args.length];
        for (int i = 0; i < args.length; i++) {
            out[i] = args[i] == null ? NullNode.getInstance() : args[i];
        }
        return out;
    }
}
