// file: src/main/java/io/kvbridge/client/command/KeyedCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.Key;
import io.kvbridge.core.policy.Policies;

/**
 * Base for single-key commands: argument 0 is always the key.
 * The key is stored in the envelope before anything else is parsed, so a
 * later parse failure still reports it in the callback.
 */
abstract class KeyedCommand implements Command {

    private final String name;
    private final int maxArgs;

    KeyedCommand(String name, int maxArgs) {
        this.name = name;
        this.maxArgs = maxArgs;
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final void prepare(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.key(Conversions.keyFromJson(args.optional(0)));
        args.expectAtMost(maxArgs, name);
        prepareArguments(args, env, defaults);
    }

    /** Parse the arguments after the key. */
    abstract void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException;

    static JsonNode error(Envelope env) {
        return Conversions.errorToJson(env.error());
    }

    static JsonNode key(Envelope env) {
        Key key = env.key();
        return key == null ? Conversions.nil() : Conversions.keyToJson(key);
    }

    static JsonNode bins(Envelope env) {
        return env.ok() ? Conversions.binsToJson(env.result()) : Conversions.nil();
    }

    static JsonNode recordMeta(Envelope env) {
        return env.ok() ? Conversions.metaToJson(env.result()) : Conversions.nil();
    }

    static JsonNode resultMeta(Envelope env) {
        return env.ok() ? Conversions.metaToJson(env.resultMeta()) : Conversions.nil();
    }
}
