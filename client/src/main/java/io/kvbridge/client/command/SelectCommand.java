// file: src/main/java/io/kvbridge/client/command/SelectCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.storage.StoreHandle;

/** select(key, bins, [policy]) -> (err, bins, meta, key) */
final class SelectCommand extends KeyedCommand {

    SelectCommand() {
        super("select", 3);
    }

    @Override
    public int arity() {
        return 4;
    }

    @Override
    void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.bins(Conversions.binNamesFromJson(args.required(1, "bin names")));
        env.policy(PolicyParser.readPolicyFromJson(args.optional(2), defaults.read()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        env.result(store.select(env.policy(ReadPolicy.class), env.key(), env.bins()));
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        return new JsonNode[]{error(env), bins(env), recordMeta(env), key(env)};
    }
}
