// file: src/main/java/io/kvbridge/client/command/GetCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.ReadPolicy;
import io.kvbridge.storage.StoreHandle;

/** get(key, [policy]) -> (err, bins, meta, key) */
final class GetCommand extends KeyedCommand {

    GetCommand() {
        super("get", 2);
    }

    @Override
    public int arity() {
        return 4;
    }

    @Override
    void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.policy(PolicyParser.readPolicyFromJson(args.optional(1), defaults.read()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        env.result(store.get(env.policy(ReadPolicy.class), env.key()));
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        return new JsonNode[]{error(env), bins(env), recordMeta(env), key(env)};
    }
}
