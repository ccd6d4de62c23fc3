// file: src/main/java/io/kvbridge/client/command/RemoveCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.RemovePolicy;
import io.kvbridge.storage.StoreHandle;

/** remove(key, [policy]) -> (err, key) */
final class RemoveCommand extends KeyedCommand {

    RemoveCommand() {
        super("remove", 2);
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.policy(PolicyParser.removePolicyFromJson(args.optional(1), defaults.remove()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        store.remove(env.policy(RemovePolicy.class), env.key());
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        return new JsonNode[]{error(env), key(env)};
    }
}
