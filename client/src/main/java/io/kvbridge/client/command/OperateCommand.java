// file: src/main/java/io/kvbridge/client/command/OperateCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.OperatePolicy;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.storage.StoreHandle;

/**
 * operate(key, operations, [meta], [policy]) -> (err, bins, meta, key)
 * <p>
 * bins holds the values produced by READ operations only.
 */
final class OperateCommand extends KeyedCommand {

    OperateCommand() {
        super("operate", 4);
    }

    @Override
    public int arity() {
        return 4;
    }

    @Override
    void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.operations(Conversions.operationsFromJson(args.required(1, "operations")));
        env.requestMeta(Conversions.metaFromJson(args.optional(2)));
        env.policy(PolicyParser.operatePolicyFromJson(args.optional(3), defaults.operate()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        env.result(store.operate(env.policy(OperatePolicy.class), env.key(), env.operations(), env.requestMeta()));
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        return new JsonNode[]{error(env), bins(env), recordMeta(env), key(env)};
    }
}
