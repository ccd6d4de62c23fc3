// file: src/main/java/io/kvbridge/client/command/PutCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.RecordMeta;
import io.kvbridge.core.StoreRecord;
import io.kvbridge.core.Value;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.core.policy.WritePolicy;
import io.kvbridge.storage.StoreHandle;

import java.util.Map;

/** put(key, bins, [meta], [policy]) -> (err, meta, key) */
final class PutCommand extends KeyedCommand {

    PutCommand() {
        super("put", 4);
    }

    @Override
    public int arity() {
        return 3;
    }

    @Override
    void prepareArguments(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        Map<String, Value> bins = Conversions.binsFromJson(args.required(1, "bins"));
        RecordMeta meta = Conversions.metaFromJson(args.optional(2));
        env.request(new StoreRecord(bins, meta));
        env.policy(PolicyParser.writePolicyFromJson(args.optional(3), defaults.write()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        env.resultMeta(store.put(env.policy(WritePolicy.class), env.key(), env.request()));
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        return new JsonNode[]{error(env), resultMeta(env), key(env)};
    }
}
