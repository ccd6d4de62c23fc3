// file: src/main/java/io/kvbridge/client/command/BatchCommand.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.convert.PolicyParser;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.BatchPolicy;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.storage.StoreHandle;

/**
 * Multi-key reads: batchGet, batchExists and batchSelect.
 * <p>
 * Semantics:
 *  - One store call for the whole key list.
 *  - The results array has one entry per requested key, in request order,
 *    each with its own status. A missing key does not fail the batch.
 *  - The batch-level error is non-OK only when the whole call failed; the
 *    results argument is then null.
 */
final class BatchCommand implements Command {

    enum Mode { GET, EXISTS, SELECT }

    private final String name;
    private final Mode mode;

    BatchCommand(String name, Mode mode) {
        this.name = name;
        this.mode = mode;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public void prepare(Arguments args, Envelope env, Policies defaults) throws ParameterException {
        env.keys(Conversions.keysFromJson(args.optional(0)));
        int policyAt = 1;
        if (mode == Mode.SELECT) {
            env.bins(Conversions.binNamesFromJson(args.required(1, "bin names")));
            policyAt = 2;
        }
        args.expectAtMost(policyAt + 1, name);
        env.policy(PolicyParser.batchPolicyFromJson(args.optional(policyAt), defaults.batch()));
    }

    @Override
    public void execute(StoreHandle store, Envelope env) {
        BatchPolicy policy = env.policy(BatchPolicy.class);
        switch (mode) {
            case GET -> env.batch(store.batchGet(policy, env.keys(), null));
            case SELECT -> env.batch(store.batchGet(policy, env.keys(), env.bins()));
            case EXISTS -> env.batch(store.batchExists(policy, env.keys()));
        }
    }

    @Override
    public JsonNode[] respond(Envelope env) {
        JsonNode results = env.ok()
                ? Conversions.batchToJson(env.batch(), mode != Mode.EXISTS)
                : Conversions.nil();
        return new JsonNode[]{Conversions.errorToJson(env.error()), results};
    }
}
