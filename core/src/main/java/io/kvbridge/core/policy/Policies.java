// file: src/main/java/io/kvbridge/core/policy/Policies.java
package io.kvbridge.core.policy;

/**
 * Default policy set for a client, one per operation family.
 * Missing families fall back to their DEFAULT.
 */
public record Policies(
        ReadPolicy read,
        WritePolicy write,
        RemovePolicy remove,
        OperatePolicy operate,
        BatchPolicy batch
) {

    public static final Policies DEFAULT = new Policies(
            ReadPolicy.DEFAULT, WritePolicy.DEFAULT, RemovePolicy.DEFAULT, OperatePolicy.DEFAULT, BatchPolicy.DEFAULT);

    public Policies {
        read = read == null ? ReadPolicy.DEFAULT : read;
        write = write == null ? WritePolicy.DEFAULT : write;
        remove = remove == null ? RemovePolicy.DEFAULT : remove;
        operate = operate == null ? OperatePolicy.DEFAULT : operate;
        batch = batch == null ? BatchPolicy.DEFAULT : batch;
    }
}
