// file: src/main/java/io/kvbridge/client/command/CommandRegistry.java
package io.kvbridge.client.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.kvbridge.client.convert.Conversions;
import io.kvbridge.client.convert.ParameterException;
import io.kvbridge.client.dispatch.Envelope;
import io.kvbridge.core.policy.Policies;
import io.kvbridge.storage.StoreHandle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name -> command lookup for the positional entry point.
 * Unknown names resolve to a command whose prepare always fails, so the
 * caller still gets exactly one asynchronous callback carrying PARAM.
 */
public final class CommandRegistry {

    public static final Command GET = new GetCommand();
    public static final Command SELECT = new SelectCommand();
    public static final Command EXISTS = new ExistsCommand();
    public static final Command PUT = new PutCommand();
    public static final Command REMOVE = new RemoveCommand();
    public static final Command OPERATE = new OperateCommand();
    public static final Command BATCH_GET = new BatchCommand("batchGet", BatchCommand.Mode.GET);
    public static final Command BATCH_EXISTS = new BatchCommand("batchExists", BatchCommand.Mode.EXISTS);
    public static final Command BATCH_SELECT = new BatchCommand("batchSelect", BatchCommand.Mode.SELECT);

    private static final Map<String, Command> BY_NAME = new LinkedHashMap<>();

    static {
        for (Command c : new Command[]{
                GET, SELECT, EXISTS, PUT, REMOVE, OPERATE, BATCH_GET, BATCH_EXISTS, BATCH_SELECT}) {
            BY_NAME.put(c.name(), c);
        }
    }

    private CommandRegistry() {
    }

    /** Never null; unknown names get a command that reports PARAM. */
    public static Command lookup(String name) {
        Command c = BY_NAME.get(name);
        return c != null ? c : new Unknown(String.valueOf(name));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(BY_NAME.keySet());
    }

    private static final class Unknown implements Command {
        private final String name;

        Unknown(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int arity() {
            return 1;
        }

        @Override
        public void prepare(Arguments args, Envelope env, Policies defaults) throws ParameterException {
            throw new ParameterException("unknown command '" + name + "'");
        }

        @Override
        public void execute(StoreHandle store, Envelope env) {
            throw new IllegalStateException("unknown command '" + name + "' reached execute");
        }

        @Override
        public JsonNode[] respond(Envelope env) {
            return new JsonNode[]{Conversions.errorToJson(env.error())};
        }
    }
}
