// file: src/test/java/io/kvbridge/client/dispatch/EnvelopeTest.java
package io.kvbridge.client.dispatch;

import io.kvbridge.client.command.CommandRegistry;
import io.kvbridge.core.ErrorCode;
import io.kvbridge.core.Key;
import io.kvbridge.core.StoreError;
import io.kvbridge.storage.MemoryStore;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle guards: first failure wins, the callback is handed out once, and
 * a released envelope cannot be used again.
 */
class EnvelopeTest {

    private final MemoryStore store = new MemoryStore();

    private Envelope envelope() {
        return new Envelope(1, CommandRegistry.GET, store, argv -> { });
    }

    @Test
    void first_failure_wins_but_override_replaces() {
        Envelope env = envelope();
        assertTrue(env.ok());
        env.fail(ErrorCode.PARAM, "first");
        env.fail(ErrorCode.TIMEOUT, "second");
        assertEquals(ErrorCode.PARAM, env.error().code());
        assertEquals("first", env.error().message());

        env.overrideError(StoreError.of(ErrorCode.CLIENT, "override"));
        assertEquals(ErrorCode.CLIENT, env.error().code());
        assertThrows(IllegalArgumentException.class, () -> env.fail(StoreError.ok()));
    }

    @Test
    void callback_can_be_taken_exactly_once() {
        Envelope env = envelope();
        assertNotNull(env.takeCallback());
        assertThrows(IllegalStateException.class, env::takeCallback);
    }

    @Test
    void release_clears_slots_and_is_single_shot() {
        Envelope env = envelope();
        env.key(Key.of("test", "s", 1L));
        env.markExecuted();
        assertEquals(Envelope.State.EXECUTED, env.state());

        env.release();
        assertEquals(Envelope.State.RELEASED, env.state());
        assertNull(env.key());
        assertThrows(IllegalStateException.class, env::release);
        assertThrows(IllegalStateException.class, env::takeCallback);
        assertThrows(IllegalStateException.class, env::store);
    }

    @Test
    void missing_key_reads_as_null() {
        assertNull(envelope().key());
    }
}
