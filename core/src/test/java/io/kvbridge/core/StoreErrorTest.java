// file: src/test/java/io/kvbridge/core/StoreErrorTest.java
package io.kvbridge.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreErrorTest {

    @Test
    void records_the_raising_source_location() {
        StoreError err = StoreError.of(ErrorCode.PARAM, "bad key");
        assertEquals("StoreErrorTest.java", err.file());
        assertTrue(err.line() > 0);
        assertFalse(err.isOk());
    }

    @Test
    void long_messages_are_truncated() {
        StoreError err = StoreError.of(ErrorCode.SERVER, "x".repeat(5000));
        assertEquals(StoreError.MESSAGE_MAX_LENGTH, err.message().length());
    }

    @Test
    void ok_is_code_zero() {
        assertTrue(StoreError.ok().isOk());
        assertEquals(0, StoreError.ok().code().code());
    }

    @Test
    void unknown_codes_map_to_server() {
        assertEquals(ErrorCode.RECORD_NOT_FOUND, ErrorCode.fromCode(2));
        assertEquals(ErrorCode.PARAM, ErrorCode.fromCode(-2));
        assertEquals(ErrorCode.SERVER, ErrorCode.fromCode(12345));
    }
}
