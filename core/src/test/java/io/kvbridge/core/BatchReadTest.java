// file: src/test/java/io/kvbridge/core/BatchReadTest.java
package io.kvbridge.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchReadTest {

    @Test
    void failed_entries_carry_no_record() {
        var key = Key.of("test", "s", 1L);
        var failed = BatchRead.failed(key, ErrorCode.RECORD_NOT_FOUND);
        assertNull(failed.record());
        assertEquals(ErrorCode.RECORD_NOT_FOUND, failed.status());

        var found = BatchRead.found(key, StoreRecord.of(Map.of("a", Value.of(1L))));
        assertEquals(ErrorCode.OK, found.status());
        assertEquals(Value.of(1L), found.record().bin("a"));
    }
}
