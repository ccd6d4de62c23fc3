// file: src/test/java/io/kvbridge/core/RecordMetaTest.java
package io.kvbridge.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecordMetaTest {

    @Test
    void generation_wraps_back_to_one() {
        assertEquals(2, RecordMeta.nextGeneration(1));
        assertEquals(1, RecordMeta.nextGeneration(RecordMeta.GENERATION_MAX));
        assertEquals(1, RecordMeta.nextGeneration(RecordMeta.GENERATION_UNSET));
    }

    @Test
    void ttl_sentinels_are_accepted_and_out_of_range_rejected() {
        assertEquals(-1, new RecordMeta(0, RecordMeta.TTL_NO_CHANGE).ttl());
        assertEquals(RecordMeta.TTL_MAX, new RecordMeta(0, RecordMeta.TTL_MAX).ttl());
        assertThrows(IllegalArgumentException.class, () -> new RecordMeta(0, -2));
        assertThrows(IllegalArgumentException.class, () -> new RecordMeta(0, RecordMeta.TTL_MAX + 1));
        assertThrows(IllegalArgumentException.class, () -> new RecordMeta(0x10000, 0));
    }
}
