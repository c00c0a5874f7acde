package com.tablesearch.config;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstantsTest {

    @Test
    void testMagicNumbersSpellFileTags() {
        assertEquals("TSDI", new String(ByteBuffer.allocate(4).putInt(Constants.DICT_MAGIC).array(), StandardCharsets.US_ASCII));
        assertEquals("TSPD", new String(ByteBuffer.allocate(4).putInt(Constants.DIRECTORY_MAGIC).array(), StandardCharsets.US_ASCII));
    }

    @Test
    void testLimits() {
        assertEquals(3 * Integer.BYTES, Constants.POSTING_RECORD_BYTES);
        assertTrue(Constants.DEFAULT_READ_THREADS <= Constants.MAX_READ_THREADS);
        assertTrue(Constants.DEFAULT_READ_PROCESSES <= Constants.MAX_READ_PROCESSES);
    }
}
