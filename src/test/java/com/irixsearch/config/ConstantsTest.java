package com.irixsearch.config;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testFormatConstants() {
        assertArrayEquals("IRIX".getBytes(StandardCharsets.US_ASCII), Constants.INDEX_MAGIC);
        assertEquals(1, Constants.FORMAT_VERSION);
        assertEquals(20, Constants.HEADER_BYTES);
        assertEquals(24, Constants.SECTION_ENTRY_BYTES);
        assertEquals(65535, Constants.MAX_TERM_BYTES);
    }

    @Test
    void testQueryDefaults() {
        assertEquals(0, Constants.DEFAULT_RESULT_LIMIT);
        assertEquals(10, Constants.DEFAULT_SLOW_QUERY_TOP);
        assertEquals(50, Constants.DEFAULT_REPORT_TOP_RESULTS);
        assertEquals("url_norm", Constants.METADATA_URL_KEY);
    }
}
