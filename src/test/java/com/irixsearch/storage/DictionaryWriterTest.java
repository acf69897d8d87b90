package com.irixsearch.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DictionaryWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testRejectsOutOfOrderTerms() throws IOException {
        try (IndexOutput output = new IndexOutput(tempDir.resolve("dict.bin"));
             DictionaryWriter writer = new DictionaryWriter(output)) {
            writer.writeTermEntry("dog", 1, 0);
            assertThrows(IllegalArgumentException.class, () -> writer.writeTermEntry("cat", 1, 4));
            assertThrows(IllegalArgumentException.class, () -> writer.writeTermEntry("dog", 1, 4));
        }
    }

    @Test
    void testRejectsOverlongTerm() throws IOException {
        try (IndexOutput output = new IndexOutput(tempDir.resolve("dict.bin"));
             DictionaryWriter writer = new DictionaryWriter(output)) {
            String overlong = "a".repeat(65536);
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> writer.writeTermEntry(overlong, 1, 0));
            assertTrue(exception.getMessage().contains("65535"));
            writer.writeTermEntry("a".repeat(65535), 1, 0);
        }
    }

    @Test
    void testTermCountBackpatchedOnClose() throws IOException {
        Path file = tempDir.resolve("dict.bin");
        try (IndexOutput output = new IndexOutput(file)) {
            try (DictionaryWriter writer = new DictionaryWriter(output)) {
                writer.writeTermEntry("apple", 3, 0);
                writer.writeTermEntry("banana", 1, 12);
                assertEquals(2, writer.getTermCount());
            }
        }

        DictionaryReader reader = new DictionaryReader(IndexInput.wrap(Files.readAllBytes(file), "DICT"));
        reader.verifySorted();
        assertEquals(2, reader.getTermCount());
        assertEquals(new TermEntry("banana", 1, 12), reader.lookup("banana").orElseThrow());
        assertTrue(reader.lookup("cherry").isEmpty());
        assertTrue(reader.lookup("").isEmpty());
    }
}
