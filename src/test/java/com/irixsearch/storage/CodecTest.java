package com.irixsearch.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CodecTest {

    @TempDir
    Path tempDir;

    @Test
    void testLittleEndianPrimitives() throws IOException {
        Path file = tempDir.resolve("primitives.bin");
        try (IndexOutput output = new IndexOutput(file)) {
            output.writeShort(0x0102);
            output.writeInt(0x03040506);
            output.writeLong(0x0708090A0B0C0D0EL);
            assertEquals(14, output.position());
        }

        byte[] expected = {0x02, 0x01, 0x06, 0x05, 0x04, 0x03, 0x0E, 0x0D, 0x0C, 0x0B, 0x0A, 0x09, 0x08, 0x07};
        assertArrayEquals(expected, Files.readAllBytes(file));
    }

    @Test
    void testPatchDoesNotMoveWritePosition() throws IOException {
        Path file = tempDir.resolve("patch.bin");
        try (IndexOutput output = new IndexOutput(file)) {
            output.writeInt(0);
            output.writeLong(0L);
            output.writeInt(42);
            output.patchInt(0, 7);
            output.patchLong(4, 9L);
            output.writeInt(43);
            assertEquals(20, output.position());
        }

        IndexInput input = IndexInput.wrap(Files.readAllBytes(file), "patch");
        assertEquals(7, input.readInt());
        assertEquals(9L, input.readLong());
        assertEquals(42, input.readInt());
        assertEquals(43, input.readInt());
        assertEquals(0, input.remaining());
    }

    @Test
    void testLargeByteArraysBypassBuffer() throws IOException {
        Path file = tempDir.resolve("large.bin");
        byte[] payload = new byte[200_000];
        for (int index = 0; index < payload.length; index++) {
            payload[index] = (byte) index;
        }
        try (IndexOutput output = new IndexOutput(file)) {
            output.writeInt(payload.length);
            output.writeBytes(payload);
            assertEquals(4L + payload.length, output.position());
        }

        IndexInput input = IndexInput.wrap(Files.readAllBytes(file), "large");
        assertEquals(payload.length, input.readCount("length"));
        assertArrayEquals(payload, input.readBytes(payload.length));
    }

    @Test
    void testUnsignedShortAndInts() throws IOException {
        Path file = tempDir.resolve("ints.bin");
        try (IndexOutput output = new IndexOutput(file)) {
            output.writeShort(65535);
            output.writeInts(new int[] {5, 6, 7, 8}, 1, 3);
            output.writeDouble(2.5);
        }

        IndexInput input = IndexInput.wrap(Files.readAllBytes(file), "ints");
        assertEquals(65535, input.readUnsignedShort());
        assertArrayEquals(new int[] {6, 7, 8}, input.readInts(3));
        assertEquals(2.5, input.readDouble());
    }

    @Test
    void testReadPastEndIsCorrupt() {
        IndexInput input = IndexInput.wrap(new byte[] {1, 2, 3}, "short");
        assertThrows(CorruptIndexException.class, input::readInt);
        assertThrows(CorruptIndexException.class, () -> input.readInts(1));
    }

    @Test
    void testNegativeCountIsCorrupt() {
        IndexInput input = IndexInput.wrap(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF}, "count");
        assertThrows(CorruptIndexException.class, () -> input.readCount("documentCount"));
    }
}
