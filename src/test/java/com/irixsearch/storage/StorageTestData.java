package com.irixsearch.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.List;

/**
 * 存储层测试共用的样例索引与小端序补丁工具。
 *
 * 样例布局：header[0,20) META[20,52) DICT[52,108) POSTINGS[108,124) FORWARD[124,182) 段表[182,278)。
 */
final class StorageTestData {
    static final long DICT_OFFSET = 52;
    static final long POSTINGS_OFFSET = 108;
    static final long FORWARD_OFFSET = 124;
    static final long SECTION_TABLE_OFFSET = 182;
    static final long FILE_SIZE = 278;

    private StorageTestData() {
    }

    /**
     * 三个文档：0={cat,dog} 1={dog} 2={bird}。
     */
    static IndexData sampleIndex() {
        IndexMetadata metadata = new IndexMetadata(3, 4, 3, 3.25, 1.5);
        List<TermEntry> dictionary = List.of(
            new TermEntry("bird", 1, 0),
            new TermEntry("cat", 1, 4),
            new TermEntry("dog", 2, 8));
        int[] postings = {2, 0, 0, 1};
        List<DocInfo> documents = List.of(
            new DocInfo("", "Document 0"),
            new DocInfo("", "Document 1"),
            new DocInfo("", "Document 2"));
        return new IndexData(metadata, dictionary, postings, documents);
    }

    static long sectionEntryOffset(int index) {
        return SECTION_TABLE_OFFSET + 24L * index;
    }

    static void patchInt(Path file, long position, int value) throws IOException {
        patch(file, position, ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
    }

    static void patchLong(Path file, long position, long value) throws IOException {
        patch(file, position, ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array());
    }

    static void patch(Path file, long position, byte[] bytes) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.seek(position);
            randomAccessFile.write(bytes);
        }
    }
}
