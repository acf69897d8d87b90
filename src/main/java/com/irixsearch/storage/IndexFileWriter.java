package com.irixsearch.storage;

import com.irixsearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 索引文件写入器。
 *
 * 文件布局：文件头（magic、版本、段数、段表偏移）之后依次为 META、DICT、POSTINGS、FORWARD 段，
 * 末尾为段表；段数与段表偏移在写完段表后回填到文件头。
 */
public final class IndexFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(IndexFileWriter.class);

    private static final long SECTION_COUNT_POSITION = Constants.INDEX_MAGIC.length + Integer.BYTES;
    private static final long SECTION_TABLE_OFFSET_POSITION = SECTION_COUNT_POSITION + Integer.BYTES;

    private IndexFileWriter() {
    }

    /**
     * 写出索引文件。
     *
     * @param path 目标文件
     * @param data 索引内容
     * @return 写出的文件字节数
     * @throws IOException 打开或写入失败时抛出
     */
    public static long write(Path path, IndexData data) throws IOException {
        try (IndexOutput output = new IndexOutput(path)) {
            output.writeBytes(Constants.INDEX_MAGIC);
            output.writeInt(Constants.FORMAT_VERSION);
            output.writeInt(0);
            output.writeLong(0L);

            SectionTable sectionTable = new SectionTable();

            long start = output.position();
            data.metadata().writeTo(output);
            sectionTable.add(section(SectionType.METADATA, start, output));

            start = output.position();
            try (DictionaryWriter dictionaryWriter = new DictionaryWriter(output)) {
                for (TermEntry entry : data.dictionary()) {
                    dictionaryWriter.writeTermEntry(entry.term(), entry.docFreq(), entry.postingsOffset());
                }
            }
            sectionTable.add(section(SectionType.DICTIONARY, start, output));

            start = output.position();
            writePostings(output, data);
            sectionTable.add(section(SectionType.POSTINGS, start, output));

            start = output.position();
            ForwardTableWriter.write(output, data.documents());
            sectionTable.add(section(SectionType.FORWARD, start, output));

            long sectionTableOffset = output.position();
            sectionTable.writeTo(output);
            output.patchInt(SECTION_COUNT_POSITION, sectionTable.size());
            output.patchLong(SECTION_TABLE_OFFSET_POSITION, sectionTableOffset);

            long fileSize = output.position();
            logger.debug("索引文件写出完成: file={}, bytes={}, sections={}", path, fileSize, sectionTable.size());
            return fileSize;
        }
    }

    /**
     * 按词典顺序写出各词项的倒排切片，并核对词条记录的偏移。
     */
    private static void writePostings(IndexOutput output, IndexData data) throws IOException {
        PostingsWriter postingsWriter = new PostingsWriter(output);
        int[] postings = data.postings();
        for (TermEntry entry : data.dictionary()) {
            int from = (int) (entry.postingsOffset() / Integer.BYTES);
            long written = postingsWriter.writePostingList(postings, from, entry.docFreq());
            if (written != entry.postingsOffset()) {
                throw new IllegalStateException("词条倒排偏移与写入位置不一致: term=" + entry.term()
                    + ", expected=" + entry.postingsOffset() + ", actual=" + written);
            }
        }
        if (postingsWriter.bytesWritten() != (long) postings.length * Integer.BYTES) {
            throw new IllegalStateException("倒排数组存在未被词典引用的数据: written=" + postingsWriter.bytesWritten()
                + ", total=" + (long) postings.length * Integer.BYTES);
        }
    }

    private static SectionInfo section(SectionType type, long start, IndexOutput output) {
        return new SectionInfo(type.tag(), 0, start, output.position() - start);
    }
}
