package com.irixsearch.storage;

import com.irixsearch.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

/**
 * 索引文件加载器，一次性读取并校验全部段。
 *
 * 任何结构错误都以 {@link CorruptIndexException} 终止加载，不存在部分可用的索引。
 */
public final class IndexLoader {
    private static final Logger logger = LoggerFactory.getLogger(IndexLoader.class);

    private IndexLoader() {
    }

    /**
     * 加载并校验索引文件。
     *
     * @param path 索引文件
     * @return 只读索引
     * @throws IOException 文件无法打开或结构非法时抛出
     */
    public static InvertedIndex load(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        long startNanos = System.nanoTime();
        try (FileChannel channel = open(path)) {
            IndexInput header = IndexInput.readRegion(channel, 0L, Math.min(Constants.HEADER_BYTES, channel.size()), "header");
            byte[] magic = header.readBytes(Constants.INDEX_MAGIC.length);
            if (!Arrays.equals(magic, Constants.INDEX_MAGIC)) {
                throw new CorruptIndexException("索引文件 magic 不匹配 (bad magic)，期望 "
                    + new String(Constants.INDEX_MAGIC, StandardCharsets.US_ASCII) + ": " + path);
            }
            int version = header.readInt();
            if (version != Constants.FORMAT_VERSION) {
                throw new CorruptIndexException("索引文件版本不支持 (unsupported version): "
                    + Integer.toUnsignedString(version) + ", 期望 " + Constants.FORMAT_VERSION);
            }
            int sectionCount = header.readCount("sectionCount");
            long sectionTableOffset = header.readLong();

            IndexInput tableInput = IndexInput.readRegion(channel, sectionTableOffset,
                (long) sectionCount * Constants.SECTION_ENTRY_BYTES, "section table");
            SectionTable sectionTable = SectionTable.readFrom(tableInput, sectionCount);

            SectionInfo metaSection = sectionTable.require(SectionType.METADATA);
            SectionInfo dictionarySection = sectionTable.require(SectionType.DICTIONARY);
            SectionInfo postingsSection = sectionTable.require(SectionType.POSTINGS);
            SectionInfo forwardSection = sectionTable.require(SectionType.FORWARD);

            IndexMetadata metadata = IndexMetadata.readFrom(region(channel, metaSection, SectionType.METADATA));
            DictionaryReader dictionary = new DictionaryReader(region(channel, dictionarySection, SectionType.DICTIONARY));
            PostingsReader postings = new PostingsReader(region(channel, postingsSection, SectionType.POSTINGS));
            List<DocInfo> documents = ForwardTableReader.read(
                region(channel, forwardSection, SectionType.FORWARD), metadata.documentCount());

            dictionary.verifySorted();
            for (TermEntry entry : dictionary.entries()) {
                postings.validate(entry, metadata.documentCount());
            }

            logger.debug("索引加载完成: file={}, docs={}, terms={}, postings={}, elapsedMs={}",
                path, metadata.documentCount(), dictionary.getTermCount(), postings.size(),
                (System.nanoTime() - startNanos) / 1_000_000);
            return new InvertedIndex(metadata, dictionary, postings, documents);
        }
    }

    private static FileChannel open(Path path) throws IOException {
        try {
            return FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException exception) {
            throw new IOException("无法打开索引文件 (cannot open index): " + path, exception);
        }
    }

    private static IndexInput region(FileChannel channel, SectionInfo section, SectionType type) throws IOException {
        return IndexInput.readRegion(channel, section.offset(), section.size(), type.label());
    }
}
