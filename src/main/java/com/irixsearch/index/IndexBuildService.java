package com.irixsearch.index;

import com.irixsearch.config.Constants;
import com.irixsearch.storage.IndexData;
import com.irixsearch.storage.IndexFileWriter;
import com.irixsearch.text.Utf8LineReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 构建流程编排：读取 token 流与可选元数据，构建并写出索引文件。
 */
public final class IndexBuildService {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuildService.class);

    /**
     * 执行一次完整构建。
     *
     * @param tokensFile token 流文件
     * @param outputFile 输出索引文件
     * @param metadataFile 文档元数据文件，可为 null
     * @return 构建摘要
     * @throws IOException 任一输入无法读取、输出无法写入或构建条件不满足时抛出
     */
    public BuildSummary build(Path tokensFile, Path outputFile, Path metadataFile) throws IOException {
        IndexBuilder builder = new IndexBuilder();
        try (Utf8LineReader reader = openTokens(tokensFile)) {
            builder.readTokens(reader);
        }

        List<String> urls = List.of();
        if (metadataFile != null) {
            urls = DocumentMetadataSource.readUrls(metadataFile);
            if (urls.isEmpty()) {
                logger.warn("元数据中未找到 {} 字段，将使用占位标题: {}", Constants.METADATA_URL_KEY, metadataFile);
            }
        }

        IndexData data = builder.build(urls);
        long fileBytes;
        try {
            fileBytes = IndexFileWriter.write(outputFile, data);
        } catch (IllegalArgumentException exception) {
            throw new IndexBuildException("索引内容无法序列化: " + exception.getMessage(), exception);
        } catch (IOException exception) {
            throw new IndexBuildException("无法写出索引文件 (cannot open output file): " + outputFile, exception);
        }
        return new BuildSummary(outputFile, data.metadata(), fileBytes);
    }

    private Utf8LineReader openTokens(Path tokensFile) throws IndexBuildException {
        try {
            return new Utf8LineReader(Files.newInputStream(tokensFile));
        } catch (IOException exception) {
            throw new IndexBuildException("无法打开 token 文件 (cannot open tokens file): " + tokensFile, exception);
        }
    }
}
