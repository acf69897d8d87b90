package com.irixsearch.index;

import com.irixsearch.storage.IndexMetadata;

import java.nio.file.Path;

/**
 * 构建结果摘要。
 */
public record BuildSummary(Path outputFile, IndexMetadata metadata, long fileBytes) {

    /**
     * 每毫秒处理的 token 数，耗时为 0 时返回 0。
     */
    public double tokensPerMillisecond() {
        return metadata.buildMillis() > 0.0 ? metadata.totalTokens() / metadata.buildMillis() : 0.0;
    }

    public double millisecondsPerDocument() {
        return metadata.documentCount() > 0 ? metadata.buildMillis() / metadata.documentCount() : 0.0;
    }
}
