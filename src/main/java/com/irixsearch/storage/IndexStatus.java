package com.irixsearch.storage;

/**
 * 索引文件统计信息，用于 status 命令输出。
 */
public record IndexStatus(
    String file,
    int version,
    int documentCount,
    long totalTokens,
    int uniqueTerms,
    int dictionaryEntries,
    int postingsCount,
    double averageTermLength,
    double buildMillis
) {
    public static IndexStatus of(String file, int version, InvertedIndex index) {
        IndexMetadata metadata = index.metadata();
        return new IndexStatus(
            file,
            version,
            metadata.documentCount(),
            metadata.totalTokens(),
            metadata.uniqueTerms(),
            index.terms().size(),
            index.postingsSize(),
            metadata.averageTermLength(),
            metadata.buildMillis()
        );
    }
}
