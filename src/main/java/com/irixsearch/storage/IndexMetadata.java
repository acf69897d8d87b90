package com.irixsearch.storage;

import java.io.IOException;

/**
 * 元数据段内容。除 documentCount 外的统计值仅供展示。
 *
 * @param documentCount 文档数，等于最大 docId + 1
 * @param totalTokens 构建时接受的 token 行数
 * @param uniqueTerms 词典词条数
 * @param averageTermLength token 平均字节长度
 * @param buildMillis 构建耗时（毫秒）
 */
public record IndexMetadata(
    int documentCount,
    long totalTokens,
    int uniqueTerms,
    double averageTermLength,
    double buildMillis
) {
    public IndexMetadata {
        if (documentCount < 0 || uniqueTerms < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("元数据计数不能为负数: docs=" + documentCount
                + ", terms=" + uniqueTerms + ", tokens=" + totalTokens);
        }
    }

    /**
     * 写出元数据段。
     *
     * @param output 索引输出
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(IndexOutput output) throws IOException {
        output.writeInt(documentCount);
        output.writeLong(totalTokens);
        output.writeInt(uniqueTerms);
        output.writeDouble(averageTermLength);
        output.writeDouble(buildMillis);
    }

    /**
     * 读取元数据段。
     *
     * @param input 元数据段输入
     * @return 元数据
     * @throws CorruptIndexException 段内容不完整或计数越界时抛出
     */
    public static IndexMetadata readFrom(IndexInput input) throws CorruptIndexException {
        int documentCount = input.readCount("documentCount");
        long totalTokens = input.readLong();
        int uniqueTerms = input.readCount("uniqueTerms");
        double averageTermLength = input.readDouble();
        double buildMillis = input.readDouble();
        if (totalTokens < 0) {
            throw new CorruptIndexException("元数据 totalTokens 非法: " + Long.toUnsignedString(totalTokens));
        }
        return new IndexMetadata(documentCount, totalTokens, uniqueTerms, averageTermLength, buildMillis);
    }
}
