package com.irixsearch.storage;

import java.util.List;

/**
 * 待写出的完整索引内容。
 *
 * @param metadata 元数据段
 * @param dictionary 按字节序排列的词条
 * @param postings 所有词项倒排列表按词典顺序拼接后的 docId 数组
 * @param documents 按 docId 排列的正排表
 */
public record IndexData(
    IndexMetadata metadata,
    List<TermEntry> dictionary,
    int[] postings,
    List<DocInfo> documents
) {
    public IndexData {
        if (metadata == null || dictionary == null || postings == null || documents == null) {
            throw new IllegalArgumentException("索引内容各部分均不能为null");
        }
        if (documents.size() != metadata.documentCount()) {
            throw new IllegalArgumentException("正排表长度与文档数不一致: " + documents.size()
                + " vs " + metadata.documentCount());
        }
        dictionary = List.copyOf(dictionary);
        documents = List.copyOf(documents);
    }
}
