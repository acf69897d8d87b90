package com.irixsearch.storage;

import java.util.List;
import java.util.Optional;

/**
 * 加载完成的只读索引：词典、倒排数组与正排表。
 *
 * 加载后不再修改，可被多个查询线程并发读取。
 */
public final class InvertedIndex {
    private static final int[] EMPTY = new int[0];

    private final IndexMetadata metadata;
    private final DictionaryReader dictionary;
    private final PostingsReader postings;
    private final List<DocInfo> documents;

    InvertedIndex(IndexMetadata metadata, DictionaryReader dictionary, PostingsReader postings, List<DocInfo> documents) {
        this.metadata = metadata;
        this.dictionary = dictionary;
        this.postings = postings;
        this.documents = documents;
    }

    /**
     * 返回已归一化词项的倒排列表，词项不存在时返回空数组。
     *
     * @param term 已归一化词项
     * @return 严格递增的 docId 数组（调用方独占）
     */
    public int[] postings(String term) {
        Optional<TermEntry> entry = dictionary.lookup(term);
        if (entry.isEmpty()) {
            return EMPTY.clone();
        }
        return postings.readPostingList(entry.get());
    }

    public Optional<TermEntry> lookup(String term) {
        return dictionary.lookup(term);
    }

    public int documentCount() {
        return metadata.documentCount();
    }

    /**
     * 按 docId 获取文档信息。
     *
     * @param docId 文档ID
     * @return 文档信息，越界时为空
     */
    public Optional<DocInfo> document(int docId) {
        if (docId < 0 || docId >= documents.size()) {
            return Optional.empty();
        }
        return Optional.of(documents.get(docId));
    }

    public IndexMetadata metadata() {
        return metadata;
    }

    public List<TermEntry> terms() {
        return dictionary.entries();
    }

    public List<DocInfo> documents() {
        return documents;
    }

    public int postingsSize() {
        return postings.size();
    }
}
