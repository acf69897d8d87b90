package com.irixsearch.storage;

import java.util.Arrays;

/**
 * 倒排段读取器，将整段原始字节读为 int 数组并按词条切片。
 */
public final class PostingsReader {
    private final int[] postings;

    /**
     * 读取整个倒排段。
     *
     * @param input 倒排段输入
     * @throws CorruptIndexException 段长度不是 4 的倍数时抛出
     */
    public PostingsReader(IndexInput input) throws CorruptIndexException {
        if (input.remaining() % Integer.BYTES != 0) {
            throw new CorruptIndexException("倒排段长度不是 4 的倍数 (postings size is not multiple of 4): "
                + input.remaining());
        }
        this.postings = input.readInts(input.remaining() / Integer.BYTES);
    }

    /**
     * 校验词条的倒排切片：偏移对齐、不越界、严格递增且 docId 小于文档数。
     *
     * @param entry 词条
     * @param documentCount 文档数
     * @throws CorruptIndexException 任一条件不满足时抛出
     */
    public void validate(TermEntry entry, int documentCount) throws CorruptIndexException {
        long offset = entry.postingsOffset();
        if (offset % Integer.BYTES != 0) {
            throw new CorruptIndexException("倒排偏移未按 4 字节对齐 (postings offset not aligned): term="
                + entry.term() + ", offset=" + offset);
        }
        long start = offset / Integer.BYTES;
        if (start + entry.docFreq() > postings.length) {
            throw new CorruptIndexException("倒排偏移越界 (postings offset out of range): term=" + entry.term()
                + ", offset=" + offset + ", df=" + entry.docFreq() + ", postings=" + postings.length);
        }
        int from = (int) start;
        for (int index = from; index < from + entry.docFreq(); index++) {
            int docId = postings[index];
            if (docId < 0 || docId >= documentCount) {
                throw new CorruptIndexException("倒排 docId 超出文档范围: term=" + entry.term()
                    + ", docId=" + Integer.toUnsignedString(docId) + ", documentCount=" + documentCount);
            }
            if (index > from && docId <= postings[index - 1]) {
                throw new CorruptIndexException("倒排列表未严格递增: term=" + entry.term() + ", docId=" + docId);
            }
        }
    }

    /**
     * 读取词条对应的倒排列表，调用方需先通过 {@link #validate} 校验。
     *
     * @param entry 词条
     * @return 新的 docId 数组
     */
    public int[] readPostingList(TermEntry entry) {
        int from = (int) (entry.postingsOffset() / Integer.BYTES);
        return Arrays.copyOfRange(postings, from, from + entry.docFreq());
    }

    public int size() {
        return postings.length;
    }
}
