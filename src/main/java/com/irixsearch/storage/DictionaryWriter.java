package com.irixsearch.storage;

import com.irixsearch.config.Constants;
import com.irixsearch.text.TermNormalizer;

import java.io.IOException;

/**
 * 词典段写入器，按严格递增的字节序写入词条，关闭时回填词条数。
 */
public final class DictionaryWriter implements AutoCloseable {
    private final IndexOutput output;
    private final long termCountPosition;
    private int termCount;
    private byte[] lastTermBytes;
    private boolean closed;

    /**
     * 在当前位置开始词典段并写入词条数占位。
     *
     * @param output 索引输出
     * @throws IOException 写入失败时抛出
     */
    public DictionaryWriter(IndexOutput output) throws IOException {
        if (output == null) {
            throw new IllegalArgumentException("索引输出不能为空");
        }
        this.output = output;
        this.termCountPosition = output.position();
        this.output.writeInt(0);
    }

    /**
     * 写入一个词条，要求 term 按字节序严格递增。
     *
     * @param term 词项
     * @param docFreq 文档频次
     * @param postingsOffset 倒排段内字节偏移
     * @throws IOException 写入失败时抛出
     */
    public void writeTermEntry(String term, int docFreq, long postingsOffset) throws IOException {
        ensureOpen();
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term 不能为空");
        }
        if (docFreq < 0) {
            throw new IllegalArgumentException("docFreq 不能为负数: " + docFreq);
        }
        if (postingsOffset < 0 || postingsOffset % Integer.BYTES != 0) {
            throw new IllegalArgumentException("postingsOffset 非法: " + postingsOffset);
        }
        byte[] termBytes = TermNormalizer.utf8(term);
        if (termBytes.length > Constants.MAX_TERM_BYTES) {
            throw new IllegalArgumentException("词项过长 (>" + Constants.MAX_TERM_BYTES + " bytes): " + termBytes.length);
        }
        if (lastTermBytes != null && TermNormalizer.compareBytes(termBytes, lastTermBytes) <= 0) {
            throw new IllegalArgumentException("term 必须严格递增，current=" + term);
        }

        output.writeShort(termBytes.length);
        output.writeBytes(termBytes);
        output.writeInt(docFreq);
        output.writeLong(postingsOffset);

        termCount++;
        lastTermBytes = termBytes;
    }

    public int getTermCount() {
        return termCount;
    }

    /**
     * 回填 termCount，不关闭底层输出。
     *
     * @throws IOException 回填失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        output.patchInt(termCountPosition, termCount);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("DictionaryWriter 已关闭");
        }
    }
}
