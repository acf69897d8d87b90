package com.irixsearch.storage;

import java.io.IOException;

/**
 * 倒排段写入器，顺序写入各词项的 docId 列表，无分隔符。
 */
public final class PostingsWriter {
    private final IndexOutput output;
    private final long sectionStart;

    /**
     * 以当前输出位置作为倒排段起点。
     *
     * @param output 索引输出
     */
    public PostingsWriter(IndexOutput output) {
        if (output == null) {
            throw new IllegalArgumentException("索引输出不能为空");
        }
        this.output = output;
        this.sectionStart = output.position();
    }

    /**
     * 写入一条倒排列表并返回其在倒排段内的字节偏移。
     *
     * @param docIds docId 数组
     * @param from 列表在数组中的起始下标
     * @param length 列表长度
     * @return 段内字节偏移
     * @throws IOException 写入失败时抛出
     */
    public long writePostingList(int[] docIds, int from, int length) throws IOException {
        validateInput(docIds, from, length);
        long postingOffset = output.position() - sectionStart;
        output.writeInts(docIds, from, length);
        return postingOffset;
    }

    /**
     * 已写入倒排段的字节数。
     */
    public long bytesWritten() {
        return output.position() - sectionStart;
    }

    private void validateInput(int[] docIds, int from, int length) {
        if (docIds == null) {
            throw new IllegalArgumentException("docIds 不能为空");
        }
        if (from < 0 || length < 0 || from + length > docIds.length) {
            throw new IllegalArgumentException("倒排区间越界: from=" + from + ", length=" + length);
        }
        for (int index = from; index < from + length; index++) {
            if (docIds[index] < 0) {
                throw new IllegalArgumentException("docId不能为负数，位置=" + index + ", value=" + docIds[index]);
            }
            if (index > from && docIds[index] <= docIds[index - 1]) {
                throw new IllegalArgumentException("docIds必须严格递增，位置=" + index + ", current=" + docIds[index]);
            }
        }
    }
}
