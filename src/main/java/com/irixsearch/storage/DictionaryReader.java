package com.irixsearch.storage;

import com.irixsearch.text.TermNormalizer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 词典段读取器，全量加载词条并以二分查找提供精确查询。
 *
 * 查找依赖词典有序，加载方需在使用前调用 {@link #verifySorted()}。
 */
public final class DictionaryReader {
    private final List<TermEntry> entries;
    private final byte[][] termKeys;

    /**
     * 解析词典段。
     *
     * @param input 词典段输入
     * @throws CorruptIndexException 段内容不完整或字段非法时抛出
     */
    public DictionaryReader(IndexInput input) throws CorruptIndexException {
        int termCount = input.readCount("termCount");
        List<TermEntry> loaded = new ArrayList<>(Math.min(termCount, 1 << 20));
        List<byte[]> keys = new ArrayList<>(Math.min(termCount, 1 << 20));
        for (int index = 0; index < termCount; index++) {
            int termLength = input.readUnsignedShort();
            byte[] termBytes = input.readBytes(termLength);
            int docFreq = input.readCount("docFreq");
            long postingsOffset = input.readLong();
            if (postingsOffset < 0) {
                throw new CorruptIndexException("词典 postingsOffset 非法: index=" + index
                    + ", offset=" + Long.toUnsignedString(postingsOffset));
            }
            loaded.add(new TermEntry(new String(termBytes, StandardCharsets.UTF_8), docFreq, postingsOffset));
            keys.add(termBytes);
        }
        this.entries = Collections.unmodifiableList(loaded);
        this.termKeys = keys.toArray(new byte[0][]);
    }

    /**
     * 校验词典按字节序非递减排列，这是二分查找成立的前提。
     *
     * @throws CorruptIndexException 存在逆序相邻词条时抛出
     */
    public void verifySorted() throws CorruptIndexException {
        for (int index = 1; index < termKeys.length; index++) {
            if (TermNormalizer.compareBytes(termKeys[index - 1], termKeys[index]) > 0) {
                throw new CorruptIndexException("词典未按词项排序 (dictionary not sorted): index=" + index
                    + ", previous=" + entries.get(index - 1).term() + ", current=" + entries.get(index).term());
            }
        }
    }

    /**
     * 精确查找已归一化的词项。
     *
     * @param term 词项
     * @return 命中的词条或空
     */
    public Optional<TermEntry> lookup(String term) {
        if (term == null || termKeys.length == 0) {
            return Optional.empty();
        }
        byte[] key = TermNormalizer.utf8(term);
        int low = 0;
        int high = termKeys.length;
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (TermNormalizer.compareBytes(termKeys[middle], key) < 0) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        if (low < termKeys.length && TermNormalizer.compareBytes(termKeys[low], key) == 0) {
            return Optional.of(entries.get(low));
        }
        return Optional.empty();
    }

    public int getTermCount() {
        return entries.size();
    }

    /**
     * 返回全部词条（按文件顺序）。
     *
     * @return 不可修改词条列表
     */
    public List<TermEntry> entries() {
        return entries;
    }
}
