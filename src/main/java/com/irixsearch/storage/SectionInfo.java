package com.irixsearch.storage;

/**
 * 段表条目，记录段类型标签、标志位以及段在文件中的字节区间。
 */
public record SectionInfo(int tag, int flags, long offset, long size) {
}
