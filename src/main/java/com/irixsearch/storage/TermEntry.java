package com.irixsearch.storage;

/**
 * 词典词条，记录词项、文档频次以及其倒排列表在倒排段中的字节偏移。
 */
public record TermEntry(String term, int docFreq, long postingsOffset) {
}
