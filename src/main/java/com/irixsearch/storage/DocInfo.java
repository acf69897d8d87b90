package com.irixsearch.storage;

/**
 * 正排表条目，docId 即其在正排表中的下标。
 */
public record DocInfo(String url, String title) {
    public DocInfo {
        if (url == null || title == null) {
            throw new IllegalArgumentException("url与title不能为null");
        }
    }
}
