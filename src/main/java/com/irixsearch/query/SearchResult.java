package com.irixsearch.query;

import java.util.Arrays;

/**
 * 单条查询的执行结果。
 *
 * @param query 原始查询行
 * @param docIds 升序命中 docId，失败时为空数组
 * @param elapsedNanos 解析与求值耗时
 * @param error 失败原因，成功时为 null
 */
public record SearchResult(
        String query,
        int[] docIds,
        long elapsedNanos,
        String error
) {
    public SearchResult {
        docIds = docIds == null ? new int[0] : docIds;
    }

    public static SearchResult success(String query, int[] docIds, long elapsedNanos) {
        return new SearchResult(query, docIds, elapsedNanos, null);
    }

    public static SearchResult failure(String query, String error, long elapsedNanos) {
        return new SearchResult(query, new int[0], elapsedNanos, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int totalMatches() {
        return docIds.length;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    @Override
    public int[] docIds() {
        return Arrays.copyOf(docIds, docIds.length);
    }
}
