package com.irixsearch.report;

/**
 * 慢查询统计条目。
 *
 * @param millis 查询耗时（毫秒）
 * @param lineNumber 查询在输入中的行号，从 1 开始
 * @param hits 命中数，失败查询为 0
 * @param query 原始查询行
 */
public record SlowQuery(double millis, long lineNumber, int hits, String query) {
}
