package com.irixsearch.index;

/**
 * token 流中的一行：文档ID与原始 token 文本。
 *
 * @param docId 无符号 32 位范围内的文档ID
 * @param token 未归一化的 token
 */
public record TokenRecord(long docId, String token) {
}
