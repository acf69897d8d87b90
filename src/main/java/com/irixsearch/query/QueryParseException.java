package com.irixsearch.query;

/**
 * 单条查询的语法或求值错误，只影响当前查询。
 */
public class QueryParseException extends RuntimeException {
    private final int position;

    /**
     * @param message 错误信息
     * @param position 出错 token 在查询行中的字符位置，未知时为 -1
     */
    public QueryParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
