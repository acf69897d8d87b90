package com.irixsearch.query;

/**
 * 查询词法单元。
 *
 * @param type 类型
 * @param value TERM 的归一化文本，运算符为其符号
 * @param position 在查询行中的字符位置
 */
public record LexToken(TokenType type, String value, int position) {

    boolean isOperandLike() {
        return type == TokenType.TERM || type == TokenType.RPAREN;
    }
}

enum TokenType {
    TERM,
    AND,
    OR,
    NOT,
    LPAREN,
    RPAREN
}
