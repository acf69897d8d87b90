package com.irixsearch.query;

import com.irixsearch.text.TermNormalizer;

import java.util.ArrayList;
import java.util.List;

public class QueryLexer {
    /**
     * 将一行查询切分为 token：( ) ! &amp; &amp;&amp; | || 与词项，词项按 ASCII 小写归一化。
     */
    public List<LexToken> tokenize(String query) {
        List<LexToken> tokens = new ArrayList<>();
        if (query == null) {
            return tokens;
        }

        int index = 0;
        while (index < query.length()) {
            char currentChar = query.charAt(index);
            if (TermNormalizer.isSpace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '(') {
                tokens.add(new LexToken(TokenType.LPAREN, "(", index));
                index++;
                continue;
            }
            if (currentChar == ')') {
                tokens.add(new LexToken(TokenType.RPAREN, ")", index));
                index++;
                continue;
            }
            if (currentChar == '!') {
                tokens.add(new LexToken(TokenType.NOT, "!", index));
                index++;
                continue;
            }
            if (currentChar == '&' || currentChar == '|') {
                TokenType type = currentChar == '&' ? TokenType.AND : TokenType.OR;
                int width = index + 1 < query.length() && query.charAt(index + 1) == currentChar ? 2 : 1;
                tokens.add(new LexToken(type, query.substring(index, index + width), index));
                index += width;
                continue;
            }

            int tokenStart = index;
            while (index < query.length() && isTermChar(query.charAt(index))) {
                index++;
            }
            String value = TermNormalizer.toLowerAscii(query.substring(tokenStart, index));
            tokens.add(new LexToken(TokenType.TERM, value, tokenStart));
        }
        return tokens;
    }

    /**
     * 判断 token 列表中是否含有词项。
     */
    static boolean containsTerm(List<LexToken> tokens) {
        for (LexToken token : tokens) {
            if (token.type() == TokenType.TERM) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTermChar(char current) {
        if (TermNormalizer.isSpace(current)) {
            return false;
        }
        return current != '&' && current != '|' && current != '!' && current != '(' && current != ')';
    }
}
