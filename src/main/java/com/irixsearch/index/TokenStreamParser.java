package com.irixsearch.index;

import com.irixsearch.text.TermNormalizer;

import java.util.Optional;

/**
 * 解析 token 流行格式 {@code <docId><空白><token>}。
 *
 * 空行与格式错误的行返回空，由调用方静默跳过；token 之后的内容被忽略。
 */
public final class TokenStreamParser {
    private static final long MAX_DOC_ID = 0xFFFF_FFFFL;

    private TokenStreamParser() {
    }

    /**
     * 解析一行 token 流。
     *
     * @param line 原始行
     * @return 解析结果，行无效时为空
     */
    public static Optional<TokenRecord> parseLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int index = skipSpaces(line, 0);
        if (index >= line.length()) {
            return Optional.empty();
        }

        long docId = 0;
        int digitsStart = index;
        while (index < line.length() && isAsciiDigit(line.charAt(index))) {
            docId = docId * 10 + (line.charAt(index) - '0');
            if (docId > MAX_DOC_ID) {
                return Optional.empty();
            }
            index++;
        }
        if (index == digitsStart) {
            return Optional.empty();
        }

        if (index >= line.length() || !TermNormalizer.isSpace(line.charAt(index))) {
            return Optional.empty();
        }
        index = skipSpaces(line, index);
        if (index >= line.length()) {
            return Optional.empty();
        }

        int tokenStart = index;
        while (index < line.length() && !TermNormalizer.isSpace(line.charAt(index))) {
            index++;
        }
        return Optional.of(new TokenRecord(docId, line.substring(tokenStart, index)));
    }

    private static boolean isAsciiDigit(char current) {
        return current >= '0' && current <= '9';
    }

    private static int skipSpaces(String line, int from) {
        int index = from;
        while (index < line.length() && TermNormalizer.isSpace(line.charAt(index))) {
            index++;
        }
        return index;
    }
}
