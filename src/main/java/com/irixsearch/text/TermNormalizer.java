package com.irixsearch.text;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 词项归一化与字节序比较。
 *
 * 构建与查询两端共用同一套规则：仅折叠 ASCII 大写字母，其余字符原样保留；
 * 词典顺序按 UTF-8 字节的无符号字典序定义。
 */
public final class TermNormalizer {
    private TermNormalizer() {
    }

    /**
     * 将 ASCII 大写字母转为小写，非 ASCII 字符保持不变。
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        char[] chars = null;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                if (chars == null) {
                    chars = text.toCharArray();
                }
                chars[index] = (char) (current - 'A' + 'a');
            }
        }
        return chars == null ? text : new String(chars);
    }

    /**
     * 空白字符集合：空格、\t、\r、\n、\f、\v。
     */
    public static boolean isSpace(char current) {
        return current == ' ' || current == '\t' || current == '\r'
            || current == '\n' || current == '\f' || current == '\u000B';
    }

    public static byte[] utf8(String term) {
        return term.getBytes(StandardCharsets.UTF_8);
    }

    public static int compareBytes(byte[] left, byte[] right) {
        return Arrays.compareUnsigned(left, right);
    }
}
