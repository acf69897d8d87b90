package com.irixsearch.index;

import com.irixsearch.config.Constants;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 从文档 URL 推导可读标题。
 */
public final class UrlTitles {
    private static final String WIKI_PATH = "/wiki/";

    private UrlTitles() {
    }

    /**
     * 取 URL 尾部路径段作为标题：优先取 /wiki/ 之后的部分，否则取最后一个 / 之后的部分；
     * 下划线替换为空格后做百分号解码。
     *
     * @param url 规范化 URL
     * @return 标题，可能为空串
     */
    public static String titleFromUrl(String url) {
        if (url == null) {
            return "";
        }
        String tail = url;
        int wikiIndex = url.indexOf(WIKI_PATH);
        if (wikiIndex >= 0) {
            tail = url.substring(wikiIndex + WIKI_PATH.length());
        } else {
            int slashIndex = url.lastIndexOf('/');
            if (slashIndex >= 0 && slashIndex + 1 < url.length()) {
                tail = url.substring(slashIndex + 1);
            }
        }
        return percentDecode(tail.replace('_', ' '));
    }

    /**
     * 文档标题：URL 推导出的标题为空时使用占位标题。
     */
    public static String titleFor(int docId, String url) {
        String title = titleFromUrl(url);
        return title.isEmpty() ? placeholder(docId) : title;
    }

    public static String placeholder(int docId) {
        return Constants.PLACEHOLDER_TITLE_PREFIX + docId;
    }

    /**
     * 百分号解码：合法的 %XX 解为字节，+ 解为空格，非法转义原样保留，结果按 UTF-8 解释。
     */
    public static String percentDecode(String text) {
        ByteArrayOutputStream decoded = new ByteArrayOutputStream(text.length());
        int index = 0;
        while (index < text.length()) {
            char current = text.charAt(index);
            if (current == '%' && index + 2 < text.length()) {
                int high = hexValue(text.charAt(index + 1));
                int low = hexValue(text.charAt(index + 2));
                if (high >= 0 && low >= 0) {
                    decoded.write((high << 4) | low);
                    index += 3;
                    continue;
                }
            }
            if (current == '+') {
                decoded.write(' ');
                index++;
                continue;
            }
            int end = index + 1;
            if (Character.isHighSurrogate(current) && end < text.length()) {
                end++;
            }
            byte[] bytes = text.substring(index, end).getBytes(StandardCharsets.UTF_8);
            decoded.write(bytes, 0, bytes.length);
            index = end;
        }
        return decoded.toString(StandardCharsets.UTF_8);
    }

    private static int hexValue(char current) {
        if (current >= '0' && current <= '9') {
            return current - '0';
        }
        if (current >= 'a' && current <= 'f') {
            return 10 + current - 'a';
        }
        if (current >= 'A' && current <= 'F') {
            return 10 + current - 'A';
        }
        return -1;
    }
}
