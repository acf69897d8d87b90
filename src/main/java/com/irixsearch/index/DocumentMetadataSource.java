package com.irixsearch.index;

import com.irixsearch.config.Constants;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 文档元数据来源：在类 JSON 文本中按出现顺序提取 URL 字段值。
 *
 * 不做完整 JSON 解析，只扫描 {@code "url_norm"} 键后的第一个字符串值，因此对截断或不规范的文本同样有效。
 * 第 i 个值对应 docId = i。
 */
public final class DocumentMetadataSource {
    private DocumentMetadataSource() {
    }

    /**
     * 读取元数据文件并提取全部 URL。
     *
     * @param path 元数据文件
     * @return 按出现顺序排列的 URL
     * @throws IndexBuildException 文件无法读取时抛出
     */
    public static List<String> readUrls(Path path) throws IndexBuildException {
        String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException exception) {
            throw new IndexBuildException("无法打开元数据文件 (cannot open JSON): " + path, exception);
        }
        return extractUrls(text, Constants.METADATA_URL_KEY);
    }

    /**
     * 扫描文本中指定键的字符串值。
     *
     * @param text 元数据文本
     * @param key 字段名（不含引号）
     * @return 解码后的字段值
     */
    public static List<String> extractUrls(String text, String key) {
        List<String> values = new ArrayList<>();
        String needle = "\"" + key + "\"";
        int position = 0;
        while (true) {
            int keyIndex = text.indexOf(needle, position);
            if (keyIndex < 0) {
                break;
            }
            int colonIndex = text.indexOf(':', keyIndex + needle.length());
            if (colonIndex < 0) {
                break;
            }
            int quoteIndex = text.indexOf('"', colonIndex + 1);
            if (quoteIndex < 0) {
                break;
            }

            StringBuilder value = new StringBuilder(128);
            int index = quoteIndex + 1;
            while (index < text.length()) {
                char current = text.charAt(index);
                if (current == '\\' && index + 1 < text.length()) {
                    char escaped = unescape(text.charAt(index + 1));
                    if (escaped != 0) {
                        value.append(escaped);
                        index += 2;
                        continue;
                    }
                    value.append(current);
                    index++;
                    continue;
                }
                if (current == '"') {
                    break;
                }
                value.append(current);
                index++;
            }
            values.add(value.toString());
            position = index + 1;
        }
        return values;
    }

    /**
     * 支持的转义：\" \\ \/ \n \t \r，其余返回 0 表示保留反斜杠。
     */
    private static char unescape(char escaped) {
        return switch (escaped) {
            case '"', '\\', '/' -> escaped;
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> '\0';
        };
    }
}
