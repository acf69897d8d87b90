package com.irixsearch.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 正排段写入器：文档数后跟每个文档的 u32 长度前缀 URL 与标题。
 */
public final class ForwardTableWriter {
    private ForwardTableWriter() {
    }

    /**
     * 写出完整正排段。
     *
     * @param output 索引输出
     * @param documents 按 docId 排列的文档信息
     * @throws IOException 写入失败时抛出
     */
    public static void write(IndexOutput output, List<DocInfo> documents) throws IOException {
        output.writeInt(documents.size());
        for (DocInfo document : documents) {
            writeString(output, document.url());
            writeString(output, document.title());
        }
    }

    private static void writeString(IndexOutput output, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        output.writeInt(bytes.length);
        output.writeBytes(bytes);
    }
}
