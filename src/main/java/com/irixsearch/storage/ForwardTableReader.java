package com.irixsearch.storage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 正排段读取器。
 */
public final class ForwardTableReader {
    private ForwardTableReader() {
    }

    /**
     * 读取正排段，文档数必须与元数据段一致。
     *
     * @param input 正排段输入
     * @param expectedDocumentCount 元数据段中的文档数
     * @return 不可修改的文档信息列表
     * @throws CorruptIndexException 文档数不一致或内容不完整时抛出
     */
    public static List<DocInfo> read(IndexInput input, int expectedDocumentCount) throws CorruptIndexException {
        int documentCount = input.readCount("documentCount");
        if (documentCount != expectedDocumentCount) {
            throw new CorruptIndexException("正排表文档数与元数据不一致 (forward/meta mismatch): forward="
                + documentCount + ", meta=" + expectedDocumentCount);
        }
        // 每个文档至少占两个 u32 长度前缀
        if (documentCount > input.remaining() / (2 * Integer.BYTES)) {
            throw new CorruptIndexException("正排段数据不足以容纳声明的文档数 (truncated): documentCount="
                + documentCount + ", remaining=" + input.remaining());
        }
        List<DocInfo> documents = new ArrayList<>(documentCount);
        for (int docId = 0; docId < documentCount; docId++) {
            String url = readString(input, "urlLength");
            String title = readString(input, "titleLength");
            documents.add(new DocInfo(url, title));
        }
        return Collections.unmodifiableList(documents);
    }

    private static String readString(IndexInput input, String what) throws CorruptIndexException {
        int length = input.readCount(what);
        return new String(input.readBytes(length), StandardCharsets.UTF_8);
    }
}
