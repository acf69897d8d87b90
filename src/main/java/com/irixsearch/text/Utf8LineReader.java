package com.irixsearch.text;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 按行读取 UTF-8 字节流。
 *
 * 只以 \n 作为行结束符，行尾紧邻 \n 的单个 \r 被去掉，行内的 \r 保留（按空白处理）。
 * 每行独立严格解码，非法 UTF-8 的行标记为无效，由调用方决定跳过或报错。
 */
public final class Utf8LineReader implements AutoCloseable {
    private final InputStream input;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    private final ByteArrayOutputStream lineBytes = new ByteArrayOutputStream(256);
    private long lineNumber;

    public Utf8LineReader(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("输入流不能为空");
        }
        this.input = input instanceof BufferedInputStream ? input : new BufferedInputStream(input);
    }

    /**
     * 读取下一行。
     *
     * @return 下一行，输入结束时为 null
     * @throws IOException 读取失败时抛出
     */
    public Line readLine() throws IOException {
        lineBytes.reset();
        int current = input.read();
        if (current < 0) {
            return null;
        }
        while (current >= 0 && current != '\n') {
            lineBytes.write(current);
            current = input.read();
        }
        lineNumber++;

        byte[] bytes = lineBytes.toByteArray();
        int length = bytes.length;
        if (current == '\n' && length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        ByteBuffer content = ByteBuffer.wrap(bytes, 0, length);
        try {
            return new Line(lineNumber, decoder.decode(content).toString(), true);
        } catch (CharacterCodingException exception) {
            return new Line(lineNumber, new String(bytes, 0, length, StandardCharsets.UTF_8), false);
        }
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    /**
     * 一行输入。
     *
     * @param number 行号，从 1 开始
     * @param text 行内容；无效行为替换非法字节后的文本，仅用于诊断
     * @param validUtf8 是否为合法 UTF-8
     */
    public record Line(long number, String text, boolean validUtf8) {
    }
}
