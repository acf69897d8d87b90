package com.irixsearch.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 小端序索引输出，带写缓冲与位置跟踪，支持对已写区域回填。
 */
public final class IndexOutput implements AutoCloseable {
    private static final int BUFFER_BYTES = 64 * 1024;

    private final FileChannel channel;
    private final String fileName;
    private final ByteBuffer buffer = ByteBuffer.allocate(BUFFER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    private long flushedBytes;
    private boolean closed;

    /**
     * 创建输出文件，已存在时截断。
     *
     * @param path 目标文件
     * @throws IOException 无法打开文件时抛出
     */
    public IndexOutput(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("输出文件不能为空");
        }
        this.channel = FileChannel.open(path,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        this.fileName = String.valueOf(path.getFileName());
    }

    /**
     * 当前逻辑写入位置（含缓冲中尚未落盘的字节）。
     */
    public long position() {
        return flushedBytes + buffer.position();
    }

    public void writeShort(int value) throws IOException {
        ensureCapacity(Short.BYTES);
        buffer.putShort((short) value);
    }

    public void writeInt(int value) throws IOException {
        ensureCapacity(Integer.BYTES);
        buffer.putInt(value);
    }

    public void writeLong(long value) throws IOException {
        ensureCapacity(Long.BYTES);
        buffer.putLong(value);
    }

    public void writeDouble(double value) throws IOException {
        ensureCapacity(Double.BYTES);
        buffer.putDouble(value);
    }

    /**
     * 写入原始字节，超过缓冲区容量时直接写通道。
     */
    public void writeBytes(byte[] bytes) throws IOException {
        ensureOpen();
        if (bytes.length <= buffer.remaining()) {
            buffer.put(bytes);
            return;
        }
        flush();
        if (bytes.length <= buffer.capacity()) {
            buffer.put(bytes);
            return;
        }
        ByteBuffer direct = ByteBuffer.wrap(bytes);
        while (direct.hasRemaining()) {
            flushedBytes += channel.write(direct);
        }
    }

    /**
     * 写入 int 数组的一个区间。
     */
    public void writeInts(int[] values, int from, int length) throws IOException {
        for (int index = from; index < from + length; index++) {
            writeInt(values[index]);
        }
    }

    /**
     * 回填已写出位置上的 int 值，不改变当前写入位置。
     */
    public void patchInt(long position, int value) throws IOException {
        ByteBuffer patch = ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(value);
        patch(position, patch);
    }

    /**
     * 回填已写出位置上的 long 值，不改变当前写入位置。
     */
    public void patchLong(long position, long value) throws IOException {
        ByteBuffer patch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value);
        patch(position, patch);
    }

    /**
     * 将缓冲数据写入通道。
     */
    public void flush() throws IOException {
        ensureOpen();
        buffer.flip();
        while (buffer.hasRemaining()) {
            flushedBytes += channel.write(buffer);
        }
        buffer.clear();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            flush();
            channel.force(false);
        } catch (IOException exception) {
            throw new IOException("关闭索引输出失败: file=" + fileName + ", bytes=" + position(), exception);
        } finally {
            channel.close();
            closed = true;
        }
    }

    private void patch(long position, ByteBuffer patch) throws IOException {
        if (position < 0 || position + patch.capacity() > position()) {
            throw new IllegalArgumentException("回填位置越界: position=" + position + ", written=" + position());
        }
        flush();
        patch.flip();
        long target = position;
        while (patch.hasRemaining()) {
            target += channel.write(patch, target);
        }
    }

    private void ensureCapacity(int bytes) throws IOException {
        ensureOpen();
        if (buffer.remaining() < bytes) {
            flush();
        }
    }

    /**
     * 校验输出状态，防止关闭后继续写入。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexOutput 已关闭");
        }
    }
}
