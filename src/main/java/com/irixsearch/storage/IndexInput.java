package com.irixsearch.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;

/**
 * 小端序索引输入，封装文件中某一字节区间，越界读取视为文件截断。
 */
public final class IndexInput {
    private final ByteBuffer buffer;
    private final String regionName;

    private IndexInput(ByteBuffer buffer, String regionName) {
        this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
        this.regionName = regionName;
    }

    /**
     * 将文件中的指定区间整体读入内存。
     *
     * @param channel 源文件通道
     * @param offset 区间起始偏移
     * @param length 区间字节数
     * @param regionName 区间名称（用于错误消息）
     * @return 覆盖该区间的输入
     * @throws IOException 区间越界、过大或读取失败时抛出
     */
    public static IndexInput readRegion(FileChannel channel, long offset, long length, String regionName) throws IOException {
        if (offset < 0 || length < 0) {
            throw new CorruptIndexException(regionName + " 区间非法: offset=" + offset + ", size=" + length);
        }
        if (length > Integer.MAX_VALUE) {
            throw new CorruptIndexException(regionName + " 区间过大: size=" + length);
        }
        long fileSize = channel.size();
        if (offset > fileSize || length > fileSize - offset) {
            throw new CorruptIndexException(regionName + " 超出文件末尾 (truncated): offset=" + offset
                + ", size=" + length + ", fileSize=" + fileSize);
        }
        ByteBuffer region = ByteBuffer.allocate((int) length);
        long position = offset;
        while (region.hasRemaining()) {
            int read = channel.read(region, position);
            if (read < 0) {
                throw new CorruptIndexException(regionName + " 读取时遇到 EOF (truncated): offset=" + position);
            }
            position += read;
        }
        region.flip();
        return new IndexInput(region, regionName);
    }

    /**
     * 包装内存中的字节数组。
     */
    public static IndexInput wrap(byte[] bytes, String regionName) {
        return new IndexInput(ByteBuffer.wrap(bytes), regionName);
    }

    public int readUnsignedShort() throws CorruptIndexException {
        require(Short.BYTES);
        return Short.toUnsignedInt(buffer.getShort());
    }

    public int readInt() throws CorruptIndexException {
        require(Integer.BYTES);
        return buffer.getInt();
    }

    public long readLong() throws CorruptIndexException {
        require(Long.BYTES);
        return buffer.getLong();
    }

    public double readDouble() throws CorruptIndexException {
        require(Double.BYTES);
        return buffer.getDouble();
    }

    /**
     * 读取 u32 计数或长度，超过 int 可表示范围视为损坏。
     *
     * @param what 字段描述（用于错误消息）
     */
    public int readCount(String what) throws CorruptIndexException {
        int value = readInt();
        if (value < 0) {
            throw new CorruptIndexException(regionName + " " + what + " 超出支持范围: " + Integer.toUnsignedString(value));
        }
        return value;
    }

    public byte[] readBytes(int length) throws CorruptIndexException {
        require(length);
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    /**
     * 批量读取 int 数组。
     */
    public int[] readInts(int count) throws CorruptIndexException {
        if (count < 0 || (long) count * Integer.BYTES > buffer.remaining()) {
            throw truncated();
        }
        int[] values = new int[count];
        buffer.asIntBuffer().get(values);
        buffer.position(buffer.position() + count * Integer.BYTES);
        return values;
    }

    public int remaining() {
        return buffer.remaining();
    }

    public int position() {
        return buffer.position();
    }

    private void require(int bytes) throws CorruptIndexException {
        if (bytes < 0 || buffer.remaining() < bytes) {
            throw truncated();
        }
    }

    private CorruptIndexException truncated() {
        return new CorruptIndexException(regionName + " 数据不完整 (truncated): position=" + buffer.position()
            + ", remaining=" + buffer.remaining());
    }
}
