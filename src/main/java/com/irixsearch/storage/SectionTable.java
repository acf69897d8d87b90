package com.irixsearch.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 段表，按写入顺序保存各段位置并支持按类型查找。
 */
public final class SectionTable {
    private final List<SectionInfo> sections = new ArrayList<>();

    /**
     * 追加一个段条目。
     */
    public void add(SectionInfo section) {
        sections.add(section);
    }

    /**
     * 查找指定类型的段，存在多个时取第一个。
     *
     * @param type 段类型
     * @return 段条目
     * @throws CorruptIndexException 段不存在时抛出
     */
    public SectionInfo require(SectionType type) throws CorruptIndexException {
        for (SectionInfo section : sections) {
            if (section.tag() == type.tag()) {
                return section;
            }
        }
        throw new CorruptIndexException("缺少必需段 (section not found): " + type);
    }

    public int size() {
        return sections.size();
    }

    /**
     * 顺序写出全部段条目。
     */
    void writeTo(IndexOutput output) throws IOException {
        for (SectionInfo section : sections) {
            output.writeInt(section.tag());
            output.writeInt(section.flags());
            output.writeLong(section.offset());
            output.writeLong(section.size());
        }
    }

    /**
     * 从段表区域读取指定数量的段条目。
     */
    static SectionTable readFrom(IndexInput input, int sectionCount) throws CorruptIndexException {
        SectionTable table = new SectionTable();
        for (int index = 0; index < sectionCount; index++) {
            int tag = input.readInt();
            int flags = input.readInt();
            long offset = input.readLong();
            long size = input.readLong();
            if (offset < 0 || size < 0) {
                throw new CorruptIndexException("段表条目非法: index=" + index + ", offset=" + offset + ", size=" + size);
            }
            table.add(new SectionInfo(tag, flags, offset, size));
        }
        return table;
    }
}
