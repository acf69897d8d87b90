package com.irixsearch.storage;

/**
 * 索引文件中的段类型及其在段表中的数值标签。
 */
public enum SectionType {
    DICTIONARY(1, "DICT"),
    POSTINGS(2, "POSTINGS"),
    FORWARD(3, "FORWARD"),
    METADATA(4, "META");

    private final int tag;
    private final String label;

    SectionType(int tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public int tag() {
        return tag;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label + "(type=" + tag + ")";
    }
}
