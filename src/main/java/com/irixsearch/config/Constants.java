package com.irixsearch.config;

/**
 * 全局常量定义
 * 
 * 包含索引文件格式魔数、段类型标签、查询与报告参数默认值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 存储格式 ====================
    /** 索引文件魔数 "IRIX"，按字节顺序写入 */
    public static final byte[] INDEX_MAGIC = {'I', 'R', 'I', 'X'};
    /** 文件格式版本号 */
    public static final int FORMAT_VERSION = 1;
    /** 文件头长度：magic + version + sectionCount + sectionTableOffset */
    public static final int HEADER_BYTES = 4 + Integer.BYTES + Integer.BYTES + Long.BYTES;
    /** 段表中单个条目的长度：type + flags + offset + size */
    public static final int SECTION_ENTRY_BYTES = Integer.BYTES + Integer.BYTES + Long.BYTES + Long.BYTES;
    /** 词项字节长度上限，受 u16 长度前缀限制 */
    public static final int MAX_TERM_BYTES = 0xFFFF;
    
    // ==================== 构建参数 ====================
    /** 文档元数据中 URL 字段的键 */
    public static final String METADATA_URL_KEY = "url_norm";
    /** 缺少标题时使用的占位前缀 */
    public static final String PLACEHOLDER_TITLE_PREFIX = "Document ";
    
    // ==================== 查询参数 ====================
    /** 每条查询输出到 stdout 的结果上限，0 表示不限制 */
    public static final int DEFAULT_RESULT_LIMIT = 0;
    /** 慢查询报告默认条数 */
    public static final int DEFAULT_SLOW_QUERY_TOP = 10;
    /** 报告文件中每条查询最多列出的标题数 */
    public static final int DEFAULT_REPORT_TOP_RESULTS = 50;
}
