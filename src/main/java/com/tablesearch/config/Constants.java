package com.tablesearch.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、文件命名、倒排记录布局和读取并发参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 词典文件魔数 "TSDI" */
    public static final int DICT_MAGIC = 0x54534449;
    /** 词项偏移目录文件魔数 "TSPD" */
    public static final int DIRECTORY_MAGIC = 0x54535044;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 倒排索引文件 ====================
    /** 倒排数据文件名 */
    public static final String POSTINGS_FILE = "postings.bin";
    /** 词项偏移目录文件名 */
    public static final String DIRECTORY_FILE = "postings.dir";
    /** 词典与频次文件名 */
    public static final String DICTIONARY_FILE = "terms.dict";
    /** 索引元数据文件名 */
    public static final String INDEX_META_FILE = "index.meta.json";
    /** 单条倒排记录字节数：termId、docId、freq 三个 int32 */
    public static final int POSTING_RECORD_BYTES = 3 * Integer.BYTES;

    // ==================== 行存储文件 ====================
    /** 行数据文件名 */
    public static final String ROWS_FILE = "rows.bin";
    /** 行偏移索引文件后缀 */
    public static final String ROW_INDEX_SUFFIX = ".idx";
    /** 行 schema 文件后缀 */
    public static final String ROW_SCHEMA_SUFFIX = ".schema.json";
    /** 变长列长度前缀字节数 */
    public static final int LENGTH_PREFIX_BYTES = Integer.BYTES;

    // ==================== 表索引 ====================
    /** 表级元数据文件名 */
    public static final String TABLE_META_FILE = "table.meta.json";
    /** 列倒排索引目录前缀 */
    public static final String COLUMN_INDEX_PREFIX = "inv_index_";

    // ==================== 线程与进程参数 ====================
    /** 默认并行读取线程数 */
    public static final int DEFAULT_READ_THREADS = 4;
    /** 并行读取线程数上限 */
    public static final int MAX_READ_THREADS = 64;
    /** 默认并行读取子进程数 */
    public static final int DEFAULT_READ_PROCESSES = 2;
    /** 并行读取子进程数上限 */
    public static final int MAX_READ_PROCESSES = 16;
    /** 查询文本最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
}
