package com.tablesearch.rowstore;

/**
 * 行读取执行策略。各策略共用同一解码逻辑，输出完全一致，只区分由谁执行定位、读取与解码。
 */
public enum ReadStrategy {
    /** 当前线程逐行读取 */
    SEQUENTIAL,
    /** 固定线程池并行读取 */
    THREAD_POOL,
    /** 子 JVM 进程按分片并行读取 */
    PROCESS_POOL,
    /** 只读内存映射 + 线程池并行解码 */
    MEMORY_MAPPED
}
