package com.tablesearch.storage;

import java.io.IOException;

/**
 * 存储文件内容与格式约定不一致，只能重建，不能修补。
 */
public class CorruptStorageException extends IOException {

    public CorruptStorageException(String message) {
        super(message);
    }

    public CorruptStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
