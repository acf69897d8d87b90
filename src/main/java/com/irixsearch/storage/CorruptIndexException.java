package com.irixsearch.storage;

import java.io.IOException;

/**
 * 索引文件结构损坏或不兼容时抛出，加载阶段遇到即终止。
 */
public class CorruptIndexException extends IOException {
    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
