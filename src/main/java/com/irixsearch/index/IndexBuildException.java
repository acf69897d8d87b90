package com.irixsearch.index;

import java.io.IOException;

/**
 * 构建阶段不可恢复的错误：输入无法读取、无有效 token、词项超长等。
 */
public class IndexBuildException extends IOException {
    public IndexBuildException(String message) {
        super(message);
    }

    public IndexBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
