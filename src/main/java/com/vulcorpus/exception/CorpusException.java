package com.vulcorpus.exception;

/**
 * 语料构建过程中的致命错误基类
 * 行级问题（解析失败、缺少代码、标签无法解析）不会抛出此异常，只计数跳过
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public class CorpusException extends RuntimeException {

    public CorpusException(String message) {
        super(message);
    }

    public CorpusException(String message, Throwable cause) {
        super(message, cause);
    }
}
