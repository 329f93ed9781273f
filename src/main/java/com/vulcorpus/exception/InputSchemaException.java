package com.vulcorpus.exception;

/**
 * 输入表缺少必需的列，或 CSV 没有表头
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public class InputSchemaException extends CorpusException {

    public InputSchemaException(String message) {
        super(message);
    }

    public InputSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
