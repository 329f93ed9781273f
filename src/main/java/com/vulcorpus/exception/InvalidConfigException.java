package com.vulcorpus.exception;

/**
 * 配置缺失或互相矛盾（输入模式、切分比例、增强范围等）
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public class InvalidConfigException extends CorpusException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
