package com.vulcorpus.exception;

import java.nio.file.Path;

/**
 * 必需的输入文件不存在
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public class MissingInputException extends CorpusException {

    private final Path path;

    public MissingInputException(String role, Path path) {
        super(path == null
                ? String.format("%s 输入文件未配置", role)
                : String.format("%s 输入文件不存在: %s", role, path));
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
