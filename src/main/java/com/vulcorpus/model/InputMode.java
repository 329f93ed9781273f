package com.vulcorpus.model;

/**
 * 真实语料的来源方式
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public enum InputMode {
    /**
     * train / val / test 三个 JSONL 文件，逐个构建，不再切分
     */
    PER_SPLIT_JSONL,
    /**
     * 单个 JSONL 文件，构建后做分层切分
     */
    COMBINED_JSONL,
    /**
     * 已经转换好的规范 CSV 切分
     */
    CANONICAL_CSV
}
