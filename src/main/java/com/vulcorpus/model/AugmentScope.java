package com.vulcorpus.model;

/**
 * 合成数据允许进入的切分范围
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public enum AugmentScope {
    /**
     * 只增强 train，val / test 保持为真实数据（默认，无泄漏）
     */
    TRAIN_ONLY("train_only"),
    /**
     * 所有存在的切分都加入合成数据，评估集会受合成分布影响，需显式开启
     */
    ALL("all");

    private final String value;

    AugmentScope(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
