package com.vulcorpus.model;

import com.vulcorpus.exception.InvalidConfigException;

/**
 * train / val / test 切分比例，三者之和必须为 1
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record SplitRatios(double train, double val, double test) {

    private static final double TOLERANCE = 1e-6;

    public static final SplitRatios DEFAULT = new SplitRatios(0.8, 0.1, 0.1);

    public SplitRatios {
        if (train < 0 || val < 0 || test < 0) {
            throw new InvalidConfigException(String.format(
                    "切分比例不能为负数: train=%s, val=%s, test=%s", train, val, test));
        }
        if (Math.abs(train + val + test - 1.0) > TOLERANCE) {
            throw new InvalidConfigException(String.format(
                    "切分比例之和必须为 1: train=%s, val=%s, test=%s", train, val, test));
        }
    }
}
