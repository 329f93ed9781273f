package com.vulcorpus.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * 一个输出切分的行数和标签分布
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record PoolSummary(String name, int rows, Map<Integer, Long> labelDistribution, Path file) {

    public static PoolSummary of(IndexedPool pool, Path file) {
        return new PoolSummary(pool.name(), pool.size(), pool.labelDistribution(), file);
    }
}
