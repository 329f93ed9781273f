package com.vulcorpus.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 合并、过滤、规范化并分配 index 之后的最终切分
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public final class MaterializedSplits {

    private final IndexedPool train;
    private final IndexedPool val;
    private final IndexedPool test;

    public MaterializedSplits(IndexedPool train, IndexedPool val, IndexedPool test) {
        this.train = train;
        this.val = val;
        this.test = test;
    }

    public IndexedPool train() {
        return train;
    }

    public Optional<IndexedPool> val() {
        return Optional.ofNullable(val);
    }

    public Optional<IndexedPool> test() {
        return Optional.ofNullable(test);
    }

    /**
     * 按 train, val, test 顺序返回所有存在的切分
     */
    public List<IndexedPool> all() {
        List<IndexedPool> pools = new ArrayList<>();
        pools.add(train);
        val().ifPresent(pools::add);
        test().ifPresent(pools::add);
        return pools;
    }
}
