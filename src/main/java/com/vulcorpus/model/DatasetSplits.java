package com.vulcorpus.model;

import java.util.Optional;

/**
 * 真实语料的 train / val / test 三个切分，val 和 test 可能不存在
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
public final class DatasetSplits {

    private final RowPool train;
    private final RowPool val;
    private final RowPool test;

    public DatasetSplits(RowPool train, RowPool val, RowPool test) {
        if (train == null) {
            throw new IllegalArgumentException("train 切分不能为空");
        }
        this.train = train;
        this.val = val;
        this.test = test;
    }

    public RowPool train() {
        return train;
    }

    public Optional<RowPool> val() {
        return Optional.ofNullable(val);
    }

    public Optional<RowPool> test() {
        return Optional.ofNullable(test);
    }

    public int totalSize() {
        return train.size()
                + val().map(RowPool::size).orElse(0)
                + test().map(RowPool::size).orElse(0);
    }
}
