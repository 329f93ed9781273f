package com.vulcorpus.model;

import lombok.Data;

/**
 * 合成样本池在加载、去重、去重叠各步骤的行数变化
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
@Data
public class SyntheticStats {

    /**
     * 两个合成表读到的总行数
     */
    private int rowsRead;

    /**
     * is_complete 质量过滤丢弃的行数
     */
    private int droppedIncomplete;

    /**
     * 清洗后代码为空而丢弃的行数
     */
    private int droppedEmptyCode;

    private int dedupDropped;

    private int overlapDropped;

    /**
     * 最终参与合并的行数
     */
    private int used;
}
