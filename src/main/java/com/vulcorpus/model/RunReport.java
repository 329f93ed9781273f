package com.vulcorpus.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次流水线运行的汇总：输入计数、跳过原因、合成池统计、每个输出切分的标签分布
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@Data
public class RunReport {

    private InputMode mode;

    /**
     * 输入名称（train / val / test / all）-> 构建计数
     */
    private Map<String, Map<String, Long>> builderCounters = new LinkedHashMap<>();

    /**
     * 未配置合成数据时为 null
     */
    private SyntheticStats synthetic;

    private List<PoolSummary> outputs = new ArrayList<>();

    public void addBuilderCounters(String input, BuildStats stats) {
        builderCounters.put(input, stats.snapshot());
    }

    public void addOutput(PoolSummary summary) {
        outputs.add(summary);
    }
}
