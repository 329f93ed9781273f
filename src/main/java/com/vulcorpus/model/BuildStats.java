package com.vulcorpus.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次运行、单个输入文件的计数累加器
 * 由调用方创建并显式传入 RowBuilder，不存在进程级共享状态
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public class BuildStats {

    private final EnumMap<BuildCounter, Long> counters = new EnumMap<>(BuildCounter.class);

    /**
     * 剩余可输出 DEBUG 明细的跳过条数
     */
    private int debugBudget;

    public BuildStats() {
        this(0);
    }

    public BuildStats(int debugSamples) {
        for (BuildCounter counter : BuildCounter.values()) {
            counters.put(counter, 0L);
        }
        this.debugBudget = Math.max(0, debugSamples);
    }

    public void increment(BuildCounter counter) {
        counters.merge(counter, 1L, Long::sum);
    }

    public long get(BuildCounter counter) {
        return counters.get(counter);
    }

    public long skipped() {
        return counters.entrySet().stream()
                .filter(e -> e.getKey().key().startsWith("skip_"))
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    /**
     * 消耗一个 DEBUG 明细名额，没有名额时返回 false
     */
    public boolean takeDebugSlot() {
        if (debugBudget <= 0) {
            return false;
        }
        debugBudget--;
        return true;
    }

    /**
     * 按计数器声明顺序输出 key -> 值
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        counters.forEach((counter, value) -> snapshot.put(counter.key(), value));
        return snapshot;
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
