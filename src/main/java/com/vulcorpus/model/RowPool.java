package com.vulcorpus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 有序、不可变的语料行集合（一个切分，或一份未切分语料）
 * 每个阶段都返回新的 RowPool，不修改输入
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record RowPool(String name, List<CorpusRow> rows) {

    public RowPool {
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static RowPool empty(String name) {
        return new RowPool(name, List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * 追加另一个 pool 的全部行，保持两者原有顺序
     */
    public RowPool concat(String newName, RowPool other) {
        List<CorpusRow> merged = new ArrayList<>(rows.size() + other.size());
        merged.addAll(rows);
        merged.addAll(other.rows());
        return new RowPool(newName, merged);
    }

    /**
     * 标签分布：target -> 行数
     */
    public Map<Integer, Long> labelDistribution() {
        return labelDistribution(rows);
    }

    static Map<Integer, Long> labelDistribution(List<CorpusRow> rows) {
        return rows.stream()
                .collect(Collectors.groupingBy(CorpusRow::target, TreeMap::new, Collectors.counting()));
    }
}
