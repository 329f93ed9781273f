package com.vulcorpus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 已物化的切分：index 从 0 开始连续分配，顺序即文件中的行序
 * 下游按 index 反查 cwe_id，因此 index 必须在所有过滤之后最后分配
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
public record IndexedPool(String name, List<IndexedRow> rows) {

    public IndexedPool {
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static IndexedPool of(RowPool pool) {
        List<IndexedRow> indexed = new ArrayList<>(pool.size());
        for (CorpusRow row : pool.rows()) {
            indexed.add(new IndexedRow(indexed.size(), row));
        }
        return new IndexedPool(pool.name(), indexed);
    }

    public int size() {
        return rows.size();
    }

    public List<CorpusRow> corpusRows() {
        return rows.stream().map(IndexedRow::row).collect(Collectors.toList());
    }

    public Map<Integer, Long> labelDistribution() {
        return RowPool.labelDistribution(corpusRows());
    }
}
