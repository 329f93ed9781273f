package com.vulcorpus.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 读取得到的任意列 CSV 表，单元格缺失时 Map 中没有该键
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record CsvTable(List<String> columns, List<Map<String, String>> rows) {

    public CsvTable {
        columns = Collections.unmodifiableList(new ArrayList<>(columns));
        rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }
}
