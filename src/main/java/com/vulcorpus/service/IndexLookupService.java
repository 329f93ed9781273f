package com.vulcorpus.service;

import com.vulcorpus.exception.InputSchemaException;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CsvTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 按 index 反查已物化切分中的行
 * 测试日志里记录的是 0 基行号，依赖的正是输出文件中稳定的 index 列
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@Service
@Slf4j
public class IndexLookupService {

    private final CorpusCsvReader csvReader;

    public IndexLookupService(CorpusCsvReader csvReader) {
        this.csvReader = csvReader;
    }

    /**
     * 解析 "[2, 67, 71]" 或 "2,67,71"，去重并升序
     */
    public static List<Integer> parseIndices(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String body = text.strip();
        if (body.startsWith("[") || body.startsWith("(")) {
            body = body.substring(1);
        }
        if (body.endsWith("]") || body.endsWith(")")) {
            body = body.substring(0, body.length() - 1);
        }
        Set<Integer> indices = new TreeSet<>();
        for (String part : body.split(",")) {
            String token = part.strip();
            if (token.isEmpty()) {
                continue;
            }
            try {
                indices.add(Integer.parseInt(token));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("无效的 index: " + token, e);
            }
        }
        return new ArrayList<>(indices);
    }

    /**
     * index -> cwe_id，找不到的 index 不出现在结果中
     */
    public Map<Integer, String> cweByIndex(Path csv, Collection<Integer> indices) {
        Map<Integer, String> result = new TreeMap<>();
        selectRows(csv, indices, List.of(CorpusColumn.CWE_ID.columnName()), null, null)
                .forEach((index, row) -> result.put(index, row.get(CorpusColumn.CWE_ID.columnName())));
        return result;
    }

    /**
     * @param indices      null 表示全部行
     * @param columns      为空时返回全部列
     * @param filterColumn 可选，与 filterValue 一起做子串过滤，例如 cwe_id 包含 CWE-362
     * @return index -> (列名 -> 值)，按 index 升序
     */
    public Map<Integer, Map<String, String>> selectRows(Path csv, Collection<Integer> indices, List<String> columns,
                                                        String filterColumn, String filterValue) {
        CsvTable table = csvReader.read(csv, "切分 CSV");
        List<String> selected = columns == null || columns.isEmpty() ? table.columns() : columns;
        List<String> missing = selected.stream()
                .filter(column -> !table.hasColumn(column))
                .collect(Collectors.toCollection(ArrayList::new));
        if (filterColumn != null && !table.hasColumn(filterColumn)) {
            missing.add(filterColumn);
        }
        if (!missing.isEmpty()) {
            throw new InputSchemaException("请求的列在表头中不存在: " + missing);
        }

        Set<Integer> wanted = indices == null ? null : new TreeSet<>(indices);
        boolean hasIndexColumn = table.hasColumn(CorpusColumn.INDEX);
        Map<Integer, Map<String, String>> result = new TreeMap<>();
        for (int position = 0; position < table.size(); position++) {
            Map<String, String> row = table.rows().get(position);
            int index = hasIndexColumn ? indexOf(row, position, csv) : position;
            if (wanted != null && !wanted.contains(index)) {
                continue;
            }
            if (filterColumn != null && filterValue != null) {
                String cell = row.getOrDefault(filterColumn, "");
                if (cell == null || !cell.contains(filterValue)) {
                    continue;
                }
            }
            Map<String, String> projected = new LinkedHashMap<>();
            for (String column : selected) {
                projected.put(column, row.getOrDefault(column, ""));
            }
            result.put(index, projected);
        }
        log.debug("按 index 查询 {}: 命中 {} 行", csv, result.size());
        return result;
    }

    /**
     * 读取一行的 index 单元格，缺失或不是整数时报告所在的数据行（从 1 开始，不含表头）
     */
    private static int indexOf(Map<String, String> row, int position, Path csv) {
        String cell = row.get(CorpusColumn.INDEX);
        if (cell == null || cell.isBlank()) {
            throw new InputSchemaException(String.format("%s 第 %d 行缺少 index", csv, position + 1));
        }
        try {
            return Integer.parseInt(cell.strip());
        } catch (NumberFormatException e) {
            throw new InputSchemaException(String.format("%s 第 %d 行 index 不是整数: %s", csv, position + 1, cell), e);
        }
    }
}
