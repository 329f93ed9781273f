package com.vulcorpus.service;

import com.vulcorpus.extract.CodeText;
import com.vulcorpus.extract.CweFormatter;
import com.vulcorpus.extract.LabelCoercer;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.CsvTable;
import com.vulcorpus.model.RowPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 把任意表规整为十个规范列：固定顺序、固定类型、缺失列填默认值
 * 只处理列，不增删、不重排行；对已规范化的数据再次处理结果不变
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class SchemaNormalizer {

    public RowPool normalize(String name, CsvTable table) {
        List<String> missing = CorpusColumn.names().stream()
                .filter(column -> !table.hasColumn(column))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.info("表 {} 缺少列 {}，使用默认值填充", name, missing);
        }
        List<CorpusRow> rows = table.rows().stream()
                .map(this::normalizeRow)
                .collect(Collectors.toList());
        return new RowPool(name, rows);
    }

    public RowPool normalize(RowPool pool) {
        List<CorpusRow> rows = pool.rows().stream()
                .map(this::normalize)
                .collect(Collectors.toList());
        return new RowPool(pool.name(), rows);
    }

    public CorpusRow normalize(CorpusRow row) {
        return normalizeRow(row.toMap());
    }

    /**
     * 多余的列（包括旧的 index 列）直接忽略
     */
    public CorpusRow normalizeRow(Map<String, String> cells) {
        return new CorpusRow(
                CodeText.clean(cells.get(CorpusColumn.PROCESSED_FUNC.columnName())),
                normalizeTarget(cells.get(CorpusColumn.TARGET.columnName())),
                orDefault(CodeText.clean(cells.get(CorpusColumn.VUL_FUNC_WITH_FIX.columnName())), CorpusColumn.VUL_FUNC_WITH_FIX),
                identifier(cells, CorpusColumn.CVE_ID),
                CweFormatter.format(cells.get(CorpusColumn.CWE_ID.columnName())),
                identifier(cells, CorpusColumn.COMMIT_ID),
                identifier(cells, CorpusColumn.FILE_PATH),
                identifier(cells, CorpusColumn.FILE_LANGUAGE),
                identifier(cells, CorpusColumn.FLAW_LINE_INDEX),
                flawLine(cells.get(CorpusColumn.FLAW_LINE.columnName())));
    }

    /**
     * 无法解析为 0/1 的标签按 0 处理
     */
    static int normalizeTarget(String value) {
        Integer label = LabelCoercer.coerceLenient(value);
        return label == null ? 0 : label;
    }

    private static String identifier(Map<String, String> cells, CorpusColumn column) {
        String value = cells.get(column.columnName());
        return orDefault(value == null ? "" : value.strip(), column);
    }

    private static String orDefault(String value, CorpusColumn column) {
        return value.isEmpty() ? column.defaultValue() : value;
    }

    private static String flawLine(String value) {
        return value == null ? CorpusColumn.FLAW_LINE.defaultValue() : value;
    }
}
