package com.vulcorpus.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 规范语料表的列定义，枚举顺序即输出顺序
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public enum CorpusColumn {
    PROCESSED_FUNC("processed_func", ""),
    TARGET("target", "0"),
    VUL_FUNC_WITH_FIX("vul_func_with_fix", CorpusColumn.SENTINEL),
    CVE_ID("cve_id", CorpusColumn.SENTINEL),
    CWE_ID("cwe_id", CorpusColumn.CWE_SENTINEL),
    COMMIT_ID("commit_id", CorpusColumn.SENTINEL),
    FILE_PATH("file_path", CorpusColumn.SENTINEL),
    FILE_LANGUAGE("file_language", "C"),
    FLAW_LINE_INDEX("flaw_line_index", "[]"),
    FLAW_LINE("flaw_line", "");

    /**
     * 字段不可用的占位值
     */
    public static final String SENTINEL = "-";

    /**
     * 列表型字段（cwe_id）不可用的占位值
     */
    public static final String CWE_SENTINEL = "['-']";

    /**
     * 物化后的行号列，只在最终输出文件中出现
     */
    public static final String INDEX = "index";

    private final String columnName;
    private final String defaultValue;

    CorpusColumn(String columnName, String defaultValue) {
        this.columnName = columnName;
        this.defaultValue = defaultValue;
    }

    public String columnName() {
        return columnName;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public static List<String> names() {
        return Arrays.stream(values())
                .map(CorpusColumn::columnName)
                .collect(Collectors.toList());
    }

    /**
     * index + 十个规范列
     */
    public static List<String> indexedNames() {
        List<String> names = new ArrayList<>();
        names.add(INDEX);
        names.addAll(names());
        return names;
    }
}
