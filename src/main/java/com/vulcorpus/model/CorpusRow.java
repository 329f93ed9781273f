package com.vulcorpus.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规范语料行（不含 index，index 在最终物化时分配）
 *
 * @param processedFunc  漏洞/非漏洞函数代码
 * @param target         标签，0 或 1
 * @param vulFuncWithFix 修复后的代码，或占位符 "-"
 * @param cweId          形如 ['CWE-119'] 的单元素列表字符串
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record CorpusRow(
        String processedFunc,
        int target,
        String vulFuncWithFix,
        String cveId,
        String cweId,
        String commitId,
        String filePath,
        String fileLanguage,
        String flawLineIndex,
        String flawLine) {

    public boolean isVulnerable() {
        return target == 1;
    }

    public boolean hasCode() {
        return processedFunc != null && !processedFunc.isEmpty();
    }

    /**
     * 按规范列顺序输出单元格
     */
    public String[] toCells() {
        return new String[]{
                processedFunc,
                String.valueOf(target),
                vulFuncWithFix,
                cveId,
                cweId,
                commitId,
                filePath,
                fileLanguage,
                flawLineIndex,
                flawLine
        };
    }

    public Map<String, String> toMap() {
        Map<String, String> map = new LinkedHashMap<>();
        String[] cells = toCells();
        CorpusColumn[] columns = CorpusColumn.values();
        for (int i = 0; i < columns.length; i++) {
            map.put(columns[i].columnName(), cells[i]);
        }
        return map;
    }

    /**
     * 合成样本及缺省元数据的行
     */
    public static CorpusRow synthetic(String code, int target, String cweId) {
        return new CorpusRow(code, target, CorpusColumn.SENTINEL, CorpusColumn.SENTINEL, cweId,
                CorpusColumn.SENTINEL, CorpusColumn.SENTINEL, "C", "[]", "");
    }
}
