package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulcorpus.model.CorpusColumn;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把任意 CWE 描述归一为 ['CWE-119'] 形式的单元素列表字符串
 * 只取第一个 CWE-数字 标记，找不到时返回 ['-']
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public final class CweFormatter {

    private static final Pattern CWE_PATTERN = Pattern.compile("(CWE-\\d+)", Pattern.CASE_INSENSITIVE);

    private CweFormatter() {
    }

    public static String format(String cell) {
        if (cell == null) {
            return CorpusColumn.CWE_SENTINEL;
        }
        Matcher matcher = CWE_PATTERN.matcher(cell);
        if (!matcher.find()) {
            return CorpusColumn.CWE_SENTINEL;
        }
        return "['" + matcher.group(1).toUpperCase(Locale.ROOT) + "']";
    }

    /**
     * 字符串或字符串数组（例如 ["CWE-787", "CWE-119"]）
     */
    public static String format(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return CorpusColumn.CWE_SENTINEL;
        }
        if (node.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode item : node) {
                if (item.isValueNode()) {
                    joined.append(item.asText()).append(' ');
                }
            }
            return format(joined.toString());
        }
        return node.isValueNode() ? format(node.asText()) : CorpusColumn.CWE_SENTINEL;
    }

    public static boolean isCanonical(String cweId) {
        return cweId != null && (CorpusColumn.CWE_SENTINEL.equals(cweId) || cweId.matches("\\['CWE-\\d+']"));
    }
}
