package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * 代码文本清洗：去掉 NUL 字符、统一换行为 \n、去掉首尾空白
 * 所有代码字段和指纹计算都走同一套清洗，清洗是幂等的
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public final class CodeText {

    private CodeText() {
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text.replace("\u0000", "")
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        return cleaned.strip();
    }

    /**
     * 读取 JSON 标量的文本并清洗，对象、数组、null 视为缺失，清洗后为空也视为缺失
     */
    public static Optional<String> fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return Optional.empty();
        }
        String cleaned = clean(node.asText());
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }

    public static Optional<String> field(JsonNode parent, String fieldName) {
        if (parent == null || !parent.isObject()) {
            return Optional.empty();
        }
        return fromJson(parent.get(fieldName));
    }
}
