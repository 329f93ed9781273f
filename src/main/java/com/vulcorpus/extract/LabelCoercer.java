package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * 标签归一：布尔、等于 0/1 的数值、"0"/"1"/"true"/"false"（忽略大小写）
 * 其他任何值都视为无法解析，返回 null，由调用方决定跳过
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public final class LabelCoercer {

    private LabelCoercer() {
    }

    public static Integer coerce(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isNumber()) {
            return fromNumber(node.decimalValue());
        }
        if (node.isTextual()) {
            return coerce(node.textValue());
        }
        return null;
    }

    public static Integer coerce(String text) {
        if (text == null) {
            return null;
        }
        String token = text.strip().toLowerCase(Locale.ROOT);
        switch (token) {
            case "1":
            case "true":
                return 1;
            case "0":
            case "false":
                return 0;
            default:
                return null;
        }
    }

    /**
     * 表格读取时的宽松解析：额外接受等于 0/1 的数值字符串，例如 "1.0"
     */
    public static Integer coerceLenient(String text) {
        Integer label = coerce(text);
        if (label != null || text == null || text.isBlank()) {
            return label;
        }
        try {
            return fromNumber(new BigDecimal(text.strip()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer fromNumber(BigDecimal value) {
        if (value.compareTo(BigDecimal.ZERO) == 0) {
            return 0;
        }
        if (value.compareTo(BigDecimal.ONE) == 0) {
            return 1;
        }
        return null;
    }
}
