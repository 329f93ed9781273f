package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * detail 中 function_before / function_after 槽位的三种形态：
 * 对象、纯字符串、缺失。单元素列表在 {@link #of(JsonNode)} 中展开为第一个元素
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public interface CodeSlot {

    CodeSlot EMPTY = new Empty();

    /**
     * 按优先级依次读取 keys，返回第一个清洗后非空的代码
     */
    Optional<String> code(List<String> keys);

    /**
     * 槽位自带的标签，只有对象形态可能有
     */
    Optional<Integer> label(String key);

    boolean isPresent();

    static CodeSlot of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        JsonNode first = node;
        if (node.isArray()) {
            if (node.isEmpty()) {
                return EMPTY;
            }
            first = node.get(0);
        }
        if (first.isObject()) {
            return new Dict(first);
        }
        if (first.isTextual()) {
            return new Text(first.textValue());
        }
        return EMPTY;
    }

    /**
     * 对象形态：{"function": ..., "code_before": ..., "target": ...}
     */
    record Dict(JsonNode node) implements CodeSlot {

        @Override
        public Optional<String> code(List<String> keys) {
            for (String key : keys) {
                Optional<String> code = CodeText.field(node, key);
                if (code.isPresent()) {
                    return code;
                }
            }
            return Optional.empty();
        }

        @Override
        public Optional<Integer> label(String key) {
            return Optional.ofNullable(LabelCoercer.coerce(node.get(key)));
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    /**
     * 纯字符串形态：字符串本身就是代码，没有标签
     */
    record Text(String value) implements CodeSlot {

        @Override
        public Optional<String> code(List<String> keys) {
            String cleaned = CodeText.clean(value);
            return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
        }

        @Override
        public Optional<Integer> label(String key) {
            return Optional.empty();
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    final class Empty implements CodeSlot {

        private Empty() {
        }

        @Override
        public Optional<String> code(List<String> keys) {
            return Optional.empty();
        }

        @Override
        public Optional<Integer> label(String key) {
            return Optional.empty();
        }

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public String toString() {
            return "CodeSlot.EMPTY";
        }
    }
}
