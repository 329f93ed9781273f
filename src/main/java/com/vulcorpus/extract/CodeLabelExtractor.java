package com.vulcorpus.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulcorpus.model.ExtractionResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 从形态不一的 detail 记录中解析 (修复前代码, 标签, 修复后代码)
 *
 * 解析顺序（每一项都是一条显式的回退链）：
 * 1. 修复前代码：function_before 槽位 -> detail.code_before -> detail.code
 * 2. 标签：function_before.target -> detail.target -> 父对象 target
 * 3. 修复后代码：function_after 槽位 -> detail.patch -> 修复前代码
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
@Component
public class CodeLabelExtractor {

    public static final String FUNCTION_BEFORE = "function_before";
    public static final String FUNCTION_AFTER = "function_after";
    public static final String CODE_BEFORE = "code_before";
    public static final String CODE = "code";
    public static final String FUNCTION = "function";
    public static final String PATCH = "patch";
    public static final String TARGET = "target";

    /**
     * 对象形态的 function_before 中代码字段的优先级
     */
    static final List<String> BEFORE_SLOT_KEYS = List.of(FUNCTION, CODE_BEFORE, CODE);

    static final List<String> AFTER_SLOT_KEYS = List.of(FUNCTION, CODE);

    private final FallbackChain<DetailContext, String> beforeCodeChain = FallbackChain.<DetailContext, String>builder()
            .rule("function_before", ctx -> ctx.before().isPresent(), ctx -> ctx.before().code(BEFORE_SLOT_KEYS))
            .rule("detail.code_before", ctx -> CodeText.field(ctx.detail(), CODE_BEFORE))
            .rule("detail.code", ctx -> CodeText.field(ctx.detail(), CODE))
            .build();

    private final FallbackChain<DetailContext, Integer> labelChain = FallbackChain.<DetailContext, Integer>builder()
            .rule("function_before.target", ctx -> ctx.before().isPresent(), ctx -> ctx.before().label(TARGET))
            .rule("detail.target", ctx -> Optional.ofNullable(LabelCoercer.coerce(ctx.detail().get(TARGET))))
            .rule("parent.target", ctx -> ctx.parent() != null,
                    ctx -> Optional.ofNullable(LabelCoercer.coerce(ctx.parent().get(TARGET))))
            .build();

    private final FallbackChain<AfterContext, String> afterCodeChain = FallbackChain.<AfterContext, String>builder()
            .rule("function_after", ac -> ac.detail().after().isPresent(), ac -> ac.detail().after().code(AFTER_SLOT_KEYS))
            .rule("detail.patch", ac -> CodeText.field(ac.detail().detail(), PATCH))
            .rule("before_code", ac -> !ac.beforeCode().isEmpty(), ac -> Optional.of(ac.beforeCode()))
            .build();

    public ExtractionResult extract(JsonNode detail) {
        return extract(detail, null);
    }

    /**
     * @param detail 单个 detail 对象
     * @param parent detail 所在的源对象，可为 null
     */
    public ExtractionResult extract(JsonNode detail, JsonNode parent) {
        if (detail == null || !detail.isObject()) {
            throw new IllegalArgumentException("detail 必须是 JSON 对象");
        }
        DetailContext ctx = new DetailContext(
                detail,
                parent != null && parent.isObject() ? parent : null,
                CodeSlot.of(detail.get(FUNCTION_BEFORE)),
                CodeSlot.of(detail.get(FUNCTION_AFTER)));

        String beforeCode = beforeCodeChain.resolve(ctx).orElse("");
        Integer label = labelChain.resolve(ctx).orElse(null);
        String afterCode = afterCodeChain.resolve(new AfterContext(ctx, beforeCode)).orElse("");
        return new ExtractionResult(beforeCode, label, afterCode);
    }

    public FallbackChain<DetailContext, String> beforeCodeChain() {
        return beforeCodeChain;
    }

    public FallbackChain<DetailContext, Integer> labelChain() {
        return labelChain;
    }

    public FallbackChain<AfterContext, String> afterCodeChain() {
        return afterCodeChain;
    }

    /**
     * 一次解析的输入：detail、父对象以及预先识别好形态的两个槽位
     */
    public record DetailContext(JsonNode detail, JsonNode parent, CodeSlot before, CodeSlot after) {
    }

    public record AfterContext(DetailContext detail, String beforeCode) {
    }
}
