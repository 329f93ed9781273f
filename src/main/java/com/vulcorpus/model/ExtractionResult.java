package com.vulcorpus.model;

/**
 * 从一个 detail 记录中解析出的 (修复前代码, 标签, 修复后代码)
 *
 * @param beforeCode 修复前代码，无法解析时为空字符串
 * @param label      0 / 1，无法解析时为 null
 * @param afterCode  修复后代码，缺失时等于 beforeCode
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record ExtractionResult(String beforeCode, Integer label, String afterCode) {

    public boolean hasCode() {
        return beforeCode != null && !beforeCode.isEmpty();
    }

    public boolean hasLabel() {
        return label != null;
    }
}
