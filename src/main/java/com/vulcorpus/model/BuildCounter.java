package com.vulcorpus.model;

/**
 * 行构建阶段的诊断计数器，key 原样出现在运行报告中
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public enum BuildCounter {
    RECORDS_SEEN("records_seen"),
    SKIP_BAD_JSON("skip_bad_json"),
    SKIP_NO_DETAILS("skip_no_details"),
    SKIP_DETAIL_NOT_DICT("skip_detail_not_dict"),
    SKIP_LANG_MISMATCH("skip_lang_mismatch"),
    SKIP_NO_CODE("skip_no_code"),
    SKIP_NO_LABEL("skip_no_label"),
    KEPT("kept");

    private final String key;

    BuildCounter(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
