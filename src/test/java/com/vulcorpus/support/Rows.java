package com.vulcorpus.support;

import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.RowPool;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的语料行构造
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
public final class Rows {

    private Rows() {
    }

    public static CorpusRow row(String code, int target) {
        return new CorpusRow(code, target, "-", "-", "['-']", "-", "-", "C", "[]", "");
    }

    public static CorpusRow row(String code, int target, String cveId) {
        return new CorpusRow(code, target, "-", cveId, "['-']", "-", "-", "C", "[]", "");
    }

    public static RowPool pool(String name, CorpusRow... rows) {
        return new RowPool(name, List.of(rows));
    }

    /**
     * positives 个正样本 + negatives 个负样本，代码互不相同
     */
    public static RowPool balanced(String name, int positives, int negatives) {
        List<CorpusRow> rows = new ArrayList<>();
        for (int i = 0; i < positives; i++) {
            rows.add(row("vuln_" + i + "();", 1));
        }
        for (int i = 0; i < negatives; i++) {
            rows.add(row("safe_" + i + "();", 0));
        }
        return new RowPool(name, rows);
    }
}
