package com.vulcorpus.service;

import com.vulcorpus.extract.CweFormatter;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.IndexedPool;
import com.vulcorpus.model.IndexedRow;
import com.vulcorpus.model.MaterializedSplits;
import org.springframework.stereotype.Service;

/**
 * 写出前的最终校验：任何一行不满足规范列约束都会中止运行，且不写出任何文件
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
public class OutputValidator {

    public void validate(MaterializedSplits splits) {
        splits.all().forEach(this::validate);
    }

    public void validate(IndexedPool pool) {
        int expected = 0;
        for (IndexedRow indexed : pool.rows()) {
            if (indexed.index() != expected) {
                throw violation(pool, indexed, "index 不连续，期望 " + expected);
            }
            CorpusRow row = indexed.row();
            if (!row.hasCode()) {
                throw violation(pool, indexed, "processed_func 为空");
            }
            if (row.processedFunc().indexOf('\u0000') >= 0 || row.processedFunc().indexOf('\r') >= 0) {
                throw violation(pool, indexed, "processed_func 未清洗");
            }
            if (row.target() != 0 && row.target() != 1) {
                throw violation(pool, indexed, "target 不是 0/1: " + row.target());
            }
            if (!CweFormatter.isCanonical(row.cweId())) {
                throw violation(pool, indexed, "cwe_id 格式错误: " + row.cweId());
            }
            if (row.vulFuncWithFix() == null || row.cveId() == null || row.commitId() == null
                    || row.filePath() == null || row.fileLanguage() == null
                    || row.flawLineIndex() == null || row.flawLine() == null) {
                throw violation(pool, indexed, "存在 null 字段");
            }
            expected++;
        }
    }

    private static IllegalStateException violation(IndexedPool pool, IndexedRow row, String reason) {
        return new IllegalStateException(String.format("切分 %s 第 %d 行校验失败: %s", pool.name(), row.index(), reason));
    }
}
