package com.vulcorpus.service;

import com.vulcorpus.extract.CodeText;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.RowPool;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 基于代码内容指纹的精确去重
 * 指纹只看清洗后的 processed_func，两行指纹相同即视为同一样本，不做模糊匹配
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class ContentDeduplicator {

    /**
     * SHA-256(清洗后的代码, UTF-8) 的十六进制
     */
    public String fingerprint(String code) {
        return DigestUtils.sha256Hex(CodeText.clean(code));
    }

    public String fingerprint(CorpusRow row) {
        return fingerprint(row.processedFunc());
    }

    public Set<String> fingerprints(RowPool pool) {
        return pool.rows().stream()
                .map(row -> fingerprint(row))
                .collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * 池内去重：每个指纹只保留第一次出现的行（连同其标签），其余行保持原顺序
     */
    public RowPool dedup(RowPool pool) {
        Set<String> seen = new HashSet<>();
        List<CorpusRow> kept = new ArrayList<>(pool.size());
        for (CorpusRow row : pool.rows()) {
            if (seen.add(fingerprint(row))) {
                kept.add(row);
            }
        }
        int dropped = pool.size() - kept.size();
        if (dropped > 0) {
            log.info("池 {} 内去重: 丢弃 {} 行重复代码，剩余 {} 行", pool.name(), dropped, kept.size());
        }
        return new RowPool(pool.name(), kept);
    }

    /**
     * 跨池去重叠：丢弃 candidate 中指纹出现在 reference 里的行，reference 不受影响
     */
    public RowPool removeOverlap(RowPool reference, RowPool candidate) {
        Set<String> referenceFingerprints = fingerprints(reference);
        List<CorpusRow> kept = candidate.rows().stream()
                .filter(row -> !referenceFingerprints.contains(fingerprint(row)))
                .collect(Collectors.toList());
        int dropped = candidate.size() - kept.size();
        if (dropped > 0) {
            log.info("池 {} 与 {} 去重叠: 丢弃 {} 行，剩余 {} 行",
                    candidate.name(), reference.name(), dropped, kept.size());
        }
        return new RowPool(candidate.name(), kept);
    }
}
