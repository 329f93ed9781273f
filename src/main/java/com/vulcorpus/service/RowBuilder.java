package com.vulcorpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulcorpus.extract.CodeLabelExtractor;
import com.vulcorpus.extract.CodeText;
import com.vulcorpus.extract.CweFormatter;
import com.vulcorpus.model.BuildCounter;
import com.vulcorpus.model.BuildStats;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 把一个源对象（含零到多个 detail）转换为规范语料行
 * 只有修复前代码非空且标签已解析的 detail 才会产出行，其余按原因计数跳过
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
@Service
@Slf4j
public class RowBuilder {

    static final String DETAILS = "details";
    static final String CVE_ID = "cve_id";
    static final String CWE_ID = "cwe_id";
    static final String COMMIT_ID = "commit_id";
    static final String FILE_PATH = "file_path";
    static final String FILE_LANGUAGE = "file_language";
    static final String CVE_LANGUAGE = "cve_language";

    private final CodeLabelExtractor extractor;

    public RowBuilder(CodeLabelExtractor extractor) {
        this.extractor = extractor;
    }

    public List<CorpusRow> build(JsonNode source, BuildStats stats) {
        return build(source, stats, null);
    }

    /**
     * @param filterLanguage 非空时只保留语言相同（忽略大小写）的 detail
     */
    public List<CorpusRow> build(JsonNode source, BuildStats stats, String filterLanguage) {
        JsonNode details = source.get(DETAILS);
        if (details == null || details.isNull()) {
            stats.increment(BuildCounter.SKIP_NO_DETAILS);
            if (stats.takeDebugSlot()) {
                log.debug("[skip_no_details] 源对象字段: {}", fieldNames(source));
            }
            return Collections.emptyList();
        }

        List<JsonNode> items = new ArrayList<>();
        if (details.isArray()) {
            details.forEach(items::add);
        } else {
            items.add(details);
        }

        List<CorpusRow> rows = new ArrayList<>(items.size());
        for (JsonNode detail : items) {
            buildOne(source, detail, stats, filterLanguage).ifPresent(rows::add);
        }
        return rows;
    }

    /**
     * 惰性地处理一串源对象，计数在消费时累加
     */
    public Stream<CorpusRow> buildAll(Stream<JsonNode> sources, BuildStats stats, String filterLanguage) {
        return sources.flatMap(source -> build(source, stats, filterLanguage).stream());
    }

    private Optional<CorpusRow> buildOne(JsonNode source, JsonNode detail, BuildStats stats, String filterLanguage) {
        if (!detail.isObject()) {
            stats.increment(BuildCounter.SKIP_DETAIL_NOT_DICT);
            return Optional.empty();
        }

        String language = CodeText.field(detail, FILE_LANGUAGE)
                .or(() -> CodeText.field(source, CVE_LANGUAGE))
                .orElse("");
        if (filterLanguage != null && !filterLanguage.isBlank()
                && !language.equalsIgnoreCase(filterLanguage.strip())) {
            stats.increment(BuildCounter.SKIP_LANG_MISMATCH);
            return Optional.empty();
        }

        ExtractionResult extracted = extractor.extract(detail, source);
        if (!extracted.hasCode()) {
            stats.increment(BuildCounter.SKIP_NO_CODE);
            if (stats.takeDebugSlot()) {
                log.debug("[skip_no_code] detail 字段: {}", fieldNames(detail));
            }
            return Optional.empty();
        }
        if (!extracted.hasLabel()) {
            stats.increment(BuildCounter.SKIP_NO_LABEL);
            if (stats.takeDebugSlot()) {
                log.debug("[skip_no_label] detail.target={}, function_before={}",
                        detail.get(CodeLabelExtractor.TARGET), detail.get(CodeLabelExtractor.FUNCTION_BEFORE));
            }
            return Optional.empty();
        }

        stats.increment(BuildCounter.KEPT);
        return Optional.of(new CorpusRow(
                extracted.beforeCode(),
                extracted.label(),
                extracted.afterCode(),
                metadata(detail, source, CVE_ID).orElse(CorpusColumn.SENTINEL),
                cweId(detail, source),
                metadata(detail, source, COMMIT_ID).orElse(CorpusColumn.SENTINEL),
                CodeText.field(detail, FILE_PATH).orElse(CorpusColumn.SENTINEL),
                language.isEmpty() ? CorpusColumn.FILE_LANGUAGE.defaultValue() : language,
                CorpusColumn.FLAW_LINE_INDEX.defaultValue(),
                CorpusColumn.FLAW_LINE.defaultValue()));
    }

    /**
     * detail 自己的值优先，缺失时取父对象的值
     */
    private Optional<String> metadata(JsonNode detail, JsonNode source, String field) {
        return CodeText.field(detail, field).or(() -> CodeText.field(source, field));
    }

    /**
     * detail 的 cwe_id 解析不出 CWE 标记时再看父对象
     */
    private static String cweId(JsonNode detail, JsonNode source) {
        String cweId = CweFormatter.format(detail.get(CWE_ID));
        return CorpusColumn.CWE_SENTINEL.equals(cweId) ? CweFormatter.format(source.get(CWE_ID)) : cweId;
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }
}
