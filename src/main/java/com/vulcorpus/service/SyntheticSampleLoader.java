package com.vulcorpus.service;

import com.vulcorpus.exception.InputSchemaException;
import com.vulcorpus.extract.CodeText;
import com.vulcorpus.extract.CweFormatter;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.CsvTable;
import com.vulcorpus.model.RowPool;
import com.vulcorpus.model.SyntheticStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把生成器产出的两个合成表（漏洞 / 非漏洞）映射为规范语料行
 *
 * - processed_func <- 'processed_func' 列，没有时取 'code' 列
 * - target 由来源表决定：漏洞表为 1，非漏洞表为 0
 * - cwe_id 只从漏洞表的 'cwe' 列提取第一个 CWE-数字，非漏洞表固定为 ['-']
 * - 其余元数据为占位值，语言为 C
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class SyntheticSampleLoader {

    static final String CODE = "code";
    static final String CWE = "cwe";
    static final String IS_COMPLETE = "is_complete";

    private final CorpusCsvReader csvReader;
    private final SchemaNormalizer schemaNormalizer;

    public SyntheticSampleLoader(CorpusCsvReader csvReader, SchemaNormalizer schemaNormalizer) {
        this.csvReader = csvReader;
        this.schemaNormalizer = schemaNormalizer;
    }

    public RowPool load(Path vulnerableCsv, Path nonVulnerableCsv, boolean keepOnlyComplete, SyntheticStats stats) {
        log.info("🔄 正在加载合成样本...");
        CsvTable vulnerable = csvReader.read(vulnerableCsv, "合成漏洞样本 CSV");
        CsvTable nonVulnerable = csvReader.read(nonVulnerableCsv, "合成非漏洞样本 CSV");

        List<CorpusRow> rows = new ArrayList<>();
        rows.addAll(map(vulnerable, vulnerableCsv, 1, keepOnlyComplete, stats));
        rows.addAll(map(nonVulnerable, nonVulnerableCsv, 0, keepOnlyComplete, stats));

        RowPool pool = schemaNormalizer.normalize(new RowPool("synthetic", rows));
        log.info("✅ 合成样本加载完成: 读取 {} 行, 质量过滤 {} 行, 空代码 {} 行, 保留 {} 行, 标签分布 {}",
                stats.getRowsRead(), stats.getDroppedIncomplete(), stats.getDroppedEmptyCode(),
                pool.size(), pool.labelDistribution());
        return pool;
    }

    private List<CorpusRow> map(CsvTable table, Path source, int label, boolean keepOnlyComplete, SyntheticStats stats) {
        String codeColumn = codeColumn(table, source);
        boolean filterComplete = keepOnlyComplete && table.hasColumn(IS_COMPLETE);
        boolean readCwe = label == 1 && table.hasColumn(CWE);

        List<CorpusRow> rows = new ArrayList<>(table.size());
        for (Map<String, String> cells : table.rows()) {
            stats.setRowsRead(stats.getRowsRead() + 1);
            if (filterComplete && !isComplete(cells.get(IS_COMPLETE))) {
                stats.setDroppedIncomplete(stats.getDroppedIncomplete() + 1);
                continue;
            }
            String code = CodeText.clean(cells.get(codeColumn));
            if (code.isEmpty()) {
                stats.setDroppedEmptyCode(stats.getDroppedEmptyCode() + 1);
                continue;
            }
            String cweId = readCwe ? CweFormatter.format(cells.get(CWE)) : CorpusColumn.CWE_SENTINEL;
            rows.add(CorpusRow.synthetic(code, label, cweId));
        }
        return rows;
    }

    /**
     * 优先 processed_func，其次 code，都没有时无法继续
     */
    static String codeColumn(CsvTable table, Path source) {
        if (table.hasColumn(CorpusColumn.PROCESSED_FUNC.columnName())) {
            return CorpusColumn.PROCESSED_FUNC.columnName();
        }
        if (table.hasColumn(CODE)) {
            return CODE;
        }
        throw new InputSchemaException("合成样本 CSV 必须包含 'processed_func' 或 'code' 列: " + source);
    }

    private static boolean isComplete(String value) {
        if (value == null) {
            return false;
        }
        String token = value.strip();
        return "true".equalsIgnoreCase(token) || "1".equals(token);
    }
}
