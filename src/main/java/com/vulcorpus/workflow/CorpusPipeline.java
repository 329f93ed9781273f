package com.vulcorpus.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.vulcorpus.config.CorpusProperties;
import com.vulcorpus.exception.MissingInputException;
import com.vulcorpus.model.AugmentScope;
import com.vulcorpus.model.BuildStats;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.DatasetSplits;
import com.vulcorpus.model.IndexedPool;
import com.vulcorpus.model.InputMode;
import com.vulcorpus.model.MaterializedSplits;
import com.vulcorpus.model.PoolSummary;
import com.vulcorpus.model.RowPool;
import com.vulcorpus.model.RunReport;
import com.vulcorpus.model.SplitRatios;
import com.vulcorpus.model.SyntheticStats;
import com.vulcorpus.service.AugmentationMerger;
import com.vulcorpus.service.ContentDeduplicator;
import com.vulcorpus.service.CorpusCsvReader;
import com.vulcorpus.service.CorpusCsvWriter;
import com.vulcorpus.service.JsonlRecordReader;
import com.vulcorpus.service.OutputValidator;
import com.vulcorpus.service.RowBuilder;
import com.vulcorpus.service.SchemaNormalizer;
import com.vulcorpus.service.StratifiedSplitter;
import com.vulcorpus.service.SyntheticSampleLoader;
import com.vulcorpus.workflow.dispatcher.InputModeDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 语料构建流水线（线性，无循环、无重试）：
 * 加载 -> 抽取/建行 -> 规范化 -> 切分或直通 -> 合成池去重/去重叠 -> 合并 -> 规范化 -> 分配 index -> 校验 -> 写出
 *
 * 每一步都返回新的 RowPool，不跨运行保留任何状态；计数器只属于本次运行
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/24
 */
@Service
@Slf4j
public class CorpusPipeline {

    private final InputModeDispatcher dispatcher = new InputModeDispatcher();

    private final JsonlRecordReader jsonlReader;
    private final RowBuilder rowBuilder;
    private final SchemaNormalizer schemaNormalizer;
    private final CorpusCsvReader csvReader;
    private final CorpusCsvWriter csvWriter;
    private final StratifiedSplitter splitter;
    private final SyntheticSampleLoader syntheticLoader;
    private final ContentDeduplicator deduplicator;
    private final AugmentationMerger merger;
    private final OutputValidator validator;

    public CorpusPipeline(JsonlRecordReader jsonlReader,
                          RowBuilder rowBuilder,
                          SchemaNormalizer schemaNormalizer,
                          CorpusCsvReader csvReader,
                          CorpusCsvWriter csvWriter,
                          StratifiedSplitter splitter,
                          SyntheticSampleLoader syntheticLoader,
                          ContentDeduplicator deduplicator,
                          AugmentationMerger merger,
                          OutputValidator validator) {
        this.jsonlReader = jsonlReader;
        this.rowBuilder = rowBuilder;
        this.schemaNormalizer = schemaNormalizer;
        this.csvReader = csvReader;
        this.csvWriter = csvWriter;
        this.splitter = splitter;
        this.syntheticLoader = syntheticLoader;
        this.deduplicator = deduplicator;
        this.merger = merger;
        this.validator = validator;
    }

    public RunReport run(CorpusProperties properties) {
        InputMode mode = dispatcher.dispatch(properties);
        SplitRatios ratios = properties.getSplit().toRatios();
        AugmentScope scope = properties.getAugmentScope() == null ? AugmentScope.TRAIN_ONLY : properties.getAugmentScope();
        preflight(properties, mode);
        log.info("🔄 开始构建语料: 模式={}, 增强范围={}", mode, scope.value());

        RunReport report = new RunReport();
        report.setMode(mode);

        DatasetSplits real = loadRealSplits(properties, mode, ratios, report);

        RowPool synthetic = null;
        if (properties.getSynthetic().isConfigured()) {
            synthetic = prepareSynthetic(properties.getSynthetic(), real.train(), report);
        }

        MaterializedSplits output = merger.merge(real, synthetic, scope);
        validator.validate(output);

        Path outputDir = Paths.get(properties.getOutputDir());
        for (IndexedPool pool : output.all()) {
            Path file = csvWriter.write(pool, outputDir.resolve(pool.name() + ".csv"));
            report.addOutput(PoolSummary.of(pool, file));
        }

        logReport(report);
        return report;
    }

    private DatasetSplits loadRealSplits(CorpusProperties properties, InputMode mode, SplitRatios ratios, RunReport report) {
        CorpusProperties.Primary primary = properties.getPrimary();
        switch (mode) {
            case PER_SPLIT_JSONL:
                return new DatasetSplits(
                        buildPool("train", primary.getTrainJsonl(), primary, report),
                        buildPool("val", primary.getValJsonl(), primary, report),
                        buildPool("test", primary.getTestJsonl(), primary, report));
            case COMBINED_JSONL:
                RowPool all = buildPool("all", primary.getAllJsonl(), primary, report);
                return splitter.split(all, properties.getSplit().getSeed(), ratios);
            case CANONICAL_CSV:
                return loadCanonicalSplits(properties.getRealSplits());
            default:
                throw new IllegalStateException("未知的输入模式: " + mode);
        }
    }

    private RowPool buildPool(String name, String path, CorpusProperties.Primary primary, RunReport report) {
        log.info("🔄 正在从 {} 构建 {} 语料...", path, name);
        BuildStats stats = new BuildStats(primary.getDebugSamples());
        List<CorpusRow> rows;
        try (Stream<JsonNode> records = jsonlReader.records(Paths.get(path), stats)) {
            rows = rowBuilder.buildAll(records, stats, primary.getFilterLanguage())
                    .collect(Collectors.toList());
        }
        report.addBuilderCounters(name, stats);
        RowPool pool = schemaNormalizer.normalize(new RowPool(name, rows));
        log.info("✅ {} 构建完成: {} 行, 计数 {}, 标签分布 {}", name, pool.size(), stats, pool.labelDistribution());
        return pool;
    }

    private DatasetSplits loadCanonicalSplits(CorpusProperties.RealSplits realSplits) {
        Path trainPath = Paths.get(realSplits.getTrainCsv());
        RowPool train = schemaNormalizer.normalize("train", csvReader.read(trainPath, "train CSV"));
        Path valPath = resolveSplit(realSplits.getValCsv(), trainPath, "val");
        Path testPath = resolveSplit(realSplits.getTestCsv(), trainPath, "test");
        RowPool val = valPath == null ? null : schemaNormalizer.normalize("val", csvReader.read(valPath, "val CSV"));
        RowPool test = testPath == null ? null : schemaNormalizer.normalize("test", csvReader.read(testPath, "test CSV"));
        if (val == null || test == null) {
            log.warn("⚠️ 未找到 {}{}，对应切分不会写出",
                    val == null ? "val.csv " : "", test == null ? "test.csv" : "");
        }
        return new DatasetSplits(train, val, test);
    }

    /**
     * 显式配置的路径直接使用；未配置时在 train 同目录下查找 {split}.csv，不存在就视为没有该切分
     */
    static Path resolveSplit(String configured, Path trainPath, String split) {
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        Path parent = trainPath.toAbsolutePath().getParent();
        Path candidate = parent.resolve(split + ".csv");
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    private RowPool prepareSynthetic(CorpusProperties.Synthetic config, RowPool realTrain, RunReport report) {
        SyntheticStats stats = new SyntheticStats();
        report.setSynthetic(stats);

        RowPool synthetic = syntheticLoader.load(
                Paths.get(config.getVulnerableCsv()),
                Paths.get(config.getNonVulnerableCsv()),
                config.isKeepOnlyComplete(),
                stats);

        if (config.isDedupWithin()) {
            RowPool deduped = deduplicator.dedup(synthetic);
            stats.setDedupDropped(synthetic.size() - deduped.size());
            synthetic = deduped;
        }
        if (config.isDedupAgainstTrain()) {
            RowPool filtered = deduplicator.removeOverlap(realTrain, synthetic);
            stats.setOverlapDropped(synthetic.size() - filtered.size());
            synthetic = filtered;
        }
        stats.setUsed(synthetic.size());
        return synthetic;
    }

    /**
     * 在做任何事之前确认所有配置的输入文件都存在
     */
    private void preflight(CorpusProperties properties, InputMode mode) {
        CorpusProperties.Primary primary = properties.getPrimary();
        switch (mode) {
            case PER_SPLIT_JSONL:
                requireFile("train JSONL", primary.getTrainJsonl());
                requireFile("val JSONL", primary.getValJsonl());
                requireFile("test JSONL", primary.getTestJsonl());
                break;
            case COMBINED_JSONL:
                requireFile("all JSONL", primary.getAllJsonl());
                break;
            case CANONICAL_CSV:
                CorpusProperties.RealSplits realSplits = properties.getRealSplits();
                requireFile("train CSV", realSplits.getTrainCsv());
                if (realSplits.getValCsv() != null && !realSplits.getValCsv().isBlank()) {
                    requireFile("val CSV", realSplits.getValCsv());
                }
                if (realSplits.getTestCsv() != null && !realSplits.getTestCsv().isBlank()) {
                    requireFile("test CSV", realSplits.getTestCsv());
                }
                break;
            default:
                break;
        }
        CorpusProperties.Synthetic synthetic = properties.getSynthetic();
        if (synthetic.isConfigured()) {
            requireFile("合成漏洞样本 CSV", synthetic.getVulnerableCsv());
            requireFile("合成非漏洞样本 CSV", synthetic.getNonVulnerableCsv());
        }
    }

    private static void requireFile(String role, String path) {
        Path resolved = path == null || path.isBlank() ? null : Paths.get(path);
        if (resolved == null || !Files.isRegularFile(resolved)) {
            throw new MissingInputException(role, resolved);
        }
    }

    private void logReport(RunReport report) {
        log.info("=== 语料构建汇总 ===");
        log.info("模式: {}", report.getMode());
        report.getBuilderCounters().forEach((input, counters) -> log.info("  - 输入 {}: {}", input, counters));
        if (report.getSynthetic() != null) {
            log.info("  - 合成池: {}", report.getSynthetic());
        }
        for (PoolSummary summary : report.getOutputs()) {
            log.info("  - {}: {} 行, 标签分布 {}, 文件 {}",
                    summary.name(), summary.rows(), summary.labelDistribution(), summary.file());
        }
        log.info("====================");
    }
}
