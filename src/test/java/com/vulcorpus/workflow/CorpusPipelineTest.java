package com.vulcorpus.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulcorpus.config.CorpusProperties;
import com.vulcorpus.exception.MissingInputException;
import com.vulcorpus.extract.CodeLabelExtractor;
import com.vulcorpus.model.AugmentScope;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CsvTable;
import com.vulcorpus.model.InputMode;
import com.vulcorpus.model.PoolSummary;
import com.vulcorpus.model.RunReport;
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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

class CorpusPipelineTest {

    @TempDir
    Path tempDir;

    private CorpusPipeline pipeline;
    private CorpusCsvReader csvReader;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        SchemaNormalizer normalizer = new SchemaNormalizer();
        csvReader = new CorpusCsvReader();
        pipeline = new CorpusPipeline(
                new JsonlRecordReader(new ObjectMapper()),
                new RowBuilder(new CodeLabelExtractor()),
                normalizer,
                csvReader,
                new CorpusCsvWriter(),
                new StratifiedSplitter(),
                new SyntheticSampleLoader(csvReader, normalizer),
                new ContentDeduplicator(),
                new AugmentationMerger(normalizer),
                new OutputValidator());
        outputDir = tempDir.resolve("out");
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * 每行一个源对象，每个源对象一个 detail
     */
    private Path jsonl(String name, int positives, int negatives, String prefix) throws Exception {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < positives; i++) {
            content.append("{\"cve_id\": \"CVE-").append(prefix).append('-').append(i)
                    .append("\", \"cwe_id\": \"CWE-119\", \"details\": [{\"function_before\": {\"function\": \"")
                    .append(prefix).append("_vuln_").append(i).append("();\", \"target\": 1}}]}\n");
        }
        for (int i = 0; i < negatives; i++) {
            content.append("{\"details\": [{\"code\": \"").append(prefix).append("_safe_").append(i)
                    .append("();\", \"target\": 0}]}\n");
        }
        return write(name, content.toString());
    }

    private CorpusProperties baseProperties() {
        CorpusProperties properties = new CorpusProperties();
        properties.setOutputDir(outputDir.toString());
        return properties;
    }

    @Test
    void run_combinedJsonlWithSyntheticShouldKeepEvaluationSplitsReal() throws Exception {
        Path all = jsonl("all.jsonl", 20, 80, "real");
        Path vuln = write("syn/vuln.csv", "code,cwe\n"
                + "real_vuln_0();,CWE-787\n"
                + "syn_a();,CWE-787\n"
                + "syn_a();,CWE-787\n");
        Path safe = write("syn/safe.csv", "code\nsyn_b();\n");

        CorpusProperties properties = baseProperties();
        properties.getPrimary().setAllJsonl(all.toString());
        properties.getSynthetic().setVulnerableCsv(vuln.toString());
        properties.getSynthetic().setNonVulnerableCsv(safe.toString());
        properties.getSynthetic().setDedupWithin(true);
        properties.getSynthetic().setDedupAgainstTrain(true);

        RunReport report = pipeline.run(properties);

        Assertions.assertEquals(InputMode.COMBINED_JSONL, report.getMode());
        Assertions.assertEquals(List.of("train_aug", "val", "test"),
                report.getOutputs().stream().map(PoolSummary::name).collect(Collectors.toList()));
        Assertions.assertEquals(100L, report.getBuilderCounters().get("all").get("kept"));

        CsvTable train = csvReader.read(outputDir.resolve("train_aug.csv"));
        CsvTable val = csvReader.read(outputDir.resolve("val.csv"));
        CsvTable test = csvReader.read(outputDir.resolve("test.csv"));
        Assertions.assertEquals(CorpusColumn.indexedNames(), train.columns());

        Set<String> evaluationCodes = new HashSet<>(codes(val));
        evaluationCodes.addAll(codes(test));
        Assertions.assertTrue(evaluationCodes.stream().noneMatch(code -> code.startsWith("syn_")));
        Assertions.assertEquals(20, val.size() + test.size());

        List<String> trainCodes = codes(train);
        Assertions.assertEquals(trainCodes.size(), new HashSet<>(trainCodes).size());
        Assertions.assertEquals(1, trainCodes.stream().filter("syn_a();"::equals).count());
        Assertions.assertTrue(trainCodes.contains("syn_b();"));
        // 与真实 train 重复的合成样本被去掉；若该真实样本落在 val / test，则合成副本保留在 train 中
        boolean overlapInTrain = !evaluationCodes.contains("real_vuln_0();");
        Assertions.assertEquals(overlapInTrain ? 82 : 83, train.size());
        Assertions.assertEquals(1, trainCodes.stream().filter("real_vuln_0();"::equals).count());
        assertDenseIndex(train);
        assertDenseIndex(val);
        assertDenseIndex(test);
    }

    @Test
    void run_shouldBeReproducibleForSameSeed() throws Exception {
        Path all = jsonl("all.jsonl", 15, 35, "real");
        CorpusProperties properties = baseProperties();
        properties.getPrimary().setAllJsonl(all.toString());

        pipeline.run(properties);
        String firstTrain = Files.readString(outputDir.resolve("train.csv"), StandardCharsets.UTF_8);
        pipeline.run(properties);
        String secondTrain = Files.readString(outputDir.resolve("train.csv"), StandardCharsets.UTF_8);

        Assertions.assertEquals(firstTrain, secondTrain);
    }

    @Test
    void run_perSplitJsonlShouldKeepProvidedSplits() throws Exception {
        CorpusProperties properties = baseProperties();
        properties.getPrimary().setTrainJsonl(jsonl("train.jsonl", 3, 5, "tr").toString());
        properties.getPrimary().setValJsonl(jsonl("val.jsonl", 1, 1, "va").toString());
        properties.getPrimary().setTestJsonl(jsonl("test.jsonl", 2, 0, "te").toString());

        RunReport report = pipeline.run(properties);

        Assertions.assertEquals(InputMode.PER_SPLIT_JSONL, report.getMode());
        Map<String, Integer> sizes = report.getOutputs().stream()
                .collect(Collectors.toMap(PoolSummary::name, PoolSummary::rows));
        Assertions.assertEquals(Map.of("train", 8, "val", 2, "test", 2), sizes);
        Assertions.assertEquals(List.of("te_vuln_0();", "te_vuln_1();"),
                codes(csvReader.read(outputDir.resolve("test.csv"))));
    }

    @Test
    void run_canonicalCsvShouldAutoDetectSiblingSplitsAndAugmentAll() throws Exception {
        Path train = write("splits/train.csv", "index,processed_func,target,cwe_id\n"
                + "17,a();,1,CWE-20\n"
                + "18,b();,0,\n");
        write("splits/val.csv", "processed_func,target\nc();,1.0\n");
        Path vuln = write("syn/vuln.csv", "processed_func,cwe\nsyn();,CWE-416\n");
        Path safe = write("syn/safe.csv", "processed_func\n");

        CorpusProperties properties = baseProperties();
        properties.setAugmentScope(AugmentScope.ALL);
        properties.getRealSplits().setTrainCsv(train.toString());
        properties.getSynthetic().setVulnerableCsv(vuln.toString());
        properties.getSynthetic().setNonVulnerableCsv(safe.toString());

        RunReport report = pipeline.run(properties);

        Assertions.assertEquals(List.of("train_aug", "val"),
                report.getOutputs().stream().map(PoolSummary::name).collect(Collectors.toList()));
        Assertions.assertFalse(Files.exists(outputDir.resolve("test.csv")));

        CsvTable trainOut = csvReader.read(outputDir.resolve("train_aug.csv"));
        Assertions.assertEquals(List.of("a();", "b();", "syn();"), codes(trainOut));
        Assertions.assertEquals("0", trainOut.rows().get(0).get("index"));
        Assertions.assertEquals("['CWE-20']", trainOut.rows().get(0).get("cwe_id"));
        Assertions.assertEquals("['-']", trainOut.rows().get(1).get("cwe_id"));
        Assertions.assertEquals("['CWE-416']", trainOut.rows().get(2).get("cwe_id"));

        CsvTable valOut = csvReader.read(outputDir.resolve("val.csv"));
        Assertions.assertEquals(List.of("c();", "syn();"), codes(valOut));
        Assertions.assertEquals("1", valOut.rows().get(0).get("target"));
    }

    @Test
    void run_missingSyntheticFileShouldFailBeforeWritingAnything() throws Exception {
        Path all = jsonl("all.jsonl", 5, 5, "real");
        CorpusProperties properties = baseProperties();
        properties.getPrimary().setAllJsonl(all.toString());
        properties.getSynthetic().setVulnerableCsv(tempDir.resolve("syn/absent.csv").toString());
        properties.getSynthetic().setNonVulnerableCsv(tempDir.resolve("syn/also-absent.csv").toString());

        Assertions.assertThrows(MissingInputException.class, () -> pipeline.run(properties));
        Assertions.assertFalse(Files.exists(outputDir));
    }

    @Test
    void resolveSplit_shouldPreferConfiguredPath() throws Exception {
        Path train = write("splits/train.csv", "processed_func\n");

        Assertions.assertEquals(Path.of("custom/test.csv"),
                CorpusPipeline.resolveSplit("custom/test.csv", train, "test"));
        Assertions.assertNull(CorpusPipeline.resolveSplit(null, train, "test"));
    }

    private static List<String> codes(CsvTable table) {
        return table.rows().stream()
                .map(row -> row.get(CorpusColumn.PROCESSED_FUNC.columnName()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static void assertDenseIndex(CsvTable table) {
        for (int i = 0; i < table.size(); i++) {
            Assertions.assertEquals(String.valueOf(i), table.rows().get(i).get(CorpusColumn.INDEX));
        }
    }
}
