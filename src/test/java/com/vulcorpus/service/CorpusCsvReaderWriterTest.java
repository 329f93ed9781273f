package com.vulcorpus.service;

import com.vulcorpus.exception.InputSchemaException;
import com.vulcorpus.exception.MissingInputException;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.CorpusRow;
import com.vulcorpus.model.CsvTable;
import com.vulcorpus.model.IndexedPool;
import com.vulcorpus.model.RowPool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.vulcorpus.support.Rows.row;

class CorpusCsvReaderWriterTest {

    private final CorpusCsvReader reader = new CorpusCsvReader();
    private final CorpusCsvWriter writer = new CorpusCsvWriter();

    @TempDir
    Path tempDir;

    @Test
    void write_shouldEmitIndexedHeaderAndPreserveMultilineCode() {
        CorpusRow multiline = new CorpusRow("int f() {\n  char b[4], c = '\"';\n}", 1, "-", "CVE-1",
                "['CWE-119']", "abc", "src/a.c", "C", "[]", "");
        IndexedPool pool = IndexedPool.of(new RowPool("train", List.of(multiline, row("g();", 0))));
        Path target = tempDir.resolve("out/nested/train.csv");

        writer.write(pool, target);
        CsvTable table = reader.read(target);

        Assertions.assertEquals(CorpusColumn.indexedNames(), table.columns());
        Assertions.assertEquals(2, table.size());
        Map<String, String> first = table.rows().get(0);
        Assertions.assertEquals("0", first.get("index"));
        Assertions.assertEquals(multiline.processedFunc(), first.get("processed_func"));
        Assertions.assertEquals("['CWE-119']", first.get("cwe_id"));
        Assertions.assertEquals("1", table.rows().get(1).get("index"));
        Assertions.assertEquals("", table.rows().get(1).get("flaw_line"));
    }

    @Test
    void write_shouldReplaceExistingFileWithoutLeavingTempFiles() throws Exception {
        Path target = tempDir.resolve("test.csv");
        Files.writeString(target, "stale", StandardCharsets.UTF_8);

        writer.write(IndexedPool.of(new RowPool("test", List.of(row("a();", 1)))), target);

        Assertions.assertEquals(1, reader.read(target).size());
        try (Stream<Path> files = Files.list(tempDir)) {
            Assertions.assertEquals(List.of(target), files.collect(Collectors.toList()));
        }
    }

    @Test
    void read_shouldStripBomAndOmitMissingTrailingCells() throws Exception {
        Path file = tempDir.resolve("bom.csv");
        Files.writeString(file, "\uFEFFprocessed_func,target,cwe_id\na();,1\n", StandardCharsets.UTF_8);

        CsvTable table = reader.read(file);

        Assertions.assertTrue(table.hasColumn("processed_func"));
        Assertions.assertEquals("1", table.rows().get(0).get("target"));
        Assertions.assertFalse(table.rows().get(0).containsKey("cwe_id"));
    }

    @Test
    void read_shouldRejectEmptyFileAndMissingFile() throws Exception {
        Path empty = tempDir.resolve("empty.csv");
        Files.writeString(empty, "", StandardCharsets.UTF_8);

        Assertions.assertThrows(InputSchemaException.class, () -> reader.read(empty, "train CSV"));
        MissingInputException missing = Assertions.assertThrows(MissingInputException.class,
                () -> reader.read(tempDir.resolve("absent.csv"), "train CSV"));
        Assertions.assertEquals(tempDir.resolve("absent.csv"), missing.getPath());
    }
}
