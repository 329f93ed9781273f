package com.vulcorpus.service;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.vulcorpus.exception.CorpusException;
import com.vulcorpus.model.CorpusColumn;
import com.vulcorpus.model.IndexedPool;
import com.vulcorpus.model.IndexedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 写出物化后的切分：表头为 index + 十个规范列，UTF-8
 * 先写到同目录下的临时文件，成功后再原子替换目标文件，失败时不留下半个文件
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class CorpusCsvWriter {

    private final ObjectWriter rowWriter;

    public CorpusCsvWriter() {
        CsvSchema schema = CsvSchema.builder()
                .addColumns(CorpusColumn.indexedNames(), CsvSchema.ColumnType.STRING)
                .setUseHeader(true)
                .build();
        this.rowWriter = new CsvMapper().writerFor(String[].class).with(schema);
    }

    public Path write(IndexedPool pool, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (SequenceWriter writer = rowWriter.writeValues(temp.toFile())) {
                for (IndexedRow row : pool.rows()) {
                    writer.write(row.toCells());
                }
            }
            moveIntoPlace(temp, target);
            log.info("💾 已写出 {}: {} 行", target, pool.size());
            return target;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CorpusException("写出 CSV 失败: " + target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("清理临时文件失败: {}", temp, e);
        }
    }
}
