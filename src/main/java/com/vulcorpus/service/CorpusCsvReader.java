package com.vulcorpus.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.vulcorpus.exception.CorpusException;
import com.vulcorpus.exception.InputSchemaException;
import com.vulcorpus.exception.MissingInputException;
import com.vulcorpus.model.CsvTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取带表头的 CSV，单元格内允许带引号的换行
 * 行比表头短时，缺失的列不会出现在行 Map 中
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/23
 */
@Service
@Slf4j
public class CorpusCsvReader {

    private final ObjectReader rowReader;

    public CorpusCsvReader() {
        this.rowReader = new CsvMapper().readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public CsvTable read(Path path) {
        return read(path, "CSV");
    }

    /**
     * @param role 出错时提示用的输入名称，例如 "train CSV"
     */
    public CsvTable read(Path path, String role) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new MissingInputException(role, path);
        }
        try (MappingIterator<String[]> it = rowReader.readValues(path.toFile())) {
            if (!it.hasNext()) {
                throw new InputSchemaException(role + " 没有表头: " + path);
            }
            List<String> header = new ArrayList<>();
            for (String name : it.next()) {
                header.add(name == null ? "" : name.replace("\uFEFF", "").strip());
            }

            List<Map<String, String>> rows = new ArrayList<>();
            while (it.hasNext()) {
                String[] cells = it.next();
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.size() && i < cells.length; i++) {
                    row.put(header.get(i), cells[i]);
                }
                rows.add(row);
            }
            log.info("读取 {} 完成: {} 行, 列 {}", path, rows.size(), header);
            return new CsvTable(header, rows);
        } catch (IOException e) {
            throw new CorpusException("读取 CSV 失败: " + path, e);
        }
    }
}
