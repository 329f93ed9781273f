package com.vulcorpus.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.vulcorpus.exception.CorpusException;
import com.vulcorpus.exception.MissingInputException;
import com.vulcorpus.model.BuildCounter;
import com.vulcorpus.model.BuildStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 逐行读取 JSONL 源文件
 * 空行忽略；无法解析、编码非法、对象后带多余内容或不是 JSON 对象的行计入 skip_bad_json 后跳过，不中断运行
 * 按字节切行，UTF-8 由 Jackson 在单行内校验，一行坏编码不会影响后续行
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
@Service
@Slf4j
public class JsonlRecordReader {

    private final ObjectReader lineReader;

    public JsonlRecordReader(ObjectMapper objectMapper) {
        this.lineReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 惰性读取，返回的 Stream 只能消费一次，调用方负责关闭
     */
    public Stream<JsonNode> records(Path path, BuildStats stats) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new MissingInputException("JSONL", path);
        }
        InputStream in;
        try {
            in = new BufferedInputStream(Files.newInputStream(path));
        } catch (IOException e) {
            throw new CorpusException("打开 JSONL 文件失败: " + path, e);
        }

        AtomicLong lineNum = new AtomicLong();
        LineIterator lines = new LineIterator(in, path);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(lines, Spliterator.ORDERED), false)
                .map(line -> parseLine(line, lineNum.incrementAndGet(), stats))
                .filter(Objects::nonNull)
                .onClose(() -> {
                    try {
                        in.close();
                    } catch (IOException e) {
                        throw new CorpusException("关闭 JSONL 文件失败: " + path, e);
                    }
                });
    }

    private JsonNode parseLine(byte[] line, long lineNum, BuildStats stats) {
        if (isBlank(line)) {
            return null;
        }
        stats.increment(BuildCounter.RECORDS_SEEN);
        try {
            JsonNode node = lineReader.readTree(line);
            if (node != null && node.isObject()) {
                return node;
            }
            log.warn("第 {} 行不是 JSON 对象，已跳过", lineNum);
        } catch (IOException e) {
            log.warn("解析第 {} 行 JSON 失败: {}", lineNum, e.getMessage());
        }
        stats.increment(BuildCounter.SKIP_BAD_JSON);
        return null;
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
                return false;
            }
        }
        return true;
    }

    /**
     * 按 '\n' 切出原始字节行（不含换行符）
     */
    private static final class LineIterator implements Iterator<byte[]> {

        private final InputStream in;
        private final Path path;
        private byte[] next;
        private boolean eof;

        LineIterator(InputStream in, Path path) {
            this.in = in;
            this.path = path;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !eof) {
                next = readLine();
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            byte[] line = next;
            next = null;
            return line;
        }

        private byte[] readLine() {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
            try {
                int b;
                while ((b = in.read()) != -1) {
                    if (b == '\n') {
                        return buffer.toByteArray();
                    }
                    buffer.write(b);
                }
            } catch (IOException e) {
                throw new CorpusException("读取 JSONL 文件失败: " + path, e);
            }
            eof = true;
            return buffer.size() > 0 ? buffer.toByteArray() : null;
        }
    }
}
