package com.vulcorpus.model;

/**
 * 带有最终行号的语料行
 *
 * @author yHong
 * @version 1.0
 * @since 2025/10/22
 */
public record IndexedRow(int index, CorpusRow row) {

    public String[] toCells() {
        String[] cells = row.toCells();
        String[] indexed = new String[cells.length + 1];
        indexed[0] = String.valueOf(index);
        System.arraycopy(cells, 0, indexed, 1, cells.length);
        return indexed;
    }
}
