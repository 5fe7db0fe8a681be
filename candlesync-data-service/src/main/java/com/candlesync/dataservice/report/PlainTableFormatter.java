package com.candlesync.dataservice.report;

import java.util.List;

/**
 * Left-aligned columns separated by two spaces, no borders.
 */
public class PlainTableFormatter implements TableFormatter {

    private static final String SEPARATOR = "  ";

    @Override
    public String format(List<String> headers, List<List<String>> rows) {
        int[] widths = TableFormatter.columnWidths(headers, rows);
        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths);
        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> row, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                line.append(SEPARATOR);
            }
            line.append(TableFormatter.pad(TableFormatter.cell(row, i), widths[i]));
        }
        sb.append(line.toString().stripTrailing()).append(System.lineSeparator());
    }
}
