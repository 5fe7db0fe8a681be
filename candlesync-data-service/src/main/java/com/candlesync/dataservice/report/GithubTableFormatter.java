package com.candlesync.dataservice.report;

import java.util.List;

/**
 * GitHub-flavored markdown pipe table.
 */
public class GithubTableFormatter implements TableFormatter {

    @Override
    public String format(List<String> headers, List<List<String>> rows) {
        int[] widths = TableFormatter.columnWidths(headers, rows);
        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths);

        sb.append('|');
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('|');
        }
        sb.append(System.lineSeparator());

        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> row, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(TableFormatter.pad(TableFormatter.cell(row, i), widths[i])).append(" |");
        }
        sb.append(System.lineSeparator());
    }
}
