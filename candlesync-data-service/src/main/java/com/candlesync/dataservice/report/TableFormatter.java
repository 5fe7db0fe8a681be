package com.candlesync.dataservice.report;

import java.util.List;
import java.util.Locale;

/**
 * Renders rows of text cells as a console table.
 */
public interface TableFormatter {

    String format(List<String> headers, List<List<String>> rows);

    /**
     * Formatter by configuration name: {@code plain} or {@code github}.
     */
    static TableFormatter named(String name) {
        switch (name == null ? "" : name.trim().toLowerCase(Locale.ROOT)) {
            case "plain":
                return new PlainTableFormatter();
            case "github":
                return new GithubTableFormatter();
            default:
                throw new IllegalArgumentException("Unknown report format: " + name);
        }
    }

    static int[] columnWidths(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length && i < row.size(); i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }
        return widths;
    }

    static String cell(List<String> row, int index) {
        if (index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }

    static String pad(String text, int width) {
        StringBuilder sb = new StringBuilder(text);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
