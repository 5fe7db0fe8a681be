package com.candlesync.dataservice.report;

import com.candlesync.dataservice.sync.PairSyncResult;
import com.candlesync.dataservice.sync.StalenessResult;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Console output of a sync run: the status table, then one decision line per
 * updated table.
 */
public class StatusReporter {

    static final List<String> HEADERS = List.of("Table", "Latest Stored Candle", "Status");
    static final String STATUS_OK = "OK";
    static final String STATUS_OUTDATED = "OUTDATED";

    private final PrintStream out;
    private final TableFormatter formatter;
    private final String title;

    public StatusReporter(PrintStream out, TableFormatter formatter, String title) {
        this.out = out;
        this.formatter = formatter;
        this.title = title;
    }

    public void printStatus(List<StalenessResult> statuses) {
        List<List<String>> rows = new ArrayList<>(statuses.size());
        for (StalenessResult status : statuses) {
            rows.add(List.of(
                status.table().shortName(),
                status.latestDisplay(),
                status.isUpToDate() ? STATUS_OK : STATUS_OUTDATED));
        }

        out.println();
        out.println("---- " + title + " ----");
        out.print(formatter.format(HEADERS, rows));

        if (statuses.stream().allMatch(StalenessResult::isUpToDate)) {
            out.println();
            out.println("All tables appear up to date.");
        }
    }

    public void printResults(List<PairSyncResult> results) {
        if (results.isEmpty()) {
            return;
        }
        out.println();
        for (PairSyncResult result : results) {
            out.println(result.table().displayName() + ": " + result.describe());
        }
    }
}
