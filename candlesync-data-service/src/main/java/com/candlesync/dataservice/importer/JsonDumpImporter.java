package com.candlesync.dataservice.importer;

import com.candlesync.core.model.Candle;
import com.candlesync.dataservice.data.sqlite.CandleSchema;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bulk loader for JSON table dumps.
 *
 * Each document feeds one schema. Rows are upserted with the same
 * (symbol, timestamp) key as the sync process, so re-running an import is safe.
 * The stored color is always derived from open/close.
 */
public class JsonDumpImporter {

    private static final Logger log = LoggerFactory.getLogger(JsonDumpImporter.class);

    private final SqliteConnection conn;
    private final CandleDao candleDao;
    private final ObjectMapper mapper;

    public JsonDumpImporter(SqliteConnection conn, CandleDao candleDao, ObjectMapper mapper) {
        this.conn = conn;
        this.candleDao = candleDao;
        this.mapper = mapper;
    }

    /**
     * Import every document in map order (schema to file name, relative to {@code baseDir}).
     * A failed document does not stop the others.
     */
    public List<ImportResult> importAll(Path baseDir, Map<String, String> documents) {
        List<ImportResult> results = new ArrayList<>();
        for (Map.Entry<String, String> entry : documents.entrySet()) {
            results.add(importDocument(baseDir.resolve(entry.getValue()), entry.getKey()));
        }
        return results;
    }

    public ImportResult importDocument(Path file, String schema) {
        if (!Files.isRegularFile(file)) {
            log.error("Could not find {}", file);
            return ImportResult.failed(file, schema, "file not found");
        }

        DumpDocument document;
        try {
            document = mapper.readValue(file.toFile(), DumpDocument.class);
        } catch (IOException e) {
            log.error("Could not parse {}: {}", file, e.getMessage());
            return ImportResult.failed(file, schema, "unreadable: " + e.getMessage());
        }
        if (document.tables() == null) {
            return ImportResult.failed(file, schema, "no 'tables' array");
        }

        log.info("Importing {} into schema {}", file.getFileName(), schema);
        int tables = 0;
        int rows = 0;
        List<String> failures = new ArrayList<>();

        for (DumpDocument.DumpTable dumpTable : document.tables()) {
            Optional<CandleTable> parsed = CandleTable.parse(schema, dumpTable.table());
            if (parsed.isEmpty()) {
                log.warn("Skipping unknown table '{}' in {}", dumpTable.table(), file.getFileName());
                continue;
            }
            CandleTable table = parsed.get();
            if (dumpTable.rows() == null || dumpTable.rows().isEmpty()) {
                log.info("{} has no rows in {}, skipping", table, file.getFileName());
                continue;
            }

            try {
                List<Candle> candles = toCandles(table, dumpTable.rows());
                CandleSchema.initialize(conn, List.of(table));
                int written = candleDao.upsert(table, candles);
                log.info("Inserted/updated {} rows in {} ({} stored)", written, table, candleDao.count(table));
                tables++;
                rows += written;
            } catch (SQLException | IllegalArgumentException e) {
                log.error("Import of {} failed: {}", table, e.getMessage());
                failures.add(table.shortName() + ": " + e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            return new ImportResult(file, schema, false, tables, rows, String.join("; ", failures));
        }
        log.info("Finished loading {}: {} rows in {} tables", file.getFileName(), rows, tables);
        return new ImportResult(file, schema, true, tables, rows, null);
    }

    private static List<Candle> toCandles(CandleTable table, List<DumpDocument.DumpRow> rows) {
        List<Candle> candles = new ArrayList<>(rows.size());
        for (DumpDocument.DumpRow row : rows) {
            if (row.open() == null || row.high() == null || row.low() == null || row.close() == null) {
                throw new IllegalArgumentException("row at " + row.timestamp() + " is missing a price");
            }
            if (row.symbol() != null && !row.symbol().equalsIgnoreCase(table.symbol().getId())) {
                log.debug("{}: row symbol '{}' differs from table symbol", table, row.symbol());
            }
            Candle candle = new Candle(
                table.symbol(),
                parseTimestamp(row.timestamp()),
                row.open(),
                row.high(),
                row.low(),
                row.close(),
                row.volume() != null ? row.volume() : 0L);
            if (row.candleColor() != null && !row.candleColor().equalsIgnoreCase(candle.color().getId())) {
                log.debug("{}: dump color '{}' at {} replaced by {}", table, row.candleColor(),
                    candle.instant(), candle.color());
            }
            candles.add(candle);
        }
        return candles;
    }

    /**
     * ISO-8601 timestamp to epoch millis; a value without an offset is read as UTC.
     */
    static long parseTimestamp(String text) {
        if (text == null) {
            throw new IllegalArgumentException("row without timestamp");
        }
        try {
            return OffsetDateTime.parse(text).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).toEpochMilli();
            } catch (DateTimeParseException naive) {
                throw new IllegalArgumentException("bad timestamp '" + text + "'", naive);
            }
        }
    }
}
