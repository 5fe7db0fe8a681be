package com.candlesync.dataservice.data.sqlite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collection;

/**
 * DDL for candle tables. Every table has the same shape, keyed by (symbol, timestamp).
 */
public final class CandleSchema {

    private static final Logger log = LoggerFactory.getLogger(CandleSchema.class);

    private CandleSchema() {
    }

    /**
     * Create the given tables if they do not exist yet.
     */
    public static void initialize(SqliteConnection conn, Collection<CandleTable> tables) throws SQLException {
        conn.executeInTransaction(c -> {
            try (Statement stmt = c.createStatement()) {
                for (CandleTable table : tables) {
                    stmt.execute(createTableSql(table));
                }
            }
        });
        log.debug("Ensured {} candle tables", tables.size());
    }

    static String createTableSql(CandleTable table) {
        return """
            CREATE TABLE IF NOT EXISTS %s (
                symbol TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                open REAL NOT NULL,
                high REAL NOT NULL,
                low REAL NOT NULL,
                close REAL NOT NULL,
                volume INTEGER NOT NULL DEFAULT 0,
                candle_color TEXT NOT NULL,
                PRIMARY KEY (symbol, timestamp)
            )
            """.formatted(table.sqlName());
    }
}
