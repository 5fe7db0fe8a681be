package com.candlesync.dataservice.data.sqlite.dao;

import com.candlesync.core.model.Candle;
import com.candlesync.core.model.RawCandle;
import com.candlesync.dataservice.data.CandleWriter;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for OHLCV candle tables.
 * One table per (schema, symbol, timeframe); see {@link CandleTable}.
 */
public class CandleDao implements CandleWriter {

    private static final Logger log = LoggerFactory.getLogger(CandleDao.class);

    private static final int BATCH_SIZE = 1000;

    private final SqliteConnection conn;

    public CandleDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Upsert candles in one transaction. A failure rolls back the whole call.
     */
    @Override
    public int upsert(CandleTable table, List<Candle> candles) throws SQLException {
        if (candles.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO %s
                (symbol, timestamp, open, high, low, close, volume, candle_color)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (symbol, timestamp) DO UPDATE
                SET open         = excluded.open,
                    high         = excluded.high,
                    low          = excluded.low,
                    close        = excluded.close,
                    volume       = excluded.volume,
                    candle_color = excluded.candle_color
            """.formatted(table.sqlName());

        int written = conn.executeInTransaction(c -> {
            int count = 0;
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                for (Candle candle : candles) {
                    stmt.setString(1, candle.symbol().getId());
                    stmt.setLong(2, candle.timestamp());
                    stmt.setDouble(3, candle.open());
                    stmt.setDouble(4, candle.high());
                    stmt.setDouble(5, candle.low());
                    stmt.setDouble(6, candle.close());
                    stmt.setLong(7, candle.volume());
                    stmt.setString(8, candle.color().getId());
                    stmt.addBatch();

                    if (++count % BATCH_SIZE == 0) {
                        stmt.executeBatch();
                    }
                }
                stmt.executeBatch();
            }
            return count;
        });

        log.debug("Upserted {} candles into {}", written, table);
        return written;
    }

    /**
     * Most recent stored timestamp, or null when the table is empty.
     */
    public Long getLatestTimestamp(CandleTable table) throws SQLException {
        String sql = "SELECT MAX(timestamp) FROM " + table.sqlName();

        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    long max = rs.getLong(1);
                    return rs.wasNull() ? null : max;
                }
                return null;
            }
        });
    }

    /**
     * Stored candle at exactly {@code timestamp}, or null.
     */
    public Candle findAt(CandleTable table, long timestamp) throws SQLException {
        String sql = """
            SELECT timestamp, open, high, low, close, volume
            FROM %s
            WHERE timestamp = ?
            LIMIT 1
            """.formatted(table.sqlName());

        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setLong(1, timestamp);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? readCandle(table, rs) : null;
                }
            }
        });
    }

    /**
     * Rows of a table read as un-normalized input, for tables this process does
     * not own (the secondary minute store). Timestamps come back as naive UTC
     * and a NULL volume stays null.
     */
    public List<RawCandle> queryRaw(CandleTable table, long startTime, long endTime) throws SQLException {
        String sql = """
            SELECT timestamp, open, high, low, close, volume
            FROM %s
            WHERE timestamp >= ? AND timestamp <= ?
            ORDER BY timestamp
            """.formatted(table.sqlName());

        return conn.execute(c -> {
            List<RawCandle> rows = new ArrayList<>();
            try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setLong(1, startTime);
                stmt.setLong(2, endTime);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        LocalDateTime time = LocalDateTime.ofInstant(
                            Instant.ofEpochMilli(rs.getLong("timestamp")), ZoneOffset.UTC);
                        long volume = rs.getLong("volume");
                        Long volumeOrNull = rs.wasNull() ? null : volume;
                        rows.add(RawCandle.naive(time,
                            rs.getDouble("open"),
                            rs.getDouble("high"),
                            rs.getDouble("low"),
                            rs.getDouble("close"),
                            volumeOrNull));
                    }
                }
            }
            return rows;
        });
    }

    /**
     * Row count of a table.
     */
    public int count(CandleTable table) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + table.sqlName();

        return conn.execute(c -> {
            try (PreparedStatement stmt = c.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private Candle readCandle(CandleTable table, ResultSet rs) throws SQLException {
        return new Candle(
            table.symbol(),
            rs.getLong("timestamp"),
            rs.getDouble("open"),
            rs.getDouble("high"),
            rs.getDouble("low"),
            rs.getDouble("close"),
            rs.getLong("volume")
        );
    }
}
