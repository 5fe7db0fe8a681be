package com.candlesync.dataservice.data.sqlite;

import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.Timeframe;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier of one candle table, {@code <schema>.<symbol>_<timeframe>}.
 *
 * Table names are never taken from outside as strings: symbol and timeframe
 * come from closed enums and the schema is checked against a strict pattern,
 * so {@link #sqlName()} is safe to splice into a statement.
 */
public record CandleTable(String schema, MarketSymbol symbol, Timeframe timeframe) {

    private static final Pattern SCHEMA_PATTERN = Pattern.compile("[a-z_][a-z0-9_]*");
    private static final Set<String> RESERVED_SCHEMAS = Set.of("main", "temp");

    public CandleTable {
        requireValidSchema(schema);
        if (symbol == null || timeframe == null) {
            throw new IllegalArgumentException("Symbol and timeframe are required");
        }
    }

    public static String requireValidSchema(String schema) {
        if (schema == null || !SCHEMA_PATTERN.matcher(schema).matches() || RESERVED_SCHEMAS.contains(schema)) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        return schema;
    }

    /**
     * Resolve a short table name such as {@code es_1m}. Empty when the name
     * does not denote a known (symbol, timeframe) pair.
     */
    public static Optional<CandleTable> parse(String schema, String shortName) {
        if (shortName == null) {
            return Optional.empty();
        }
        String name = shortName.trim().toLowerCase(Locale.ROOT);
        int sep = name.lastIndexOf('_');
        if (sep <= 0 || sep == name.length() - 1) {
            return Optional.empty();
        }
        try {
            MarketSymbol symbol = MarketSymbol.fromId(name.substring(0, sep));
            Timeframe timeframe = Timeframe.fromId(name.substring(sep + 1));
            return Optional.of(new CandleTable(schema, symbol, timeframe));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String shortName() {
        return symbol.getId() + "_" + timeframe.getId();
    }

    public String displayName() {
        return schema + "." + shortName();
    }

    /**
     * Quoted, schema-qualified identifier for use in SQL.
     */
    public String sqlName() {
        return "\"" + schema + "\".\"" + shortName() + "\"";
    }

    @Override
    public String toString() {
        return displayName();
    }
}
