package com.candlesync.dataservice.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON dump layout: {@code {"tables":[{"table":"es_1m","rows":[...]}, ...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DumpDocument(List<DumpTable> tables) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DumpTable(String table, List<DumpRow> rows) {
    }

    /**
     * One exported row. {@code timestamp} is ISO-8601, with or without an offset.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DumpRow(
        String symbol,
        String timestamp,
        Double open,
        Double high,
        Double low,
        Double close,
        Long volume,
        @JsonProperty("candle_color") String candleColor
    ) {
    }
}
