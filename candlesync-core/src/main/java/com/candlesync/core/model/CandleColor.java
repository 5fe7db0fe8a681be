package com.candlesync.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a candle body.
 */
public enum CandleColor {
    GREEN("green"),
    RED("red"),
    DOJI("doji");

    private final String id;

    CandleColor(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static CandleColor of(double open, double close) {
        if (close > open) {
            return GREEN;
        }
        if (close < open) {
            return RED;
        }
        return DOJI;
    }

    @Override
    public String toString() {
        return id;
    }
}
