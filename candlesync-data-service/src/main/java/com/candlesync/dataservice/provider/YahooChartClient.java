package com.candlesync.dataservice.provider;

import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.RawCandle;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.data.HttpClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Yahoo Finance chart API client.
 * Uses the public chart endpoint (no authentication required).
 *
 * API Endpoint: GET /v8/finance/chart/{ticker}?interval=..&range=.. (or &period1=..&period2=..)
 * Bars come back as parallel arrays; a bar with any null price is dropped,
 * a null volume is passed on as unavailable.
 *
 * Full history is {@code range=max} for daily bars only. Intraday bars are
 * served for a limited lookback, so history for those is requested as an
 * explicit window ending now: 7 days of 1m, 60 days of 2m to 30m, 730 days of 60m.
 * A response whose granularity differs from the requested interval is rejected.
 */
public class YahooChartClient implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooChartClient.class);

    public static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; candlesync)";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl baseUrl;
    private final Function<MarketSymbol, String> tickers;
    private final Clock clock;

    public YahooChartClient(Function<MarketSymbol, String> tickers, Duration timeout) {
        this(DEFAULT_BASE_URL, tickers, timeout);
    }

    public YahooChartClient(String baseUrl, Function<MarketSymbol, String> tickers, Duration timeout) {
        this(baseUrl, tickers, timeout, Clock.systemUTC());
    }

    YahooChartClient(String baseUrl, Function<MarketSymbol, String> tickers, Duration timeout, Clock clock) {
        this.client = HttpClientFactory.providerClient(timeout, USER_AGENT);
        this.mapper = HttpClientFactory.getMapper();
        this.baseUrl = HttpUrl.get(baseUrl);
        this.tickers = tickers;
        this.clock = clock;
    }

    /**
     * Latest bar from a short window: one month for daily bars, five days otherwise.
     */
    @Override
    public RawCandle fetchLatest(MarketSymbol symbol, Timeframe timeframe) throws ProviderException {
        String range = timeframe.isDaily() ? "1mo" : "5d";
        String interval = requireInterval(timeframe);
        List<RawCandle> bars = fetchChart(symbol, interval, chartUrl(symbol, interval)
            .addQueryParameter("range", range));
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    @Override
    public List<RawCandle> fetchHistory(MarketSymbol symbol, Timeframe timeframe) throws ProviderException {
        String interval = requireInterval(timeframe);
        HttpUrl.Builder url = chartUrl(symbol, interval);
        Duration lookback = intradayLookback(interval);
        if (lookback == null) {
            url.addQueryParameter("range", "max");
        } else {
            Instant end = clock.instant();
            url.addQueryParameter("period1", Long.toString(end.minus(lookback).getEpochSecond()))
                .addQueryParameter("period2", Long.toString(end.getEpochSecond()));
        }
        return fetchChart(symbol, interval, url);
    }

    /**
     * Longest window the chart API serves for an intraday interval, null for daily and coarser.
     */
    static Duration intradayLookback(String interval) {
        switch (interval) {
            case "1m":
                return Duration.ofDays(7);
            case "2m":
            case "5m":
            case "15m":
            case "30m":
            case "90m":
                return Duration.ofDays(60);
            case "60m":
            case "1h":
                return Duration.ofDays(730);
            default:
                return null;
        }
    }

    private static String requireInterval(Timeframe timeframe) throws ProviderException {
        String interval = timeframe.getProviderInterval();
        if (interval == null) {
            throw new ProviderException("Provider has no " + timeframe + " bars");
        }
        return interval;
    }

    private HttpUrl.Builder chartUrl(MarketSymbol symbol, String interval) {
        return baseUrl.newBuilder()
            .addPathSegments("v8/finance/chart")
            .addPathSegment(tickers.apply(symbol))
            .addQueryParameter("interval", interval)
            .addQueryParameter("includePrePost", "false");
    }

    private List<RawCandle> fetchChart(MarketSymbol symbol, String interval, HttpUrl.Builder urlBuilder)
            throws ProviderException {
        String ticker = tickers.apply(symbol);
        HttpUrl url = urlBuilder.build();

        Request request = new Request.Builder()
            .url(url)
            .get()
            .build();

        log.debug("Fetching {} bars for {} ({}): {}", interval, symbol, ticker, url);

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ProviderException("Chart API error for " + ticker + ": "
                    + response.code() + " " + response.message() + " - " + body);
            }
            return parseChart(mapper.readTree(body), interval);
        } catch (IOException e) {
            throw new ProviderException("Chart request failed for " + ticker + ": " + e.getMessage(), e);
        }
    }

    /**
     * Convert a chart response into raw bars, in response order.
     */
    List<RawCandle> parseChart(JsonNode root, String interval) throws ProviderException {
        JsonNode chart = root.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ProviderException("Chart API returned error: " + error.path("description").asText(error.toString()));
        }

        JsonNode results = chart.path("result");
        if (!results.isArray() || results.isEmpty()) {
            return List.of();
        }

        JsonNode result = results.get(0);
        String granularity = result.path("meta").path("dataGranularity").asText(null);
        if (granularity != null && !sameGranularity(interval, granularity)) {
            throw new ProviderException("Requested " + interval + " bars but chart API returned "
                + granularity + " granularity");
        }
        ZoneId zone = parseZone(result.path("meta").path("exchangeTimezoneName").asText(null));
        JsonNode timestamps = result.path("timestamp");
        JsonNode quote = result.path("indicators").path("quote").path(0);
        if (!timestamps.isArray() || quote.isMissingNode()) {
            return List.of();
        }

        List<RawCandle> bars = new ArrayList<>(timestamps.size());
        int dropped = 0;
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode open = quote.path("open").path(i);
            JsonNode high = quote.path("high").path(i);
            JsonNode low = quote.path("low").path(i);
            JsonNode close = quote.path("close").path(i);
            if (!open.isNumber() || !high.isNumber() || !low.isNumber() || !close.isNumber()) {
                dropped++;
                continue;
            }
            JsonNode volume = quote.path("volume").path(i);

            bars.add(RawCandle.at(
                Instant.ofEpochSecond(timestamps.get(i).asLong()),
                zone,
                open.asDouble(),
                high.asDouble(),
                low.asDouble(),
                close.asDouble(),
                volume.isNumber() ? volume.asLong() : null));
        }

        if (dropped > 0) {
            log.debug("Dropped {} bars without prices", dropped);
        }
        return bars;
    }

    private static boolean sameGranularity(String requested, String returned) {
        if (requested.equals(returned)) {
            return true;
        }
        return isHourly(requested) && isHourly(returned);
    }

    private static boolean isHourly(String interval) {
        return "60m".equals(interval) || "1h".equals(interval);
    }

    private static ZoneId parseZone(String name) {
        if (name == null || name.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(name);
        } catch (DateTimeException e) {
            log.warn("Unknown exchange time zone '{}', reading bars as UTC", name);
            return ZoneOffset.UTC;
        }
    }
}
