package com.candlesync.dataservice.config;

import com.candlesync.core.model.MarketSymbol;
import com.candlesync.core.model.Timeframe;
import com.candlesync.dataservice.data.HttpClientFactory;
import com.candlesync.dataservice.data.sqlite.CandleTable;
import com.candlesync.dataservice.report.TableFormatter;
import com.candlesync.dataservice.sync.ConflictPolicy;
import com.candlesync.dataservice.sync.GapFillPolicy;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for the candle sync and import processes.
 * Read from a YAML file; every option has a default so an absent file is valid.
 *
 * Lookup order for the file: system property {@code candlesync.config},
 * env {@code CANDLESYNC_CONFIG}, then {@code ./candlesync.yaml}.
 * The data directory can be overridden separately with {@code candlesync.data.dir}
 * / {@code CANDLESYNC_DATA_DIR}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncConfig.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_CONFIG_FILE = "candlesync.yaml";
    private static final String DEFAULT_DATA_DIR = System.getProperty("user.home") + "/.candlesync";

    private String dataDir = DEFAULT_DATA_DIR;
    private String targetSchema = "fronttest";
    private String secondarySchema = "public";
    private List<MarketSymbol> symbols = new ArrayList<>(List.of(MarketSymbol.values()));
    private List<Timeframe> timeframes = new ArrayList<>(List.of(
        Timeframe.M1, Timeframe.M5, Timeframe.M15, Timeframe.M30, Timeframe.H1, Timeframe.D1));
    private long stalenessToleranceSeconds = 90;
    private long providerTimeoutSeconds = HttpClientFactory.DEFAULT_TIMEOUT.getSeconds();
    private double defaultMatchThreshold = 0.01;
    private Map<String, Double> matchThresholds = new LinkedHashMap<>(Map.of(
        "es", 0.25,
        "eurusd", 0.0005,
        "spy", 0.1));
    private Map<String, String> providerTickers = new LinkedHashMap<>(Map.of(
        "es", "ES=F",
        "eurusd", "EURUSD=X",
        "spy", "SPY"));
    private String conflictPolicy = "prefer-provider";
    private String gapFill = "always";
    private int parallelism = 1;
    private String reportFormat = "plain";
    private Map<String, String> importDocuments = defaultImportDocuments();

    public SyncConfig() {
    }

    private static Map<String, String> defaultImportDocuments() {
        // backtest first, as the loader imports in map order
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("backtest", "backtest_data.json");
        documents.put("fronttest", "fronttest_data.json");
        return documents;
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getTargetSchema() { return targetSchema; }
    public void setTargetSchema(String targetSchema) { this.targetSchema = targetSchema; }

    public String getSecondarySchema() { return secondarySchema; }
    public void setSecondarySchema(String secondarySchema) { this.secondarySchema = secondarySchema; }

    public List<MarketSymbol> getSymbols() { return symbols; }
    public void setSymbols(List<MarketSymbol> symbols) { this.symbols = symbols; }

    public List<Timeframe> getTimeframes() { return timeframes; }
    public void setTimeframes(List<Timeframe> timeframes) { this.timeframes = timeframes; }

    public long getStalenessToleranceSeconds() { return stalenessToleranceSeconds; }
    public void setStalenessToleranceSeconds(long stalenessToleranceSeconds) { this.stalenessToleranceSeconds = stalenessToleranceSeconds; }

    public long getProviderTimeoutSeconds() { return providerTimeoutSeconds; }
    public void setProviderTimeoutSeconds(long providerTimeoutSeconds) { this.providerTimeoutSeconds = providerTimeoutSeconds; }

    public double getDefaultMatchThreshold() { return defaultMatchThreshold; }
    public void setDefaultMatchThreshold(double defaultMatchThreshold) { this.defaultMatchThreshold = defaultMatchThreshold; }

    public Map<String, Double> getMatchThresholds() { return matchThresholds; }
    public void setMatchThresholds(Map<String, Double> matchThresholds) { this.matchThresholds = matchThresholds; }

    public Map<String, String> getProviderTickers() { return providerTickers; }
    public void setProviderTickers(Map<String, String> providerTickers) { this.providerTickers = providerTickers; }

    public String getConflictPolicy() { return conflictPolicy; }
    public void setConflictPolicy(String conflictPolicy) { this.conflictPolicy = conflictPolicy; }

    public String getGapFill() { return gapFill; }
    public void setGapFill(String gapFill) { this.gapFill = gapFill; }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }

    public String getReportFormat() { return reportFormat; }
    public void setReportFormat(String reportFormat) { this.reportFormat = reportFormat; }

    public Map<String, String> getImportDocuments() { return importDocuments; }
    public void setImportDocuments(Map<String, String> importDocuments) { this.importDocuments = importDocuments; }

    @JsonIgnore
    public Path getDataPath() {
        String path = dataDir;
        if (path.startsWith("~")) {
            path = System.getProperty("user.home") + path.substring(1);
        }
        return Paths.get(path);
    }

    @JsonIgnore
    public Duration getStalenessTolerance() {
        return Duration.ofSeconds(stalenessToleranceSeconds);
    }

    @JsonIgnore
    public Duration getProviderTimeout() {
        return Duration.ofSeconds(providerTimeoutSeconds);
    }

    /**
     * Absolute open/close tolerance for the boundary candle check.
     */
    public double thresholdFor(MarketSymbol symbol) {
        Double threshold = matchThresholds.get(symbol.getId());
        return threshold != null ? threshold : defaultMatchThreshold;
    }

    /**
     * Ticker the chart provider knows the symbol by; falls back to the upper-cased id.
     */
    public String tickerFor(MarketSymbol symbol) {
        String ticker = providerTickers.get(symbol.getId());
        return ticker != null ? ticker : symbol.getId().toUpperCase(Locale.ROOT);
    }

    /**
     * Reject values that would only fail later, mid-run.
     */
    public SyncConfig validate() {
        CandleTable.requireValidSchema(targetSchema);
        CandleTable.requireValidSchema(secondarySchema);
        importDocuments.keySet().forEach(CandleTable::requireValidSchema);
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol must be configured");
        }
        if (timeframes == null || timeframes.isEmpty()) {
            throw new IllegalArgumentException("At least one timeframe must be configured");
        }
        if (stalenessToleranceSeconds < 0) {
            throw new IllegalArgumentException("stalenessToleranceSeconds must be >= 0");
        }
        if (providerTimeoutSeconds < 1) {
            throw new IllegalArgumentException("providerTimeoutSeconds must be >= 1");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        ConflictPolicy.named(conflictPolicy);
        GapFillPolicy.named(gapFill);
        TableFormatter.named(reportFormat);
        for (Map.Entry<String, Double> entry : matchThresholds.entrySet()) {
            MarketSymbol.fromId(entry.getKey());
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("Invalid match threshold for " + entry.getKey());
            }
        }
        return this;
    }

    /**
     * Load from the configured location, applying the data dir override.
     */
    public static SyncConfig load() throws IOException {
        String configFile = System.getProperty("candlesync.config",
            System.getenv().getOrDefault("CANDLESYNC_CONFIG", DEFAULT_CONFIG_FILE));
        SyncConfig config = load(Paths.get(configFile));

        String dataDirOverride = System.getProperty("candlesync.data.dir", System.getenv("CANDLESYNC_DATA_DIR"));
        if (dataDirOverride != null && !dataDirOverride.isBlank()) {
            config.setDataDir(dataDirOverride);
        }
        return config.validate();
    }

    public static SyncConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.info("No config file at {}, using defaults", path.toAbsolutePath());
            return new SyncConfig().validate();
        }
        log.info("Loading config from {}", path.toAbsolutePath());
        return YAML.readValue(path.toFile(), SyncConfig.class).validate();
    }
}
