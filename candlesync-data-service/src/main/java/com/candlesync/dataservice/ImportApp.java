package com.candlesync.dataservice;

import com.candlesync.dataservice.config.SyncConfig;
import com.candlesync.dataservice.data.HttpClientFactory;
import com.candlesync.dataservice.data.sqlite.SqliteConnection;
import com.candlesync.dataservice.data.sqlite.dao.CandleDao;
import com.candlesync.dataservice.importer.ImportResult;
import com.candlesync.dataservice.importer.JsonDumpImporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Bulk loader - imports the configured JSON dumps from the working directory.
 *
 * Exit code 0 when every document imported, 1 otherwise.
 */
public class ImportApp {
    private static final Logger LOG = LoggerFactory.getLogger(ImportApp.class);

    public static void main(String[] args) {
        LOG.info("Starting dump import...");
        int exitCode;
        try {
            exitCode = run(SyncConfig.load(), Paths.get(""));
        } catch (Exception e) {
            LOG.error("Dump import failed to start", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(SyncConfig config, Path baseDir) throws Exception {
        Files.createDirectories(config.getDataPath());

        try (SqliteConnection conn = new SqliteConnection(config.getDataPath(), config.getImportDocuments().keySet())) {
            JsonDumpImporter importer = new JsonDumpImporter(conn, new CandleDao(conn), HttpClientFactory.getMapper());
            List<ImportResult> results = importer.importAll(baseDir, config.getImportDocuments());

            boolean allImported = true;
            for (ImportResult result : results) {
                if (result.success()) {
                    LOG.info("{} -> {}: {} rows in {} tables", result.document().getFileName(), result.schema(),
                        result.rows(), result.tables());
                } else {
                    LOG.error("{} -> {}: FAILED ({})", result.document().getFileName(), result.schema(), result.message());
                    allImported = false;
                }
            }
            return allImported ? 0 : 1;
        }
    }
}
