package com.candlesync.dataservice.importer;

import java.nio.file.Path;

/**
 * Outcome of importing one dump document.
 */
public record ImportResult(Path document, String schema, boolean success, int tables, int rows, String message) {

    public static ImportResult failed(Path document, String schema, String message) {
        return new ImportResult(document, schema, false, 0, 0, message);
    }
}
