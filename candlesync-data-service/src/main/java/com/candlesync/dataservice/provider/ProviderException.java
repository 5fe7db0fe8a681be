package com.candlesync.dataservice.provider;

/**
 * A market-data provider call failed: transport error, HTTP error, or a
 * response that could not be read.
 */
public class ProviderException extends Exception {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
