package com.candlesync.dataservice.data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds the HTTP client used for provider calls and holds the shared JSON mapper
 * used for chart responses and dump documents.
 */
public final class HttpClientFactory {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final ConnectionPool PROVIDER_POOL = new ConnectionPool(4, 5, TimeUnit.MINUTES);

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private HttpClientFactory() {
    }

    /**
     * Client for provider calls. Every request carries the given User-Agent.
     * Retries are off: a failed call fails the pair and the next run picks it up.
     */
    public static OkHttpClient providerClient(Duration timeout, String userAgent) {
        return new OkHttpClient.Builder()
            .connectionPool(PROVIDER_POOL)
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .callTimeout(timeout.multipliedBy(2))
            .retryOnConnectionFailure(false)
            .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                .header("User-Agent", userAgent)
                .build()))
            .build();
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
