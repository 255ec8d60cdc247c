package com.crypto.connector.common.exchange.impl;

import com.crypto.connector.common.model.ExchangeApiException;
import com.crypto.connector.common.model.ExchangeConnectivityException;
import com.crypto.connector.common.model.ExchangeException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries idempotent reads on rate limits, server errors and connectivity failures with
 * exponential backoff. Order placement and cancellation must not go through here.
 */
@Slf4j
public class ExchangeHttpClient {
    private final int maxAttempts;
    private final Duration initialBackoff;

    public ExchangeHttpClient(int maxAttempts, Duration initialBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
    }

    public <T> T executeWithRetry(Supplier<T> call) {
        int attempt = 0;
        long backoffMillis = initialBackoff.toMillis();
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (ExchangeException ex) {
                if (attempt >= maxAttempts || !isRetryable(ex)) {
                    throw ex;
                }
                LOG.warn("attempt {}/{} failed, retrying in {}ms: {}", attempt, maxAttempts, backoffMillis,
                        ex.getUserMessage());
                sleep(backoffMillis);
                backoffMillis *= 2;
            }
        }
    }

    static boolean isRetryable(ExchangeException ex) {
        if (ex instanceof ExchangeApiException api) {
            return api.isRetryable();
        }
        return ex instanceof ExchangeConnectivityException;
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Retry interrupted", ie);
        }
    }
}
