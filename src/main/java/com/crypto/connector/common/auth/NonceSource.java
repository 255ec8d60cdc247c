package com.crypto.connector.common.auth;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Millisecond nonces that never repeat or go backwards, even when several requests
 * are signed within the same millisecond.
 */
public class NonceSource {
    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public NonceSource(Clock clock) {
        this.clock = clock;
    }

    public long next() {
        long now = clock.millis();
        return last.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
