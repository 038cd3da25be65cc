package com.docbridge.util;

import java.time.Instant;

/**
 * Time source backed by the system clock.
 */
public final class SystemTimeSource implements TimeSource {
    static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private SystemTimeSource() {}

    @Override
    public Instant now() {
        return Instant.now();
    }
}
