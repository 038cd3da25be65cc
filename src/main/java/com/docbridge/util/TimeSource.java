package com.docbridge.util;

import java.time.Instant;

/**
 * Wall clock used for server-side timestamps such as {@code _ts}.
 * Injected into transports so tests can pin time.
 */
public sealed interface TimeSource permits SystemTimeSource, MockTimeSource {

    Instant now();

    /**
     * Current time as whole seconds since the epoch.
     */
    default long epochSeconds() {
        return now().getEpochSecond();
    }

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    /**
     * Returns a controllable time source starting at the given instant.
     */
    static MockTimeSource mockAt(Instant instant) {
        return new MockTimeSource(instant);
    }
}
