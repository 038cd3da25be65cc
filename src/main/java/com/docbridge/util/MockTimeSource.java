package com.docbridge.util;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Time source that only moves when told to.
 */
public final class MockTimeSource implements TimeSource {
    private final AtomicReference<Instant> instant;

    public MockTimeSource(Instant initialInstant) {
        this.instant = new AtomicReference<>(Objects.requireNonNull(initialInstant, "initialInstant must not be null"));
    }

    @Override
    public Instant now() {
        return instant.get();
    }

    public void advance(Duration duration) {
        instant.updateAndGet(i -> i.plus(duration));
    }

    public void setInstant(Instant instant) {
        this.instant.set(Objects.requireNonNull(instant, "instant must not be null"));
    }
}
