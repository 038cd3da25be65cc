package com.docbridge.adapter.mongodb;

import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandSucceededEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * MongoDB {@link CommandListener} that logs failed commands and commands slower than
 * a threshold, and keeps simple counters.
 */
public class CommandLoggingListener implements CommandListener {

    private static final Logger log = LoggerFactory.getLogger(CommandLoggingListener.class);

    private final Duration slowThreshold;
    private final AtomicLong completedCommands = new AtomicLong();
    private final AtomicLong failedCommands = new AtomicLong();
    private final AtomicLong slowCommands = new AtomicLong();

    public CommandLoggingListener(Duration slowThreshold) {
        this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold must not be null");
    }

    @Override
    public void commandSucceeded(CommandSucceededEvent event) {
        completedCommands.incrementAndGet();
        long elapsedNanos = event.getElapsedTime(TimeUnit.NANOSECONDS);
        if (elapsedNanos >= slowThreshold.toNanos()) {
            slowCommands.incrementAndGet();
            log.warn("Slow MongoDB command {} (request {}) took {} ms", event.getCommandName(),
                    event.getRequestId(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        } else if (log.isTraceEnabled()) {
            log.trace("MongoDB command {} took {} us", event.getCommandName(),
                    TimeUnit.NANOSECONDS.toMicros(elapsedNanos));
        }
    }

    @Override
    public void commandFailed(CommandFailedEvent event) {
        failedCommands.incrementAndGet();
        log.warn("MongoDB command {} (request {}) failed after {} ms: {}", event.getCommandName(),
                event.getRequestId(), event.getElapsedTime(TimeUnit.MILLISECONDS),
                event.getThrowable().getMessage());
    }

    public Duration getSlowThreshold() {
        return slowThreshold;
    }

    public long getCompletedCommandCount() {
        return completedCommands.get();
    }

    public long getFailedCommandCount() {
        return failedCommands.get();
    }

    public long getSlowCommandCount() {
        return slowCommands.get();
    }
}
