package com.docbridge.bridge;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads backing the {@link ExecutionBridge}: an elastic pool on which collaborator
 * calls run, and a fixed-size dispatcher serving the asynchronous facade.
 * All threads are daemons and live until the JVM exits.
 */
public final class BridgeRuntime {

    static final class DaemonThreadFactory implements ThreadFactory {
        private final ThreadFactory factory = Executors.defaultThreadFactory();
        private final AtomicInteger threadCount = new AtomicInteger();
        private final String prefix;

        DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = factory.newThread(r);
            t.setName(prefix + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    private final ExecutorService runtime;
    private final ExecutorService dispatcher;
    private final BridgeSettings settings;

    BridgeRuntime(ExecutorService runtime, ExecutorService dispatcher, BridgeSettings settings) {
        this.runtime = runtime;
        this.dispatcher = dispatcher;
        this.settings = settings;
    }

    public static BridgeRuntime create(BridgeSettings settings) {
        ExecutorService runtime = Executors.newCachedThreadPool(
                new DaemonThreadFactory(settings.threadPrefix() + "-runtime"));
        ExecutorService dispatcher = Executors.newFixedThreadPool(settings.dispatcherThreads(),
                new DaemonThreadFactory(settings.threadPrefix() + "-dispatch"));
        return new BridgeRuntime(runtime, dispatcher, settings);
    }

    Executor runtime() {
        return runtime;
    }

    Executor dispatcher() {
        return dispatcher;
    }

    public BridgeSettings settings() {
        return settings;
    }
}
