package io.durableproxy.server;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used by the proxy. Pump threads block on upstream reads, so the pool is unbounded.
 */
public final class ProxyExecutors {
    private ProxyExecutors() {
    }

    public static ExecutorService newPumpExecutor(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        return Executors.newCachedThreadPool(new NamedThreadFactory(namePrefix));
    }

    public static ScheduledExecutorService newTimer(String namePrefix) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        return Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory(namePrefix));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
