package com.eainde.safepulse.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs hand-off work (alerts, releases, incident responses) off the ingesting thread,
 * carrying the caller's MDC so downstream log lines keep their domain and lock ids.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String namePrefix) {
        this.delegate = Executors.newFixedThreadPool(threads, daemonFactory(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear(); // pooled threads must not leak context
            }
        });
    }

    public void shutdown() throws InterruptedException {
        delegate.shutdown();
        if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
            delegate.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
