package com.vidnyan.archgate.application.service;

import com.vidnyan.archgate.application.port.out.SyntaxAdapter;
import com.vidnyan.archgate.domain.model.SyntaxExtraction;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls adapters with a time bound and a bounded number of attempts.
 * An adapter that keeps timing out or throwing degrades to a parse failure for that file.
 */
@Slf4j
public class AdapterInvoker implements AutoCloseable {

    private final Duration timeout;
    private final int maxAttempts;
    private final ExecutorService executor;

    public AdapterInvoker(Duration timeout, int maxAttempts) {
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "archgate-adapter-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public SyntaxExtraction invoke(SyntaxAdapter adapter, String text, String dialectHint, String path) {
        String lastError = "no attempt made";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<SyntaxExtraction> future = executor.submit(() -> adapter.extract(text, dialectHint));
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = adapter.dialectId() + " adapter timed out after " + timeout.toMillis() + "ms";
            } catch (ExecutionException e) {
                lastError = adapter.dialectId() + " adapter failed: " + e.getCause();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return SyntaxExtraction.failed("interrupted while parsing");
            }
            log.warn("  Attempt {}/{} on {}: {}", attempt, maxAttempts, path, lastError);
        }
        return SyntaxExtraction.failed(lastError);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
