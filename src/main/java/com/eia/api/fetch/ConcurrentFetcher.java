package com.eia.api.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReferenceArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eia.api.clients.EiaTransport;
import com.eia.api.exceptions.EiaApiException;
import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.exceptions.TransportFailureException;
import com.eia.api.query.Endpoint;

/**
 * Fetches one row set per endpoint on a bounded thread pool.
 * <p>
 * Each worker writes its result into the slot of its endpoint index, so the output
 * is in endpoint order whatever the completion order. The first failure cancels the
 * query: tasks that have not started yet return without issuing a request, tasks
 * already in flight drain and their results are discarded, and the failure is
 * rethrown to the caller.
 */
public class ConcurrentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentFetcher.class);

    private static final int SKIPPED = -1;

    private final EiaTransport transport;
    private final int concurrency;
    private final RetryPolicy retryPolicy;

    public ConcurrentFetcher(EiaTransport transport, int concurrency) {
        this(transport, concurrency, RetryPolicy.none());
    }

    public ConcurrentFetcher(EiaTransport transport, int concurrency, RetryPolicy retryPolicy) {
        if (concurrency <= 0) {
            throw new InvalidArgumentException("Concurrency must be positive, got: " + concurrency);
        }
        this.transport = transport;
        this.concurrency = concurrency;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * @return one row set per endpoint, in endpoint order
     * @throws TransportFailureException for the first chunk that failed
     */
    public List<RawRowSet> fetchAll(List<Endpoint> endpoints, String apiKey) {
        if (endpoints == null || endpoints.isEmpty()) {
            return Collections.emptyList();
        }

        int total = endpoints.size();
        int threadCount = Math.min(total, concurrency);
        AtomicReferenceArray<RawRowSet> slots = new AtomicReferenceArray<>(total);
        AtomicBoolean cancelled = new AtomicBoolean(false);

        logger.debug("Fetching {} chunk(s) with {} worker(s)", total, threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);

        try {
            for (int i = 0; i < total; i++) {
                final int index = i;
                final Endpoint endpoint = endpoints.get(i);
                Callable<Integer> task = () -> fetchChunk(index, endpoint, apiKey, slots, cancelled);
                completion.submit(task);
            }

            for (int completed = 1; completed <= total; completed++) {
                Future<Integer> future = completion.take();
                try {
                    int index = future.get();
                    if (completed % 5 == 0 || completed == total) {
                        logger.debug("Chunk progress: {} of {} complete (last finished: #{})",
                                completed, total, index);
                    }
                } catch (ExecutionException e) {
                    cancelled.set(true);
                    throw propagate(e.getCause());
                }
            }
        } catch (InterruptedException e) {
            cancelled.set(true);
            Thread.currentThread().interrupt();
            throw new TransportFailureException("Interrupted while waiting for chunk requests",
                    TransportFailureException.NO_STATUS, null, e);
        } finally {
            executor.shutdown();
            awaitDrain(executor);
        }

        List<RawRowSet> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            results.add(slots.get(i));
        }
        return Collections.unmodifiableList(results);
    }

    private int fetchChunk(int index, Endpoint endpoint, String apiKey,
            AtomicReferenceArray<RawRowSet> slots, AtomicBoolean cancelled) throws InterruptedException {
        int attempt = 0;
        while (true) {
            if (cancelled.get()) {
                logger.debug("Skipping chunk #{}: query already failed", index);
                return SKIPPED;
            }
            attempt++;
            try {
                List<Map<String, Object>> rows = transport.getRows(endpoint.getUrl(), apiKey);
                slots.set(index, new RawRowSet(index, endpoint.getUrl(), rows));
                logger.debug("Chunk #{} returned {} rows", index, rows == null ? 0 : rows.size());
                return index;
            } catch (TransportFailureException e) {
                if (!retryPolicy.shouldRetry(e, attempt) || cancelled.get()) {
                    cancelled.set(true);
                    throw e;
                }
                Duration backoff = retryPolicy.backoffAfter(attempt);
                logger.warn("Chunk #{} attempt {}/{} failed ({}), retrying in {} ms",
                        index, attempt, retryPolicy.getMaxAttempts(), e.getMessage(), backoff.toMillis());
                Thread.sleep(backoff.toMillis());
            } catch (RuntimeException e) {
                cancelled.set(true);
                throw e;
            }
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof EiaApiException) {
            return (EiaApiException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        if (cause instanceof InterruptedException) {
            return new TransportFailureException("Chunk request interrupted",
                    TransportFailureException.NO_STATUS, null, cause);
        }
        return new EiaApiException("Chunk request failed: " + cause.getMessage(), cause);
    }

    private static void awaitDrain(ExecutorService executor) {
        try {
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.debug("Waiting for in-flight chunk requests to drain");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
