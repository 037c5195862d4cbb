package com.siteintel.scrape.fetch;

import com.siteintel.config.Sleeper;
import com.siteintel.scrape.model.PageRecord;
import com.siteintel.scrape.strategy.FetchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Fetches URLs in fixed-size batches. Batches run one after another with a pause in between; inside a
 * batch, stateless strategies fetch concurrently (never more than the batch size), stateful ones one by one.
 * A failed page never stops the phase; what its slot holds follows the phase's {@link PhaseErrorPolicy.FailureMode}.
 */
@Service
public class BatchFetchExecutor {
    private static final Logger log = LoggerFactory.getLogger(BatchFetchExecutor.class);
    private static final Duration TIMEOUT_GRACE = Duration.ofSeconds(1);
    private static final Duration QUEUE_POLL = Duration.ofMillis(50);

    private final ExecutorService fetchExecutor;
    private final Sleeper sleeper;

    public BatchFetchExecutor(@Qualifier("fetchExecutor") ExecutorService fetchExecutor, Sleeper sleeper) {
        this.fetchExecutor = fetchExecutor;
        this.sleeper = sleeper;
    }

    public BatchFetchOutcome fetchAll(List<String> urls, FetchStrategy strategy, BatchRequest request) {
        return fetchAll(urls, null, strategy, request);
    }

    /**
     * {@code originals}, when given, is aligned with {@code urls}. Under
     * {@link PhaseErrorPolicy.FailureMode#KEEP_ORIGINAL} a slot that yields no fresh record keeps its original;
     * under {@link PhaseErrorPolicy.FailureMode#NULL_PLACEHOLDER} it stays null.
     */
    public BatchFetchOutcome fetchAll(
        List<String> urls,
        List<PageRecord> originals,
        FetchStrategy strategy,
        BatchRequest request
    ) {
        if (originals != null && originals.size() != urls.size()) {
            throw new IllegalArgumentException("originals must align with urls: " + originals.size() + " != " + urls.size());
        }
        List<PageRecord> results = new ArrayList<>(Collections.nCopies(urls.size(), null));
        List<Integer> batchSizes = new ArrayList<>();
        PhaseErrorPolicy.Tracker tracker = request.errorPolicy().tracker();
        int batchSize = request.batchSize();
        int totalBatches = (urls.size() + batchSize - 1) / batchSize;
        int attempted = 0;
        int succeeded = 0;
        boolean aborted = false;

        for (int start = 0; start < urls.size(); start += batchSize) {
            if (request.abortSignal().isAborted()) {
                aborted = true;
                log.info("batch fetch stopped phase={} reason={} remaining={}",
                    request.errorPolicy().phase().wireName(), request.abortSignal().reason(), urls.size() - start);
                break;
            }
            if (tracker.exhausted()) {
                log.warn("batch fetch stopped phase={} failures={} maxToleratedFailures={}",
                    request.errorPolicy().phase().wireName(), tracker.failures(), request.errorPolicy().maxToleratedFailures());
                break;
            }
            if (start > 0 && request.interBatchDelayMs() > 0) {
                try {
                    sleeper.sleep(request.interBatchDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    aborted = true;
                    break;
                }
            }

            int end = Math.min(urls.size(), start + batchSize);
            List<String> batch = urls.subList(start, end);
            batchSizes.add(batch.size());
            if (strategy.stateful()) {
                for (int i = 0; i < batch.size(); i++) {
                    results.set(start + i, fetchOne(batch.get(i), strategy, request, tracker, () -> true));
                }
            } else {
                fetchConcurrently(batch, start, strategy, request, tracker, results);
            }
            attempted += batch.size();
            for (int i = start; i < end; i++) {
                if (results.get(i) != null) {
                    succeeded++;
                }
            }
            request.listener().onBatchComplete(new BatchListener.BatchProgress(
                batchSizes.size(),
                totalBatches,
                batch.size(),
                attempted,
                succeeded,
                attempted - succeeded,
                urls.size()
            ));
            log.debug("batch complete phase={} batch={}/{} size={} succeeded={}",
                request.errorPolicy().phase().wireName(), batchSizes.size(), totalBatches, batch.size(), succeeded);
        }

        Set<Integer> fetchedSlots = new TreeSet<>();
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) != null) {
                fetchedSlots.add(i);
            } else if (originals != null && request.errorPolicy().failureMode() == PhaseErrorPolicy.FailureMode.KEEP_ORIGINAL) {
                results.set(i, originals.get(i));
            }
        }

        return new BatchFetchOutcome(
            results,
            Collections.unmodifiableSet(fetchedSlots),
            List.copyOf(batchSizes),
            succeeded,
            attempted - succeeded,
            urls.size() - attempted,
            aborted
        );
    }

    /**
     * Each page gets {@code pageTimeout} plus a grace period measured from the moment its task starts, so
     * pages queued behind a slow one are not charged for the wait. A page past its limit is cancelled with
     * an interrupt to release the pool thread.
     */
    private void fetchConcurrently(
        List<String> batch,
        int offset,
        FetchStrategy strategy,
        BatchRequest request,
        PhaseErrorPolicy.Tracker tracker,
        List<PageRecord> results
    ) {
        List<PageTask> tasks = new ArrayList<>(batch.size());
        List<Future<PageRecord>> futures = new ArrayList<>(batch.size());
        for (String url : batch) {
            PageTask task = new PageTask(url, strategy, request, tracker);
            tasks.add(task);
            futures.add(fetchExecutor.submit(task));
        }
        long limitNanos = request.context().pageTimeout().plus(TIMEOUT_GRACE).toNanos();
        for (int i = 0; i < futures.size(); i++) {
            results.set(offset + i, await(tasks.get(i), futures.get(i), limitNanos, tracker));
        }
    }

    private PageRecord await(PageTask task, Future<PageRecord> future, long limitNanos, PhaseErrorPolicy.Tracker tracker) {
        while (true) {
            long waitNanos = task.started()
                ? task.startedNanos() + limitNanos - System.nanoTime()
                : QUEUE_POLL.toNanos();
            try {
                if (waitNanos <= 0L) {
                    throw new TimeoutException();
                }
                return future.get(waitNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (!task.started() || System.nanoTime() - task.startedNanos() < limitNanos) {
                    continue;
                }
                if (task.claim()) {
                    future.cancel(true);
                    tracker.recordFailure(task.url, ScrapeErrorKind.NETWORK, "page timeout");
                    return null;
                }
                // The task settled first; its result is about to be published.
                return finished(task, future, tracker);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (task.claim()) {
                    future.cancel(true);
                    tracker.recordFailure(task.url, ScrapeErrorKind.UNEXPECTED, "interrupted");
                    return null;
                }
                return finished(task, future, tracker);
            } catch (ExecutionException e) {
                tracker.recordFailure(task.url, ScrapeErrorKind.UNEXPECTED, String.valueOf(e.getCause()));
                return null;
            }
        }
    }

    private PageRecord finished(PageTask task, Future<PageRecord> future, PhaseErrorPolicy.Tracker tracker) {
        boolean interrupted = Thread.interrupted();
        try {
            return future.get();
        } catch (InterruptedException | ExecutionException | CancellationException e) {
            tracker.recordFailure(task.url, ScrapeErrorKind.UNEXPECTED, e.toString());
            return null;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * {@code claim} settles the page exactly once: either the fetch finishes first or the waiter times it out.
     * Only the winner records the outcome.
     */
    private PageRecord fetchOne(
        String url,
        FetchStrategy strategy,
        BatchRequest request,
        PhaseErrorPolicy.Tracker tracker,
        BooleanSupplier claim
    ) {
        try {
            PageRecord record = strategy.fetch(url, request.context(), request.siteMetadata());
            if (!claim.getAsBoolean()) {
                return null;
            }
            if (record == null || !record.hasContent()) {
                tracker.recordFailure(url, ScrapeErrorKind.PARSE, "empty content");
                return null;
            }
            return record;
        } catch (PageFetchException e) {
            if (claim.getAsBoolean()) {
                tracker.recordFailure(url, e.getKind(), e.getMessage());
            }
            return null;
        } catch (RuntimeException e) {
            if (claim.getAsBoolean()) {
                tracker.recordFailure(url, ScrapeErrorKind.UNEXPECTED, e.toString());
            }
            return null;
        }
    }

    private final class PageTask implements Callable<PageRecord> {
        private final String url;
        private final FetchStrategy strategy;
        private final BatchRequest request;
        private final PhaseErrorPolicy.Tracker tracker;
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile boolean started;
        private volatile long startedNanos;

        private PageTask(String url, FetchStrategy strategy, BatchRequest request, PhaseErrorPolicy.Tracker tracker) {
            this.url = url;
            this.strategy = strategy;
            this.request = request;
            this.tracker = tracker;
        }

        @Override
        public PageRecord call() {
            startedNanos = System.nanoTime();
            started = true;
            return fetchOne(url, strategy, request, tracker, this::claim);
        }

        boolean claim() {
            return settled.compareAndSet(false, true);
        }

        boolean started() {
            return started;
        }

        long startedNanos() {
            return startedNanos;
        }
    }
}
