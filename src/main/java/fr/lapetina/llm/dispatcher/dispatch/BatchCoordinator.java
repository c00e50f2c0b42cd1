package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.BatchJob;
import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs a batch of independent requests on a bounded worker pool.
 *
 * Results land in a pre-sized array at each request's original index, never in completion
 * order. A failing request only fills its own slot. When the batch timeout elapses, slots
 * still empty are filled with a {@link ErrorType#BATCH_TIMEOUT} failure, the remaining
 * workers are cancelled, and whatever they produce afterwards is dropped.
 */
public final class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final Function<CallRequest, CallDispatcher> dispatcherSelector;
    private final Predicate<String> knownProvider;
    private final DispatchSettings settings;
    private final Clock clock;
    private final DispatchObserver observer;

    /**
     * @param dispatcherSelector picks the sequential dispatcher or the racer for a request
     * @param knownProvider      whether a provider id has both a pool and a provider variant
     */
    public BatchCoordinator(
            Function<CallRequest, CallDispatcher> dispatcherSelector,
            Predicate<String> knownProvider,
            DispatchSettings settings,
            Clock clock,
            DispatchObserver observer
    ) {
        this.dispatcherSelector = Objects.requireNonNull(dispatcherSelector, "Dispatcher selector is required");
        this.knownProvider = Objects.requireNonNull(knownProvider, "Provider check is required");
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.observer = observer != null ? observer : DispatchObserver.NOOP;
    }

    /**
     * Runs every request of the job and returns results index-aligned with its requests.
     *
     * @throws BatchValidationException if the job is rejected up front
     */
    public BatchResult run(BatchJob job) {
        validate(job);

        int size = job.size();
        if (size == 0) {
            return new BatchResult(List.of(), Duration.ZERO, false);
        }

        int workers = Math.min(Math.min(job.concurrencyLimit(), settings.maxParallelApiKeys()), size);
        Duration batchTimeout = settings.batchTimeout();
        long startNanos = System.nanoTime();

        log.info("Batch started: size={}, workers={}, batchTimeoutMs={}",
                size, workers, batchTimeout.toMillis());

        AtomicReferenceArray<CallResult> slots = new AtomicReferenceArray<>(size);
        ExecutorService executor = Executors.newFixedThreadPool(workers, new BatchThreadFactory("batch-worker"));
        List<Future<?>> futures = new ArrayList<>(size);

        boolean timedOut = false;
        boolean interrupted = false;
        try {
            for (int i = 0; i < size; i++) {
                int index = i;
                CallRequest request = job.requests().get(i);
                futures.add(executor.submit(() -> slots.compareAndSet(index, null, runOne(request))));
            }
            executor.shutdown();

            if (!executor.awaitTermination(batchTimeout.toNanos(), TimeUnit.NANOSECONDS)) {
                timedOut = true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = true;
        } finally {
            if (timedOut || interrupted) {
                // Claim empty slots before cancelling so late worker results cannot land
                fillPending(job, slots, interrupted);
                futures.forEach(f -> f.cancel(true));
            }
            executor.shutdownNow();
        }

        List<CallResult> results = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            results.add(slots.get(i));
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        BatchResult batchResult = new BatchResult(results, elapsed, timedOut);
        observer.onBatch(batchResult);

        if (timedOut) {
            log.warn("Batch timed out: size={}, succeeded={}, failed={}, elapsedMs={}",
                    size, batchResult.successCount(), batchResult.failureCount(), elapsed.toMillis());
        } else {
            log.info("Batch completed: size={}, succeeded={}, failed={}, elapsedMs={}",
                    size, batchResult.successCount(), batchResult.failureCount(), elapsed.toMillis());
        }
        return batchResult;
    }

    /**
     * Checks a job without side effects.
     *
     * @throws BatchValidationException describing the first problem found
     */
    public void validate(BatchJob job) {
        Objects.requireNonNull(job, "Batch job is required");
        int size = job.size();

        if (size > settings.maxBatchSize()) {
            throw new BatchValidationException(
                    "Batch size " + size + " exceeds maximum of " + settings.maxBatchSize(), size);
        }
        if (job.concurrencyLimit() < 1) {
            throw new BatchValidationException(
                    "Concurrency limit must be >= 1, got " + job.concurrencyLimit(), size);
        }
        for (int i = 0; i < size; i++) {
            CallRequest request = job.requests().get(i);
            if (request.providerId().isBlank()) {
                throw new BatchValidationException("Request " + i + " has an empty provider id", size);
            }
            if (!knownProvider.test(request.providerId())) {
                throw new BatchValidationException(
                        "Request " + i + " targets unknown provider: " + request.providerId(), size);
            }
        }
    }

    private CallResult runOne(CallRequest request) {
        try {
            return dispatcherSelector.apply(request).dispatch(request);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in batch worker: requestId={}, providerId={}",
                    request.requestId(), request.providerId(), e);
            CallResult result = CallResult.failure(request, RequestState.FAILED_NONRETRYABLE,
                    ErrorType.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    List.of(), clock.instant());
            observer.onResult(result);
            return result;
        }
    }

    private void fillPending(BatchJob job, AtomicReferenceArray<CallResult> slots, boolean interrupted) {
        ErrorType errorType = interrupted ? ErrorType.CANCELLED : ErrorType.BATCH_TIMEOUT;
        String message = interrupted
                ? "Batch interrupted before the request finished"
                : "Batch timeout of " + settings.batchTimeout().toMillis() + "ms elapsed before the request finished";

        for (int i = 0; i < slots.length(); i++) {
            CallRequest request = job.requests().get(i);
            CallResult cutOff = CallResult.failure(
                    request, RequestState.FAILED_EXHAUSTED, errorType, message, List.of(), clock.instant());
            if (slots.compareAndSet(i, null, cutOff)) {
                observer.onResult(cutOff);
                log.warn("Request cut off: requestId={}, index={}, errorType={}",
                        request.requestId(), i, errorType);
            }
        }
    }

    /**
     * Thread factory for batch workers.
     */
    private static class BatchThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        BatchThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix + "-" + POOL_COUNTER.getAndIncrement();
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
