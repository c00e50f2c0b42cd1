package fr.lapetina.llm.dispatcher.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.llm.dispatcher.dispatch.DispatchService;
import fr.lapetina.llm.dispatcher.disruptor.exception.BackpressureException;
import fr.lapetina.llm.dispatcher.disruptor.handlers.CompletionHandler;
import fr.lapetina.llm.dispatcher.disruptor.handlers.DispatchHandler;
import fr.lapetina.llm.dispatcher.disruptor.handlers.MetricsHandler;
import fr.lapetina.llm.dispatcher.disruptor.handlers.ValidationHandler;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEvent;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEventFactory;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.infrastructure.config.DispatcherConfig;
import fr.lapetina.llm.dispatcher.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous submission pipeline for single calls.
 *
 * Callers publish requests into a pre-allocated ring buffer and get a future back.
 * A full ring buffer is reported at once with a {@link BackpressureException} instead of
 * queueing without bound. Events flow through:
 *
 * <pre>
 * Validation -> Dispatch (hand-off to worker pool) -> Metrics -> Completion
 * </pre>
 *
 * The ring buffer stages never block on the network: the dispatch stage hands each
 * request to a bounded worker pool that runs it through the {@link DispatchService}.
 *
 * PRODUCER TYPE: MULTI, since requests come from any caller thread.
 */
public final class DispatchPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchPipeline.class);

    private final Disruptor<CallRequestEvent> disruptor;
    private final RingBuffer<CallRequestEvent> ringBuffer;
    private final ThreadPoolExecutor workers;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ValidationHandler validationHandler;
    private final DispatchHandler dispatchHandler;

    private DispatchPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.workers = new ThreadPoolExecutor(
                builder.workerThreads,
                builder.workerThreads,
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(builder.ringBufferSize),
                new PipelineThreadFactory("dispatch-worker", true)
        );

        this.disruptor = new Disruptor<>(
                new CallRequestEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("disruptor-handler", false),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        DispatchService service = builder.dispatchService;
        this.validationHandler = new ValidationHandler(service::isKnownProvider);
        this.dispatchHandler = new DispatchHandler(service, workers, service.getClock());

        disruptor
                .handleEventsWith(validationHandler)
                .then(dispatchHandler)
                .then(new MetricsHandler(metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DispatchPipeline created: ringBufferSize={}, waitStrategy={}, workerThreads={}",
                builder.ringBufferSize, builder.waitStrategy, builder.workerThreads);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DispatchPipeline started");
        }
    }

    /**
     * Submits a request for asynchronous dispatch.
     *
     * @param request The call request
     * @return future completed with the request's terminal result
     * @throws BackpressureException if the ring buffer is full
     */
    public CompletableFuture<CallResult> submit(CallRequest request) {
        Objects.requireNonNull(request, "Request is required");
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Pipeline not running"));
        }

        CompletableFuture<CallResult> resultFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            CallRequestEvent event = ringBuffer.get(sequence);
            event.initialize(request, resultFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        log.debug("Request submitted: requestId={}, providerId={}, sequence={}",
                request.requestId(), request.providerId(), sequence);

        return resultFuture;
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops accepting requests, drains the ring buffer and lets running workers finish.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DispatchPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("DispatchPipeline shutdown timed out, halting...");
                disruptor.halt();
            }

            workers.shutdown();
            try {
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Dispatch workers did not finish in time, interrupting");
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
            log.info("DispatchPipeline shut down");
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public ValidationHandler getValidationHandler() {
        return validationHandler;
    }

    public DispatchHandler getDispatchHandler() {
        return dispatchHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for ring buffer consumers and dispatch workers.
     */
    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final boolean daemon;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix, boolean daemon) {
            this.namePrefix = namePrefix;
            this.daemon = daemon;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(daemon);
            return t;
        }
    }

    /**
     * Exception handler for Disruptor.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<CallRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, CallRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for DispatchPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int workerThreads = 8;
        private DispatchService dispatchService;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("Worker threads must be >= 1");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder dispatchService(DispatchService service) {
            this.dispatchService = service;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(DispatcherConfig config) {
            ringBufferSize(config.getPipeline().getRingBufferSize());
            this.waitStrategy = config.getPipeline().getWaitStrategy();
            workerThreads(config.getPipeline().getWorkerThreads());
            return this;
        }

        public DispatchPipeline build() {
            if (dispatchService == null) {
                throw new IllegalStateException("DispatchService is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new DispatchPipeline(this);
        }
    }
}
