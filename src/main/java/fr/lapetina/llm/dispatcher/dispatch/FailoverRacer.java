package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.CallAttempt;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.ProviderResponse;
import fr.lapetina.llm.dispatcher.domain.model.RequestState;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import fr.lapetina.llm.dispatcher.pool.CredentialPools;
import fr.lapetina.llm.dispatcher.pool.PoolExhaustedException;
import fr.lapetina.llm.dispatcher.provider.CallContext;
import fr.lapetina.llm.dispatcher.provider.ProviderCall;
import fr.lapetina.llm.dispatcher.provider.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Fast-failover mode: the same request goes to several distinct credentials at once and
 * the first success wins.
 *
 * Losing attempts are cancelled through their token and future. Cancellation is advisory,
 * so a loser may still finish; anything that settles after the race is decided is discarded
 * and never reported to the pool. Failures that settle before the decision are reported,
 * so unhealthy keys are still quarantined in race mode.
 */
public final class FailoverRacer implements CallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FailoverRacer.class);

    // Slack on top of the call timeout before the racer stops waiting for its own attempts
    private static final Duration SETTLE_GRACE = Duration.ofSeconds(1);

    private final CredentialPools pools;
    private final ProviderRegistry providers;
    private final DispatchSettings settings;
    private final Clock clock;
    private final DispatchObserver observer;

    public FailoverRacer(
            CredentialPools pools,
            ProviderRegistry providers,
            DispatchSettings settings,
            Clock clock,
            DispatchObserver observer
    ) {
        this.pools = Objects.requireNonNull(pools, "Pools are required");
        this.providers = Objects.requireNonNull(providers, "Providers are required");
        this.settings = Objects.requireNonNull(settings, "Settings are required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.observer = observer != null ? observer : DispatchObserver.NOOP;
    }

    @Override
    public CallResult dispatch(CallRequest request) {
        return race(request);
    }

    /**
     * Races the request over up to {@code min(maxParallelApiKeys, healthy)} credentials.
     */
    public CallResult race(CallRequest request) {
        CredentialPool pool = pools.require(request.providerId());
        ProviderCall provider = providers.require(request.providerId());

        int fanOut = Math.max(1, Math.min(settings.maxParallelApiKeys(), pool.healthyCount()));
        List<Credential> credentials;
        try {
            credentials = pool.acquireDistinct(fanOut);
        } catch (PoolExhaustedException e) {
            log.warn("Race not started, pool exhausted: requestId={}, providerId={}",
                    request.requestId(), request.providerId());
            return finish(CallResult.poolExhausted(request, List.of(), clock.instant()));
        }

        Duration timeout = settings.timeoutFor(request, 1);
        Race race = new Race(request, pool, credentials.size());

        log.info("Race started: requestId={}, providerId={}, credentials={}, timeoutMs={}",
                request.requestId(), request.providerId(),
                credentials.stream().map(Credential::getId).collect(Collectors.joining(",")),
                timeout.toMillis());

        for (int i = 0; i < credentials.size(); i++) {
            race.launch(provider, credentials.get(i), i + 1, timeout);
        }

        try {
            return finish(race.outcome.get(timeout.plus(SETTLE_GRACE).toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            // Every attempt carries its own timeout, so this only trips on a misbehaving provider
            return finish(race.settle(RequestState.FAILED_EXHAUSTED, ErrorType.TIMEOUT,
                    "Race did not settle within " + timeout.plus(SETTLE_GRACE).toMillis() + "ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Race interrupted: requestId={}", request.requestId());
            return finish(race.settle(RequestState.FAILED_EXHAUSTED, ErrorType.CANCELLED, "Race interrupted"));
        } catch (ExecutionException e) {
            log.error("Race failed unexpectedly: requestId={}", request.requestId(), e);
            return finish(race.settle(RequestState.FAILED_EXHAUSTED, ErrorType.INTERNAL_ERROR,
                    ErrorClassifier.message(e)));
        } finally {
            race.cancelRemaining();
        }
    }

    private CallResult finish(CallResult result) {
        observer.onResult(result);
        return result;
    }

    /**
     * Shared state of one race. Settlement and attempt recording are serialized on the
     * race's monitor; pool reporting happens under it too, and the pool never calls back.
     */
    private final class Race {

        private final CallRequest request;
        private final CredentialPool pool;
        private final CompletableFuture<CallResult> outcome = new CompletableFuture<>();
        private final List<CallAttempt> attempts = new ArrayList<>();
        private final List<Runnable> cancellers = new ArrayList<>();
        private int pending;

        Race(CallRequest request, CredentialPool pool, int size) {
            this.request = request;
            this.pool = pool;
            this.pending = size;
        }

        void launch(ProviderCall provider, Credential credential, int attemptNumber, Duration timeout) {
            if (outcome.isDone()) {
                return;
            }
            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();
            CallContext context = CallContext.start(attemptNumber, timeout, startedAt);
            AtomicBoolean settled = new AtomicBoolean(false);

            CompletableFuture<ProviderResponse> future;
            try {
                future = provider.call(request, credential, context)
                        .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }

            CompletableFuture<ProviderResponse> attempt = future;
            synchronized (this) {
                cancellers.add(() -> {
                    context.token().cancel();
                    attempt.cancel(true);
                });
            }

            attempt.whenComplete((response, throwable) -> {
                if (!settled.compareAndSet(false, true)) {
                    return;
                }
                Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
                if (throwable == null && response != null) {
                    onSuccess(credential, attemptNumber, startedAt, latency, response);
                } else {
                    ErrorType errorType = throwable != null ? ErrorClassifier.classify(throwable) : ErrorType.INVALID_RESPONSE;
                    String message = throwable != null ? ErrorClassifier.message(throwable) : "Provider returned no response";
                    if (errorType == ErrorType.TIMEOUT && throwable != null
                            && ErrorClassifier.unwrap(throwable) instanceof TimeoutException) {
                        context.token().cancel();
                        message = "Attempt exceeded " + timeout.toMillis() + "ms";
                    }
                    onFailure(credential, attemptNumber, startedAt, latency, errorType, message);
                }
            });
        }

        private synchronized void onSuccess(
                Credential credential,
                int attemptNumber,
                Instant startedAt,
                Duration latency,
                ProviderResponse response
        ) {
            if (outcome.isDone()) {
                log.debug("Late success discarded: requestId={}, credential={}", request.requestId(), credential.getId());
                return;
            }
            CallAttempt attempt = CallAttempt.success(attemptNumber, credential.getId(), startedAt, latency);
            attempts.add(attempt);
            observer.onAttempt(request.providerId(), attempt);
            pool.reportSuccess(credential);

            log.info("Race won: requestId={}, providerId={}, credential={}, latencyMs={}",
                    request.requestId(), request.providerId(), credential.getId(), latency.toMillis());
            outcome.complete(CallResult.success(request, response, attempts, clock.instant()));
        }

        private synchronized void onFailure(
                Credential credential,
                int attemptNumber,
                Instant startedAt,
                Duration latency,
                ErrorType errorType,
                String message
        ) {
            if (outcome.isDone()) {
                log.debug("Late failure discarded: requestId={}, credential={}, errorType={}",
                        request.requestId(), credential.getId(), errorType);
                return;
            }
            CallAttempt attempt = CallAttempt.failure(
                    attemptNumber, credential.getId(), startedAt, errorType, message, latency);
            attempts.add(attempt);
            observer.onAttempt(request.providerId(), attempt);
            if (errorType.isCredentialFault()) {
                pool.reportFailure(credential, errorType);
            }
            pending--;

            log.warn("Race attempt failed: requestId={}, credential={}, errorType={}, error={}, pending={}",
                    request.requestId(), credential.getId(), errorType, message, pending);

            if (!errorType.isRetryable() && errorType != ErrorType.AUTH_ERROR) {
                outcome.complete(CallResult.failure(
                        request, RequestState.FAILED_NONRETRYABLE, errorType, message, attempts, clock.instant()));
            } else if (pending == 0) {
                outcome.complete(CallResult.failure(
                        request, RequestState.FAILED_EXHAUSTED, errorType, aggregate(), attempts, clock.instant()));
            }
        }

        synchronized CallResult settle(RequestState state, ErrorType errorType, String message) {
            if (outcome.isDone()) {
                return outcome.join();
            }
            CallResult result = CallResult.failure(request, state, errorType, message, attempts, clock.instant());
            outcome.complete(result);
            return result;
        }

        void cancelRemaining() {
            List<Runnable> toCancel;
            synchronized (this) {
                toCancel = List.copyOf(cancellers);
            }
            toCancel.forEach(Runnable::run);
        }

        private String aggregate() {
            return "All " + attempts.size() + " race attempts failed: " + attempts.stream()
                    .map(a -> a.credentialId() + "=" + a.errorType())
                    .collect(Collectors.joining(", "));
        }
    }
}
