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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sequential dispatcher: one credential at a time, rotating to a fresh credential after
 * each failed attempt. A credential that already failed for this request is only reused
 * once every other healthy credential has failed too.
 *
 * The first attempt runs under the call timeout, later attempts under the retry timeout.
 * The worker never waits past an attempt's deadline: the attempt is cancelled and counted
 * as a {@link ErrorType#TIMEOUT} failure against its credential.
 */
public final class SingleCallDispatcher implements CallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SingleCallDispatcher.class);

    private final CredentialPools pools;
    private final ProviderRegistry providers;
    private final DispatchSettings settings;
    private final Clock clock;
    private final DispatchObserver observer;

    public SingleCallDispatcher(
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
        CredentialPool pool = pools.require(request.providerId());
        ProviderCall provider = providers.require(request.providerId());

        RequestStateMachine machine = new RequestStateMachine(
                request.requestId(), settings.maxRetriesFor(request), pool.size());
        List<CallAttempt> attempts = new ArrayList<>();
        Set<Credential> failedCredentials = new HashSet<>();

        while (true) {
            Credential credential;
            try {
                credential = pool.acquire(failedCredentials::contains);
            } catch (PoolExhaustedException e) {
                machine.poolExhausted();
                log.warn("Dispatch stopped, pool exhausted: requestId={}, providerId={}, attempts={}",
                        request.requestId(), request.providerId(), attempts.size());
                return finish(CallResult.poolExhausted(request, attempts, clock.instant()));
            }

            machine.dispatched();
            int attemptNumber = attempts.size() + 1;
            Duration timeout = settings.timeoutFor(request, attemptNumber);

            Settled outcome;
            try {
                outcome = invoke(provider, request, credential, attemptNumber, timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                machine.abandon();
                log.warn("Dispatch interrupted: requestId={}, credential={}, attempt={}",
                        request.requestId(), credential.getId(), attemptNumber);
                return finish(CallResult.failure(request, RequestState.FAILED_EXHAUSTED,
                        ErrorType.CANCELLED, "Dispatch interrupted", attempts, clock.instant()));
            }

            attempts.add(outcome.attempt());
            observer.onAttempt(request.providerId(), outcome.attempt());

            if (outcome.response() != null) {
                pool.reportSuccess(credential);
                machine.succeeded();
                log.info("Request succeeded: requestId={}, providerId={}, credential={}, attempt={}, latencyMs={}",
                        request.requestId(), request.providerId(), credential.getId(),
                        attemptNumber, outcome.attempt().latency().toMillis());
                return finish(CallResult.success(request, outcome.response(), attempts, clock.instant()));
            }

            ErrorType errorType = outcome.attempt().errorType();
            failedCredentials.add(credential);
            if (errorType.isCredentialFault()) {
                pool.reportFailure(credential, errorType);
            }

            RequestState next = machine.onFailure(errorType);
            log.warn("Attempt failed: requestId={}, credential={}, attempt={}, errorType={}, error={}, next={}",
                    request.requestId(), credential.getId(), attemptNumber, errorType,
                    outcome.attempt().errorMessage(), next);

            if (next.isTerminal()) {
                return finish(CallResult.failure(
                        request, next, errorType, outcome.attempt().errorMessage(), attempts, clock.instant()));
            }
        }
    }

    /**
     * Runs one attempt and waits for it, at most {@code timeout}.
     */
    private Settled invoke(
            ProviderCall provider,
            CallRequest request,
            Credential credential,
            int attemptNumber,
            Duration timeout
    ) throws InterruptedException {
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        CallContext context = CallContext.start(attemptNumber, timeout, startedAt);

        log.debug("Dispatching attempt: requestId={}, credential={}, attempt={}, timeoutMs={}",
                request.requestId(), credential.getId(), attemptNumber, timeout.toMillis());

        CompletableFuture<ProviderResponse> future;
        try {
            future = provider.call(request, credential, context);
        } catch (RuntimeException e) {
            return failed(attemptNumber, credential, startedAt, startNanos,
                    ErrorClassifier.classify(e), ErrorClassifier.message(e));
        }

        try {
            ProviderResponse response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (response == null) {
                return failed(attemptNumber, credential, startedAt, startNanos,
                        ErrorType.INVALID_RESPONSE, "Provider returned no response");
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            return new Settled(
                    CallAttempt.success(attemptNumber, credential.getId(), startedAt, latency), response);
        } catch (TimeoutException e) {
            context.token().cancel();
            future.cancel(true);
            return failed(attemptNumber, credential, startedAt, startNanos,
                    ErrorType.TIMEOUT, "Attempt exceeded " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            return failed(attemptNumber, credential, startedAt, startNanos,
                    ErrorClassifier.classify(e), ErrorClassifier.message(e));
        } catch (CancellationException e) {
            return failed(attemptNumber, credential, startedAt, startNanos,
                    ErrorType.CANCELLED, "Attempt cancelled");
        } catch (InterruptedException e) {
            context.token().cancel();
            future.cancel(true);
            throw e;
        }
    }

    private static Settled failed(
            int attemptNumber,
            Credential credential,
            Instant startedAt,
            long startNanos,
            ErrorType errorType,
            String message
    ) {
        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        return new Settled(
                CallAttempt.failure(attemptNumber, credential.getId(), startedAt, errorType, message, latency),
                null);
    }

    private CallResult finish(CallResult result) {
        observer.onResult(result);
        return result;
    }

    private record Settled(CallAttempt attempt, ProviderResponse response) {
    }
}
