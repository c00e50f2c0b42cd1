package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.CallAttempt;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.RequestState;
import fr.lapetina.llm.dispatcher.domain.strategy.RoundRobinStrategy;
import fr.lapetina.llm.dispatcher.pool.CredentialPool;
import fr.lapetina.llm.dispatcher.pool.CredentialPools;
import fr.lapetina.llm.dispatcher.pool.QuarantinePolicy;
import fr.lapetina.llm.dispatcher.provider.ProviderRegistry;
import fr.lapetina.llm.dispatcher.support.MutableClock;
import fr.lapetina.llm.dispatcher.support.StubProviderCall;
import fr.lapetina.llm.dispatcher.support.StubProviderCall.Behavior;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FailoverRacerTest {

    private MutableClock clock;
    private CredentialPool pool;
    private StubProviderCall provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        provider = new StubProviderCall("gemini");
        pool = CredentialPool.of("gemini", List.of("race-key-00001", "race-key-00002", "race-key-00003"),
                new RoundRobinStrategy(), QuarantinePolicy.defaults(), clock);
    }

    private FailoverRacer racer(int maxParallel, Duration callTimeout) {
        CredentialPools pools = new CredentialPools();
        pools.register(pool);
        ProviderRegistry providers = new ProviderRegistry();
        providers.register(provider);
        DispatchSettings settings = DispatchSettings.builder()
                .maxParallelApiKeys(maxParallel)
                .callTimeout(callTimeout)
                .retryTimeout(callTimeout)
                .build();
        return new FailoverRacer(pools, providers, settings, clock, DispatchObserver.NOOP);
    }

    private static CallRequest request() {
        return CallRequest.of("gemini", Map.of("prompt", "race me"));
    }

    @Nested
    @DisplayName("winning")
    class WinningTests {

        @Test
        @DisplayName("should return the fastest success without waiting for slower keys")
        void shouldReturnFastest() {
            provider.script("gemini-0", Behavior.hang());
            provider.script("gemini-1", Behavior.succeedAfter(Duration.ofMillis(200)));
            provider.script("gemini-2", Behavior.succeedAfter(Duration.ofMillis(500)));

            long start = System.nanoTime();
            CallResult result = racer(5, Duration.ofSeconds(1)).race(request());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(result.state()).isEqualTo(RequestState.SUCCEEDED);
            assertThat(result.response().credentialId()).isEqualTo("gemini-1");
            assertThat(elapsed).isLessThan(Duration.ofMillis(450));
            assertThat(provider.totalCalls()).isEqualTo(3);
        }

        @Test
        @DisplayName("should cancel the losing attempts")
        void shouldCancelLosers() {
            provider.script("gemini-0", Behavior.hang());
            provider.script("gemini-1", Behavior.succeedAfter(Duration.ofMillis(50)));
            provider.script("gemini-2", Behavior.succeedAfter(Duration.ofMillis(500)));

            racer(5, Duration.ofSeconds(1)).race(request());

            assertThat(provider.cancellations()).isEqualTo(2);
        }

        @Test
        @DisplayName("should win even when other keys fail first")
        void shouldWinAfterFailures() {
            provider.script("gemini-0", Behavior.fail(ErrorType.RATE_LIMITED));
            provider.script("gemini-1", Behavior.fail(ErrorType.TRANSPORT_ERROR));
            provider.script("gemini-2", Behavior.succeedAfter(Duration.ofMillis(100)));

            CallResult result = racer(5, Duration.ofSeconds(1)).race(request());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.attempts()).hasSize(3);
            assertThat(pool.getCredentials().get(0).getConsecutiveFailures()).isEqualTo(1);
            assertThat(pool.getCredentials().get(2).getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should not report failures that settle after the race is decided")
        void shouldDiscardLateFailures() throws Exception {
            provider.script("gemini-0", Behavior.succeedAfter(Duration.ofMillis(20)));
            provider.script("gemini-1", Behavior.failAfter(ErrorType.TRANSPORT_ERROR, Duration.ofMillis(100)));

            CallResult result = racer(2, Duration.ofSeconds(1)).race(request());
            Thread.sleep(250);

            assertThat(result.attempts()).extracting(CallAttempt::credentialId).containsExactly("gemini-0");
            assertThat(pool.getCredentials().get(1).getConsecutiveFailures()).isZero();
        }
    }

    @Nested
    @DisplayName("fan-out")
    class FanOutTests {

        @Test
        @DisplayName("should cap parallel attempts at the configured limit")
        void shouldCapAtMaxParallel() {
            provider.defaultBehavior(Behavior.succeedAfter(Duration.ofMillis(50)));

            CallResult result = racer(2, Duration.ofSeconds(1)).race(request());

            assertThat(result.isSuccess()).isTrue();
            assertThat(provider.totalCalls()).isEqualTo(2);
        }

        @Test
        @DisplayName("should only race healthy keys")
        void shouldSkipQuarantinedKeys() {
            pool.reportFailure(pool.getCredentials().get(1), ErrorType.AUTH_ERROR);
            provider.defaultBehavior(Behavior.succeedAfter(Duration.ofMillis(50)));

            racer(5, Duration.ofSeconds(1)).race(request());

            assertThat(provider.totalCalls()).isEqualTo(2);
            assertThat(provider.callsFor("gemini-1")).isZero();
        }

        @Test
        @DisplayName("should fail with zero attempts when the pool is exhausted")
        void shouldFailOnExhaustedPool() {
            pool.getCredentials().forEach(c -> pool.reportFailure(c, ErrorType.AUTH_ERROR));

            CallResult result = racer(5, Duration.ofSeconds(1)).race(request());

            assertThat(result.state()).isEqualTo(RequestState.FAILED_POOL_EXHAUSTED);
            assertThat(result.attempts()).isEmpty();
            assertThat(provider.totalCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("losing")
    class LosingTests {

        @Test
        @DisplayName("should aggregate errors when every attempt fails")
        void shouldAggregateFailures() {
            provider.defaultBehavior(Behavior.fail(ErrorType.RATE_LIMITED));

            CallResult result = racer(5, Duration.ofSeconds(1)).race(request());

            assertThat(result.state()).isEqualTo(RequestState.FAILED_EXHAUSTED);
            assertThat(result.errorType()).isEqualTo(ErrorType.RATE_LIMITED);
            assertThat(result.attempts()).hasSize(3);
            assertThat(result.errorMessage()).startsWith("All 3 race attempts failed");
            assertThat(result.completedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should time out every attempt that never answers")
        void shouldTimeOutSilentKeys() {
            provider.defaultBehavior(Behavior.hang());

            long start = System.nanoTime();
            CallResult result = racer(5, Duration.ofMillis(300)).race(request());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(result.state()).isEqualTo(RequestState.FAILED_EXHAUSTED);
            assertThat(result.attempts()).extracting(CallAttempt::errorType).containsOnly(ErrorType.TIMEOUT);
            assertThat(elapsed).isLessThan(Duration.ofMillis(1200));
        }

        @Test
        @DisplayName("should stop at once on a non-retryable error")
        void shouldStopOnNonRetryable() {
            provider.script("gemini-0", Behavior.fail(ErrorType.INVALID_RESPONSE));
            provider.script("gemini-1", Behavior.hang());
            provider.script("gemini-2", Behavior.hang());

            long start = System.nanoTime();
            CallResult result = racer(5, Duration.ofSeconds(2)).race(request());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(result.state()).isEqualTo(RequestState.FAILED_NONRETRYABLE);
            assertThat(result.errorType()).isEqualTo(ErrorType.INVALID_RESPONSE);
            assertThat(elapsed).isLessThan(Duration.ofSeconds(1));
        }
    }
}
