package fr.lapetina.llm.dispatcher.pool;

import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.CredentialStatus;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.strategy.FailoverStrategy;
import fr.lapetina.llm.dispatcher.domain.strategy.RandomStrategy;
import fr.lapetina.llm.dispatcher.domain.strategy.RoundRobinStrategy;
import fr.lapetina.llm.dispatcher.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialPoolTest {

    private static final QuarantinePolicy POLICY =
            new QuarantinePolicy(2, Duration.ofSeconds(30), Duration.ofMinutes(10));

    private MutableClock clock;
    private CredentialPool pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        pool = CredentialPool.of("gemini", List.of("key-aaaa-0001", "key-bbbb-0002", "key-cccc-0003"),
                new RoundRobinStrategy(), POLICY, clock);
    }

    private Credential credential(int index) {
        return pool.getCredentials().get(index);
    }

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("should spread acquisitions evenly in round-robin order")
        void shouldBeFair() {
            Map<String, Integer> counts = new HashMap<>();
            List<String> order = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                Credential c = pool.acquire();
                counts.merge(c.getId(), 1, Integer::sum);
                order.add(c.getId());
            }

            assertThat(counts).containsOnly(
                    Map.entry("gemini-0", 10), Map.entry("gemini-1", 10), Map.entry("gemini-2", 10));
            assertThat(order.subList(0, 4)).containsExactly("gemini-0", "gemini-1", "gemini-2", "gemini-0");
        }

        @Test
        @DisplayName("should stay fair under concurrent acquisition")
        void shouldBeFairConcurrently() throws Exception {
            int threads = 6;
            int perThread = 50;
            Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            counts.computeIfAbsent(pool.acquire().getId(), k -> new AtomicInteger()).incrementAndGet();
                        }
                        return null;
                    });
                }
                start.countDown();
                executor.shutdown();
                assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            assertThat(counts.values()).extracting(AtomicInteger::get).containsOnly(100);
        }

        @Test
        @DisplayName("should skip excluded credentials while others are healthy")
        void shouldSkipExcluded() {
            pool.setStrategy(new FailoverStrategy());

            Credential chosen = pool.acquire(c -> c.getId().equals("gemini-0"));

            assertThat(chosen.getId()).isEqualTo("gemini-1");
            assertThat(pool.getCursor()).isZero();
        }

        @Test
        @DisplayName("should fall back to an excluded credential when nothing else is healthy")
        void shouldFallBackWhenAllExcluded() {
            pool.reportFailure(credential(2), ErrorType.AUTH_ERROR);

            Credential chosen = pool.acquire(c -> !c.getId().equals("gemini-2"));

            assertThat(chosen.getId()).isIn("gemini-0", "gemini-1");
        }

        @Test
        @DisplayName("should record the last use time")
        void shouldMarkUsed() {
            Credential c = pool.acquire();

            assertThat(c.getLastUsedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("should throw when the pool is empty")
        void shouldThrowOnEmptyPool() {
            CredentialPool empty = CredentialPool.of("empty", List.of(), new RoundRobinStrategy(), POLICY, clock);

            assertThatThrownBy(empty::acquire)
                    .isInstanceOf(PoolExhaustedException.class)
                    .satisfies(e -> {
                        PoolExhaustedException pe = (PoolExhaustedException) e;
                        assertThat(pe.getProviderId()).isEqualTo("empty");
                        assertThat(pe.getPoolSize()).isZero();
                    });
        }

        @Test
        @DisplayName("should reject credentials of another provider")
        void shouldRejectForeignCredentials() {
            Credential foreign = Credential.builder().providerId("openai").apiKey("sk-xxxxxxxxxx").build();

            assertThatThrownBy(() -> new CredentialPool("gemini", List.of(foreign),
                    new RoundRobinStrategy(), POLICY, clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("quarantine")
    class QuarantineTests {

        @Test
        @DisplayName("should quarantine only after failures exceed the threshold")
        void shouldQuarantineAboveThreshold() {
            Credential first = credential(0);

            pool.reportFailure(first, ErrorType.RATE_LIMITED);
            pool.reportFailure(first, ErrorType.RATE_LIMITED);
            assertThat(first.isQuarantinedAt(clock.instant())).isFalse();

            pool.reportFailure(first, ErrorType.RATE_LIMITED);
            assertThat(first.isQuarantinedAt(clock.instant())).isTrue();
            assertThat(first.getQuarantinedUntil()).isEqualTo(clock.instant().plusSeconds(30));
            assertThat(pool.healthyCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should never hand out a quarantined credential")
        void shouldSkipQuarantined() {
            Credential first = credential(0);
            for (int i = 0; i < 3; i++) {
                pool.reportFailure(first);
            }

            for (int i = 0; i < 20; i++) {
                assertThat(pool.acquire()).isNotEqualTo(first);
            }
        }

        @Test
        @DisplayName("should release a credential after the cooldown with a clean count")
        void shouldReleaseAfterCooldown() {
            Credential first = credential(0);
            for (int i = 0; i < 3; i++) {
                pool.reportFailure(first);
            }

            clock.advance(Duration.ofSeconds(29));
            assertThat(pool.healthyCount()).isEqualTo(2);

            clock.advance(Duration.ofSeconds(1));
            assertThat(pool.healthyCount()).isEqualTo(3);

            List<String> acquired = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                acquired.add(pool.acquire().getId());
            }
            assertThat(acquired).contains("gemini-0");
            assertThat(first.getConsecutiveFailures()).isZero();
            assertThat(first.getQuarantinedUntil()).isNull();
        }

        @Test
        @DisplayName("should quarantine at once on authentication errors for the auth cooldown")
        void shouldQuarantineOnAuthError() {
            Credential second = credential(1);

            pool.reportFailure(second, ErrorType.AUTH_ERROR);

            assertThat(second.isQuarantinedAt(clock.instant())).isTrue();
            assertThat(second.getQuarantinedUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));

            clock.advance(Duration.ofMinutes(5));
            assertThat(second.isQuarantinedAt(clock.instant())).isTrue();
        }

        @Test
        @DisplayName("should size the quarantine by the error type that crossed the threshold")
        void shouldUseCooldownOfErrorType() {
            CredentialPool tuned = CredentialPool.of("gemini", List.of("key-aaaa-0001", "key-bbbb-0002"),
                    new RoundRobinStrategy(), QuarantinePolicy.defaults(), clock);
            Credential limited = tuned.getCredentials().get(0);
            Credential slow = tuned.getCredentials().get(1);

            tuned.reportFailure(limited, ErrorType.TRANSPORT_ERROR);
            tuned.reportFailure(limited, ErrorType.TRANSPORT_ERROR);
            tuned.reportFailure(limited, ErrorType.RATE_LIMITED);
            for (int i = 0; i < 3; i++) {
                tuned.reportFailure(slow, ErrorType.TIMEOUT);
            }

            assertThat(limited.getQuarantinedUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
            assertThat(slow.getQuarantinedUntil()).isEqualTo(clock.instant().plus(Duration.ofMinutes(2)));

            clock.advance(Duration.ofMinutes(2));
            assertThat(tuned.acquire()).isEqualTo(slow);
            assertThat(limited.isQuarantinedAt(clock.instant())).isTrue();
        }

        @Test
        @DisplayName("should fall back to the general cooldown for error types without their own")
        void shouldFallBackToGeneralCooldown() {
            QuarantinePolicy policy = new QuarantinePolicy(1, Duration.ofSeconds(45), Duration.ofMinutes(10),
                    Map.of(ErrorType.RATE_LIMITED, Duration.ofMinutes(3)));

            assertThat(policy.cooldownFor(ErrorType.TRANSPORT_ERROR)).isEqualTo(Duration.ofSeconds(45));
            assertThat(policy.cooldownFor(ErrorType.RATE_LIMITED)).isEqualTo(Duration.ofMinutes(3));
            assertThat(policy.cooldownFor(ErrorType.AUTH_ERROR)).isEqualTo(Duration.ofMinutes(10));
            assertThatThrownBy(() -> new QuarantinePolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(1),
                    Map.of(ErrorType.TIMEOUT, Duration.ofSeconds(-1))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reset failures and clear quarantine on success")
        void shouldResetOnSuccess() {
            Credential first = credential(0);
            pool.reportFailure(first);
            pool.reportFailure(first);

            pool.reportSuccess(first);

            assertThat(first.getConsecutiveFailures()).isZero();
            pool.reportFailure(first);
            pool.reportFailure(first);
            assertThat(first.isQuarantinedAt(clock.instant())).isFalse();
        }

        @Test
        @DisplayName("should throw when every credential is quarantined")
        void shouldThrowWhenAllQuarantined() {
            for (Credential c : pool.getCredentials()) {
                pool.reportFailure(c, ErrorType.AUTH_ERROR);
            }

            assertThat(pool.healthyCount()).isZero();
            assertThatThrownBy(pool::acquire).isInstanceOf(PoolExhaustedException.class);
        }

        @Test
        @DisplayName("should reject reports for credentials outside the pool")
        void shouldRejectForeignReport() {
            Credential stranger = Credential.builder().providerId("gemini").apiKey("other-key").index(9).build();

            assertThatThrownBy(() -> pool.reportFailure(stranger)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should expose masked keys in snapshots")
        void shouldMaskKeysInSnapshot() {
            pool.reportFailure(credential(2), ErrorType.AUTH_ERROR);

            List<CredentialStatus> snapshot = pool.snapshot();

            assertThat(snapshot).hasSize(3);
            assertThat(snapshot.get(0).maskedKey()).isEqualTo("key-...0001");
            assertThat(snapshot.get(2).quarantined()).isTrue();
            assertThat(snapshot).extracting(CredentialStatus::maskedKey).doesNotContain("key-cccc-0003");
        }
    }

    @Nested
    @DisplayName("acquireDistinct")
    class AcquireDistinctTests {

        @Test
        @DisplayName("should return distinct healthy credentials up to the limit")
        void shouldReturnDistinct() {
            List<Credential> chosen = pool.acquireDistinct(2);

            assertThat(chosen).extracting(Credential::getId).containsExactly("gemini-0", "gemini-1");
            assertThat(pool.acquire().getId()).isEqualTo("gemini-2");
        }

        @Test
        @DisplayName("should return fewer credentials when fewer are healthy")
        void shouldCapAtHealthy() {
            pool.reportFailure(credential(1), ErrorType.AUTH_ERROR);

            List<Credential> chosen = pool.acquireDistinct(5);

            assertThat(chosen).extracting(Credential::getId).containsExactly("gemini-0", "gemini-2");
        }

        @Test
        @DisplayName("should return distinct credentials with random rotation")
        void shouldBeDistinctWithRandom() {
            pool.setStrategy(new RandomStrategy());

            List<Credential> chosen = pool.acquireDistinct(3);

            assertThat(chosen).doesNotHaveDuplicates().hasSize(3);
        }

        @Test
        @DisplayName("should keep the failover cursor on the preferred credential")
        void shouldKeepFailoverCursor() {
            pool.setStrategy(new FailoverStrategy());

            List<Credential> chosen = pool.acquireDistinct(3);

            assertThat(chosen).extracting(Credential::getId).containsExactly("gemini-0", "gemini-1", "gemini-2");
            assertThat(pool.getCursor()).isZero();

            pool.reportFailure(credential(0), ErrorType.AUTH_ERROR);
            pool.acquireDistinct(2);
            assertThat(pool.getCursor()).isEqualTo(1);
        }

        @Test
        @DisplayName("should throw when nothing is healthy")
        void shouldThrowWhenNothingHealthy() {
            pool.getCredentials().forEach(c -> pool.reportFailure(c, ErrorType.AUTH_ERROR));

            assertThatThrownBy(() -> pool.acquireDistinct(2)).isInstanceOf(PoolExhaustedException.class);
        }
    }

    @Nested
    @DisplayName("strategy swap")
    class StrategySwapTests {

        @Test
        @DisplayName("should apply a new strategy to later acquisitions")
        void shouldSwapStrategy() {
            pool.acquire();
            pool.setStrategy(new FailoverStrategy());

            assertThat(pool.getStrategy().getName()).isEqualTo("failover");
            assertThat(pool.acquire().getId()).isEqualTo("gemini-0");
            assertThat(pool.acquire().getId()).isEqualTo("gemini-0");
        }

        @Test
        @DisplayName("should swap strategies across registered pools")
        void shouldSwapAcrossPools() {
            CredentialPools pools = new CredentialPools();
            pools.register(pool);
            pools.register(CredentialPool.of("openai", List.of("sk-1111111111"),
                    new RoundRobinStrategy(), POLICY, clock));

            pools.applyStrategy(FailoverStrategy::new);

            assertThat(pools.all()).extracting(p -> p.getStrategy().getName()).containsOnly("failover");
            assertThatThrownBy(() -> pools.register(pool)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> pools.require("missing")).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
