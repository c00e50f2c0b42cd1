package fr.lapetina.llm.dispatcher.pool;

import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.CredentialStatus;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.strategy.RotationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Pool of interchangeable API keys for one provider.
 *
 * Sole owner of credential health. Every mutation (cursor advance, failure counters,
 * quarantine) happens under one lock that is held only for in-memory bookkeeping, never
 * across a network call. Acquisition never blocks: when nothing is healthy it throws
 * {@link PoolExhaustedException} at once.
 */
public final class CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    private final String providerId;
    private final List<Credential> credentials;
    private final QuarantinePolicy policy;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile RotationStrategy strategy;
    private int cursor;

    public CredentialPool(
            String providerId,
            List<Credential> credentials,
            RotationStrategy strategy,
            QuarantinePolicy policy,
            Clock clock
    ) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.credentials = List.copyOf(credentials);
        this.strategy = Objects.requireNonNull(strategy, "Rotation strategy is required");
        this.policy = Objects.requireNonNull(policy, "Quarantine policy is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.cursor = 0;

        for (Credential credential : this.credentials) {
            if (!providerId.equals(credential.getProviderId())) {
                throw new IllegalArgumentException("Credential " + credential.getId()
                        + " belongs to provider " + credential.getProviderId() + ", not " + providerId);
            }
        }

        log.info("CredentialPool created: provider={}, size={}, strategy={}, failureThreshold={}, cooldown={}",
                providerId, this.credentials.size(), strategy.getName(),
                policy.failureThreshold(), policy.cooldown());
    }

    /**
     * Builds a pool from raw API keys, numbering credentials {@code <provider>-0..n}.
     */
    public static CredentialPool of(
            String providerId,
            List<String> apiKeys,
            RotationStrategy strategy,
            QuarantinePolicy policy,
            Clock clock
    ) {
        List<Credential> built = new ArrayList<>(apiKeys.size());
        for (int i = 0; i < apiKeys.size(); i++) {
            built.add(Credential.builder()
                    .providerId(providerId)
                    .apiKey(apiKeys.get(i))
                    .index(i)
                    .build());
        }
        return new CredentialPool(providerId, built, strategy, policy, clock);
    }

    /**
     * Returns the next credential per the rotation strategy, skipping quarantined ones.
     *
     * @throws PoolExhaustedException if the pool is empty or fully quarantined
     */
    public Credential acquire() {
        return acquire(c -> false);
    }

    /**
     * Returns the next healthy credential not matched by {@code exclude}. When every healthy
     * credential is excluded, falls back to the strategy's choice among all healthy ones.
     *
     * A strategy that keeps its cursor on a preferred credential still points at that
     * credential afterwards, even when the exclusion moved the pick elsewhere.
     *
     * @throws PoolExhaustedException if the pool is empty or fully quarantined
     */
    public Credential acquire(Predicate<Credential> exclude) {
        Objects.requireNonNull(exclude, "Exclusion filter is required");

        lock.lock();
        try {
            Instant now = clock.instant();
            releaseExpired(now);

            Optional<RotationStrategy.Selection> preferred =
                    strategy.select(credentials, cursor, c -> !c.isQuarantinedAt(now));
            if (preferred.isEmpty()) {
                throw new PoolExhaustedException(providerId, credentials.size());
            }
            RotationStrategy.Selection pick = strategy
                    .select(credentials, cursor, c -> !c.isQuarantinedAt(now) && !exclude.test(c))
                    .orElse(preferred.get());

            Credential chosen = take(pick, strategy.advancesPerPick() ? pick : preferred.get(), now);
            log.debug("Credential acquired: provider={}, credential={}, cursor={}",
                    providerId, chosen.getId(), cursor);
            return chosen;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns up to {@code max} distinct healthy credentials in strategy order.
     * The cursor advances once per credential returned, or only for the first one when the
     * strategy keeps its cursor on a preferred credential.
     *
     * @throws PoolExhaustedException if no credential is healthy
     */
    public List<Credential> acquireDistinct(int max) {
        if (max < 1) {
            throw new IllegalArgumentException("max must be >= 1");
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            releaseExpired(now);

            Set<Credential> chosen = new HashSet<>();
            List<Credential> ordered = new ArrayList<>();
            RotationStrategy.Selection first = null;
            while (ordered.size() < max) {
                Optional<RotationStrategy.Selection> selection = strategy.select(
                        credentials, cursor, c -> !c.isQuarantinedAt(now) && !chosen.contains(c));
                if (selection.isEmpty()) {
                    break;
                }
                RotationStrategy.Selection pick = selection.get();
                if (first == null) {
                    first = pick;
                }
                Credential credential = take(pick, strategy.advancesPerPick() ? pick : first, now);
                chosen.add(credential);
                ordered.add(credential);
            }

            if (ordered.isEmpty()) {
                throw new PoolExhaustedException(providerId, credentials.size());
            }
            return List.copyOf(ordered);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a transient failure against a credential.
     */
    public void reportFailure(Credential credential) {
        reportFailure(credential, ErrorType.TRANSPORT_ERROR);
    }

    /**
     * Records a failure against a credential.
     *
     * Authentication failures quarantine the credential at once for the auth cooldown.
     * Other failures quarantine it once the consecutive failure count exceeds the threshold,
     * for the cooldown of the error type that crossed it.
     */
    public void reportFailure(Credential credential, ErrorType errorType) {
        checkMember(credential);

        lock.lock();
        try {
            Instant now = clock.instant();
            int failures = credential.incrementFailures();

            if (errorType == ErrorType.AUTH_ERROR) {
                Instant until = now.plus(policy.authErrorCooldown());
                credential.quarantineUntil(until);
                log.warn("Credential quarantined (auth error): provider={}, credential={}, key={}, until={}",
                        providerId, credential.getId(), credential.maskedKey(), until);
                return;
            }

            if (failures > policy.failureThreshold()) {
                Instant until = now.plus(policy.cooldownFor(errorType));
                credential.quarantineUntil(until);
                log.warn("Credential quarantined: provider={}, credential={}, key={}, failures={}, errorType={}, until={}",
                        providerId, credential.getId(), credential.maskedKey(), failures, errorType, until);
            } else {
                log.debug("Credential failure recorded: provider={}, credential={}, failures={}, errorType={}",
                        providerId, credential.getId(), failures, errorType);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a success: clears the failure counter and any quarantine.
     */
    public void reportSuccess(Credential credential) {
        checkMember(credential);

        lock.lock();
        try {
            boolean wasQuarantined = credential.getQuarantinedUntil() != null;
            credential.resetFailures();
            credential.clearQuarantine();
            if (wasQuarantined) {
                log.info("Credential restored after success: provider={}, credential={}",
                        providerId, credential.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of credentials currently eligible for selection.
     */
    public int healthyCount() {
        Instant now = clock.instant();
        int healthy = 0;
        for (Credential credential : credentials) {
            if (!credential.isQuarantinedAt(now)) {
                healthy++;
            }
        }
        return healthy;
    }

    public int size() {
        return credentials.size();
    }

    public List<CredentialStatus> snapshot() {
        lock.lock();
        try {
            Instant now = clock.instant();
            return credentials.stream()
                    .map(c -> CredentialStatus.of(c, now))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Swaps the rotation strategy. The cursor is kept.
     */
    public void setStrategy(RotationStrategy newStrategy) {
        Objects.requireNonNull(newStrategy, "Rotation strategy is required");
        lock.lock();
        try {
            RotationStrategy old = this.strategy;
            this.strategy = newStrategy;
            log.info("Rotation strategy changed: provider={}, {} -> {}",
                    providerId, old.getName(), newStrategy.getName());
        } finally {
            lock.unlock();
        }
    }

    public RotationStrategy getStrategy() {
        return strategy;
    }

    public int getCursor() {
        lock.lock();
        try {
            return cursor;
        } finally {
            lock.unlock();
        }
    }

    public String getProviderId() {
        return providerId;
    }

    public List<Credential> getCredentials() {
        return credentials;
    }

    public QuarantinePolicy getPolicy() {
        return policy;
    }

    private Credential take(RotationStrategy.Selection pick, RotationStrategy.Selection cursorFrom, Instant now) {
        Credential credential = credentials.get(pick.index());
        cursor = Math.floorMod(cursorFrom.nextCursor(), credentials.size());
        credential.markUsed(now);
        return credential;
    }

    // Expired quarantines are lifted lazily and the credential starts over with a clean count
    private void releaseExpired(Instant now) {
        for (Credential credential : credentials) {
            Instant until = credential.getQuarantinedUntil();
            if (until != null && !until.isAfter(now)) {
                credential.clearQuarantine();
                credential.resetFailures();
                log.info("Credential quarantine expired: provider={}, credential={}",
                        providerId, credential.getId());
            }
        }
    }

    private void checkMember(Credential credential) {
        Objects.requireNonNull(credential, "Credential is required");
        if (!credentials.contains(credential)) {
            throw new IllegalArgumentException("Credential " + credential.getId()
                    + " does not belong to pool " + providerId);
        }
    }

    @Override
    public String toString() {
        return "CredentialPool{" +
                "provider='" + providerId + '\'' +
                ", size=" + credentials.size() +
                ", healthy=" + healthyCount() +
                ", strategy=" + strategy.getName() +
                '}';
    }
}
