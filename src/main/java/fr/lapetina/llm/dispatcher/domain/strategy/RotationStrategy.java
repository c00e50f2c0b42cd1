package fr.lapetina.llm.dispatcher.domain.strategy;

import fr.lapetina.llm.dispatcher.domain.model.Credential;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Strategy interface for choosing the next credential of a pool.
 *
 * Implementations are stateless: the rotation cursor belongs to the pool, which calls
 * {@link #select} inside its critical section and stores the returned cursor. This keeps
 * acquire-and-advance atomic without any locking in the strategy itself.
 */
public interface RotationStrategy {

    /**
     * Returns the configuration name of this strategy.
     */
    String getName();

    /**
     * Selects a credential among those accepted by {@code eligible}.
     *
     * @param credentials Ordered credentials of the pool
     * @param cursor      Current rotation cursor, always in {@code [0, credentials.size())}
     * @param eligible    Filter excluding quarantined (or already chosen) credentials
     * @return Selected index and the cursor to store, or empty if nothing is eligible
     */
    Optional<Selection> select(List<Credential> credentials, int cursor, Predicate<Credential> eligible);

    /**
     * Whether every pick moves the cursor. When {@code false}, the pool keeps the cursor on
     * the credential this strategy prefers among all healthy ones, even when a pick had to
     * skip it (a retry away from it, or the extra credentials of a race).
     */
    default boolean advancesPerPick() {
        return true;
    }

    /**
     * Result of a selection.
     *
     * @param index      Index of the chosen credential
     * @param nextCursor Cursor value the pool must store
     */
    record Selection(int index, int nextCursor) {
    }
}
