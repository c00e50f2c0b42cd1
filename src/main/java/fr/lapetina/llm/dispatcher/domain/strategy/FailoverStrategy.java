package fr.lapetina.llm.dispatcher.domain.strategy;

import fr.lapetina.llm.dispatcher.domain.model.Credential;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Failover rotation.
 *
 * Always prefers the lowest-index eligible credential. The cursor tracks the preferred
 * credential and only moves when that credential is quarantined (or comes back).
 */
public final class FailoverStrategy implements RotationStrategy {

    @Override
    public String getName() {
        return "failover";
    }

    @Override
    public Optional<Selection> select(List<Credential> credentials, int cursor, Predicate<Credential> eligible) {
        if (credentials == null || credentials.isEmpty()) {
            return Optional.empty();
        }

        for (int index = 0; index < credentials.size(); index++) {
            if (eligible.test(credentials.get(index))) {
                return Optional.of(new Selection(index, index));
            }
        }

        return Optional.empty();
    }

    @Override
    public boolean advancesPerPick() {
        return false;
    }
}
