package fr.lapetina.llm.dispatcher.domain.strategy;

import fr.lapetina.llm.dispatcher.domain.model.Credential;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Round-robin rotation.
 *
 * Starts at the cursor, skips ineligible credentials in cyclic order and moves the cursor
 * just past the chosen one. With no quarantines, N acquisitions over a pool of size P use
 * each credential N / P times (plus or minus one), in order.
 */
public final class RoundRobinStrategy implements RotationStrategy {

    @Override
    public String getName() {
        return "round_robin";
    }

    @Override
    public Optional<Selection> select(List<Credential> credentials, int cursor, Predicate<Credential> eligible) {
        if (credentials == null || credentials.isEmpty()) {
            return Optional.empty();
        }

        int size = credentials.size();
        int start = Math.floorMod(cursor, size);

        for (int i = 0; i < size; i++) {
            int index = (start + i) % size;
            if (eligible.test(credentials.get(index))) {
                return Optional.of(new Selection(index, (index + 1) % size));
            }
        }

        return Optional.empty();
    }
}
