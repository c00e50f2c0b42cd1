package fr.lapetina.llm.dispatcher.domain.strategy;

import fr.lapetina.llm.dispatcher.domain.model.Credential;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Random rotation.
 *
 * Uniform choice among eligible credentials. The cursor is left untouched.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements RotationStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<Selection> select(List<Credential> credentials, int cursor, Predicate<Credential> eligible) {
        if (credentials == null || credentials.isEmpty()) {
            return Optional.empty();
        }

        List<Integer> available = IntStream.range(0, credentials.size())
                .filter(i -> eligible.test(credentials.get(i)))
                .boxed()
                .collect(Collectors.toList());

        if (available.isEmpty()) {
            return Optional.empty();
        }

        int index = available.get(ThreadLocalRandom.current().nextInt(available.size()));
        return Optional.of(new Selection(index, cursor));
    }
}
