package fr.lapetina.llm.dispatcher.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Results index-aligned with the requests of a {@link BatchJob}:
 * {@code results.get(i)} always answers {@code job.requests().get(i)}.
 */
public record BatchResult(List<CallResult> results, Duration elapsed, boolean timedOut) {

    public BatchResult {
        Objects.requireNonNull(results, "Results are required");
        results = List.copyOf(results);
        if (elapsed == null) {
            elapsed = Duration.ZERO;
        }
    }

    public CallResult get(int index) {
        return results.get(index);
    }

    public int size() {
        return results.size();
    }

    public long successCount() {
        return results.stream().filter(CallResult::isSuccess).count();
    }

    public long failureCount() {
        return results.size() - successCount();
    }

    public boolean isPartialFailure() {
        long successes = successCount();
        return successes > 0 && successes < results.size();
    }
}
