package fr.lapetina.llm.dispatcher.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered requests run together under one concurrency limit.
 * A request's position in {@code requests} is its identity in the {@link BatchResult}.
 */
public record BatchJob(List<CallRequest> requests, int concurrencyLimit) {

    public BatchJob {
        Objects.requireNonNull(requests, "Requests are required");
        requests = List.copyOf(requests);
    }

    public int size() {
        return requests.size();
    }
}
