package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallAttempt;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;

/**
 * Callback for dispatch outcomes, used for metrics. Implementations must be thread-safe
 * and must not throw.
 */
public interface DispatchObserver {

    DispatchObserver NOOP = new DispatchObserver() {
    };

    default void onAttempt(String providerId, CallAttempt attempt) {
    }

    default void onResult(CallResult result) {
    }

    default void onBatch(BatchResult result) {
    }
}
