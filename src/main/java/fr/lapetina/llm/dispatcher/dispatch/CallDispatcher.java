package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.CallResult;

/**
 * Runs one request to a terminal {@link CallResult}.
 *
 * Implementations never throw for provider or pool failures; those become the result.
 */
@FunctionalInterface
public interface CallDispatcher {

    CallResult dispatch(CallRequest request);
}
