package fr.lapetina.llm.dispatcher.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.dispatcher.domain.event.CallRequestEvent;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * First stage handler: validates submitted call requests.
 *
 * Validates:
 * - Request is not null
 * - Provider id is present and known
 *
 * The payload is never inspected, an empty one included.
 */
public final class ValidationHandler implements EventHandler<CallRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(ValidationHandler.class);

    private final Predicate<String> knownProvider;

    public ValidationHandler(Predicate<String> knownProvider) {
        this.knownProvider = knownProvider;
    }

    @Override
    public void onEvent(CallRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            log.debug("Skipping already processed event: sequence={}", sequence);
            return;
        }

        event.setSequence(sequence);
        CallRequest request = event.getRequest();

        try {
            validate(request);
            event.markValidated();

            log.debug("Request validated: requestId={}, providerId={}, sequence={}",
                    request.requestId(), request.providerId(), sequence);

        } catch (ValidationException e) {
            event.markValidationFailed(e.getMessage());

            log.warn("Validation failed: requestId={}, providerId={}, reason={}, sequence={}",
                    request != null ? request.requestId() : "null",
                    request != null ? request.providerId() : "null",
                    e.getMessage(),
                    sequence);
        }
    }

    private void validate(CallRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }
        if (request.providerId().isBlank()) {
            throw new ValidationException("Provider id is required");
        }
        if (!knownProvider.test(request.providerId())) {
            throw new ValidationException("Unknown provider: " + request.providerId());
        }
    }

    private static class ValidationException extends Exception {
        ValidationException(String message) {
            super(message);
        }
    }
}
