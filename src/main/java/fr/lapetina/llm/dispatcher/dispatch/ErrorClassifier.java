package fr.lapetina.llm.dispatcher.dispatch;

import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.provider.ProviderCallException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised by provider futures onto the error taxonomy.
 */
final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    static ErrorType classify(Throwable throwable) {
        Throwable cause = unwrap(throwable);

        if (cause instanceof ProviderCallException pce) {
            return pce.getErrorType();
        }
        if (cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        if (cause instanceof CancellationException) {
            return ErrorType.CANCELLED;
        }
        if (cause instanceof IOException) {
            return ErrorType.TRANSPORT_ERROR;
        }
        return ErrorType.INTERNAL_ERROR;
    }

    static String message(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause.getMessage() != null) {
            return cause.getMessage();
        }
        return cause.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
