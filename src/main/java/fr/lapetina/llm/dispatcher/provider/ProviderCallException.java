package fr.lapetina.llm.dispatcher.provider;

import fr.lapetina.llm.dispatcher.domain.model.ErrorType;

import java.util.Objects;

/**
 * Classified failure of a provider call. Provider variants complete their future
 * exceptionally with this exception.
 */
public class ProviderCallException extends RuntimeException {

    private final ErrorType errorType;
    private final int statusCode;

    public ProviderCallException(ErrorType errorType, String message) {
        this(errorType, message, -1, null);
    }

    public ProviderCallException(ErrorType errorType, String message, Throwable cause) {
        this(errorType, message, -1, cause);
    }

    public ProviderCallException(ErrorType errorType, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
        this.statusCode = statusCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * HTTP status that caused the failure, or -1 when there was none.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
