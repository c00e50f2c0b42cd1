package fr.lapetina.llm.dispatcher.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.ProviderResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Generic JSON-over-HTTP provider variant.
 *
 * Posts the request payload as a JSON document to the provider endpoint, with the
 * credential's key in the configured auth header. The response body is kept opaque.
 * Uses java.net.http.HttpClient for non-blocking I/O.
 */
public class HttpProviderCall implements ProviderCall {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderCall.class);

    private final String providerId;
    private final URI endpoint;
    private final String authHeader;
    private final String authScheme;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpProviderCall(Builder builder) {
        this.providerId = Objects.requireNonNull(builder.providerId, "Provider ID is required");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        this.authHeader = builder.authHeader;
        this.authScheme = builder.authScheme != null ? builder.authScheme : "";

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public CompletableFuture<ProviderResponse> call(CallRequest request, Credential credential, CallContext context) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, credential, context);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode payload: providerId={}, requestId={}", providerId, request.requestId(), e);
            return CompletableFuture.failedFuture(new ProviderCallException(
                    ErrorType.INVALID_RESPONSE, "Payload is not serializable: " + e.getOriginalMessage(), e));
        }

        Instant startTime = Instant.now();
        log.debug("Sending request: providerId={}, requestId={}, credential={}, attempt={}, endpoint={}",
                providerId, request.requestId(), credential.getId(), context.attemptNumber(), endpoint);

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
        context.token().onCancel(() -> exchange.cancel(true));

        return exchange.handle((response, throwable) -> {
            if (throwable != null) {
                throw translate(throwable);
            }
            return toProviderResponse(request, credential, response, startTime);
        });
    }

    private HttpRequest buildHttpRequest(CallRequest request, Credential credential, CallContext context)
            throws JsonProcessingException {
        String body = objectMapper.writeValueAsString(request.payload());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(context.timeout())
                .header("Content-Type", "application/json")
                .header("X-Request-ID", request.requestId())
                .POST(HttpRequest.BodyPublishers.ofString(body));

        if (authHeader != null && !authHeader.isBlank()) {
            builder.header(authHeader, authScheme + credential.getApiKey());
        }
        return builder.build();
    }

    private ProviderResponse toProviderResponse(
            CallRequest request,
            Credential credential,
            HttpResponse<String> response,
            Instant startTime
    ) {
        int statusCode = response.statusCode();
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();

        if (statusCode >= 200 && statusCode < 300) {
            log.debug("Request successful: providerId={}, requestId={}, credential={}, status={}, latencyMs={}",
                    providerId, request.requestId(), credential.getId(), statusCode, latencyMs);
            return new ProviderResponse(
                    providerId,
                    credential.getId(),
                    response.body(),
                    statusCode,
                    Map.of("latencyMs", latencyMs),
                    Instant.now()
            );
        }

        ErrorType errorType = classifyStatus(statusCode);
        String message = extractErrorMessage(response.body(), statusCode);
        log.warn("Request failed with HTTP error: providerId={}, requestId={}, credential={}, status={}, errorType={}, latencyMs={}",
                providerId, request.requestId(), credential.getId(), statusCode, errorType, latencyMs);
        throw new ProviderCallException(errorType, message, statusCode, null);
    }

    /**
     * Maps a non-2xx HTTP status to the error taxonomy.
     */
    static ErrorType classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorType.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ErrorType.AUTH_ERROR;
        }
        if (statusCode == 408) {
            return ErrorType.TIMEOUT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return ErrorType.INVALID_RESPONSE;
        }
        return ErrorType.TRANSPORT_ERROR;
    }

    /**
     * Reads {@code error} or {@code error.message} from a JSON error body.
     */
    String extractErrorMessage(String body, int statusCode) {
        String fallback = "HTTP " + statusCode;
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isTextual()) {
                return fallback + ": " + error.asText();
            }
            if (error.path("message").isTextual()) {
                return fallback + ": " + error.path("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: providerId={}, status={}", providerId, statusCode);
        }
        return fallback;
    }

    private RuntimeException translate(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;

        if (cause instanceof ProviderCallException pce) {
            return pce;
        }
        if (cause instanceof HttpTimeoutException) {
            return new ProviderCallException(ErrorType.TIMEOUT, "Provider call timed out: " + cause.getMessage(), cause);
        }
        if (cause instanceof CancellationException) {
            return new ProviderCallException(ErrorType.CANCELLED, "Provider call cancelled", cause);
        }
        if (cause instanceof IOException) {
            return new ProviderCallException(ErrorType.TRANSPORT_ERROR,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
        return new ProviderCallException(ErrorType.INTERNAL_ERROR,
                "Unexpected provider failure: " + cause.getMessage(), cause);
    }

    public URI getEndpoint() {
        return endpoint;
    }

    @Override
    public String toString() {
        return "HttpProviderCall{" +
                "providerId='" + providerId + '\'' +
                ", endpoint=" + endpoint +
                ", authHeader='" + authHeader + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String providerId;
        private URI endpoint;
        private String authHeader = "Authorization";
        private String authScheme = "Bearer ";
        private Duration connectTimeout = Duration.ofSeconds(10);

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = URI.create(endpoint);
            return this;
        }

        public Builder authHeader(String authHeader) {
            this.authHeader = authHeader;
            return this;
        }

        public Builder authScheme(String authScheme) {
            this.authScheme = authScheme;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public HttpProviderCall build() {
            return new HttpProviderCall(this);
        }
    }
}
