package fr.lapetina.llm.dispatcher.provider;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.ErrorType;
import fr.lapetina.llm.dispatcher.domain.model.ProviderResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpProviderCallTest {

    private HttpServer server;
    private final AtomicReference<String> receivedAuth = new AtomicReference<>();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"text\":\"hello\"}";
    private volatile long delayMs = 0;

    private final Credential credential = Credential.builder()
            .providerId("gemini").apiKey("secret-key-123").index(0).build();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/generate", exchange -> {
            receivedAuth.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpProviderCall provider() {
        return HttpProviderCall.builder()
                .providerId("gemini")
                .endpoint("http://127.0.0.1:" + server.getAddress().getPort() + "/generate")
                .authHeader("x-api-key")
                .authScheme("")
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    private CompletableFuture<ProviderResponse> call(Duration timeout) {
        CallRequest request = CallRequest.of("gemini", Map.of("prompt", "hi"));
        return provider().call(request, credential, CallContext.start(1, timeout, Instant.now()));
    }

    private static ProviderCallException failureOf(CompletableFuture<ProviderResponse> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            assertThat(e.getCause()).isInstanceOf(ProviderCallException.class);
            return (ProviderCallException) e.getCause();
        }
        throw new AssertionError("Expected the call to fail");
    }

    @Nested
    @DisplayName("exchange")
    class ExchangeTests {

        @Test
        @DisplayName("should post the payload with the key in the auth header")
        void shouldPostPayload() {
            ProviderResponse response = call(Duration.ofSeconds(2)).join();

            assertThat(response.body()).isEqualTo("{\"text\":\"hello\"}");
            assertThat(response.credentialId()).isEqualTo("gemini-0");
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(receivedAuth.get()).isEqualTo("secret-key-123");
            assertThat(receivedBody.get()).isEqualTo("{\"prompt\":\"hi\"}");
        }

        @Test
        @DisplayName("should classify a 429 as rate limited with the provider message")
        void shouldClassifyRateLimit() {
            status = 429;
            responseBody = "{\"error\":{\"message\":\"quota exceeded\"}}";

            ProviderCallException failure = failureOf(call(Duration.ofSeconds(2)));

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.RATE_LIMITED);
            assertThat(failure.getStatusCode()).isEqualTo(429);
            assertThat(failure.getMessage()).isEqualTo("HTTP 429: quota exceeded");
        }

        @Test
        @DisplayName("should classify a slow response as a timeout")
        void shouldTimeOut() {
            delayMs = 1_000;

            ProviderCallException failure = failureOf(call(Duration.ofMillis(200)));

            assertThat(failure.getErrorType()).isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should classify a refused connection as a transport error")
        void shouldClassifyConnectionFailure() {
            int port = server.getAddress().getPort();
            server.stop(0);
            HttpProviderCall closed = HttpProviderCall.builder()
                    .providerId("gemini")
                    .endpoint("http://127.0.0.1:" + port + "/generate")
                    .build();

            CompletableFuture<ProviderResponse> future = closed.call(
                    CallRequest.of("gemini", Map.of()), credential,
                    CallContext.start(1, Duration.ofSeconds(2), Instant.now()));

            assertThat(failureOf(future).getErrorType()).isEqualTo(ErrorType.TRANSPORT_ERROR);
        }
    }

    @Nested
    @DisplayName("status mapping")
    class StatusMappingTests {

        @Test
        @DisplayName("should map statuses onto the error taxonomy")
        void shouldMapStatuses() {
            assertThat(HttpProviderCall.classifyStatus(429)).isEqualTo(ErrorType.RATE_LIMITED);
            assertThat(HttpProviderCall.classifyStatus(401)).isEqualTo(ErrorType.AUTH_ERROR);
            assertThat(HttpProviderCall.classifyStatus(403)).isEqualTo(ErrorType.AUTH_ERROR);
            assertThat(HttpProviderCall.classifyStatus(408)).isEqualTo(ErrorType.TIMEOUT);
            assertThat(HttpProviderCall.classifyStatus(400)).isEqualTo(ErrorType.INVALID_RESPONSE);
            assertThat(HttpProviderCall.classifyStatus(404)).isEqualTo(ErrorType.INVALID_RESPONSE);
            assertThat(HttpProviderCall.classifyStatus(500)).isEqualTo(ErrorType.TRANSPORT_ERROR);
            assertThat(HttpProviderCall.classifyStatus(503)).isEqualTo(ErrorType.TRANSPORT_ERROR);
        }

        @Test
        @DisplayName("should read error messages from the common body shapes")
        void shouldExtractMessages() {
            HttpProviderCall provider = provider();

            assertThat(provider.extractErrorMessage("{\"error\":\"bad key\"}", 401)).isEqualTo("HTTP 401: bad key");
            assertThat(provider.extractErrorMessage("{\"error\":{\"message\":\"slow down\"}}", 429))
                    .isEqualTo("HTTP 429: slow down");
            assertThat(provider.extractErrorMessage("<html>oops</html>", 502)).isEqualTo("HTTP 502");
            assertThat(provider.extractErrorMessage("", 500)).isEqualTo("HTTP 500");
        }

        @Test
        @DisplayName("should not leak the api key in its description")
        void shouldHideKey() {
            assertThat(provider().toString()).doesNotContain("secret-key-123");
        }
    }
}
