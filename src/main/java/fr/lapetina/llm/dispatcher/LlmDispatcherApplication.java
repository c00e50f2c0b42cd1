package fr.lapetina.llm.dispatcher;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.dispatcher.dispatch.BatchValidationException;
import fr.lapetina.llm.dispatcher.domain.model.BatchResult;
import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command-line entry point: runs a JSON batch file through the dispatcher and prints
 * the index-aligned results as JSON.
 *
 * <pre>
 * java -jar llm-dispatcher.jar dispatcher.yaml batch.json
 * </pre>
 *
 * The batch file is an array of {@code {"providerId": "...", "payload": {...}}} objects.
 * A missing {@code providerId} falls back to the configured default provider.
 */
public class LlmDispatcherApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmDispatcherApplication.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);

    private final DispatcherFactory factory;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LlmDispatcherApplication(DispatcherFactory factory) {
        this.factory = factory;
    }

    /**
     * One entry of a batch file.
     */
    record BatchEntry(String requestId, String providerId, Map<String, Object> payload) {
    }

    /**
     * Reads batch entries and turns them into requests.
     */
    List<CallRequest> readBatch(InputStream input) throws IOException {
        List<BatchEntry> entries = MAPPER.readValue(input, new TypeReference<List<BatchEntry>>() { });
        List<CallRequest> requests = new ArrayList<>(entries.size());
        for (BatchEntry entry : entries) {
            String providerId = entry.providerId() != null && !entry.providerId().isBlank()
                    ? entry.providerId()
                    : factory.getConfig().getDefaultProvider();
            requests.add(CallRequest.builder()
                    .requestId(entry.requestId())
                    .providerId(providerId)
                    .payload(entry.payload())
                    .build());
        }
        return requests;
    }

    public BatchResult run(InputStream batchInput) throws IOException {
        List<CallRequest> requests = readBatch(batchInput);
        log.info("Running batch: size={}", requests.size());
        return factory.getDispatchService().dispatchBatch(requests);
    }

    public String toJson(BatchResult result) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            factory.close();
        }
    }

    /**
     * Runs one batch file and closes the application.
     *
     * @return the process exit code: 0 when every request succeeded, 1 on failed requests or
     *         errors, 2 when the batch was rejected
     */
    static int execute(LlmDispatcherApplication application, Path batchPath, PrintStream out) {
        try (LlmDispatcherApplication app = application;
             InputStream input = Files.newInputStream(batchPath)) {
            BatchResult result = app.run(input);
            out.println(app.toJson(result));
            log.info("Batch finished: successes={}, failures={}, timedOut={}, elapsed={}",
                    result.successCount(), result.failureCount(), result.timedOut(), result.elapsed());
            return result.failureCount() > 0 ? 1 : 0;
        } catch (BatchValidationException e) {
            log.error("Batch rejected: {}", e.getMessage());
            return 2;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to run batch: batch={}", batchPath, e);
            return 1;
        }
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: LlmDispatcherApplication <config.yaml> <batch.json>");
            System.exit(2);
        }

        int exitCode;
        try {
            LlmDispatcherApplication app = new LlmDispatcherApplication(DispatcherFactory.create(args[0]).start());
            Runtime.getRuntime().addShutdownHook(new Thread(app::close, "dispatcher-shutdown"));
            exitCode = execute(app, Paths.get(args[1]), System.out);
        } catch (RuntimeException e) {
            log.error("Failed to start dispatcher", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
