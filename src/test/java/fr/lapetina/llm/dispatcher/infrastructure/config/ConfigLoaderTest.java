package fr.lapetina.llm.dispatcher.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = """
            providers:
              - id: gemini
                endpoint: http://localhost:9/generate
                apiKeys: [k1, k2]
            rotation:
              strategy: random
            """;

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void shouldLoadFromClasspath() {
            try (ConfigLoader loader = new ConfigLoader("test-dispatcher.yaml", Map.of())) {
                DispatcherConfig config = loader.load();

                assertThat(config.getDefaultProvider()).isEqualTo("stub");
                assertThat(config.getProviders()).extracting(DispatcherConfig.ProviderConfig::getId)
                        .containsExactly("stub", "single");
                assertThat(config.findProvider("single")).get()
                        .extracting(DispatcherConfig.ProviderConfig::resolveApiKeys)
                        .isEqualTo(List.of("only-key"));
                assertThat(config.getDispatch().getMaxParallelApiKeys()).isEqualTo(3);
                assertThat(config.getPipeline().getRingBufferSize()).isEqualTo(64);
                assertThat(loader.getCurrentConfig()).isSameAs(config);
            }
        }

        @Test
        @DisplayName("should fill unspecified sections with defaults")
        void shouldApplyDefaults() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                DispatcherConfig config = loader.loadFromStream(yaml(MINIMAL));

                assertThat(config.getRotation().getStrategy()).isEqualTo("random");
                assertThat(config.getRotation().getFailureThreshold()).isEqualTo(2);
                assertThat(config.getDispatch().getApiCallTimeoutMs()).isEqualTo(60000);
                assertThat(config.getBatch().getMaxBatchSize()).isEqualTo(10);
                assertThat(config.getMetrics().isEnabled()).isTrue();
            }
        }

        @Test
        @DisplayName("should treat an empty document as the default configuration")
        void shouldHandleEmptyDocument() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                DispatcherConfig config = loader.loadFromStream(yaml(""));

                assertThat(config.getProviders()).isEmpty();
                assertThat(config.getDefaultProvider()).isEqualTo("gemini");
            }
        }

        @Test
        @DisplayName("should apply environment overrides on load")
        void shouldApplyEnvironment() {
            Map<String, String> env = Map.of(
                    "API_KEY_ROTATION_STRATEGY", "failover",
                    "GEMINI_API_KEYS", "env-1, env-2,env-3");
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", env)) {
                DispatcherConfig config = loader.loadFromStream(yaml(MINIMAL));

                assertThat(config.getRotation().getStrategy()).isEqualTo("failover");
                assertThat(config.getProviders().get(0).resolveApiKeys()).containsExactly("env-1", "env-2", "env-3");
            }
        }

        @Test
        @DisplayName("should fail on a missing file")
        void shouldFailOnMissingFile() {
            try (ConfigLoader loader = new ConfigLoader("does-not-exist.yaml", Map.of())) {
                assertThatThrownBy(loader::load)
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("not found");
            }
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should reject an unknown rotation strategy")
        void shouldRejectUnknownStrategy() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("rotation:\n  strategy: weighted\n")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("weighted");
            }
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void shouldRejectRingBufferSize() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("pipeline:\n  ringBufferSize: 100\n")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("power of 2");
            }
        }

        @Test
        @DisplayName("should reject an enabled provider without endpoint")
        void shouldRejectMissingEndpoint() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("providers:\n  - id: openai\n")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class)
                        .hasMessageContaining("openai");
            }
        }

        @Test
        @DisplayName("should clamp a retry timeout longer than the call timeout")
        void shouldClampRetryTimeout() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                DispatcherConfig config = loader.loadFromStream(yaml(
                        "dispatch:\n  apiCallTimeoutMs: 1000\n  apiRetryTimeoutMs: 5000\n"));

                assertThat(config.getDispatch().getApiRetryTimeoutMs()).isEqualTo(1000);
            }
        }

        @Test
        @DisplayName("should wrap malformed YAML")
        void shouldWrapMalformedYaml() {
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                assertThatThrownBy(() -> loader.loadFromStream(yaml("dispatch: [unclosed\n")))
                        .isInstanceOf(ConfigLoader.ConfigurationException.class);
            }
        }
    }

    @Nested
    @DisplayName("reload")
    class ReloadTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should notify listeners with the old and new configuration")
        void shouldNotifyListeners() throws IOException {
            Path file = tempDir.resolve("dispatcher.yaml");
            Files.writeString(file, MINIMAL);
            AtomicReference<DispatcherConfig> seenOld = new AtomicReference<>();
            AtomicReference<DispatcherConfig> seenNew = new AtomicReference<>();

            try (ConfigLoader loader = new ConfigLoader(file.toString(), Map.of())) {
                DispatcherConfig first = loader.load();
                loader.addListener((oldConfig, newConfig) -> {
                    seenOld.set(oldConfig);
                    seenNew.set(newConfig);
                });

                Files.writeString(file, MINIMAL.replace("random", "failover"));
                DispatcherConfig second = loader.reload();

                assertThat(seenOld.get()).isSameAs(first);
                assertThat(seenNew.get()).isSameAs(second);
                assertThat(second.getRotation().getStrategy()).isEqualTo("failover");
            }
        }

        @Test
        @DisplayName("should keep the current configuration when the new file is invalid")
        void shouldKeepConfigOnInvalidReload() throws IOException {
            Path file = tempDir.resolve("dispatcher.yaml");
            Files.writeString(file, MINIMAL);

            try (ConfigLoader loader = new ConfigLoader(file.toString(), Map.of())) {
                DispatcherConfig first = loader.load();

                Files.writeString(file, "rotation:\n  strategy: nonsense\n");
                DispatcherConfig afterReload = loader.reload();

                assertThat(afterReload).isSameAs(first);
                assertThat(loader.getCurrentConfig()).isSameAs(first);
            }
        }

        @Test
        @DisplayName("should keep notifying other listeners when one fails")
        void shouldIsolateListenerFailures() {
            AtomicReference<DispatcherConfig> seen = new AtomicReference<>();
            try (ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of())) {
                loader.addListener((oldConfig, newConfig) -> {
                    throw new IllegalStateException("listener broke");
                });
                loader.addListener((oldConfig, newConfig) -> seen.set(newConfig));

                DispatcherConfig config = loader.loadFromStream(yaml(MINIMAL));

                assertThat(seen.get()).isSameAs(config);
            }
        }
    }

    @Nested
    @DisplayName("watching")
    class WatchTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should watch a file on disk until closed")
        void shouldWatchFileOnDisk() throws IOException {
            Path file = dir.resolve("dispatcher.yaml");
            Files.writeString(file, MINIMAL);

            ConfigLoader loader = new ConfigLoader(file.toString(), Map.of());
            loader.load();
            loader.startWatching();
            assertThat(loader.isWatching()).isTrue();

            loader.close();
            assertThat(loader.isWatching()).isFalse();
        }

        @Test
        @DisplayName("should not watch a classpath configuration")
        void shouldNotWatchClasspathResource() {
            try (ConfigLoader loader = new ConfigLoader("test-dispatcher.yaml", Map.of())) {
                loader.load();
                loader.startWatching();

                assertThat(loader.isWatching()).isFalse();
            }
        }
    }
}
