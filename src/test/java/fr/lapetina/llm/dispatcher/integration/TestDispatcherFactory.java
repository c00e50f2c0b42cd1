package fr.lapetina.llm.dispatcher.integration;

import fr.lapetina.llm.dispatcher.DispatcherFactory;
import fr.lapetina.llm.dispatcher.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.dispatcher.provider.ProviderRegistry;
import fr.lapetina.llm.dispatcher.support.MutableClock;
import fr.lapetina.llm.dispatcher.support.StubProviderCall;

import java.util.Map;

/**
 * Test extension of DispatcherFactory wired with scripted providers instead of HTTP.
 */
public final class TestDispatcherFactory extends DispatcherFactory {

    private final StubProviderCall stub;
    private final StubProviderCall single;
    private final MutableClock clock;

    private TestDispatcherFactory(String configPath, Providers providers) {
        super(new ConfigLoader(configPath, Map.of()), providers.registry, providers.clock);
        this.stub = providers.stub;
        this.single = providers.single;
        this.clock = providers.clock;
    }

    /**
     * Creates and starts a factory from the default test configuration.
     */
    public static TestDispatcherFactory create() {
        return create("test-dispatcher.yaml");
    }

    public static TestDispatcherFactory create(String configPath) {
        TestDispatcherFactory factory = new TestDispatcherFactory(configPath, new Providers());
        factory.start();
        return factory;
    }

    /**
     * Provider with three keys.
     */
    public StubProviderCall stub() {
        return stub;
    }

    /**
     * Provider with one key.
     */
    public StubProviderCall single() {
        return single;
    }

    public MutableClock clock() {
        return clock;
    }

    private static final class Providers {
        final StubProviderCall stub = new StubProviderCall("stub");
        final StubProviderCall single = new StubProviderCall("single");
        final MutableClock clock = new MutableClock();
        final ProviderRegistry registry = new ProviderRegistry();

        Providers() {
            registry.register(stub);
            registry.register(single);
        }
    }
}
