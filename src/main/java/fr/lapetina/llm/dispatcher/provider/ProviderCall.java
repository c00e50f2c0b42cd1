package fr.lapetina.llm.dispatcher.provider;

import fr.lapetina.llm.dispatcher.domain.model.CallRequest;
import fr.lapetina.llm.dispatcher.domain.model.Credential;
import fr.lapetina.llm.dispatcher.domain.model.ProviderResponse;

import java.util.concurrent.CompletableFuture;

/**
 * The network call against one provider, one variant per provider.
 *
 * Implementations must not block the calling thread. Failures complete the returned future
 * exceptionally, preferably with a {@link ProviderCallException} carrying the error kind.
 * Implementations should stop work when the context's token is cancelled, but the
 * dispatcher does not rely on it.
 */
public interface ProviderCall {

    /**
     * Provider identifier this variant serves (e.g. "gemini").
     */
    String providerId();

    CompletableFuture<ProviderResponse> call(CallRequest request, Credential credential, CallContext context);
}
