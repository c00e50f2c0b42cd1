package fr.lapetina.llm.dispatcher.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link CallRequestEvent} instances for the ring buffer.
 */
public final class CallRequestEventFactory implements EventFactory<CallRequestEvent> {

    @Override
    public CallRequestEvent newInstance() {
        return new CallRequestEvent();
    }
}
