package com.strata.subscription.publish;

import com.strata.eventmodel.StreamEventEnvelope;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InternalEventBus} that calls the handlers on the publishing thread.
 *
 * <p>Registrations may be added while events are published; a publish sees the registrations present
 * when it started. Each handler gets the envelope with its payload typed to the registered class.
 */
public final class InProcessEventBus implements InternalEventBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessEventBus.class);

    private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

    @Override
    public <T> void subscribe(Class<T> payloadType, EventHandler<T> handler) {
        if (payloadType == null || handler == null) {
            throw new IllegalArgumentException("payloadType and handler must not be null");
        }
        registrations.add(new Registration<>(payloadType, handler));
        log.debug("Registered handler for {}", payloadType.getName());
    }

    @Override
    public void publish(StreamEventEnvelope<?> envelope) throws Exception {
        Object payload = envelope.payload();
        int delivered = 0;
        for (Registration<?> registration : registrations) {
            if (registration.payloadType().isInstance(payload)) {
                registration.dispatch(envelope);
                delivered++;
            }
        }
        if (delivered == 0) {
            log.trace("No handler for {}", payload.getClass().getName());
        }
    }

    int handlerCount() {
        return registrations.size();
    }

    private record Registration<T>(Class<T> payloadType, EventHandler<T> handler) {

        void dispatch(StreamEventEnvelope<?> envelope) throws Exception {
            handler.handle(new StreamEventEnvelope<>(payloadType.cast(envelope.payload()), envelope.metadata()));
        }
    }
}
