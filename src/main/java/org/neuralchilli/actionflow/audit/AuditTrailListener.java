package org.neuralchilli.actionflow.audit;

import org.neuralchilli.actionflow.domain.Event;
import org.neuralchilli.actionflow.events.EventBus;
import org.neuralchilli.actionflow.events.EventListener;
import org.neuralchilli.actionflow.events.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs action lifecycle and offload events as they cross the bus.
 */
public class AuditTrailListener implements EventListener {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailListener.class);

    static final List<String> CHANNELS = List.of(
            EventNames.ACTION_STARTED,
            EventNames.ACTION_COMPLETED,
            EventNames.ACTION_FAILED,
            EventNames.RESPONSE_OFFLOADED
    );

    private final AtomicLong observed = new AtomicLong();

    /**
     * Subscribe to every audited channel
     *
     * @return number of channels actually subscribed
     */
    public int register(EventBus eventBus) {
        int subscribed = 0;
        for (String channel : CHANNELS) {
            if (eventBus.subscribe(channel, this).isSuccess()) {
                subscribed++;
            }
        }
        log.info("Audit trail listening on {}/{} channels", subscribed, CHANNELS.size());
        return subscribed;
    }

    @Override
    public void onEvent(Event event) {
        observed.incrementAndGet();
        switch (event.name()) {
            case EventNames.ACTION_FAILED -> log.warn("[{}] {} from {}: {}",
                    event.correlationId(), event.name(), event.source(), event.payload());
            case EventNames.RESPONSE_OFFLOADED -> log.info("[{}] response of '{}' offloaded to {} ({} bytes)",
                    event.correlationId(), event.payload().get("action"), event.payload().get("reference"),
                    event.payload().get("original_size_bytes"));
            default -> log.debug("[{}] {} from {}: {}",
                    event.correlationId(), event.name(), event.source(), event.payload());
        }
    }

    public long observed() {
        return observed.get();
    }
}
