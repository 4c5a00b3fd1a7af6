package org.neuralchilli.actionflow.events;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.topic.ITopic;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.actionflow.domain.Event;
import org.neuralchilli.actionflow.domain.EventIds;
import org.neuralchilli.actionflow.state.HealthReport;
import org.neuralchilli.actionflow.state.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Best-effort pub/sub over Hazelcast topics, one topic per event name.
 *
 * Topic listeners only enqueue; a single dispatcher thread polls the inbox and invokes
 * the channel's callbacks, so ordering holds within a channel. Delivery is at-most-once.
 * When the broker is unavailable, publish and subscribe log locally and report failure.
 */
@ApplicationScoped
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int HISTORY_LIMIT = 1000;
    private static final long POLL_TIMEOUT_MILLIS = 1000;

    private final HazelcastInstance hazelcast;

    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();
    private final Map<String, UUID> registrations = new ConcurrentHashMap<>();
    private final BlockingQueue<Event> inbox = new LinkedBlockingQueue<>();
    private final Deque<Event> history = new ArrayDeque<>();

    private volatile boolean running = false;
    private Thread dispatcher;

    @Inject
    public EventBus(HazelcastInstance hazelcast) {
        this.hazelcast = hazelcast;
    }

    /**
     * Publish an event on the channel named after it.
     */
    public OperationResult publish(Event event) {
        remember(event);

        if (!brokerAvailable()) {
            log.info("Event bus unavailable, not delivered: {} from {} {}", event.name(), event.source(), event.payload().keySet());
            return OperationResult.failure(event.name(), "Broker unavailable");
        }

        try {
            ITopic<Event> topic = hazelcast.getTopic(event.name());
            topic.publish(event);
            log.trace("Published {} ({})", event.name(), event.id());
            return OperationResult.success(event.name());
        } catch (RuntimeException e) {
            log.warn("Failed to publish {}: {}", event.name(), e.getMessage());
            return OperationResult.failure(event.name(), e);
        }
    }

    /**
     * Stamp id and timestamp, then publish
     */
    public OperationResult emit(String name, String source, Map<String, Object> payload) {
        return publish(Event.of(name, source, payload, EventIds.none()));
    }

    public OperationResult emit(String name, String source, Map<String, Object> payload, EventIds ids) {
        return publish(Event.of(name, source, payload, ids));
    }

    /**
     * Register a callback on a channel.
     */
    public OperationResult subscribe(String channel, EventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener cannot be null");
        }
        if (!brokerAvailable()) {
            log.info("Event bus unavailable, subscription to {} not registered", channel);
            return OperationResult.failure(channel, "Broker unavailable");
        }

        // listener list and topic registration change together under the channel's map lock
        try {
            listeners.compute(channel, (c, current) -> {
                List<EventListener> channelListeners = current != null ? current : new CopyOnWriteArrayList<>();
                registrations.computeIfAbsent(c, this::registerTopicListener);
                channelListeners.add(listener);
                return channelListeners;
            });
        } catch (RuntimeException e) {
            log.warn("Failed to subscribe to {}: {}", channel, e.getMessage());
            return OperationResult.failure(channel, e);
        }
        ensureDispatcher();

        log.debug("Subscribed to {} ({} listeners)", channel, listeners.getOrDefault(channel, List.of()).size());
        return OperationResult.success(channel);
    }

    /**
     * Remove one callback, or every callback when {@code listener} is null.
     */
    public OperationResult unsubscribe(String channel, EventListener listener) {
        AtomicReference<OperationResult> result =
                new AtomicReference<>(OperationResult.failure(channel, "Not subscribed"));

        listeners.computeIfPresent(channel, (c, channelListeners) -> {
            boolean removed;
            if (listener == null) {
                removed = !channelListeners.isEmpty();
                channelListeners.clear();
            } else {
                removed = channelListeners.remove(listener);
            }
            result.set(removed
                    ? OperationResult.success(c)
                    : OperationResult.failure(c, "Listener not registered"));

            if (channelListeners.isEmpty()) {
                releaseTopicListener(c);
                return null;
            }
            return channelListeners;
        });

        return result.get();
    }

    public OperationResult unsubscribe(String channel) {
        return unsubscribe(channel, null);
    }

    /**
     * Most recent events published through this bus, newest last
     */
    public List<Event> recentEvents(int limit) {
        synchronized (history) {
            List<Event> all = new ArrayList<>(history);
            return all.subList(Math.max(0, all.size() - limit), all.size());
        }
    }

    public List<Event> eventsBySource(String source) {
        synchronized (history) {
            return history.stream().filter(e -> e.source().equals(source)).toList();
        }
    }

    public int activeSubscriptions() {
        return listeners.values().stream().mapToInt(List::size).sum();
    }

    public HealthReport health() {
        Map<String, Object> details = Map.of(
                "active_subscriptions", activeSubscriptions(),
                "channels", listeners.size(),
                "dispatcher_running", running
        );
        if (!brokerAvailable()) {
            return HealthReport.unhealthy("hazelcast-topic", "Broker unavailable").withDetails(details);
        }
        return HealthReport.healthy("hazelcast-topic", Duration.ZERO).withDetails(details);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        Thread current = dispatcher;
        if (current != null) {
            current.interrupt();
        }
        for (String channel : List.copyOf(registrations.keySet())) {
            releaseTopicListener(channel);
        }
        listeners.clear();
        log.info("Event bus stopped");
    }

    private UUID registerTopicListener(String channel) {
        ITopic<Event> topic = hazelcast.getTopic(channel);
        return topic.addMessageListener(message -> inbox.offer(message.getMessageObject()));
    }

    private void releaseTopicListener(String channel) {
        UUID registration = registrations.remove(channel);
        if (registration == null || !brokerAvailable()) {
            return;
        }
        try {
            hazelcast.getTopic(channel).removeMessageListener(registration);
        } catch (RuntimeException e) {
            log.warn("Failed to release topic listener for {}: {}", channel, e.getMessage());
        }
    }

    private synchronized void ensureDispatcher() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "event-bus-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Event bus dispatcher started");
    }

    private void dispatchLoop() {
        try {
            while (running) {
                try {
                    Event event = inbox.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                    if (event != null) {
                        dispatch(event);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            // a dead loop must be restartable by the next subscribe
            synchronized (this) {
                if (dispatcher == Thread.currentThread()) {
                    running = false;
                }
            }
            log.debug("Event bus dispatcher exited");
        }
    }

    private void dispatch(Event event) {
        List<EventListener> channelListeners = listeners.getOrDefault(event.name(), List.of());
        for (EventListener listener : channelListeners) {
            try {
                listener.onEvent(event);
            } catch (Throwable t) {
                log.error("Listener on {} failed for event {}: {}", event.name(), event.id(), t.getMessage(), t);
            }
        }
    }

    private void remember(Event event) {
        synchronized (history) {
            history.addLast(event);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
    }

    private boolean brokerAvailable() {
        return hazelcast != null && hazelcast.getLifecycleService().isRunning();
    }
}
