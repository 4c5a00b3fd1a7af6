package org.neuralchilli.actionflow.events;

import org.neuralchilli.actionflow.domain.Event;

/**
 * Callback registered on an event channel.
 */
@FunctionalInterface
public interface EventListener {

    void onEvent(Event event);
}
