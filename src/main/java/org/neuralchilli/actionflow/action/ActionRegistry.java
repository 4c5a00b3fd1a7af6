package org.neuralchilli.actionflow.action;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to capability lookup over every registered {@link Action}.
 */
@ApplicationScoped
public class ActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionRegistry.class);

    private final Map<String, Action> actions = new ConcurrentHashMap<>();

    @Inject
    public ActionRegistry(@Any Instance<Action> discovered) {
        discovered.forEach(this::register);
        log.info("Action registry initialized with {} actions", actions.size());
    }

    public ActionRegistry(List<? extends Action> initial) {
        initial.forEach(this::register);
    }

    /**
     * Register an action, replacing any previous action with the same name
     */
    public void register(Action action) {
        Action previous = actions.put(action.name(), action);
        if (previous != null && previous != action) {
            log.warn("Action '{}' re-registered, replacing {}", action.name(), previous.getClass().getSimpleName());
        }
    }

    public Optional<Action> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(actions.get(name));
    }

    public boolean contains(String name) {
        return name != null && actions.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(actions.keySet());
    }

    public Set<String> byCategory(String category) {
        Set<String> names = new TreeSet<>();
        actions.values().stream()
                .filter(a -> a.category().equals(category))
                .forEach(a -> names.add(a.name()));
        return names;
    }

    public int size() {
        return actions.size();
    }
}
