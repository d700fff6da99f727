package dk.cloudcreate.aggregatestore.aggregates;

import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The table of event handlers an {@link AggregateRoot} uses to apply and replay its events.<br>
 * Handlers are keyed by the concrete event type and at most one handler can be registered per event type.
 * Populate it by overriding {@link AggregateRoot#registerEventHandlers(EventHandlers)}:
 * <pre>{@code
 * @Override
 * protected EventHandlers<CounterId, Integer> registerEventHandlers(EventHandlers<CounterId, Integer> eventHandlers) {
 *     return eventHandlers.register(ValueAdded.class, this::handle)
 *                         .register(CounterDeleted.class, this::handle);
 * }
 * }</pre>
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public final class EventHandlers<ID, VERSION extends Comparable<VERSION>> {
    private final Map<Class<?>, Consumer<Object>> handlers;

    EventHandlers() {
        handlers = new HashMap<>();
    }

    /**
     * Register the handler for events of type <code>eventType</code>
     *
     * @param eventType the concrete event type
     * @param handler   the handler
     * @param <E>       the event type
     * @return this instance
     * @throws DuplicateEventHandlerException if a handler has already been registered for <code>eventType</code>
     */
    public <E extends AggregateSnapshotOrEvent<ID, VERSION>> EventHandlers<ID, VERSION> register(Class<E> eventType, Consumer<? super E> handler) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(handler, "No handler provided");
        if (handlers.containsKey(eventType)) {
            throw new DuplicateEventHandlerException(eventType);
        }
        handlers.put(eventType, event -> handler.accept(eventType.cast(event)));
        return this;
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public boolean hasHandlerFor(Class<?> eventType) {
        return handlers.containsKey(eventType);
    }

    /**
     * Invoke the handler registered for the exact type of <code>event</code>
     *
     * @return true if a handler was found
     */
    boolean apply(AggregateSnapshotOrEvent<ID, VERSION> event) {
        var handler = handlers.get(event.getClass());
        if (handler == null) {
            return false;
        }
        handler.accept(event);
        return true;
    }

    @Override
    public String toString() {
        return "EventHandlers{" +
                "eventTypes=" + handlers.keySet() +
                '}';
    }
}
