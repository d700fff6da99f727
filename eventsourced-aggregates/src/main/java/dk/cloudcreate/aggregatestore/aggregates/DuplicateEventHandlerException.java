package dk.cloudcreate.aggregatestore.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class DuplicateEventHandlerException extends AggregateException {
    public final Class<?> eventType;

    public DuplicateEventHandlerException(Class<?> eventType) {
        super(msg("Another handler for event of type '{}' has already been registered", eventType.getSimpleName()));
        this.eventType = eventType;
    }
}
