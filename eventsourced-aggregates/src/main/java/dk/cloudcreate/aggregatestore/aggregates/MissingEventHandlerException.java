package dk.cloudcreate.aggregatestore.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class MissingEventHandlerException extends AggregateException {
    public final Class<?> aggregateType;
    public final Class<?> eventType;

    public MissingEventHandlerException(Class<?> aggregateType, Class<?> eventType) {
        super(msg("Aggregate of type '{}' has no handler registered for event of type '{}'",
                  aggregateType.getSimpleName(),
                  eventType.getSimpleName()));
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }
}
