package dk.cloudcreate.aggregatestore.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an event is applied to an aggregate that has already been removed
 */
public class AggregateRemovedException extends AggregateException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;
    public final Class<?> eventType;

    public AggregateRemovedException(Object aggregateId, Class<?> aggregateType, Class<?> eventType) {
        super(msg("Cannot apply event of type '{}' to aggregate of type '{}' with Id '{}' because the aggregate has been removed",
                  eventType.getSimpleName(),
                  aggregateType.getSimpleName(),
                  aggregateId));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }
}
