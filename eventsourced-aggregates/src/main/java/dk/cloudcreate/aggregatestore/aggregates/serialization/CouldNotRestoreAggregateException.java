package dk.cloudcreate.aggregatestore.aggregates.serialization;

import dk.cloudcreate.aggregatestore.aggregates.AggregateException;

/**
 * Thrown when an {@link AggregateDataSet} can't be turned into an aggregate of the expected type and id
 */
public class CouldNotRestoreAggregateException extends AggregateException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;

    public CouldNotRestoreAggregateException(Object aggregateId, Class<?> aggregateType, String message) {
        super(message);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }

    public CouldNotRestoreAggregateException(Object aggregateId, Class<?> aggregateType, String message, Throwable cause) {
        super(message, cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
