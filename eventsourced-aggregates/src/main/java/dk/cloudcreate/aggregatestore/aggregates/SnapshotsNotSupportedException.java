package dk.cloudcreate.aggregatestore.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class SnapshotsNotSupportedException extends AggregateException {
    public final Class<?> aggregateType;

    public SnapshotsNotSupportedException(Class<?> aggregateType) {
        super(msg("Aggregate of type '{}' does not support snapshots", aggregateType.getSimpleName()));
        this.aggregateType = aggregateType;
    }
}
