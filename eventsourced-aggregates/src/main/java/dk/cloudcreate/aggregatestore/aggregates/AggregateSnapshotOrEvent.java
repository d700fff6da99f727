package dk.cloudcreate.aggregatestore.aggregates;

import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;

/**
 * A {@link SnapshotOrEvent} (in its latest schema version) that belongs to a specific aggregate instance
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public interface AggregateSnapshotOrEvent<ID, VERSION extends Comparable<VERSION>> extends SnapshotOrEvent {
    /**
     * The id of the aggregate this record belongs to
     */
    ID aggregateId();

    /**
     * The version the aggregate had right after this record was produced
     */
    VERSION version();

    /**
     * Restore the aggregate from this record. Supported by snapshots and by the event that creates the aggregate.
     *
     * @param eventBus the bus the restored aggregate publishes new events on (may be null)
     * @return the restored aggregate
     * @throws UnsupportedOperationException if this record can't restore an aggregate
     */
    default AggregateRoot<ID, VERSION> restoreAggregate(DomainEventBus eventBus) {
        throw new UnsupportedOperationException(getClass().getName() + " cannot restore an aggregate");
    }
}
