package dk.cloudcreate.aggregatestore.aggregates.serialization;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Appends the new events on every change and, when a snapshot interval is configured, writes a snapshot
 * every time the number of events since the last snapshot reaches the interval
 *
 * @see SerializationStrategy#useEvents()
 * @see SerializationStrategy#useEvents(int)
 */
final class EventSerializationStrategy extends SerializationStrategy {
    static final int NO_SNAPSHOTS = 0;

    private final int snapshotInterval;

    EventSerializationStrategy(int snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    @Override
    public boolean usesEvents() {
        return true;
    }

    @Override
    public boolean usesSnapshots() {
        return snapshotInterval != NO_SNAPSHOTS;
    }

    @Override
    protected <ID, VERSION extends Comparable<VERSION>> AggregateWriteSet<ID, VERSION> createWriteSet(AggregateRoot<ID, VERSION> aggregate,
                                                                                                      VERSION expectedVersion,
                                                                                                      int eventsSinceLastSnapshot) {
        var events       = aggregate.uncommittedChanges();
        var eventsToDate = eventsSinceLastSnapshot + events.size();
        if (usesSnapshots() && eventsToDate >= snapshotInterval) {
            return new AggregateWriteSet<>(aggregate.aggregateId(),
                                           expectedVersion,
                                           aggregate.version(),
                                           new AggregateDataSet(aggregate.takeSnapshot(), events),
                                           0);
        }
        return new AggregateWriteSet<>(aggregate.aggregateId(),
                                       expectedVersion,
                                       aggregate.version(),
                                       AggregateDataSet.ofEvents(events),
                                       eventsToDate);
    }

    @Override
    protected <ID, VERSION extends Comparable<VERSION>> AggregateRoot<ID, VERSION> restore(ID aggregateId,
                                                                                           AggregateDataSet dataSet,
                                                                                           Class<?> aggregateType,
                                                                                           DomainEventBus eventBus) {
        var snapshot = dataSet.snapshot();
        if (usesSnapshots() && snapshot.isPresent()) {
            return restoreFrom(aggregateId, snapshot.get(), dataSet.events(), aggregateType, eventBus);
        }
        var events = dataSet.events();
        if (events.isEmpty()) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Cannot restore aggregate of type '{}' with Id '{}' because no events were found",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId));
        }
        return restoreFrom(aggregateId, events.get(0), events.subList(1, events.size()), aggregateType, eventBus);
    }

    @Override
    public String toString() {
        return usesSnapshots() ? "SerializationStrategy.useEvents(" + snapshotInterval + ")" : "SerializationStrategy.useEvents()";
    }
}
