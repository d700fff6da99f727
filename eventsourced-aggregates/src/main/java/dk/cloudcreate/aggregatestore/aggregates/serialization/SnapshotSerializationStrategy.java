package dk.cloudcreate.aggregatestore.aggregates.serialization;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Writes a full snapshot on every change and restores from the snapshot
 *
 * @see SerializationStrategy#useSnapshots()
 */
final class SnapshotSerializationStrategy extends SerializationStrategy {
    @Override
    public boolean usesEvents() {
        return false;
    }

    @Override
    public boolean usesSnapshots() {
        return true;
    }

    @Override
    protected <ID, VERSION extends Comparable<VERSION>> AggregateWriteSet<ID, VERSION> createWriteSet(AggregateRoot<ID, VERSION> aggregate,
                                                                                                      VERSION expectedVersion,
                                                                                                      int eventsSinceLastSnapshot) {
        return new AggregateWriteSet<>(aggregate.aggregateId(),
                                       expectedVersion,
                                       aggregate.version(),
                                       AggregateDataSet.ofSnapshot(aggregate.takeSnapshot()),
                                       0);
    }

    @Override
    protected <ID, VERSION extends Comparable<VERSION>> AggregateRoot<ID, VERSION> restore(ID aggregateId,
                                                                                           AggregateDataSet dataSet,
                                                                                           Class<?> aggregateType,
                                                                                           DomainEventBus eventBus) {
        var snapshot = dataSet.snapshot()
                              .orElseThrow(() -> new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                                                       msg("Cannot restore aggregate of type '{}' with Id '{}' because no snapshot was found",
                                                                                           aggregateType.getSimpleName(),
                                                                                           aggregateId)));
        return restoreFrom(aggregateId, snapshot, dataSet.events(), aggregateType, eventBus);
    }

    @Override
    public String toString() {
        return "SerializationStrategy.useSnapshots()";
    }
}
