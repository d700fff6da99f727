package dk.cloudcreate.aggregatestore.aggregates.serialization;

import dk.cloudcreate.aggregatestore.aggregates.*;
import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Decides how an aggregate is written to and restored from storage:
 * <ul>
 *     <li>{@link #useSnapshots()}: every write stores a full snapshot, restore requires a snapshot</li>
 *     <li>{@link #useEvents()}: every write appends the new events, restore replays all events</li>
 *     <li>{@link #useEvents(int)}: every write appends the new events and additionally stores a snapshot once
 *     <code>snapshotInterval</code> events have been written since the last snapshot. Restore uses the latest
 *     snapshot plus the trailing events, or all events if there is no snapshot</li>
 * </ul>
 * All records are upgraded to their latest schema version (see {@link SnapshotOrEvent#updateToLatestVersion(SnapshotOrEvent)})
 * before they are used.
 */
public abstract class SerializationStrategy {
    private static final Logger log = LoggerFactory.getLogger(SerializationStrategy.class);

    public static SerializationStrategy useSnapshots() {
        return new SnapshotSerializationStrategy();
    }

    public static SerializationStrategy useEvents() {
        return new EventSerializationStrategy(EventSerializationStrategy.NO_SNAPSHOTS);
    }

    /**
     * @param snapshotInterval the number of events after which a new snapshot is written (must be positive)
     */
    public static SerializationStrategy useEvents(int snapshotInterval) {
        requireTrue(snapshotInterval > 0, msg("snapshotInterval must be positive but was {}", snapshotInterval));
        return new EventSerializationStrategy(snapshotInterval);
    }

    /**
     * Does this strategy write events
     */
    public abstract boolean usesEvents();

    /**
     * Does this strategy write snapshots
     */
    public abstract boolean usesSnapshots();

    /**
     * Convert the uncommitted changes of <code>aggregate</code> to an {@link AggregateWriteSet} and mark them as committed
     *
     * @param aggregate               the aggregate
     * @param expectedVersion         the version the aggregate had when it was loaded (null for new aggregates)
     * @param eventsSinceLastSnapshot the number of events stored since the most recent snapshot
     * @return the write set
     * @throws SnapshotsNotSupportedException if a snapshot is needed but the aggregate doesn't support snapshots
     */
    public final <ID, VERSION extends Comparable<VERSION>> AggregateWriteSet<ID, VERSION> serialize(AggregateRoot<ID, VERSION> aggregate,
                                                                                                    VERSION expectedVersion,
                                                                                                    int eventsSinceLastSnapshot) {
        requireNonNull(aggregate, "No aggregate provided");
        var writeSet = createWriteSet(aggregate, expectedVersion, eventsSinceLastSnapshot);
        aggregate.markChangesAsCommitted();
        if (log.isTraceEnabled()) {
            log.trace("Serialized '{}' with id '{}' at version '{}': snapshot={}, events={}",
                      aggregate.getClass().getSimpleName(),
                      aggregate.aggregateId(),
                      writeSet.version(),
                      writeSet.dataSet().snapshot().isPresent(),
                      writeSet.dataSet().events().size());
        }
        return writeSet;
    }

    /**
     * Convert <code>aggregate</code> to an {@link AggregateWriteSet} holding a snapshot of its current state, regardless of
     * how many events were stored since the last snapshot. Uncommitted changes are included as events when this strategy
     * writes events, and are marked as committed
     *
     * @param aggregate       the aggregate
     * @param expectedVersion the version the aggregate had when it was loaded
     * @return the write set
     * @throws IllegalArgumentException       if this strategy doesn't write snapshots
     * @throws SnapshotsNotSupportedException if the aggregate doesn't support snapshots
     */
    public final <ID, VERSION extends Comparable<VERSION>> AggregateWriteSet<ID, VERSION> serializeSnapshot(AggregateRoot<ID, VERSION> aggregate,
                                                                                                            VERSION expectedVersion) {
        requireNonNull(aggregate, "No aggregate provided");
        requireTrue(usesSnapshots(), msg("{} doesn't write snapshots", this));
        var events = usesEvents() ? aggregate.uncommittedChanges() : List.<AggregateSnapshotOrEvent<ID, VERSION>>of();
        var writeSet = new AggregateWriteSet<>(aggregate.aggregateId(),
                                               expectedVersion,
                                               aggregate.version(),
                                               new AggregateDataSet(aggregate.takeSnapshot(), events),
                                               0);
        aggregate.markChangesAsCommitted();
        log.trace("Serialized snapshot of '{}' with id '{}' at version '{}'", aggregate.getClass().getSimpleName(), aggregate.aggregateId(), writeSet.version());
        return writeSet;
    }

    /**
     * Restore an aggregate from its persisted data
     *
     * @param aggregateId   the id the data was stored under
     * @param dataSet       the persisted data
     * @param aggregateType the expected aggregate type
     * @param eventBus      the bus the restored aggregate publishes new events on (may be null)
     * @return the restored aggregate
     * @throws CouldNotRestoreAggregateException if the data set doesn't hold what this strategy requires, if a record can't
     *                                           be upgraded or doesn't belong to an aggregate, if restoring fails, or if the
     *                                           restored aggregate isn't of the expected type or id
     */
    public final <ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> AGGREGATE deserialize(ID aggregateId,
                                                                                                                               AggregateDataSet dataSet,
                                                                                                                               Class<AGGREGATE> aggregateType,
                                                                                                                               DomainEventBus eventBus) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(dataSet, "No dataSet provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        AggregateRoot<ID, VERSION> aggregate;
        try {
            if (dataSet.isEmpty()) {
                throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                            msg("Cannot restore aggregate of type '{}' with Id '{}' from an empty data set",
                                                                aggregateType.getSimpleName(),
                                                                aggregateId));
            }
            aggregate = restore(aggregateId, dataSet, aggregateType, eventBus);
        } catch (CouldNotRestoreAggregateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Failed to restore aggregate of type '{}' with Id '{}': {}",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId,
                                                            e.getMessage()),
                                                        e);
        }
        if (!aggregateType.isInstance(aggregate)) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Expected to restore aggregate of type '{}' with Id '{}' but restored an aggregate of type '{}'",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId,
                                                            aggregate == null ? null : aggregate.getClass().getSimpleName()));
        }
        if (!Objects.equals(aggregate.aggregateId(), aggregateId)) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Expected to restore aggregate of type '{}' with Id '{}' but restored an aggregate with Id '{}'",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId,
                                                            aggregate.aggregateId()));
        }
        log.trace("Restored '{}' with id '{}' at version '{}'", aggregateType.getSimpleName(), aggregateId, aggregate.version());
        return aggregateType.cast(aggregate);
    }

    protected abstract <ID, VERSION extends Comparable<VERSION>> AggregateWriteSet<ID, VERSION> createWriteSet(AggregateRoot<ID, VERSION> aggregate,
                                                                                                               VERSION expectedVersion,
                                                                                                               int eventsSinceLastSnapshot);

    /**
     * Restore the aggregate from a non empty data set. Runtime exceptions are wrapped in a {@link CouldNotRestoreAggregateException}
     * by the caller
     */
    protected abstract <ID, VERSION extends Comparable<VERSION>> AggregateRoot<ID, VERSION> restore(ID aggregateId,
                                                                                                    AggregateDataSet dataSet,
                                                                                                    Class<?> aggregateType,
                                                                                                    DomainEventBus eventBus);

    /**
     * Restore an aggregate from <code>snapshotOrEvent</code> and replay <code>events</code> on it
     */
    protected final <ID, VERSION extends Comparable<VERSION>> AggregateRoot<ID, VERSION> restoreFrom(ID aggregateId,
                                                                                                    SnapshotOrEvent snapshotOrEvent,
                                                                                                    List<SnapshotOrEvent> events,
                                                                                                    Class<?> aggregateType,
                                                                                                    DomainEventBus eventBus) {
        AggregateSnapshotOrEvent<ID, VERSION> latest    = upgrade(aggregateId, snapshotOrEvent, aggregateType);
        var                                   aggregate = latest.restoreAggregate(eventBus);
        if (aggregate == null) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("'{}' restored a null aggregate", latest.getClass().getName()));
        }
        if (!events.isEmpty()) {
            var upgradedEvents = new ArrayList<AggregateSnapshotOrEvent<ID, VERSION>>(events.size());
            for (var event : events) {
                upgradedEvents.add(upgrade(aggregateId, event, aggregateType));
            }
            aggregate.rehydrate(upgradedEvents);
        }
        return aggregate;
    }

    @SuppressWarnings("unchecked")
    private static <ID, VERSION extends Comparable<VERSION>> AggregateSnapshotOrEvent<ID, VERSION> upgrade(ID aggregateId,
                                                                                                         SnapshotOrEvent snapshotOrEvent,
                                                                                                         Class<?> aggregateType) {
        SnapshotOrEvent latest;
        try {
            latest = SnapshotOrEvent.updateToLatestVersion(snapshotOrEvent);
        } catch (SnapshotOrEventUpgradeException e) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Cannot restore aggregate of type '{}' with Id '{}': {}",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId,
                                                            e.getMessage()),
                                                        e);
        }
        if (!(latest instanceof AggregateSnapshotOrEvent)) {
            throw new CouldNotRestoreAggregateException(aggregateId, aggregateType,
                                                        msg("Cannot restore aggregate of type '{}' with Id '{}': '{}' is not an AggregateSnapshotOrEvent",
                                                            aggregateType.getSimpleName(),
                                                            aggregateId,
                                                            latest.getClass().getName()));
        }
        return (AggregateSnapshotOrEvent<ID, VERSION>) latest;
    }
}
