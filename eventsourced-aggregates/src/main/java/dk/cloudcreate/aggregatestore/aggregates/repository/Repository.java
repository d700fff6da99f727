package dk.cloudcreate.aggregatestore.aggregates.repository;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.aggregates.serialization.*;
import dk.cloudcreate.aggregatestore.common.transaction.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Unit of work scoped cache of the aggregates of a single type.<br>
 * The repository tracks every aggregate it loads or is given in a {@link TrackingState} and, when the owning
 * {@link UnitOfWorkScope} completes, turns the tracked changes into a single {@link ChangeSet} that is handed to
 * {@link #flush(ChangeSet)}. Within one unit of work loading the same id twice returns the same instance.
 * <p>
 * Storage specific subclasses implement {@link #selectById(Object)} and {@link #flush(ChangeSet)}.
 * A repository instance belongs to one {@link UnitOfWorkContext} and must not be shared between concurrently running operations.
 *
 * @param <ID>        the aggregate id type
 * @param <VERSION>   the aggregate version type
 * @param <AGGREGATE> the aggregate type
 */
public abstract class Repository<ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> implements UnitOfWork {
    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    private final UnitOfWorkContext                                  unitOfWorkContext;
    private final SerializationStrategy                              serializationStrategy;
    private final Class<AGGREGATE>                                   aggregateType;
    private final Map<ID, TrackedAggregate<ID, VERSION, AGGREGATE>> trackedAggregates;
    private       boolean                                            hasBeenFlushed;

    protected Repository(UnitOfWorkContext unitOfWorkContext, SerializationStrategy serializationStrategy, Class<AGGREGATE> aggregateType) {
        this.unitOfWorkContext = requireNonNull(unitOfWorkContext, "No unitOfWorkContext provided");
        this.serializationStrategy = requireNonNull(serializationStrategy, "No serializationStrategy provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.trackedAggregates = new LinkedHashMap<>();
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Get the aggregate with the given id. The aggregate is loaded from storage the first time it's requested
     *
     * @param aggregateId the aggregate id
     * @return the aggregate or {@link Optional#empty()} if it doesn't exist, has been soft deleted or was removed in this unit of work
     * @throws CouldNotRestoreAggregateException if the stored data can't be restored
     */
    public Optional<AGGREGATE> tryGetById(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        enlist();
        var tracked = trackedAggregates.get(aggregateId);
        if (tracked != null) {
            if (tracked.state() == TrackingState.Removed) {
                return Optional.empty();
            }
            return Optional.of(tracked.aggregate);
        }
        var dataSet = selectById(aggregateId);
        if (dataSet.isEmpty()) {
            log.trace("No '{}' with id '{}' found", aggregateType.getSimpleName(), aggregateId);
            return Optional.empty();
        }
        var aggregate = serializationStrategy.deserialize(aggregateId, dataSet.get(), aggregateType, unitOfWorkContext.eventBus());
        if (aggregate.hasBeenRemoved()) {
            log.debug("'{}' with id '{}' has been soft deleted", aggregateType.getSimpleName(), aggregateId);
            return Optional.empty();
        }
        log.debug("Loaded '{}' with id '{}' at version '{}'", aggregateType.getSimpleName(), aggregateId, aggregate.version());
        trackedAggregates.put(aggregateId, TrackedAggregate.loaded(aggregate, dataSet.get().events().size()));
        return Optional.of(aggregate);
    }

    /**
     * Get the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return the aggregate
     * @throws AggregateNotFoundException        if the aggregate doesn't exist, has been soft deleted or was removed in this unit of work
     * @throws CouldNotRestoreAggregateException if the stored data can't be restored
     */
    public AGGREGATE getById(ID aggregateId) {
        return tryGetById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateType));
    }

    /**
     * Add a new aggregate. It will be inserted when the unit of work completes
     *
     * @param aggregate the new aggregate
     * @return true if the aggregate was added, false if this exact instance is already tracked
     * @throws DuplicateKeyException if another aggregate with the same id is tracked or stored, or if the id was removed in this unit of work
     */
    public boolean add(AGGREGATE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        enlist();
        var aggregateId = aggregate.aggregateId();
        var tracked     = trackedAggregates.get(aggregateId);
        if (tracked != null) {
            if (tracked.state() != TrackingState.Removed && tracked.aggregate == aggregate) {
                return false;
            }
            throw new DuplicateKeyException(aggregateId, aggregateType);
        }
        if (selectById(aggregateId).isPresent()) {
            throw new DuplicateKeyException(aggregateId, aggregateType);
        }
        log.debug("Added '{}' with id '{}'", aggregateType.getSimpleName(), aggregateId);
        trackedAggregates.put(aggregateId, TrackedAggregate.added(aggregate));
        return true;
    }

    /**
     * Remove an aggregate that is tracked by this repository. The aggregate is notified (see {@link AggregateRoot#notifyRemoved()})
     * and will be deleted when the unit of work completes. An aggregate added in this unit of work is simply forgotten
     *
     * @param aggregate the aggregate to remove
     * @return true if the aggregate was removed, false if it's null, not tracked, already removed or not the tracked instance
     */
    public boolean remove(AGGREGATE aggregate) {
        if (aggregate == null) {
            return false;
        }
        enlist();
        var aggregateId = aggregate.aggregateId();
        var tracked     = trackedAggregates.get(aggregateId);
        if (tracked == null || tracked.aggregate != aggregate || tracked.state() == TrackingState.Removed) {
            return false;
        }
        aggregate.notifyRemoved();
        if (tracked.state() == TrackingState.Added) {
            log.debug("Removed the added '{}' with id '{}' before it was inserted", aggregateType.getSimpleName(), aggregateId);
            trackedAggregates.remove(aggregateId);
        } else {
            log.debug("Removed '{}' with id '{}'", aggregateType.getSimpleName(), aggregateId);
            tracked.markAsRemoved();
        }
        return true;
    }

    /**
     * Load and remove the aggregate with the given id
     *
     * @return true if the aggregate was found and removed
     * @see #remove(AggregateRoot)
     */
    public boolean removeById(ID aggregateId) {
        return tryGetById(aggregateId).map(this::remove).orElse(false);
    }

    /**
     * The current tracking state of the given id ({@link TrackingState#Null} if it isn't tracked)
     */
    public TrackingState trackingStateOf(ID aggregateId) {
        var tracked = trackedAggregates.get(aggregateId);
        return tracked == null ? TrackingState.Null : tracked.state();
    }

    public Class<AGGREGATE> aggregateType() {
        return aggregateType;
    }

    public SerializationStrategy serializationStrategy() {
        return serializationStrategy;
    }

    public UnitOfWorkContext unitOfWorkContext() {
        return unitOfWorkContext;
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    @Override
    public boolean requiresFlush() {
        if (hasBeenFlushed) {
            return false;
        }
        return trackedAggregates.values().stream().anyMatch(TrackedAggregate::requiresFlush);
    }

    /**
     * Build the {@link ChangeSet} and hand it to {@link #flush(ChangeSet)}. After a successful write all remaining
     * aggregates are {@link TrackingState#Unmodified} at their new version; if building or writing the change set fails
     * all tracked aggregates are discarded and the exception is rethrown
     */
    @Override
    public void flush() {
        if (hasBeenFlushed) {
            log.debug("Repository for '{}' has already been flushed", aggregateType.getSimpleName());
            return;
        }
        hasBeenFlushed = true;
        try {
            var changeSet = createChangeSet();
            if (changeSet.isEmpty()) {
                log.trace("No changes to flush for '{}'", aggregateType.getSimpleName());
                return;
            }
            log.debug("Flushing {} for '{}'", changeSet, aggregateType.getSimpleName());
            flush(changeSet);
        } catch (RuntimeException e) {
            log.debug("Flushing changes for '{}' failed, discarding {} tracked aggregate(s)", aggregateType.getSimpleName(), trackedAggregates.size());
            trackedAggregates.clear();
            throw e;
        }
        var iterator = trackedAggregates.values().iterator();
        while (iterator.hasNext()) {
            var tracked = iterator.next();
            if (tracked.state() == TrackingState.Removed) {
                iterator.remove();
            } else {
                tracked.markAsCommitted();
            }
        }
    }

    private ChangeSet<ID, VERSION> createChangeSet() {
        var aggregatesToInsert = new ArrayList<AggregateWriteSet<ID, VERSION>>();
        var aggregatesToUpdate = new ArrayList<AggregateWriteSet<ID, VERSION>>();
        var aggregatesToDelete = new ArrayList<ID>();
        for (var tracked : trackedAggregates.values()) {
            if (!tracked.requiresFlush()) {
                continue;
            }
            var aggregate = tracked.aggregate;
            switch (tracked.state()) {
                case Added:
                    log.trace("Inserting '{}' with id '{}'", aggregateType.getSimpleName(), aggregate.aggregateId());
                    aggregatesToInsert.add(serialize(tracked, null));
                    break;
                case Modified:
                    log.trace("Updating '{}' with id '{}'", aggregateType.getSimpleName(), aggregate.aggregateId());
                    aggregatesToUpdate.add(serialize(tracked, tracked.storedVersion()));
                    break;
                case Removed:
                    if (aggregate.isSoftDeleteEnabled()) {
                        log.trace("Soft deleting '{}' with id '{}'", aggregateType.getSimpleName(), aggregate.aggregateId());
                        aggregatesToUpdate.add(serializeSoftDeleted(tracked));
                    } else {
                        log.trace("Deleting '{}' with id '{}'", aggregateType.getSimpleName(), aggregate.aggregateId());
                        aggregatesToDelete.add(aggregate.aggregateId());
                    }
                    break;
                default:
                    break;
            }
        }
        return new ChangeSet<>(aggregatesToInsert, aggregatesToUpdate, aggregatesToDelete);
    }

    private AggregateWriteSet<ID, VERSION> serialize(TrackedAggregate<ID, VERSION, AGGREGATE> tracked, VERSION expectedVersion) {
        var writeSet = serializationStrategy.serialize(tracked.aggregate, expectedVersion, tracked.eventsSinceLastSnapshot());
        tracked.pendingWriteSet(writeSet);
        return writeSet;
    }

    /**
     * The update must leave a removed marker in storage: the terminal event if the aggregate applied one, otherwise a snapshot
     */
    private AggregateWriteSet<ID, VERSION> serializeSoftDeleted(TrackedAggregate<ID, VERSION, AGGREGATE> tracked) {
        var aggregate = tracked.aggregate;
        if (aggregate.hasChanges()) {
            return serialize(tracked, tracked.storedVersion());
        }
        if (!serializationStrategy.usesSnapshots()) {
            throw new RepositoryException(msg("Cannot soft delete aggregate of type '{}' with Id '{}' because it applied no terminal event and {} doesn't write snapshots",
                                              aggregateType.getSimpleName(),
                                              aggregate.aggregateId(),
                                              serializationStrategy));
        }
        var writeSet = serializationStrategy.serializeSnapshot(aggregate, tracked.storedVersion());
        tracked.pendingWriteSet(writeSet);
        return writeSet;
    }

    private void enlist() {
        unitOfWorkContext.enlist(this);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Read the persisted data of the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return the data set or {@link Optional#empty()} if nothing is stored under the id
     */
    protected abstract Optional<AggregateDataSet> selectById(ID aggregateId);

    /**
     * Write all changes to storage atomically
     *
     * @param changeSet the changes (never empty)
     */
    protected abstract void flush(ChangeSet<ID, VERSION> changeSet);
}
