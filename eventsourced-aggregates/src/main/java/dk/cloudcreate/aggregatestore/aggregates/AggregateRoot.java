package dk.cloudcreate.aggregatestore.aggregates;

import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;

import java.util.*;
import java.util.function.BiFunction;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for event sourced aggregates.<br>
 * A new aggregate is created from the event that creates it. That event is immediately recorded as an uncommitted
 * change and published on the {@link DomainEventBus}. A restored aggregate is created from a snapshot or from its
 * creation event (see {@link AggregateSnapshotOrEvent#restoreAggregate(DomainEventBus)}) and is brought up to date
 * using {@link #rehydrate(List)}.
 * <p>
 * State changes are made by calling {@link #apply(BiFunction)} with a factory that receives the aggregate id and the
 * {@link #nextVersion()}. The resulting event is applied through the handler registered for its exact type
 * (see {@link #registerEventHandlers(EventHandlers)}), the aggregate version is advanced to the event's version,
 * and the event is recorded and published.
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public abstract class AggregateRoot<ID, VERSION extends Comparable<VERSION>> {
    private final DomainEventBus                           eventBus;
    private final ID                                       aggregateId;
    private final boolean                                  isNewAggregate;
    private final List<AggregateSnapshotOrEvent<ID, VERSION>> uncommittedChanges;
    private       VERSION                                  version;
    private       EventHandlers<ID, VERSION>               eventHandlers;
    private       boolean                                  hasBeenRemoved;

    /**
     * @param eventBus        the bus new events are published on (may be null)
     * @param snapshotOrEvent the creation event (when <code>isNewAggregate</code> is true) or the snapshot/event the aggregate is restored from
     * @param isNewAggregate  is the aggregate a new entity rather than being restored from storage
     */
    protected AggregateRoot(DomainEventBus eventBus, AggregateSnapshotOrEvent<ID, VERSION> snapshotOrEvent, boolean isNewAggregate) {
        requireNonNull(snapshotOrEvent, "No snapshotOrEvent provided");
        this.eventBus = eventBus;
        this.aggregateId = requireNonNull(snapshotOrEvent.aggregateId(), msg("'{}' didn't contain an aggregateId", snapshotOrEvent.getClass().getName()));
        this.version = requireNonNull(snapshotOrEvent.version(), msg("'{}' didn't contain a version", snapshotOrEvent.getClass().getName()));
        this.isNewAggregate = isNewAggregate;
        this.uncommittedChanges = new ArrayList<>();
        if (isNewAggregate) {
            record(snapshotOrEvent);
        }
    }

    /**
     * Create a new aggregate as a consequence of a change to <code>parent</code>. The new aggregate publishes its events
     * on the same {@link DomainEventBus} as its parent
     *
     * @param parent the aggregate that creates this aggregate
     * @param event  the creation event
     */
    protected AggregateRoot(AggregateRoot<?, ?> parent, AggregateSnapshotOrEvent<ID, VERSION> event) {
        this(requireNonNull(parent, "No parent provided").eventBus, event, true);
    }

    public ID aggregateId() {
        return aggregateId;
    }

    public VERSION version() {
        return version;
    }

    /**
     * Was this instance created as a new entity (as opposed to being restored from storage)
     */
    public boolean isNewAggregate() {
        return isNewAggregate;
    }

    /**
     * Compute the version the next event must carry, e.g. <code>version() + 1</code>
     */
    protected abstract VERSION nextVersion();

    /**
     * Register the handlers for the events this aggregate applies. Called once, the first time a handler is needed
     *
     * @param eventHandlers the empty table
     * @return the populated table
     */
    protected EventHandlers<ID, VERSION> registerEventHandlers(EventHandlers<ID, VERSION> eventHandlers) {
        return eventHandlers;
    }

    /**
     * Create, apply, record and publish a new event
     *
     * @param eventFactory creates the event from the aggregate id and {@link #nextVersion()}
     * @param <E>          the event type
     * @return the applied event
     * @throws AggregateRemovedException    if the aggregate has been removed
     * @throws MissingEventHandlerException if no handler is registered for the event type while other handlers are
     * @throws AggregateVersionException    if the event version isn't greater than the current version
     */
    protected final <E extends AggregateSnapshotOrEvent<ID, VERSION>> E apply(BiFunction<ID, VERSION, E> eventFactory) {
        requireNonNull(eventFactory, "No eventFactory provided");
        var event = requireNonNull(eventFactory.apply(aggregateId, nextVersion()), "The eventFactory returned null");
        if (hasBeenRemoved) {
            throw new AggregateRemovedException(aggregateId, getClass(), event.getClass());
        }
        requireTrue(Objects.equals(event.aggregateId(), aggregateId),
                    msg("Aggregate Id's do not match! Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' with aggregateId '{}'",
                        event.getClass().getName(),
                        event.aggregateId(),
                        getClass().getName(),
                        aggregateId));
        requireGreaterVersion(event.version());
        if (!eventHandlers().apply(event) && !eventHandlers().isEmpty()) {
            throw new MissingEventHandlerException(getClass(), event.getClass());
        }
        version = event.version();
        record(event);
        return event;
    }

    /**
     * Replay historic events on a restored aggregate. Events that belong to another aggregate or that don't carry a
     * version greater than the current version (e.g. events already covered by a snapshot) are skipped
     *
     * @param events the historic events in their latest schema version
     * @throws MissingEventHandlerException if one of the events to replay has no registered handler
     */
    public void rehydrate(List<? extends AggregateSnapshotOrEvent<ID, VERSION>> events) {
        requireNonNull(events, "No events provided");
        for (var event : events) {
            if (event == null || !Objects.equals(event.aggregateId(), aggregateId) || event.version().compareTo(version) <= 0) {
                continue;
            }
            if (!eventHandlers().apply(event)) {
                throw new MissingEventHandlerException(getClass(), event.getClass());
            }
            version = event.version();
        }
    }

    /**
     * Create a snapshot of the current state
     *
     * @throws SnapshotsNotSupportedException if the aggregate doesn't support snapshots
     */
    public AggregateSnapshotOrEvent<ID, VERSION> takeSnapshot() {
        throw new SnapshotsNotSupportedException(getClass());
    }

    /**
     * The events applied since the aggregate was created, restored or last committed
     */
    public List<AggregateSnapshotOrEvent<ID, VERSION>> uncommittedChanges() {
        return Collections.unmodifiableList(uncommittedChanges);
    }

    public boolean hasChanges() {
        return !uncommittedChanges.isEmpty();
    }

    /**
     * Reset the {@link #uncommittedChanges()}, marking them as persisted
     *
     * @return the events that were uncommitted
     */
    public List<AggregateSnapshotOrEvent<ID, VERSION>> markChangesAsCommitted() {
        var committed = List.copyOf(uncommittedChanges);
        uncommittedChanges.clear();
        return committed;
    }

    /**
     * Called by the repository when the aggregate is removed. Invokes {@link #onRemoved()}, which lets the aggregate
     * apply its terminal event, and afterwards rejects further changes
     */
    public final void notifyRemoved() {
        if (hasBeenRemoved) {
            return;
        }
        onRemoved();
        hasBeenRemoved = true;
    }

    /**
     * Hook for applying the event that marks the end of the aggregate's life
     */
    protected void onRemoved() {
    }

    /**
     * Mark the aggregate as removed, e.g. when replaying its terminal event or restoring a snapshot of a removed aggregate
     */
    protected final void markAsRemoved() {
        hasBeenRemoved = true;
    }

    public boolean hasBeenRemoved() {
        return hasBeenRemoved;
    }

    /**
     * When true, removing the aggregate keeps its data in storage (with the terminal event/snapshot written as an update)
     * instead of deleting it. Read by the repository when it flushes
     */
    public boolean isSoftDeleteEnabled() {
        return false;
    }

    private void requireGreaterVersion(VERSION newVersion) {
        requireNonNull(newVersion, "The event didn't contain a version");
        if (newVersion.compareTo(version) <= 0) {
            throw new AggregateVersionException(aggregateId, version, newVersion);
        }
    }

    private void record(AggregateSnapshotOrEvent<ID, VERSION> event) {
        uncommittedChanges.add(event);
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    private EventHandlers<ID, VERSION> eventHandlers() {
        if (eventHandlers == null) {
            eventHandlers = requireNonNull(registerEventHandlers(new EventHandlers<>()), "registerEventHandlers returned null");
        }
        return eventHandlers;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", uncommittedChanges=" + uncommittedChanges.size() +
                ", hasBeenRemoved=" + hasBeenRemoved +
                '}';
    }
}
