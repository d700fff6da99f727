package dk.cloudcreate.aggregatestore.aggregates.repository;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.aggregates.serialization.AggregateWriteSet;

/**
 * Per id bookkeeping of a {@link Repository}
 */
final class TrackedAggregate<ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> {
    final AGGREGATE                   aggregate;
    private TrackingState             state;
    /**
     * Version in storage, null while the aggregate hasn't been inserted
     */
    private VERSION                   storedVersion;
    private int                       eventsSinceLastSnapshot;
    private AggregateWriteSet<ID, VERSION> pendingWriteSet;

    private TrackedAggregate(AGGREGATE aggregate, TrackingState state, VERSION storedVersion, int eventsSinceLastSnapshot) {
        this.aggregate = aggregate;
        this.state = state;
        this.storedVersion = storedVersion;
        this.eventsSinceLastSnapshot = eventsSinceLastSnapshot;
    }

    static <ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> TrackedAggregate<ID, VERSION, AGGREGATE> loaded(AGGREGATE aggregate,
                                                                                                                                                 int eventsSinceLastSnapshot) {
        return new TrackedAggregate<>(aggregate, TrackingState.Unmodified, aggregate.version(), eventsSinceLastSnapshot);
    }

    static <ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> TrackedAggregate<ID, VERSION, AGGREGATE> added(AGGREGATE aggregate) {
        return new TrackedAggregate<>(aggregate, TrackingState.Added, null, 0);
    }

    /**
     * An unmodified aggregate that has changes since it was loaded is reported as {@link TrackingState#Modified}
     */
    TrackingState state() {
        if (state == TrackingState.Unmodified && aggregate.hasChanges()) {
            state = TrackingState.Modified;
        }
        return state;
    }

    void markAsRemoved() {
        state = TrackingState.Removed;
    }

    VERSION storedVersion() {
        return storedVersion;
    }

    int eventsSinceLastSnapshot() {
        return eventsSinceLastSnapshot;
    }

    /**
     * Does this entry produce an insert, update or delete
     */
    boolean requiresFlush() {
        switch (state()) {
            case Added:
            case Removed:
                return true;
            case Modified:
                return aggregate.hasChanges();
            default:
                return false;
        }
    }

    void pendingWriteSet(AggregateWriteSet<ID, VERSION> writeSet) {
        this.pendingWriteSet = writeSet;
    }

    /**
     * Called after storage accepted the change set
     */
    void markAsCommitted() {
        if (pendingWriteSet != null) {
            storedVersion = pendingWriteSet.version();
            eventsSinceLastSnapshot = pendingWriteSet.eventsSinceLastSnapshot();
            pendingWriteSet = null;
        }
        state = TrackingState.Unmodified;
    }

    @Override
    public String toString() {
        return "TrackedAggregate{" +
                "aggregate=" + aggregate +
                ", state=" + state +
                ", storedVersion=" + storedVersion +
                '}';
    }
}
