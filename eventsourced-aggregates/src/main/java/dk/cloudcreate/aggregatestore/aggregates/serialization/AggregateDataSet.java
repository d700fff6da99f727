package dk.cloudcreate.aggregatestore.aggregates.serialization;

import dk.cloudcreate.aggregatestore.aggregates.SnapshotOrEvent;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The persisted form of a single aggregate: an optional snapshot and the ordered events recorded after it
 * (or all events if there is no snapshot). The records may be in an outdated schema version.
 */
public final class AggregateDataSet {
    private final SnapshotOrEvent       snapshot;
    private final List<SnapshotOrEvent> events;

    public AggregateDataSet(SnapshotOrEvent snapshot, List<? extends SnapshotOrEvent> events) {
        this.snapshot = snapshot;
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    public static AggregateDataSet ofSnapshot(SnapshotOrEvent snapshot) {
        return new AggregateDataSet(requireNonNull(snapshot, "No snapshot provided"), List.of());
    }

    public static AggregateDataSet ofEvents(List<? extends SnapshotOrEvent> events) {
        return new AggregateDataSet(null, events);
    }

    public static AggregateDataSet ofEvents(SnapshotOrEvent... events) {
        return new AggregateDataSet(null, List.of(events));
    }

    public Optional<SnapshotOrEvent> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    public List<SnapshotOrEvent> events() {
        return events;
    }

    /**
     * A data set without snapshot and events can't restore an aggregate
     */
    public boolean isEmpty() {
        return snapshot == null && events.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateDataSet)) return false;
        AggregateDataSet that = (AggregateDataSet) o;
        return Objects.equals(snapshot, that.snapshot) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot, events);
    }

    @Override
    public String toString() {
        return "AggregateDataSet{" +
                "snapshot=" + snapshot +
                ", events=" + events +
                '}';
    }
}
