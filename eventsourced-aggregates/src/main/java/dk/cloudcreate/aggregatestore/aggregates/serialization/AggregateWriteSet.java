package dk.cloudcreate.aggregatestore.aggregates.serialization;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * What a {@link SerializationStrategy} produced for a single changed aggregate: the {@link AggregateDataSet} to write,
 * the version the aggregate had when it was loaded (absent for new aggregates) and its new version
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public final class AggregateWriteSet<ID, VERSION extends Comparable<VERSION>> {
    private final ID               aggregateId;
    private final VERSION          expectedVersion;
    private final VERSION          version;
    private final AggregateDataSet dataSet;
    private final int              eventsSinceLastSnapshot;

    public AggregateWriteSet(ID aggregateId, VERSION expectedVersion, VERSION version, AggregateDataSet dataSet, int eventsSinceLastSnapshot) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = expectedVersion;
        this.version = requireNonNull(version, "No version provided");
        this.dataSet = requireNonNull(dataSet, "No dataSet provided");
        this.eventsSinceLastSnapshot = eventsSinceLastSnapshot;
    }

    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * The version the aggregate had when it was loaded, used as optimistic concurrency token
     */
    public Optional<VERSION> expectedVersion() {
        return Optional.ofNullable(expectedVersion);
    }

    public VERSION version() {
        return version;
    }

    public AggregateDataSet dataSet() {
        return dataSet;
    }

    /**
     * Number of events written since the most recent snapshot, including the events of this write set
     * (0 if this write set contains a snapshot)
     */
    public int eventsSinceLastSnapshot() {
        return eventsSinceLastSnapshot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateWriteSet)) return false;
        AggregateWriteSet<?, ?> that = (AggregateWriteSet<?, ?>) o;
        return eventsSinceLastSnapshot == that.eventsSinceLastSnapshot &&
                aggregateId.equals(that.aggregateId) &&
                Objects.equals(expectedVersion, that.expectedVersion) &&
                version.equals(that.version) &&
                dataSet.equals(that.dataSet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, expectedVersion, version, dataSet, eventsSinceLastSnapshot);
    }

    @Override
    public String toString() {
        return "AggregateWriteSet{" +
                "aggregateId=" + aggregateId +
                ", expectedVersion=" + expectedVersion +
                ", version=" + version +
                ", dataSet=" + dataSet +
                '}';
    }
}
