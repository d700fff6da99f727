package dk.cloudcreate.aggregatestore.memory;

import dk.cloudcreate.aggregatestore.aggregates.SnapshotOrEvent;
import dk.cloudcreate.aggregatestore.aggregates.repository.*;
import dk.cloudcreate.aggregatestore.aggregates.serialization.*;
import dk.cloudcreate.aggregatestore.memory.serializer.json.SnapshotOrEventSerializer;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thread safe in memory storage for the aggregates of one type.<br>
 * Per aggregate id the store keeps the latest snapshot, the events written after that snapshot and the complete
 * event history. Writing a snapshot replaces the stored snapshot and discards the trailing events, as a snapshot
 * always captures the aggregate at the version of the write. {@link #selectById(Object)} returns the latest snapshot
 * together with the trailing events.
 * <p>
 * A {@link ChangeSet} is applied atomically: every insert, update and delete is validated before anything is changed.
 * Updates are checked against the stored version (optimistic concurrency).
 * <p>
 * When created with a {@link SnapshotOrEventSerializer} every record is stored as a serialized and deserialized copy,
 * which verifies that the records can be persisted and detaches the stored data from the live objects.
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public final class InMemoryAggregateStore<ID, VERSION extends Comparable<VERSION>> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAggregateStore.class);

    private final Class<?>                          aggregateType;
    private final Map<ID, StoredAggregate<VERSION>> storedAggregates;
    private final List<ChangeSet<ID, VERSION>>      changeSets;
    private final SnapshotOrEventSerializer         serializer;

    public InMemoryAggregateStore(Class<?> aggregateType) {
        this(aggregateType, null);
    }

    /**
     * @param aggregateType the type of the stored aggregates
     * @param serializer    the serializer used to copy every stored record (may be null, in which case records are stored as is)
     */
    public InMemoryAggregateStore(Class<?> aggregateType, SnapshotOrEventSerializer serializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.serializer = serializer;
        this.storedAggregates = new LinkedHashMap<>();
        this.changeSets = new ArrayList<>();
    }

    /**
     * Seed the store with existing data, bypassing any {@link ChangeSet} bookkeeping
     *
     * @param aggregateId the aggregate id
     * @param version     the version of the stored aggregate (may be null, which disables the version check for this id until it's updated)
     * @param dataSet     the stored data
     * @throws DuplicateKeyException if data is already stored under <code>aggregateId</code>
     */
    public synchronized void add(ID aggregateId, VERSION version, AggregateDataSet dataSet) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(dataSet, "No dataSet provided");
        if (storedAggregates.containsKey(aggregateId)) {
            throw new DuplicateKeyException(aggregateId, aggregateType);
        }
        var stored = new StoredAggregate<VERSION>();
        stored.write(version, copyOf(dataSet));
        storedAggregates.put(aggregateId, stored);
    }

    /**
     * @return the latest snapshot and the events written after it, or {@link Optional#empty()} if nothing is stored under the id
     */
    public synchronized Optional<AggregateDataSet> selectById(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var stored = storedAggregates.get(aggregateId);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.of(new AggregateDataSet(stored.snapshot, stored.trailingEvents));
    }

    /**
     * Apply all changes or none of them
     *
     * @param changeSet the changes
     * @throws DuplicateKeyException          if an aggregate to insert is already stored
     * @throws OptimisticConcurrencyException if an aggregate to update isn't stored or is stored at another version than expected
     */
    public synchronized void apply(ChangeSet<ID, VERSION> changeSet) {
        requireNonNull(changeSet, "No changeSet provided");
        validate(changeSet);
        for (var writeSet : changeSet.aggregatesToInsert()) {
            var stored = new StoredAggregate<VERSION>();
            stored.write(writeSet.version(), copyOf(writeSet.dataSet()));
            storedAggregates.put(writeSet.aggregateId(), stored);
        }
        for (var writeSet : changeSet.aggregatesToUpdate()) {
            storedAggregates.get(writeSet.aggregateId()).write(writeSet.version(), copyOf(writeSet.dataSet()));
        }
        for (var aggregateId : changeSet.aggregatesToDelete()) {
            if (storedAggregates.remove(aggregateId) == null) {
                log.debug("'{}' with id '{}' was already deleted", aggregateType.getSimpleName(), aggregateId);
            }
        }
        changeSets.add(changeSet);
        log.debug("Applied {} to '{}'", changeSet, aggregateType.getSimpleName());
    }

    private void validate(ChangeSet<ID, VERSION> changeSet) {
        var idsToInsert = new HashSet<ID>();
        for (var writeSet : changeSet.aggregatesToInsert()) {
            if (storedAggregates.containsKey(writeSet.aggregateId()) || !idsToInsert.add(writeSet.aggregateId())) {
                throw new DuplicateKeyException(writeSet.aggregateId(), aggregateType);
            }
        }
        for (var writeSet : changeSet.aggregatesToUpdate()) {
            var stored = storedAggregates.get(writeSet.aggregateId());
            if (stored == null) {
                throw new OptimisticConcurrencyException(writeSet.aggregateId(), writeSet.expectedVersion().orElse(null), null);
            }
            var expectedVersion = writeSet.expectedVersion();
            if (stored.version != null && expectedVersion.isPresent() && !stored.version.equals(expectedVersion.get())) {
                throw new OptimisticConcurrencyException(writeSet.aggregateId(), expectedVersion.get(), stored.version);
            }
        }
    }

    public Class<?> aggregateType() {
        return aggregateType;
    }

    /**
     * All {@link ChangeSet}'s applied so far, oldest first
     */
    public synchronized List<ChangeSet<ID, VERSION>> changeSets() {
        return List.copyOf(changeSets);
    }

    public synchronized boolean contains(ID aggregateId) {
        return storedAggregates.containsKey(aggregateId);
    }

    public synchronized Optional<VERSION> versionOf(ID aggregateId) {
        var stored = storedAggregates.get(aggregateId);
        return stored == null ? Optional.empty() : Optional.ofNullable(stored.version);
    }

    /**
     * Every event written for the aggregate, including those covered by the latest snapshot
     */
    public synchronized List<SnapshotOrEvent> eventHistoryOf(ID aggregateId) {
        var stored = storedAggregates.get(aggregateId);
        return stored == null ? List.of() : List.copyOf(stored.eventHistory);
    }

    public synchronized int size() {
        return storedAggregates.size();
    }

    public synchronized void clear() {
        storedAggregates.clear();
        changeSets.clear();
    }

    private AggregateDataSet copyOf(AggregateDataSet dataSet) {
        if (serializer == null) {
            return dataSet;
        }
        var snapshot = dataSet.snapshot().map(this::copyOf).orElse(null);
        var events   = dataSet.events().stream().map(this::copyOf).collect(Collectors.toList());
        return new AggregateDataSet(snapshot, events);
    }

    private SnapshotOrEvent copyOf(SnapshotOrEvent snapshotOrEvent) {
        return serializer.deserialize(serializer.serialize(snapshotOrEvent));
    }

    @Override
    public synchronized String toString() {
        return "InMemoryAggregateStore{" +
                "aggregateType=" + aggregateType.getSimpleName() +
                ", aggregates=" + storedAggregates.size() +
                ", changeSets=" + changeSets.size() +
                '}';
    }

    private static final class StoredAggregate<VERSION> {
        private VERSION               version;
        private SnapshotOrEvent       snapshot;
        private List<SnapshotOrEvent> trailingEvents = List.of();
        private List<SnapshotOrEvent> eventHistory   = List.of();

        void write(VERSION version, AggregateDataSet dataSet) {
            this.version = version;
            var history = new ArrayList<>(eventHistory);
            history.addAll(dataSet.events());
            eventHistory = List.copyOf(history);
            if (dataSet.snapshot().isPresent()) {
                snapshot = dataSet.snapshot().get();
                trailingEvents = List.of();
            } else {
                var events = new ArrayList<>(trailingEvents);
                events.addAll(dataSet.events());
                trailingEvents = List.copyOf(events);
            }
        }
    }
}
