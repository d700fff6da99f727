package dk.cloudcreate.aggregatestore.memory;

import dk.cloudcreate.aggregatestore.aggregates.*;
import dk.cloudcreate.aggregatestore.aggregates.CounterEvents.*;
import dk.cloudcreate.aggregatestore.aggregates.repository.*;
import dk.cloudcreate.aggregatestore.aggregates.serialization.*;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryAggregateStoreTest {
    private InMemoryAggregateStore<CounterId, Integer> store;
    private CounterId                                  counterId;

    @BeforeEach
    void setup() {
        store = new InMemoryAggregateStore<>(Counter.class);
        counterId = CounterId.random();
    }

    @Test
    void an_unknown_id_has_no_data() {
        assertThat(store.selectById(counterId)).isEmpty();
        assertThat(store.contains(counterId)).isFalse();
        assertThat(store.versionOf(counterId)).isEmpty();
        assertThat(store.eventHistoryOf(counterId)).isEmpty();
    }

    @Test
    void events_are_appended_until_a_snapshot_replaces_them() {
        // Given
        store.apply(changeSet(List.of(insert(1, AggregateDataSet.ofEvents(created(1), added(2)))), List.of(), List.of()));
        store.apply(changeSet(List.of(), List.of(update(2, 3, AggregateDataSet.ofEvents(added(3)))), List.of()));
        assertThat(store.selectById(counterId).orElseThrow().events()).hasSize(3);

        // When
        var snapshot = new Counter.Snapshot(counterId, 4, 4, false);
        store.apply(changeSet(List.of(), List.of(update(3, 4, new AggregateDataSet(snapshot, List.of(added(4))))), List.of()));

        // Then
        var dataSet = store.selectById(counterId).orElseThrow();
        assertThat(dataSet.snapshot()).containsSame(snapshot);
        assertThat(dataSet.events()).isEmpty();
        assertThat(store.eventHistoryOf(counterId)).hasSize(4);
        assertThat(store.versionOf(counterId)).hasValue(4);
        assertThat(store.changeSets()).hasSize(3);
    }

    @Test
    void a_change_set_is_applied_completely_or_not_at_all() {
        // Given
        var otherId = CounterId.random();
        store.add(counterId, 2, AggregateDataSet.ofEvents(created(1), added(2)));
        var stale = changeSet(List.of(new AggregateWriteSet<CounterId, Integer>(otherId, null, 1, AggregateDataSet.ofEvents(new CounterCreated(otherId, 1, 0)), 1)),
                              List.of(update(1, 3, AggregateDataSet.ofEvents(added(3)))),
                              List.of());

        // When / Then
        assertThatThrownBy(() -> store.apply(stale))
                .isInstanceOf(OptimisticConcurrencyException.class);
        assertThat(store.contains(otherId)).isFalse();
        assertThat(store.versionOf(counterId)).hasValue(2);
        assertThat(store.changeSets()).isEmpty();
    }

    @Test
    void inserting_a_stored_id_fails() {
        // Given
        store.add(counterId, 1, AggregateDataSet.ofEvents(created(1)));

        // When / Then
        assertThatThrownBy(() -> store.apply(changeSet(List.of(insert(1, AggregateDataSet.ofEvents(created(1)))), List.of(), List.of())))
                .isInstanceOf(DuplicateKeyException.class)
                .hasMessageContaining("Counter");
        assertThatThrownBy(() -> store.add(counterId, 1, AggregateDataSet.ofEvents(created(1))))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void updating_an_id_that_is_not_stored_fails() {
        assertThatThrownBy(() -> store.apply(changeSet(List.of(), List.of(update(1, 2, AggregateDataSet.ofEvents(added(2)))), List.of())))
                .isInstanceOf(OptimisticConcurrencyException.class);
    }

    @Test
    void deleting_removes_all_data_and_ignores_unknown_ids() {
        // Given
        store.add(counterId, 1, AggregateDataSet.ofEvents(created(1)));

        // When
        store.apply(changeSet(List.of(), List.of(), List.of(counterId, CounterId.random())));

        // Then
        assertThat(store.contains(counterId)).isFalse();
        assertThat(store.size()).isEqualTo(0);
        assertThat(store.eventHistoryOf(counterId)).isEmpty();
    }

    @Test
    void seeded_data_without_a_version_skips_the_version_check() {
        // Given
        store.add(counterId, null, AggregateDataSet.ofEvents(created(1)));

        // When
        store.apply(changeSet(List.of(), List.of(update(7, 2, AggregateDataSet.ofEvents(added(2)))), List.of()));

        // Then
        assertThat(store.versionOf(counterId)).hasValue(2);
    }

    private CounterCreated created(int version) {
        return new CounterCreated(counterId, version, 0);
    }

    private ValueAdded added(int version) {
        return new ValueAdded(counterId, version, 1);
    }

    private AggregateWriteSet<CounterId, Integer> insert(int version, AggregateDataSet dataSet) {
        return new AggregateWriteSet<>(counterId, null, version, dataSet, dataSet.events().size());
    }

    private AggregateWriteSet<CounterId, Integer> update(int expectedVersion, int version, AggregateDataSet dataSet) {
        return new AggregateWriteSet<>(counterId, expectedVersion, version, dataSet, dataSet.events().size());
    }

    private static ChangeSet<CounterId, Integer> changeSet(List<AggregateWriteSet<CounterId, Integer>> aggregatesToInsert,
                                                           List<AggregateWriteSet<CounterId, Integer>> aggregatesToUpdate,
                                                           List<CounterId> aggregatesToDelete) {
        return new ChangeSet<>(aggregatesToInsert, aggregatesToUpdate, aggregatesToDelete);
    }
}
