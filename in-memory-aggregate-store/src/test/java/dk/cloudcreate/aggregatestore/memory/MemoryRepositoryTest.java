package dk.cloudcreate.aggregatestore.memory;

import dk.cloudcreate.aggregatestore.aggregates.*;
import dk.cloudcreate.aggregatestore.aggregates.CounterEvents.*;
import dk.cloudcreate.aggregatestore.aggregates.CounterSnapshots.*;
import dk.cloudcreate.aggregatestore.aggregates.repository.*;
import dk.cloudcreate.aggregatestore.aggregates.serialization.*;
import dk.cloudcreate.aggregatestore.common.bus.PublishedDomainEvents;
import dk.cloudcreate.aggregatestore.common.transaction.*;
import dk.cloudcreate.aggregatestore.memory.serializer.json.JacksonSnapshotOrEventSerializer;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class MemoryRepositoryTest {
    private UnitOfWorkFactory           unitOfWorkFactory;
    private List<PublishedDomainEvents> delivered;

    @BeforeEach
    void setup() {
        delivered = new ArrayList<>();
        unitOfWorkFactory = new UnitOfWorkFactory().addDomainEventSubscriber(delivered::add);
    }

    @Test
    void the_same_repository_is_returned_within_a_unit_of_work() {
        // Given
        var counters = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());

        // When
        try (var scope = unitOfWorkFactory.startUnitOfWorkScope()) {
            var repository = counters.repositoryFor(scope.context());

            // Then
            assertThat(counters.repositoryFor(scope.context())).isSameAs(repository);
            assertThat(repository.unitOfWorkContext()).isSameAs(scope.context());
            assertThat(repository.aggregateStore()).isSameAs(counters.aggregateStore());
            try (var otherScope = unitOfWorkFactory.startUnitOfWorkScope()) {
                assertThat(counters.repositoryFor(otherScope.context())).isNotSameAs(repository);
            }
        }
    }

    @Test
    void a_repository_cannot_be_requested_for_a_disposed_unit_of_work() {
        // Given
        var counters = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        UnitOfWorkContext context;
        try (var scope = unitOfWorkFactory.startUnitOfWorkScope()) {
            context = scope.context();
        }

        // When / Then
        assertThatThrownBy(() -> counters.repositoryFor(context))
                .isInstanceOf(UnitOfWorkException.class);
    }

    @Test
    void create_modify_and_reload_a_counter_across_units_of_work() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).add(Counter.create(counterId, 10, context.eventBus())));
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).add(5));
        var value = unitOfWorkFactory.withUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).value());

        // Then
        assertThat(value).isEqualTo(15);
        assertThat(counters.aggregateStore().versionOf(counterId)).hasValue(2);
        assertThat(counters.aggregateStore().changeSets()).hasSize(2);
        assertThat(counters.aggregateStore().eventHistoryOf(counterId)).hasSize(2);
        assertThat(delivered).hasSize(2);
        assertThat(delivered.get(0).events().get(0)).isInstanceOf(CounterCreated.class);
        assertThat(delivered.get(1).events().get(0)).isInstanceOf(ValueAdded.class);
    }

    @Test
    void concurrent_modifications_of_the_same_aggregate_are_detected() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).add(Counter.create(counterId, 1, context.eventBus())));

        try (var first = unitOfWorkFactory.startUnitOfWorkScope();
             var second = unitOfWorkFactory.startUnitOfWorkScope()) {
            counters.repositoryFor(first.context()).getById(counterId).add(1);
            counters.repositoryFor(second.context()).getById(counterId).add(2);
            first.complete();

            // When / Then
            assertThatThrownBy(second::complete)
                    .isInstanceOf(OptimisticConcurrencyException.class)
                    .satisfies(e -> {
                        var exception = (OptimisticConcurrencyException) e;
                        assertThat(exception.aggregateId).isEqualTo(counterId);
                        assertThat(exception.expectedVersion).isEqualTo(1);
                        assertThat(exception.actualVersion).isEqualTo(2);
                    });
        }
        assertThat(counters.aggregateStore().eventHistoryOf(counterId)).hasSize(2);
        assertThat(delivered).hasSize(2);
    }

    @Test
    void inserting_an_aggregate_concurrently_inserted_by_another_unit_of_work_fails() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();

        try (var first = unitOfWorkFactory.startUnitOfWorkScope();
             var second = unitOfWorkFactory.startUnitOfWorkScope()) {
            counters.repositoryFor(first.context()).add(Counter.create(counterId, 1, first.context().eventBus()));
            counters.repositoryFor(second.context()).add(Counter.create(counterId, 2, second.context().eventBus()));
            first.complete();

            // When / Then
            assertThatThrownBy(second::complete)
                    .isInstanceOf(DuplicateKeyException.class);
        }
        assertThat(counters.aggregateStore().size()).isEqualTo(1);
    }

    @Test
    void an_outdated_snapshot_is_upgraded_when_loaded() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useSnapshots());
        var counterId = CounterId.random();
        counters.aggregateStore().add(counterId, 3, AggregateDataSet.ofSnapshot(new SnapshotV1(counterId.toString(), 3, "9")));

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).add(1));

        // Then
        var update = counters.aggregateStore().changeSets().get(0).aggregatesToUpdate().get(0);
        assertThat(update.expectedVersion()).hasValue(3);
        assertThat(update.version()).isEqualTo(4);
        assertThat(update.dataSet().snapshot()).hasValueSatisfying(snapshot -> assertThat(((Counter.Snapshot) snapshot).getValue()).isEqualTo(10));
    }

    @Test
    void data_without_a_snapshot_cannot_be_loaded_when_using_snapshots() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useSnapshots());
        var counterId = CounterId.random();
        counters.aggregateStore().add(counterId, 1, AggregateDataSet.ofEvents(new CounterCreated(counterId, 1, 0)));

        // When / Then
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId)))
                .isInstanceOf(UnitOfWorkException.class)
                .hasCauseInstanceOf(CouldNotRestoreAggregateException.class);
    }

    @Test
    void snapshots_are_taken_at_the_configured_interval_and_used_when_loading() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents(3));
        var counterId = CounterId.random();
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).add(Counter.create(counterId, 0, context.eventBus())));

        // When
        for (var i = 1; i <= 4; i++) {
            var valueToAdd = i;
            unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).add(valueToAdd));
        }

        // Then
        var changeSets = counters.aggregateStore().changeSets();
        assertThat(changeSets).hasSize(5);
        assertThat(changeSets.get(1).aggregatesToUpdate().get(0).dataSet().snapshot()).isEmpty();
        assertThat(changeSets.get(2).aggregatesToUpdate().get(0).dataSet().snapshot()).isPresent();
        assertThat(changeSets.get(3).aggregatesToUpdate().get(0).dataSet().snapshot()).isEmpty();
        assertThat(changeSets.get(4).aggregatesToUpdate().get(0).dataSet().snapshot()).isEmpty();
        var stored = counters.aggregateStore().selectById(counterId).orElseThrow();
        assertThat(stored.snapshot()).hasValueSatisfying(snapshot -> assertThat(((Counter.Snapshot) snapshot).version()).isEqualTo(3));
        assertThat(stored.events()).hasSize(2);
        assertThat(counters.aggregateStore().eventHistoryOf(counterId)).hasSize(5);
        assertThat(unitOfWorkFactory.withUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).value())).isEqualTo(10);
    }

    @Test
    void a_soft_deleted_counter_stays_stored_but_is_no_longer_found() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents(3));
        var counterId = CounterId.random();
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var counter = Counter.create(counterId, 0, context.eventBus());
            counter.add(1);
            counters.repositoryFor(context).add(counter);
        });

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var repository = counters.repositoryFor(context);
            repository.remove(repository.getById(counterId).enableSoftDelete(true));
        });

        // Then
        var update = counters.aggregateStore().changeSets().get(1).aggregatesToUpdate().get(0);
        assertThat(update.dataSet().snapshot()).hasValueSatisfying(snapshot -> assertThat(((Counter.Snapshot) snapshot).isRemoved()).isTrue());
        assertThat(update.dataSet().events()).hasSize(1);
        assertThat(update.dataSet().events().get(0)).isInstanceOf(CounterDeleted.class);
        assertThat(counters.aggregateStore().contains(counterId)).isTrue();
        assertThat(unitOfWorkFactory.withUnitOfWork(context -> counters.repositoryFor(context).tryGetById(counterId))).isEmpty();
    }

    @Test
    void a_hard_deleted_counter_is_removed_from_the_store() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useSnapshots());
        var counterId = CounterId.random();
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).add(Counter.create(counterId, 0, context.eventBus())));

        // When
        var removed = unitOfWorkFactory.withUnitOfWork(context -> counters.repositoryFor(context).removeById(counterId));

        // Then
        assertThat(removed).isTrue();
        assertThat(counters.aggregateStore().contains(counterId)).isFalse();
        assertThat(counters.aggregateStore().changeSets().get(1).aggregatesToDelete()).containsExactly(counterId);
        assertThat(delivered.get(1).events()).hasSize(1);
        assertThat(delivered.get(1).events().get(0)).isInstanceOf(CounterDeleted.class);
    }

    @Test
    void records_are_stored_as_serialized_copies_when_using_a_serializer() {
        // Given
        var store     = new InMemoryAggregateStore<CounterId, Integer>(Counter.class, new JacksonSnapshotOrEventSerializer());
        var counters  = new MemoryRepositoryFactory<>(Counter.class, SerializationStrategy.useEvents(2), store);
        var counterId = CounterId.random();

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var counter = Counter.create(counterId, 4, context.eventBus());
            counter.add(6);
            counters.repositoryFor(context).add(counter);
        });
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).add(1));

        // Then
        var stored = store.selectById(counterId).orElseThrow();
        assertThat(stored.snapshot()).hasValueSatisfying(snapshot -> {
            assertThat(snapshot).isInstanceOf(Counter.Snapshot.class);
            assertThat(((Counter.Snapshot) snapshot).aggregateId()).isEqualTo(counterId);
            assertThat(((Counter.Snapshot) snapshot).getValue()).isEqualTo(10);
        });
        assertThat(stored.events()).hasSize(1);
        assertThat(stored.events().get(0)).isNotSameAs(delivered.get(1).events().get(0));
        assertThat(unitOfWorkFactory.withUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).value())).isEqualTo(11);
    }

    @Test
    void creating_and_modifying_in_one_unit_of_work_inserts_a_single_snapshot_when_using_snapshots() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useSnapshots());
        var counterId = CounterId.random();

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var counter = Counter.create(counterId, 0, context.eventBus());
            counters.repositoryFor(context).add(counter);
            counter.add(5);
        });

        // Then
        var changeSet = counters.aggregateStore().changeSets().get(0);
        assertThat(changeSet.size()).isEqualTo(1);
        var insert = changeSet.aggregatesToInsert().get(0);
        assertThat(insert.version()).isEqualTo(2);
        assertThat(insert.dataSet().events()).isEmpty();
        assertThat(insert.dataSet().snapshot()).hasValueSatisfying(snapshot -> assertThat(((Counter.Snapshot) snapshot).getValue()).isEqualTo(5));
        assertThat(delivered.get(0).events()).hasSize(2);
        var valueAdded = (ValueAdded) delivered.get(0).events().get(1);
        assertThat(valueAdded.aggregateId()).isEqualTo(counterId);
        assertThat(valueAdded.version()).isEqualTo(2);
        assertThat(valueAdded.getValue()).isEqualTo(5);
    }

    @Test
    void creating_and_modifying_in_one_unit_of_work_inserts_both_events_when_using_events() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var counter = Counter.create(counterId, 0, context.eventBus());
            counters.repositoryFor(context).add(counter);
            counter.add(5);
        });

        // Then
        var insert = counters.aggregateStore().changeSets().get(0).aggregatesToInsert().get(0);
        assertThat(insert.dataSet().snapshot()).isEmpty();
        assertThat(insert.dataSet().events()).hasSize(2);
        assertThat(insert.dataSet().events().get(0)).isInstanceOf(CounterCreated.class);
        assertThat(insert.dataSet().events().get(1)).isInstanceOf(ValueAdded.class);
        assertThat(delivered.get(0).events()).containsExactlyElementsOf(insert.dataSet().events());
    }

    @Test
    void only_the_first_of_two_new_instances_with_the_same_id_is_inserted() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();

        // When
        try (var scope = unitOfWorkFactory.startUnitOfWorkScope()) {
            var repository = counters.repositoryFor(scope.context());
            assertThat(repository.add(Counter.create(counterId, 1, scope.context().eventBus()))).isTrue();
            assertThatThrownBy(() -> repository.add(Counter.create(counterId, 2, scope.context().eventBus())))
                    .isInstanceOf(DuplicateKeyException.class);
            scope.complete();
        }

        // Then
        var changeSet = counters.aggregateStore().changeSets().get(0);
        assertThat(changeSet.aggregatesToInsert()).hasSize(1);
        assertThat(changeSet.size()).isEqualTo(1);
    }

    @Test
    void removing_a_modified_soft_delete_counter_writes_an_update_with_all_new_events() {
        // Given
        var counters  = new MemoryRepositoryFactory<CounterId, Integer, Counter>(Counter.class, SerializationStrategy.useEvents());
        var counterId = CounterId.random();
        unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).add(Counter.create(counterId, 0, context.eventBus())));

        // When
        unitOfWorkFactory.usingUnitOfWork(context -> {
            var repository = counters.repositoryFor(context);
            var counter    = repository.getById(counterId).enableSoftDelete(true);
            counter.add(3);
            assertThat(repository.trackingStateOf(counterId)).isEqualTo(TrackingState.Modified);
            repository.remove(counter);
        });

        // Then
        var changeSet = counters.aggregateStore().changeSets().get(1);
        assertThat(changeSet.aggregatesToDelete()).isEmpty();
        assertThat(changeSet.aggregatesToUpdate().get(0).dataSet().events()).hasSize(2);
        assertThat(changeSet.aggregatesToUpdate().get(0).dataSet().events().get(1)).isInstanceOf(CounterDeleted.class);
        assertThat(counters.aggregateStore().eventHistoryOf(counterId)).hasSize(3);
    }
}
