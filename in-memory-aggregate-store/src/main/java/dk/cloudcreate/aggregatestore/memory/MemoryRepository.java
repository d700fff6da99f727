package dk.cloudcreate.aggregatestore.memory;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.aggregates.repository.*;
import dk.cloudcreate.aggregatestore.aggregates.serialization.*;
import dk.cloudcreate.aggregatestore.common.transaction.UnitOfWorkContext;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link Repository} that reads from and writes to an {@link InMemoryAggregateStore}
 *
 * @see MemoryRepositoryFactory
 */
public class MemoryRepository<ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> extends Repository<ID, VERSION, AGGREGATE> {
    private final InMemoryAggregateStore<ID, VERSION> aggregateStore;

    public MemoryRepository(UnitOfWorkContext unitOfWorkContext,
                            SerializationStrategy serializationStrategy,
                            Class<AGGREGATE> aggregateType,
                            InMemoryAggregateStore<ID, VERSION> aggregateStore) {
        super(unitOfWorkContext, serializationStrategy, aggregateType);
        this.aggregateStore = requireNonNull(aggregateStore, "No aggregateStore provided");
    }

    public InMemoryAggregateStore<ID, VERSION> aggregateStore() {
        return aggregateStore;
    }

    @Override
    protected Optional<AggregateDataSet> selectById(ID aggregateId) {
        return aggregateStore.selectById(aggregateId);
    }

    @Override
    protected void flush(ChangeSet<ID, VERSION> changeSet) {
        aggregateStore.apply(changeSet);
    }
}
