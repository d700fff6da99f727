package dk.cloudcreate.aggregatestore.memory;

import dk.cloudcreate.aggregatestore.aggregates.AggregateRoot;
import dk.cloudcreate.aggregatestore.aggregates.serialization.SerializationStrategy;
import dk.cloudcreate.aggregatestore.common.transaction.UnitOfWorkContext;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Hands out the {@link MemoryRepository} of a {@link UnitOfWorkContext}.<br>
 * All repositories share the same {@link InMemoryAggregateStore} and {@link SerializationStrategy}. Within one
 * {@link UnitOfWorkContext} the same repository instance is returned, as it's kept in the context's
 * {@link dk.cloudcreate.aggregatestore.common.cache.DependencyCache}.
 * <pre>{@code
 * var counters = new MemoryRepositoryFactory<>(Counter.class, SerializationStrategy.useEvents(10));
 * unitOfWorkFactory.usingUnitOfWork(context -> counters.repositoryFor(context).getById(counterId).add(5));
 * }</pre>
 */
public class MemoryRepositoryFactory<ID, VERSION extends Comparable<VERSION>, AGGREGATE extends AggregateRoot<ID, VERSION>> {
    private static final Logger log = LoggerFactory.getLogger(MemoryRepositoryFactory.class);

    private final Class<AGGREGATE>                    aggregateType;
    private final SerializationStrategy               serializationStrategy;
    private final InMemoryAggregateStore<ID, VERSION> aggregateStore;

    public MemoryRepositoryFactory(Class<AGGREGATE> aggregateType, SerializationStrategy serializationStrategy) {
        this(aggregateType, serializationStrategy, new InMemoryAggregateStore<>(aggregateType));
    }

    public MemoryRepositoryFactory(Class<AGGREGATE> aggregateType,
                                   SerializationStrategy serializationStrategy,
                                   InMemoryAggregateStore<ID, VERSION> aggregateStore) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.serializationStrategy = requireNonNull(serializationStrategy, "No serializationStrategy provided");
        this.aggregateStore = requireNonNull(aggregateStore, "No aggregateStore provided");
    }

    /**
     * Get the repository bound to <code>unitOfWorkContext</code>, creating it on first use
     *
     * @param unitOfWorkContext the unit of work
     * @return the repository
     * @throws dk.cloudcreate.aggregatestore.common.transaction.UnitOfWorkException if the context has been disposed
     */
    public MemoryRepository<ID, VERSION, AGGREGATE> repositoryFor(UnitOfWorkContext unitOfWorkContext) {
        requireNonNull(unitOfWorkContext, "No unitOfWorkContext provided");
        return unitOfWorkContext.dependencyCache().getOrAdd(this, () -> {
            log.debug("[{}] Creating MemoryRepository for '{}' using {}", unitOfWorkContext.id(), aggregateType.getSimpleName(), serializationStrategy);
            return new MemoryRepository<>(unitOfWorkContext, serializationStrategy, aggregateType, aggregateStore);
        });
    }

    public InMemoryAggregateStore<ID, VERSION> aggregateStore() {
        return aggregateStore;
    }

    public SerializationStrategy serializationStrategy() {
        return serializationStrategy;
    }

    public Class<AGGREGATE> aggregateType() {
        return aggregateType;
    }
}
