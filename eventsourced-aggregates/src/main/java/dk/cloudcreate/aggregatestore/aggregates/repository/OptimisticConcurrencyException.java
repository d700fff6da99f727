package dk.cloudcreate.aggregatestore.aggregates.repository;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by storage when the version of a stored aggregate differs from the version the aggregate had when it was loaded
 */
public class OptimisticConcurrencyException extends RepositoryException {
    public final Object aggregateId;
    public final Object expectedVersion;
    public final Object actualVersion;

    public OptimisticConcurrencyException(Object aggregateId, Object expectedVersion, Object actualVersion) {
        super(msg("Expected version '{}' for aggregate with Id '{}' but found version '{}' in the data store",
                  expectedVersion,
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
