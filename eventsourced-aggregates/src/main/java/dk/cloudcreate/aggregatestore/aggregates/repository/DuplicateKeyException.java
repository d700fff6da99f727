package dk.cloudcreate.aggregatestore.aggregates.repository;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate is added while another aggregate with the same id is already tracked or stored
 */
public class DuplicateKeyException extends RepositoryException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;

    public DuplicateKeyException(Object aggregateId, Class<?> aggregateType) {
        super(generateMessage(aggregateId, aggregateType));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
    }

    private static String generateMessage(Object aggregateId, Class<?> aggregateType) {
        return msg("Cannot add aggregate of type '{}' to the repository because another aggregate with Id '{}' is already present in the data store.",
                   aggregateType.getSimpleName(),
                   aggregateId);
    }
}
