package dk.cloudcreate.aggregatestore.aggregates.repository;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends RepositoryException {
    public final Object   aggregateId;
    public final Class<?> aggregateType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateType) {
        super(generateMessage(aggregateId, aggregateType));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
    }

    private static String generateMessage(Object aggregateId, Class<?> aggregateType) {
        return msg("Aggregate of type '{}' with Id '{}' was not found.",
                   aggregateType.getSimpleName(),
                   aggregateId);
    }
}
