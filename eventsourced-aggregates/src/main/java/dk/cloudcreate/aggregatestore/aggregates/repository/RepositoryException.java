package dk.cloudcreate.aggregatestore.aggregates.repository;

import dk.cloudcreate.aggregatestore.aggregates.AggregateException;

/**
 * Root of the exceptions raised by a {@link Repository} and the storage behind it
 */
public class RepositoryException extends AggregateException {
    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
