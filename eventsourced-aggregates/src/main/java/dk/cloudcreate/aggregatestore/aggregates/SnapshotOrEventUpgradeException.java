package dk.cloudcreate.aggregatestore.aggregates;

/**
 * Thrown when a {@link SnapshotOrEvent} can't be upgraded to its latest schema version
 */
public class SnapshotOrEventUpgradeException extends AggregateException {
    public SnapshotOrEventUpgradeException(String message) {
        super(message);
    }
}
