package dk.cloudcreate.aggregatestore.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate's version would be set to a value that isn't greater than its current version
 */
public class AggregateVersionException extends AggregateException {
    public final Object aggregateId;
    public final Object currentVersion;
    public final Object newVersion;

    public AggregateVersionException(Object aggregateId, Object currentVersion, Object newVersion) {
        super(msg("Cannot change the version of aggregate with Id '{}' from '{}' to '{}': the new version must be greater than the current version",
                  aggregateId,
                  currentVersion,
                  newVersion));
        this.aggregateId = aggregateId;
        this.currentVersion = currentVersion;
        this.newVersion = newVersion;
    }
}
