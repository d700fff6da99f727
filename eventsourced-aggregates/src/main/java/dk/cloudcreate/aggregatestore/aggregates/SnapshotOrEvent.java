package dk.cloudcreate.aggregatestore.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A persisted record that is either a snapshot of an aggregate or one of its events.<br>
 * Records are versioned at the schema level: an outdated schema type returns its successor from
 * {@link #updateToNextVersion()}, the latest schema type returns itself. Every record read from storage is walked up
 * to its latest schema version using {@link #updateToLatestVersion(SnapshotOrEvent)} before it's used.
 */
public interface SnapshotOrEvent {
    /**
     * Upper bound on the number of upgrade steps performed for a single record
     */
    int MAXIMUM_UPGRADE_CHAIN_LENGTH = 100;

    /**
     * Convert this record to the next schema version
     *
     * @return the record in the next schema version or <code>this</code> if this is the latest version
     */
    default SnapshotOrEvent updateToNextVersion() {
        return this;
    }

    /**
     * Repeatedly call {@link #updateToNextVersion()} until a record returns itself
     *
     * @param snapshotOrEvent the record to upgrade
     * @return the record in its latest schema version
     * @throws SnapshotOrEventUpgradeException if a step returns null, if a schema type is visited twice
     *                                         or if more than {@link #MAXIMUM_UPGRADE_CHAIN_LENGTH} steps are needed
     */
    static SnapshotOrEvent updateToLatestVersion(SnapshotOrEvent snapshotOrEvent) {
        if (snapshotOrEvent == null) {
            throw new SnapshotOrEventUpgradeException("Cannot upgrade a null SnapshotOrEvent");
        }
        var visitedTypes = new HashSet<Class<?>>();
        var current      = snapshotOrEvent;
        visitedTypes.add(current.getClass());
        for (var step = 0; step < MAXIMUM_UPGRADE_CHAIN_LENGTH; step++) {
            var next = current.updateToNextVersion();
            if (next == null) {
                throw new SnapshotOrEventUpgradeException(msg("'{}' returned null from updateToNextVersion()",
                                                              current.getClass().getName()));
            }
            if (next == current) {
                return current;
            }
            if (!visitedTypes.add(next.getClass())) {
                throw new SnapshotOrEventUpgradeException(msg("Detected an upgrade cycle: '{}' was upgraded to the already visited type '{}'",
                                                              current.getClass().getName(),
                                                              next.getClass().getName()));
            }
            current = next;
        }
        throw new SnapshotOrEventUpgradeException(msg("Upgrading '{}' exceeded the maximum of {} upgrade steps",
                                                      snapshotOrEvent.getClass().getName(),
                                                      MAXIMUM_UPGRADE_CHAIN_LENGTH));
    }
}
