package dk.cloudcreate.aggregatestore.aggregates.repository;

/**
 * The state a {@link Repository} keeps for each aggregate id it has seen during a unit of work
 */
public enum TrackingState {
    /**
     * The id isn't tracked
     */
    Null,
    /**
     * The aggregate was loaded from storage and hasn't changed (yet)
     */
    Unmodified,
    /**
     * The aggregate is new and will be inserted
     */
    Added,
    /**
     * The aggregate was loaded from storage and has changed, it will be updated
     */
    Modified,
    /**
     * The aggregate was loaded from storage and removed, it will be deleted (or updated when soft delete is enabled)
     */
    Removed
}
