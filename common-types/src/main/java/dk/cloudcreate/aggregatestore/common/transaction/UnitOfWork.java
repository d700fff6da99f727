package dk.cloudcreate.aggregatestore.common.transaction;

/**
 * A participant that collects changes during a logical operation and writes them to storage when the owning
 * {@link UnitOfWorkScope} is completed.<br>
 * Participants are enlisted using {@link UnitOfWorkContext#enlist(UnitOfWork)} and are flushed by the
 * {@link UnitOfWorkController} in the order in which they were enlisted.
 */
public interface UnitOfWork {
    /**
     * Does this participant have changes that must be written to storage
     *
     * @return true if {@link #flush()} must be called for the changes to be persisted
     */
    boolean requiresFlush();

    /**
     * Write all pending changes to storage. Called at most once per {@link UnitOfWorkContext}
     *
     * @throws RuntimeException any storage failure, which stops the flush of the remaining participants
     */
    void flush();
}
