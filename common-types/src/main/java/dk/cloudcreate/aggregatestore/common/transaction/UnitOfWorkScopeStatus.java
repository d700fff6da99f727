package dk.cloudcreate.aggregatestore.common.transaction;

/**
 * The status of a {@link UnitOfWorkScope}
 */
public enum UnitOfWorkScopeStatus {
    /**
     * The scope has been started and can be completed
     */
    Active(false),
    /**
     * {@link UnitOfWorkScope#complete()} has been called
     */
    Completed(true),
    /**
     * {@link UnitOfWorkScope#close()} has been called
     */
    Disposed(true);

    public final boolean isCompleted;

    UnitOfWorkScopeStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
