package dk.cloudcreate.aggregatestore.common.transaction;

import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A handle on a {@link UnitOfWorkContext}. The scope that created the context is the <b>owner</b>; scopes started
 * with an existing context are nested and never flush or dispose the context themselves.<br>
 * Usage:
 * <pre>{@code
 * try (var scope = unitOfWorkFactory.startUnitOfWorkScope()) {
 *     var repository = repositoryFactory.repositoryFor(scope.context());
 *     repository.getById(id).add(5);
 *     scope.complete();
 * }
 * }</pre>
 */
public final class UnitOfWorkScope implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkScope.class);

    private final UnitOfWorkFactory     unitOfWorkFactory;
    private final UnitOfWorkContext     context;
    private final boolean               isOwner;
    private       UnitOfWorkScopeStatus status;

    UnitOfWorkScope(UnitOfWorkFactory unitOfWorkFactory, UnitOfWorkContext context, boolean isOwner) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.context = requireNonNull(context, "No context provided");
        this.isOwner = isOwner;
        this.status = UnitOfWorkScopeStatus.Active;
    }

    public UnitOfWorkContext context() {
        return context;
    }

    /**
     * Did this scope create the {@link UnitOfWorkContext}
     */
    public boolean isOwner() {
        return isOwner;
    }

    public UnitOfWorkScopeStatus status() {
        return status;
    }

    /**
     * Mark the scope as completed. The owner scope flushes all enlisted participants and afterwards releases
     * the collected domain events to the subscribers of the {@link UnitOfWorkFactory}.<br>
     * A nested scope only records that it has completed.
     *
     * @throws UnitOfWorkException if the scope has already been completed or closed
     */
    public void complete() {
        if (status != UnitOfWorkScopeStatus.Active) {
            throw new UnitOfWorkException(msg("Cannot complete the UnitOfWorkScope for UnitOfWork '{}' as its status is {}",
                                              context.id(),
                                              status));
        }
        status = UnitOfWorkScopeStatus.Completed;
        if (!isOwner) {
            log.debug("[{}] NestedUnitOfWork: Won't flush the UnitOfWork as it wasn't created by this scope", context.id());
            return;
        }
        log.debug("[{}] Completing UnitOfWork", context.id());
        context.flush();
        unitOfWorkFactory.deliver(context.eventBus().releaseEvents());
    }

    /**
     * Close the scope. Closing an owner scope disposes the {@link UnitOfWorkContext}, discarding any changes and events
     * if the scope wasn't completed. Repeated calls are ignored.
     */
    @Override
    public void close() {
        if (status == UnitOfWorkScopeStatus.Disposed) {
            return;
        }
        var wasCompleted = status == UnitOfWorkScopeStatus.Completed;
        status = UnitOfWorkScopeStatus.Disposed;
        if (!isOwner) {
            log.trace("[{}] NestedUnitOfWork: Closing nested scope (completed: {})", context.id(), wasCompleted);
            return;
        }
        if (!wasCompleted) {
            log.debug("[{}] Closing UnitOfWork without completing it. Pending changes are discarded", context.id());
        }
        context.dispose();
    }

    @Override
    public String toString() {
        return "UnitOfWorkScope{" +
                "context=" + context.id() +
                ", isOwner=" + isOwner +
                ", status=" + status +
                '}';
    }
}
