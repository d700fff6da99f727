package dk.cloudcreate.aggregatestore.common.transaction;

import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;
import dk.cloudcreate.aggregatestore.common.cache.DependencyCache;
import org.slf4j.*;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The state shared by all {@link UnitOfWorkScope}'s that take part in the same logical operation:
 * the enlisted {@link UnitOfWork} participants, the {@link DomainEventBus} and the {@link DependencyCache}.<br>
 * A context is created by {@link UnitOfWorkFactory#startUnitOfWorkScope()} and is passed explicitly to nested scopes
 * and to the repositories used by the operation. It must not be shared between concurrently running operations.
 */
public final class UnitOfWorkContext {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkContext.class);

    private final String               id;
    private final UnitOfWorkController controller;
    private final DomainEventBus       eventBus;
    private final DependencyCache      dependencyCache;
    private       boolean              disposed;

    UnitOfWorkContext() {
        this.id = UUID.randomUUID().toString();
        this.controller = new UnitOfWorkController(id);
        this.eventBus = new DomainEventBus(id);
        this.dependencyCache = new DependencyCache(id);
    }

    public String id() {
        return id;
    }

    public DomainEventBus eventBus() {
        return eventBus;
    }

    public DependencyCache dependencyCache() {
        return dependencyCache;
    }

    /**
     * Enlist a participant that must be flushed when the owning scope completes
     *
     * @param unitOfWork the participant
     * @return true if newly enlisted, false if it already was enlisted
     * @throws UnitOfWorkException if the context has been disposed
     */
    public boolean enlist(UnitOfWork unitOfWork) {
        if (disposed) {
            throw new UnitOfWorkException(msg("Cannot enlist '{}' as the UnitOfWork '{}' has been disposed",
                                              unitOfWork == null ? null : unitOfWork.getClass().getName(),
                                              id));
        }
        return controller.enlist(unitOfWork);
    }

    public boolean isEnlisted(UnitOfWork unitOfWork) {
        return controller.isEnlisted(unitOfWork);
    }

    public boolean requiresFlush() {
        return controller.requiresFlush();
    }

    public boolean isDisposed() {
        return disposed;
    }

    void flush() {
        controller.flush();
    }

    void dispose() {
        if (disposed) {
            return;
        }
        log.debug("[{}] Disposing UnitOfWork with {} enlisted participant(s)", id, controller.enlistedCount());
        disposed = true;
        eventBus.discard();
        dependencyCache.dispose();
    }

    @Override
    public String toString() {
        return "UnitOfWorkContext{" +
                "id='" + id + '\'' +
                ", disposed=" + disposed +
                '}';
    }
}
