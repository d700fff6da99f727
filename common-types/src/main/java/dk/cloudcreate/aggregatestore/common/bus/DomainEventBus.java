package dk.cloudcreate.aggregatestore.common.bus;

import dk.cloudcreate.aggregatestore.common.transaction.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Collects the domain events published by aggregates while a {@link UnitOfWorkContext} is active.<br>
 * The events are held back until the owning {@link UnitOfWorkScope} has been completed and all enlisted
 * {@link UnitOfWork} participants have been flushed, after which they're released to the subscribers registered
 * with the {@link UnitOfWorkFactory}. If the scope is closed without being completed the events are discarded.
 */
public final class DomainEventBus {
    private static final Logger log = LoggerFactory.getLogger(DomainEventBus.class);

    private final String       unitOfWorkContextId;
    private final List<Object> pendingEvents;
    private       boolean      closed;

    public DomainEventBus(String unitOfWorkContextId) {
        this.unitOfWorkContextId = requireNonNull(unitOfWorkContextId, "No unitOfWorkContextId provided");
        this.pendingEvents = new ArrayList<>();
    }

    /**
     * Publish a domain event. The event will be delivered to subscribers after a successful flush
     *
     * @param event the event
     * @throws UnitOfWorkException if the bus has been closed
     */
    public void publish(Object event) {
        requireNonNull(event, "No event provided");
        if (closed) {
            throw new UnitOfWorkException(msg("Cannot publish event '{}' as the UnitOfWork '{}' has been disposed",
                                              event.getClass().getName(),
                                              unitOfWorkContextId));
        }
        log.trace("[{}] Publishing '{}'", unitOfWorkContextId, event.getClass().getName());
        pendingEvents.add(event);
    }

    /**
     * Get a snapshot of the events published so far that haven't been released yet
     */
    public List<Object> pendingEvents() {
        return List.copyOf(pendingEvents);
    }

    /**
     * Remove and return all pending events in the order in which they were published
     *
     * @return the released events
     */
    public PublishedDomainEvents releaseEvents() {
        var released = new PublishedDomainEvents(unitOfWorkContextId, pendingEvents);
        pendingEvents.clear();
        log.debug("[{}] Released {} domain event(s)", unitOfWorkContextId, released.events().size());
        return released;
    }

    /**
     * Drop all pending events and reject further publishing
     */
    public void discard() {
        if (!pendingEvents.isEmpty()) {
            log.debug("[{}] Discarding {} unreleased domain event(s)", unitOfWorkContextId, pendingEvents.size());
        }
        pendingEvents.clear();
        closed = true;
    }
}
