package dk.cloudcreate.aggregatestore.common.bus;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The domain events released by a {@link DomainEventBus} after its unit of work was successfully flushed
 */
public final class PublishedDomainEvents {
    public final String       unitOfWorkContextId;
    private final List<Object> events;

    public PublishedDomainEvents(String unitOfWorkContextId, List<Object> events) {
        this.unitOfWorkContextId = requireNonNull(unitOfWorkContextId, "No unitOfWorkContextId provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    /**
     * The events in the order in which they were published
     */
    public List<Object> events() {
        return events;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublishedDomainEvents)) return false;
        PublishedDomainEvents that = (PublishedDomainEvents) o;
        return unitOfWorkContextId.equals(that.unitOfWorkContextId) && events.equals(that.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unitOfWorkContextId, events);
    }

    @Override
    public String toString() {
        return "PublishedDomainEvents{" +
                "unitOfWorkContextId='" + unitOfWorkContextId + '\'' +
                ", events=" + events +
                '}';
    }
}
