package dk.cloudcreate.aggregatestore.aggregates;

import dk.cloudcreate.aggregatestore.aggregates.CounterEvents.CounterCreated;
import dk.cloudcreate.aggregatestore.common.bus.DomainEventBus;

/**
 * {@link Counter} with soft delete enabled that doesn't apply a terminal event when it's removed
 */
public class SilentlyRemovedCounter extends Counter {
    SilentlyRemovedCounter(DomainEventBus eventBus, CounterCreated event) {
        super(eventBus, event, false);
        enableSoftDelete(true);
    }

    SilentlyRemovedCounter(DomainEventBus eventBus, Counter.Snapshot snapshot) {
        super(eventBus, snapshot);
        enableSoftDelete(true);
    }

    @Override
    protected void onRemoved() {
    }

    public static class Created extends CounterCreated {
        public Created() {
        }

        public Created(CounterId counterId, int counterVersion, int value) {
            super(counterId, counterVersion, value);
        }

        @Override
        public AggregateRoot<CounterId, Integer> restoreAggregate(DomainEventBus eventBus) {
            return new SilentlyRemovedCounter(eventBus, this);
        }
    }

    public static class Snapshot extends Counter.Snapshot {
        public Snapshot() {
        }

        public Snapshot(CounterId counterId, int counterVersion, int value) {
            super(counterId, counterVersion, value, false);
        }

        @Override
        public AggregateRoot<CounterId, Integer> restoreAggregate(DomainEventBus eventBus) {
            return new SilentlyRemovedCounter(eventBus, this);
        }
    }
}
