package dk.cloudcreate.aggregatestore.aggregates;

import dk.cloudcreate.aggregatestore.aggregates.CounterSnapshots.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SnapshotOrEventTest {
    @Test
    void the_latest_version_returns_itself() {
        // Given
        var snapshot = new Counter.Snapshot(CounterId.random(), 2, 5, false);

        // When
        var latest = SnapshotOrEvent.updateToLatestVersion(snapshot);

        // Then
        assertThat(latest).isSameAs(snapshot);
    }

    @Test
    void an_old_schema_is_upgraded_through_every_intermediate_version() {
        // Given
        var counterId = CounterId.random();
        var veryOld   = new SnapshotV1(counterId.toString(), 4, "42");

        // When
        var latest = SnapshotOrEvent.updateToLatestVersion(veryOld);

        // Then
        assertThat(latest).isInstanceOf(Counter.Snapshot.class);
        var snapshot = (Counter.Snapshot) latest;
        assertThat(snapshot.aggregateId()).isEqualTo(counterId);
        assertThat(snapshot.version()).isEqualTo(4);
        assertThat(snapshot.getValue()).isEqualTo(42);
        assertThat(snapshot.isRemoved()).isFalse();
    }

    @Test
    void an_upgrade_cycle_is_detected() {
        assertThatThrownBy(() -> SnapshotOrEvent.updateToLatestVersion(new CyclicSnapshotA()))
                .isInstanceOf(SnapshotOrEventUpgradeException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void an_upgrade_step_returning_null_is_rejected() {
        assertThatThrownBy(() -> SnapshotOrEvent.updateToLatestVersion(new NullUpgradeSnapshot()))
                .isInstanceOf(SnapshotOrEventUpgradeException.class)
                .hasMessageContaining("returned null");
    }

    @Test
    void upgrading_null_is_rejected() {
        assertThatThrownBy(() -> SnapshotOrEvent.updateToLatestVersion(null))
                .isInstanceOf(SnapshotOrEventUpgradeException.class);
    }

    @Test
    void a_step_returning_a_new_instance_of_the_same_type_is_reported_as_a_cycle() {
        assertThatThrownBy(() -> SnapshotOrEvent.updateToLatestVersion(new EndlessChain(0)))
                .isInstanceOf(SnapshotOrEventUpgradeException.class)
                .hasMessageContaining(EndlessChain.class.getName());
    }

    private static class EndlessChain implements SnapshotOrEvent {
        private final int step;

        EndlessChain(int step) {
            this.step = step;
        }

        @Override
        public SnapshotOrEvent updateToNextVersion() {
            return new EndlessChain(step + 1);
        }
    }
}
