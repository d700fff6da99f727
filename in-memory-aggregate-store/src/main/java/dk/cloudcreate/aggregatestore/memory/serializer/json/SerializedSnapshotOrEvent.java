package dk.cloudcreate.aggregatestore.memory.serializer.json;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link dk.cloudcreate.aggregatestore.aggregates.SnapshotOrEvent} in its persisted form
 */
public final class SerializedSnapshotOrEvent {
    /**
     * Fully Qualified Class Name of the serialized record
     */
    public final String javaType;
    public final String json;

    public SerializedSnapshotOrEvent(String javaType, String json) {
        this.javaType = requireNonNull(javaType, "No javaType provided");
        this.json = requireNonNull(json, "No json provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedSnapshotOrEvent)) return false;
        SerializedSnapshotOrEvent that = (SerializedSnapshotOrEvent) o;
        return javaType.equals(that.javaType) && json.equals(that.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(javaType, json);
    }

    @Override
    public String toString() {
        return "SerializedSnapshotOrEvent{" +
                "javaType='" + javaType + '\'' +
                ", json='" + json + '\'' +
                '}';
    }
}
