package dk.cloudcreate.aggregatestore.memory.serializer.json;

import dk.cloudcreate.aggregatestore.aggregates.SnapshotOrEvent;

/**
 * Converts {@link SnapshotOrEvent} records to and from their persisted JSON form
 */
public interface SnapshotOrEventSerializer {
    /**
     * Serialize a record to JSON
     *
     * @param snapshotOrEvent the record
     * @return the JSON together with the Fully Qualified Class Name of the record
     * @throws JSONSerializationException in case the record couldn't be serialized to JSON
     */
    SerializedSnapshotOrEvent serialize(SnapshotOrEvent snapshotOrEvent);

    /**
     * Deserialize a record into the Java type named by {@link SerializedSnapshotOrEvent#javaType}
     *
     * @param serializedSnapshotOrEvent the serialized record
     * @return the record
     * @throws JSONDeserializationException in case the json couldn't be deserialized or the Java type isn't a {@link SnapshotOrEvent}
     */
    SnapshotOrEvent deserialize(SerializedSnapshotOrEvent serializedSnapshotOrEvent);

    /**
     * Deserialize the payload in the <code>json</code> parameter into the Java type specified by the <code>javaType</code> parameter
     *
     * @param json     the json payload
     * @param javaType the Java type that the json payload should be deserialized into
     * @param <T>      the corresponding Java type
     * @return the deserialized json payload
     * @throws JSONDeserializationException in case the json couldn't be deserialized to the specified java type
     */
    <T> T deserialize(String json, Class<T> javaType);
}
