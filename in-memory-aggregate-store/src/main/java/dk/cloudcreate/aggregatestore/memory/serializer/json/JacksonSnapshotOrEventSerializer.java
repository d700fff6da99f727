package dk.cloudcreate.aggregatestore.memory.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import dk.cloudcreate.aggregatestore.aggregates.SnapshotOrEvent;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link SnapshotOrEventSerializer}.<br>
 * The {@link ObjectMapper} returned by {@link #createDefaultObjectMapper()} serializes the fields of a record
 * (regardless of their visibility) and ignores getters, so records only need a no-arguments constructor.
 */
public class JacksonSnapshotOrEventSerializer implements SnapshotOrEventSerializer {
    private final ObjectMapper objectMapper;

    public JacksonSnapshotOrEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonSnapshotOrEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No object mapper instance provided");
    }

    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = new ObjectMapper();
        objectMapper.setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        return objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public SerializedSnapshotOrEvent serialize(SnapshotOrEvent snapshotOrEvent) {
        requireNonNull(snapshotOrEvent, "No snapshotOrEvent provided");
        try {
            return new SerializedSnapshotOrEvent(snapshotOrEvent.getClass().getName(),
                                                 objectMapper.writeValueAsString(snapshotOrEvent));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", snapshotOrEvent.getClass().getName()), e);
        }
    }

    @Override
    public SnapshotOrEvent deserialize(SerializedSnapshotOrEvent serializedSnapshotOrEvent) {
        requireNonNull(serializedSnapshotOrEvent, "No serializedSnapshotOrEvent provided");
        var javaType = resolveJavaType(serializedSnapshotOrEvent.javaType);
        if (!SnapshotOrEvent.class.isAssignableFrom(javaType)) {
            throw new JSONDeserializationException(msg("Cannot deserialize JSON to '{}' as it doesn't implement {}",
                                                       serializedSnapshotOrEvent.javaType,
                                                       SnapshotOrEvent.class.getSimpleName()));
        }
        return (SnapshotOrEvent) deserialize(serializedSnapshotOrEvent.json, javaType);
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    private static Class<?> resolveJavaType(String javaType) {
        var classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = JacksonSnapshotOrEventSerializer.class.getClassLoader();
        }
        try {
            return Class.forName(javaType, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Failed to resolve Java type '{}'", javaType), e);
        }
    }
}
