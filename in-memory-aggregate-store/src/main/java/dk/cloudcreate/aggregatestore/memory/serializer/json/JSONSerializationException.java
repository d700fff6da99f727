package dk.cloudcreate.aggregatestore.memory.serializer.json;

import dk.cloudcreate.aggregatestore.aggregates.AggregateException;

public class JSONSerializationException extends AggregateException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
