package dk.cloudcreate.aggregatestore.memory.serializer.json;

import dk.cloudcreate.aggregatestore.aggregates.AggregateException;

public class JSONDeserializationException extends AggregateException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
