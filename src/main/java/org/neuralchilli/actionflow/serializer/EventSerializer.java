package org.neuralchilli.actionflow.serializer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.actionflow.domain.Event;
import org.neuralchilli.actionflow.util.Jsons;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Binary serializer for events travelling through Hazelcast topics.
 * The payload is nested and loosely typed, so it is carried as JSON.
 */
public class EventSerializer implements StreamSerializer<Event> {

    public static final int TYPE_ID = 1001;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    @Override
    public int getTypeId() {
        return TYPE_ID;
    }

    @Override
    public void write(ObjectDataOutput out, Event event) throws IOException {
        out.writeString(event.id());
        out.writeString(event.name());
        out.writeString(event.source());
        out.writeLong(event.timestamp().toEpochMilli());
        out.writeString(Jsons.mapper().writeValueAsString(event.payload()));
        writeStringOrNull(out, event.correlationId());
        writeStringOrNull(out, event.userId());
        writeStringOrNull(out, event.sessionId());
    }

    @Override
    public Event read(ObjectDataInput in) throws IOException {
        String id = in.readString();
        String name = in.readString();
        String source = in.readString();
        Instant timestamp = Instant.ofEpochMilli(in.readLong());
        Map<String, Object> payload = Jsons.mapper().readValue(in.readString(), PAYLOAD_TYPE);
        String correlationId = readStringOrNull(in);
        String userId = readStringOrNull(in);
        String sessionId = readStringOrNull(in);

        return new Event(id, name, source, timestamp, payload, correlationId, userId, sessionId);
    }

    private void writeStringOrNull(ObjectDataOutput out, String value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeString(value);
        }
    }

    private String readStringOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readString() : null;
    }
}
