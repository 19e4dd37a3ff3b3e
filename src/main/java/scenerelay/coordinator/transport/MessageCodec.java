package scenerelay.coordinator.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import scenerelay.coordinator.model.Message;

/**
 * JSON encoding of protocol messages. One message is one line of JSON.
 * Thread-safe.
 */
public final class MessageCodec {

    private final ObjectMapper mapper;

    public MessageCodec() {
        this(new ObjectMapper()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .findAndRegisterModules());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Message message) {
        try {
            return mapper.writerFor(Message.class).writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    public Message decode(String line) {
        if (line == null || line.isBlank()) {
            throw new TransportException("Empty message frame");
        }
        try {
            return mapper.readValue(line, Message.class);
        } catch (JsonProcessingException e) {
            throw new TransportException("Cannot decode message: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            // payload validation inside a message constructor
            throw new TransportException("Invalid message: " + e.getMessage(), e);
        }
    }
}
