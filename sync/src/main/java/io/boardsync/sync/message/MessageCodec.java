// file: sync/src/main/java/io/boardsync/sync/message/MessageCodec.java
package io.boardsync.sync.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.boardsync.storage.json.ObjectJson;

/** JSON text codec for {@link SyncMessage}, shared by clients and the relay. Thread-safe. */
public final class MessageCodec {
    private final ObjectWriter writer;
    private final ObjectReader reader;

    public MessageCodec() {
        this(ObjectJson.newMapper());
    }

    public MessageCodec(ObjectMapper mapper) {
        this.writer = mapper.writerFor(SyncMessage.class);
        this.reader = mapper.readerFor(SyncMessage.class);
    }

    public String encode(SyncMessage message) {
        try {
            return writer.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /** @throws IllegalArgumentException on malformed JSON, an unknown event or an invalid payload */
    public SyncMessage decode(String text) {
        try {
            return reader.readValue(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid message: " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid message: " + e.getMessage(), e);
        }
    }
}
