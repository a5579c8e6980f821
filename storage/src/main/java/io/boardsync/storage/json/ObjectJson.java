// file: storage/src/main/java/io/boardsync/storage/json/ObjectJson.java
package io.boardsync.storage.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.WhiteboardObject;

import java.io.IOException;

/**
 * Jackson wiring for the core model. The core module stays free of Jackson;
 * here {@link WhiteboardObject} and {@link ObjectPatch} are mapped through
 * {@link ObjectDto} and {@link PatchDto}.
 */
public final class ObjectJson {

    private ObjectJson() {
        // utility
    }

    public static SimpleModule module() {
        SimpleModule m = new SimpleModule("boardsync-objects");
        m.addSerializer(WhiteboardObject.class, new JsonSerializer<>() {
            @Override
            public void serialize(WhiteboardObject value, JsonGenerator gen, SerializerProvider sp) throws IOException {
                gen.writeObject(ObjectDto.from(value));
            }
        });
        m.addDeserializer(WhiteboardObject.class, new JsonDeserializer<>() {
            @Override
            public WhiteboardObject deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return p.readValueAs(ObjectDto.class).toObject();
            }
        });
        m.addSerializer(ObjectPatch.class, new JsonSerializer<>() {
            @Override
            public void serialize(ObjectPatch value, JsonGenerator gen, SerializerProvider sp) throws IOException {
                gen.writeObject(PatchDto.from(value));
            }
        });
        m.addDeserializer(ObjectPatch.class, new JsonDeserializer<>() {
            @Override
            public ObjectPatch deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return p.readValueAs(PatchDto.class).toPatch();
            }
        });
        return m;
    }

    /** A mapper that reads and writes the core model types. */
    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(module())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
