// file: storage/src/main/java/io/boardsync/storage/json/ObjectDto.java
package io.boardsync.storage.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.boardsync.core.ObjectType;
import io.boardsync.core.WhiteboardObject;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of a whiteboard object, shared by the REST API, the live channel,
 * WAL records and snapshots.
 * Example:
 *   {
 *     "id": "6f1c...", "board_id": "b-1", "object_type": "sticky_note",
 *     "x": 120, "y": 80, "width": 200, "height": 200, "rotation": 0,
 *     "properties": { "text": "hi", "noteColor": "#FEF08A" },
 *     "updated_by": "u-1", "updated_at": "2024-05-01T10:00:00Z",
 *     "created_at": "2024-05-01T10:00:00Z", "version": 3
 *   }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ObjectDto {
    public String id;
    @JsonProperty("board_id")
    public String boardId;
    @JsonProperty("object_type")
    public String objectType;
    public double x;
    public double y;
    public double width;
    public double height;
    public double rotation;
    public Map<String, Object> properties;
    @JsonProperty("updated_by")
    public String updatedBy;
    @JsonProperty("updated_at")
    public String updatedAt;
    @JsonProperty("created_at")
    public String createdAt;
    public int version;

    public static ObjectDto from(WhiteboardObject o) {
        ObjectDto dto = new ObjectDto();
        dto.id = o.id();
        dto.boardId = o.boardId();
        dto.objectType = o.type().wireName();
        dto.x = o.x();
        dto.y = o.y();
        dto.width = o.width();
        dto.height = o.height();
        dto.rotation = o.rotation();
        dto.properties = new LinkedHashMap<>(o.properties());
        dto.updatedBy = o.updatedBy();
        dto.updatedAt = Instant.ofEpochMilli(o.updatedAt()).toString();
        dto.createdAt = Instant.ofEpochMilli(o.createdAt()).toString();
        dto.version = o.version();
        return dto;
    }

    /** @throws IllegalArgumentException on a missing id, unknown type or malformed timestamp */
    public WhiteboardObject toObject() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id must not be empty");
        if (boardId == null || boardId.isBlank()) throw new IllegalArgumentException("board_id must not be empty");
        long updated = parseInstant("updated_at", updatedAt, 0L);
        return WhiteboardObject.builder()
                .id(id)
                .boardId(boardId)
                .type(ObjectType.fromWireName(objectType))
                .x(x).y(y).width(width).height(height).rotation(rotation)
                .properties(properties)
                .updatedBy(updatedBy)
                .updatedAt(updated)
                .createdAt(parseInstant("created_at", createdAt, updated))
                .version(version)
                .build();
    }

    static long parseInstant(String field, String value, long fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid " + field + ": " + value, e);
        }
    }
}
