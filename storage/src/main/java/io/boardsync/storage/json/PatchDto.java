// file: storage/src/main/java/io/boardsync/storage/json/PatchDto.java
package io.boardsync.storage.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.boardsync.core.ObjectPatch;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shape of a partial update. Absent fields are left alone; inside
 * {@code properties} an explicit null removes the key.
 * Example:
 *   { "x": 140, "y": 95, "version": 4, "updated_at": "...", "updated_by": "u-1" }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchDto {
    public Double x;
    public Double y;
    public Double width;
    public Double height;
    public Double rotation;
    public Map<String, Object> properties;
    public Integer version;
    @JsonProperty("updated_at")
    public String updatedAt;
    @JsonProperty("updated_by")
    public String updatedBy;

    public static PatchDto from(ObjectPatch p) {
        PatchDto dto = new PatchDto();
        dto.x = p.x();
        dto.y = p.y();
        dto.width = p.width();
        dto.height = p.height();
        dto.rotation = p.rotation();
        dto.properties = p.properties().isEmpty() ? null : new LinkedHashMap<>(p.properties());
        dto.version = p.version();
        dto.updatedAt = p.updatedAt() == null ? null : Instant.ofEpochMilli(p.updatedAt()).toString();
        dto.updatedBy = p.updatedBy();
        return dto;
    }

    public ObjectPatch toPatch() {
        return ObjectPatch.builder()
                .x(x).y(y).width(width).height(height).rotation(rotation)
                .properties(properties)
                .version(version)
                .updatedAt(updatedAt == null ? null : ObjectDto.parseInstant("updated_at", updatedAt, 0L))
                .updatedBy(updatedBy)
                .build();
    }
}
