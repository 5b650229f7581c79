package com.deepproof.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Type and description of a single tool parameter (e.g. code → string, "F* code to execute"). */
@JsonPropertyOrder({"type", "description"})
public final class ParameterSpec {

    private final String type;
    private final String description;

    @JsonCreator
    public ParameterSpec(@JsonProperty("type") String type,
                         @JsonProperty("description") String description) {
        this.type = type != null && !type.isBlank() ? type.trim() : "string";
        this.description = description != null ? description : "";
    }

    public String getType() { return type; }
    public String getDescription() { return description; }

    /** JSON-schema property shape: {@code {"type": ..., "description": ...}}. */
    Map<String, Object> toPropertyMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        m.put("description", description);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterSpec)) return false;
        ParameterSpec that = (ParameterSpec) o;
        return type.equals(that.type) && description.equals(that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, description);
    }

    @Override
    public String toString() {
        return "ParameterSpec{type=" + type + ", description=" + description + "}";
    }
}
