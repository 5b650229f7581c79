package com.deepproof.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable descriptor of a tool: name, description, parameters and required parameter names.
 * Serializes (Jackson) as {@code {"name", "description", "parameters", "required"}}, the shape used in
 * the tool catalog. {@link #toFunctionSchema()} renders the OpenAI function-tool shape the agent runtime
 * sends to the model.
 */
@JsonPropertyOrder({"name", "description", "parameters", "required"})
public final class ToolSchema {

    private final String name;
    private final String description;
    private final Map<String, ParameterSpec> parameters;
    private final List<String> required;

    @JsonCreator
    public ToolSchema(@JsonProperty("name") String name,
                      @JsonProperty("description") String description,
                      @JsonProperty("parameters") Map<String, ParameterSpec> parameters,
                      @JsonProperty("required") List<String> required) {
        String n = Objects.requireNonNull(name, "name").trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException("Tool name must be non-blank");
        }
        this.name = n;
        this.description = description != null ? description : "";
        this.parameters = parameters != null && !parameters.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Collections.emptyMap();
        this.required = required != null && !required.isEmpty()
                ? List.copyOf(required)
                : List.of();
        for (String r : this.required) {
            if (!this.parameters.containsKey(r)) {
                throw new IllegalArgumentException("Required parameter '" + r + "' is not declared for tool " + n);
            }
        }
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public Map<String, ParameterSpec> getParameters() { return parameters; }
    public List<String> getRequired() { return required; }

    /**
     * OpenAI function-tool shape:
     * {@code {"type":"function","function":{"name","description","parameters":{"type":"object","properties":{...},"required":[...]}}}}.
     */
    public Map<String, Object> toFunctionSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        parameters.forEach((k, v) -> properties.put(k, v.toPropertyMap()));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("type", "object");
        params.put("properties", properties);
        params.put("required", new ArrayList<>(required));
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", params);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("type", "function");
        out.put("function", function);
        return out;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolSchema)) return false;
        ToolSchema that = (ToolSchema) o;
        return name.equals(that.name) && description.equals(that.description)
                && parameters.equals(that.parameters) && required.equals(that.required);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, parameters, required);
    }

    @Override
    public String toString() {
        return "ToolSchema{name=" + name + ", parameters=" + parameters.keySet() + ", required=" + required + "}";
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private final Map<String, ParameterSpec> parameters = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(String paramName, String type, String paramDescription, boolean isRequired) {
            parameters.put(Objects.requireNonNull(paramName, "paramName"), new ParameterSpec(type, paramDescription));
            if (isRequired && !required.contains(paramName)) {
                required.add(paramName);
            }
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(name, description, parameters, required);
        }
    }
}
