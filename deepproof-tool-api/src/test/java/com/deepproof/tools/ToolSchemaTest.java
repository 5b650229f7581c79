package com.deepproof.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolSchemaTest {

    private static final ToolSchema EXECUTE = ToolSchema.builder("tools/execute_fstar")
            .description("A tool that executes the given fstar code.")
            .parameter("code", "string", "F* code to execute", true)
            .build();

    @Test
    void builder_collectsParametersAndRequired() {
        assertEquals("tools/execute_fstar", EXECUTE.getName());
        assertEquals(new ParameterSpec("string", "F* code to execute"), EXECUTE.getParameters().get("code"));
        assertEquals(List.of("code"), EXECUTE.getRequired());
    }

    @Test
    void parametersAreImmutable() {
        assertThrows(UnsupportedOperationException.class,
                () -> EXECUTE.getParameters().put("other", new ParameterSpec("string", "")));
        assertThrows(UnsupportedOperationException.class, () -> EXECUTE.getRequired().add("other"));
    }

    @Test
    void requiredMustBeDeclared() {
        assertThrows(IllegalArgumentException.class,
                () -> new ToolSchema("t", "d", Map.of(), List.of("code")));
    }

    @Test
    void blankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> ToolSchema.builder("  ").build());
    }

    @Test
    @SuppressWarnings("unchecked")
    void toFunctionSchema_rendersOpenAiShape() {
        Map<String, Object> fn = EXECUTE.toFunctionSchema();

        assertEquals("function", fn.get("type"));
        Map<String, Object> function = (Map<String, Object>) fn.get("function");
        assertEquals("tools/execute_fstar", function.get("name"));
        Map<String, Object> params = (Map<String, Object>) function.get("parameters");
        assertEquals("object", params.get("type"));
        assertEquals(List.of("code"), params.get("required"));
        Map<String, Object> properties = (Map<String, Object>) params.get("properties");
        assertEquals(Map.of("type", "string", "description", "F* code to execute"), properties.get("code"));
    }

    @Test
    void schemaWithoutParameters_hasEmptyPropertiesAndRequired() {
        ToolSchema list = ToolSchema.builder("tools/list").description("lists").build();

        assertTrue(list.getParameters().isEmpty());
        assertTrue(list.getRequired().isEmpty());
    }
}
