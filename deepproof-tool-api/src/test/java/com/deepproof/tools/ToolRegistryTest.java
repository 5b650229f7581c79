package com.deepproof.tools;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    private static Tool tool(String name) {
        Tool t = mock(Tool.class);
        when(t.getSchema()).thenReturn(ToolSchema.builder(name).description(name + " tool").build());
        return t;
    }

    @Test
    void register_bindsBySchemaName() {
        Tool a = tool("tools/a");

        registry.register(a);

        assertSame(a, registry.get("tools/a"));
        assertSame(a, registry.get(" tools/a "));
        assertNull(registry.get("tools/missing"));
        assertNull(registry.get(null));
    }

    @Test
    void register_duplicateNameRejected() {
        registry.register(tool("tools/a"));

        assertThrows(IllegalArgumentException.class, () -> registry.register(tool("tools/a")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", tool("tools/b")));
    }

    @Test
    void register_providerUsesCreatedTool() {
        Tool a = tool("tools/a");
        ToolProvider provider = () -> a;

        registry.register(provider);

        assertSame(a, registry.get("tools/a"));
        assertEquals("tools/a tool", provider.getDescription());
    }

    @Test
    void schemasAndNames_keepRegistrationOrder() {
        registry.register(tool("tools/b"));
        registry.register(tool("tools/a"));

        assertEquals(List.of("tools/b", "tools/a"), List.copyOf(registry.getToolNames()));
        assertEquals("tools/b", registry.getSchemas().get(0).getName());
        assertEquals(2, registry.getFunctionSchemas().size());
        assertEquals("function", registry.getFunctionSchemas().get(1).get("type"));
    }

    @Test
    void runResourceCleanup_callsOnExitAndSkipsFailures() {
        Tool failing = mock(Tool.class, Mockito.withSettings().extraInterfaces(ResourceCleanup.class));
        when(failing.getSchema()).thenReturn(ToolSchema.builder("tools/failing").build());
        doThrow(new IllegalStateException("boom")).when((ResourceCleanup) failing).onExit();
        Tool closing = mock(Tool.class, Mockito.withSettings().extraInterfaces(ResourceCleanup.class));
        when(closing.getSchema()).thenReturn(ToolSchema.builder("tools/closing").build());
        registry.register(failing);
        registry.register(closing);
        registry.register(tool("tools/plain"));

        registry.runResourceCleanup();

        verify((ResourceCleanup) failing).onExit();
        verify((ResourceCleanup) closing).onExit();
    }

    @Test
    void clear_removesEverything() {
        registry.register(tool("tools/a"));

        registry.clear();

        assertEquals(0, registry.size());
    }
}
