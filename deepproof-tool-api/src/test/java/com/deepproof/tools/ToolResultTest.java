package com.deepproof.tools;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ToolResultTest {

    @Test
    void of_hasZeroScoreAndEmptyMetadata() {
        ToolResult r = ToolResult.of("done");

        assertEquals(new ToolResult("done", 0, Map.of()), r);
    }

    @Test
    void runtimeError_namesExceptionClass() {
        ToolResult r = ToolResult.runtimeError(new IOException("connection refused"));

        assertEquals("Runtime error occurred.\njava.io.IOException: connection refused", r.getMessage());
        assertEquals(0.0, r.getScore());
        assertEquals(Map.of(), r.getMetadata());
    }

    @Test
    void runtimeError_usesCauseMessageWhenOuterHasNone() {
        ConnectException refused = new ConnectException();
        refused.initCause(new ConnectException("Connection refused"));

        ToolResult r = ToolResult.runtimeError(refused);

        assertEquals("Runtime error occurred.\njava.net.ConnectException: java.net.ConnectException: Connection refused",
                r.getMessage());
    }

    @Test
    void runtimeError_withoutAnyMessageHasEmptyDetail() {
        assertEquals("Runtime error occurred.\njava.net.ConnectException: ",
                ToolResult.runtimeError(new ConnectException()).getMessage());
    }

    @Test
    void contractViolation_isLabelledSeparately() {
        ToolResult r = ToolResult.contractViolation(new ContractViolationException("Missing required parameter: code"));

        assertEquals("Invalid tool call.\nMissing required parameter: code", r.getMessage());
        assertEquals(Map.of("errorKind", "CONTRACT_VIOLATION"), r.getMetadata());
    }

    @Test
    void metadataIsCopiedAndReadOnly() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("k", "v");
        ToolResult r = new ToolResult("m", 0, meta);
        meta.put("k2", "v2");

        assertEquals(Map.of("k", "v"), r.getMetadata());
        assertThrows(UnsupportedOperationException.class, () -> r.getMetadata().put("x", 1));
    }
}
