package com.deepproof.tools;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolInstanceRegistryTest {

    @Test
    void create_generatesDistinctIdsWhenNoneGiven() {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");

        String a = registry.create(null, null);
        String b = registry.create(null, null);

        assertNotEquals(a, b);
        assertEquals(2, registry.size());
    }

    @Test
    void create_returnsExplicitId() {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");

        assertEquals("episode-1", registry.create("episode-1", "answer"));
        assertEquals("answer", registry.get("episode-1").orElseThrow().getGroundTruth());
    }

    @Test
    void create_blankIdIsReplaced() {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");

        String id = registry.create("  ", null);

        assertFalse(id.isBlank());
        assertTrue(registry.contains(id));
    }

    @Test
    void create_sameIdTwiceKeepsFirstRecord() {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");
        registry.create("x", "first");

        assertEquals("x", registry.create("x", "second"));
        assertEquals("first", registry.get("x").orElseThrow().getGroundTruth());
        assertEquals(1, registry.size());
    }

    @Test
    void release_removesAndToleratesUnknownIds() {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");
        String id = registry.create(null, null);

        registry.release(id);
        registry.release(id);
        registry.release("never-created");
        registry.release(null);

        assertFalse(registry.contains(id));
        assertTrue(registry.get(id).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void concurrentCreates_forDifferentIdsAreAllRecorded() throws Exception {
        ToolInstanceRegistry registry = new ToolInstanceRegistry("t");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                tasks.add(() -> registry.create(null, null));
            }
            Set<String> ids = new HashSet<>();
            for (Future<String> f : pool.invokeAll(tasks)) {
                ids.add(f.get());
            }
            assertEquals(200, ids.size());
            assertEquals(200, registry.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
