package com.deepproof.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tool map of instance id → {@link ToolInstance}. {@link #create} inserts, {@link #release}
 * removes, execute paths only read. Backed by a {@link ConcurrentHashMap} so hosts may drive
 * different instance ids from different threads.
 */
public final class ToolInstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolInstanceRegistry.class);

    private final String toolName;
    private final ConcurrentHashMap<String, ToolInstance> instances = new ConcurrentHashMap<>();

    public ToolInstanceRegistry(String toolName) {
        this.toolName = toolName;
    }

    /**
     * Records an instance and returns its id. A null or blank id is replaced with a random UUID.
     * If the id is already recorded the first record is kept.
     */
    public String create(String instanceId, String groundTruth) {
        String id = instanceId == null || instanceId.isBlank() ? UUID.randomUUID().toString() : instanceId;
        ToolInstance previous = instances.putIfAbsent(id, new ToolInstance(id, groundTruth, Instant.now()));
        if (previous != null) {
            log.debug("Tool {}: instance {} already created; keeping existing record", toolName, id);
        }
        return id;
    }

    /** Returns the instance for the id, or empty if it was never created or already released. */
    public Optional<ToolInstance> get(String instanceId) {
        if (instanceId == null) return Optional.empty();
        return Optional.ofNullable(instances.get(instanceId));
    }

    public boolean contains(String instanceId) {
        return instanceId != null && instances.containsKey(instanceId);
    }

    /** Removes the instance; no-op when absent. */
    public void release(String instanceId) {
        if (instanceId == null) return;
        if (instances.remove(instanceId) == null) {
            log.debug("Tool {}: release for unknown instance {}", toolName, instanceId);
        }
    }

    public int size() {
        return instances.size();
    }
}
