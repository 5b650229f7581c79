package com.deepproof.tools;

import java.time.Instant;

/** Bookkeeping for one tool-use episode. */
public final class ToolInstance {

    private final String instanceId;
    private final String groundTruth;
    private final Instant createdAt;

    ToolInstance(String instanceId, String groundTruth, Instant createdAt) {
        this.instanceId = instanceId;
        this.groundTruth = groundTruth;
        this.createdAt = createdAt;
    }

    public String getInstanceId() { return instanceId; }
    /** Reference answer passed to create; null when none was given. */
    public String getGroundTruth() { return groundTruth; }
    public Instant getCreatedAt() { return createdAt; }
}
