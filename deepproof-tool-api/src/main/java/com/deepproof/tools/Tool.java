package com.deepproof.tools;

import java.util.Map;

/**
 * Lifecycle contract every tool satisfies. The hosting agent runtime resolves a tool by name from
 * {@link ToolRegistry}, calls {@link #create} once per tool-use episode, {@link #execute} zero or more
 * times with the returned instance id, and finally {@link #release}.
 * <p>
 * <b>Threading and state:</b> calls for different instance ids may run concurrently on any thread.
 * Calls for one instance id are serialized by the caller; implementations add no per-instance lock.
 * Per-instance bookkeeping belongs in a {@link ToolInstanceRegistry}, never in fields that assume a
 * single episode.
 */
public interface Tool {

    /**
     * Schema built when the tool was constructed. Pure; no side effects.
     */
    ToolSchema getSchema();

    /**
     * Starts a tool-use episode.
     *
     * @param instanceId  id chosen by the caller; null or blank to have a random id generated
     * @param groundTruth optional reference answer for the episode; may be null
     * @param extra       auxiliary arguments from the orchestration layer; may be null
     * @return the instance id to pass to {@link #execute} and {@link #release}
     */
    String create(String instanceId, String groundTruth, Map<String, Object> extra);

    /**
     * Invokes the tool. Never throws: every failure is rendered into {@link ToolResult#getMessage()}.
     *
     * @param instanceId id returned by {@link #create}
     * @param parameters arguments emitted by the model (e.g. "code")
     * @param extra      auxiliary arguments from the orchestration layer (e.g. "tools_kwargs"); may be null
     * @return message, score and metadata; never null
     */
    ToolResult execute(String instanceId, Map<String, Object> parameters, Map<String, Object> extra);

    /**
     * Ends the episode and drops any bookkeeping for it. Safe for ids that were never created.
     */
    void release(String instanceId, Map<String, Object> extra);

    /** Convenience for {@link #getSchema()}{@code .getName()}. */
    default String getName() {
        return getSchema().getName();
    }
}
