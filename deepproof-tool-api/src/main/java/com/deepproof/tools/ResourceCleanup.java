package com.deepproof.tools;

/**
 * Contract for releasing resources when the host shuts down. Tools that hold connections, threads or
 * caches implement this and release them in {@link #onExit()}. {@link ToolRegistry#runResourceCleanup()}
 * invokes it on every registered tool that implements it.
 */
public interface ResourceCleanup {

    /**
     * Called once at shutdown. Exceptions are logged by the caller and not rethrown so the remaining
     * tools still get cleaned up.
     */
    void onExit();
}
