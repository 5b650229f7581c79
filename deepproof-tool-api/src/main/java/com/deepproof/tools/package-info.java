/**
 * Tool contract for agent runtimes: tools are named, schema-described capabilities the agent may call
 * mid-conversation.
 * <ul>
 *   <li>{@link com.deepproof.tools.Tool} – lifecycle: getSchema, create, execute, release</li>
 *   <li>{@link com.deepproof.tools.ToolSchema} / {@link com.deepproof.tools.ParameterSpec} – immutable descriptor</li>
 *   <li>{@link com.deepproof.tools.ToolResult} – message, score, metadata</li>
 *   <li>{@link com.deepproof.tools.ToolInstanceRegistry} – per-tool instance id bookkeeping</li>
 *   <li>{@link com.deepproof.tools.ToolProvider} – tool plus discovery metadata for registration</li>
 *   <li>{@link com.deepproof.tools.ToolRegistry} – name → tool dispatch table</li>
 *   <li>{@link com.deepproof.tools.ResourceCleanup} – onExit() for shutdown</li>
 * </ul>
 */
package com.deepproof.tools;
