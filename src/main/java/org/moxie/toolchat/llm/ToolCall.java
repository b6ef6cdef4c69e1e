package org.moxie.toolchat.llm;

/**
 * A tool invocation requested by the model inside an assistant turn.
 */
public record ToolCall(String id, String toolName, String argumentsJson) {}
