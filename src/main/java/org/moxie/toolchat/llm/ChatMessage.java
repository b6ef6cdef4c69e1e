package org.moxie.toolchat.llm;

import java.util.List;

/**
 * One turn of a transcript.
 *
 * @param role       who produced the turn
 * @param content    text of the turn; may be null on an assistant turn that only carries tool calls
 * @param toolCalls  tool calls requested by an assistant turn, in the order issued
 * @param toolCallId for tool turns, the id of the call this turn answers
 */
public record ChatMessage(Role role, String content, List<ToolCall> toolCalls, String toolCallId) {

  public ChatMessage {
    if (role == null) {
      throw new IllegalArgumentException("role is required");
    }
    toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
  }

  public static ChatMessage system(String content) {
    return new ChatMessage(Role.system, content, List.of(), null);
  }

  public static ChatMessage user(String content) {
    return new ChatMessage(Role.user, content, List.of(), null);
  }

  public static ChatMessage assistant(String content) {
    return new ChatMessage(Role.assistant, content, List.of(), null);
  }

  public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
    return new ChatMessage(Role.assistant, content, toolCalls, null);
  }

  public static ChatMessage tool(String toolCallId, String content) {
    return new ChatMessage(Role.tool, content, List.of(), toolCallId);
  }

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }
}
