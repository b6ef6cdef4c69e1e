package org.moxie.toolchat.llm;

import org.moxie.toolchat.conversation.GenerationException;
import org.moxie.toolchat.tools.ToolDefinition;

import java.util.List;

public interface ModelEndpoint {

  /**
   * Produce the next assistant turn for the transcript.
   *
   * @param aiConfig   endpoint, credentials and model
   * @param transcript the conversation so far
   * @param tools      tools the model may call; empty for a plain generation
   * @return exactly one assistant turn, possibly carrying tool calls
   * @throws GenerationException if the endpoint fails or returns no choice
   */
  ChatMessage generate(AiConfig aiConfig, List<ChatMessage> transcript, List<ToolDefinition> tools) throws GenerationException;
}
