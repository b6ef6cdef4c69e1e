package org.moxie.toolchat.conversation;

import org.moxie.toolchat.llm.ChatMessage;

import java.util.List;

/**
 * Outcome of a finished run: the text to present and the transcript that produced it.
 * The transcript does not include the formatting exchange.
 */
public record ConversationResult(String finalText, List<ChatMessage> transcript, int iterations) {

  public ConversationResult {
    transcript = List.copyOf(transcript);
  }
}
