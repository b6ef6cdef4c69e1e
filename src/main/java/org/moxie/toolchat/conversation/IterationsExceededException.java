package org.moxie.toolchat.conversation;

import org.moxie.toolchat.llm.ChatMessage;

import java.util.List;

/**
 * The model was still requesting tools when the iteration bound was reached.
 */
public class IterationsExceededException extends ConversationException {

  private final int               maxIterations;
  private final List<ChatMessage> transcript;

  public IterationsExceededException(int maxIterations, List<ChatMessage> transcript) {
    super("exceeded maximum iterations (" + maxIterations + ") without final response");
    this.maxIterations = maxIterations;
    this.transcript    = List.copyOf(transcript);
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public List<ChatMessage> getTranscript() {
    return transcript;
  }
}
