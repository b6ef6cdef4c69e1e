package org.moxie.toolchat.conversation;

/**
 * The model endpoint failed. Fatal to the current conversation only.
 */
public class GenerationException extends ConversationException {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
