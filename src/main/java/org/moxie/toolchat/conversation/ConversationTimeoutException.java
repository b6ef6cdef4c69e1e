package org.moxie.toolchat.conversation;

/**
 * The run exceeded its end-to-end deadline or was cancelled.
 */
public class ConversationTimeoutException extends ConversationException {
  public ConversationTimeoutException(String message) {
    super(message);
  }

  public ConversationTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
