package org.moxie.toolchat.conversation;

/**
 * Base class for failures that end a conversation run.
 */
public abstract class ConversationException extends Exception {
  protected ConversationException(String message) {
    super(message);
  }

  protected ConversationException(String message, Throwable cause) {
    super(message, cause);
  }
}
