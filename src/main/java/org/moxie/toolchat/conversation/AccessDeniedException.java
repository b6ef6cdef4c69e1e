package org.moxie.toolchat.conversation;

public class AccessDeniedException extends ConversationException {
  public AccessDeniedException(String platform, String userId) {
    super("user " + userId + " is not allowed on platform " + platform);
  }
}
