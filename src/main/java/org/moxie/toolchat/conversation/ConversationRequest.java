package org.moxie.toolchat.conversation;

/**
 * One interactive request from a user on a chat platform.
 */
public record ConversationRequest(String platform, String userId, String text, ConversationMode mode) {

  public ConversationRequest {
    if (platform == null || platform.isBlank()) {
      throw new IllegalArgumentException("platform is required");
    }
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    if (mode == null) {
      mode = ConversationMode.CHAT;
    }
  }
}
