package org.moxie.toolchat.conversation;

public enum ConversationState {
  GENERATING,
  DECIDING,
  INVOKING,
  DONE
}
