package org.moxie.toolchat.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ConversationMode {
  CHAT,
  NEWS,
  SEARCH;

  @JsonCreator
  public static ConversationMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return CHAT;
    }

    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown conversation mode: " + value, e);
    }
  }
}
