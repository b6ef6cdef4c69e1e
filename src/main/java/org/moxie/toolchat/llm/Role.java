package org.moxie.toolchat.llm;

public enum Role {
  system,
  user,
  assistant,
  tool
}
