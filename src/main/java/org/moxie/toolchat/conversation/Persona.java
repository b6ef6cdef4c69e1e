package org.moxie.toolchat.conversation;

/**
 * A named system prompt that replaces the default for one {@code platform:userId}.
 */
public record Persona(String name, String prompt) {
}
