package org.moxie.toolchat.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool as discovered from its provider: name, description and JSON schema of its arguments.
 */
public record ToolDefinition(String name, String description, JsonNode parameterSchema) {

  public ToolDefinition {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Tool name is required");
    }
    if (description == null) {
      description = "";
    }
  }
}
