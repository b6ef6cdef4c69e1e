package org.moxie.toolchat.mcp;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentExpanderTest {

  private final EnvironmentExpander expander = new EnvironmentExpander(Map.of("API_KEY", "s3cr$t", "REGION", "eu")::get);

  @Test
  void testBracedAndBareReferences() {
    assertEquals("Bearer s3cr$t", expander.expand("Bearer ${API_KEY}"));
    assertEquals("eu-west", expander.expand("$REGION-west"));
  }

  @Test
  void testMissingVariableExpandsToEmpty() {
    assertEquals("token=", expander.expand("token=${NOT_SET}"));
  }

  @Test
  void testPlainValuesUntouched() {
    assertEquals("application/json", expander.expand("application/json"));
    assertNull(expander.expand(null));
  }
}
