package org.moxie.toolchat.mcp;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands ${VAR} and $VAR references against an environment lookup.
 * Unset variables expand to the empty string.
 */
public class EnvironmentExpander {

  private static final Pattern VARIABLE = Pattern.compile("\\$\\{([^}]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

  private final Function<String, String> lookup;

  public EnvironmentExpander() {
    this(System::getenv);
  }

  public EnvironmentExpander(Function<String, String> lookup) {
    this.lookup = lookup;
  }

  public String expand(String value) {
    if (value == null || value.indexOf('$') < 0) {
      return value;
    }

    Matcher       matcher = VARIABLE.matcher(value);
    StringBuilder result  = new StringBuilder();

    while (matcher.find()) {
      String name        = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
      String replacement = name.isEmpty() ? null : lookup.apply(name);

      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement == null ? "" : replacement));
    }

    matcher.appendTail(result);
    return result.toString();
  }
}
