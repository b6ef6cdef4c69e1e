package org.moxie.toolchat.delivery;

import java.util.Locale;

/**
 * A platform and a recipient on it, written as {@code platform:recipient}. Only the
 * first colon separates the two, so {@code QQ:Group:456} addresses {@code Group:456} on qq.
 */
public record DeliveryTarget(String platform, String recipient) {

  public DeliveryTarget {
    if (platform == null || platform.isBlank() || recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("platform and recipient are required");
    }
    platform = platform.trim().toLowerCase(Locale.ROOT);
    recipient = recipient.trim();
  }

  public static DeliveryTarget parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("delivery target is required");
    }

    int separator = value.indexOf(':');

    if (separator <= 0 || separator == value.length() - 1) {
      throw new IllegalArgumentException("Invalid delivery target, expected platform:recipient: " + value);
    }

    return new DeliveryTarget(value.substring(0, separator), value.substring(separator + 1));
  }

  @Override
  public String toString() {
    return platform + ":" + recipient;
  }
}
