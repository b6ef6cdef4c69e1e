package org.moxie.toolchat.broadcast;

import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * A daily local time of day, configured as {@code HH:MM}.
 */
public record FireTime(int hour, int minute) {

  public FireTime {
    if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
      throw new IllegalArgumentException("Invalid fire time: " + hour + ":" + minute);
    }
  }

  public static FireTime parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("fire time is required");
    }

    String[] parts = value.trim().split(":");

    if (parts.length != 2) {
      throw new IllegalArgumentException("Invalid fire time, expected HH:MM: " + value);
    }

    try {
      return new FireTime(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid fire time, expected HH:MM: " + value, e);
    }
  }

  /**
   * Today at this time if that is strictly after {@code now}, otherwise tomorrow.
   */
  public ZonedDateTime nextFireAfter(ZonedDateTime now) {
    ZonedDateTime today = now.with(LocalTime.of(hour, minute));

    if (today.isAfter(now)) {
      return today;
    }

    return today.plusDays(1);
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
