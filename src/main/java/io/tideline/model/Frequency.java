package io.tideline.model;

import java.util.Optional;

/**
 * Frequency of a recurrence rule, named as in RFC 5545 {@code FREQ=}.
 *
 * <p>The sub-daily frequencies exist so that codecs can carry them; the recurrence engine only
 * generates {@link #DAILY}, {@link #WEEKLY}, {@link #MONTHLY} and {@link #YEARLY}.
 */
public enum Frequency {
  SECONDLY,
  MINUTELY,
  HOURLY,
  DAILY,
  WEEKLY,
  MONTHLY,
  YEARLY;

  /**
   * Returns whether the recurrence engine can generate occurrences for this frequency.
   *
   * @return true for daily, weekly, monthly and yearly
   */
  public boolean isSupported() {
    return this == DAILY || this == WEEKLY || this == MONTHLY || this == YEARLY;
  }

  /**
   * Parses an RFC 5545 frequency name such as {@code WEEKLY} (case insensitive).
   *
   * @param s the string to parse
   * @return the frequency if valid
   */
  public static Optional<Frequency> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    String name = s.trim();
    for (Frequency f : values()) {
      if (f.name().equalsIgnoreCase(name)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }
}
