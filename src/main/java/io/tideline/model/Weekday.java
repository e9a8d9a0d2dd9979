package io.tideline.model;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Represents a day of the week, with its RFC 5545 two-letter code. */
public enum Weekday {
  MONDAY("monday", "MO"),
  TUESDAY("tuesday", "TU"),
  WEDNESDAY("wednesday", "WE"),
  THURSDAY("thursday", "TH"),
  FRIDAY("friday", "FR"),
  SATURDAY("saturday", "SA"),
  SUNDAY("sunday", "SU");

  private final String displayName;
  private final String icsCode;

  Weekday(String displayName, String icsCode) {
    this.displayName = displayName;
    this.icsCode = icsCode;
  }

  /**
   * Returns the two-letter code used in {@code BYDAY=} (MO, TU, ...).
   *
   * @return the iCalendar weekday code
   */
  public String icsCode() {
    return icsCode;
  }

  /**
   * Returns whether this day is Saturday or Sunday.
   *
   * @return true for the weekend
   */
  public boolean isWeekend() {
    return this == SATURDAY || this == SUNDAY;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("mo", MONDAY),
          Map.entry("tu", TUESDAY),
          Map.entry("we", WEDNESDAY),
          Map.entry("th", THURSDAY),
          Map.entry("fr", FRIDAY),
          Map.entry("sa", SATURDAY),
          Map.entry("su", SUNDAY));

  /**
   * Parses a two-letter iCalendar code such as {@code MO} (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() - 1];
  }
}
