package io.tideline.zone;

import io.tideline.TidelineException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.zone.ZoneRules;
import java.util.List;

/**
 * Resolves civil date-times against named zones.
 *
 * <h2>DST Handling</h2>
 *
 * <ol>
 *   <li><b>Fall back (overlap):</b> the wall-clock time occurs twice. {@link
 *       Disambiguation#EARLIEST} picks the first instant, {@link Disambiguation#LATEST} the second.
 *   <li><b>Spring forward (gap):</b> the wall-clock time does not exist. Only {@link
 *       Disambiguation#SHIFT_FORWARD} resolves it, by pushing the time past the gap; the other
 *       strategies fail with {@code INVALID_LOCAL_TIME}.
 * </ol>
 *
 * <p>Day windows are {@code [00:00:00 earliest, 23:59:59 latest]} so that a full civil day is
 * covered even when it is 23 or 25 hours long.
 */
public final class ZonedClock {
  /** Civil pattern with a space separator, e.g. {@code 2025-11-01 10:00:00}. */
  private static final DateTimeFormatter SPACE_PATTERN =
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  /** Civil pattern with a {@code T} separator, e.g. {@code 2025-11-01T10:00:00}. */
  private static final DateTimeFormatter ISO_PATTERN =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

  /** Last second of a civil day used for end-of-day windows. */
  private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

  private ZonedClock() {}

  /**
   * Resolves an IANA zone identifier (or {@code UTC}).
   *
   * @param zoneId the zone identifier
   * @return the zone
   * @throws TidelineException if the identifier is blank or unknown
   */
  public static ZoneId zone(String zoneId) throws TidelineException {
    if (zoneId == null || zoneId.isBlank()) {
      throw TidelineException.invalidTimeZone(String.valueOf(zoneId), null);
    }
    try {
      return ZoneId.of(zoneId.trim());
    } catch (DateTimeException e) {
      throw TidelineException.invalidTimeZone(zoneId, e);
    }
  }

  /**
   * Parses a civil date-time in one of the two supported patterns.
   *
   * @param civil the text, {@code YYYY-MM-DD HH:MM:SS} or {@code YYYY-MM-DDTHH:MM:SS}
   * @return the civil date-time
   * @throws TidelineException if the text matches neither pattern
   */
  public static LocalDateTime parseCivil(String civil) throws TidelineException {
    if (civil == null) {
      throw TidelineException.timeParse("Civil date-time is required", null);
    }
    String text = civil.trim();
    DateTimeFormatter pattern =
        text.length() > 10 && text.charAt(10) == 'T' ? ISO_PATTERN : SPACE_PATTERN;
    try {
      return LocalDateTime.parse(text, pattern);
    } catch (DateTimeParseException e) {
      throw TidelineException.timeParse(
          "Could not parse '"
              + civil
              + "'. Expected 'YYYY-MM-DD HH:MM:SS' or 'YYYY-MM-DDTHH:MM:SS'",
          civil);
    }
  }

  /**
   * Parses a civil date-time string and resolves it in the given zone.
   *
   * @param civil the civil date-time text
   * @param zone the zone
   * @param disambiguation how to treat overlaps and gaps
   * @return the resolved instant
   * @throws TidelineException if the text is malformed or the time cannot be resolved
   */
  public static ZonedDateTime resolve(String civil, ZoneId zone, Disambiguation disambiguation)
      throws TidelineException {
    return resolve(parseCivil(civil), zone, disambiguation);
  }

  /**
   * Resolves a civil date-time in the given zone.
   *
   * @param local the civil date-time
   * @param zone the zone
   * @param disambiguation how to treat overlaps and gaps
   * @return the resolved instant
   * @throws TidelineException if the time falls in a gap and the strategy does not tolerate it
   */
  public static ZonedDateTime resolve(
      LocalDateTime local, ZoneId zone, Disambiguation disambiguation) throws TidelineException {
    ZoneRules rules = zone.getRules();
    List<ZoneOffset> offsets = rules.getValidOffsets(local);

    if (offsets.size() == 1) {
      return ZonedDateTime.ofStrict(local, offsets.get(0), zone);
    }

    if (offsets.isEmpty()) {
      if (disambiguation == Disambiguation.SHIFT_FORWARD) {
        // ofLocal moves a gap time forward by the gap length
        return ZonedDateTime.ofLocal(local, zone, null);
      }
      throw TidelineException.invalidLocalTime(
          "Local time " + local + " does not exist in zone " + zone + " (DST gap)",
          local.toString());
    }

    ZonedDateTime earliest = ZonedDateTime.ofLocal(local, zone, null).withEarlierOffsetAtOverlap();
    return disambiguation == Disambiguation.LATEST ? earliest.withLaterOffsetAtOverlap() : earliest;
  }

  /**
   * Resolves a civil date-time, moving times inside a DST gap forward. Never fails.
   *
   * @param local the civil date-time
   * @param zone the zone
   * @return the earliest instant for the civil time, shifted past any gap
   */
  public static ZonedDateTime resolveLenient(LocalDateTime local, ZoneId zone) {
    return ZonedDateTime.ofLocal(local, zone, null).withEarlierOffsetAtOverlap();
  }

  /**
   * Returns the first instant of a civil day.
   *
   * @param date the civil date
   * @param zone the zone
   * @return the start of the day
   */
  public static ZonedDateTime startOfDay(LocalDate date, ZoneId zone) {
    return resolveLenient(date.atStartOfDay(), zone);
  }

  /**
   * Returns {@code 23:59:59} of a civil day, using the later instant on an overlap.
   *
   * @param date the civil date
   * @param zone the zone
   * @return the end of the day
   * @throws TidelineException if {@code 23:59:59} does not exist in the zone on that date
   */
  public static ZonedDateTime endOfDay(LocalDate date, ZoneId zone) throws TidelineException {
    return resolve(date.atTime(END_OF_DAY), zone, Disambiguation.LATEST);
  }

  /**
   * Renders the same instant in another zone.
   *
   * @param instant the instant
   * @param target the target zone
   * @return the instant in the target zone
   */
  public static ZonedDateTime convert(ZonedDateTime instant, ZoneId target) {
    return instant.withZoneSameInstant(target);
  }

  /**
   * Checks whether daylight saving time is in effect at the given instant in its own zone.
   *
   * @param instant the instant
   * @return true if the zone's offset includes a DST saving at that instant
   */
  public static boolean isDst(ZonedDateTime instant) {
    return instant.getZone().getRules().isDaylightSavings(instant.toInstant());
  }

  /**
   * Checks whether a zone is UTC (or an alias with a permanent zero offset such as Etc/UTC).
   *
   * @param zone the zone
   * @return true if the zone is UTC
   */
  public static boolean isUtc(ZoneId zone) {
    return zone.normalized().equals(ZoneOffset.UTC);
  }

  /**
   * Formats an instant as civil time in its own zone, {@code YYYY-MM-DD HH:MM:SS}.
   *
   * @param instant the instant
   * @return the civil text
   */
  public static String formatCivil(ZonedDateTime instant) {
    return SPACE_PATTERN.format(instant);
  }
}
