package io.tideline.ics;

import io.tideline.TidelineException;
import io.tideline.zone.Disambiguation;
import io.tideline.zone.ZonedClock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.Temporal;

/** RFC 5545 basic-format DATE and DATE-TIME values. */
final class IcsTime {
  /** Zone assumed for floating values and for input without a TZID. */
  static final ZoneId DEFAULT_ZONE = ZoneId.of("UTC");

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmss").withResolverStyle(ResolverStyle.STRICT);

  private IcsTime() {}

  /**
   * Formats an instant as {@code yyyyMMddTHHmmssZ}.
   *
   * @param instant the instant
   * @return the UTC form
   */
  static String formatUtc(ZonedDateTime instant) {
    return DATE_TIME.format(instant.withZoneSameInstant(ZoneOffset.UTC)) + "Z";
  }

  /**
   * Formats a civil date-time as {@code yyyyMMddTHHmmss}.
   *
   * @param local the civil date-time
   * @return the local form
   */
  static String formatLocal(LocalDateTime local) {
    return DATE_TIME.format(local);
  }

  /**
   * Converts a value parsed by ical4j to an instant in {@code zone}. {@link Instant}s and
   * fixed-offset values are absolute; other date-times are civil time in {@code zone}. A {@link
   * LocalDate} stands for the start of that day.
   *
   * @param value the parsed DATE or DATE-TIME
   * @param zone the zone named by the property's {@code TZID}, or {@link #DEFAULT_ZONE}
   * @return the instant
   * @throws TidelineException if the value has an unsupported type or does not exist in the zone
   */
  static ZonedDateTime toZoned(Temporal value, ZoneId zone) throws TidelineException {
    if (value instanceof Instant instant) {
      return instant.atZone(zone);
    }
    if (value instanceof OffsetDateTime offset) {
      return offset.atZoneSameInstant(zone);
    }
    if (value instanceof ZonedDateTime zoned) {
      if (zoned.getZone().normalized() instanceof ZoneOffset) {
        return zoned.withZoneSameInstant(zone);
      }
      return ZonedClock.resolve(zoned.toLocalDateTime(), zone, Disambiguation.EARLIEST);
    }
    if (value instanceof LocalDateTime local) {
      return ZonedClock.resolve(local, zone, Disambiguation.EARLIEST);
    }
    if (value instanceof LocalDate date) {
      return ZonedClock.startOfDay(date, zone);
    }
    throw TidelineException.timeParse(
        "Unsupported iCalendar date-time value", String.valueOf(value));
  }
}
