package io.tideline.ics;

import io.tideline.Calendar;
import io.tideline.TidelineException;
import io.tideline.model.Event;
import io.tideline.model.EventStatus;
import io.tideline.zone.ZonedClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a calendar as RFC 5545 text.
 *
 * <p>Events in UTC are written in the {@code Z} form; all others carry a {@code TZID} parameter
 * with local time. No {@code VTIMEZONE} components are emitted, zone names are IANA identifiers.
 */
public final class IcsWriter {
  private static final Logger log = LoggerFactory.getLogger(IcsWriter.class);

  static final String PRODID = "-//Tideline//Tideline Calendar//EN";

  /** Status extension carrying values RFC 5545 has no name for. */
  static final String X_STATUS = "X-TIDELINE-STATUS";

  static final String X_SKIP_WEEKENDS = "X-TIDELINE-SKIP-WEEKENDS";

  private static final String CRLF = "\r\n";
  private static final int MAX_LINE_OCTETS = 75;

  private IcsWriter() {}

  /**
   * Renders a calendar.
   *
   * @param calendar the calendar
   * @return the iCalendar text, CRLF terminated
   */
  public static String write(Calendar calendar) {
    return write(calendar, ZonedDateTime.now(ZoneOffset.UTC));
  }

  /**
   * Renders a calendar with a fixed {@code DTSTAMP}.
   *
   * @param calendar the calendar
   * @param stamp the creation time written to every event
   * @return the iCalendar text, CRLF terminated
   */
  public static String write(Calendar calendar, ZonedDateTime stamp) {
    StringBuilder sb = new StringBuilder();
    line(sb, "BEGIN:VCALENDAR");
    line(sb, "VERSION:2.0");
    line(sb, "PRODID:" + PRODID);
    line(sb, "CALSCALE:GREGORIAN");
    line(sb, "X-WR-CALNAME:" + escape(calendar.name()));
    calendar.description().ifPresent(d -> line(sb, "X-WR-CALDESC:" + escape(d)));
    calendar.zone().ifPresent(z -> line(sb, "X-WR-TIMEZONE:" + z.getId()));
    for (Event event : calendar.events()) {
      writeEvent(sb, event, stamp);
    }
    line(sb, "END:VCALENDAR");
    log.debug("Wrote {} event(s) of calendar '{}'", calendar.eventCount(), calendar.name());
    return sb.toString();
  }

  /**
   * Renders a calendar to a file, UTF-8 encoded.
   *
   * @param calendar the calendar
   * @param path the target file
   * @throws TidelineException if the file cannot be written
   */
  public static void write(Calendar calendar, Path path) throws TidelineException {
    try {
      Files.writeString(path, write(calendar), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw TidelineException.codec("Failed to write ICS file " + path, e);
    }
  }

  private static void writeEvent(StringBuilder sb, Event event, ZonedDateTime stamp) {
    line(sb, "BEGIN:VEVENT");
    String uid = event.uid() != null ? event.uid() : UUID.randomUUID() + "@tideline";
    line(sb, "UID:" + escape(uid));
    line(sb, "DTSTAMP:" + IcsTime.formatUtc(stamp));
    line(sb, "SUMMARY:" + escape(event.title()));
    if (event.description() != null) {
      line(sb, "DESCRIPTION:" + escape(event.description()));
    }
    if (event.location() != null) {
      line(sb, "LOCATION:" + escape(event.location()));
    }
    line(sb, dateTime("DTSTART", event.start(), event.zone()));
    line(sb, dateTime("DTEND", event.end(), event.zone()));

    EventStatus status = event.status();
    if (status == EventStatus.BLOCKED) {
      line(sb, "STATUS:CONFIRMED");
      line(sb, X_STATUS + ":BLOCKED");
    } else {
      line(sb, "STATUS:" + status.name());
    }

    for (String attendee : event.attendees()) {
      line(sb, "ATTENDEE:mailto:" + attendee);
    }
    if (event.recurrence() != null) {
      line(sb, "RRULE:" + RRuleFormat.format(event.recurrence()));
    }
    if (event.filter() != null && event.filter().skipWeekends()) {
      line(sb, X_SKIP_WEEKENDS + ":TRUE");
    }
    for (LocalDate date : event.exceptionDates()) {
      ZonedDateTime excluded =
          ZonedClock.resolveLenient(date.atTime(event.start().toLocalTime()), event.zone());
      line(sb, dateTime("EXDATE", excluded, event.zone()));
    }
    line(sb, "END:VEVENT");
  }

  private static String dateTime(String name, ZonedDateTime instant, ZoneId zone) {
    if (ZonedClock.isUtc(zone)) {
      return name + ":" + IcsTime.formatUtc(instant);
    }
    return name
        + ";TZID="
        + zone.getId()
        + ":"
        + IcsTime.formatLocal(instant.withZoneSameInstant(zone).toLocalDateTime());
  }

  /**
   * Escapes a TEXT value.
   *
   * @param text the raw text
   * @return the escaped text
   */
  static String escape(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case ';' -> sb.append("\\;");
        case ',' -> sb.append("\\,");
        case '\n' -> sb.append("\\n");
        case '\r' -> {}
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  private static void line(StringBuilder sb, String content) {
    sb.append(fold(content)).append(CRLF);
  }

  /**
   * Folds a content line so no physical line exceeds 75 octets. Continuation lines start with a
   * space; code points are never split.
   *
   * @param content the unfolded line
   * @return the folded line without the final CRLF
   */
  static String fold(String content) {
    StringBuilder out = new StringBuilder(content.length() + 8);
    int octets = 0;
    for (int i = 0; i < content.length(); ) {
      int cp = content.codePointAt(i);
      int len = utf8Length(cp);
      if (octets + len > MAX_LINE_OCTETS) {
        out.append(CRLF).append(' ');
        octets = 1;
      }
      out.appendCodePoint(cp);
      octets += len;
      i += Character.charCount(cp);
    }
    return out.toString();
  }

  private static int utf8Length(int cp) {
    if (cp < 0x80) {
      return 1;
    } else if (cp < 0x800) {
      return 2;
    } else if (cp < 0x10000) {
      return 3;
    }
    return 4;
  }
}
