package io.tideline.ics;

import io.tideline.Calendar;
import io.tideline.TidelineException;
import io.tideline.model.Event;
import io.tideline.model.EventDraft;
import io.tideline.model.EventStatus;
import io.tideline.zone.ZonedClock;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.Optional;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Parameter;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.TemporalAdapter;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads RFC 5545 text into a calendar.
 *
 * <p>The text is parsed by ical4j's {@link CalendarBuilder}; this class maps the resulting {@code
 * VEVENT}s onto events. Components other than {@code VEVENT} are skipped. A {@code VEVENT} that
 * cannot be turned into a valid event is logged and skipped; input ical4j cannot parse fails the
 * whole read.
 *
 * <p>Date-times carry their zone as a {@code TZID} parameter or a trailing {@code Z}; values with
 * neither are read as UTC. A DATE-valued {@code DTSTART} without an end lasts one day.
 */
public final class IcsReader {
  private static final Logger log = LoggerFactory.getLogger(IcsReader.class);

  /** Name given to a calendar without {@code X-WR-CALNAME}. */
  public static final String DEFAULT_CALENDAR_NAME = "Imported Calendar";

  private IcsReader() {}

  /**
   * Parses iCalendar text.
   *
   * @param text the iCalendar text
   * @return the calendar with every readable event
   * @throws TidelineException if the text is not a well-formed VCALENDAR
   */
  public static Calendar read(String text) throws TidelineException {
    if (text == null || text.isBlank()) {
      throw TidelineException.codec("Empty iCalendar input", null);
    }
    net.fortuna.ical4j.model.Calendar ical;
    try {
      ical = new CalendarBuilder().build(new StringReader(text));
    } catch (IOException | ParserException e) {
      throw TidelineException.codec("Malformed iCalendar input: " + e.getMessage(), e);
    }
    return toCalendar(ical);
  }

  /**
   * Parses an iCalendar file, UTF-8 encoded.
   *
   * @param path the file
   * @return the calendar with every readable event
   * @throws TidelineException if the file cannot be read or is not a well-formed VCALENDAR
   */
  public static Calendar read(Path path) throws TidelineException {
    String text;
    try {
      text = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw TidelineException.codec("Failed to read ICS file " + path, e);
    }
    return read(text);
  }

  private static Calendar toCalendar(net.fortuna.ical4j.model.Calendar ical)
      throws TidelineException {
    String name = xText(ical.getProperty("X-WR-CALNAME")).orElse(DEFAULT_CALENDAR_NAME);
    String description = xText(ical.getProperty("X-WR-CALDESC")).orElse(null);
    Optional<Property> tz = ical.getProperty("X-WR-TIMEZONE");
    ZoneId zone = tz.isPresent() ? ZonedClock.zone(tz.get().getValue().trim()) : null;

    Calendar calendar = new Calendar(name, description, zone);
    List<VEvent> vevents = ical.getComponents(Component.VEVENT);
    for (VEvent vevent : vevents) {
      try {
        calendar.addEvent(toEvent(vevent));
      } catch (TidelineException e) {
        log.warn("Skipping VEVENT that cannot be read: {}", e.displayRich());
      }
    }
    log.debug(
        "Read calendar '{}' with {} of {} event(s)", name, calendar.eventCount(), vevents.size());
    return calendar;
  }

  private static Event toEvent(VEvent vevent) throws TidelineException {
    Optional<Property> summary = vevent.getProperty(Property.SUMMARY);
    if (summary.isEmpty()) {
      throw TidelineException.codec("Event missing SUMMARY", null);
    }
    Optional<DateProperty<Temporal>> dtstart = vevent.getProperty(Property.DTSTART);
    if (dtstart.isEmpty()) {
      throw TidelineException.codec("Event missing DTSTART", null);
    }

    ZoneId zone = zoneOf(dtstart.get(), IcsTime.DEFAULT_ZONE);
    Temporal startValue = dtstart.get().getDate();
    ZonedDateTime start = IcsTime.toZoned(startValue, zone);
    EventDraft draft = EventDraft.titled(summary.get().getValue()).withStart(start);

    Optional<DateProperty<Temporal>> dtend = vevent.getProperty(Property.DTEND);
    Optional<net.fortuna.ical4j.model.property.Duration> duration =
        vevent.getProperty(Property.DURATION);
    if (dtend.isPresent()) {
      DateProperty<Temporal> end = dtend.get();
      draft = draft.withEnd(IcsTime.toZoned(end.getDate(), zoneOf(end, IcsTime.DEFAULT_ZONE)));
    } else if (duration.isPresent()) {
      draft = draft.withEnd(start.plus(duration.get().getDuration()));
    } else if (startValue instanceof LocalDate date) {
      draft = draft.withEnd(ZonedClock.startOfDay(date.plusDays(1), zone));
    }

    draft = draft.withDescription(text(vevent, Property.DESCRIPTION));
    draft = draft.withLocation(text(vevent, Property.LOCATION));
    draft = draft.withUid(text(vevent, Property.UID));
    List<Property> attendees = vevent.getProperties(Property.ATTENDEE);
    for (Property attendee : attendees) {
      draft = draft.withAttendee(stripMailto(attendee.getValue()));
    }

    Optional<Property> rrule = vevent.getProperty(Property.RRULE);
    if (rrule.isPresent()) {
      draft = draft.withRecurrence(RRuleFormat.parse(rrule.get().getValue(), zone));
    }
    List<Property> exdates = vevent.getProperties(Property.EXDATE);
    for (Property exdate : exdates) {
      ZoneId exZone = zoneOf(exdate, zone);
      for (String value : exdate.getValue().split(",")) {
        Temporal excluded = exceptionDate(value);
        draft =
            draft.withExceptionDate(
                IcsTime.toZoned(excluded, exZone).withZoneSameInstant(zone).toLocalDate());
      }
    }

    Optional<Property> custom = vevent.getProperty(IcsWriter.X_STATUS);
    Optional<Property> status = custom.isPresent() ? custom : vevent.getProperty(Property.STATUS);
    if (status.isPresent()) {
      draft = draft.withStatus(parseStatus(status.get().getValue()));
    }
    Optional<Property> skipWeekends = vevent.getProperty(IcsWriter.X_SKIP_WEEKENDS);
    if (skipWeekends.isPresent()) {
      draft = draft.withSkipWeekends(Boolean.parseBoolean(skipWeekends.get().getValue().trim()));
    }
    return draft.build();
  }

  private static Temporal exceptionDate(String value) throws TidelineException {
    try {
      return TemporalAdapter.parse(value.trim()).getTemporal();
    } catch (RuntimeException e) {
      throw TidelineException.timeParse("Invalid EXDATE value '" + value + "'", value);
    }
  }

  private static ZoneId zoneOf(Property property, ZoneId fallback) throws TidelineException {
    Optional<Parameter> tzid = property.getParameter(Parameter.TZID);
    return tzid.isPresent() ? ZonedClock.zone(tzid.get().getValue()) : fallback;
  }

  private static String text(VEvent vevent, String name) {
    Optional<Property> property = vevent.getProperty(name);
    return property.map(Property::getValue).orElse(null);
  }

  /** X- properties are not TEXT to ical4j, so their escapes are still in place. */
  private static Optional<String> xText(Optional<Property> property) {
    return property.map(p -> Strings.unescape(p.getValue()));
  }

  private static EventStatus parseStatus(String value) throws TidelineException {
    return EventStatus.parse(value)
        .orElseThrow(() -> TidelineException.codec("Unknown STATUS '" + value + "'", null));
  }

  private static String stripMailto(String value) {
    String v = value.trim();
    return v.regionMatches(true, 0, "mailto:", 0, 7) ? v.substring(7) : v;
  }
}
