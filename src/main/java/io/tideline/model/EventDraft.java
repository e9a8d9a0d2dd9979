package io.tideline.model;

import io.tideline.TidelineException;
import io.tideline.zone.Disambiguation;
import io.tideline.zone.ZonedClock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * The unvalidated inputs of an {@link Event}.
 *
 * <p>A draft keeps every value exactly as given, including civil date-time text and zone names
 * that have not been resolved yet. Nothing is checked until {@link #build()}, which resolves and
 * validates all fields together and either returns an event or throws; an invalid zone or date
 * string is reported there instead of being dropped.
 *
 * <p>The start is given either as civil text plus a zone name, or as an instant. The end is given
 * as civil text (in the start's zone), as an instant, or as a duration from the start; the last
 * one set wins.
 *
 * @param title the title (required)
 * @param description the description (may be null)
 * @param startText the civil start text (may be null)
 * @param zone the zone name (may be null; defaults to the start instant's zone)
 * @param start the start instant (may be null)
 * @param endText the civil end text (may be null)
 * @param end the end instant (may be null)
 * @param duration the duration from the start (may be null)
 * @param attendees the attendees
 * @param recurrence the recurrence rule (may be null)
 * @param filter the recurrence filter (may be null)
 * @param exceptionDates civil dates excluded from the recurrence
 * @param location the location (may be null)
 * @param uid the unique identifier (may be null)
 * @param status the status (null means confirmed)
 */
public record EventDraft(
    String title,
    String description,
    String startText,
    String zone,
    ZonedDateTime start,
    String endText,
    ZonedDateTime end,
    Duration duration,
    List<String> attendees,
    RecurrenceRule recurrence,
    RecurrenceFilter filter,
    List<LocalDate> exceptionDates,
    String location,
    String uid,
    EventStatus status) {
  /** Creates a new EventDraft with defensive copies of lists. */
  public EventDraft {
    attendees = attendees == null ? List.of() : List.copyOf(attendees);
    exceptionDates = exceptionDates == null ? List.of() : List.copyOf(exceptionDates);
  }

  /**
   * Creates an empty draft.
   *
   * @return a draft with no fields set
   */
  public static EventDraft empty() {
    return new EventDraft(
        null, null, null, null, null, null, null, null, List.of(), null, null, List.of(), null,
        null, null);
  }

  /**
   * Creates a draft with only a title.
   *
   * @param title the title
   * @return a new draft
   */
  public static EventDraft titled(String title) {
    return empty().withTitle(title);
  }

  /**
   * Returns a copy with the specified title.
   *
   * @param title the title
   * @return a new draft with the updated title
   */
  public EventDraft withTitle(String title) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with the specified description.
   *
   * @param description the description
   * @return a new draft with the updated description
   */
  public EventDraft withDescription(String description) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy starting at a civil time in a named zone.
   *
   * @param civil the civil start, {@code YYYY-MM-DD HH:MM:SS} or {@code YYYY-MM-DDTHH:MM:SS}
   * @param zoneName the IANA zone name
   * @return a new draft with the updated start
   */
  public EventDraft withStart(String civil, String zoneName) {
    return new EventDraft(
        title, description, civil, zoneName, null, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy starting at an instant; the event's zone becomes the instant's zone.
   *
   * @param start the start instant
   * @return a new draft with the updated start
   */
  public EventDraft withStart(ZonedDateTime start) {
    return new EventDraft(
        title, description, null, null, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with an explicit zone, overriding the start instant's zone.
   *
   * @param zoneName the IANA zone name
   * @return a new draft with the updated zone
   */
  public EventDraft withZone(String zoneName) {
    return new EventDraft(
        title, description, startText, zoneName, start, endText, end, duration, attendees,
        recurrence, filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy ending at a civil time in the event's zone.
   *
   * @param civil the civil end
   * @return a new draft with the updated end
   */
  public EventDraft withEnd(String civil) {
    return new EventDraft(
        title, description, startText, zone, start, civil, null, null, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy ending at an instant.
   *
   * @param end the end instant
   * @return a new draft with the updated end
   */
  public EventDraft withEnd(ZonedDateTime end) {
    return new EventDraft(
        title, description, startText, zone, start, null, end, null, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy ending a fixed amount of absolute time after the start.
   *
   * @param duration the duration
   * @return a new draft with the updated end
   */
  public EventDraft withDuration(Duration duration) {
    return new EventDraft(
        title, description, startText, zone, start, null, null, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy lasting the given number of hours.
   *
   * @param hours the duration in hours
   * @return a new draft with the updated end
   */
  public EventDraft withDurationHours(long hours) {
    return withDuration(Duration.ofHours(hours));
  }

  /**
   * Returns a copy lasting the given number of minutes.
   *
   * @param minutes the duration in minutes
   * @return a new draft with the updated end
   */
  public EventDraft withDurationMinutes(long minutes) {
    return withDuration(Duration.ofMinutes(minutes));
  }

  /**
   * Returns a copy with one more attendee.
   *
   * @param attendee the attendee
   * @return a new draft with the attendee appended
   */
  public EventDraft withAttendee(String attendee) {
    List<String> updated = new ArrayList<>(attendees);
    updated.add(attendee);
    return withAttendees(updated);
  }

  /**
   * Returns a copy with the specified attendees.
   *
   * @param attendees the attendees
   * @return a new draft with the updated attendees
   */
  public EventDraft withAttendees(List<String> attendees) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with the specified recurrence rule.
   *
   * @param recurrence the rule
   * @return a new draft with the updated recurrence
   */
  public EventDraft withRecurrence(RecurrenceRule recurrence) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with the specified recurrence filter.
   *
   * @param filter the filter
   * @return a new draft with the updated filter
   */
  public EventDraft withFilter(RecurrenceFilter filter) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy whose filter skips or keeps weekend occurrences.
   *
   * @param skip whether to skip Saturdays and Sundays
   * @return a new draft with the updated filter
   */
  public EventDraft withSkipWeekends(boolean skip) {
    RecurrenceFilter base = filter == null ? RecurrenceFilter.none() : filter;
    return withFilter(base.withSkipWeekends(skip));
  }

  /**
   * Returns a copy with the specified exception dates.
   *
   * @param dates the civil dates to exclude
   * @return a new draft with the updated exception dates
   */
  public EventDraft withExceptionDates(List<LocalDate> dates) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, dates, location, uid, status);
  }

  /**
   * Returns a copy with one more exception date.
   *
   * @param date the civil date to exclude
   * @return a new draft with the date appended
   */
  public EventDraft withExceptionDate(LocalDate date) {
    List<LocalDate> updated = new ArrayList<>(exceptionDates);
    updated.add(date);
    return withExceptionDates(updated);
  }

  /**
   * Returns a copy excluding the civil date of an instant, taken in the instant's own zone.
   *
   * @param instant the instant whose civil date is excluded
   * @return a new draft with the date appended
   */
  public EventDraft withExceptionDate(ZonedDateTime instant) {
    return withExceptionDate(instant.toLocalDate());
  }

  /**
   * Returns a copy with the specified location.
   *
   * @param location the location
   * @return a new draft with the updated location
   */
  public EventDraft withLocation(String location) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with the specified unique identifier.
   *
   * @param uid the uid
   * @return a new draft with the updated uid
   */
  public EventDraft withUid(String uid) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Returns a copy with the specified status.
   *
   * @param status the status
   * @return a new draft with the updated status
   */
  public EventDraft withStatus(EventStatus status) {
    return new EventDraft(
        title, description, startText, zone, start, endText, end, duration, attendees, recurrence,
        filter, exceptionDates, location, uid, status);
  }

  /**
   * Resolves and validates every field and creates the event.
   *
   * @return the event
   * @throws TidelineException if a required field is missing, a zone or civil time cannot be
   *     resolved, {@code end <= start}, or the recurrence rule is malformed
   */
  public Event build() throws TidelineException {
    if (title == null || title.isBlank()) {
      throw TidelineException.validation("Event title is required");
    }

    ZoneId eventZone;
    ZonedDateTime resolvedStart;
    if (startText != null) {
      if (zone == null) {
        throw TidelineException.validation("Event time zone is required");
      }
      eventZone = ZonedClock.zone(zone);
      resolvedStart = ZonedClock.resolve(startText, eventZone, Disambiguation.EARLIEST);
    } else if (start != null) {
      eventZone = zone != null ? ZonedClock.zone(zone) : start.getZone();
      resolvedStart = start.withZoneSameInstant(eventZone);
    } else {
      throw TidelineException.validation("Event start time is required");
    }

    ZonedDateTime resolvedEnd;
    if (endText != null) {
      resolvedEnd = ZonedClock.resolve(endText, eventZone, Disambiguation.EARLIEST);
    } else if (end != null) {
      resolvedEnd = end.withZoneSameInstant(eventZone);
    } else if (duration != null) {
      resolvedEnd = resolvedStart.plus(duration);
    } else {
      throw TidelineException.validation("Event end time is required");
    }

    if (!resolvedEnd.isAfter(resolvedStart)) {
      throw TidelineException.validation("Event end time must be after start time");
    }

    if (recurrence != null) {
      recurrence.validate();
    }

    return new Event(
        title,
        description,
        resolvedStart,
        resolvedEnd,
        eventZone,
        attendees,
        recurrence,
        filter,
        new LinkedHashSet<>(exceptionDates),
        location,
        uid,
        status == null ? EventStatus.CONFIRMED : status);
  }
}
