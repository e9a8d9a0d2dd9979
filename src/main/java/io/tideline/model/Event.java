package io.tideline.model;

import io.tideline.TidelineException;
import io.tideline.eval.OccurrenceExpander;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A titled time interval in a zone, optionally recurring.
 *
 * <p>Events are created through {@link EventDraft#build()} or {@link #of}. The invariant {@code
 * end > start} holds from construction on; {@link #reschedule} is the only way to move an event
 * and checks it again. Status transitions always succeed.
 *
 * <pre>{@code
 * Event standup =
 *     EventDraft.titled("Standup")
 *         .withStart("2025-11-03 09:00:00", "Europe/Berlin")
 *         .withDurationMinutes(15)
 *         .withRecurrence(RecurrenceRule.daily().withCount(10))
 *         .withSkipWeekends(true)
 *         .build();
 * }</pre>
 */
public final class Event {
  private final String title;
  private final String description;
  private final ZoneId zone;
  private final List<String> attendees;
  private final RecurrenceRule recurrence;
  private final RecurrenceFilter filter;
  private final Set<LocalDate> exceptionDates;
  private final String location;
  private final String uid;

  private ZonedDateTime start;
  private ZonedDateTime end;
  private EventStatus status;

  Event(
      String title,
      String description,
      ZonedDateTime start,
      ZonedDateTime end,
      ZoneId zone,
      List<String> attendees,
      RecurrenceRule recurrence,
      RecurrenceFilter filter,
      Set<LocalDate> exceptionDates,
      String location,
      String uid,
      EventStatus status) {
    this.title = title;
    this.description = description;
    this.start = start;
    this.end = end;
    this.zone = zone;
    this.attendees = List.copyOf(attendees);
    this.recurrence = recurrence;
    this.filter = filter;
    this.exceptionDates = Collections.unmodifiableSet(new LinkedHashSet<>(exceptionDates));
    this.location = location;
    this.uid = uid;
    this.status = status;
  }

  /**
   * Creates a plain confirmed event in the start instant's zone.
   *
   * @param title the title
   * @param start the start instant
   * @param end the end instant
   * @return the event
   * @throws TidelineException if the title is blank or {@code end <= start}
   */
  public static Event of(String title, ZonedDateTime start, ZonedDateTime end)
      throws TidelineException {
    return EventDraft.titled(title).withStart(start).withEnd(end).build();
  }

  /**
   * Returns the title.
   *
   * @return the title
   */
  public String title() {
    return title;
  }

  /**
   * Returns the description.
   *
   * @return the description, or null
   */
  public String description() {
    return description;
  }

  /**
   * Returns the start instant, rendered in the event's zone.
   *
   * @return the start
   */
  public ZonedDateTime start() {
    return start;
  }

  /**
   * Returns the end instant, rendered in the event's zone.
   *
   * @return the end
   */
  public ZonedDateTime end() {
    return end;
  }

  /**
   * Returns the zone owning this event's civil times.
   *
   * @return the zone
   */
  public ZoneId zone() {
    return zone;
  }

  /**
   * Returns the attendees in insertion order.
   *
   * @return an unmodifiable list of attendees
   */
  public List<String> attendees() {
    return attendees;
  }

  /**
   * Returns the recurrence rule.
   *
   * @return the rule, or null for a one-off event
   */
  public RecurrenceRule recurrence() {
    return recurrence;
  }

  /**
   * Returns the recurrence filter.
   *
   * @return the filter, or null
   */
  public RecurrenceFilter filter() {
    return filter;
  }

  /**
   * Returns the civil dates excluded from the recurrence.
   *
   * @return an unmodifiable, insertion-ordered set of dates
   */
  public Set<LocalDate> exceptionDates() {
    return exceptionDates;
  }

  /**
   * Returns the location.
   *
   * @return the location, or null
   */
  public String location() {
    return location;
  }

  /**
   * Returns the unique identifier.
   *
   * @return the uid, or null
   */
  public String uid() {
    return uid;
  }

  /**
   * Returns the lifecycle status.
   *
   * @return the status
   */
  public EventStatus status() {
    return status;
  }

  /**
   * Returns whether this event recurs.
   *
   * @return true if a recurrence rule is set
   */
  public boolean isRecurring() {
    return recurrence != null;
  }

  /**
   * Returns the length of one occurrence.
   *
   * @return {@code end - start}, always positive
   */
  public Duration duration() {
    return Duration.between(start, end);
  }

  /**
   * Returns whether the event occupies time.
   *
   * @return false only when the event is cancelled
   */
  public boolean isActive() {
    return status.occupiesTime();
  }

  /** Marks the event confirmed. */
  public void confirm() {
    status = EventStatus.CONFIRMED;
  }

  /** Marks the event cancelled. */
  public void cancel() {
    status = EventStatus.CANCELLED;
  }

  /** Marks the event tentative. */
  public void tentative() {
    status = EventStatus.TENTATIVE;
  }

  /** Marks the event as a blocked slot. */
  public void block() {
    status = EventStatus.BLOCKED;
  }

  /**
   * Moves the event. A cancelled event becomes confirmed again.
   *
   * @param newStart the new start instant
   * @param newEnd the new end instant
   * @throws TidelineException if {@code newEnd <= newStart}
   */
  public void reschedule(ZonedDateTime newStart, ZonedDateTime newEnd) throws TidelineException {
    Objects.requireNonNull(newStart, "newStart");
    Objects.requireNonNull(newEnd, "newEnd");
    if (!newEnd.isAfter(newStart)) {
      throw TidelineException.validation("Event end time must be after start time");
    }
    start = newStart.withZoneSameInstant(zone);
    end = newEnd.withZoneSameInstant(zone);
    if (status == EventStatus.CANCELLED) {
      status = EventStatus.CONFIRMED;
    }
  }

  /**
   * Returns the occurrence start instants of this event within an inclusive window.
   *
   * @param windowStart the window start (inclusive)
   * @param windowEnd the window end (inclusive)
   * @param maxOccurrences the generation cap for recurring events
   * @return the occurrence starts in chronological order
   * @throws TidelineException if the recurrence rule cannot be generated
   */
  public List<ZonedDateTime> occurrencesBetween(
      ZonedDateTime windowStart, ZonedDateTime windowEnd, int maxOccurrences)
      throws TidelineException {
    return OccurrenceExpander.expand(this, windowStart, windowEnd, maxOccurrences);
  }

  /**
   * Checks whether an occurrence starts on the given civil date in this event's zone.
   *
   * @param date the civil date
   * @return true if some occurrence starts that day
   * @throws TidelineException if the day window or the recurrence cannot be resolved
   */
  public boolean occursOn(LocalDate date) throws TidelineException {
    return OccurrenceExpander.occursOn(this, date);
  }

  @Override
  public String toString() {
    return "Event{"
        + "title='"
        + title
        + "', start="
        + start
        + ", end="
        + end
        + ", status="
        + status
        + (recurrence != null ? ", recurrence=" + recurrence : "")
        + '}';
  }
}
