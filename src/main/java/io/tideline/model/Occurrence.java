package io.tideline.model;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * One realization of a calendar event.
 *
 * <p>The event is referenced by its index in the calendar that produced the occurrence, never
 * directly; resolve it with {@code Calendar.event(eventIndex)}. Occurrences are query results and
 * become stale once the calendar's event list changes.
 *
 * @param eventIndex the index of the event in its calendar
 * @param start the occurrence start
 * @param duration the event's duration when the occurrence was computed
 */
public record Occurrence(int eventIndex, ZonedDateTime start, Duration duration) {

  /**
   * Returns the end of this occurrence.
   *
   * @return {@code start + duration}
   */
  public ZonedDateTime end() {
    return start.plus(duration);
  }
}
