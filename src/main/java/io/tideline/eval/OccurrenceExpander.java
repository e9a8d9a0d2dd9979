package io.tideline.eval;

import io.tideline.TidelineException;
import io.tideline.model.Event;
import io.tideline.zone.ZonedClock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Expands a single event into occurrence start instants over an inclusive window.
 *
 * <ol>
 *   <li>A one-off event contributes its own start iff it lies inside the window.
 *   <li>A recurring event is generated with the caller's cap, restricted to the window, passed
 *       through its recurrence filter, and stripped of occurrences whose civil date is one of the
 *       event's exception dates.
 * </ol>
 */
public final class OccurrenceExpander {
  /** Per-event generation cap used by calendar queries. */
  public static final int DEFAULT_MAX_OCCURRENCES = 1000;

  private OccurrenceExpander() {}

  /**
   * Expands an event over {@code [windowStart, windowEnd]}.
   *
   * @param event the event
   * @param windowStart the window start (inclusive)
   * @param windowEnd the window end (inclusive)
   * @param maxOccurrences the generation cap for recurring events
   * @return the occurrence starts in chronological order
   * @throws TidelineException if the event's recurrence rule cannot be generated
   */
  public static List<ZonedDateTime> expand(
      Event event, ZonedDateTime windowStart, ZonedDateTime windowEnd, int maxOccurrences)
      throws TidelineException {
    if (!event.isRecurring()) {
      ZonedDateTime start = event.start();
      return inWindow(start, windowStart, windowEnd) ? List.of(start) : List.of();
    }

    List<ZonedDateTime> generated =
        RecurrenceEngine.generate(event.recurrence(), event.start(), maxOccurrences);

    List<ZonedDateTime> occurrences = new ArrayList<>();
    for (ZonedDateTime t : generated) {
      if (inWindow(t, windowStart, windowEnd)) {
        occurrences.add(t);
      }
    }

    if (event.filter() != null) {
      occurrences = event.filter().filter(occurrences);
    }

    Set<LocalDate> exceptions = event.exceptionDates();
    if (!exceptions.isEmpty()) {
      occurrences.removeIf(t -> exceptions.contains(t.toLocalDate()));
    }
    return occurrences;
  }

  /**
   * Checks whether an event has an occurrence starting on a civil date, in the event's zone.
   *
   * @param event the event
   * @param date the civil date
   * @return true if an occurrence starts within that day
   * @throws TidelineException if the day's end cannot be resolved or the rule cannot be generated
   */
  public static boolean occursOn(Event event, LocalDate date) throws TidelineException {
    ZonedDateTime dayStart = ZonedClock.startOfDay(date, event.zone());
    ZonedDateTime dayEnd = ZonedClock.endOfDay(date, event.zone());
    return !expand(event, dayStart, dayEnd, DEFAULT_MAX_OCCURRENCES).isEmpty();
  }

  private static boolean inWindow(ZonedDateTime t, ZonedDateTime start, ZonedDateTime end) {
    return !t.isBefore(start) && !t.isAfter(end);
  }
}
