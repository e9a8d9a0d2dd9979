package io.tideline.model;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Post-filter over generated occurrences: weekend skipping and explicit skip dates.
 *
 * <p>Skip dates match on civil date only. The civil date of a skip instant is taken in the skip
 * instant's own zone and compared with the civil date of the occurrence in the occurrence's zone;
 * the time of day is ignored.
 *
 * @param skipWeekends whether Saturday and Sunday occurrences are removed
 * @param skipDates instants whose civil dates are removed
 */
public record RecurrenceFilter(boolean skipWeekends, List<ZonedDateTime> skipDates) {
  /** Creates a new RecurrenceFilter with defensive copy of the skip dates. */
  public RecurrenceFilter {
    skipDates = skipDates == null ? List.of() : List.copyOf(skipDates);
  }

  /**
   * Returns a filter that skips nothing.
   *
   * @return an empty filter
   */
  public static RecurrenceFilter none() {
    return new RecurrenceFilter(false, List.of());
  }

  /**
   * Returns a copy with weekend skipping switched on or off.
   *
   * @param skip whether to skip weekends
   * @return a new filter
   */
  public RecurrenceFilter withSkipWeekends(boolean skip) {
    return new RecurrenceFilter(skip, skipDates);
  }

  /**
   * Returns a copy with additional skip dates appended.
   *
   * @param dates the dates to skip
   * @return a new filter
   */
  public RecurrenceFilter withSkipDates(List<ZonedDateTime> dates) {
    List<ZonedDateTime> merged = new ArrayList<>(skipDates);
    merged.addAll(dates);
    return new RecurrenceFilter(skipWeekends, merged);
  }

  /**
   * Checks if an occurrence should be removed.
   *
   * @param occurrence the occurrence instant
   * @return true if it falls on a skipped weekend or a skipped civil date
   */
  public boolean shouldSkip(ZonedDateTime occurrence) {
    if (skipWeekends && Weekday.fromDayOfWeek(occurrence.getDayOfWeek()).isWeekend()) {
      return true;
    }
    LocalDate date = occurrence.toLocalDate();
    for (ZonedDateTime skip : skipDates) {
      if (skip.toLocalDate().equals(date)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes skipped occurrences, keeping the relative order of the rest.
   *
   * @param occurrences the occurrences
   * @return the retained occurrences
   */
  public List<ZonedDateTime> filter(List<ZonedDateTime> occurrences) {
    List<ZonedDateTime> kept = new ArrayList<>(occurrences.size());
    for (ZonedDateTime t : occurrences) {
      if (!shouldSkip(t)) {
        kept.add(t);
      }
    }
    return kept;
  }
}
