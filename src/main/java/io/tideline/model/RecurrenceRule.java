package io.tideline.model;

import io.tideline.TidelineException;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * A recurrence rule: a frequency, a step interval and an optional terminator.
 *
 * <p>Example:
 *
 * <pre>{@code
 * RecurrenceRule biweekly = RecurrenceRule.weekly().withInterval(2).withCount(10);
 * }</pre>
 *
 * @param frequency the step unit
 * @param interval the number of units between occurrences (at least 1)
 * @param terminator the count or until bound, {@link Terminator#none()} when unbounded
 * @param weekdays weekdays kept for export as {@code BYDAY}; generation does not consult them
 */
public record RecurrenceRule(
    Frequency frequency, int interval, Terminator terminator, List<Weekday> weekdays) {
  /** Creates a new RecurrenceRule with defensive copy of the weekday list. */
  public RecurrenceRule {
    Objects.requireNonNull(frequency, "frequency");
    terminator = terminator == null ? Terminator.none() : terminator;
    weekdays = weekdays == null ? List.of() : List.copyOf(weekdays);
  }

  /**
   * Creates an unbounded rule with interval 1.
   *
   * @param frequency the frequency
   * @return a new rule
   */
  public static RecurrenceRule of(Frequency frequency) {
    return new RecurrenceRule(frequency, 1, Terminator.none(), List.of());
  }

  /**
   * Creates an unbounded daily rule.
   *
   * @return a new daily rule
   */
  public static RecurrenceRule daily() {
    return of(Frequency.DAILY);
  }

  /**
   * Creates an unbounded weekly rule.
   *
   * @return a new weekly rule
   */
  public static RecurrenceRule weekly() {
    return of(Frequency.WEEKLY);
  }

  /**
   * Creates an unbounded monthly rule.
   *
   * @return a new monthly rule
   */
  public static RecurrenceRule monthly() {
    return of(Frequency.MONTHLY);
  }

  /**
   * Creates an unbounded yearly rule.
   *
   * @return a new yearly rule
   */
  public static RecurrenceRule yearly() {
    return of(Frequency.YEARLY);
  }

  /**
   * Returns a copy with the specified interval.
   *
   * @param interval the interval
   * @return a new rule with the updated interval
   */
  public RecurrenceRule withInterval(int interval) {
    return new RecurrenceRule(frequency, interval, terminator, weekdays);
  }

  /**
   * Returns a copy bounded to a number of occurrences.
   *
   * @param count the number of occurrences
   * @return a new rule with a COUNT terminator
   */
  public RecurrenceRule withCount(int count) {
    return new RecurrenceRule(frequency, interval, Terminator.count(count), weekdays);
  }

  /**
   * Returns a copy bounded by an inclusive end instant.
   *
   * @param until the last instant an occurrence may have
   * @return a new rule with an UNTIL terminator
   */
  public RecurrenceRule withUntil(ZonedDateTime until) {
    return new RecurrenceRule(frequency, interval, Terminator.until(until), weekdays);
  }

  /**
   * Returns a copy with the specified export weekdays.
   *
   * @param weekdays the weekdays
   * @return a new rule with the updated weekdays
   */
  public RecurrenceRule withWeekdays(List<Weekday> weekdays) {
    return new RecurrenceRule(frequency, interval, terminator, weekdays);
  }

  /**
   * Returns the count limit, or 0 when the rule is not count-bounded.
   *
   * @return the count
   */
  public int count() {
    return terminator.kind() == Terminator.Kind.COUNT ? terminator.count() : 0;
  }

  /**
   * Returns the until bound, or null when the rule is not until-bounded.
   *
   * @return the until instant
   */
  public ZonedDateTime until() {
    return terminator.kind() == Terminator.Kind.UNTIL ? terminator.until() : null;
  }

  /**
   * Checks that the rule can be generated.
   *
   * @throws TidelineException if the frequency is unsupported or a bound is malformed
   */
  public void validate() throws TidelineException {
    if (!frequency.isSupported()) {
      throw TidelineException.recurrence(
          "Unsupported frequency " + frequency + "; expected DAILY, WEEKLY, MONTHLY or YEARLY");
    }
    if (interval < 1) {
      throw TidelineException.recurrence("Interval must be at least 1, got " + interval);
    }
    switch (terminator.kind()) {
      case COUNT -> {
        if (terminator.count() < 1) {
          throw TidelineException.recurrence(
              "Count must be at least 1, got " + terminator.count());
        }
      }
      case UNTIL -> {
        if (terminator.until() == null) {
          throw TidelineException.recurrence("Until terminator requires an instant");
        }
      }
      case NONE -> {}
    }
  }
}
