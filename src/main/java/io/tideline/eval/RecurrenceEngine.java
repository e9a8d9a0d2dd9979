package io.tideline.eval;

import io.tideline.TidelineException;
import io.tideline.model.Frequency;
import io.tideline.model.RecurrenceRule;
import io.tideline.zone.ZonedClock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates the occurrence instants of a recurrence rule.
 *
 * <h2>Bounds</h2>
 *
 * <p>Every call takes an explicit cap. The result holds at most {@code min(count, cap)}
 * occurrences for a count-bounded rule and at most {@code cap} otherwise; an until-bounded rule
 * additionally stops at the first occurrence after {@code until} (an occurrence equal to {@code
 * until} is kept).
 *
 * <h2>Civil-time stepping</h2>
 *
 * <p>The k-th occurrence is computed from the anchor's civil date-time, not from the previous
 * occurrence, so the wall-clock time of day never drifts:
 *
 * <ul>
 *   <li>Daily: {@code anchor + k * interval} days
 *   <li>Weekly: {@code anchor + k * interval} weeks
 *   <li>Monthly: {@code anchor + k * interval} months, same day of month
 *   <li>Yearly: {@code anchor + k * interval} years, same month and day
 * </ul>
 *
 * <p>Across a DST transition the elapsed absolute time between two daily occurrences is therefore
 * 23 or 25 hours. When a monthly or yearly step lands on a day the target month lacks (the 31st in
 * April, Feb 29 in a non-leap year) generation stops there; no day is clamped or skipped.
 *
 * <h2>DST resolution</h2>
 *
 * <ol>
 *   <li><b>DST Gap (Spring Forward):</b> the civil time is pushed forward past the gap.
 *   <li><b>DST Fold (Fall Back):</b> the first (pre-transition) instant is used.
 * </ol>
 */
public final class RecurrenceEngine {
  private static final Logger log = LoggerFactory.getLogger(RecurrenceEngine.class);

  /** Initial capacity limit for result lists; large caps grow the list on demand. */
  private static final int INITIAL_CAPACITY = 64;

  private RecurrenceEngine() {}

  /**
   * Generates occurrences of a rule starting at an anchor.
   *
   * @param rule the recurrence rule
   * @param anchor the first occurrence; its zone drives civil stepping
   * @param cap the maximum number of occurrences to generate
   * @return strictly increasing occurrence instants, beginning with {@code anchor}
   * @throws TidelineException if the rule is malformed or its frequency is unsupported
   * @throws IllegalArgumentException if {@code cap} is negative
   */
  public static List<ZonedDateTime> generate(RecurrenceRule rule, ZonedDateTime anchor, int cap)
      throws TidelineException {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(anchor, "anchor");
    if (cap < 0) {
      throw new IllegalArgumentException("cap must not be negative: " + cap);
    }
    rule.validate();

    int limit = rule.count() > 0 ? Math.min(rule.count(), cap) : cap;
    ZonedDateTime until = rule.until();
    LocalDateTime anchorLocal = anchor.toLocalDateTime();
    ZoneId zone = anchor.getZone();

    List<ZonedDateTime> results = new ArrayList<>(Math.min(limit, INITIAL_CAPACITY));
    ZonedDateTime current = anchor;
    for (int k = 0; k < limit; k++) {
      if (k > 0) {
        Optional<LocalDateTime> next =
            step(rule.frequency(), anchorLocal, (long) k * rule.interval());
        if (next.isEmpty()) {
          log.warn(
              "Stopping {} recurrence anchored at {} after {} occurrence(s): no matching calendar"
                  + " date",
              rule.frequency(),
              anchor,
              results.size());
          break;
        }
        current = ZonedClock.resolveLenient(next.get(), zone);
      }
      if (until != null && current.isAfter(until)) {
        break;
      }
      results.add(current);
    }

    log.debug(
        "Generated {} occurrence(s) for {} rule (interval {}, cap {}) from {}",
        results.size(),
        rule.frequency(),
        rule.interval(),
        cap,
        anchor);
    return results;
  }

  /**
   * Computes the civil date-time {@code units} frequency units after the anchor.
   *
   * @return the civil date-time, or empty if the target month or year lacks the anchor's day
   */
  private static Optional<LocalDateTime> step(
      Frequency frequency, LocalDateTime anchor, long units) {
    try {
      return switch (frequency) {
        case DAILY -> Optional.of(anchor.plusDays(units));
        case WEEKLY -> Optional.of(anchor.plusWeeks(units));
        case MONTHLY -> {
          YearMonth target = YearMonth.from(anchor).plusMonths(units);
          int day = anchor.getDayOfMonth();
          if (!target.isValidDay(day)) {
            yield Optional.empty();
          }
          yield Optional.of(LocalDateTime.of(target.atDay(day), anchor.toLocalTime()));
        }
        case YEARLY -> {
          int year = Math.toIntExact(anchor.getYear() + units);
          MonthDay monthDay = MonthDay.from(anchor);
          if (!monthDay.isValidYear(year)) {
            yield Optional.empty();
          }
          yield Optional.of(LocalDateTime.of(monthDay.atYear(year), anchor.toLocalTime()));
        }
        default -> throw new IllegalStateException("Unsupported frequency " + frequency);
      };
    } catch (DateTimeException | ArithmeticException e) {
      // stepping beyond the supported date range ends the sequence
      log.debug("Recurrence left the supported date range at +{} {}", units, frequency, e);
      return Optional.empty();
    }
  }
}
