package io.tideline.analysis;

import io.tideline.Calendar;
import io.tideline.TidelineException;
import io.tideline.model.DensityReport;
import io.tideline.model.Gap;
import io.tideline.model.Occurrence;
import io.tideline.model.Overlap;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes free time, conflicts and occupancy over a calendar window.
 *
 * <p>All methods read the calendar's current events and recompute the occurrence expansion on
 * every call. Only occurrences of active events are considered: a cancelled event frees its
 * slot.
 *
 * <h2>Gap sweep</h2>
 *
 * <p>Occurrences are visited in instant order while a frontier, initially the window start, is
 * pushed forward to the latest end seen so far. Whenever an occurrence starts after the frontier
 * the interval between them is free. The frontier never moves back, so overlapping occurrences
 * never produce a gap between them.
 *
 * <h2>Overlaps and density</h2>
 *
 * <p>Overlaps are reported pairwise: three mutually overlapping occurrences yield three records.
 * Busy time is the unmerged sum of every occurrence clipped to the window, so overlapping time is
 * counted once per occurrence.
 */
public final class ScheduleAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(ScheduleAnalyzer.class);

  /** Distance between successive candidate starts inside one free gap. */
  public static final Duration ALTERNATIVE_STEP = Duration.ofHours(1);

  /** How far before a slot to look for occurrences that still run into it. */
  static final Duration SLOT_LOOKBEHIND = Duration.ofDays(1);

  private ScheduleAnalyzer() {}

  /**
   * Finds the free intervals in {@code [start, end]} that last at least {@code minDuration}.
   *
   * @param calendar the calendar
   * @param start the window start
   * @param end the window end
   * @param minDuration the shortest gap to report
   * @return the gaps in chronological order
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static List<Gap> findGaps(
      Calendar calendar, ZonedDateTime start, ZonedDateTime end, Duration minDuration)
      throws TidelineException {
    Objects.requireNonNull(minDuration, "minDuration");
    List<Occurrence> occurrences = calendar.activeEventsBetween(start, end);

    List<Gap> gaps = new ArrayList<>();
    ZonedDateTime frontier = start;
    String lastTitle = null;
    for (Occurrence occurrence : occurrences) {
      String title = calendar.eventOf(occurrence).title();
      if (occurrence.start().isAfter(frontier)) {
        Gap gap = Gap.of(frontier, occurrence.start(), lastTitle, title);
        if (gap.isAtLeast(minDuration)) {
          gaps.add(gap);
        }
      }
      ZonedDateTime occurrenceEnd = occurrence.end();
      if (occurrenceEnd.isAfter(frontier)) {
        frontier = occurrenceEnd;
        lastTitle = title;
      }
    }
    if (end.isAfter(frontier)) {
      Gap trailing = Gap.of(frontier, end, lastTitle, null);
      if (trailing.isAtLeast(minDuration)) {
        gaps.add(trailing);
      }
    }

    log.debug(
        "Found {} gap(s) of at least {} among {} active occurrence(s)",
        gaps.size(),
        minDuration,
        occurrences.size());
    return gaps;
  }

  /**
   * Finds every pair of active occurrences in {@code [start, end]} whose intervals intersect.
   *
   * @param calendar the calendar
   * @param start the window start
   * @param end the window end
   * @return one overlap per intersecting pair, ordered by the pair's earlier occurrence
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static List<Overlap> findOverlaps(
      Calendar calendar, ZonedDateTime start, ZonedDateTime end) throws TidelineException {
    return overlapsOf(calendar, calendar.activeEventsBetween(start, end));
  }

  private static List<Overlap> overlapsOf(Calendar calendar, List<Occurrence> occurrences) {
    List<Overlap> overlaps = new ArrayList<>();
    for (int i = 0; i < occurrences.size(); i++) {
      Occurrence a = occurrences.get(i);
      for (int j = i + 1; j < occurrences.size(); j++) {
        Occurrence b = occurrences.get(j);
        if (a.start().isBefore(b.end()) && b.start().isBefore(a.end())) {
          ZonedDateTime from = a.start().isAfter(b.start()) ? a.start() : b.start();
          ZonedDateTime to = a.end().isBefore(b.end()) ? a.end() : b.end();
          overlaps.add(
              Overlap.of(
                  from,
                  to,
                  List.of(calendar.eventOf(a).title(), calendar.eventOf(b).title())));
        }
      }
    }
    return overlaps;
  }

  /**
   * Summarizes how much of {@code [start, end]} is taken by active occurrences.
   *
   * @param calendar the calendar
   * @param start the window start
   * @param end the window end
   * @return the density report
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static DensityReport calculateDensity(
      Calendar calendar, ZonedDateTime start, ZonedDateTime end) throws TidelineException {
    List<Occurrence> occurrences = calendar.activeEventsBetween(start, end);

    Duration window = Duration.between(start, end);
    Duration busy = Duration.ZERO;
    for (Occurrence occurrence : occurrences) {
      ZonedDateTime from = occurrence.start().isBefore(start) ? start : occurrence.start();
      ZonedDateTime to = occurrence.end().isAfter(end) ? end : occurrence.end();
      if (to.isAfter(from)) {
        busy = busy.plus(Duration.between(from, to));
      }
    }

    double occupancy =
        window.isNegative() || window.isZero()
            ? 0.0
            : busy.toMillis() * 100.0 / window.toMillis();
    int gapCount = findGaps(calendar, start, end, Duration.ZERO).size();
    int overlapCount = overlapsOf(calendar, occurrences).size();

    DensityReport report =
        new DensityReport(
            window,
            busy,
            window.minus(busy),
            occupancy,
            occurrences.size(),
            gapCount,
            overlapCount);
    log.debug("Density over [{}, {}]: {}", start, end, report);
    return report;
  }

  /**
   * Finds the longest free interval in {@code [start, end]}.
   *
   * @param calendar the calendar
   * @param start the window start
   * @param end the window end
   * @return the longest gap (the earliest one on a tie), or empty if the window is fully booked
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static Optional<Gap> findLongestGap(
      Calendar calendar, ZonedDateTime start, ZonedDateTime end) throws TidelineException {
    Gap longest = null;
    for (Gap gap : findGaps(calendar, start, end, Duration.ZERO)) {
      if (longest == null || gap.duration().compareTo(longest.duration()) > 0) {
        longest = gap;
      }
    }
    return Optional.ofNullable(longest);
  }

  /**
   * Finds the free intervals in {@code [start, end]} long enough to hold {@code duration}.
   *
   * @param calendar the calendar
   * @param start the window start
   * @param end the window end
   * @param duration the length of the slot needed
   * @return the qualifying gaps in chronological order
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static List<Gap> findAvailableSlots(
      Calendar calendar, ZonedDateTime start, ZonedDateTime end, Duration duration)
      throws TidelineException {
    return findGaps(calendar, start, end, duration);
  }

  /**
   * Checks that no active occurrence intersects {@code [slotStart, slotEnd)}.
   *
   * <p>Occurrences that start up to one day before the slot are taken into account. Touching
   * boundaries do not conflict.
   *
   * @param calendar the calendar
   * @param slotStart the slot start
   * @param slotEnd the slot end
   * @return true if the slot is free
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static boolean isSlotAvailable(
      Calendar calendar, ZonedDateTime slotStart, ZonedDateTime slotEnd)
      throws TidelineException {
    for (Occurrence occurrence :
        calendar.activeEventsBetween(slotStart.minus(SLOT_LOOKBEHIND), slotEnd)) {
      if (occurrence.start().isBefore(slotEnd) && slotStart.isBefore(occurrence.end())) {
        log.debug(
            "Slot [{}, {}] conflicts with '{}' at {}",
            slotStart,
            slotEnd,
            calendar.eventOf(occurrence).title(),
            occurrence.start());
        return false;
      }
    }
    return true;
  }

  /**
   * Suggests start times near a requested one where {@code duration} fits.
   *
   * <p>Searches {@code [requestedStart - searchWindow, requestedStart + searchWindow]}. Each gap
   * long enough contributes its own start and then one candidate per {@link #ALTERNATIVE_STEP}
   * while the slot still ends inside the gap.
   *
   * @param calendar the calendar
   * @param requestedStart the preferred start
   * @param duration the length of the slot needed
   * @param searchWindow how far to search on either side of the preferred start
   * @return candidate starts in chronological order
   * @throws TidelineException if an event's recurrence cannot be expanded
   */
  public static List<ZonedDateTime> suggestAlternatives(
      Calendar calendar, ZonedDateTime requestedStart, Duration duration, Duration searchWindow)
      throws TidelineException {
    ZonedDateTime from = requestedStart.minus(searchWindow);
    ZonedDateTime to = requestedStart.plus(searchWindow);

    List<ZonedDateTime> candidates = new ArrayList<>();
    for (Gap gap : findAvailableSlots(calendar, from, to, duration)) {
      ZonedDateTime candidate = gap.start();
      while (!candidate.plus(duration).isAfter(gap.end())) {
        candidates.add(candidate);
        candidate = candidate.plus(ALTERNATIVE_STEP);
      }
    }
    candidates.sort(Comparator.comparing(ZonedDateTime::toInstant));
    log.debug("Suggested {} alternative start(s) around {}", candidates.size(), requestedStart);
    return candidates;
  }
}
