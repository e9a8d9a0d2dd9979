package io.tideline.model;

import java.time.Duration;

/**
 * Occupancy statistics of a schedule window.
 *
 * <p>{@code busyDuration} sums every occurrence clipped to the window without merging, so
 * overlapping occurrences count twice; {@code freeDuration} can then be negative and {@code
 * occupancyPercent} can exceed 100.
 *
 * @param windowDuration the length of the analyzed window
 * @param busyDuration the summed clipped occurrence time
 * @param freeDuration {@code windowDuration - busyDuration}
 * @param occupancyPercent {@code busy / window * 100}, 0 for an empty window
 * @param occurrenceCount the number of occurrences analyzed
 * @param gapCount the number of gaps of any length
 * @param overlapCount the number of pairwise overlaps
 */
public record DensityReport(
    Duration windowDuration,
    Duration busyDuration,
    Duration freeDuration,
    double occupancyPercent,
    int occurrenceCount,
    int gapCount,
    int overlapCount) {

  /** Occupancy above which a window is busy. */
  public static final double BUSY_THRESHOLD = 60.0;

  /** Occupancy below which a window is light. */
  public static final double LIGHT_THRESHOLD = 30.0;

  /**
   * Checks if the window is more than 60% occupied.
   *
   * @return true if busy
   */
  public boolean isBusy() {
    return occupancyPercent > BUSY_THRESHOLD;
  }

  /**
   * Checks if the window is less than 30% occupied.
   *
   * @return true if light
   */
  public boolean isLight() {
    return occupancyPercent < LIGHT_THRESHOLD;
  }

  /**
   * Checks if any occurrences overlap.
   *
   * @return true if there is at least one overlap
   */
  public boolean hasConflicts() {
    return overlapCount > 0;
  }
}
