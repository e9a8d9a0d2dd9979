package io.tideline.model;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * A free interval in a schedule.
 *
 * @param start the start of the gap
 * @param end the end of the gap
 * @param duration {@code end - start}
 * @param precedingLabel title of the occurrence before the gap (may be null)
 * @param followingLabel title of the occurrence after the gap (may be null)
 */
public record Gap(
    ZonedDateTime start,
    ZonedDateTime end,
    Duration duration,
    String precedingLabel,
    String followingLabel) {

  /**
   * Creates a gap, deriving its duration.
   *
   * @param start the start
   * @param end the end
   * @param precedingLabel the preceding title, or null
   * @param followingLabel the following title, or null
   * @return a new gap
   */
  public static Gap of(
      ZonedDateTime start, ZonedDateTime end, String precedingLabel, String followingLabel) {
    return new Gap(start, end, Duration.between(start, end), precedingLabel, followingLabel);
  }

  /**
   * Returns the duration in whole minutes.
   *
   * @return the minutes
   */
  public long durationMinutes() {
    return duration.toMinutes();
  }

  /**
   * Returns the duration in whole hours.
   *
   * @return the hours
   */
  public long durationHours() {
    return duration.toHours();
  }

  /**
   * Checks if this gap is at least a certain length.
   *
   * @param minimum the minimum duration
   * @return true if the gap is long enough
   */
  public boolean isAtLeast(Duration minimum) {
    return duration.compareTo(minimum) >= 0;
  }
}
