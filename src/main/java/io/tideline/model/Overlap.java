package io.tideline.model;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * An interval during which occurrences conflict.
 *
 * @param start the start of the overlap
 * @param end the end of the overlap
 * @param duration {@code end - start}
 * @param participants titles of the conflicting occurrences
 */
public record Overlap(
    ZonedDateTime start, ZonedDateTime end, Duration duration, List<String> participants) {
  /** Creates a new Overlap with defensive copy of the participants. */
  public Overlap {
    participants = List.copyOf(participants);
  }

  /**
   * Creates an overlap, deriving its duration.
   *
   * @param start the start
   * @param end the end
   * @param participants the titles involved
   * @return a new overlap
   */
  public static Overlap of(ZonedDateTime start, ZonedDateTime end, List<String> participants) {
    return new Overlap(start, end, Duration.between(start, end), participants);
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
   * Returns the number of conflicting occurrences.
   *
   * @return the participant count
   */
  public int participantCount() {
    return participants.size();
  }
}
