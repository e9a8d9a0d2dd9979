package io.tideline.zone;

/**
 * Strategy for turning a civil (wall-clock) date-time into an instant when the zone's offset at
 * that wall-clock time is not unique.
 */
public enum Disambiguation {
  /** On a fall-back overlap pick the first instant; a spring-forward gap is an error. */
  EARLIEST,
  /** On a fall-back overlap pick the second instant; a spring-forward gap is an error. */
  LATEST,
  /**
   * On a fall-back overlap pick the first instant; inside a spring-forward gap move the civil time
   * forward by the length of the gap (02:30 becomes 03:30 on a one-hour transition).
   */
  SHIFT_FORWARD
}
