package io.tideline.model;

import java.time.ZonedDateTime;

/**
 * Bounds how many occurrences a recurrence rule produces.
 *
 * @param kind the type of terminator
 * @param count the maximum number of occurrences (for COUNT)
 * @param until the last instant an occurrence may have, inclusive (for UNTIL)
 */
public record Terminator(Kind kind, int count, ZonedDateTime until) {

  /** The type of terminator. */
  public enum Kind {
    /** No terminator; generation is bounded by the caller's cap only. */
    NONE,
    /** Stop after a fixed number of occurrences. */
    COUNT,
    /** Stop after the last occurrence at or before an instant. */
    UNTIL
  }

  private static final Terminator NONE = new Terminator(Kind.NONE, 0, null);

  /**
   * Returns the absent terminator.
   *
   * @return a terminator of kind NONE
   */
  public static Terminator none() {
    return NONE;
  }

  /**
   * Creates a count terminator.
   *
   * @param count the number of occurrences
   * @return a new COUNT terminator
   */
  public static Terminator count(int count) {
    return new Terminator(Kind.COUNT, count, null);
  }

  /**
   * Creates an until terminator.
   *
   * @param until the inclusive upper bound
   * @return a new UNTIL terminator
   */
  public static Terminator until(ZonedDateTime until) {
    return new Terminator(Kind.UNTIL, 0, until);
  }
}
