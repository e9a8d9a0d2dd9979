package io.tideline;

/** The type of error raised by clock resolution, event validation, recurrence or the codecs. */
public enum ErrorKind {
  /** A civil date-time string did not match a supported pattern. */
  TIME_PARSE("time_parse"),
  /** A zone identifier could not be resolved. */
  INVALID_TIME_ZONE("invalid_time_zone"),
  /** A civil date-time does not exist (or is unresolved) in the requested zone. */
  INVALID_LOCAL_TIME("invalid_local_time"),
  /** An event invariant was violated. */
  VALIDATION("validation"),
  /** A recurrence rule is malformed or uses an unsupported frequency. */
  RECURRENCE("recurrence"),
  /** iCalendar or JSON text could not be read or written. */
  CODEC("codec");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
