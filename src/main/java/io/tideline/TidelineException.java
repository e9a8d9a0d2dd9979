package io.tideline;

import java.util.Optional;

/** Exception thrown for errors in time resolution, event validation, recurrence or codecs. */
public final class TidelineException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input text, if any. */
  private final String input;

  private TidelineException(ErrorKind kind, String message, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new civil date-time parse error.
   *
   * @param message the error message
   * @param input the text that failed to parse
   * @return a new TidelineException for a parse error
   */
  public static TidelineException timeParse(String message, String input) {
    return new TidelineException(ErrorKind.TIME_PARSE, message, input, null);
  }

  /**
   * Creates a new unknown zone error.
   *
   * @param zoneId the zone identifier that could not be resolved
   * @param cause the underlying failure
   * @return a new TidelineException for an unknown zone
   */
  public static TidelineException invalidTimeZone(String zoneId, Throwable cause) {
    return new TidelineException(
        ErrorKind.INVALID_TIME_ZONE, "Invalid time zone: " + zoneId, zoneId, cause);
  }

  /**
   * Creates a new error for a civil time that does not resolve to an instant.
   *
   * @param message the error message
   * @param input the civil date-time
   * @return a new TidelineException for an unresolved local time
   */
  public static TidelineException invalidLocalTime(String message, String input) {
    return new TidelineException(ErrorKind.INVALID_LOCAL_TIME, message, input, null);
  }

  /**
   * Creates a new event validation error.
   *
   * @param message the error message
   * @return a new TidelineException for a validation error
   */
  public static TidelineException validation(String message) {
    return new TidelineException(ErrorKind.VALIDATION, message, null, null);
  }

  /**
   * Creates a new recurrence error.
   *
   * @param message the error message
   * @return a new TidelineException for a recurrence error
   */
  public static TidelineException recurrence(String message) {
    return new TidelineException(ErrorKind.RECURRENCE, message, null, null);
  }

  /**
   * Creates a new codec error.
   *
   * @param message the error message
   * @param cause the underlying failure, may be null
   * @return a new TidelineException for a codec error
   */
  public static TidelineException codec(String message, Throwable cause) {
    return new TidelineException(ErrorKind.CODEC, message, null, cause);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending input text, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats the error as {@code error[kind]: message}, followed by the offending input when known.
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error[").append(kind).append("]: ").append(getMessage());
    if (input != null && !input.isEmpty()) {
      sb.append("\n  ").append(input);
    }
    return sb.toString();
  }
}
