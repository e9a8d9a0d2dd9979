package io.tideline.model;

import java.util.Optional;

/** Booking lifecycle of an event. Only {@link #CANCELLED} frees the event's time. */
public enum EventStatus {
  /** Confirmed and occupying time. The default. */
  CONFIRMED("confirmed"),
  /** Provisional, still occupying time. */
  TENTATIVE("tentative"),
  /** Cancelled, does not occupy time. */
  CANCELLED("cancelled"),
  /** A blocked slot, occupying time like a confirmed event. */
  BLOCKED("blocked");

  private final String displayName;

  EventStatus(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns whether events in this status occupy time.
   *
   * @return false only for {@link #CANCELLED}
   */
  public boolean occupiesTime() {
    return this != CANCELLED;
  }

  @Override
  public String toString() {
    return displayName;
  }

  /**
   * Parses a status name (case insensitive).
   *
   * @param s the string to parse
   * @return the status if valid
   */
  public static Optional<EventStatus> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    for (EventStatus status : values()) {
      if (status.displayName.equalsIgnoreCase(s.trim())) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
