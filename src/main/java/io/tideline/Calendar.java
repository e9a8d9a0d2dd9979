package io.tideline;

import io.tideline.eval.OccurrenceExpander;
import io.tideline.model.Event;
import io.tideline.model.Occurrence;
import io.tideline.zone.ZonedClock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An insertion-ordered collection of events and the index that expands them into occurrences.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Calendar cal = new Calendar("Work");
 * cal.addEvent(
 *     EventDraft.titled("Weekly sync")
 *         .withStart("2025-11-03 10:00:00", "America/New_York")
 *         .withDurationHours(1)
 *         .withRecurrence(RecurrenceRule.weekly().withCount(10))
 *         .build());
 * List<Occurrence> november = cal.eventsBetween(from, to);
 * }</pre>
 *
 * <p>Events are neither deduplicated nor reordered; an event's index is its position in insertion
 * order and shifts when an earlier event is removed. Occurrences are recomputed on every query.
 * A calendar is not thread-safe.
 */
public final class Calendar {
  private static final Logger log = LoggerFactory.getLogger(Calendar.class);

  /** Per-event generation cap applied by {@link #eventsBetween}. */
  public static final int DEFAULT_MAX_OCCURRENCES = OccurrenceExpander.DEFAULT_MAX_OCCURRENCES;

  /** Orders occurrences by absolute instant only. */
  private static final Comparator<Occurrence> BY_INSTANT =
      Comparator.comparing(o -> o.start().toInstant());

  private final String name;
  private final String description;
  private final ZoneId zone;
  private final List<Event> events = new ArrayList<>();

  /**
   * Creates an empty calendar.
   *
   * @param name the calendar name
   */
  public Calendar(String name) {
    this(name, null, null);
  }

  /**
   * Creates an empty calendar with a description and a default zone.
   *
   * @param name the calendar name
   * @param description the description, may be null
   * @param zone the default zone for codecs, may be null
   */
  public Calendar(String name, String description, ZoneId zone) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.zone = zone;
  }

  /**
   * Returns the calendar name.
   *
   * @return the name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the description, if set.
   *
   * @return the description
   */
  public Optional<String> description() {
    return Optional.ofNullable(description);
  }

  /**
   * Returns the default zone, if set.
   *
   * @return the zone
   */
  public Optional<ZoneId> zone() {
    return Optional.ofNullable(zone);
  }

  /**
   * Appends an event.
   *
   * @param event the event
   * @return the index of the added event
   */
  public int addEvent(Event event) {
    events.add(Objects.requireNonNull(event, "event"));
    return events.size() - 1;
  }

  /**
   * Appends several events in iteration order.
   *
   * @param toAdd the events
   */
  public void addEvents(Collection<Event> toAdd) {
    for (Event event : toAdd) {
      addEvent(event);
    }
  }

  /**
   * Removes the event at an index. Later events shift down by one.
   *
   * @param index the index
   * @return the removed event, or empty if the index is out of range
   */
  public Optional<Event> removeEvent(int index) {
    if (index < 0 || index >= events.size()) {
      return Optional.empty();
    }
    return Optional.of(events.remove(index));
  }

  /**
   * Applies a mutation to the event at an index.
   *
   * @param index the index
   * @param mutation the mutation, e.g. {@code Event::cancel}
   * @return true if an event exists at the index
   */
  public boolean updateEvent(int index, Consumer<Event> mutation) {
    if (index < 0 || index >= events.size()) {
      return false;
    }
    mutation.accept(events.get(index));
    return true;
  }

  /**
   * Returns the event at an index.
   *
   * @param index the index
   * @return the event
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  public Event event(int index) {
    return events.get(index);
  }

  /**
   * Returns the event an occurrence belongs to.
   *
   * @param occurrence an occurrence produced by this calendar
   * @return the event
   */
  public Event eventOf(Occurrence occurrence) {
    return events.get(occurrence.eventIndex());
  }

  /**
   * Returns all events in insertion order.
   *
   * @return an unmodifiable view of the events
   */
  public List<Event> events() {
    return Collections.unmodifiableList(events);
  }

  /**
   * Finds events whose title contains a search term, ignoring case.
   *
   * @param term the search term
   * @return the matching events in insertion order
   */
  public List<Event> findEventsByTitle(String term) {
    String needle = term.toLowerCase(Locale.ROOT);
    List<Event> found = new ArrayList<>();
    for (Event event : events) {
      if (event.title().toLowerCase(Locale.ROOT).contains(needle)) {
        found.add(event);
      }
    }
    return found;
  }

  /**
   * Returns the number of events.
   *
   * @return the event count
   */
  public int eventCount() {
    return events.size();
  }

  /** Removes all events. */
  public void clear() {
    events.clear();
  }

  /**
   * Expands every event over {@code [start, end]} into a single time-ordered sequence.
   *
   * <p>Occurrences at the same instant keep event insertion order.
   *
   * @param start the window start (inclusive)
   * @param end the window end (inclusive)
   * @return the occurrences sorted by absolute instant
   * @throws TidelineException if an event's recurrence rule cannot be generated
   */
  public List<Occurrence> eventsBetween(ZonedDateTime start, ZonedDateTime end)
      throws TidelineException {
    List<Occurrence> occurrences = new ArrayList<>();
    for (int i = 0; i < events.size(); i++) {
      Event event = events.get(i);
      Duration duration = event.duration();
      for (ZonedDateTime t :
          OccurrenceExpander.expand(event, start, end, DEFAULT_MAX_OCCURRENCES)) {
        occurrences.add(new Occurrence(i, t, duration));
      }
    }
    occurrences.sort(BY_INSTANT);
    log.debug(
        "Expanded {} event(s) into {} occurrence(s) over [{}, {}]",
        events.size(),
        occurrences.size(),
        start,
        end);
    return occurrences;
  }

  /**
   * Like {@link #eventsBetween} but keeps only occurrences of events that occupy time.
   *
   * @param start the window start (inclusive)
   * @param end the window end (inclusive)
   * @return the active occurrences sorted by absolute instant
   * @throws TidelineException if an event's recurrence rule cannot be generated
   */
  public List<Occurrence> activeEventsBetween(ZonedDateTime start, ZonedDateTime end)
      throws TidelineException {
    List<Occurrence> active = new ArrayList<>();
    for (Occurrence occurrence : eventsBetween(start, end)) {
      if (eventOf(occurrence).isActive()) {
        active.add(occurrence);
      }
    }
    return active;
  }

  /**
   * Returns the occurrences on the civil day of {@code date}, in {@code date}'s zone.
   *
   * @param date any instant on the day, rendered in the zone whose day is meant
   * @return the occurrences between the day's first instant and {@code 23:59:59}
   * @throws TidelineException if the day window cannot be resolved or a rule cannot be generated
   */
  public List<Occurrence> eventsOnDate(ZonedDateTime date) throws TidelineException {
    ZoneId dayZone = date.getZone();
    return eventsBetween(
        ZonedClock.startOfDay(date.toLocalDate(), dayZone),
        ZonedClock.endOfDay(date.toLocalDate(), dayZone));
  }

  @Override
  public String toString() {
    return "Calendar{name='" + name + "', events=" + events.size() + '}';
  }
}
