package io.tideline.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tideline.Calendar;
import io.tideline.TidelineException;
import io.tideline.model.Event;
import io.tideline.model.EventDraft;
import io.tideline.model.EventStatus;
import io.tideline.model.Frequency;
import io.tideline.model.RecurrenceFilter;
import io.tideline.model.RecurrenceRule;
import io.tideline.model.Terminator;
import io.tideline.model.Weekday;
import io.tideline.zone.ZonedClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes calendars as JSON.
 *
 * <p>Instants are RFC 3339 strings with an offset ({@code 2025-11-01T10:00:00-04:00}); the
 * event's zone travels separately as {@code timezone}. Civil dates are {@code YYYY-MM-DD}.
 *
 * <pre>{@code
 * {
 *   "name": "Work",
 *   "events": [
 *     {
 *       "title": "Standup",
 *       "start_time": "2025-11-03T09:00:00+01:00",
 *       "end_time": "2025-11-03T09:15:00+01:00",
 *       "timezone": "Europe/Berlin",
 *       "status": "confirmed",
 *       "recurrence": {"frequency": "DAILY", "interval": 1, "count": 10},
 *       "skip_weekends": true,
 *       "exception_dates": ["2025-11-05"]
 *     }
 *   ]
 * }
 * }</pre>
 */
public final class CalendarJson {
  private static final Logger log = LoggerFactory.getLogger(CalendarJson.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private CalendarJson() {}

  /**
   * Serializes a calendar.
   *
   * @param calendar the calendar
   * @return pretty-printed JSON
   * @throws TidelineException if serialization fails
   */
  public static String write(Calendar calendar) throws TidelineException {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("name", calendar.name());
    calendar.description().ifPresent(d -> root.put("description", d));
    calendar.zone().ifPresent(z -> root.put("timezone", z.getId()));
    ArrayNode events = root.putArray("events");
    for (Event event : calendar.events()) {
      events.add(eventNode(event));
    }
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw TidelineException.codec("Failed to serialize calendar " + calendar.name(), e);
    }
  }

  /**
   * Serializes a calendar to a file, UTF-8 encoded.
   *
   * @param calendar the calendar
   * @param path the target file
   * @throws TidelineException if serialization or writing fails
   */
  public static void write(Calendar calendar, Path path) throws TidelineException {
    String json = write(calendar);
    try {
      Files.writeString(path, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw TidelineException.codec("Failed to write JSON file " + path, e);
    }
  }

  /**
   * Parses a calendar. Every event is validated; the first invalid one fails the read.
   *
   * @param json the JSON text
   * @return the calendar
   * @throws TidelineException with {@code CODEC} for malformed JSON or a missing calendar name,
   *     or with the event's own error kind for an invalid event
   */
  public static Calendar read(String json) throws TidelineException {
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw TidelineException.codec("Malformed calendar JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw TidelineException.codec("Calendar JSON must be an object", null);
    }
    String name = text(root, "name");
    if (name == null) {
      throw TidelineException.codec("Calendar JSON is missing 'name'", null);
    }
    String zone = text(root, "timezone");
    Calendar calendar =
        new Calendar(name, text(root, "description"), zone != null ? ZonedClock.zone(zone) : null);

    JsonNode events = root.path("events");
    if (!events.isMissingNode() && !events.isArray()) {
      throw TidelineException.codec("'events' must be an array", null);
    }
    for (JsonNode node : events) {
      calendar.addEvent(readEvent(node));
    }
    log.debug("Read calendar '{}' with {} event(s) from JSON", name, calendar.eventCount());
    return calendar;
  }

  /**
   * Parses a calendar file, UTF-8 encoded.
   *
   * @param path the file
   * @return the calendar
   * @throws TidelineException if the file cannot be read or its content is invalid
   */
  public static Calendar read(Path path) throws TidelineException {
    String json;
    try {
      json = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw TidelineException.codec("Failed to read JSON file " + path, e);
    }
    return read(json);
  }

  private static ObjectNode eventNode(Event event) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("title", event.title());
    putIfPresent(node, "description", event.description());
    node.put("start_time", instant(event.start()));
    node.put("end_time", instant(event.end()));
    node.put("timezone", event.zone().getId());
    ArrayNode attendees = node.putArray("attendees");
    event.attendees().forEach(attendees::add);
    putIfPresent(node, "location", event.location());
    putIfPresent(node, "uid", event.uid());
    node.put("status", event.status().toString());

    RecurrenceRule rule = event.recurrence();
    if (rule != null) {
      ObjectNode recurrence = node.putObject("recurrence");
      recurrence.put("frequency", rule.frequency().name());
      recurrence.put("interval", rule.interval());
      switch (rule.terminator().kind()) {
        case COUNT -> recurrence.put("count", rule.count());
        case UNTIL -> recurrence.put("until", instant(rule.until()));
        case NONE -> {}
      }
      if (!rule.weekdays().isEmpty()) {
        ArrayNode weekdays = recurrence.putArray("weekdays");
        rule.weekdays().forEach(w -> weekdays.add(w.icsCode()));
      }
    }

    RecurrenceFilter filter = event.filter();
    if (filter != null) {
      node.put("skip_weekends", filter.skipWeekends());
      if (!filter.skipDates().isEmpty()) {
        ArrayNode skipDates = node.putArray("skip_dates");
        filter.skipDates().forEach(d -> skipDates.add(instant(d)));
      }
    }

    if (!event.exceptionDates().isEmpty()) {
      ArrayNode dates = node.putArray("exception_dates");
      event.exceptionDates().forEach(d -> dates.add(d.toString()));
    }
    return node;
  }

  private static Event readEvent(JsonNode node) throws TidelineException {
    if (!node.isObject()) {
      throw TidelineException.codec("Event JSON must be an object", null);
    }
    EventDraft draft =
        EventDraft.titled(text(node, "title")).withDescription(text(node, "description"));

    String start = text(node, "start_time");
    if (start != null) {
      draft = draft.withStart(parseInstant(start));
    }
    String zone = text(node, "timezone");
    if (zone != null) {
      draft = draft.withZone(zone);
    }
    String end = text(node, "end_time");
    if (end != null) {
      draft = draft.withEnd(parseInstant(end));
    }

    for (JsonNode attendee : node.path("attendees")) {
      draft = draft.withAttendee(attendee.asText());
    }
    draft = draft.withLocation(text(node, "location")).withUid(text(node, "uid"));

    String status = text(node, "status");
    if (status != null) {
      draft =
          draft.withStatus(
              EventStatus.parse(status)
                  .orElseThrow(
                      () -> TidelineException.codec("Unknown status '" + status + "'", null)));
    }

    JsonNode recurrence = node.get("recurrence");
    if (recurrence != null && !recurrence.isNull()) {
      draft = draft.withRecurrence(readRule(recurrence));
    }

    if (node.has("skip_weekends") || node.has("skip_dates")) {
      List<ZonedDateTime> skipDates = new ArrayList<>();
      for (JsonNode date : node.path("skip_dates")) {
        skipDates.add(parseInstant(date.asText()));
      }
      draft =
          draft.withFilter(
              new RecurrenceFilter(node.path("skip_weekends").asBoolean(false), skipDates));
    }

    for (JsonNode date : node.path("exception_dates")) {
      String value = date.asText();
      try {
        draft = draft.withExceptionDate(LocalDate.parse(value));
      } catch (DateTimeParseException e) {
        throw TidelineException.timeParse(
            "Invalid exception date '" + value + "'. Expected 'YYYY-MM-DD'", value);
      }
    }
    return draft.build();
  }

  private static RecurrenceRule readRule(JsonNode node) throws TidelineException {
    String name = text(node, "frequency");
    if (name == null) {
      throw TidelineException.codec("Recurrence is missing 'frequency'", null);
    }
    Frequency frequency =
        Frequency.parse(name)
            .orElseThrow(() -> TidelineException.recurrence("Unknown frequency '" + name + "'"));

    Terminator terminator = Terminator.none();
    if (node.has("count") && node.has("until")) {
      throw TidelineException.recurrence("Recurrence must not have both 'count' and 'until'");
    } else if (node.has("count")) {
      terminator = Terminator.count(node.get("count").asInt());
    } else if (node.has("until")) {
      terminator = Terminator.until(parseInstant(node.get("until").asText()));
    }

    List<Weekday> weekdays = new ArrayList<>();
    for (JsonNode code : node.path("weekdays")) {
      weekdays.add(
          Weekday.parse(code.asText())
              .orElseThrow(
                  () -> TidelineException.recurrence("Unknown weekday '" + code.asText() + "'")));
    }
    return new RecurrenceRule(frequency, node.path("interval").asInt(1), terminator, weekdays);
  }

  private static String instant(ZonedDateTime instant) {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant);
  }

  private static ZonedDateTime parseInstant(String text) throws TidelineException {
    try {
      return OffsetDateTime.parse(text).toZonedDateTime();
    } catch (DateTimeParseException e) {
      throw TidelineException.timeParse(
          "Invalid RFC 3339 timestamp '" + text + "'. Expected e.g. '2025-11-01T10:00:00Z'",
          text);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }
}
