package io.tideline.ics;

import io.tideline.TidelineException;
import io.tideline.model.Frequency;
import io.tideline.model.RecurrenceRule;
import io.tideline.model.Terminator;
import io.tideline.model.Weekday;
import io.tideline.zone.ZonedClock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import net.fortuna.ical4j.model.Recur;
import net.fortuna.ical4j.model.WeekDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts recurrence rules to and from RFC 5545 {@code RRULE} values.
 *
 * <p>Parsing is done by ical4j's {@link Recur}. Only {@code FREQ}, {@code INTERVAL}, {@code
 * COUNT}, {@code UNTIL} and {@code BYDAY} are mapped; other rule parts are ignored on input.
 */
public final class RRuleFormat {
  private static final Logger log = LoggerFactory.getLogger(RRuleFormat.class);

  private RRuleFormat() {}

  /**
   * Renders a rule, e.g. {@code FREQ=WEEKLY;INTERVAL=2;COUNT=10;BYDAY=MO,WE}.
   *
   * @param rule the rule
   * @return the RRULE value without the {@code RRULE:} prefix
   */
  public static String format(RecurrenceRule rule) {
    StringBuilder sb = new StringBuilder();
    sb.append("FREQ=").append(rule.frequency().name());
    if (rule.interval() > 1) {
      sb.append(";INTERVAL=").append(rule.interval());
    }
    switch (rule.terminator().kind()) {
      case COUNT -> sb.append(";COUNT=").append(rule.count());
      case UNTIL -> sb.append(";UNTIL=").append(IcsTime.formatUtc(rule.until()));
      case NONE -> {}
    }
    if (!rule.weekdays().isEmpty()) {
      sb.append(";BYDAY=")
          .append(rule.weekdays().stream().map(Weekday::icsCode).collect(Collectors.joining(",")));
    }
    return sb.toString();
  }

  /**
   * Parses an RRULE value with ical4j. An optional {@code RRULE:} prefix is accepted.
   *
   * @param value the RRULE value
   * @param zone the zone of a floating {@code UNTIL}
   * @return the rule, validated
   * @throws TidelineException if the value is malformed or describes an invalid rule
   */
  public static RecurrenceRule parse(String value, ZoneId zone) throws TidelineException {
    if (value == null || value.isBlank()) {
      throw TidelineException.codec("Empty RRULE", null);
    }
    String text = value.trim().toUpperCase(Locale.ROOT);
    if (text.startsWith("RRULE:")) {
      text = text.substring(6);
    }

    Recur<Temporal> recur;
    try {
      recur = new Recur<>(text);
    } catch (Exception e) {
      throw TidelineException.codec("Malformed RRULE '" + value + "': " + e.getMessage(), e);
    }
    return toRule(recur, zone);
  }

  /**
   * Maps a parsed ical4j recurrence onto a rule. A DATE-valued {@code UNTIL} includes the whole
   * day.
   *
   * @param recur the recurrence
   * @param zone the zone of a floating {@code UNTIL}
   * @return the rule, validated
   * @throws TidelineException if the recurrence uses parts this library cannot represent
   */
  static RecurrenceRule toRule(Recur<?> recur, ZoneId zone) throws TidelineException {
    if (recur.getFrequency() == null) {
      throw TidelineException.codec("RRULE is missing FREQ: " + recur, null);
    }
    String freq = recur.getFrequency().name();
    Frequency frequency =
        Frequency.parse(freq)
            .orElseThrow(() -> TidelineException.codec("Unsupported FREQ '" + freq + "'", null));

    int count = recur.getCount();
    Temporal until = recur.getUntil();
    if (count >= 0 && until != null) {
      throw TidelineException.codec("RRULE must not contain both COUNT and UNTIL", null);
    }
    Terminator terminator = Terminator.none();
    if (count >= 0) {
      terminator = Terminator.count(count);
    } else if (until instanceof LocalDate date) {
      terminator = Terminator.until(ZonedClock.endOfDay(date, zone));
    } else if (until != null) {
      terminator = Terminator.until(IcsTime.toZoned(until, zone));
    }

    List<Weekday> weekdays = new ArrayList<>();
    for (WeekDay day : recur.getDayList()) {
      if (day.getOffset() != 0) {
        throw TidelineException.codec("BYDAY offsets are not supported: " + day, null);
      }
      weekdays.add(
          Weekday.parse(day.getDay().name())
              .orElseThrow(() -> TidelineException.codec("Unknown BYDAY value " + day, null)));
    }

    int interval = recur.getInterval() < 0 ? 1 : recur.getInterval();
    RecurrenceRule rule = new RecurrenceRule(frequency, interval, terminator, weekdays);
    rule.validate();
    log.trace("Parsed RRULE {} as {}", recur, rule);
    return rule;
  }
}
