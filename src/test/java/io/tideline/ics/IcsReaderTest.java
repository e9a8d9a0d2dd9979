package io.tideline.ics;

import static org.junit.jupiter.api.Assertions.*;

import io.tideline.Calendar;
import io.tideline.ErrorKind;
import io.tideline.TidelineException;
import io.tideline.model.Event;
import io.tideline.model.EventDraft;
import io.tideline.model.EventStatus;
import io.tideline.model.Frequency;
import io.tideline.model.RecurrenceRule;
import io.tideline.model.Weekday;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class IcsReaderTest {
  private static final ZoneId UTC = ZoneId.of("UTC");

  private static String ics(String... lines) {
    return String.join("\r\n", lines) + "\r\n";
  }

  private static String calendarWith(String... eventLines) {
    StringBuilder sb = new StringBuilder("BEGIN:VCALENDAR\r\nVERSION:2.0\r\n");
    for (String line : eventLines) {
      sb.append(line).append("\r\n");
    }
    return sb.append("END:VCALENDAR\r\n").toString();
  }

  private static TidelineException readFails(String text) {
    return assertThrows(TidelineException.class, () -> IcsReader.read(text));
  }

  @Test
  void testRoundTrip() throws TidelineException {
    Calendar original = new Calendar("Work", "Team, shared", ZoneId.of("Europe/Berlin"));
    original.addEvent(
        EventDraft.titled("Standup; daily")
            .withStart("2025-11-03 09:00:00", "America/New_York")
            .withDurationMinutes(15)
            .withDescription("Line one\nline two")
            .withLocation("Room 4, floor 2")
            .withAttendees(List.of("alice@example.com", "bob@example.com"))
            .withUid("standup@example.com")
            .withRecurrence(
                RecurrenceRule.weekly()
                    .withInterval(2)
                    .withCount(6)
                    .withWeekdays(List.of(Weekday.MONDAY, Weekday.FRIDAY)))
            .withSkipWeekends(true)
            .withExceptionDate(LocalDate.of(2025, 11, 17))
            .build());
    Event blocked =
        Event.of(
            "Focus",
            ZonedDateTime.of(2025, 11, 4, 13, 0, 0, 0, ZoneOffset.UTC),
            ZonedDateTime.of(2025, 11, 4, 15, 0, 0, 0, ZoneOffset.UTC));
    blocked.block();
    original.addEvent(blocked);

    Calendar copy = IcsReader.read(IcsWriter.write(original));
    assertEquals("Work", copy.name());
    assertEquals(original.description(), copy.description());
    assertEquals(original.zone(), copy.zone());
    assertEquals(2, copy.eventCount());

    Event a = original.event(0);
    Event b = copy.event(0);
    assertEquals(a.title(), b.title());
    assertEquals(a.description(), b.description());
    assertEquals(a.location(), b.location());
    assertEquals(a.uid(), b.uid());
    assertEquals(a.attendees(), b.attendees());
    assertEquals(a.zone(), b.zone());
    assertEquals(a.start(), b.start());
    assertEquals(a.end(), b.end());
    assertEquals(a.recurrence(), b.recurrence());
    assertTrue(b.filter().skipWeekends());
    assertEquals(a.exceptionDates(), b.exceptionDates());
    assertEquals(EventStatus.CONFIRMED, b.status());

    Event focus = copy.event(1);
    assertEquals(EventStatus.BLOCKED, focus.status());
    assertEquals(blocked.start().toInstant(), focus.start().toInstant());
    assertTrue(focus.uid().endsWith("@tideline"));
  }

  @Test
  void testDateTimeForms() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Zulu",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "END:VEVENT",
                "BEGIN:VEVENT",
                "SUMMARY:Zoned",
                "DTSTART;TZID=Europe/Paris:20251027T150000",
                "DTEND;TZID=Europe/Paris:20251027T160000",
                "END:VEVENT",
                "BEGIN:VEVENT",
                "SUMMARY:Floating",
                "DTSTART:20251027T150000",
                "DTEND:20251027T160000",
                "END:VEVENT"));

    Event zulu = cal.event(0);
    assertEquals(UTC, zulu.zone());
    assertEquals(LocalDateTime.of(2025, 10, 27, 15, 0), zulu.start().toLocalDateTime());

    Event zoned = cal.event(1);
    assertEquals(ZoneId.of("Europe/Paris"), zoned.zone());
    assertEquals(LocalDateTime.of(2025, 10, 27, 15, 0), zoned.start().toLocalDateTime());
    assertEquals(
        ZonedDateTime.of(2025, 10, 27, 14, 0, 0, 0, ZoneOffset.UTC).toInstant(),
        zoned.start().toInstant());

    Event floating = cal.event(2);
    assertEquals(UTC, floating.zone());
    assertEquals(zulu.start().toInstant(), floating.start().toInstant());
  }

  @Test
  void testDateValueStartsAtMidnight() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Holiday",
                "DTSTART;VALUE=DATE:20251225",
                "DTEND;VALUE=DATE:20251226",
                "END:VEVENT"));
    Event e = cal.event(0);
    assertEquals(LocalDateTime.of(2025, 12, 25, 0, 0), e.start().toLocalDateTime());
    assertEquals(Duration.ofDays(1), e.duration());
  }

  @Test
  void testDuration() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Short",
                "DTSTART:20251027T150000Z",
                "DURATION:PT45M",
                "END:VEVENT"));
    assertEquals(Duration.ofMinutes(45), cal.event(0).duration());
  }

  @Test
  void testWeekDuration() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Sprint",
                "DTSTART:20251103T090000Z",
                "DURATION:P1W",
                "END:VEVENT"));
    assertEquals(1, cal.eventCount());
    Event e = cal.event(0);
    assertEquals(Duration.ofDays(7), e.duration());
    assertEquals(ZonedDateTime.of(2025, 11, 10, 9, 0, 0, 0, UTC), e.end());
  }

  @Test
  void testDateStartWithoutEndLastsOneDay() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Holiday",
                "DTSTART;VALUE=DATE:20251103",
                "END:VEVENT"));
    assertEquals(1, cal.eventCount());
    Event e = cal.event(0);
    assertEquals(ZonedDateTime.of(2025, 11, 3, 0, 0, 0, 0, UTC), e.start());
    assertEquals(Duration.ofDays(1), e.duration());
  }

  @Test
  void testDefaultsWithoutCalendarProperties() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Call",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "END:VEVENT"));
    assertEquals(IcsReader.DEFAULT_CALENDAR_NAME, cal.name());
    assertTrue(cal.description().isEmpty());
    assertTrue(cal.zone().isEmpty());
    assertEquals(EventStatus.CONFIRMED, cal.event(0).status());
  }

  @Test
  void testFoldedLinesAreJoined() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Quarterly",
                "  planning",
                "DESCRIPTION:first part",
                "\tsecond part",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "END:VEVENT"));
    assertEquals("Quarterly planning", cal.event(0).title());
    assertEquals("first partsecond part", cal.event(0).description());
  }

  @Test
  void testNestedComponentsAreDropped() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VTODO",
                "UID:todo-1@example.com",
                "SUMMARY:Not an event",
                "END:VTODO",
                "BEGIN:VEVENT",
                "SUMMARY:Call",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "BEGIN:VALARM",
                "ACTION:DISPLAY",
                "DESCRIPTION:Reminder",
                "TRIGGER:-PT15M",
                "END:VALARM",
                "END:VEVENT"));
    assertEquals(1, cal.eventCount());
    assertNull(cal.event(0).description());
  }

  @Test
  void testUnreadableEventsAreSkipped() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "END:VEVENT",
                "BEGIN:VEVENT",
                "SUMMARY:Backwards",
                "DTSTART:20251027T160000Z",
                "DTEND:20251027T150000Z",
                "END:VEVENT",
                "BEGIN:VEVENT",
                "SUMMARY:Odd status",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "STATUS:MAYBE",
                "END:VEVENT",
                "BEGIN:VEVENT",
                "SUMMARY:Kept",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "END:VEVENT"));
    assertEquals(1, cal.eventCount());
    assertEquals("Kept", cal.event(0).title());
  }

  @Test
  void testStatusAndAttendees() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Maybe",
                "DTSTART:20251027T150000Z",
                "DTEND:20251027T160000Z",
                "STATUS:TENTATIVE",
                "ATTENDEE;CN=\"Doe, Jane\":MAILTO:jane@example.com",
                "ATTENDEE:bob@example.com",
                "END:VEVENT"));
    Event e = cal.event(0);
    assertEquals(EventStatus.TENTATIVE, e.status());
    assertEquals(List.of("jane@example.com", "bob@example.com"), e.attendees());
  }

  @Test
  void testRecurrenceAndExceptions() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            calendarWith(
                "BEGIN:VEVENT",
                "SUMMARY:Morning",
                "DTSTART;TZID=Asia/Tokyo:20251103T100000",
                "DTEND;TZID=Asia/Tokyo:20251103T110000",
                "RRULE:FREQ=DAILY;UNTIL=20251110",
                "EXDATE:20251105T010000Z,20251106T010000Z",
                "EXDATE;TZID=Asia/Tokyo:20251108T100000",
                "END:VEVENT"));
    Event e = cal.event(0);
    assertEquals(Frequency.DAILY, e.recurrence().frequency());
    assertEquals(
        Set.of(LocalDate.of(2025, 11, 5), LocalDate.of(2025, 11, 6), LocalDate.of(2025, 11, 8)),
        e.exceptionDates());

    List<ZonedDateTime> days = e.occurrencesBetween(e.start(), e.start().plusDays(30), 100);
    // Nov 3 through Nov 10 inclusive, minus three exception dates
    assertEquals(5, days.size());
    assertEquals(LocalDate.of(2025, 11, 10), days.get(days.size() - 1).toLocalDate());
  }

  @Test
  void testCalendarProperties() throws TidelineException {
    Calendar cal =
        IcsReader.read(
            ics(
                "BEGIN:VCALENDAR",
                "VERSION:2.0",
                "X-WR-CALNAME:Team\\, Berlin",
                "X-WR-CALDESC:Shared",
                "X-WR-TIMEZONE:Europe/Berlin",
                "END:VCALENDAR"));
    assertEquals("Team, Berlin", cal.name());
    assertEquals("Shared", cal.description().orElseThrow());
    assertEquals(ZoneId.of("Europe/Berlin"), cal.zone().orElseThrow());
    assertEquals(0, cal.eventCount());
  }

  @Test
  void testStructuralErrors() {
    assertEquals(ErrorKind.CODEC, readFails("").kind());
    assertEquals(ErrorKind.CODEC, readFails(ics("VERSION:2.0", "END:VCALENDAR")).kind());
    assertEquals(ErrorKind.CODEC, readFails(ics("BEGIN:VCALENDAR", "VERSION:2.0")).kind());
    assertEquals(
        ErrorKind.CODEC,
        readFails(ics("BEGIN:VCALENDAR", "BEGIN:VEVENT", "SUMMARY:Open", "END:VCALENDAR"))
            .kind());
  }

  @Test
  void testReadFromFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("in.ics");
    Files.writeString(
        file,
        calendarWith(
            "BEGIN:VEVENT",
            "SUMMARY:Réunion",
            "DTSTART:20251027T150000Z",
            "DTEND:20251027T160000Z",
            "END:VEVENT"),
        StandardCharsets.UTF_8);
    assertEquals("Réunion", IcsReader.read(file).event(0).title());

    TidelineException e =
        assertThrows(TidelineException.class, () -> IcsReader.read(dir.resolve("missing.ics")));
    assertEquals(ErrorKind.CODEC, e.kind());
  }
}
