package io.tideline.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.tideline.ErrorKind;
import io.tideline.TidelineException;
import io.tideline.model.Frequency;
import io.tideline.model.RecurrenceRule;
import io.tideline.model.Weekday;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for occurrence generation. */
public class RecurrenceEngineTest {
  private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
  private static final ZonedDateTime ANCHOR =
      ZonedDateTime.of(2025, 11, 1, 10, 0, 0, 0, ZoneOffset.UTC);

  private static void assertStrictlyIncreasing(List<ZonedDateTime> times) {
    for (int i = 1; i < times.size(); i++) {
      assertTrue(
          times.get(i - 1).isBefore(times.get(i)), "not increasing at index " + i + ": " + times);
    }
  }

  @Test
  void testDailyCountProperty() throws TidelineException {
    for (int n = 1; n < 100; n++) {
      List<ZonedDateTime> result =
          RecurrenceEngine.generate(RecurrenceRule.daily().withCount(n), ANCHOR, n + 5);
      assertEquals(n, result.size());
      assertEquals(ANCHOR, result.get(0));
      assertStrictlyIncreasing(result);
      for (int i = 1; i < result.size(); i++) {
        assertEquals(Duration.ofHours(24), Duration.between(result.get(i - 1), result.get(i)));
      }
    }
  }

  @Test
  void testWeeklyIntervalProperty() throws TidelineException {
    for (int interval = 1; interval < 52; interval++) {
      RecurrenceRule rule = RecurrenceRule.weekly().withInterval(interval).withCount(5);
      List<ZonedDateTime> result = RecurrenceEngine.generate(rule, ANCHOR, 100);
      assertEquals(5, result.size());
      for (int i = 1; i < result.size(); i++) {
        assertEquals(
            Duration.ofDays(7L * interval), Duration.between(result.get(i - 1), result.get(i)));
      }
    }
  }

  @Test
  void testDailyPreservesWallClockAcrossSpringForward() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 3, 8, 9, 0, 0, 0, NEW_YORK);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.daily().withCount(3), anchor, 10);

    assertEquals(Duration.ofHours(23), Duration.between(result.get(0), result.get(1)));
    assertEquals(Duration.ofHours(24), Duration.between(result.get(1), result.get(2)));
    for (ZonedDateTime t : result) {
      assertEquals(LocalTime.of(9, 0), t.toLocalTime());
    }
  }

  @Test
  void testDailyPreservesWallClockAcrossFallBack() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 11, 1, 9, 0, 0, 0, NEW_YORK);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.daily().withCount(2), anchor, 10);

    assertEquals(Duration.ofHours(25), Duration.between(result.get(0), result.get(1)));
    assertEquals(LocalTime.of(9, 0), result.get(1).toLocalTime());
  }

  @Test
  void testStepIntoGapIsShiftedForward() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 3, 8, 2, 30, 0, 0, NEW_YORK);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.daily().withCount(3), anchor, 10);

    assertEquals(3, result.size());
    assertEquals(LocalDateTime.of(2025, 3, 9, 3, 30), result.get(1).toLocalDateTime());
    assertEquals(LocalDateTime.of(2025, 3, 10, 2, 30), result.get(2).toLocalDateTime());
  }

  @Test
  void testMonthlyCarriesYear() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 1, 15, 9, 0, 0, 0, NEW_YORK);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.monthly().withCount(14), anchor, 100);

    assertEquals(14, result.size());
    assertEquals(LocalDateTime.of(2026, 2, 15, 9, 0), result.get(13).toLocalDateTime());
    assertStrictlyIncreasing(result);
  }

  @Test
  void testMonthlyStopsOnMissingDay() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 1, 31, 9, 0, 0, 0, ZoneOffset.UTC);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.monthly().withCount(12), anchor, 100);
    assertEquals(List.of(anchor), result);
  }

  @Test
  void testMonthlyIntervalSkipsOverShortMonths() throws TidelineException {
    // Jan 31 + 2 months is Mar 31, + 4 is May 31
    ZonedDateTime anchor = ZonedDateTime.of(2025, 1, 31, 9, 0, 0, 0, ZoneOffset.UTC);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(
            RecurrenceRule.monthly().withInterval(2).withCount(4), anchor, 100);

    assertEquals(4, result.size());
    assertEquals(LocalDateTime.of(2025, 7, 31, 9, 0), result.get(3).toLocalDateTime());
  }

  @Test
  void testYearlyStopsOnMissingLeapDay() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2024, 2, 29, 12, 0, 0, 0, ZoneOffset.UTC);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(RecurrenceRule.yearly().withCount(5), anchor, 100);
    assertEquals(List.of(anchor), result);
  }

  @Test
  void testYearlyInterval() throws TidelineException {
    ZonedDateTime anchor = ZonedDateTime.of(2025, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(
            RecurrenceRule.yearly().withInterval(2).withCount(3), anchor, 100);

    assertEquals(3, result.size());
    assertEquals(2027, result.get(1).getYear());
    assertEquals(2029, result.get(2).getYear());
  }

  @Test
  void testUntilIsInclusive() throws TidelineException {
    List<ZonedDateTime> inclusive =
        RecurrenceEngine.generate(
            RecurrenceRule.daily().withUntil(ANCHOR.plusDays(4)), ANCHOR, 100);
    assertEquals(5, inclusive.size());
    assertEquals(ANCHOR.plusDays(4), inclusive.get(4));

    List<ZonedDateTime> exclusive =
        RecurrenceEngine.generate(
            RecurrenceRule.daily().withUntil(ANCHOR.plusDays(4).minusMinutes(1)), ANCHOR, 100);
    assertEquals(4, exclusive.size());
  }

  @Test
  void testUntilBeforeAnchorYieldsNothing() throws TidelineException {
    List<ZonedDateTime> result =
        RecurrenceEngine.generate(
            RecurrenceRule.daily().withUntil(ANCHOR.minusDays(1)), ANCHOR, 100);
    assertTrue(result.isEmpty());
  }

  @Test
  void testCapBoundsCount() throws TidelineException {
    RecurrenceRule rule = RecurrenceRule.daily().withCount(10);
    assertEquals(3, RecurrenceEngine.generate(rule, ANCHOR, 3).size());
    assertEquals(10, RecurrenceEngine.generate(rule, ANCHOR, 1000).size());
    assertTrue(RecurrenceEngine.generate(rule, ANCHOR, 0).isEmpty());
  }

  @Test
  void testUnboundedRuleStopsAtCap() throws TidelineException {
    assertEquals(1000, RecurrenceEngine.generate(RecurrenceRule.daily(), ANCHOR, 1000).size());
  }

  @Test
  void testNegativeCapRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RecurrenceEngine.generate(RecurrenceRule.daily(), ANCHOR, -1));
  }

  @Test
  void testUnsupportedFrequency() {
    TidelineException e =
        assertThrows(
            TidelineException.class,
            () -> RecurrenceEngine.generate(RecurrenceRule.of(Frequency.HOURLY), ANCHOR, 10));
    assertEquals(ErrorKind.RECURRENCE, e.kind());
  }

  @Test
  void testMalformedRule() {
    assertEquals(
        ErrorKind.RECURRENCE,
        assertThrows(
                TidelineException.class,
                () ->
                    RecurrenceEngine.generate(
                        RecurrenceRule.daily().withInterval(0), ANCHOR, 10))
            .kind());
    assertEquals(
        ErrorKind.RECURRENCE,
        assertThrows(
                TidelineException.class,
                () ->
                    RecurrenceEngine.generate(RecurrenceRule.daily().withCount(-2), ANCHOR, 10))
            .kind());
  }

  @Test
  void testWeekdaysDoNotAffectGeneration() throws TidelineException {
    RecurrenceRule plain = RecurrenceRule.weekly().withCount(4);
    RecurrenceRule withDays = plain.withWeekdays(List.of(Weekday.MONDAY, Weekday.FRIDAY));
    assertEquals(
        RecurrenceEngine.generate(plain, ANCHOR, 10),
        RecurrenceEngine.generate(withDays, ANCHOR, 10));
  }
}
