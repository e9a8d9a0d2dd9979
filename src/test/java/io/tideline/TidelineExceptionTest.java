package io.tideline;

import static org.junit.jupiter.api.Assertions.*;

import io.tideline.zone.ZonedClock;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

public class TidelineExceptionTest {
  @Test
  void testKindsAndInput() {
    assertEquals(ErrorKind.TIME_PARSE, TidelineException.timeParse("bad", "x").kind());
    assertEquals(ErrorKind.VALIDATION, TidelineException.validation("bad").kind());
    assertEquals(ErrorKind.RECURRENCE, TidelineException.recurrence("bad").kind());
    assertEquals(ErrorKind.CODEC, TidelineException.codec("bad", null).kind());
    assertEquals(
        ErrorKind.INVALID_LOCAL_TIME, TidelineException.invalidLocalTime("bad", "x").kind());

    assertEquals("x", TidelineException.timeParse("bad", "x").input().orElseThrow());
    assertTrue(TidelineException.validation("bad").input().isEmpty());
  }

  @Test
  void testInvalidTimeZoneKeepsCause() {
    TidelineException e =
        assertThrows(TidelineException.class, () -> ZonedClock.zone("Mars/Olympus_Mons"));
    assertEquals(ErrorKind.INVALID_TIME_ZONE, e.kind());
    assertEquals("Mars/Olympus_Mons", e.input().orElseThrow());
    assertNotNull(e.getCause());
  }

  @Test
  void testDisplayRich() {
    TidelineException parse =
        TidelineException.timeParse("Invalid date-time", "2025-13-01 10:00:00");
    assertEquals(
        "error[time_parse]: Invalid date-time\n  2025-13-01 10:00:00", parse.displayRich());

    TidelineException validation = TidelineException.validation("Event title is required");
    assertEquals("error[validation]: Event title is required", validation.displayRich());
  }

  @Test
  void testCodecCause() {
    IllegalStateException cause = new IllegalStateException("boom");
    TidelineException e = TidelineException.codec("Failed", cause);
    assertSame(cause, e.getCause());
    assertEquals("Failed", e.getMessage());
  }

  @Test
  void testErrorKindValues() {
    assertEquals("invalid_time_zone", ErrorKind.INVALID_TIME_ZONE.value());
    assertEquals("codec", ErrorKind.CODEC.toString());
  }

  @Test
  void testValidZoneDoesNotThrow() throws TidelineException {
    assertEquals(ZoneId.of("Europe/Paris"), ZonedClock.zone("Europe/Paris"));
  }
}
