package io.rfc822.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.rfc822.ast.CivilDateTime;
import io.rfc822.ast.Weekday;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

/** Tests for converting civil date-times to instants. */
public class EvaluatorTest {

  @Test
  void testUtc() {
    CivilDateTime dt = new CivilDateTime(23, 11, 2020, 9, 34, 3, 0);
    assertEquals(Instant.parse("2020-11-23T09:34:03Z"), Evaluator.toInstant(dt));
  }

  @Test
  void testNegativeDifferentialIsLaterInUtc() {
    CivilDateTime dt = new CivilDateTime(23, 11, 2020, 9, 34, 3, -300);
    assertEquals(Instant.parse("2020-11-23T14:34:03Z"), Evaluator.toInstant(dt));
  }

  @Test
  void testPositiveDifferentialCrossesDayBoundary() {
    CivilDateTime dt = new CivilDateTime(1, 1, 2000, 12, 0, 0, 750);
    assertEquals(Instant.parse("1999-12-31T23:30:00Z"), Evaluator.toInstant(dt));
  }

  @Test
  void testBeforeEpoch() {
    CivilDateTime dt = new CivilDateTime(31, 12, 1969, 23, 59, 59, 0);
    assertEquals(-1, Evaluator.toEpochSecond(dt));
  }

  @Test
  void testAgreesWithJavaTime() {
    int[] offsets = {-720, -480, -330, 0, 60, 750};
    for (int year = 1900; year <= 2100; year += 7) {
      for (int month = 1; month <= 12; month++) {
        for (int offset : offsets) {
          CivilDateTime dt = new CivilDateTime(28, month, year, 17, 45, 30, offset);
          long expected =
              LocalDateTime.of(year, month, 28, 17, 45, 30)
                  .toEpochSecond(ZoneOffset.ofTotalSeconds(offset * 60));
          assertEquals(expected, Evaluator.toEpochSecond(dt), dt.toString());
        }
      }
    }
  }

  @Test
  void testWeekday() {
    assertEquals(Weekday.THURSDAY, Evaluator.weekday(new CivilDateTime(1, 1, 1970, 0, 0, 0, 0)));
    assertEquals(
        Weekday.TUESDAY, Evaluator.weekday(new CivilDateTime(7, 10, 2014, 10, 10, 5, -480)));
    assertEquals(
        Weekday.SATURDAY, Evaluator.weekday(new CivilDateTime(29, 2, 2020, 23, 0, 0, 720)));
  }
}
