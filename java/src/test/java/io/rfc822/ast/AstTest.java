package io.rfc822.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Month;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for the lookup tables and value types. */
public class AstTest {

  @Test
  void testMonthNames() {
    assertEquals(Optional.of(MonthName.JANUARY), MonthName.parse("Jan"));
    assertEquals(Optional.empty(), MonthName.parse("jan"));
    assertEquals(Optional.empty(), MonthName.parse("January"));
    assertEquals(12, MonthName.numberOf("Dec"));
    assertEquals(MonthName.UNKNOWN, MonthName.numberOf("DEC"));
    for (MonthName m : MonthName.values()) {
      assertEquals(m, MonthName.parse(m.toString()).orElseThrow());
      assertEquals(Month.of(m.number()), m.toMonth());
    }
  }

  @Test
  void testWeekdays() {
    assertEquals(Optional.of(Weekday.SUNDAY), Weekday.parse("Sun"));
    assertEquals(Optional.empty(), Weekday.parse("sun"));
    for (Weekday d : Weekday.values()) {
      assertEquals(d, Weekday.parse(d.toString()).orElseThrow());
      assertEquals(d, Weekday.ofIso(d.number()));
      assertEquals(DayOfWeek.of(d.number()), d.toDayOfWeek());
    }
  }

  @Test
  void testZones() {
    assertEquals(Optional.of(Zone.PDT), Zone.parse("PDT"));
    assertEquals(Optional.empty(), Zone.parse("J"));
    assertEquals(Optional.empty(), Zone.parse("pst"));
    assertEquals(-8, Zone.PST.offsetHours());
    assertEquals(-480, Zone.PST.offsetMinutes());
    assertEquals(720, Zone.Y.offsetMinutes());
    for (Zone z : Zone.values()) {
      assertEquals(z, Zone.parse(z.toString()).orElseThrow());
    }
  }

  @Test
  void testCivilDateTime() {
    CivilDateTime dt = new CivilDateTime(7, 10, 2014, 10, 10, 5, -480);
    assertEquals(Duration.ofHours(-8), dt.differential());
    assertEquals("2014-10-07 10:10:05 (-480 min)", dt.toString());
    assertEquals(2014, dt.toLocalDateTime().getYear());
  }
}
