package io.rfc822.eval;

import io.rfc822.ast.CivilDateTime;
import io.rfc822.ast.Weekday;
import java.time.Instant;

/** Computes the point in time that a validated civil date-time names. */
public final class Evaluator {
  private Evaluator() {}

  /**
   * Returns the UTC instant of a civil date-time.
   *
   * <p>The fields are first read as if they were UTC, then the zone differential is subtracted: a
   * zone ahead of UTC reaches any wall-clock time earlier.
   *
   * @param dt a validated civil date-time
   * @return the instant
   */
  public static Instant toInstant(CivilDateTime dt) {
    return Instant.ofEpochSecond(toEpochSecond(dt));
  }

  /**
   * Returns the UTC epoch second of a civil date-time.
   *
   * @param dt a validated civil date-time
   * @return seconds since 1970-01-01T00:00:00Z
   */
  public static long toEpochSecond(CivilDateTime dt) {
    long days = CivilCalendar.daysFromCivil(dt.year(), dt.month(), dt.day());
    long local = ((days * 24 + dt.hour()) * 60 + dt.minute()) * 60 + dt.second();
    return local - dt.timeZoneDifferential() * 60L;
  }

  /**
   * Returns the day of week on which a civil date falls.
   *
   * @param dt a validated civil date-time
   * @return the weekday of its local date
   */
  public static Weekday weekday(CivilDateTime dt) {
    long days = CivilCalendar.daysFromCivil(dt.year(), dt.month(), dt.day());
    return Weekday.ofIso(CivilCalendar.isoWeekdayFromDays(days));
  }
}
