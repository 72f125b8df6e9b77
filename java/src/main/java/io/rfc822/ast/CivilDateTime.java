package io.rfc822.ast;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * A decoded date and time of day, as written in the timestamp.
 *
 * <p>The fields are local to the zone the timestamp names; they are never shifted by the zone
 * differential.
 *
 * @param day the day of month [1-31]
 * @param month the month of year [1-12]
 * @param year the absolute year (two-digit years have 2000 added)
 * @param hour the hour [0-23]
 * @param minute the minute [0-59]
 * @param second the second [0-59]
 * @param timeZoneDifferential the signed offset from Universal Time, in minutes
 */
public record CivilDateTime(
    int day, int month, int year, int hour, int minute, int second, int timeZoneDifferential) {

  /**
   * Returns the zone differential as a duration.
   *
   * @return the offset from Universal Time
   */
  public Duration differential() {
    return Duration.ofMinutes(timeZoneDifferential);
  }

  /**
   * Returns the local date and time these fields name, ignoring the zone.
   *
   * @return the local date-time
   * @throws java.time.DateTimeException if the fields do not form a valid date-time
   */
  public LocalDateTime toLocalDateTime() {
    return LocalDateTime.of(year, month, day, hour, minute, second);
  }

  @Override
  public String toString() {
    return String.format(
        "%04d-%02d-%02d %02d:%02d:%02d (%+d min)",
        year, month, day, hour, minute, second, timeZoneDifferential);
  }
}
