package io.rfc822.eval;

/**
 * Proleptic Gregorian calendar arithmetic.
 *
 * <p>Day counts are relative to 1970-01-01 and use the closed-form era algorithm described at
 * http://howardhinnant.github.io/date_algorithms.html, so no calendar library is involved. An era
 * is 400 years, or 146097 days.
 */
public final class CivilCalendar {
  private static final int DAYS_PER_ERA = 146097;

  /** Days from 0000-03-01 to 1970-01-01. */
  private static final int EPOCH_OFFSET = 719468;

  private CivilCalendar() {}

  /**
   * Returns whether a year is a leap year.
   *
   * @param year the year
   * @return true if February has 29 days
   */
  public static boolean isLeapYear(int year) {
    return year % 4 == 0 && (year % 100 != 0 || year % 400 == 0);
  }

  /**
   * Returns whether day, month and year name a date that exists.
   *
   * @param year the year
   * @param month the month [1-12]
   * @param day the day of month
   * @return true if the date exists
   */
  public static boolean isValidDate(int year, int month, int day) {
    if (day < 1 || day > 31 || month < 1 || month > 12) {
      return false;
    }

    int febDays = isLeapYear(year) ? 29 : 28;
    if (day <= febDays) {
      return true;
    }
    if (day == 31) {
      return month != 2 && month != 4 && month != 6 && month != 9 && month != 11;
    }
    // 29 or 30
    return month != 2;
  }

  /**
   * Returns whether hour, minute and second are in range. Leap seconds are not accepted.
   *
   * @param hour the hour
   * @param minute the minute
   * @param second the second
   * @return true if the time of day exists
   */
  public static boolean isValidTime(int hour, int minute, int second) {
    return hour >= 0 && hour <= 23 && minute >= 0 && minute <= 59 && second >= 0 && second <= 59;
  }

  /**
   * Returns the number of days from 1970-01-01 to a date. Dates before the epoch give negative
   * counts.
   *
   * @param year the year
   * @param month the month [1-12]
   * @param day the day of month, valid for the month
   * @return the day count
   */
  public static long daysFromCivil(long year, int month, int day) {
    // March-based year, so the leap day falls at the end
    long y = month <= 2 ? year - 1 : year;
    long era = Math.floorDiv(y, 400);
    long yoe = y - era * 400; // [0, 399]
    long doy = (153 * (month + (month > 2 ? -3 : 9)) + 2) / 5 + day - 1; // [0, 365]
    long doe = yoe * 365 + yoe / 4 - yoe / 100 + doy; // [0, 146096]
    return era * DAYS_PER_ERA + doe - EPOCH_OFFSET;
  }

  /**
   * Returns the ISO day number (Monday=1, Sunday=7) of a day count from 1970-01-01.
   *
   * @param days the day count
   * @return the ISO day number
   */
  public static int isoWeekdayFromDays(long days) {
    // 1970-01-01 was a Thursday
    return (int) Math.floorMod(days + 3, 7L) + 1;
  }
}
