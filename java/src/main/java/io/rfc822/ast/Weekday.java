package io.rfc822.ast;

import java.util.Map;
import java.util.Optional;

/** Represents a day of the week, as abbreviated in RFC 822 dates. */
public enum Weekday {
  MONDAY(1, "Mon"),
  TUESDAY(2, "Tue"),
  WEDNESDAY(3, "Wed"),
  THURSDAY(4, "Thu"),
  FRIDAY(5, "Fri"),
  SATURDAY(6, "Sat"),
  SUNDAY(7, "Sun");

  private final int isoNumber;
  private final String abbreviation;

  Weekday(int isoNumber, String abbreviation) {
    this.isoNumber = isoNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("Mon", MONDAY),
          Map.entry("Tue", TUESDAY),
          Map.entry("Wed", WEDNESDAY),
          Map.entry("Thu", THURSDAY),
          Map.entry("Fri", FRIDAY),
          Map.entry("Sat", SATURDAY),
          Map.entry("Sun", SUNDAY));

  /**
   * Parses a three-letter day abbreviation. Matching is case sensitive.
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }

  /**
   * Returns the Weekday for an ISO day number.
   *
   * @param isoNumber the ISO day number (Monday=1, Sunday=7)
   * @return the corresponding Weekday
   */
  public static Weekday ofIso(int isoNumber) {
    return values()[isoNumber - 1];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public java.time.DayOfWeek toDayOfWeek() {
    return java.time.DayOfWeek.of(isoNumber);
  }
}
