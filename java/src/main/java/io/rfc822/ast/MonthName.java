package io.rfc822.ast;

import java.util.Map;
import java.util.Optional;

/** Represents a month of the year, as abbreviated in RFC 822 dates. */
public enum MonthName {
  JANUARY(1, "Jan"),
  FEBRUARY(2, "Feb"),
  MARCH(3, "Mar"),
  APRIL(4, "Apr"),
  MAY(5, "May"),
  JUNE(6, "Jun"),
  JULY(7, "Jul"),
  AUGUST(8, "Aug"),
  SEPTEMBER(9, "Sep"),
  OCTOBER(10, "Oct"),
  NOVEMBER(11, "Nov"),
  DECEMBER(12, "Dec");

  /** Returned by {@link #numberOf(String)} for an unknown abbreviation. */
  public static final int UNKNOWN = 0;

  private final int monthNumber;
  private final String abbreviation;

  MonthName(int monthNumber, String abbreviation) {
    this.monthNumber = monthNumber;
    this.abbreviation = abbreviation;
  }

  /**
   * Returns the month number (January=1, December=12).
   *
   * @return the month number
   */
  public int number() {
    return monthNumber;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  private static final Map<String, MonthName> PARSE_MAP =
      Map.ofEntries(
          Map.entry("Jan", JANUARY),
          Map.entry("Feb", FEBRUARY),
          Map.entry("Mar", MARCH),
          Map.entry("Apr", APRIL),
          Map.entry("May", MAY),
          Map.entry("Jun", JUNE),
          Map.entry("Jul", JULY),
          Map.entry("Aug", AUGUST),
          Map.entry("Sep", SEPTEMBER),
          Map.entry("Oct", OCTOBER),
          Map.entry("Nov", NOVEMBER),
          Map.entry("Dec", DECEMBER));

  /**
   * Parses a three-letter month abbreviation. Matching is case sensitive.
   *
   * @param s the string to parse
   * @return the month if valid
   */
  public static Optional<MonthName> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }

  /**
   * Returns the month number for an abbreviation, or {@link #UNKNOWN} if it is not one.
   *
   * @param s the abbreviation
   * @return the month number in [1, 12], or 0
   */
  public static int numberOf(String s) {
    return parse(s).map(MonthName::number).orElse(UNKNOWN);
  }

  /**
   * Converts this MonthName to a java.time.Month.
   *
   * @return the corresponding Month
   */
  public java.time.Month toMonth() {
    return java.time.Month.of(monthNumber);
  }
}
