package io.rfc822.ast;

import java.util.Map;
import java.util.Optional;

/**
 * The named time zones of RFC 822: Universal Time, the North American zones and the military
 * single-letter zones that the grammar admits.
 */
public enum Zone {
  UT("UT", 0),
  GMT("GMT", 0),
  EST("EST", -5),
  EDT("EDT", -4),
  CST("CST", -6),
  CDT("CDT", -5),
  MST("MST", -7),
  MDT("MDT", -6),
  PST("PST", -8),
  PDT("PDT", -7),
  Z("Z", 0),
  A("A", -1),
  M("M", -12),
  N("N", 1),
  Y("Y", 12);

  private final String abbreviation;
  private final int offsetHours;

  Zone(String abbreviation, int offsetHours) {
    this.abbreviation = abbreviation;
    this.offsetHours = offsetHours;
  }

  /**
   * Returns the offset from Universal Time in whole hours.
   *
   * @return the offset in hours
   */
  public int offsetHours() {
    return offsetHours;
  }

  /**
   * Returns the offset from Universal Time in minutes.
   *
   * @return the offset in minutes
   */
  public int offsetMinutes() {
    return offsetHours * 60;
  }

  @Override
  public String toString() {
    return abbreviation;
  }

  private static final Map<String, Zone> PARSE_MAP =
      Map.ofEntries(
          Map.entry("UT", UT),
          Map.entry("GMT", GMT),
          Map.entry("EST", EST),
          Map.entry("EDT", EDT),
          Map.entry("CST", CST),
          Map.entry("CDT", CDT),
          Map.entry("MST", MST),
          Map.entry("MDT", MDT),
          Map.entry("PST", PST),
          Map.entry("PDT", PDT),
          Map.entry("Z", Z),
          Map.entry("A", A),
          Map.entry("M", M),
          Map.entry("N", N),
          Map.entry("Y", Y));

  /**
   * Parses a zone abbreviation. Matching is case sensitive.
   *
   * @param s the string to parse
   * @return the zone if valid
   */
  public static Optional<Zone> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s));
  }
}
