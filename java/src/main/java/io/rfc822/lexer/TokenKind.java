package io.rfc822.lexer;

/** The grammatical fields of an RFC 822 date-time. */
public enum TokenKind {
  /** The optional day of week (e.g., "Tue"). */
  DAY_OF_WEEK("dow"),
  /** The day of month, one or two digits. */
  DAY("day"),
  /** The three-letter month abbreviation. */
  MONTH("month"),
  /** The year, two to four digits. */
  YEAR("year"),
  /** The two-digit hour. */
  HOUR("hour"),
  /** The two-digit minute. */
  MINUTE("minute"),
  /** The optional two-digit second. */
  SECOND("second"),
  /** The zone, either a named abbreviation or a signed four-digit differential. */
  TIME_ZONE("zone");

  private final String group;

  TokenKind(String group) {
    this.group = group;
  }

  /**
   * Returns the name of the capture group that matches this field.
   *
   * @return the group name
   */
  public String group() {
    return group;
  }
}
