package io.rfc822;

/** The reason a timestamp was rejected. */
public enum ErrorKind {
  /** The input does not have the shape of an RFC 822 date-time. */
  NO_MATCH("no-match"),
  /** The day, month and year do not name a calendar date. */
  INVALID_DATE("invalid-date"),
  /** The hour, minute or second is out of range. */
  INVALID_TIME("invalid-time");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
