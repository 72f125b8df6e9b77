package io.rfc822;

import java.util.Optional;

/**
 * Exception thrown by the matching and decoding stages when a timestamp is rejected.
 *
 * <p>{@link Rfc822DateTime#parse(String)} never lets this escape; it reports every rejection as an
 * empty result.
 */
public final class Rfc822Exception extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The span of the offending field, if one can be pinned down. */
  private final Span span;

  /** The original input string. */
  private final String input;

  private Rfc822Exception(ErrorKind kind, String message, Span span, String input) {
    super(message);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates an error for input that does not match the date-time grammar.
   *
   * @param input the original input string
   * @return a new Rfc822Exception for a grammar mismatch
   */
  public static Rfc822Exception noMatch(String input) {
    return new Rfc822Exception(
        ErrorKind.NO_MATCH, "not an RFC 822 date-time", null, input);
  }

  /**
   * Creates an error for a well-formed date that does not exist in the calendar.
   *
   * @param message the error message
   * @param span the location of the offending field
   * @param input the original input string
   * @return a new Rfc822Exception for an invalid date
   */
  public static Rfc822Exception invalidDate(String message, Span span, String input) {
    return new Rfc822Exception(ErrorKind.INVALID_DATE, message, span, input);
  }

  /**
   * Creates an error for a well-formed time of day with an out-of-range field.
   *
   * @param message the error message
   * @param span the location of the offending field
   * @param input the original input string
   * @return a new Rfc822Exception for an invalid time
   */
  public static Rfc822Exception invalidTime(String message, Span span, String input) {
    return new Rfc822Exception(ErrorKind.INVALID_TIME, message, span, input);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span of the offending field, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending field.
   *
   * <p>For errors with span and input, produces output like:
   *
   * <pre>
   * error: day 31 does not exist in month 4
   *   31 Apr 2020 10:00:00 GMT
   *   ^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    StringBuilder sb = new StringBuilder();
    sb.append("error: ").append(getMessage());
    if (input != null) {
      sb.append("\n  ").append(input);
      if (span != null) {
        sb.append("\n");
        sb.append(" ".repeat(span.start() + 2));
        sb.append("^".repeat(span.length()));
      }
    }
    return sb.toString();
  }
}
