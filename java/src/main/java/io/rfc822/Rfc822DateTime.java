package io.rfc822;

import io.rfc822.ast.CivilDateTime;
import io.rfc822.ast.Weekday;
import io.rfc822.eval.Evaluator;
import io.rfc822.lexer.Lexer;
import io.rfc822.lexer.Tokens;
import io.rfc822.parser.Parser;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A timestamp in the RFC 822 date-time format, such as {@code "Tue, 07 Oct 2014 10:10:05 PST"}.
 *
 * <p>Four-digit years are accepted as well as the two-digit years of RFC 822, since RSS feeds use
 * them. Two-digit years are taken to be in the 21st century.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Optional<Rfc822DateTime> stamp = Rfc822DateTime.parse("23 Nov 2020 09:34:03 -0500");
 * if (stamp.isPresent()) {
 *     System.out.println("UTC: " + stamp.get().instant());
 * }
 * }</pre>
 *
 * <p>Instances are immutable. Equality and ordering compare {@link #instant()} only, so two stamps
 * written differently for the same moment are equal.
 */
public final class Rfc822DateTime implements Comparable<Rfc822DateTime> {
  private static final Logger log = LoggerFactory.getLogger(Rfc822DateTime.class);

  private final String stamp;
  private final Instant instant;
  private final Tokens tokens;
  private final CivilDateTime dateTime;

  private Rfc822DateTime(String stamp, Instant instant, Tokens tokens, CivilDateTime dateTime) {
    this.stamp = stamp;
    this.instant = instant;
    this.tokens = tokens;
    this.dateTime = dateTime;
  }

  /**
   * Parses an RFC 822 date-time.
   *
   * <p>Input that does not have the right shape and input that names a date or time that does not
   * exist (such as 31 Apr) are both reported as empty.
   *
   * @param stamp the candidate timestamp
   * @return the parsed timestamp, or empty if it is not a valid RFC 822 date-time
   */
  public static Optional<Rfc822DateTime> parse(String stamp) {
    try {
      Tokens tokens = Lexer.tokenize(stamp);
      CivilDateTime dateTime = Parser.parse(stamp, tokens);
      return Optional.of(
          new Rfc822DateTime(stamp, Evaluator.toInstant(dateTime), tokens, dateTime));
    } catch (Rfc822Exception e) {
      if (log.isDebugEnabled()) {
        log.debug("Rejected timestamp ({}):\n{}", e.kind(), e.displayRich());
      }
      return Optional.empty();
    }
  }

  /**
   * Validates an RFC 822 date-time without keeping the result.
   *
   * @param stamp the candidate timestamp
   * @return true if the timestamp parses
   */
  public static boolean validate(String stamp) {
    return parse(stamp).isPresent();
  }

  /**
   * Returns the timestamp exactly as it was given.
   *
   * @return the original text
   */
  public String stamp() {
    return stamp;
  }

  /**
   * Returns the point in time this timestamp names.
   *
   * @return the UTC instant
   */
  public Instant instant() {
    return instant;
  }

  /**
   * Returns the raw text of each field.
   *
   * @return the tokens
   */
  public Tokens tokens() {
    return tokens;
  }

  /**
   * Returns the decoded fields, in the timestamp's own zone.
   *
   * @return the civil date-time
   */
  public CivilDateTime dateTime() {
    return dateTime;
  }

  /**
   * Returns the offset of the timestamp's zone from Universal Time.
   *
   * @return the zone differential
   */
  public Duration timeZoneDifferential() {
    return dateTime.differential();
  }

  /**
   * Returns the day of week written in the timestamp, if there was one.
   *
   * @return the stated weekday, or empty
   */
  public Optional<Weekday> dayOfWeek() {
    return tokens.dayOfWeek().isEmpty() ? Optional.empty() : Weekday.parse(tokens.dayOfWeek());
  }

  /**
   * Returns the day of week on which the local date falls.
   *
   * @return the weekday implied by the date
   */
  public Weekday impliedDayOfWeek() {
    return Evaluator.weekday(dateTime);
  }

  /**
   * Returns whether the stated day of week, if any, agrees with the date. A mismatch does not make
   * the timestamp invalid.
   *
   * @return false only if a day of week was given and it is wrong
   */
  public boolean isDayOfWeekConsistent() {
    return dayOfWeek().map(d -> d == impliedDayOfWeek()).orElse(true);
  }

  /**
   * Checks if this timestamp is strictly earlier than another.
   *
   * @param other the timestamp to compare to
   * @return true if this instant is before the other
   */
  public boolean isBefore(Rfc822DateTime other) {
    return instant.isBefore(other.instant);
  }

  /**
   * Checks if this timestamp is strictly later than another.
   *
   * @param other the timestamp to compare to
   * @return true if this instant is after the other
   */
  public boolean isAfter(Rfc822DateTime other) {
    return instant.isAfter(other.instant);
  }

  @Override
  public int compareTo(Rfc822DateTime other) {
    return instant.compareTo(other.instant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Rfc822DateTime)) {
      return false;
    }
    return instant.equals(((Rfc822DateTime) o).instant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instant);
  }

  /**
   * Returns the original timestamp text.
   *
   * @return the stamp
   */
  @Override
  public String toString() {
    return stamp;
  }
}
