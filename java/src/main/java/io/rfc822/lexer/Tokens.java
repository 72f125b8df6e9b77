package io.rfc822.lexer;

import io.rfc822.Span;
import java.util.Map;
import java.util.Optional;

/**
 * The raw text of each field of a matched timestamp.
 *
 * <p>Optional fields that were absent are empty strings. The day of week is held without its
 * trailing comma and the second without its leading colon.
 *
 * @param dayOfWeek the day of week (e.g., "Tue"), or empty
 * @param day the day of month
 * @param month the month abbreviation
 * @param year the year digits
 * @param hour the hour digits
 * @param minute the minute digits
 * @param second the second digits, or empty
 * @param timeZone the zone abbreviation or signed differential (e.g., "-0500")
 * @param spans the input location of every field that was present
 */
public record Tokens(
    String dayOfWeek,
    String day,
    String month,
    String year,
    String hour,
    String minute,
    String second,
    String timeZone,
    Map<TokenKind, Span> spans) {

  public Tokens {
    spans = Map.copyOf(spans);
  }

  /**
   * Returns where a field was found in the input.
   *
   * @param kind the field
   * @return the span, or empty if the field was absent
   */
  public Optional<Span> span(TokenKind kind) {
    return Optional.ofNullable(spans.get(kind));
  }

  /**
   * Returns the raw text of a field.
   *
   * @param kind the field
   * @return the text, empty if the field was absent
   */
  public String get(TokenKind kind) {
    return switch (kind) {
      case DAY_OF_WEEK -> dayOfWeek;
      case DAY -> day;
      case MONTH -> month;
      case YEAR -> year;
      case HOUR -> hour;
      case MINUTE -> minute;
      case SECOND -> second;
      case TIME_ZONE -> timeZone;
    };
  }
}
