package io.rfc822.parser;

import io.rfc822.Rfc822Exception;
import io.rfc822.Span;
import io.rfc822.ast.CivilDateTime;
import io.rfc822.ast.MonthName;
import io.rfc822.ast.Zone;
import io.rfc822.eval.CivilCalendar;
import io.rfc822.lexer.Lexer;
import io.rfc822.lexer.TokenKind;
import io.rfc822.lexer.Tokens;
import java.util.Locale;

/** Decodes the raw fields of a matched timestamp into validated numbers. */
public final class Parser {
  private final String input;
  private final Tokens tokens;

  private Parser(String input, Tokens tokens) {
    this.input = input;
    this.tokens = tokens;
  }

  /**
   * Matches, decodes and validates a timestamp.
   *
   * @param input the candidate timestamp
   * @return the decoded fields
   * @throws Rfc822Exception if the input does not match the grammar or names no real date-time
   */
  public static CivilDateTime parse(String input) throws Rfc822Exception {
    return parse(input, Lexer.tokenize(input));
  }

  /**
   * Decodes and validates fields already extracted by {@link Lexer#tokenize(String)}.
   *
   * @param input the timestamp the tokens were taken from
   * @param tokens the raw fields
   * @return the decoded fields
   * @throws Rfc822Exception if the fields name no real date-time
   */
  public static CivilDateTime parse(String input, Tokens tokens) throws Rfc822Exception {
    Parser p = new Parser(input, tokens);
    CivilDateTime dt = decode(tokens);
    p.validate(dt);
    return dt;
  }

  /**
   * Converts raw fields to numbers without checking their ranges.
   *
   * <p>An unknown month decodes to 0 and an unknown zone to a zero differential. Neither can come
   * out of the lexer.
   *
   * @param tokens the raw fields
   * @return the decoded fields
   */
  public static CivilDateTime decode(Tokens tokens) {
    int year = Integer.parseInt(tokens.year());
    if (year < 100) {
      year += 2000;
    }
    int second = tokens.second().isEmpty() ? 0 : Integer.parseInt(tokens.second());

    return new CivilDateTime(
        Integer.parseInt(tokens.day()),
        MonthName.numberOf(tokens.month()),
        year,
        Integer.parseInt(tokens.hour()),
        Integer.parseInt(tokens.minute()),
        second,
        parseTimeZone(tokens.timeZone()));
  }

  /**
   * Returns the offset from Universal Time, in minutes, for a zone field.
   *
   * @param zone a zone abbreviation or a signed HHMM differential
   * @return the offset in minutes
   */
  public static int parseTimeZone(String zone) {
    if (!zone.isEmpty() && (zone.charAt(0) == '+' || zone.charAt(0) == '-')) {
      return parseLocalDifferential(zone);
    }
    return Zone.parse(zone).map(Zone::offsetMinutes).orElse(0);
  }

  /**
   * Converts a signed HHMM differential (e.g., "-0530") to minutes. The sign covers both hours and
   * minutes.
   *
   * @param differential the differential, sign included
   * @return the offset in minutes
   */
  public static int parseLocalDifferential(String differential) {
    int hhmm = Integer.parseInt(differential.substring(1));
    int minutes = (hhmm / 100) * 60 + hhmm % 100;
    return differential.charAt(0) == '-' ? -minutes : minutes;
  }

  private void validate(CivilDateTime dt) throws Rfc822Exception {
    if (dt.month() < 1 || dt.month() > 12) {
      throw Rfc822Exception.invalidDate(
          "unknown month '" + tokens.month() + "'", span(TokenKind.MONTH), input);
    }
    if (!CivilCalendar.isValidDate(dt.year(), dt.month(), dt.day())) {
      throw Rfc822Exception.invalidDate(
          "day " + dt.day() + " does not exist in " + tokens.month() + " " + dt.year(),
          span(TokenKind.DAY),
          input);
    }
    if (!CivilCalendar.isValidTime(dt.hour(), dt.minute(), dt.second())) {
      TokenKind field =
          dt.hour() > 23 ? TokenKind.HOUR : dt.minute() > 59 ? TokenKind.MINUTE : TokenKind.SECOND;
      throw Rfc822Exception.invalidTime(
          field.name().toLowerCase(Locale.ROOT) + " '" + tokens.get(field) + "' is out of range",
          span(field),
          input);
    }
  }

  private Span span(TokenKind kind) {
    return tokens.span(kind).orElse(null);
  }
}
