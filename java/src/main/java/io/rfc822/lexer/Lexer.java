package io.rfc822.lexer;

import io.rfc822.Rfc822Exception;
import io.rfc822.Span;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an RFC 822 date-time into its fields.
 *
 * <p>The accepted grammar is RFC 822 section 5.1, except that the year may have two to four
 * digits:
 *
 * <pre>
 * date-time = [ day "," ] date time
 * date      = 1*2DIGIT month 2*4DIGIT
 * time      = 2DIGIT ":" 2DIGIT [ ":" 2DIGIT ] zone
 * zone      = "UT" / "GMT" / "EST" / "EDT" / "CST" / "CDT" / "MST" / "MDT" / "PST" / "PDT"
 *           / "Z" / "A" / "M" / "N" / "Y" / ( ("+" / "-") 4DIGIT )
 * </pre>
 *
 * <p>Only the shape of each field is checked here; a day of "99" is lexically fine.
 */
public final class Lexer {
  private static final Pattern DATE_TIME =
      Pattern.compile(
          "(?<dow>(?:Mon|Tue|Wed|Thu|Fri|Sat|Sun),)?\\s*"
              + "(?<day>\\d{1,2})\\s+"
              + "(?<month>Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+"
              + "(?<year>\\d{2,4})\\s+"
              + "(?<hour>\\d{2}):(?<minute>\\d{2})(?<second>:\\d{2})?\\s+"
              + "(?<zone>UT|GMT|EST|EDT|CST|CDT|MST|MDT|PST|PDT|Z|A|M|N|Y|[+-]\\d{4})");

  private Lexer() {}

  /**
   * Matches the whole input against the date-time grammar and extracts each field.
   *
   * @param input the candidate timestamp
   * @return the raw fields
   * @throws Rfc822Exception if the input does not match the grammar
   */
  public static Tokens tokenize(String input) throws Rfc822Exception {
    if (input == null) {
      throw Rfc822Exception.noMatch(null);
    }

    Matcher m = DATE_TIME.matcher(input);
    if (!m.matches()) {
      throw Rfc822Exception.noMatch(input);
    }

    Map<TokenKind, Span> spans = new EnumMap<>(TokenKind.class);
    for (TokenKind kind : TokenKind.values()) {
      if (m.start(kind.group()) >= 0) {
        spans.put(kind, new Span(m.start(kind.group()), m.end(kind.group())));
      }
    }

    // Drop the separators that are part of the optional groups
    Span dow = spans.get(TokenKind.DAY_OF_WEEK);
    if (dow != null) {
      dow = new Span(dow.start(), dow.end() - 1);
      spans.put(TokenKind.DAY_OF_WEEK, dow);
    }
    Span second = spans.get(TokenKind.SECOND);
    if (second != null) {
      second = new Span(second.start() + 1, second.end());
      spans.put(TokenKind.SECOND, second);
    }

    return new Tokens(
        dow != null ? dow.slice(input) : "",
        m.group("day"),
        m.group("month"),
        m.group("year"),
        m.group("hour"),
        m.group("minute"),
        second != null ? second.slice(input) : "",
        m.group("zone"),
        spans);
  }

  /**
   * Tests whether the input has the shape of an RFC 822 date-time.
   *
   * @param input the candidate timestamp
   * @return true if the grammar matches
   */
  public static boolean matches(String input) {
    return input != null && DATE_TIME.matcher(input).matches();
  }
}
