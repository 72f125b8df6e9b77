package io.rfc822;

/**
 * Represents a range of character positions in the input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record Span(int start, int end) {
  /**
   * Returns the length of this span.
   *
   * @return the number of characters covered by this span
   */
  public int length() {
    return Math.max(1, end - start);
  }

  /**
   * Returns the text covered by this span.
   *
   * @param input the string this span was taken from
   * @return the covered substring
   */
  public String slice(String input) {
    return input.substring(start, end);
  }
}
