package tokex;

import java.util.StringJoiner;

/**
 * One case of a pattern file: a pattern, the source text its tokens come
 * from, and the expected outcome of the first search.
 *
 * @param pattern token pattern
 * @param source source text, lexed with the default options
 * @param expected expected outcome, or a line starting with {@code error}
 * @param resource resource the case was read from
 * @param line line of the pattern in that resource
 */
record PatternCase(String pattern, String source, String expected, String resource, int line) {

  boolean expectsError() {
    return expected.startsWith("error");
  }

  /**
   * Render the outcome of a search the way pattern files spell it.
   *
   * <p>That is {@code found}, then the matched text (only on success), the
   * number of capture groups, and the text of every group that took part in
   * the match. Text is the token values concatenated.
   */
  static String outcome(boolean found, TokenMatcher matcher) {
    final var joiner = new StringJoiner(" ");
    joiner.add(Boolean.toString(found));
    if (!found) {
      return joiner.add(Integer.toString(matcher.groupCount())).toString();
    }
    joiner.add(matcher.group());
    joiner.add(Integer.toString(matcher.groupCount()));
    for (Capture capture : matcher.captures()) {
      if (capture.index() > 0) {
        joiner.add(capture.value());
      }
    }
    return joiner.toString();
  }

  @Override
  public String toString() {
    return "/" + pattern + "/ on '" + source + "' (" + resource + ":" + line + ")";
  }
}
