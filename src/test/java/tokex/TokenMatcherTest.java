package tokex;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import tokex.lexer.Lexer;
import tokex.lexer.Token;

public class TokenMatcherTest {

  private static TokenMatcher matcher(String pattern, String source) {
    return TokenPattern.compile(pattern).matcher(Lexer.tokenize(source));
  }

  private static List<String> spans(TokenMatcher matcher) {
    return matcher
      .results()
      .map(match -> match.start() + "-" + match.end())
      .collect(Collectors.toList());
  }

  @Test
  public void matchesMayLeaveEndOfInput() {
    assertTrue(matcher("\\i '=' \\n ';'", "a = 1;").matches());
    assertTrue(matcher(".* \\e", "a = 1;").matches());
    assertFalse(matcher("\\i '=' \\n", "a = 1;").matches());
  }

  @Test
  public void lookingAtMatchesPrefix() {
    final var matcher = matcher("\\i '='", "a = 1;");
    assertTrue(matcher.lookingAt());
    assertEquals(0, matcher.start());
    assertEquals(2, matcher.end());
    assertFalse(matcher("'='", "a = 1;").lookingAt());
  }

  @Test
  public void findWalksThroughMatches() {
    final var matcher = matcher("(\\i) '=' (\\n)", "a = 1; b = 2; c;");

    assertTrue(matcher.find());
    assertEquals("a", matcher.group(1));
    assertEquals("1", matcher.group(2));

    assertTrue(matcher.find());
    assertEquals("b", matcher.group(1));
    assertEquals(4, matcher.start());
    assertEquals(7, matcher.end());

    assertFalse(matcher.find());
    assertThrows(IllegalStateException.class, matcher::start);
    assertThrows(IllegalStateException.class, () -> matcher.capture(1));
  }

  @Test
  public void namedGroupsThroughMatcher() {
    final var matcher = matcher("(?<key>\\i) ':' (?<value>\\n | \\s)", "({ a: 1, b: 'x' })");
    final List<String> pairs = matcher
      .results()
      .map(match -> match.group("key") + "=" + match.group("value"))
      .collect(Collectors.toList());
    assertEquals(List.of("a=1", "b='x'"), pairs);
  }

  @Test
  public void regionLimitsMatching() {
    final List<Token> tokens = Lexer.tokenize("a b c d e");
    final var matcher = TokenPattern.compile("\\i").matcher(tokens).region(1, 3);

    assertEquals(1, matcher.regionStart());
    assertEquals(3, matcher.regionEnd());
    assertEquals(List.of("1-2", "2-3"), spans(matcher));

    matcher.reset();
    assertEquals(0, matcher.regionStart());
    assertEquals(tokens.size(), matcher.regionEnd());
    assertEquals(5, matcher.results().count());

    assertThrows(IndexOutOfBoundsException.class, () -> matcher.region(-1, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> matcher.region(3, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> matcher.region(0, tokens.size() + 1));
  }

  @Test
  public void matchesWholeRegion() {
    final var matcher = matcher("\\i+", "a b c 1");
    assertFalse(matcher.matches());
    assertTrue(matcher.region(1, 3).matches());
    assertTrue(matcher.hitEnd());
  }

  @Test
  public void emptyMatchesAdvance() {
    assertEquals(List.of("0-0", "1-2", "2-2", "3-3", "4-4"), spans(matcher("\\n*", "a 1 b")));
  }

  @Test
  public void snapshotsAreIndependentOfMatcher() {
    final var matcher = matcher("\\n", "1 2");
    assertTrue(matcher.find());
    final TokenMatch first = matcher.toMatchResult();
    assertTrue(matcher.find());

    assertEquals(0, first.start());
    assertEquals("1", first.group());
    assertEquals(1, matcher.start());
  }

  @Test
  public void snapshotRequiresMatch() {
    final var matcher = matcher("\\n", "a");
    assertFalse(matcher.find());
    assertThrows(IllegalStateException.class, matcher::toMatchResult);
    assertFalse(matcher.hitEnd());
  }

  @Test
  public void describesItself() {
    final var matcher = matcher("\\i", "x");
    assertTrue(matcher.find());
    assertEquals("TokenMatcher[pattern=\\i region=0,2 lastmatch=x]", matcher.toString());
  }
}
