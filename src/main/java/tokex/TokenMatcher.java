package tokex;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import tokex.lexer.Token;
import tokex.lexer.TokenType;
import tokex.vm.Backtracker;

/**
 * Stateful matcher over one token list, in the manner of
 * {@link java.util.regex.Matcher}.
 *
 * <p>The group accessors inherited from {@link TokenMatch} describe the last
 * successful {@link #matches}, {@link #lookingAt} or {@link #find}, and throw
 * {@link IllegalStateException} when there is none.
 *
 * @author Alec Theriault
 */
public class TokenMatcher extends TokenMatch {

  private final TokenPattern pattern;

  private int regionStart;
  private int regionEnd;

  /**
   * Token index the next {@link #find} starts searching from.
   */
  private int searchFrom;

  private boolean matched;

  TokenMatcher(TokenPattern pattern, List<Token> tokens) {
    super(tokens, new int[(pattern.groupCount() + 1) * 2], pattern.namedGroups());
    this.pattern = pattern;
    reset();
  }

  @Override
  protected int[] offsets() throws IllegalStateException {
    if (!matched) {
      throw new IllegalStateException("No match found");
    }
    return groups;
  }

  public TokenPattern pattern() {
    return pattern;
  }

  /**
   * @return whether the last match succeeded and ended at the region end
   */
  public boolean hitEnd() {
    return matched && groups[1] == regionEnd;
  }

  public int regionStart() {
    return regionStart;
  }

  public int regionEnd() {
    return regionEnd;
  }

  /**
   * Restrict matching to the tokens in {@code [start, end)} and forget the
   * last match.
   *
   * @return this matcher
   */
  public TokenMatcher region(int start, int end) throws IndexOutOfBoundsException {
    if (start < 0 || start > tokens.size()) {
      throw new IndexOutOfBoundsException("Region start " + start + " outside of [0, " + tokens.size() + "]");
    }
    if (end < start || end > tokens.size()) {
      throw new IndexOutOfBoundsException("Region end " + end + " outside of [" + start + ", " + tokens.size() + "]");
    }
    regionStart = start;
    regionEnd = end;
    searchFrom = start;
    matched = false;
    return this;
  }

  /**
   * Widen the region back to all tokens and forget the last match.
   *
   * @return this matcher
   */
  public TokenMatcher reset() {
    return region(0, tokens.size());
  }

  private boolean attempt(int start, int requiredEnd) {
    Arrays.fill(groups, -1);
    return new Backtracker(pattern.program(), tokens, regionStart, regionEnd)
      .match(start, requiredEnd, groups);
  }

  private boolean settle(boolean found) {
    matched = found;
    if (found) {
      // an empty match is not reported twice at the same index
      searchFrom = groups[1] > groups[0] ? groups[1] : groups[1] + 1;
    }
    return found;
  }

  /**
   * Match the whole region.
   *
   * <p>A trailing end-of-input token in the region may be left unmatched.
   *
   * @return whether the pattern matched
   */
  public boolean matches() {
    matched = false;
    boolean found = attempt(regionStart, regionEnd);
    if (!found && regionEnd > regionStart && tokens.get(regionEnd - 1).is(TokenType.END_OF_INPUT)) {
      found = attempt(regionStart, regionEnd - 1);
    }
    return settle(found);
  }

  /**
   * Match some prefix of the region.
   *
   * @return whether the pattern matched
   */
  public boolean lookingAt() {
    matched = false;
    return settle(attempt(regionStart, -1));
  }

  /**
   * Search for the next match, starting where the previous one ended.
   *
   * @return whether the pattern matched
   */
  public boolean find() {
    matched = false;
    for (int start = searchFrom; start <= regionEnd; start++) {
      if (attempt(start, -1)) {
        return settle(true);
      }
    }
    searchFrom = regionEnd + 1;
    return settle(false);
  }

  /**
   * Snapshots of the remaining matches, found by repeated {@link #find}.
   *
   * <p>The first search runs eagerly; later ones run as the stream is
   * consumed.
   */
  public Stream<TokenMatch> results() {
    return Stream.iterate(nextResult(), Objects::nonNull, previous -> nextResult());
  }

  private TokenMatch nextResult() {
    return find() ? toMatchResult() : null;
  }

  @Override
  public String toString() {
    return "TokenMatcher[pattern=" + pattern.pattern()
      + " region=" + regionStart + "," + regionEnd
      + " lastmatch=" + (matched ? group() : "") + "]";
  }
}
