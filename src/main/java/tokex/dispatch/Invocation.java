package tokex.dispatch;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import tokex.Capture;
import tokex.TokenMatch;
import tokex.lexer.Token;
import tokex.lexer.TokenType;
import tokex.parser.BalancedRegion;

/**
 * What a handler sees when its registration wins at some position.
 *
 * <p>Besides the match itself, this gives access to the stores of the
 * traversal, lets the handler start nested traversals over parts of the
 * token stream, and lets it fast-forward the traversal past tokens it has
 * already dealt with.
 */
public final class Invocation {

  private final Traversal traversal;
  private final Registration registration;
  private final TokenMatch match;
  private final int index;
  private final int rangeEnd;

  private int skipTarget = -1;

  Invocation(Traversal traversal, Registration registration, TokenMatch match, int index, int rangeEnd) {
    this.traversal = traversal;
    this.registration = registration;
    this.match = match;
    this.index = index;
    this.rangeEnd = rangeEnd;
  }

  public TokenMatch match() {
    return match;
  }

  /**
   * @param groupIndex index of the capture group
   * @return the capture, or empty if the group did not participate
   */
  public Optional<Capture> capture(int groupIndex) {
    return match.capture(groupIndex);
  }

  /**
   * @param name name of the capture group
   * @return the capture, or empty if the group did not participate
   */
  public Optional<Capture> capture(String name) {
    return match.capture(name);
  }

  public Capture fullMatch() {
    return match.fullMatch();
  }

  /**
   * @return every token of the traversal, not just the matched ones
   */
  public List<Token> tokens() {
    return traversal.tokens();
  }

  /**
   * @return index at which the match starts
   */
  public int index() {
    return index;
  }

  public Registration registration() {
    return registration;
  }

  public Traversal traversal() {
    return traversal;
  }

  public ContextStore context() {
    return traversal.context();
  }

  public ResultStore results() {
    return traversal.results();
  }

  public TokenEdits edits() {
    return traversal.edits();
  }

  /**
   * @return names of the registrations running nested traversals around this
   *   one, innermost first
   */
  public List<String> callers() {
    return traversal.callers();
  }

  /**
   * Traverse the matched tokens with the named registrations.
   *
   * @param names registrations to dispatch to
   */
  public void traverse(String... names) {
    traverse(match.start(), match.end(), names);
  }

  /**
   * Traverse the tokens of a capture with the named registrations.
   *
   * @param capture tokens to traverse
   * @param names registrations to dispatch to
   */
  public void traverse(Capture capture, String... names) {
    traverse(capture.start(), capture.end(), names);
  }

  /**
   * Traverse a range of tokens with the named registrations.
   *
   * <p>While the nested traversal runs, this registration is the innermost
   * caller, so registrations restricted to it become eligible.
   *
   * @param from first index to traverse
   * @param to index after the last one to traverse
   * @param names registrations to dispatch to
   */
  public void traverse(int from, int to, String... names) {
    if (from < 0 || to > traversal.tokens().size() || from > to) {
      throw new IndexOutOfBoundsException("Invalid traversal range [" + from + ", " + to + ")");
    }
    traversal.nested(registration, Arrays.asList(names), from, to);
  }

  /**
   * Resume the traversal after the given token.
   *
   * @param token token to skip past, looked up from the match start on
   * @return whether the token was found
   */
  public boolean skipTo(Token token) {
    final List<Token> tokens = traversal.tokens();
    for (int i = index; i < tokens.size(); i++) {
      if (tokens.get(i).equals(token)) {
        skipTarget = i + 1;
        return true;
      }
    }
    return false;
  }

  /**
   * Resume the traversal at the given index.
   *
   * <p>Indices at or before the match start have no effect.
   */
  public void skipToIndex(int target) {
    if (target < 0 || target > traversal.tokens().size()) {
      throw new IndexOutOfBoundsException("No token " + target);
    }
    skipTarget = target;
  }

  /**
   * Resume the traversal after the first balanced region opening at or after
   * the match start. If the region never closes, the rest of the range is
   * skipped.
   *
   * @param region bracket pair or {@link BalancedRegion#ELEMENT}
   * @return whether a region was found
   */
  public boolean skipBalanced(BalancedRegion region) {
    final int open = findOpening(region);
    if (open < 0) {
      return false;
    }
    final int end = region.scan(traversal.tokens(), open, rangeEnd);
    skipTarget = end < 0 ? rangeEnd : end;
    return true;
  }

  /**
   * Tokens strictly inside the first balanced region opening at or after the
   * match start.
   *
   * @param region bracket pair or {@link BalancedRegion#ELEMENT}
   * @return inner tokens, or an empty list if there is no closed region
   */
  public List<Token> extractBalanced(BalancedRegion region) {
    final int open = findOpening(region);
    if (open < 0) {
      return List.of();
    }
    final int end = region.scan(traversal.tokens(), open, rangeEnd);
    return end < 0 ? List.of() : traversal.tokens().subList(open + 1, end - 1);
  }

  private int findOpening(BalancedRegion region) {
    final Predicate<Token> opens;
    if (region.isBracketPair()) {
      opens = region::isOpen;
    } else if (region == BalancedRegion.ELEMENT) {
      opens = token -> token.is(TokenType.TAG_OPEN);
    } else {
      throw new IllegalArgumentException(region + " does not start with an opening token");
    }

    final List<Token> tokens = traversal.tokens();
    for (int i = index; i < rangeEnd; i++) {
      if (opens.test(tokens.get(i))) {
        return i;
      }
    }
    return -1;
  }

  int skipTarget() {
    return skipTarget;
  }
}
