package tokex.parser;

import java.util.Optional;
import java.util.OptionalInt;
import tokex.lexer.TokenType;

/**
 * Bottom-up traversal of a token pattern.
 *
 * <p>{@link PatternParser} reports what it parses through this interface
 * instead of building an explicit tree, so the same parse can build a
 * {@link tokex.tree.PatternNode} tree or compile straight to something else.
 *
 * @param <R> output from traversing the pattern
 */
public interface PatternVisitor<R> {

  /**
   * Empty pattern, matching no tokens.
   */
  R visitEpsilon();

  /**
   * Matches one token by its kind.
   *
   * @param type kind of token
   * @param negated match any token that is not of this kind instead
   */
  R visitTokenClass(TokenType type, boolean negated);

  /**
   * Matches one token by its exact value.
   *
   * @param value text the token must have
   * @param type if present, kind the token must also have
   */
  R visitLiteral(String value, Optional<TokenType> type);

  /**
   * Matches any one token, except for the end of input.
   */
  R visitAny();

  /**
   * Matches a concatenation of two patterns.
   *
   * @param lhs first pattern to match
   * @param rhs second pattern to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches either of two patterns, preferring the left one.
   *
   * @param lhs first pattern to try matching
   * @param rhs second pattern to try matching
   */
  R visitAlternation(R lhs, R rhs);

  /**
   * Matches a pattern zero or more times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  default R visitKleene(R lhs, boolean isLazy) {
    return visitRepetition(lhs, 0, OptionalInt.empty(), isLazy);
  }

  /**
   * Matches a pattern zero or one times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize an empty vs. non-empty match
   */
  default R visitOptional(R lhs, boolean isLazy) {
    return visitRepetition(lhs, 0, OptionalInt.of(1), isLazy);
  }

  /**
   * Matches a pattern one or more times.
   *
   * @param lhs pattern to match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  default R visitPlus(R lhs, boolean isLazy) {
    return visitRepetition(lhs, 1, OptionalInt.empty(), isLazy);
  }

  /**
   * Matches a pattern at least a certain number of times and possibly at most
   * another number of times.
   *
   * @param lhs pattern to match
   * @param atLeast minimum (inclusive) of times the pattern must match
   * @param atMost maximum (inclusive) of time the pattern must match
   * @param isLazy whether to prioritize a shorter vs. longer match
   */
  R visitRepetition(R lhs, int atLeast, OptionalInt atMost, boolean isLazy);

  /**
   * Group, possibly capturing.
   *
   * @param arg body of the group
   * @param groupIndex capture group index, empty for non-capturing groups
   * @param name capture group name, for named groups
   */
  R visitGroup(R arg, OptionalInt groupIndex, Optional<String> name);

  /**
   * Zero-width assertion about the tokens around the current position.
   *
   * @param arg subpattern
   * @param lookaround direction and polarity of the assertion
   */
  R visitLookaround(R arg, Lookaround lookaround);

  /**
   * Matches the same token values as an earlier capture group.
   *
   * @param groupIndex referenced capture group
   * @param depth if present, the nesting depth that must be reached between
   *   the start of the referenced group and the reference
   */
  R visitBackreference(int groupIndex, OptionalInt depth);

  /**
   * Matches a run of tokens delimited by nesting structure.
   *
   * @param region kind of region
   */
  R visitBalanced(BalancedRegion region);
}
