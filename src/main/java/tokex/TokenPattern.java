package tokex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokex.lexer.Token;
import tokex.lexer.TokenType;
import tokex.parser.PatternParser;
import tokex.tree.PatternNode;
import tokex.tree.PatternTreeBuilder;
import tokex.vm.Backtracker;
import tokex.vm.Program;
import tokex.vm.ProgramBuilder;

/**
 * Compiled token pattern.
 *
 * <p>This aspires to have an interface and semantics similar to {@code Pattern}
 * and {@code Matcher} from the JDK's {@code java.util.regex}, except that the
 * input is a list of tokens and every atom of the pattern matches whole
 * tokens. Matching is done by full backtracking, so quantifiers and
 * alternations give back tokens whenever the rest of the pattern needs them.
 *
 * <p>Patterns are immutable and safe to share. Matchers are not.
 *
 * @author Alec Theriault
 */
public final class TokenPattern {

  private static final Logger log = LoggerFactory.getLogger(TokenPattern.class);

  private final String pattern;
  private final PatternNode tree;
  private final Program program;
  private final int groupCount;
  private final Map<String, Integer> namedGroups;

  private TokenPattern(String pattern) throws PatternSyntaxException {
    this.pattern = pattern;

    final var treeBuilder = new PatternTreeBuilder();
    this.tree = PatternParser.parse(treeBuilder, pattern, true);
    this.groupCount = treeBuilder.groupCount() - 1;
    this.namedGroups = Map.copyOf(treeBuilder.groupNames());
    this.program = ProgramBuilder.compile(tree);

    if (log.isDebugEnabled()) {
      log.debug(
        "Compiled token pattern {} ({} groups, {} instructions)",
        pattern,
        groupCount,
        program.instructions().size()
      );
    }
    log.trace("Program for {}:\n{}", pattern, program.listing());
  }

  /**
   * Compiles the given token pattern.
   *
   * @param pattern source of the pattern
   * @return compiled pattern
   * @throws PatternSyntaxException if the pattern is malformed
   */
  public static TokenPattern compile(String pattern) throws PatternSyntaxException {
    return new TokenPattern(pattern);
  }

  /**
   * Returns the text from which the pattern was compiled.
   *
   * @return source of the pattern
   */
  public String pattern() {
    return pattern;
  }

  /**
   * @return parsed form of the pattern
   */
  public PatternNode tree() {
    return tree;
  }

  Program program() {
    return program;
  }

  /**
   * Compute the number of groups in the pattern.
   *
   * @return number of capture groups in the pattern, not counting group 0
   */
  public int groupCount() {
    return groupCount;
  }

  /**
   * @return mapping from group names to group indices
   */
  public Map<String, Integer> namedGroups() {
    return namedGroups;
  }

  /**
   * Create a matcher for matching the current pattern against tokens.
   *
   * @param tokens tokens against which to match
   * @return matcher for the pattern against the tokens
   */
  public TokenMatcher matcher(List<Token> tokens) {
    return new TokenMatcher(this, tokens);
  }

  /**
   * Match the pattern starting exactly at the given index.
   *
   * <p>The match may end anywhere. Earlier tokens are visible to lookbehinds.
   *
   * @param tokens tokens against which to match
   * @param start index at which the match must start
   * @return match, or empty if the pattern does not match there
   */
  public Optional<TokenMatch> tryMatch(List<Token> tokens, int start) {
    return tryMatch(tokens, start, tokens.size());
  }

  /**
   * Match the pattern starting exactly at the given index, without consuming
   * any tokens at or after {@code end}.
   *
   * @param tokens tokens against which to match
   * @param start index at which the match must start
   * @param end index past which the match may not extend
   * @return match, or empty if the pattern does not match there
   */
  public Optional<TokenMatch> tryMatch(List<Token> tokens, int start, int end) {
    if (start < 0 || end > tokens.size() || start > end) {
      return Optional.empty();
    }
    final int[] groups = new int[2 * (groupCount + 1)];
    if (!new Backtracker(program, tokens, 0, end).match(start, -1, groups)) {
      return Optional.empty();
    }
    return Optional.of(new TokenMatch(tokens, groups, namedGroups));
  }

  /**
   * Splits the tokens around matches of this pattern.
   *
   * <p>Pieces are the non-empty runs of tokens between matches, in order. A
   * trailing end-of-input token is not part of any piece. If the pattern
   * never matches, the only piece is all of the tokens.
   *
   * @param tokens tokens to split
   * @return pieces between matches
   */
  public List<List<Token>> split(List<Token> tokens) {
    final int end = withoutEndOfInput(tokens);
    final TokenMatcher matcher = matcher(tokens).region(0, end);
    final List<List<Token>> pieces = new ArrayList<>();
    int pieceStart = 0;
    while (matcher.find()) {
      if (matcher.start() > pieceStart) {
        pieces.add(tokens.subList(pieceStart, matcher.start()));
      }
      pieceStart = Math.max(pieceStart, matcher.end());
    }
    if (pieceStart < end) {
      pieces.add(tokens.subList(pieceStart, end));
    }
    return pieces;
  }

  /**
   * @param tokens tokens to search
   * @return tokens before the first match, or an empty list if there is none
   */
  public List<Token> takeBefore(List<Token> tokens) {
    final TokenMatcher matcher = matcher(tokens);
    return matcher.find() ? tokens.subList(0, matcher.start()) : List.of();
  }

  /**
   * @param tokens tokens to search
   * @return tokens after the first match, or an empty list if there is none
   */
  public List<Token> skipAfter(List<Token> tokens) {
    final TokenMatcher matcher = matcher(tokens);
    return matcher.find() ? tokens.subList(matcher.end(), tokens.size()) : List.of();
  }

  /**
   * Values of the tokens in every match, in order.
   *
   * @param tokens tokens to search
   * @return values of matched tokens
   */
  public Stream<String> values(List<Token> tokens) {
    return matcher(tokens)
      .results()
      .flatMap(match -> match.matchedTokens().stream())
      .map(Token::value);
  }

  /**
   * Predicate which tests whether this pattern is found somewhere in a list
   * of tokens.
   *
   * @return predicate usable for finding a match
   */
  public Predicate<List<Token>> asPredicate() {
    return tokens -> matcher(tokens).find();
  }

  /**
   * Predicate which tests whether this pattern matches all of a list of
   * tokens, a trailing end-of-input token aside.
   *
   * @return predicate usable for matching whole token lists
   */
  public Predicate<List<Token>> asMatchPredicate() {
    return tokens -> matcher(tokens).matches();
  }

  private static int withoutEndOfInput(List<Token> tokens) {
    final int size = tokens.size();
    return size > 0 && tokens.get(size - 1).is(TokenType.END_OF_INPUT) ? size - 1 : size;
  }

  @Override
  public String toString() {
    return "TokenPattern(" + pattern + ")";
  }
}
