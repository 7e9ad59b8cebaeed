package tokex.parser;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import tokex.lexer.Token;
import tokex.lexer.TokenType;

/**
 * Regions of tokens recognized by their nesting structure rather than token
 * by token, written {@code \B} followed by a letter.
 *
 * <p>Bracket pairs match from an opening token through its matching closing
 * token, brackets included. Regions that fail to close are ordinary match
 * failures.
 */
public enum BalancedRegion {

  /**
   * {@code ( ... )}
   */
  PARENTHESES("(", ")", EnumSet.of(TokenType.PUNCTUATION)),

  /**
   * <code>{ ... }</code>, also markup expression braces
   */
  BRACES("{", "}", EnumSet.of(TokenType.PUNCTUATION, TokenType.EXPRESSION_START, TokenType.EXPRESSION_END)),

  /**
   * {@code [ ... ]}, also tuple brackets
   */
  BRACKETS("[", "]", EnumSet.of(TokenType.PUNCTUATION, TokenType.TUPLE_OPEN, TokenType.TUPLE_CLOSE)),

  /**
   * {@code < ... >} as generic brackets or as plain operators
   */
  ANGLES("<", ">", EnumSet.of(TokenType.OPERATOR, TokenType.GENERIC_OPEN, TokenType.GENERIC_CLOSE)),

  /**
   * Non-empty run of tokens up to (not including) a comma at the same
   * nesting level, or the bracket closing the enclosing level.
   */
  UNTIL_COMMA {
    @Override
    public int scan(List<Token> tokens, int index, int end) {
      return scanUntil(tokens, index, end, ",");
    }
  },

  /**
   * Non-empty run of tokens up to (not including) a semicolon at the same
   * nesting level, or the bracket closing the enclosing level.
   */
  UNTIL_SEMICOLON {
    @Override
    public int scan(List<Token> tokens, int index, int end) {
      return scanUntil(tokens, index, end, ";");
    }
  },

  /**
   * One complete markup element, from its tag open through its self-close
   * or the tag end of its closing tag.
   */
  ELEMENT {
    @Override
    public int scan(List<Token> tokens, int index, int end) {
      if (index >= end || !tokens.get(index).is(TokenType.TAG_OPEN)) {
        return -1;
      }
      final var nesting = new Nesting();
      for (int i = index; i < end; i++) {
        final Token token = tokens.get(i);
        if (token.is(TokenType.END_OF_INPUT)) {
          break;
        }
        nesting.accept(token);
        if (nesting.depth() == 0) {
          return i + 1;
        }
      }
      return -1;
    }
  },

  /**
   * Possibly empty content of a markup element, up to (not including) the
   * closing tag that ends the enclosing element. Nested elements and
   * expressions must be complete.
   */
  CONTENT {
    @Override
    public int scan(List<Token> tokens, int index, int end) {
      final var nesting = new Nesting();
      for (int i = index; i < end; i++) {
        final Token token = tokens.get(i);
        if (token.is(TokenType.END_OF_INPUT)) {
          break;
        } else if (token.is(TokenType.TAG_CLOSE) && nesting.depth() == 0) {
          return i;
        }
        nesting.accept(token);
        if (nesting.depth() < 0) {
          break;
        }
      }
      return -1;
    }
  };

  private final String open;
  private final String close;
  private final Set<TokenType> kinds;

  BalancedRegion(String open, String close, Set<TokenType> kinds) {
    this.open = open;
    this.close = close;
    this.kinds = kinds;
  }

  BalancedRegion() {
    this(null, null, Set.of());
  }

  /**
   * Mapping from the letter following {@code \B} to the region.
   */
  public static final Map<Character, BalancedRegion> CHARACTERS = Map.of(
    'p', PARENTHESES,
    'b', BRACES,
    'k', BRACKETS,
    'a', ANGLES,
    'c', UNTIL_COMMA,
    's', UNTIL_SEMICOLON,
    'm', ELEMENT,
    'j', CONTENT
  );

  /**
   * @return whether this region is delimited by a pair of bracket tokens
   */
  public boolean isBracketPair() {
    return open != null;
  }

  /**
   * @param token token to check
   * @return whether the token opens this kind of region
   */
  public boolean isOpen(Token token) {
    return open != null && kinds.contains(token.type()) && token.hasValue(open);
  }

  /**
   * @param token token to check
   * @return whether the token closes this kind of region
   */
  public boolean isClose(Token token) {
    return close != null && kinds.contains(token.type()) && token.hasValue(close);
  }

  /**
   * Match the region starting at a given index.
   *
   * @param tokens token stream
   * @param index where the region must start
   * @param end index past which the region may not extend
   * @return index just past the region, or {@code -1} if there is no region
   */
  public int scan(List<Token> tokens, int index, int end) {
    if (index >= end || !isOpen(tokens.get(index))) {
      return -1;
    }
    int depth = 0;
    for (int i = index; i < end; i++) {
      final Token token = tokens.get(i);
      if (isOpen(token)) {
        depth++;
      } else if (isClose(token)) {
        depth--;
        if (depth == 0) {
          return i + 1;
        }
      }
    }
    return -1;
  }

  private static int scanUntil(List<Token> tokens, int index, int end, String terminator) {
    int depth = 0;
    int i = index;
    for (; i < end; i++) {
      final Token token = tokens.get(i);
      if (token.is(TokenType.END_OF_INPUT)) {
        break;
      } else if (Nesting.opensBracket(token)) {
        depth++;
      } else if (Nesting.closesBracket(token)) {
        if (depth == 0) {
          break;
        }
        depth--;
      } else if (depth == 0 && token.is(TokenType.PUNCTUATION, terminator)) {
        break;
      }
    }
    return (i > index && depth == 0) ? i : -1;
  }
}
