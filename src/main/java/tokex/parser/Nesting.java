package tokex.parser;

import java.util.List;
import tokex.lexer.Token;

/**
 * Running count of how deeply nested a walk over a token stream is.
 *
 * <p>Opening brackets ({@code (}, {@code [}, {@code {}), markup expression
 * starts, generic and tuple opens, and markup tag opens all go one level
 * deeper. Their closing counterparts come back out. A markup element closes
 * at its self-close, or at the tag end of its closing tag, so while the walk
 * is still inside {@code </name} the element is considered open.
 */
public final class Nesting {

  private int depth = 0;
  private boolean inClosingTag = false;

  /**
   * Depth reached after walking over a range of tokens from depth zero.
   *
   * @param tokens token stream
   * @param from first token to walk over
   * @param to index after the last token to walk over
   * @return relative depth at the end of the range
   */
  public static int depthAfter(List<Token> tokens, int from, int to) {
    final var nesting = new Nesting();
    for (int i = from; i < to; i++) {
      nesting.accept(tokens.get(i));
    }
    return nesting.depth;
  }

  /**
   * Walk over one more token.
   *
   * @param token next token in the stream
   */
  public void accept(Token token) {
    if (opensBracket(token)) {
      depth++;
      return;
    } else if (closesBracket(token)) {
      depth--;
      return;
    }

    switch (token.type()) {
      case TAG_OPEN:
        depth++;
        break;
      case TAG_CLOSE:
        inClosingTag = true;
        break;
      case TAG_END:
        if (inClosingTag) {
          inClosingTag = false;
          depth--;
        }
        break;
      case SELF_CLOSE:
        depth--;
        break;
      default:
        break;
    }
  }

  public int depth() {
    return depth;
  }

  /**
   * Whether the token opens a (non-markup) bracketed region.
   */
  public static boolean opensBracket(Token token) {
    switch (token.type()) {
      case PUNCTUATION:
        final String value = token.value();
        return value.equals("(") || value.equals("[") || value.equals("{");
      case EXPRESSION_START:
      case GENERIC_OPEN:
      case TUPLE_OPEN:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether the token closes a (non-markup) bracketed region.
   */
  public static boolean closesBracket(Token token) {
    switch (token.type()) {
      case PUNCTUATION:
        final String value = token.value();
        return value.equals(")") || value.equals("]") || value.equals("}");
      case EXPRESSION_END:
      case GENERIC_CLOSE:
      case TUPLE_CLOSE:
        return true;
      default:
        return false;
    }
  }
}
