package tokex.lexer;

import java.util.Objects;

/**
 * Token in a token stream.
 *
 * <p>Offsets are into the source text the token was lexed from: {@code start}
 * is inclusive, {@code end} is exclusive, and {@code value} is exactly the
 * source text between them. Lines and columns are 1-based.
 *
 * @param type kind of token
 * @param value source text of the token
 * @param start offset of the first character of the token
 * @param end offset after the last character of the token
 * @param line line on which the token starts
 * @param column column at which the token starts
 */
public record Token(
  TokenType type,
  String value,
  int start,
  int end,
  int line,
  int column
) {

  public Token {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
  }

  /**
   * Make a token which does not come from any source text.
   *
   * <p>These are used as replacement text when editing a token stream.
   *
   * @param type kind of token
   * @param value text of the token
   * @return token without a position
   */
  public static Token synthetic(TokenType type, String value) {
    return new Token(type, value, -1, -1, 0, 0);
  }

  /**
   * @return whether the token was made by {@link #synthetic}
   */
  public boolean isSynthetic() {
    return start < 0;
  }

  public boolean is(TokenType type) {
    return this.type == type;
  }

  public boolean is(TokenType type, String value) {
    return this.type == type && this.value.equals(value);
  }

  public boolean hasValue(String value) {
    return this.value.equals(value);
  }

  @Override
  public String toString() {
    return type + "(" + value + ")@" + line + ":" + column;
  }
}
