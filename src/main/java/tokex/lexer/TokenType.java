package tokex.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kinds of tokens produced by the {@link Lexer}.
 *
 * <p>Every kind has a shorthand used to refer to it from pattern text: {@code \i}
 * matches an identifier and {@code \I} matches anything that is not an
 * identifier. Two-letter shorthands are negated by capitalizing their first
 * letter ({@code \Tn} is "not a type name").
 */
public enum TokenType {

  KEYWORD("k"),
  IDENTIFIER("i"),
  STRING("s"),
  NUMBER("n"),
  OPERATOR("o"),
  PUNCTUATION("p"),
  COMMENT("c"),
  WHITESPACE("w"),
  TEMPLATE_STRING("t"),
  REGEX("r"),
  END_OF_INPUT("e"),

  // Type annotation context
  COLON("co"),
  GENERIC_OPEN("go"),
  GENERIC_CLOSE("gc"),
  TYPE_NAME("tn"),
  QUESTION_MARK("qm"),
  ARROW("ar"),
  TYPE_OPERATOR("to"),
  EXTENDS("xt"),
  TUPLE_OPEN("tl"),
  TUPLE_CLOSE("tr"),
  MAPPED_IN("mi"),
  AS_CONST("ac"),

  // Markup context
  TAG_OPEN("mo"),
  TAG_CLOSE("mc"),
  SELF_CLOSE("ms"),
  TAG_END("me"),
  ATTRIBUTE_NAME("ma"),
  ATTRIBUTE_VALUE("mv"),
  TEXT("mt"),
  EXPRESSION_START("mx"),
  EXPRESSION_END("my"),

  DECORATOR("dc"),
  UNKNOWN("uk");

  /**
   * Shorthand letters used in pattern text (positive form).
   */
  public final String shorthand;

  TokenType(String shorthand) {
    this.shorthand = shorthand;
  }

  /**
   * Mapping from the positive shorthand to the token type.
   */
  public static final Map<String, TokenType> SHORTHANDS = Arrays
    .stream(values())
    .collect(Collectors.toUnmodifiableMap(t -> t.shorthand, Function.identity()));

  /**
   * Whether tokens of this kind are insignificant when deciding how to lex
   * what follows them.
   *
   * @return whether the token kind is whitespace or a comment
   */
  public boolean isTrivia() {
    return this == WHITESPACE || this == COMMENT;
  }
}
