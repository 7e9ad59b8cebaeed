package tokex.parser;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.PatternSyntaxException;
import tokex.lexer.TokenType;

/**
 * Parser for token patterns.
 *
 * <p>Token patterns look like regular expressions, but each atom matches a
 * whole token:
 *
 * <ul>
 *   <li>{@code \i}, {@code \k}, {@code \tn}, ... match a token by kind (see
 *       {@link TokenType}), and the capitalized forms {@code \I}, {@code \Tn}
 *       match any token not of that kind
 *   <li>{@code "="} or {@code '='} matches a token by value, and
 *       {@code \k"const"} by both kind and value
 *   <li>{@code .} matches any token other than the end of input
 *   <li>{@code ( )}, {@code (?: )}, {@code (?<name> )} are groups and
 *       {@code (?= )}, {@code (?! )}, {@code (?<= )}, {@code (?<! )} are
 *       lookarounds
 *   <li>{@code [a | b]} and {@code a | b} are alternations
 *   <li>{@code \1} and {@code \k<name>} are backreferences, optionally with a
 *       depth constraint {@code \1@0}
 *   <li>{@code \Bp}, {@code \Bb}, ... are balanced regions (see {@link BalancedRegion})
 *   <li>{@code \fc}, {@code \call}, ... are macros (see {@link PatternMacro})
 *   <li>{@code <div}, {@code </div>}, {@code </\1>} match markup tags, and
 *       {@code <(\i)(attributes)>} or {@code <(\i)/>} a whole opening tag
 *   <li>{@code *}, {@code +}, {@code ?}, {@code {n}}, {@code {n,}},
 *       {@code {n,m}} are quantifiers, lazy when followed by {@code ?}
 * </ul>
 *
 * <p>Whitespace between atoms is ignored. This is a fairly standard recursive
 * descent parser, except that the results are reported bottom-up to a visitor
 * instead of being returned as an explicit tree.
 *
 * @author Alec Theriault
 */
public final class PatternParser<A> {

  // Used when "visiting" the pattern bottom up
  private final PatternVisitor<A> visitor;

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;
  private int groupCount = 0;

  // Named groups declared so far
  private final Map<String, Integer> groupNames;

  // Attributes skipped by a tag pattern without an attribute group
  private static final String ANY_ATTRIBUTES = "(?:\\Bb | (?![\\me | \\ms | \\mx]) .)*";

  /**
   * Parse a token pattern.
   *
   * @param visitor visitor used to accept bottom-up parsing progress
   * @param input pattern text
   * @param wrappingGroup is there an implicit outer group (group 0) wrapping the pattern
   * @return parsed pattern
   */
  public static <B> B parse(
    PatternVisitor<B> visitor,
    String input,
    boolean wrappingGroup
  ) throws PatternSyntaxException {
    final var parser = new PatternParser<B>(visitor, input);
    if (wrappingGroup) {
      parser.groupCount++;
    }

    B parsed = parser.parseAlternation();

    if (parser.position < parser.length) {
      switch (parser.peekChar()) {
        case ')':
          throw parser.error("Unmatched closing parenthesis");
        case ']':
          throw parser.error("Unmatched closing bracket");
        default:
          throw parser.error("Expected the end of the pattern");
      }
    }

    if (wrappingGroup) {
      parsed = visitor.visitGroup(parsed, OptionalInt.of(0), Optional.empty());
    }
    return parsed;
  }

  private PatternParser(PatternVisitor<A> visitor, String input) {
    this(visitor, input, new HashMap<>());
  }

  private PatternParser(PatternVisitor<A> visitor, String input, Map<String, Integer> groupNames) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
    this.groupNames = groupNames;
  }

  /**
   * Parse a fixed piece of pattern text in place, as one atom, continuing
   * this parser's group numbering.
   */
  private A parseInPlace(String text) {
    final var nested = new PatternParser<A>(visitor, text, groupNames);
    nested.groupCount = groupCount;
    final A parsed = nested.parseAlternation();
    if (nested.position < nested.length) {
      throw new IllegalStateException("Malformed built-in pattern: " + text);
    }
    groupCount = nested.groupCount;
    return parsed;
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private PatternSyntaxException error(String message, int position) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(String unsupported) {
    return new UnsupportedPatternSyntaxException(unsupported, input, position);
  }

  /**
   * Advance the cursor past any whitespace.
   */
  private void skipSpace() {
    while (position < length && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
  }

  /**
   * Peek the next non-whitespace character without advancing the position.
   *
   * @return next character or else -1 if there is none
   */
  int peekChar() {
    skipSpace();
    return position < length ? input.charAt(position) : -1;
  }

  /**
   * Skip over the next non-whitespace character.
   */
  void skipChar() {
    skipSpace();
    position++;
  }

  /**
   * Advance past the next non-whitespace character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    skipSpace();
    return nextRawCharIf(matching);
  }

  /**
   * Advance past the very next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  private boolean nextRawCharIf(char matching) {
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Parse an alternation.
   */
  private A parseAlternation() throws PatternSyntaxException {
    A unionLhs = parseConcatenation();
    while (nextCharIf('|')) {
      A unionRhs = parseConcatenation();
      unionLhs = visitor.visitAlternation(unionLhs, unionRhs);
    }
    return unionLhs;
  }

  /**
   * Parse a concatenation.
   */
  private A parseConcatenation() throws PatternSyntaxException {
    // Left is `null` until we need it so as to avoid unnecessary `visitEpsilon`
    A concatLhs = null;

    // Keep parsing concatenations until a lower priority construct is encountered
    int c;
    while ((c = peekChar()) != -1) {
      if (c == ')' || c == '|' || c == ']') break;
      A concatRhs = parseQuantified();
      if (concatLhs == null) {
        concatLhs = concatRhs;
      } else {
        concatLhs = visitor.visitConcatenation(concatLhs, concatRhs);
      }
    }

    return (concatLhs == null) ? visitor.visitEpsilon() : concatLhs;
  }

  /**
   * Parse a quantified atom.
   *
   * Called on non-empty input.
   */
  private A parseQuantified() throws PatternSyntaxException {
    A quantified = parseAtom();

    // Used for repetitions
    int atLeast = 0;
    OptionalInt atMost = OptionalInt.empty();

    int c;
    postfix_parsing:
    while ((c = peekChar()) != -1) {

      // Pass over the quantifier stem
      switch (c) {
        case '*':
        case '?':
        case '+':
          skipChar();
          break;

        case '{':
          final int openBracePosition = position;
          skipChar();
          atLeast = parseDecimalInteger();

          if (nextCharIf(',')) {
            if (peekChar() != '}') {
              atMost = OptionalInt.of(parseDecimalInteger());
            } else {
              atMost = OptionalInt.empty();
            }
          } else {
            atMost = OptionalInt.of(atLeast);
          }

          if (!nextCharIf('}')) {
            throw error("Expected `}` to close repetition (opened at " + openBracePosition + ")");
          }
          if (atMost.isPresent() && atMost.getAsInt() < atLeast) {
            throw error(
              "Invalid repetition range: minimum " + atLeast + " exceeds maximum " + atMost.getAsInt(),
              openBracePosition
            );
          }
          break;

        default:
          break postfix_parsing;
      }

      // `?` directly after indicates the quantifier is lazy (reluctant) instead of being greedy
      boolean isLazy = false;
      if (nextRawCharIf('?')) {
        isLazy = true;
      } else if (position < length && input.charAt(position) == '+') {
        throw unsupported("Possessive quantifiers");
      }

      // Visit the quantifier corresponding to the initial character
      switch (c) {
        case '*':
          quantified = visitor.visitKleene(quantified, isLazy);
          break;
        case '?':
          quantified = visitor.visitOptional(quantified, isLazy);
          break;
        case '+':
          quantified = visitor.visitPlus(quantified, isLazy);
          break;
        case '{':
          quantified = visitor.visitRepetition(quantified, atLeast, atMost, isLazy);
          break;
      }
    }

    return quantified;
  }

  /**
   * Parse an atom: a group, alternation, literal, escape, or wildcard.
   *
   * Called on non-empty input.
   */
  private A parseAtom() throws PatternSyntaxException {
    final int c = peekChar();
    switch (c) {
      case '(':
        return parseGroup();

      case '[':
        final int openBracketPosition = position;
        skipChar();
        final A union = parseAlternation();
        if (!nextCharIf(']')) {
          throw error(
            "Unclosed alternation (expected `]` for bracket opened at " + openBracketPosition + ")"
          );
        }
        return union;

      case '.':
        skipChar();
        return visitor.visitAny();

      case '"':
      case '\'':
        return visitor.visitLiteral(parseLiteralString(), Optional.empty());

      case '\\':
        return parseEscape();

      case '<':
        return parseTag();

      case '*':
      case '+':
      case '?':
      case '{':
        throw error("Dangling quantifier `" + (char) c + "` (nothing to repeat)");

      case '^':
      case '$':
        throw unsupported("Anchors");

      default:
        throw error("Unexpected character `" + (char) c + "`");
    }
  }

  /**
   * Parse a group or lookaround.
   *
   * Called when the next character is an open paren.
   */
  private A parseGroup() throws PatternSyntaxException {
    // Track the open paren so we can use it in the error message
    final int openParenPosition = position;
    skipChar();

    boolean capture = true;
    Optional<String> name = Optional.empty();
    Lookaround lookaround = null;

    if (nextRawCharIf('?')) {
      final int construct = position < length ? input.charAt(position) : -1;
      switch (construct) {
        case ':':
          position++;
          capture = false;
          break;

        case '=':
          position++;
          lookaround = Lookaround.AHEAD;
          break;

        case '!':
          position++;
          lookaround = Lookaround.NEGATIVE_AHEAD;
          break;

        case '<':
          position++;
          if (nextRawCharIf('=')) {
            lookaround = Lookaround.BEHIND;
          } else if (nextRawCharIf('!')) {
            lookaround = Lookaround.NEGATIVE_BEHIND;
          } else {
            name = Optional.of(parseGroupName());
          }
          break;

        case '>':
          throw unsupported("Atomic groups");

        default:
          if (construct != -1 && Character.isLetter(construct)) {
            throw unsupported("Inline flags");
          }
          throw error("Invalid group construct (in group opened at " + openParenPosition + ")");
      }
    }

    if (lookaround != null) {
      capture = false;
    }

    // If this a capture group, increment the group count
    final var groupIdx = capture ? OptionalInt.of(groupCount++) : OptionalInt.empty();
    if (name.isPresent()) {
      if (groupNames.putIfAbsent(name.get(), groupIdx.getAsInt()) != null) {
        throw error("Duplicate group name `" + name.get() + "`", openParenPosition);
      }
    }

    // Parse the group body and ensure that it is closed
    final A union = parseAlternation();
    if (!nextCharIf(')')) {
      throw error(
        "Unclosed group (expected close paren for group opened at " + openParenPosition + ")"
      );
    }

    if (lookaround != null) {
      return visitor.visitLookaround(union, lookaround);
    }
    return visitor.visitGroup(union, groupIdx, name);
  }

  /**
   * Parse a group name and the closing {@code >} after it.
   */
  private String parseGroupName() throws PatternSyntaxException {
    final int nameStart = position;
    while (position < length && Character.isLetterOrDigit(input.charAt(position))) {
      position++;
    }
    final String name = input.substring(nameStart, position);
    if (name.isEmpty() || !Character.isLetter(name.charAt(0))) {
      throw error("Group name must start with a letter", nameStart);
    }
    if (!nextRawCharIf('>')) {
      throw error("Expected `>` to close group name");
    }
    return name;
  }

  /**
   * Parse an escape: a token class, a class-scoped literal, a backreference,
   * or a balanced region.
   *
   * Called when the next character is a backslash.
   */
  private A parseEscape() throws PatternSyntaxException {
    skipChar();
    final int escapeStart = position - 1;
    if (position >= length) {
      throw error("Pattern may not end with backslash");
    }
    final char c = input.charAt(position);

    // Numbered backreference
    if (c >= '0' && c <= '9') {
      final int groupIndex = parseDecimalInteger();
      if (groupIndex < 1 || groupIndex >= groupCount) {
        throw error("Backreference to undeclared group " + groupIndex, escapeStart);
      }
      return visitor.visitBackreference(groupIndex, parseDepthSuffix());
    }

    // Named backreference
    if (c == 'k' && position + 1 < length && input.charAt(position + 1) == '<') {
      position += 2;
      final String name = parseGroupName();
      final Integer groupIndex = groupNames.get(name);
      if (groupIndex == null) {
        throw error("Backreference to undeclared group name `" + name + "`", escapeStart);
      }
      return visitor.visitBackreference(groupIndex, parseDepthSuffix());
    }

    // Balanced region
    if (c == 'B') {
      position++;
      final BalancedRegion region = position < length
        ? BalancedRegion.CHARACTERS.get(input.charAt(position))
        : null;
      if (region == null) {
        throw error("Unknown balanced region (expected one of p, b, k, a, c, s, m, j after `\\B`)", escapeStart);
      }
      position++;
      return visitor.visitBalanced(region);
    }

    // Macro
    int nameEnd = position;
    while (nameEnd < length && Character.isLetter(input.charAt(nameEnd))) {
      nameEnd++;
    }
    if (nameEnd - position > 1) {
      final PatternMacro macro = PatternMacro.NAMES.get(input.substring(position, nameEnd));
      if (macro != null) {
        position = nameEnd;
        return parseInPlace(macro.expansion());
      }
    }

    // Token class, longest shorthand first
    TokenType type = null;
    boolean negated = Character.isUpperCase(c);
    final String lower = String.valueOf(Character.toLowerCase(c));
    if (position + 1 < length && Character.isLowerCase(input.charAt(position + 1))) {
      type = TokenType.SHORTHANDS.get(lower + input.charAt(position + 1));
      if (type != null) {
        position += 2;
      }
    }
    if (type == null) {
      type = TokenType.SHORTHANDS.get(lower);
      if (type == null) {
        throw error("Unknown token class `\\" + c + "`", escapeStart);
      }
      position++;
    }

    // Class-scoped literal
    if (position < length && (input.charAt(position) == '"' || input.charAt(position) == '\'')) {
      if (negated) {
        throw error("Negated token classes cannot scope a literal", escapeStart);
      }
      return visitor.visitLiteral(parseLiteralString(), Optional.of(type));
    }

    return visitor.visitTokenClass(type, negated);
  }

  /**
   * Parse a markup tag pattern.
   *
   * <ul>
   *   <li>{@code <name} is a tag open and that tag name
   *   <li>{@code </name>} is a whole closing tag
   *   <li>{@code </\1@0>} is a closing tag whose name is matched by the escape
   *       (usually a backreference to the opening tag name)
   *   <li>{@code <(name) (attributes)>} is a whole opening tag, with the tag
   *       name and attributes matched by groups. Without an attributes group,
   *       any attributes are skipped. Ending in {@code />} instead matches a
   *       self-closing tag.
   * </ul>
   *
   * Called when the next character is {@code <}.
   */
  private A parseTag() throws PatternSyntaxException {
    skipChar();
    final int tagStart = position - 1;

    if (nextRawCharIf('/')) {
      final A name;
      if (position < length && input.charAt(position) == '\\') {
        name = parseEscape();
      } else {
        name = parseTagName(tagStart);
      }
      nextCharIf('>');
      final A open = visitor.visitConcatenation(visitor.visitTokenClass(TokenType.TAG_CLOSE, false), name);
      return visitor.visitConcatenation(open, visitor.visitTokenClass(TokenType.TAG_END, false));
    }

    if (position < length && input.charAt(position) == '(') {
      A tag = visitor.visitConcatenation(visitor.visitTokenClass(TokenType.TAG_OPEN, false), parseGroup());
      final A attributes = peekChar() == '(' ? parseGroup() : parseInPlace(ANY_ATTRIBUTES);
      tag = visitor.visitConcatenation(tag, attributes);
      if (nextCharIf('>')) {
        return visitor.visitConcatenation(tag, visitor.visitTokenClass(TokenType.TAG_END, false));
      } else if (nextCharIf('/') && nextRawCharIf('>')) {
        return visitor.visitConcatenation(tag, visitor.visitTokenClass(TokenType.SELF_CLOSE, false));
      }
      throw error("Expected `>` or `/>` to end the tag opened at " + tagStart);
    }

    return visitor.visitConcatenation(
      visitor.visitTokenClass(TokenType.TAG_OPEN, false),
      parseTagName(tagStart)
    );
  }

  /**
   * Parse a literal tag name, such as {@code div}, {@code Foo.Bar} or
   * {@code my-element}, into an identifier literal.
   */
  private A parseTagName(int tagStart) throws PatternSyntaxException {
    final int nameStart = position;
    while (position < length) {
      final char c = input.charAt(position);
      if (!Character.isLetterOrDigit(c) && c != '_' && c != '$' && c != '.' && c != '-' && c != ':') {
        break;
      }
      position++;
    }
    if (nameStart == position) {
      throw error("Expected a tag name in the tag pattern at " + tagStart);
    }
    return visitor.visitLiteral(input.substring(nameStart, position), Optional.of(TokenType.IDENTIFIER));
  }

  /**
   * Parse an optional {@code @N} suffix on a backreference.
   */
  private OptionalInt parseDepthSuffix() throws PatternSyntaxException {
    if (!nextRawCharIf('@')) {
      return OptionalInt.empty();
    }
    final boolean negative = nextRawCharIf('-');
    if (!negative) {
      nextRawCharIf('+');
    }
    if (position >= length || !Character.isDigit(input.charAt(position))) {
      throw error("Expected a depth after `@`");
    }
    final int depth = parseDecimalInteger();
    return OptionalInt.of(negative ? -depth : depth);
  }

  /**
   * Parse a quoted literal, processing escapes.
   *
   * Called when the next character is a quote.
   */
  private String parseLiteralString() throws PatternSyntaxException {
    skipSpace();
    final int openQuotePosition = position;
    final char quote = input.charAt(position++);
    final var builder = new StringBuilder();

    while (true) {
      if (position >= length) {
        throw error(
          "Unclosed literal (expected closing quote for literal opened at " + openQuotePosition + ")"
        );
      }
      final char c = input.charAt(position++);
      if (c == quote) {
        break;
      } else if (c == '\\' && position < length) {
        builder.append(input.charAt(position++));
      } else {
        builder.append(c);
      }
    }

    if (builder.length() == 0) {
      throw error("Empty literal", openQuotePosition);
    }
    return builder.toString();
  }

  /**
   * Parse a non-negative decimal integer.
   */
  private int parseDecimalInteger() throws PatternSyntaxException {
    skipSpace();
    final int start = position;
    while (position < length && Character.isDigit(input.charAt(position))) {
      position++;
    }
    if (start == position) {
      throw error("Expected a decimal integer");
    }
    try {
      return Integer.parseInt(input.substring(start, position));
    } catch (NumberFormatException err) {
      throw error("Integer is too large", start);
    }
  }
}
