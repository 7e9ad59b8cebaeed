package tokex.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contextual lexer for TypeScript with embedded markup (TSX).
 *
 * <p>The lexer is a state machine over an explicit stack of modes. Script code
 * can open markup (a {@code <} in operand position), markup can open script
 * code (an opening brace in a tag or in text), and either can nest inside the other
 * arbitrarily deeply without recursion. Type annotations are a mode of their
 * own so that {@code <}, {@code >}, {@code [}, and names inside of them get the
 * type-specific token kinds.
 *
 * <p>There is no error recovery: a string, template, regular expression, or
 * block comment that is never closed is reported with a {@link LexException}.
 * Anything else that cannot be classified becomes an {@link TokenType#UNKNOWN}
 * token. The token list always ends with an {@link TokenType#END_OF_INPUT}
 * token.
 */
public final class Lexer {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  /**
   * Keep whitespace tokens in the output.
   */
  public static final int WHITESPACE = 0x01;

  /**
   * Keep comment tokens in the output.
   */
  public static final int COMMENTS = 0x02;

  /**
   * Split template literals at their interpolations and tokenize the
   * interpolated expressions (including any markup inside them).
   */
  public static final int TEMPLATE_INTERPOLATION = 0x04;

  static final Set<String> KEYWORDS = Set.of(
    "break", "case", "catch", "class", "const", "continue", "debugger", "default",
    "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for",
    "function", "if", "import", "in", "instanceof", "let", "new", "null", "return",
    "static", "super", "switch", "this", "throw", "true", "try", "typeof", "undefined",
    "var", "void", "while", "with", "yield", "async", "await", "implements", "interface",
    "package", "private", "protected", "public", "as", "from", "type", "namespace",
    "module", "declare", "readonly"
  );

  // Keywords after which an operand has ended
  private static final Set<String> VALUE_KEYWORDS = Set.of(
    "this", "super", "true", "false", "null", "undefined"
  );

  // Keywords after which a `{` opens a block rather than an object literal
  private static final Set<String> BLOCK_KEYWORDS = Set.of(
    "else", "do", "try", "finally"
  );

  private static final Set<String> TYPE_OPERATORS = Set.of(
    "typeof", "keyof", "infer", "readonly", "unique", "asserts"
  );

  // Longest first, so that the first prefix found is the longest operator
  private static final String[] OPERATORS = {
    ">>>=",
    "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
    "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=",
    "*=", "/=", "%=", "&=", "|=", "^=", "**", "<<", ">>",
    "+", "-", "*", "/", "%", "=", "<", ">", "!", "&", "|", "^", "~", "?", ":"
  };

  /**
   * Lexer modes. Each one is a frame on the mode stack.
   */
  private enum Mode {
    /** Script code at the top level of the source. */
    SCRIPT,
    /** Script code between braces in markup. */
    EXPRESSION,
    /** Script code in a template literal interpolation. */
    INTERPOLATION,
    /** Type annotation, type alias, type assertion, or generic argument list. */
    TYPE,
    /** Inside an open tag, before its closing {@code >} or {@code />}. */
    TAG,
    /** Inside a closing tag. */
    CLOSING_TAG,
    /** Between the tags of an element. */
    TEXT
  }

  /**
   * Open bracket inside a mode.
   */
  private static final class Bracket {
    final char open;
    final boolean objectLiteral;
    int pendingColons = 0;

    Bracket(char open, boolean objectLiteral) {
      this.open = open;
      this.objectLiteral = objectLiteral;
    }
  }

  private static final class Frame {
    final Mode mode;
    final Deque<Bracket> brackets = new ArrayDeque<>();

    // TYPE: frame ends as soon as its last bracket closes (generic lists)
    boolean closesWithBrackets = false;

    // TYPE: frame ends at a line break at the top level (`as` assertions)
    boolean endsAtLineBreak = false;

    // TYPE: the next token should start a type
    boolean typeExpected = true;

    // TYPE: the last token closed a parenthesized parameter list
    boolean afterParameters = false;

    // SCRIPT: saw `type Name`, so the next `=` starts a type
    boolean pendingTypeAlias = false;

    // SCRIPT: saw `as` and `const` is coming up
    boolean pendingAsConst = false;

    // TAG: tag name has been lexed
    boolean afterTagName = false;

    // INTERPOLATION: where the enclosing template literal started
    int templateStart = -1;

    Frame(Mode mode) {
      this.mode = mode;
      if (mode != Mode.TYPE) {
        brackets.push(new Bracket('\0', false));
      }
    }

    boolean atTopLevel() {
      return mode == Mode.TYPE ? brackets.isEmpty() : brackets.size() == 1;
    }

    char top() {
      return brackets.isEmpty() ? '\0' : brackets.peek().open;
    }
  }

  private final String input;
  private final int length;
  private final int flags;
  private final int[] lineStarts;

  private int position = 0;
  private Token lastSignificant = null;
  private final Deque<Frame> modes = new ArrayDeque<>();
  private final List<Token> tokens = new ArrayList<>();

  private Lexer(String input, int flags) {
    this.input = input;
    this.length = input.length();
    this.flags = flags;
    this.lineStarts = computeLineStarts(input);
  }

  /**
   * Tokenize source text, dropping whitespace and comments.
   *
   * @param source source text
   * @return tokens, ending with an end-of-input token
   */
  public static List<Token> tokenize(String source) throws LexException {
    return tokenize(source, 0);
  }

  /**
   * Tokenize source text.
   *
   * @param source source text
   * @param includeWhitespace keep whitespace tokens
   * @param includeComments keep comment tokens
   * @return tokens, ending with an end-of-input token
   */
  public static List<Token> tokenize(
    String source,
    boolean includeWhitespace,
    boolean includeComments
  ) throws LexException {
    return tokenize(source, (includeWhitespace ? WHITESPACE : 0) | (includeComments ? COMMENTS : 0));
  }

  /**
   * Tokenize source text.
   *
   * @param source source text
   * @param flags bitmask of {@link #WHITESPACE}, {@link #COMMENTS}, and
   *   {@link #TEMPLATE_INTERPOLATION}
   * @return tokens, ending with an end-of-input token
   */
  public static List<Token> tokenize(String source, int flags) throws LexException {
    final var lexer = new Lexer(source, flags);
    lexer.run();
    log.trace("Lexed {} characters into {} tokens", lexer.length, lexer.tokens.size());
    return List.copyOf(lexer.tokens);
  }

  private static int[] computeLineStarts(String input) {
    final var starts = new ArrayList<Integer>();
    starts.add(0);
    for (int i = 0; i < input.length(); i++) {
      final char c = input.charAt(i);
      if (c == '\n' || (c == '\r' && (i + 1 >= input.length() || input.charAt(i + 1) != '\n'))) {
        starts.add(i + 1);
      }
    }
    return starts.stream().mapToInt(Integer::intValue).toArray();
  }

  private int lineOf(int offset) {
    final int found = Arrays.binarySearch(lineStarts, offset);
    return found >= 0 ? found : -found - 2;
  }

  private LexException error(String message, int start) {
    final int line = lineOf(start);
    return new LexException(message, start, line + 1, start - lineStarts[line] + 1);
  }

  private boolean checkFlags(int mask) {
    return (flags & mask) != 0;
  }

  /**
   * Record a token spanning from {@code start} to {@code end} and move the
   * cursor to its end.
   */
  private void emit(TokenType type, int start, int end) {
    final int line = lineOf(start);
    final var token = new Token(
      type,
      input.substring(start, end),
      start,
      end,
      line + 1,
      start - lineStarts[line] + 1
    );
    position = end;

    if (type == TokenType.WHITESPACE) {
      if (checkFlags(WHITESPACE)) tokens.add(token);
    } else if (type == TokenType.COMMENT) {
      if (checkFlags(COMMENTS)) tokens.add(token);
    } else {
      tokens.add(token);
      lastSignificant = token;
    }
  }

  private int charAt(int offset) {
    return offset < length ? input.charAt(offset) : -1;
  }

  private boolean startsWith(String prefix) {
    return input.startsWith(prefix, position);
  }

  private static boolean isIdentifierStart(int codePoint) {
    return codePoint == '$' || codePoint == '_' ||
      (codePoint >= 0 && UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START));
  }

  private static boolean isIdentifierPart(int codePoint) {
    return codePoint == '$' || codePoint == '_' || codePoint == 0x200C || codePoint == 0x200D ||
      (codePoint >= 0 && UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE));
  }

  // Character.isWhitespace leaves out the no-break space and the byte order mark
  private static boolean isSpace(int c) {
    return Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF';
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private int codePointAt(int offset) {
    return offset < length ? input.codePointAt(offset) : -1;
  }

  /**
   * Offset just past the identifier starting at the given offset.
   *
   * @param offset start of the identifier
   * @param extraPart other characters allowed after the first one
   */
  private int scanIdentifier(int offset, String extraPart) {
    int end = offset + Character.charCount(codePointAt(offset));
    int cp;
    while ((cp = codePointAt(end)) != -1 &&
        (isIdentifierPart(cp) || extraPart.indexOf(cp) >= 0)) {
      end += Character.charCount(cp);
    }
    return end;
  }

  private int skipSpaces(int offset) {
    while (offset < length && isSpace(input.charAt(offset))) {
      offset++;
    }
    return offset;
  }

  private void run() throws LexException {
    modes.push(new Frame(Mode.SCRIPT));
    if (startsWith("#!")) {
      lexLineComment();
    }

    while (position < length) {
      final Frame frame = modes.peek();
      switch (frame.mode) {
        case SCRIPT:
        case EXPRESSION:
        case INTERPOLATION:
          lexScript(frame);
          break;
        case TYPE:
          lexType(frame);
          break;
        case TAG:
          lexTag(frame);
          break;
        case CLOSING_TAG:
          lexClosingTag(frame);
          break;
        case TEXT:
          lexText(frame);
          break;
      }
    }

    emit(TokenType.END_OF_INPUT, length, length);
  }

  /**
   * Lex whitespace or a comment at the cursor, if there is one.
   *
   * @return whether anything was lexed
   */
  private boolean lexTrivia() throws LexException {
    final char c = input.charAt(position);
    if (isSpace(c)) {
      emit(TokenType.WHITESPACE, position, skipSpaces(position));
      return true;
    } else if (c == '/' && charAt(position + 1) == '/') {
      lexLineComment();
      return true;
    } else if (c == '/' && charAt(position + 1) == '*') {
      final int end = input.indexOf("*/", position + 2);
      if (end < 0) {
        throw error("Unterminated block comment", position);
      }
      emit(TokenType.COMMENT, position, end + 2);
      return true;
    }
    return false;
  }

  private void lexLineComment() {
    int end = position;
    while (end < length && input.charAt(end) != '\n' && input.charAt(end) != '\r') {
      end++;
    }
    emit(TokenType.COMMENT, position, end);
  }

  /**
   * Whether the previous token leaves the script expecting an operand (so a
   * {@code /} starts a regular expression and a {@code <} may start markup).
   */
  private boolean expectsOperand() {
    final Token prev = lastSignificant;
    if (prev == null) {
      return true;
    }
    switch (prev.type()) {
      case OPERATOR:
        return !prev.hasValue("++") && !prev.hasValue("--");
      case PUNCTUATION:
        return !prev.hasValue(")") && !prev.hasValue("]") && !prev.hasValue("}");
      case KEYWORD:
        return !VALUE_KEYWORDS.contains(prev.value());
      case COLON:
      case QUESTION_MARK:
      case ARROW:
      case EXPRESSION_START:
        return true;
      case TEMPLATE_STRING:
        return prev.value().endsWith("${");
      default:
        return false;
    }
  }

  /**
   * Whether the previous token ends an operand that {@code as} could apply to.
   */
  private boolean afterOperand() {
    final Token prev = lastSignificant;
    if (prev == null) {
      return false;
    }
    switch (prev.type()) {
      case IDENTIFIER:
      case STRING:
      case NUMBER:
      case TEMPLATE_STRING:
      case GENERIC_CLOSE:
      case TYPE_NAME:
        return true;
      case PUNCTUATION:
        return prev.hasValue(")") || prev.hasValue("]");
      case OPERATOR:
        return prev.hasValue(">");
      case KEYWORD:
        return VALUE_KEYWORDS.contains(prev.value());
      default:
        return false;
    }
  }

  private boolean afterPunctuation(String value) {
    return lastSignificant != null &&
      lastSignificant.is(TokenType.PUNCTUATION) &&
      lastSignificant.hasValue(value);
  }

  private boolean atStatementStart() {
    final Token prev = lastSignificant;
    return prev == null ||
      (prev.is(TokenType.PUNCTUATION) && (prev.hasValue(";") || prev.hasValue("{") || prev.hasValue("}"))) ||
      prev.is(TokenType.KEYWORD, "export") ||
      prev.is(TokenType.KEYWORD, "declare");
  }

  private void pushType(boolean endsAtLineBreak) {
    final var frame = new Frame(Mode.TYPE);
    frame.endsAtLineBreak = endsAtLineBreak;
    modes.push(frame);
  }

  private void pushGeneric() {
    final var frame = new Frame(Mode.TYPE);
    frame.closesWithBrackets = true;
    frame.brackets.push(new Bracket('<', false));
    modes.push(frame);
  }

  private void lexScript(Frame frame) throws LexException {
    if (lexTrivia()) {
      return;
    }

    final int start = position;
    final char c = input.charAt(position);
    final int cp = input.codePointAt(position);

    if (isIdentifierStart(cp) || (c == '#' && isIdentifierStart(codePointAt(position + 1)))) {
      lexWord(frame);
      return;
    } else if (isDigit(c) || (c == '.' && isDigit(charAt(position + 1)))) {
      emit(TokenType.NUMBER, start, scanNumber(start));
      return;
    } else if (c == '"' || c == '\'') {
      emit(TokenType.STRING, start, scanString(start, false));
      return;
    } else if (c == '`') {
      lexTemplate();
      return;
    } else if (c == '@' && isIdentifierStart(codePointAt(position + 1))) {
      emit(TokenType.DECORATOR, start, scanIdentifier(position + 1, "."));
      return;
    }

    if (c == ';' || c == '{' || c == '}') {
      frame.pendingTypeAlias = false;
    }

    switch (c) {
      case '(':
      case '[':
        frame.brackets.push(new Bracket(c, false));
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '{':
        frame.brackets.push(new Bracket(c, opensObjectLiteral()));
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case ')':
      case ']':
        if (!frame.atTopLevel()) {
          frame.brackets.pop();
        }
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '}':
        if (frame.atTopLevel() && frame.mode == Mode.EXPRESSION) {
          modes.pop();
          emit(TokenType.EXPRESSION_END, start, start + 1);
        } else if (frame.atTopLevel() && frame.mode == Mode.INTERPOLATION) {
          modes.pop();
          lexTemplateChunk(start, frame.templateStart);
        } else {
          if (!frame.atTopLevel()) {
            frame.brackets.pop();
          }
          emit(TokenType.PUNCTUATION, start, start + 1);
        }
        return;

      case ';':
      case ',':
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '.':
        if (startsWith("...")) {
          emit(TokenType.OPERATOR, start, start + 3);
        } else {
          emit(TokenType.PUNCTUATION, start, start + 1);
        }
        return;

      case ':':
        lexColon(frame);
        return;

      case '?':
        if (isOptionalMarker()) {
          emit(TokenType.QUESTION_MARK, start, start + 1);
          return;
        }
        if (!startsWith("?.") && !startsWith("??")) {
          frame.brackets.peek().pendingColons++;
        }
        break;

      case '<':
        if (expectsOperand()) {
          if (looksLikeGenericArrow(start)) {
            emit(TokenType.GENERIC_OPEN, start, start + 1);
            pushGeneric();
            return;
          } else if (looksLikeMarkup(start)) {
            emit(TokenType.TAG_OPEN, start, start + 1);
            modes.push(new Frame(Mode.TAG));
            return;
          }
        } else if (lastSignificant.is(TokenType.IDENTIFIER) && looksLikeTypeArguments(start)) {
          emit(TokenType.GENERIC_OPEN, start, start + 1);
          pushGeneric();
          return;
        }
        break;

      case '/':
        if (expectsOperand()) {
          emit(TokenType.REGEX, start, scanRegex(start));
          return;
        }
        break;

      default:
        break;
    }

    for (String operator : OPERATORS) {
      if (startsWith(operator)) {
        emit(TokenType.OPERATOR, start, start + operator.length());
        if (operator.equals("=") && frame.pendingTypeAlias) {
          frame.pendingTypeAlias = false;
          pushType(false);
        }
        return;
      }
    }

    emit(TokenType.UNKNOWN, start, start + Character.charCount(cp));
  }

  private void lexWord(Frame frame) {
    final int start = position;
    final int end = scanIdentifier(input.charAt(start) == '#' ? start + 1 : start, "");
    final String word = input.substring(start, end);

    final boolean propertyName = afterPunctuation(".") || afterPunctuation("?.");
    if (frame.pendingAsConst && word.equals("const")) {
      frame.pendingAsConst = false;
      emit(TokenType.AS_CONST, start, end);
      return;
    } else if (propertyName || !KEYWORDS.contains(word)) {
      emit(TokenType.IDENTIFIER, start, end);
      return;
    }

    switch (word) {
      case "as":
        if (afterOperand()) {
          emit(TokenType.KEYWORD, start, end);
          final int next = skipSpaces(end);
          if (input.startsWith("const", next) && !isIdentifierPart(codePointAt(next + 5))) {
            frame.pendingAsConst = true;
          } else {
            pushType(true);
          }
          return;
        }
        break;

      case "case":
        frame.brackets.peek().pendingColons++;
        break;

      case "type":
        if (atStatementStart() && isIdentifierStart(codePointAt(skipSpaces(end)))) {
          emit(TokenType.KEYWORD, start, end);
          frame.pendingTypeAlias = true;
          return;
        }
        break;

      default:
        break;
    }

    frame.pendingTypeAlias = false;
    emit(TokenType.KEYWORD, start, end);
  }

  private boolean opensObjectLiteral() {
    final Token prev = lastSignificant;
    if (prev == null) {
      return false;
    }
    switch (prev.type()) {
      case OPERATOR:
        return !prev.hasValue("=>");
      case PUNCTUATION:
        return prev.hasValue("(") || prev.hasValue("[") || prev.hasValue(",");
      case KEYWORD:
        return !BLOCK_KEYWORDS.contains(prev.value());
      case EXPRESSION_START:
        return true;
      default:
        return false;
    }
  }

  /**
   * Whether a {@code ?} at the cursor is the optional marker of a property or
   * parameter ({@code name?: T}) rather than a conditional operator.
   */
  private boolean isOptionalMarker() {
    return lastSignificant != null &&
      lastSignificant.is(TokenType.IDENTIFIER) &&
      charAt(skipSpaces(position + 1)) == ':';
  }

  private void lexColon(Frame frame) {
    final int start = position;
    final Bracket bracket = frame.brackets.peek();
    final Token prev = lastSignificant;

    if (bracket.pendingColons > 0) {
      bracket.pendingColons--;
      emit(TokenType.OPERATOR, start, start + 1);
    } else if (bracket.objectLiteral || prev == null) {
      emit(TokenType.OPERATOR, start, start + 1);
    } else if (prev.is(TokenType.IDENTIFIER) ||
        prev.is(TokenType.QUESTION_MARK) ||
        prev.is(TokenType.PUNCTUATION, ")") ||
        prev.is(TokenType.PUNCTUATION, "]") ||
        (prev.is(TokenType.PUNCTUATION, "}") && bracket.open == '(')) {
      emit(TokenType.COLON, start, start + 1);
      pushType(false);
    } else {
      emit(TokenType.OPERATOR, start, start + 1);
    }
  }

  /**
   * Whether a {@code <} in operand position opens markup.
   */
  private boolean looksLikeMarkup(int offset) {
    final int next = codePointAt(offset + 1);
    return next == '>' || (next != '$' && isIdentifierStart(next));
  }

  /**
   * Whether a {@code <} in operand position opens the type parameters of a
   * generic arrow function: {@code <T,>(...)}, {@code <T extends U>(...)} or
   * {@code <T>(...)} with a single capital letter.
   */
  private boolean looksLikeGenericArrow(int offset) {
    final int nameStart = skipSpaces(offset + 1);
    if (!isIdentifierStart(codePointAt(nameStart))) {
      return false;
    }
    final int nameEnd = scanIdentifier(nameStart, "");
    int cursor = skipSpaces(nameEnd);
    if (charAt(cursor) == ',') {
      return true;
    } else if (input.startsWith("extends", cursor) && !isIdentifierPart(codePointAt(cursor + 7))) {
      return true;
    } else if (charAt(cursor) == '>' && nameEnd == nameStart + 1) {
      return Character.isUpperCase(input.charAt(nameStart)) && charAt(skipSpaces(cursor + 1)) == '(';
    }
    return false;
  }

  /**
   * Whether a {@code <} after an identifier opens a type argument or type
   * parameter list instead of being a comparison.
   *
   * <p>The bracketed text must contain only what can appear in simple types,
   * and must be followed by something that can follow a generic name.
   */
  private boolean looksLikeTypeArguments(int offset) {
    int depth = 0;
    int cursor = offset;
    while (cursor < length) {
      final char c = input.charAt(cursor);
      if (c == '<') {
        depth++;
      } else if (c == '>') {
        depth--;
        if (depth == 0) {
          break;
        }
      } else if ((c == '&' || c == '|') && charAt(cursor + 1) == c) {
        return false;
      } else if (!(isSpace(c) || isIdentifierPart(c) ||
          c == ',' || c == '.' || c == '[' || c == ']' || c == '|' || c == '&' || c == '?')) {
        return false;
      }
      cursor++;
    }
    if (depth != 0) {
      return false;
    }

    final int after = skipSpaces(cursor + 1);
    final int next = charAt(after);
    return next == '(' || next == '{' || next == ')' || next == ',' || next == ';' ||
      next == '.' || next == -1 ||
      (next == '=' && charAt(after + 1) != '=') ||
      input.startsWith("extends", after) ||
      input.startsWith("implements", after);
  }

  /**
   * Offset just past the numeric literal starting at the given offset.
   */
  private int scanNumber(int start) {
    int end = start;
    final int second = charAt(start + 1);
    if (input.charAt(start) == '0' && (second == 'x' || second == 'X' || second == 'o' ||
        second == 'O' || second == 'b' || second == 'B')) {
      end += 2;
      while (end < length && (Character.digit(input.charAt(end), 16) >= 0 || input.charAt(end) == '_')) {
        end++;
      }
    } else {
      while (end < length && (isDigit(input.charAt(end)) || input.charAt(end) == '_')) {
        end++;
      }
      if (charAt(end) == '.' && isDigit(charAt(end + 1))) {
        end++;
        while (end < length && (isDigit(input.charAt(end)) || input.charAt(end) == '_')) {
          end++;
        }
      }
      final int e = charAt(end);
      if (e == 'e' || e == 'E') {
        int exponent = end + 1;
        if (charAt(exponent) == '+' || charAt(exponent) == '-') {
          exponent++;
        }
        if (isDigit(charAt(exponent))) {
          end = exponent;
          while (end < length && isDigit(input.charAt(end))) {
            end++;
          }
        }
      }
    }
    if (charAt(end) == 'n') {
      end++;
    }
    return end;
  }

  /**
   * Offset just past the string literal starting at the given offset.
   *
   * @param start offset of the opening quote
   * @param multiline whether unescaped line breaks are allowed (markup attributes)
   */
  private int scanString(int start, boolean multiline) throws LexException {
    final char quote = input.charAt(start);
    int cursor = start + 1;
    while (cursor < length) {
      final char c = input.charAt(cursor);
      if (c == quote) {
        return cursor + 1;
      } else if (c == '\\' && !multiline) {
        cursor += 2;
      } else if ((c == '\n' || c == '\r') && !multiline) {
        break;
      } else {
        cursor++;
      }
    }
    throw error(multiline ? "Unterminated attribute value" : "Unterminated string literal", start);
  }

  /**
   * Offset just past the regular expression literal starting at the given
   * offset (including its flags).
   */
  private int scanRegex(int start) throws LexException {
    int cursor = start + 1;
    boolean inClass = false;
    while (cursor < length) {
      final char c = input.charAt(cursor);
      if (c == '\n' || c == '\r') {
        break;
      } else if (c == '\\') {
        cursor += 2;
        continue;
      } else if (c == '[') {
        inClass = true;
      } else if (c == ']') {
        inClass = false;
      } else if (c == '/' && !inClass) {
        cursor++;
        while (cursor < length && isIdentifierPart(input.charAt(cursor))) {
          cursor++;
        }
        return cursor;
      }
      cursor++;
    }
    throw error("Unterminated regular expression literal", start);
  }

  private void lexTemplate() throws LexException {
    final int start = position;
    if (checkFlags(TEMPLATE_INTERPOLATION)) {
      lexTemplateChunk(start, start);
    } else {
      emit(TokenType.TEMPLATE_STRING, start, scanTemplate(start));
    }
  }

  /**
   * Offset just past the template literal starting at the given offset,
   * including everything in its interpolations.
   *
   * <p>The stack tracks, for each open interpolation, how many braces are open
   * inside it. {@code -1} entries are nested template literals.
   */
  private int scanTemplate(int start) throws LexException {
    final var nesting = new ArrayDeque<Integer>();
    nesting.push(-1);
    int cursor = start + 1;

    while (cursor < length) {
      final char c = input.charAt(cursor);
      final int top = nesting.peek();

      if (top < 0) {
        if (c == '\\') {
          cursor += 2;
          continue;
        } else if (c == '`') {
          nesting.pop();
          if (nesting.isEmpty()) {
            return cursor + 1;
          }
        } else if (c == '$' && charAt(cursor + 1) == '{') {
          nesting.push(0);
          cursor++;
        }
      } else {
        if (c == '{') {
          nesting.pop();
          nesting.push(top + 1);
        } else if (c == '}') {
          nesting.pop();
          if (top > 0) {
            nesting.push(top - 1);
          }
        } else if (c == '`') {
          nesting.push(-1);
        } else if (c == '"' || c == '\'') {
          cursor = scanString(cursor, false);
          continue;
        }
      }
      cursor++;
    }
    throw error("Unterminated template literal", start);
  }

  /**
   * Lex one chunk of template text, starting at the opening backtick or at
   * the brace closing an interpolation. Ends either at the closing backtick
   * or just inside the next interpolation, in which case an interpolation
   * frame is pushed.
   */
  private void lexTemplateChunk(int start, int templateStart) throws LexException {
    int cursor = start + 1;
    while (cursor < length) {
      final char c = input.charAt(cursor);
      if (c == '\\') {
        cursor += 2;
        continue;
      } else if (c == '`') {
        emit(TokenType.TEMPLATE_STRING, start, cursor + 1);
        return;
      } else if (c == '$' && charAt(cursor + 1) == '{') {
        emit(TokenType.TEMPLATE_STRING, start, cursor + 2);
        final var frame = new Frame(Mode.INTERPOLATION);
        frame.templateStart = templateStart;
        modes.push(frame);
        return;
      }
      cursor++;
    }
    throw error("Unterminated template literal", templateStart);
  }

  private void lexType(Frame frame) throws LexException {
    final char c = input.charAt(position);

    if (isSpace(c)) {
      final int end = skipSpaces(position);
      final boolean lineBreak = input.substring(position, end).indexOf('\n') >= 0 ||
        input.substring(position, end).indexOf('\r') >= 0;
      emit(TokenType.WHITESPACE, position, end);
      if (lineBreak && frame.endsAtLineBreak && frame.atTopLevel() && !frame.typeExpected) {
        modes.pop();
      }
      return;
    } else if (lexTrivia()) {
      return;
    }

    final int start = position;
    final int cp = input.codePointAt(position);
    final boolean afterParameters = frame.afterParameters;
    frame.afterParameters = false;

    if (isIdentifierStart(cp)) {
      lexTypeWord(frame);
      return;
    } else if (isDigit(c) || c == '"' || c == '\'' || c == '`' || (c == '-' && isDigit(charAt(position + 1)))) {
      if (c == '"' || c == '\'') {
        emit(TokenType.STRING, start, scanString(start, false));
      } else if (c == '`') {
        emit(TokenType.TEMPLATE_STRING, start, scanTemplate(start));
      } else {
        emit(TokenType.NUMBER, start, scanNumber(c == '-' ? start + 1 : start));
      }
      frame.typeExpected = false;
      return;
    }

    switch (c) {
      case '<':
        frame.brackets.push(new Bracket('<', false));
        frame.typeExpected = true;
        emit(TokenType.GENERIC_OPEN, start, start + 1);
        return;

      case '>':
        if (frame.top() != '<') break;
        frame.brackets.pop();
        frame.typeExpected = false;
        emit(TokenType.GENERIC_CLOSE, start, start + 1);
        if (frame.closesWithBrackets && frame.brackets.isEmpty()) {
          modes.pop();
        }
        return;

      case '[':
        if (charAt(skipSpaces(start + 1)) == ']') {
          frame.brackets.push(new Bracket('a', false));
          emit(TokenType.PUNCTUATION, start, start + 1);
        } else {
          frame.brackets.push(new Bracket('t', false));
          frame.typeExpected = true;
          emit(TokenType.TUPLE_OPEN, start, start + 1);
        }
        return;

      case ']':
        if (frame.top() == 'a') {
          frame.brackets.pop();
          emit(TokenType.PUNCTUATION, start, start + 1);
          return;
        } else if (frame.top() == 't') {
          frame.brackets.pop();
          frame.typeExpected = false;
          emit(TokenType.TUPLE_CLOSE, start, start + 1);
          return;
        }
        break;

      case '(':
        frame.brackets.push(new Bracket('(', false));
        frame.typeExpected = true;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case ')':
        if (frame.top() != '(') break;
        frame.brackets.pop();
        frame.typeExpected = false;
        frame.afterParameters = true;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '{':
        if (!frame.typeExpected && frame.atTopLevel()) break;
        frame.brackets.push(new Bracket('{', false));
        frame.typeExpected = false;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '}':
        if (frame.top() != '{') break;
        frame.brackets.pop();
        frame.typeExpected = false;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case ';':
        if (frame.top() != '{') break;
        frame.typeExpected = false;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case ',':
        if (frame.atTopLevel()) break;
        frame.typeExpected = true;
        emit(TokenType.PUNCTUATION, start, start + 1);
        return;

      case '=':
        if (startsWith("=>")) {
          if (!afterParameters && frame.atTopLevel()) break;
          frame.typeExpected = true;
          emit(TokenType.ARROW, start, start + 2);
          return;
        }
        if (frame.top() != '<' || startsWith("==")) break;
        frame.typeExpected = true;
        emit(TokenType.OPERATOR, start, start + 1);
        return;

      case '|':
      case '&':
        if (charAt(start + 1) == c || charAt(start + 1) == '=') break;
        frame.typeExpected = true;
        emit(TokenType.OPERATOR, start, start + 1);
        return;

      case '?':
        if (startsWith("??") || startsWith("?.")) break;
        frame.typeExpected = true;
        emit(TokenType.QUESTION_MARK, start, start + 1);
        return;

      case ':':
        frame.typeExpected = true;
        emit(TokenType.COLON, start, start + 1);
        return;

      case '.':
        if (startsWith("...")) {
          frame.typeExpected = true;
          emit(TokenType.OPERATOR, start, start + 3);
        } else {
          emit(TokenType.PUNCTUATION, start, start + 1);
        }
        return;

      case '+':
      case '-':
      case '!':
        if (frame.atTopLevel()) break;
        emit(TokenType.OPERATOR, start, start + 1);
        return;

      default:
        break;
    }

    // Anything else ends the type, and is lexed again by the enclosing mode
    modes.pop();
  }

  private void lexTypeWord(Frame frame) {
    final int start = position;
    final int end = scanIdentifier(start, "");
    final String word = input.substring(start, end);

    if (TYPE_OPERATORS.contains(word)) {
      frame.typeExpected = true;
      emit(TokenType.TYPE_OPERATOR, start, end);
    } else if (word.equals("extends")) {
      frame.typeExpected = true;
      emit(TokenType.EXTENDS, start, end);
    } else if (word.equals("in") && frame.top() == 't') {
      frame.typeExpected = true;
      emit(TokenType.MAPPED_IN, start, end);
    } else if ((word.equals("is") || word.equals("as")) && !frame.typeExpected) {
      frame.typeExpected = true;
      emit(TokenType.KEYWORD, start, end);
    } else if (!frame.typeExpected && frame.atTopLevel()) {
      // Two names in a row: the type has already ended
      modes.pop();
    } else {
      final int next = charAt(skipSpaces(end));
      final boolean propertyKey = (frame.top() == '{' || frame.top() == '(') &&
        (next == ':' || (next == '?' && charAt(skipSpaces(skipSpaces(end) + 1)) == ':'));
      final boolean dotted = next == '.' || lastSignificant.is(TokenType.PUNCTUATION, ".");
      frame.typeExpected = false;
      emit(propertyKey || dotted ? TokenType.IDENTIFIER : TokenType.TYPE_NAME, start, end);
    }
  }

  private void lexTag(Frame frame) throws LexException {
    if (lexTrivia()) {
      return;
    }

    final int start = position;
    final char c = input.charAt(position);
    final int cp = input.codePointAt(position);

    if (!frame.afterTagName && isIdentifierStart(cp)) {
      frame.afterTagName = true;
      emit(TokenType.IDENTIFIER, start, scanIdentifier(start, "-.:"));
    } else if (c == '/' && charAt(start + 1) == '>') {
      modes.pop();
      emit(TokenType.SELF_CLOSE, start, start + 2);
    } else if (c == '>') {
      modes.pop();
      modes.push(new Frame(Mode.TEXT));
      emit(TokenType.TAG_END, start, start + 1);
    } else if (c == '{') {
      modes.push(new Frame(Mode.EXPRESSION));
      emit(TokenType.EXPRESSION_START, start, start + 1);
    } else if (c == '"' || c == '\'') {
      emit(TokenType.ATTRIBUTE_VALUE, start, scanString(start, true));
    } else if (c == '=') {
      emit(TokenType.OPERATOR, start, start + 1);
    } else if (isIdentifierStart(cp)) {
      emit(TokenType.ATTRIBUTE_NAME, start, scanIdentifier(start, "-:"));
    } else {
      emit(TokenType.UNKNOWN, start, start + Character.charCount(cp));
    }
  }

  private void lexClosingTag(Frame frame) throws LexException {
    if (lexTrivia()) {
      return;
    }

    final int start = position;
    final int cp = input.codePointAt(position);
    if (cp == '>') {
      modes.pop();
      emit(TokenType.TAG_END, start, start + 1);
    } else if (isIdentifierStart(cp)) {
      emit(TokenType.IDENTIFIER, start, scanIdentifier(start, "-.:"));
    } else {
      emit(TokenType.UNKNOWN, start, start + Character.charCount(cp));
    }
  }

  private void lexText(Frame frame) {
    final int start = position;
    final char c = input.charAt(position);

    if (c == '<' && charAt(start + 1) == '/') {
      modes.pop();
      modes.push(new Frame(Mode.CLOSING_TAG));
      emit(TokenType.TAG_CLOSE, start, start + 2);
      return;
    } else if (c == '<') {
      modes.push(new Frame(Mode.TAG));
      emit(TokenType.TAG_OPEN, start, start + 1);
      return;
    } else if (c == '{') {
      modes.push(new Frame(Mode.EXPRESSION));
      emit(TokenType.EXPRESSION_START, start, start + 1);
      return;
    }

    int end = start;
    while (end < length && input.charAt(end) != '<' && input.charAt(end) != '{') {
      end++;
    }

    // Surrounding whitespace is not part of the text
    int textStart = start;
    while (textStart < end && isSpace(input.charAt(textStart))) {
      textStart++;
    }
    int textEnd = end;
    while (textEnd > textStart && isSpace(input.charAt(textEnd - 1))) {
      textEnd--;
    }

    if (textStart == textEnd) {
      emit(TokenType.WHITESPACE, start, end);
      return;
    }
    if (textStart > start) {
      emit(TokenType.WHITESPACE, start, textStart);
    }
    emit(TokenType.TEXT, textStart, textEnd);
    if (textEnd < end) {
      emit(TokenType.WHITESPACE, textEnd, end);
    }
  }
}
