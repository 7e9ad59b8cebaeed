package tokex.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;
import tokex.TokenMatch;
import tokex.TokenPattern;
import tokex.lexer.Lexer;
import tokex.lexer.Token;
import tokex.lexer.TokenType;

public class TokenEditsTest {

  private static Token word(String value) {
    return Token.synthetic(TokenType.IDENTIFIER, value);
  }

  private static List<String> values(List<Token> tokens) {
    return tokens.stream().map(Token::value).collect(Collectors.toList());
  }

  @Test
  public void insertReplaceRemove() {
    final String source = "let a = b;  // done";
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();

    edits.replace(tokens.get(0), Token.synthetic(TokenType.KEYWORD, "const"));
    edits.insertAfter(tokens.get(1), Token.synthetic(TokenType.COLON, ":"), word(" T"));
    edits.remove(tokens.get(4));
    edits.insertBefore(tokens.get(3), word("f"), word("("));
    edits.insertAfter(tokens.get(3), word(")"));

    assertEquals("const a: T = f(b)  // done", edits.reconstruct(source));
    assertEquals(5, edits.size());
    assertFalse(edits.isEmpty());
  }

  @Test
  public void insertionsAtSameOffsetKeepOrder() {
    final String source = "a";
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    edits.insertBefore(tokens.get(0), word("1"));
    edits.insertBefore(tokens.get(0), word("2"));
    edits.replace(tokens.get(0), word("x"));
    edits.insertAfter(tokens.get(0), word("3"));

    assertEquals("12x3", edits.reconstruct(source));
  }

  @Test
  public void replaceCaptureAndMatch() {
    final String source = "foo(a, b);";
    final List<Token> tokens = Lexer.tokenize(source);
    final TokenMatch match = TokenPattern.compile("\\i '(' (.*?) ')'").tryMatch(tokens, 0).orElseThrow();

    final var args = new TokenEdits();
    args.replace(match.capture(1).orElseThrow(), word("x"));
    assertEquals("foo(x);", args.reconstruct(source));

    final var whole = new TokenEdits();
    whole.remove(match);
    assertEquals(";", whole.reconstruct(source));

    final var around = new TokenEdits();
    around.insertBefore(match.capture(1).orElseThrow(), word("["));
    around.insertAfter(match.capture(1).orElseThrow(), word("]"));
    assertEquals("foo([a, b]);", around.reconstruct(source));
  }

  @Test
  public void invalidTargets() {
    final List<Token> tokens = Lexer.tokenize("f()");
    final TokenMatch match = TokenPattern.compile("\\i '(' (.*) ')'").tryMatch(tokens, 0).orElseThrow();
    final var edits = new TokenEdits();

    assertThrows(IllegalArgumentException.class, () -> edits.replace(word("x"), word("y")));
    assertThrows(IllegalArgumentException.class, () -> edits.insertBefore(word("x"), word("y")));
    assertThrows(IllegalArgumentException.class, () -> edits.remove(match.capture(1).orElseThrow()));
    assertThrows(IllegalArgumentException.class, () -> edits.replaceRange(tokens.get(2), tokens.get(0)));
    assertTrue(edits.isEmpty());
  }

  @Test
  public void overlappingEditsConflict() {
    final String source = "a b c";
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    edits.replaceRange(tokens.get(0), tokens.get(1), word("x"));
    edits.replace(tokens.get(1), word("y"));

    assertThrows(IllegalStateException.class, () -> edits.reconstruct(source));
    assertThrows(IllegalStateException.class, () -> edits.apply(tokens));
  }

  @Test
  public void insertionInsideReplacementConflicts() {
    final String source = "a b c";
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    edits.replaceRange(tokens.get(0), tokens.get(2), word("x"));
    edits.insertBefore(tokens.get(1), word("y"));

    assertThrows(IllegalStateException.class, () -> edits.reconstruct(source));
  }

  @Test
  public void adjacentEditsDoNotConflict() {
    final String source = "a b";
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    edits.replace(tokens.get(0), word("x"));
    edits.insertAfter(tokens.get(0), word("!"));
    edits.replace(tokens.get(1), word("y"));

    assertEquals("x! y", edits.reconstruct(source));
    assertEquals(3, edits.replayOrder().size());
  }

  @Test
  public void applyToTokens() {
    final List<Token> tokens = Lexer.tokenize("var a = b;");
    final var edits = new TokenEdits();
    edits.replace(tokens.get(0), Token.synthetic(TokenType.KEYWORD, "let"));
    edits.replaceRange(tokens.get(2), tokens.get(3), word("="), word("c"));
    edits.insertAfter(tokens.get(4), word("d"));

    assertEquals(List.of("let", "a", "=", "c", ";", "d", ""), values(edits.apply(tokens)));
    assertEquals(values(tokens), values(new TokenEdits().apply(tokens)));
  }

  @Test
  public void editsRecordTheirOrder() {
    final List<Token> tokens = Lexer.tokenize("a b");
    final var edits = new TokenEdits();
    edits.replace(tokens.get(1), word("y"));
    edits.insertBefore(tokens.get(0), word("x"));

    final List<TokenEdits.Edit> made = edits.edits();
    assertEquals(0, made.get(0).sequence());
    assertEquals(2, made.get(0).start());
    assertEquals(3, made.get(0).end());
    assertFalse(made.get(0).isInsertion());
    assertTrue(made.get(1).isInsertion());

    assertEquals(List.of(1, 0), edits.replayOrder().stream().map(TokenEdits.Edit::sequence).collect(Collectors.toList()));
  }

  @Provide
  Arbitrary<String> sources() {
    final Arbitrary<String> word = Arbitraries.of(
      "a", "bc", "42", "'s'", "(", ")", "{", "}", ";", ",", "+", "=", "// note\n", "/* c */", " ", "\n"
    );
    return word.list().ofMaxSize(25).map(words -> String.join(" ", words));
  }

  @Property(tries = 200)
  void replacingEveryTokenWithItselfReconstructsSource(@ForAll("sources") String source) {
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    for (Token token : tokens) {
      if (!token.is(TokenType.END_OF_INPUT)) {
        edits.replace(token, Token.synthetic(token.type(), token.value()));
      }
    }
    assertEquals(source, edits.reconstruct(source));
    assertEquals(values(tokens), values(edits.apply(tokens)));
  }

  @Property(tries = 200)
  void removingEveryIdentifierKeepsEverythingElse(@ForAll("sources") String source) {
    final List<Token> tokens = Lexer.tokenize(source);
    final var edits = new TokenEdits();
    final var expected = new StringBuilder(source);
    for (int i = tokens.size() - 1; i >= 0; i--) {
      final Token token = tokens.get(i);
      if (token.is(TokenType.IDENTIFIER)) {
        edits.remove(token);
        expected.delete(token.start(), token.end());
      }
    }
    assertEquals(expected.toString(), edits.reconstruct(source));
  }
}
