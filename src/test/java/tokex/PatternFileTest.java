package tokex;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;
import tokex.lexer.LexException;
import tokex.lexer.Lexer;
import tokex.lexer.Token;

/**
 * Runs the pattern cases in {@code TestCases.txt}.
 *
 * <p>Each source is lexed, the pattern compiled, and the first match found
 * anywhere in the tokens compared against the expected outcome.
 */
public class PatternFileTest {

  /**
   * @return a description of the problem, or {@code null} if the case passed
   */
  private static String check(PatternCase patternCase) {
    final TokenPattern pattern;
    final List<Token> tokens;
    try {
      pattern = TokenPattern.compile(patternCase.pattern());
      tokens = Lexer.tokenize(patternCase.source());
    } catch (PatternSyntaxException | LexException error) {
      return patternCase.expectsError() ? null : "unexpected error: " + error.getMessage();
    }
    if (patternCase.expectsError()) {
      return "compiled, but an error was expected";
    }

    final TokenMatcher matcher = pattern.matcher(tokens);
    final String found = PatternCase.outcome(matcher.find(), matcher);
    if (found.equals(patternCase.expected())) {
      return null;
    }
    return "expected '" + patternCase.expected() + "' but got '" + found + "'";
  }

  @Test
  public void testCasesFile() throws IOException {
    final List<PatternCase> cases = PatternCaseReader.read("TestCases.txt");
    final List<String> failures = new ArrayList<>();
    for (PatternCase patternCase : cases) {
      final String problem = check(patternCase);
      if (problem != null) {
        failures.add(patternCase + ": " + problem);
      }
    }

    assertTrue(cases.size() > 30, "Expected the file to contain pattern cases");
    assertTrue(failures.isEmpty(), String.join("\n", failures));
  }
}
