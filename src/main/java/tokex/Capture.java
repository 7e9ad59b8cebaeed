package tokex;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import tokex.lexer.Token;

/**
 * Capture group that participated in a match.
 *
 * @param index index of the group (0 for the whole match)
 * @param name name of the group, if it is a named group
 * @param start index of the first captured token
 * @param end index after the last captured token
 * @param tokens captured tokens
 */
public record Capture(
  int index,
  Optional<String> name,
  int start,
  int end,
  List<Token> tokens
) {

  public Capture {
    tokens = List.copyOf(tokens);
  }

  /**
   * @return values of the captured tokens, concatenated
   */
  public String value() {
    return tokens.stream().map(Token::value).collect(Collectors.joining());
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public int size() {
    return tokens.size();
  }
}
