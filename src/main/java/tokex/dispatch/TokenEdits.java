package tokex.dispatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import tokex.Capture;
import tokex.TokenMatch;
import tokex.lexer.Token;

/**
 * Edits to a token stream, collected while traversing it and replayed
 * afterwards.
 *
 * <p>Edits are keyed by the source offsets of the tokens they target, never
 * by token index, so they do not disturb matching while the traversal is
 * still running. Replaying them against the original source text keeps all
 * untouched text (whitespace and comments included) exactly as it was.
 *
 * <p>Edits are replayed in source order. At the same offset, insertions come
 * before a replacement, and otherwise edits keep the order they were made in.
 * Replacements that overlap each other, or an insertion strictly inside a
 * replaced range, cannot be replayed.
 */
public final class TokenEdits {

  /**
   * One edit: source text {@code [start, end)} is replaced by the values of
   * the replacement tokens. Insertions have {@code start == end}.
   *
   * @param start source offset where the edit starts
   * @param end source offset where the edit ends
   * @param replacement tokens to put in place of the range
   * @param sequence order in which the edit was made
   */
  public record Edit(int start, int end, List<Token> replacement, int sequence) {
    public Edit {
      replacement = List.copyOf(replacement);
    }

    public boolean isInsertion() {
      return start == end;
    }
  }

  private static final Comparator<Edit> REPLAY_ORDER = Comparator
    .comparingInt(Edit::start)
    .thenComparing(Edit::isInsertion, Comparator.reverseOrder())
    .thenComparingInt(Edit::sequence);

  private final List<Edit> edits = new ArrayList<>();

  private static Token original(Token token) {
    if (token.isSynthetic()) {
      throw new IllegalArgumentException("Synthetic token " + token + " cannot be the target of an edit");
    }
    return token;
  }

  private static List<Token> span(List<Token> tokens) {
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Empty captures cannot be the target of an edit");
    }
    original(tokens.get(0));
    original(tokens.get(tokens.size() - 1));
    return tokens;
  }

  private void add(int start, int end, Token... newTokens) {
    edits.add(new Edit(start, end, Arrays.asList(newTokens), edits.size()));
  }

  public void insertBefore(Token target, Token... newTokens) {
    add(original(target).start(), target.start(), newTokens);
  }

  public void insertAfter(Token target, Token... newTokens) {
    add(original(target).end(), target.end(), newTokens);
  }

  public void insertBefore(Capture target, Token... newTokens) {
    insertBefore(span(target.tokens()).get(0), newTokens);
  }

  public void insertAfter(Capture target, Token... newTokens) {
    final List<Token> tokens = span(target.tokens());
    insertAfter(tokens.get(tokens.size() - 1), newTokens);
  }

  public void replace(Token target, Token... newTokens) {
    add(original(target).start(), target.end(), newTokens);
  }

  /**
   * Replace everything from the start of one token to the end of another.
   */
  public void replaceRange(Token first, Token last, Token... newTokens) {
    if (original(last).end() < original(first).start()) {
      throw new IllegalArgumentException("Range from " + first + " to " + last + " is backwards");
    }
    add(first.start(), last.end(), newTokens);
  }

  public void replace(Capture target, Token... newTokens) {
    final List<Token> tokens = span(target.tokens());
    replaceRange(tokens.get(0), tokens.get(tokens.size() - 1), newTokens);
  }

  public void replace(TokenMatch target, Token... newTokens) {
    replace(target.fullMatch(), newTokens);
  }

  public void remove(Token target) {
    replace(target);
  }

  public void remove(Capture target) {
    replace(target);
  }

  public void remove(TokenMatch target) {
    replace(target);
  }

  public boolean isEmpty() {
    return edits.isEmpty();
  }

  public int size() {
    return edits.size();
  }

  /**
   * @return edits in the order they were made
   */
  public List<Edit> edits() {
    return List.copyOf(edits);
  }

  /**
   * Edits in the order they are replayed.
   *
   * @throws IllegalStateException if two edits conflict
   */
  public List<Edit> replayOrder() throws IllegalStateException {
    final var sorted = new ArrayList<>(edits);
    sorted.sort(REPLAY_ORDER);

    int replacedUntil = 0;
    Edit lastReplacement = null;
    for (Edit edit : sorted) {
      if (lastReplacement != null && edit.start() < replacedUntil) {
        throw new IllegalStateException("Edit " + edit + " overlaps with edit " + lastReplacement);
      }
      if (!edit.isInsertion()) {
        replacedUntil = edit.end();
        lastReplacement = edit;
      }
    }
    return sorted;
  }

  /**
   * Apply the edits to the source text the tokens were lexed from.
   *
   * @param source original source text
   * @return edited text, identical to the source if there are no edits
   * @throws IllegalStateException if two edits conflict
   */
  public String reconstruct(String source) throws IllegalStateException {
    if (edits.isEmpty()) {
      return source;
    }

    final var builder = new StringBuilder(source.length());
    int copiedUntil = 0;
    for (Edit edit : replayOrder()) {
      if (edit.end() > source.length()) {
        throw new IllegalStateException("Edit " + edit + " is past the end of the source text");
      }
      builder.append(source, copiedUntil, edit.start());
      for (Token token : edit.replacement()) {
        builder.append(token.value());
      }
      copiedUntil = edit.end();
    }
    builder.append(source, copiedUntil, source.length());
    return builder.toString();
  }

  /**
   * Apply the edits to a token list.
   *
   * <p>Original tokens inside a replaced range are dropped and the
   * replacement tokens are spliced in where the range starts.
   *
   * @param tokens tokens the edits were made against, in source order
   * @return edited tokens
   * @throws IllegalStateException if two edits conflict
   */
  public List<Token> apply(List<Token> tokens) throws IllegalStateException {
    if (edits.isEmpty()) {
      return List.copyOf(tokens);
    }

    final List<Edit> sorted = replayOrder();
    final var output = new ArrayList<Token>(tokens.size());
    int nextEdit = 0;
    int removedUntil = 0;
    for (Token token : tokens) {
      while (nextEdit < sorted.size() && sorted.get(nextEdit).start() <= token.start()) {
        final Edit edit = sorted.get(nextEdit++);
        output.addAll(edit.replacement());
        removedUntil = Math.max(removedUntil, edit.end());
      }
      if (token.isSynthetic() || token.start() >= removedUntil) {
        output.add(token);
      }
    }
    while (nextEdit < sorted.size()) {
      output.addAll(sorted.get(nextEdit++).replacement());
    }
    return output;
  }
}
