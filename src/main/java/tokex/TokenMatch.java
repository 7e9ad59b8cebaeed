package tokex;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import tokex.lexer.Token;

/**
 * Array-backed result of matching a token pattern.
 *
 * <p>Offsets are indices into the token list, not into source text. The
 * {@code String} accessors inherited from {@link MatchResult} return the
 * values of the captured tokens concatenated together. A group which did not
 * participate in the match has start and end {@code -1} and a {@code null}
 * group, while {@link #capture(int)} reports it as empty.
 */
public class TokenMatch implements MatchResult {

  /**
   * Tokens against which the pattern was run.
   */
  protected final List<Token> tokens;

  /**
   * Token offsets of start/end groups.
   *
   * <p>Length is equal to {@code 2 * (groupCount + 1)}, with starts at even
   * indices and ends at odd indices.
   */
  protected final int[] groups;

  /**
   * Count of capture groups in the pattern (not including group 0).
   */
  protected final int groupCount;

  /**
   * Names of named capture groups.
   */
  protected final Map<String, Integer> namedGroups;

  TokenMatch(List<Token> tokens, int[] groups, Map<String, Integer> namedGroups) {
    this.tokens = tokens;
    this.groups = groups;
    this.groupCount = (groups.length >> 1) - 1;
    this.namedGroups = namedGroups;
  }

  /**
   * Start and end offsets of every group.
   *
   * <p>Every accessor reads offsets through here, so a subclass whose
   * offsets are not always valid can refuse access in one place.
   */
  protected int[] offsets() {
    return groups;
  }

  private int checkedIndex(int groupIndex) throws IndexOutOfBoundsException {
    if (groupIndex < 0 || groupIndex > groupCount) {
      throw new IndexOutOfBoundsException("No capture group " + groupIndex);
    }
    return groupIndex;
  }

  private int namedIndex(String name) throws IllegalArgumentException {
    final Integer groupIndex = namedGroups.get(name);
    if (groupIndex == null) {
      throw new IllegalArgumentException("No group with name <" + name + ">");
    }
    return groupIndex;
  }

  private String text(int groupIndex) {
    final int[] offsets = offsets();
    final int from = offsets[2 * groupIndex];
    final int to = offsets[2 * groupIndex + 1];
    if (from < 0) {
      return null;
    }
    return tokens.subList(from, to).stream().map(Token::value).collect(Collectors.joining());
  }

  @Override
  public int groupCount() {
    return groupCount;
  }

  @Override
  public int start() {
    return start(0);
  }

  @Override
  public int end() {
    return end(0);
  }

  @Override
  public String group() {
    return group(0);
  }

  @Override
  public int start(int groupIndex) throws IndexOutOfBoundsException {
    return offsets()[2 * checkedIndex(groupIndex)];
  }

  @Override
  public int end(int groupIndex) throws IndexOutOfBoundsException {
    return offsets()[2 * checkedIndex(groupIndex) + 1];
  }

  @Override
  public String group(int groupIndex) throws IndexOutOfBoundsException {
    return text(checkedIndex(groupIndex));
  }

  public int start(String name) {
    return start(namedIndex(name));
  }

  public int end(String name) {
    return end(namedIndex(name));
  }

  public String group(String name) {
    return group(namedIndex(name));
  }

  /**
   * @return mapping from group names to group indices
   */
  public Map<String, Integer> namedGroups() {
    return namedGroups;
  }

  /**
   * Get a capture group by index.
   *
   * @param groupIndex index of the group
   * @return the capture, or empty if the group did not participate in the match
   */
  public Optional<Capture> capture(int groupIndex) throws IndexOutOfBoundsException {
    final int start = start(groupIndex);
    final int end = end(groupIndex);
    if (start < 0) {
      return Optional.empty();
    }
    return Optional.of(new Capture(groupIndex, nameOf(groupIndex), start, end, tokens.subList(start, end)));
  }

  /**
   * Get a capture group by name.
   *
   * @param name name of the group
   * @return the capture, or empty if the group did not participate in the match
   */
  public Optional<Capture> capture(String name) throws IllegalArgumentException {
    return capture(namedIndex(name));
  }

  /**
   * @return the whole match as a capture
   */
  public Capture fullMatch() {
    return capture(0).orElseThrow();
  }

  /**
   * @return tokens spanned by the whole match
   */
  public List<Token> matchedTokens() {
    return tokens.subList(start(), end());
  }

  /**
   * @return tokens against which the pattern was run
   */
  public List<Token> tokens() {
    return tokens;
  }

  private Optional<String> nameOf(int groupIndex) {
    return namedGroups
      .entrySet()
      .stream()
      .filter(entry -> entry.getValue() == groupIndex)
      .map(Map.Entry::getKey)
      .findFirst();
  }

  /**
   * Ordered stream of all of the groups in the match result.
   */
  public Stream<String> groups() {
    return IntStream
      .rangeClosed(0, groupCount)
      .mapToObj(this::group);
  }

  /**
   * @return all groups that participated in the match, in order
   */
  public List<Capture> captures() {
    return IntStream
      .rangeClosed(0, groupCount)
      .mapToObj(this::capture)
      .flatMap(Optional::stream)
      .collect(Collectors.toList());
  }

  /**
   * Make an immutable snapshot of the match result.
   */
  public TokenMatch toMatchResult() {
    return new TokenMatch(tokens, offsets().clone(), namedGroups);
  }

  @Override
  public String toString() {
    return "TokenMatch[" + start() + ", " + end() + ") " + groups().collect(Collectors.toList());
  }
}
