package tokex.parser;

/**
 * Zero-width assertions that look at the tokens around the current position
 * without consuming them.
 */
public enum Lookaround {
  /**
   * {@code (?=...)}
   */
  AHEAD(false, false),

  /**
   * {@code (?!...)}
   */
  NEGATIVE_AHEAD(false, true),

  /**
   * {@code (?<=...)}
   */
  BEHIND(true, false),

  /**
   * {@code (?<!...)}
   */
  NEGATIVE_BEHIND(true, true);

  private final boolean behind;
  private final boolean negated;

  Lookaround(boolean behind, boolean negated) {
    this.behind = behind;
    this.negated = negated;
  }

  /**
   * @return whether the subpattern must end (instead of start) at the current position
   */
  public boolean isBehind() {
    return behind;
  }

  /**
   * @return whether the assertion holds when the subpattern does not match
   */
  public boolean isNegated() {
    return negated;
  }
}
