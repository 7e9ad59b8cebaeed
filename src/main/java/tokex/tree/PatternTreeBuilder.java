package tokex.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import tokex.lexer.TokenType;
import tokex.parser.BalancedRegion;
import tokex.parser.Lookaround;
import tokex.parser.PatternVisitor;

/**
 * Builds an explicit {@link PatternNode} tree from parser callbacks.
 *
 * <p>Nested concatenations and alternations are flattened, so {@code a b c}
 * is one three-item sequence. The builder also keeps track of every capture
 * group it sees, which is how the compiled pattern learns its group count and
 * group names.
 */
public final class PatternTreeBuilder implements PatternVisitor<PatternNode> {

  private int groupCount = 0;
  private final Map<String, Integer> groupNames = new LinkedHashMap<>();

  /**
   * @return number of capture groups seen, including group 0 if it was seen
   */
  public int groupCount() {
    return groupCount;
  }

  /**
   * @return named groups seen, in order of appearance
   */
  public Map<String, Integer> groupNames() {
    return Collections.unmodifiableMap(groupNames);
  }

  @Override
  public PatternNode visitEpsilon() {
    return new PatternNode.Sequence(List.of());
  }

  @Override
  public PatternNode visitTokenClass(TokenType type, boolean negated) {
    return new PatternNode.TokenClass(type, negated);
  }

  @Override
  public PatternNode visitLiteral(String value, Optional<TokenType> type) {
    return new PatternNode.Literal(value, type);
  }

  @Override
  public PatternNode visitAny() {
    return new PatternNode.Any();
  }

  @Override
  public PatternNode visitConcatenation(PatternNode lhs, PatternNode rhs) {
    final var items = new ArrayList<PatternNode>();
    for (PatternNode node : List.of(lhs, rhs)) {
      if (node instanceof PatternNode.Sequence sequence) {
        items.addAll(sequence.items());
      } else {
        items.add(node);
      }
    }
    return new PatternNode.Sequence(items);
  }

  @Override
  public PatternNode visitAlternation(PatternNode lhs, PatternNode rhs) {
    final var branches = new ArrayList<PatternNode>();
    if (lhs instanceof PatternNode.Alternation alternation) {
      branches.addAll(alternation.branches());
    } else {
      branches.add(lhs);
    }
    branches.add(rhs);
    return new PatternNode.Alternation(branches);
  }

  @Override
  public PatternNode visitRepetition(PatternNode lhs, int atLeast, OptionalInt atMost, boolean isLazy) {
    return new PatternNode.Quantified(lhs, atLeast, atMost, isLazy);
  }

  @Override
  public PatternNode visitGroup(PatternNode arg, OptionalInt groupIndex, Optional<String> name) {
    if (groupIndex.isPresent()) {
      groupCount = Math.max(groupCount, groupIndex.getAsInt() + 1);
      name.ifPresent(n -> groupNames.put(n, groupIndex.getAsInt()));
    }
    return new PatternNode.Group(arg, groupIndex, name);
  }

  @Override
  public PatternNode visitLookaround(PatternNode arg, Lookaround lookaround) {
    return new PatternNode.Assertion(arg, lookaround);
  }

  @Override
  public PatternNode visitBackreference(int groupIndex, OptionalInt depth) {
    return new PatternNode.Backreference(groupIndex, depth);
  }

  @Override
  public PatternNode visitBalanced(BalancedRegion region) {
    return new PatternNode.Balanced(region);
  }
}
