package tokex.tree;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import tokex.lexer.TokenType;
import tokex.parser.BalancedRegion;
import tokex.parser.Lookaround;
import tokex.parser.PatternVisitor;

/**
 * Immutable tree of a compiled token pattern.
 *
 * <p>Trees are built by {@link PatternTreeBuilder} and can be replayed into
 * any other {@link PatternVisitor} with {@link #accept}, which is how they get
 * compiled into something executable.
 */
public interface PatternNode {

  /**
   * Replay this tree bottom-up into a visitor.
   *
   * @param visitor visitor to feed
   * @return output of the visitor for the root of this tree
   */
  <R> R accept(PatternVisitor<R> visitor);

  /**
   * One token of a given kind (or, if negated, of any other kind).
   */
  record TokenClass(TokenType type, boolean negated) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitTokenClass(type, negated);
    }
  }

  /**
   * One token with a given value, optionally also of a given kind.
   */
  record Literal(String value, Optional<TokenType> type) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitLiteral(value, type);
    }
  }

  /**
   * Any one token other than the end of input.
   */
  record Any() implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitAny();
    }
  }

  /**
   * Patterns matched one after another. The empty sequence matches nothing.
   */
  record Sequence(List<PatternNode> items) implements PatternNode {
    public Sequence {
      items = List.copyOf(items);
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      if (items.isEmpty()) {
        return visitor.visitEpsilon();
      }
      R result = items.get(0).accept(visitor);
      for (int i = 1; i < items.size(); i++) {
        result = visitor.visitConcatenation(result, items.get(i).accept(visitor));
      }
      return result;
    }
  }

  /**
   * Branches tried in order.
   */
  record Alternation(List<PatternNode> branches) implements PatternNode {
    public Alternation {
      branches = List.copyOf(branches);
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      R result = branches.get(0).accept(visitor);
      for (int i = 1; i < branches.size(); i++) {
        result = visitor.visitAlternation(result, branches.get(i).accept(visitor));
      }
      return result;
    }
  }

  /**
   * Group, capturing when it has an index.
   */
  record Group(PatternNode body, OptionalInt index, Optional<String> name) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitGroup(body.accept(visitor), index, name);
    }
  }

  /**
   * Repeated pattern. An empty maximum means unbounded.
   */
  record Quantified(PatternNode body, int min, OptionalInt max, boolean lazy) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitRepetition(body.accept(visitor), min, max, lazy);
    }
  }

  /**
   * Zero-width lookahead or lookbehind.
   */
  record Assertion(PatternNode body, Lookaround kind) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitLookaround(body.accept(visitor), kind);
    }
  }

  /**
   * Same token values as an earlier capture group. Named references are
   * resolved to indices when the pattern is parsed.
   */
  record Backreference(int index, OptionalInt depth) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitBackreference(index, depth);
    }
  }

  /**
   * Run of tokens delimited by nesting structure.
   */
  record Balanced(BalancedRegion region) implements PatternNode {
    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
      return visitor.visitBalanced(region);
    }
  }
}
