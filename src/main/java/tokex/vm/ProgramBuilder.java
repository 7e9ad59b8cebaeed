package tokex.vm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import tokex.lexer.Token;
import tokex.lexer.TokenType;
import tokex.parser.BalancedRegion;
import tokex.parser.Lookaround;
import tokex.parser.PatternVisitor;
import tokex.tree.PatternNode;

/**
 * Pattern visitor which compiles a pattern into backtracking instructions.
 *
 * <p>The output of visiting a subpattern is the instruction list for that
 * subpattern alone. Since all jumps are relative, lists combine by simple
 * concatenation, and a repeated subpattern just gets its list copied again.
 *
 * <p>Loops whose body could match no tokens are guarded with a register: the
 * body start is marked and an iteration which did not move past the mark is
 * rejected, so the loop exits instead of spinning.
 */
public final class ProgramBuilder implements PatternVisitor<List<Instruction>> {

  private int registerCount = 0;
  private int groupCount = 0;

  /**
   * Compile a pattern tree into a program.
   *
   * @param tree pattern to compile
   * @return program matching the pattern
   */
  public static Program compile(PatternNode tree) {
    final var builder = new ProgramBuilder();
    final var instructions = new ArrayList<>(tree.accept(builder));
    instructions.add(new Instruction.Match());
    return new Program(instructions, builder.groupCount, builder.registerCount);
  }

  @Override
  public List<Instruction> visitEpsilon() {
    return List.of();
  }

  @Override
  public List<Instruction> visitTokenClass(TokenType type, boolean negated) {
    final String shorthand = negated
      ? Character.toUpperCase(type.shorthand.charAt(0)) + type.shorthand.substring(1)
      : type.shorthand;
    return List.of(new Instruction.Consume(
      token -> negated
        ? !token.is(type) && !token.is(TokenType.END_OF_INPUT)
        : token.is(type),
      "\\" + shorthand
    ));
  }

  @Override
  public List<Instruction> visitLiteral(String value, Optional<TokenType> type) {
    final String description = type.map(t -> "\\" + t.shorthand).orElse("") + '"' + value + '"';
    if (type.isPresent()) {
      final TokenType required = type.get();
      return List.of(new Instruction.Consume(token -> token.is(required, value), description));
    }
    return List.of(new Instruction.Consume(token -> token.hasValue(value), description));
  }

  @Override
  public List<Instruction> visitAny() {
    return List.of(new Instruction.Consume((Token token) -> !token.is(TokenType.END_OF_INPUT), "."));
  }

  @Override
  public List<Instruction> visitConcatenation(List<Instruction> lhs, List<Instruction> rhs) {
    final var instructions = new ArrayList<Instruction>(lhs.size() + rhs.size());
    instructions.addAll(lhs);
    instructions.addAll(rhs);
    return instructions;
  }

  @Override
  public List<Instruction> visitAlternation(List<Instruction> lhs, List<Instruction> rhs) {
    final var instructions = new ArrayList<Instruction>(lhs.size() + rhs.size() + 2);
    instructions.add(new Instruction.Split(1, lhs.size() + 2));
    instructions.addAll(lhs);
    instructions.add(new Instruction.Jump(rhs.size() + 1));
    instructions.addAll(rhs);
    return instructions;
  }

  @Override
  public List<Instruction> visitKleene(List<Instruction> lhs, boolean isLazy) {
    final int register = registerCount++;
    final int length = lhs.size();
    final var instructions = new ArrayList<Instruction>(length + 4);
    instructions.add(isLazy ? new Instruction.Split(length + 4, 1) : new Instruction.Split(1, length + 4));
    instructions.add(new Instruction.Mark(register));
    instructions.addAll(lhs);
    instructions.add(new Instruction.Progress(register));
    instructions.add(new Instruction.Jump(-(length + 3)));
    return instructions;
  }

  @Override
  public List<Instruction> visitOptional(List<Instruction> lhs, boolean isLazy) {
    final int length = lhs.size();
    final var instructions = new ArrayList<Instruction>(length + 1);
    instructions.add(isLazy ? new Instruction.Split(length + 1, 1) : new Instruction.Split(1, length + 1));
    instructions.addAll(lhs);
    return instructions;
  }

  @Override
  public List<Instruction> visitRepetition(
    List<Instruction> lhs,
    int atLeast,
    OptionalInt atMost,
    boolean isLazy
  ) {
    // `atMost` portion - either nested optionals or a kleene star
    List<Instruction> tail;
    if (atMost.isPresent()) {
      tail = List.of();
      for (int i = atLeast; i < atMost.getAsInt(); i++) {
        tail = visitOptional(visitConcatenation(lhs, tail), isLazy);
      }
    } else {
      tail = visitKleene(lhs, isLazy);
    }

    // `atLeast` portion
    final var instructions = new ArrayList<Instruction>(atLeast * lhs.size() + tail.size());
    for (int i = 0; i < atLeast; i++) {
      instructions.addAll(lhs);
    }
    instructions.addAll(tail);
    return instructions;
  }

  @Override
  public List<Instruction> visitGroup(List<Instruction> arg, OptionalInt groupIndex, Optional<String> name) {
    if (groupIndex.isEmpty()) {
      return arg;
    }
    final int group = groupIndex.getAsInt();
    groupCount = Math.max(groupCount, group + 1);

    final var instructions = new ArrayList<Instruction>(arg.size() + 2);
    instructions.add(new Instruction.OpenGroup(group));
    instructions.addAll(arg);
    instructions.add(new Instruction.CloseGroup(group));
    return instructions;
  }

  @Override
  public List<Instruction> visitLookaround(List<Instruction> arg, Lookaround lookaround) {
    final var body = new ArrayList<Instruction>(arg.size() + 1);
    body.addAll(arg);
    body.add(new Instruction.Match());
    return List.of(new Instruction.Assert(body, lookaround));
  }

  @Override
  public List<Instruction> visitBackreference(int groupIndex, OptionalInt depth) {
    return List.of(new Instruction.Backreference(groupIndex, depth));
  }

  @Override
  public List<Instruction> visitBalanced(BalancedRegion region) {
    return List.of(new Instruction.Balanced(region));
  }
}
