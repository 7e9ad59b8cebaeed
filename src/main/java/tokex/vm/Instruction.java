package tokex.vm;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;
import tokex.lexer.Token;
import tokex.parser.BalancedRegion;
import tokex.parser.Lookaround;

/**
 * Instruction in a backtracking {@link Program}.
 *
 * <p>Jump targets are relative to the instruction doing the jumping, so
 * instruction lists for subpatterns can be concatenated and repeated without
 * any relocation.
 */
public interface Instruction {

  /**
   * Consume one token if it satisfies a test, otherwise fail.
   *
   * @param test test the token must pass
   * @param description pattern text for the test, used when printing programs
   */
  record Consume(Predicate<Token> test, String description) implements Instruction {
    @Override
    public String toString() {
      return "consume " + description;
    }
  }

  /**
   * Continue at {@code primary}, retrying from {@code secondary} on failure.
   */
  record Split(int primary, int secondary) implements Instruction {
    @Override
    public String toString() {
      return "split " + primary + ", " + secondary;
    }
  }

  record Jump(int offset) implements Instruction {
    @Override
    public String toString() {
      return "jump " + offset;
    }
  }

  /**
   * Remember the current position as the tentative start of a group.
   */
  record OpenGroup(int group) implements Instruction {
    @Override
    public String toString() {
      return "open " + group;
    }
  }

  /**
   * Commit a group spanning from its tentative start to the current position.
   */
  record CloseGroup(int group) implements Instruction {
    @Override
    public String toString() {
      return "close " + group;
    }
  }

  /**
   * Save the current position into a loop register.
   */
  record Mark(int register) implements Instruction {
    @Override
    public String toString() {
      return "mark r" + register;
    }
  }

  /**
   * Fail unless the position moved since the matching {@link Mark}.
   */
  record Progress(int register) implements Instruction {
    @Override
    public String toString() {
      return "progress r" + register;
    }
  }

  record Backreference(int group, OptionalInt depth) implements Instruction {
    @Override
    public String toString() {
      return "backref " + group + (depth.isPresent() ? "@" + depth.getAsInt() : "");
    }
  }

  record Balanced(BalancedRegion region) implements Instruction {
    @Override
    public String toString() {
      return "balanced " + region;
    }
  }

  /**
   * Zero-width assertion running a separate instruction list, which ends in
   * its own {@link Match}.
   */
  record Assert(List<Instruction> body, Lookaround kind) implements Instruction {
    public Assert {
      body = List.copyOf(body);
    }

    @Override
    public String toString() {
      return "assert " + kind + " " + body;
    }
  }

  record Match() implements Instruction {
    @Override
    public String toString() {
      return "match";
    }
  }
}
