package tokex.vm;

import java.util.Arrays;
import java.util.List;
import tokex.lexer.Token;
import tokex.parser.Nesting;

/**
 * Interpreter running a {@link Program} over a token stream.
 *
 * <p>Choices are kept on an explicit stack instead of the Java call stack, so
 * long inputs cannot overflow it. Only lookarounds recurse, and then only as
 * deeply as they are nested in the pattern.
 *
 * <p>All of the mutable match state lives in one {@code int[]}:
 *
 * <ul>
 *   <li>at {@code 2 * g} and {@code 2 * g + 1}, the committed start and end of
 *       group {@code g}
 *   <li>at {@code 2 * groupCount + g}, where group {@code g} was last opened
 *   <li>after that, the loop registers
 * </ul>
 *
 * <p>Every write to the state is recorded on an undo trail, and every choice
 * point remembers how long the trail was when it was pushed. Backtracking pops
 * a choice point and unwinds the trail back to that length.
 */
public final class Backtracker {

  private final Program program;
  private final List<Token> tokens;
  private final int regionStart;
  private final int regionEnd;

  // Offsets into `state`
  private final int openedOffset;
  private final int registerOffset;

  private int[] state;

  // Pairs of (slot, previous value)
  private int[] trail = new int[16];
  private int trailSize = 0;

  // Triples of (pc, index, trail size)
  private int[] choices = new int[48];
  private int choicesSize = 0;

  /**
   * Make an interpreter for one program and one token stream.
   *
   * @param program program to run
   * @param tokens token stream to match against
   * @param regionStart tokens before this index are never consumed
   * @param regionEnd tokens from this index on are never consumed
   */
  public Backtracker(Program program, List<Token> tokens, int regionStart, int regionEnd) {
    this.program = program;
    this.tokens = tokens;
    this.regionStart = regionStart;
    this.regionEnd = regionEnd;
    this.openedOffset = 2 * program.groupCount();
    this.registerOffset = 3 * program.groupCount();
  }

  /**
   * Try to match the program starting at a given index.
   *
   * @param start index at which the match starts
   * @param requiredEnd index at which the match must end, or {@code -1} if it
   *   may end anywhere
   * @param groups output array of group offsets, of length
   *   {@code 2 * groupCount}; only written to if the match succeeds
   * @return whether the match succeeded
   */
  public boolean match(int start, int requiredEnd, int[] groups) {
    final int[] initial = new int[program.stateSize()];
    Arrays.fill(initial, -1);
    if (!run(program.instructions(), start, requiredEnd, initial)) {
      return false;
    }
    System.arraycopy(state, 0, groups, 0, openedOffset);
    return true;
  }

  /**
   * Run a list of instructions to its first accepting {@link Instruction.Match}.
   *
   * @param code instructions to run
   * @param start starting index
   * @param requiredEnd index at which the match must end, or {@code -1}
   * @param initial initial state, which is taken over by this run
   * @return whether a match was found, in which case {@link #state} holds it
   */
  private boolean run(List<Instruction> code, int start, int requiredEnd, int[] initial) {
    state = initial;
    trailSize = 0;
    choicesSize = 0;

    int pc = 0;
    int index = start;

    while (true) {
      final Instruction instruction = code.get(pc);
      boolean failed = false;

      if (instruction instanceof Instruction.Consume consume) {
        if (index < regionEnd && consume.test().test(tokens.get(index))) {
          index++;
          pc++;
        } else {
          failed = true;
        }
      } else if (instruction instanceof Instruction.Split split) {
        pushChoice(pc + split.secondary(), index);
        pc += split.primary();
      } else if (instruction instanceof Instruction.Jump jump) {
        pc += jump.offset();
      } else if (instruction instanceof Instruction.OpenGroup open) {
        write(openedOffset + open.group(), index);
        pc++;
      } else if (instruction instanceof Instruction.CloseGroup close) {
        final int group = close.group();
        write(2 * group, state[openedOffset + group]);
        write(2 * group + 1, index);
        pc++;
      } else if (instruction instanceof Instruction.Mark mark) {
        write(registerOffset + mark.register(), index);
        pc++;
      } else if (instruction instanceof Instruction.Progress progress) {
        if (state[registerOffset + progress.register()] == index) {
          failed = true;
        } else {
          pc++;
        }
      } else if (instruction instanceof Instruction.Backreference backreference) {
        final int end = matchBackreference(backreference, index);
        if (end < 0) {
          failed = true;
        } else {
          index = end;
          pc++;
        }
      } else if (instruction instanceof Instruction.Balanced balanced) {
        final int end = balanced.region().scan(tokens, index, regionEnd);
        if (end < 0) {
          failed = true;
        } else {
          index = end;
          pc++;
        }
      } else if (instruction instanceof Instruction.Assert assertion) {
        if (holds(assertion, index)) {
          pc++;
        } else {
          failed = true;
        }
      } else if (instruction instanceof Instruction.Match) {
        if (requiredEnd < 0 || index == requiredEnd) {
          return true;
        }
        failed = true;
      } else {
        throw new IllegalStateException("Unknown instruction " + instruction);
      }

      if (failed) {
        if (choicesSize == 0) {
          return false;
        }
        choicesSize -= 3;
        pc = choices[choicesSize];
        index = choices[choicesSize + 1];
        unwind(choices[choicesSize + 2]);
      }
    }
  }

  /**
   * Match a backreference at the given index.
   *
   * @return index after the matched tokens, or {@code -1} if there is no match
   */
  private int matchBackreference(Instruction.Backreference backreference, int index) {
    final int group = backreference.group();
    final int groupStart = state[2 * group];
    final int groupEnd = state[2 * group + 1];
    if (groupStart < 0) {
      return -1;
    }

    if (backreference.depth().isPresent()
        && Nesting.depthAfter(tokens, groupStart, index) != backreference.depth().getAsInt()) {
      return -1;
    }

    final int length = groupEnd - groupStart;
    if (index + length > regionEnd) {
      return -1;
    }
    for (int i = 0; i < length; i++) {
      if (!tokens.get(groupStart + i).value().equals(tokens.get(index + i).value())) {
        return -1;
      }
    }
    return index + length;
  }

  /**
   * Check a lookaround at the given index.
   *
   * <p>The assertion body runs in a separate interpreter on a copy of the
   * current state, so it can read captures made so far but nothing it
   * captures is kept.
   */
  private boolean holds(Instruction.Assert assertion, int index) {
    final var nested = new Backtracker(program, tokens, regionStart, regionEnd);
    boolean found = false;
    if (assertion.kind().isBehind()) {
      for (int start = index; start >= regionStart && !found; start--) {
        found = nested.run(assertion.body(), start, index, state.clone());
      }
    } else {
      found = nested.run(assertion.body(), index, -1, state.clone());
    }
    return found != assertion.kind().isNegated();
  }

  private void write(int slot, int value) {
    if (trailSize + 2 > trail.length) {
      trail = Arrays.copyOf(trail, trail.length * 2);
    }
    trail[trailSize++] = slot;
    trail[trailSize++] = state[slot];
    state[slot] = value;
  }

  private void unwind(int toSize) {
    while (trailSize > toSize) {
      final int previous = trail[--trailSize];
      final int slot = trail[--trailSize];
      state[slot] = previous;
    }
  }

  private void pushChoice(int pc, int index) {
    if (choicesSize + 3 > choices.length) {
      choices = Arrays.copyOf(choices, choices.length * 2);
    }
    choices[choicesSize++] = pc;
    choices[choicesSize++] = index;
    choices[choicesSize++] = trailSize;
  }
}
