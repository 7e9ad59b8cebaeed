package tokex.vm;

import java.util.List;

/**
 * Compiled token pattern, ready to be run by a {@link Backtracker}.
 *
 * @param instructions code, ending in {@link Instruction.Match}
 * @param groupCount number of capture groups, including group 0
 * @param registerCount number of loop registers used by the code
 */
public record Program(
  List<Instruction> instructions,
  int groupCount,
  int registerCount
) {

  public Program {
    instructions = List.copyOf(instructions);
  }

  /**
   * Number of {@code int} slots of state needed to run the program: a start
   * and end per group, a tentative start per group, then the registers.
   */
  int stateSize() {
    return 3 * groupCount + registerCount;
  }

  /**
   * Readable listing of the program, one instruction per line.
   */
  public String listing() {
    final var builder = new StringBuilder();
    for (int pc = 0; pc < instructions.size(); pc++) {
      builder.append(String.format("%4d: %s%n", pc, instructions.get(pc)));
    }
    return builder.toString();
  }
}
