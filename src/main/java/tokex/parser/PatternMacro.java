package tokex.parser;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Named shorthands for common multi-token shapes, written as a backslash
 * followed by either name ({@code \fc} or {@code \call}).
 *
 * <p>A macro stands for its expansion as if that were wrapped in a
 * non-capturing group, so a quantifier after it applies to the whole shape.
 * Expansions never declare capture groups.
 */
public enum PatternMacro {

  /** Arrow function head: {@code (a, b) =>} or {@code x =>}. */
  LAMBDA("la", "lambda", "['(' .*? ')' | \\i] '=>'"),

  /** Type annotation: {@code : T} or {@code : T<U>}. */
  TYPE("ty", "type", "':' [\\tn | \\i] (?:'<' .*? '>')?"),

  /** Generic parameter list: {@code <T>} or {@code <T, U>}. */
  GENERIC("ge", "generic", "'<' [\\tn | \\i] (?:',' [\\tn | \\i])* '>'"),

  /** Call: {@code name(args)}. */
  CALL("fc", "call", "\\i '(' .*? ')'"),

  /** Index: {@code [index]}. */
  INDEX("ax", "array", "'[' .*? ']'"),

  BLOCK("bl", "block", "'{' .*? '}'"),

  PARENS("pa", "parens", "'(' .*? ')'"),

  /** Decorator with optional arguments: {@code @name} or {@code @name(args)}. */
  DECORATOR("de", "decorator", "\\dc (?:'(' .*? ')')?"),

  /** Property access chain: {@code .a.b}. */
  PROPERTY("pr", "prop", "(?:'.' \\i)+"),

  OPTIONAL_CHAIN("oc", "optchain", "'?.' \\i"),

  SPREAD("sp", "spread", "'...' \\i"),

  /** Array destructuring of plain names: {@code [a, b]}. */
  ARRAY_PATTERN("da", "destarray", "'[' \\i (?:',' \\i)* ']'"),

  /** Object destructuring of plain names: <code>{a, b}</code>. */
  OBJECT_PATTERN("do", "destobj", "'{' \\i (?:',' \\i)* '}'"),

  /** Ternary up to its colon: {@code ? a :}. */
  TERNARY("te", "ternary", "'?' .*? ':'"),

  /** Import up to its module: {@code import x from "y"}. */
  IMPORT("im", "import", "\\k'import' .*? \\k'from' \\s"),

  EXPORT("ex", "export", "\\k'export' (?:\\k'default')?"),

  /** Async function or async arrow head. */
  ASYNC("af", "async", "\\k'async' [\\k'function' | ['(' .*? ')' | \\i] '=>']"),

  AWAIT("aw", "await", "\\k'await' [\\fc | \\i]");

  private final String shortName;
  private final String longName;
  private final String expansion;

  PatternMacro(String shortName, String longName, String expansion) {
    this.shortName = shortName;
    this.longName = longName;
    this.expansion = expansion;
  }

  /**
   * Mapping from both names of every macro to the macro.
   */
  public static final Map<String, PatternMacro> NAMES;

  static {
    final var names = new HashMap<String, PatternMacro>();
    for (PatternMacro macro : values()) {
      names.put(macro.shortName, macro);
      names.put(macro.longName, macro);
    }
    NAMES = Map.copyOf(names);
  }

  public List<String> names() {
    return List.of(shortName, longName);
  }

  /**
   * @return pattern text the macro stands for
   */
  public String expansion() {
    return expansion;
  }
}
