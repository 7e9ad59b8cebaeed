package tokex.lexer;

/**
 * Source text could not be tokenized.
 *
 * <p>Only literals that are opened but never closed (strings, templates,
 * regular expressions, block comments) cause this. The offset, line, and
 * column all point at where the offending literal starts.
 */
public class LexException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 3187044160723795213L;

  private final String description;
  private final int index;
  private final int line;
  private final int column;

  public LexException(String description, int index, int line, int column) {
    super(description);
    this.description = description;
    this.index = index;
    this.line = line;
    this.column = column;
  }

  public String getDescription() {
    return description;
  }

  /**
   * @return offset in the source text where the unterminated literal starts
   */
  public int getIndex() {
    return index;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String getMessage() {
    return description + " (starting at " + line + ":" + column + ", offset " + index + ")";
  }
}
