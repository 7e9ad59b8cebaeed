package tokex.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs borrowed from regular expressions
 * that have no meaning (or no implementation) over token streams, such as
 * anchors, atomic groups, inline flags, and possessive quantifiers.
 *
 * @author Alec Theriault
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -2907468342183503117L;

  /**
   * (Capitalized, plural) name of the unsupported construct.
   */
  public final String unsupportedFeatureCategory;

  /**
   * @param unsupportedFeatureCategory plural name of the construct, eg. "Atomic groups"
   * @param pattern full pattern text
   * @param index offset of the construct in the pattern text
   */
  public UnsupportedPatternSyntaxException(
    String unsupportedFeatureCategory,
    String pattern,
    int index
  ) {
    super(unsupportedFeatureCategory + " are not supported in token patterns", pattern, index);
    this.unsupportedFeatureCategory = unsupportedFeatureCategory;
  }
}
