package tokex.dispatch;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import tokex.TokenPattern;

/**
 * Entry of a dispatch table.
 *
 * @param pattern pattern that must match for the handler to run
 * @param handler code to run on a match
 * @param name identity of the registration, used to select it for nested
 *   traversals, to restrict callers, and to file its results
 * @param displayName optional human-readable label
 * @param priority registrations with higher priority are tried first
 * @param consumes whether the cursor moves past the matched tokens, instead of
 *   just past the first of them
 * @param allowedCallers if non-empty, the registration can only fire inside a
 *   nested traversal started by one of these registrations
 */
public record Registration(
  TokenPattern pattern,
  Handler handler,
  String name,
  Optional<String> displayName,
  int priority,
  boolean consumes,
  Set<String> allowedCallers
) {

  public Registration {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(name, "name");
    allowedCallers = Set.copyOf(allowedCallers);
  }

  /**
   * Start building a registration.
   *
   * @param pattern token pattern text
   * @param handler code to run on a match
   * @return builder, with priority 0, consuming, and no caller restriction
   * @throws PatternSyntaxException if the pattern is malformed
   */
  public static Builder on(String pattern, Handler handler) throws PatternSyntaxException {
    return new Builder(TokenPattern.compile(pattern), handler);
  }

  /**
   * Start building a registration for an already compiled pattern.
   *
   * @param pattern compiled token pattern
   * @param handler code to run on a match
   * @return builder, with priority 0, consuming, and no caller restriction
   */
  public static Builder on(TokenPattern pattern, Handler handler) {
    return new Builder(pattern, handler);
  }

  /**
   * Whether this registration may fire in a traversal started by a caller.
   *
   * @param caller name of the registration whose handler started the
   *   traversal, or {@code null} at the top level
   * @return whether the registration is allowed to fire
   */
  public boolean permits(String caller) {
    return allowedCallers.isEmpty() || (caller != null && allowedCallers.contains(caller));
  }

  /**
   * @return display name if there is one, otherwise the name
   */
  public String label() {
    return displayName.orElse(name);
  }

  public static final class Builder {
    private final TokenPattern pattern;
    private final Handler handler;
    private String name = null;
    private String displayName = null;
    private int priority = 0;
    private boolean consumes = true;
    private final Set<String> allowedCallers = new LinkedHashSet<>();

    private Builder(TokenPattern pattern, Handler handler) {
      this.pattern = Objects.requireNonNull(pattern, "pattern");
      this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Set the identity of the registration. Defaults to the pattern text.
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder priority(int priority) {
      this.priority = priority;
      return this;
    }

    public Builder consumes(boolean consumes) {
      this.consumes = consumes;
      return this;
    }

    /**
     * Only let the registration fire in nested traversals started by the
     * given registrations.
     */
    public Builder allowedCallers(String... callers) {
      allowedCallers.addAll(Arrays.asList(callers));
      return this;
    }

    public Registration build() {
      return new Registration(
        pattern,
        handler,
        name != null ? name : pattern.pattern(),
        Optional.ofNullable(displayName),
        priority,
        consumes,
        allowedCallers
      );
    }
  }
}
