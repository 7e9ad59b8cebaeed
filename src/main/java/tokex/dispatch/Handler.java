package tokex.dispatch;

import java.util.function.Consumer;

/**
 * Code run when a registration wins at some position of a traversal.
 */
@FunctionalInterface
public interface Handler {

  /**
   * Handle one match.
   *
   * @param invocation the match and everything the handler may act on
   * @return value to record in the {@link ResultStore} under the registration
   *   name, or {@code null} to record nothing
   */
  Object handle(Invocation invocation);

  /**
   * Adapt a handler that only has side effects.
   *
   * @param action what to do with each match
   * @return handler which records no result
   */
  static Handler of(Consumer<Invocation> action) {
    return invocation -> {
      action.accept(invocation);
      return null;
    };
  }
}
