package tokex.dispatch;

import tokex.lexer.Token;

/**
 * Lifecycle hooks of a traversal. All methods default to doing nothing.
 */
public interface DispatchListener {

  /**
   * Called before a top-level visit starts.
   */
  default void onBegin(Traversal traversal) {
  }

  /**
   * Called after a top-level visit ends.
   */
  default void onEnd(Traversal traversal) {
  }

  /**
   * Called when no registration matched at a position, top-level or nested.
   *
   * @param token token at the unmatched position
   * @param index index of the token
   * @param traversal traversal in progress
   */
  default void onUnmatched(Token token, int index, Traversal traversal) {
  }
}
