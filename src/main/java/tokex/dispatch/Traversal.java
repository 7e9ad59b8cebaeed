package tokex.dispatch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokex.TokenMatch;
import tokex.lexer.Token;
import tokex.lexer.TokenType;

/**
 * State of one top-level visit: the tokens, the stores handlers share, the
 * edits they made, and the stack of registrations running nested traversals.
 */
public final class Traversal {

  private static final Logger log = LoggerFactory.getLogger(Traversal.class);

  private final Dispatcher dispatcher;
  private final List<Token> tokens;
  private final String source;
  private final ContextStore context;
  private final ResultStore results = new ResultStore();
  private final TokenEdits edits = new TokenEdits();

  // Names of registrations running nested traversals, innermost first
  private final Deque<String> callers = new ArrayDeque<>();

  Traversal(Dispatcher dispatcher, List<Token> tokens, String source, ContextStore context) {
    this.dispatcher = dispatcher;
    this.tokens = tokens;
    this.source = source;
    this.context = context;
  }

  /**
   * Dispatch over {@code [from, to)} with the given candidates.
   *
   * <p>Stops early at an end-of-input token.
   */
  void run(List<Registration> candidates, int from, int to) {
    int index = from;
    while (index < to) {
      final Token token = tokens.get(index);
      if (token.is(TokenType.END_OF_INPUT)) {
        break;
      }

      final String caller = callers.peek();
      Registration winner = null;
      TokenMatch match = null;
      for (Registration registration : candidates) {
        if (!registration.permits(caller)) {
          continue;
        }
        final Optional<TokenMatch> attempt = registration.pattern().tryMatch(tokens, index, to);
        if (attempt.isPresent()) {
          winner = registration;
          match = attempt.get();
          break;
        }
      }

      if (winner == null) {
        log.trace("No registration matched {} at {}", token, index);
        for (DispatchListener listener : dispatcher.listeners()) {
          listener.onUnmatched(token, index, this);
        }
        index++;
        continue;
      }

      log.trace("{} matched tokens [{}, {})", winner.label(), match.start(), match.end());
      final var invocation = new Invocation(this, winner, match, index, to);
      final Object result = winner.handler().handle(invocation);
      if (result != null) {
        results.record(winner.name(), result);
      }

      if (invocation.skipTarget() > index) {
        index = invocation.skipTarget();
      } else if (winner.consumes()) {
        index = Math.max(match.end(), index + 1);
      } else {
        index++;
      }
    }
  }

  /**
   * Run a nested traversal on behalf of a registration.
   */
  void nested(Registration caller, List<String> names, int from, int to) {
    final List<Registration> candidates = dispatcher.select(names);
    log.trace("{} traversing [{}, {}) with {}", caller.label(), from, to, names);
    callers.push(caller.name());
    try {
      run(candidates, from, to);
    } finally {
      callers.pop();
    }
  }

  public Dispatcher dispatcher() {
    return dispatcher;
  }

  public List<Token> tokens() {
    return tokens;
  }

  public Optional<String> source() {
    return Optional.ofNullable(source);
  }

  public ContextStore context() {
    return context;
  }

  public ResultStore results() {
    return results;
  }

  public TokenEdits edits() {
    return edits;
  }

  /**
   * @return names of the registrations running nested traversals, innermost
   *   first; empty at the top level
   */
  public List<String> callers() {
    return List.copyOf(callers);
  }

  /**
   * Replay the edits made during the traversal against the source text.
   *
   * @return edited source text
   * @throws IllegalStateException if the visit had no source text, or if two
   *   edits conflict
   */
  public String reconstruct() throws IllegalStateException {
    if (source == null) {
      throw new IllegalStateException("No source text was given to the visit");
    }
    return edits.reconstruct(source);
  }

  /**
   * @return tokens with the edits made during the traversal applied
   */
  public List<Token> modifiedTokens() {
    return edits.apply(tokens);
  }
}
