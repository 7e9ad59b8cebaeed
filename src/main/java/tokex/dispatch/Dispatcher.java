package tokex.dispatch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tokex.lexer.Lexer;
import tokex.lexer.Token;

/**
 * Table of token pattern registrations, dispatched over token streams.
 *
 * <p>A visit scans the tokens left to right. At every position the
 * registrations are tried in descending priority (ties in the order they
 * were registered) and the handler of the first one whose pattern matches
 * there is run. Registrations restricted to certain callers are left out of
 * the top-level scan entirely; they only fire inside nested traversals started
 * by one of their allowed callers (see {@link Invocation#traverse}).
 *
 * <p>Dispatchers are immutable and can be reused across visits. All of the
 * state of a visit lives in the {@link Traversal} it returns.
 */
public final class Dispatcher {

  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private static final Comparator<Registration> DISPATCH_ORDER =
    Comparator.comparingInt(Registration::priority).reversed();

  private final List<Registration> registrations;
  private final List<Registration> topLevel;
  private final List<DispatchListener> listeners;

  private Dispatcher(List<Registration> registrations, List<DispatchListener> listeners) {
    // `List.sort` is stable, so equal priorities keep registration order
    final var sorted = new ArrayList<>(registrations);
    sorted.sort(DISPATCH_ORDER);
    this.registrations = List.copyOf(sorted);
    this.topLevel = sorted
      .stream()
      .filter(registration -> registration.allowedCallers().isEmpty())
      .collect(Collectors.toUnmodifiableList());
    this.listeners = List.copyOf(listeners);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return all registrations, in the order they are tried
   */
  public List<Registration> registrations() {
    return registrations;
  }

  List<DispatchListener> listeners() {
    return listeners;
  }

  /**
   * Visit a token stream with all of the unrestricted registrations.
   *
   * @param tokens tokens to visit
   * @return finished traversal
   */
  public Traversal visit(List<Token> tokens) {
    return visit(tokens, null, new ContextStore());
  }

  /**
   * Visit a token stream, keeping the source text around so that edits can
   * be replayed against it with {@link Traversal#reconstruct()}.
   *
   * @param tokens tokens to visit, lexed from {@code source}
   * @param source source text of the tokens
   * @return finished traversal
   */
  public Traversal visit(List<Token> tokens, String source) {
    return visit(tokens, source, new ContextStore());
  }

  /**
   * Visit a token stream with a context store shared with other visits.
   *
   * @param tokens tokens to visit
   * @param source source text of the tokens, or {@code null}
   * @param context context store, which is not cleared first
   * @return finished traversal
   */
  public Traversal visit(List<Token> tokens, String source, ContextStore context) {
    return run(new Traversal(this, tokens, source, context), topLevel);
  }

  /**
   * Visit a token stream with only some of the registrations.
   *
   * <p>This is a top-level visit, so registrations restricted to certain
   * callers still never fire.
   *
   * @param tokens tokens to visit
   * @param names names of the registrations to use
   * @param context context store, which is not cleared first
   * @return finished traversal
   */
  public Traversal traverse(List<Token> tokens, Collection<String> names, ContextStore context) {
    return run(new Traversal(this, tokens, null, context), select(names));
  }

  private Traversal run(Traversal traversal, List<Registration> candidates) {
    final int size = traversal.tokens().size();
    log.debug("Visiting {} tokens with {} registrations", size, candidates.size());

    for (DispatchListener listener : listeners) {
      listener.onBegin(traversal);
    }
    traversal.run(candidates, 0, size);
    for (DispatchListener listener : listeners) {
      listener.onEnd(traversal);
    }

    log.debug("Visited {} tokens, {} results, {} edits", size, traversal.results().size(), traversal.edits().size());
    return traversal;
  }

  /**
   * Lex source text and visit the tokens.
   *
   * @param source source text
   * @return finished traversal
   */
  public Traversal visitSource(String source) {
    return visit(Lexer.tokenize(source), source);
  }

  /**
   * Registrations with the given names, in the order they are tried.
   *
   * <p>Names which do not belong to any registration are ignored.
   */
  List<Registration> select(Collection<String> names) {
    final Set<String> wanted = new LinkedHashSet<>(names);
    final List<Registration> selected = new ArrayList<>();
    final Set<String> found = new LinkedHashSet<>();
    for (Registration registration : registrations) {
      if (wanted.contains(registration.name())) {
        selected.add(registration);
        found.add(registration.name());
      }
    }
    if (found.size() < wanted.size()) {
      wanted.removeAll(found);
      log.warn("Ignoring unknown registrations {}", wanted);
    }
    return selected;
  }

  public static final class Builder {
    private final List<Registration> registrations = new ArrayList<>();
    private final List<DispatchListener> listeners = new ArrayList<>();

    private Builder() { }

    public Builder register(Registration registration) {
      registrations.add(registration);
      return this;
    }

    public Builder register(Registration.Builder registration) {
      return register(registration.build());
    }

    /**
     * Register a consuming handler with priority 0, named after its pattern.
     */
    public Builder register(String pattern, Handler handler) {
      return register(Registration.on(pattern, handler));
    }

    public Builder listener(DispatchListener listener) {
      listeners.add(listener);
      return this;
    }

    public Dispatcher build() {
      return new Dispatcher(registrations, listeners);
    }
  }
}
