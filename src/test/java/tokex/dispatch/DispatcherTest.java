package tokex.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import tokex.lexer.Lexer;
import tokex.lexer.Token;
import tokex.lexer.TokenType;
import tokex.parser.BalancedRegion;

public class DispatcherTest {

  private static Handler recordName(List<String> fired) {
    return Handler.of(invocation -> fired.add(invocation.registration().label()));
  }

  @Test
  public void registrationDefaults() {
    final Registration registration = Registration.on("\\i '='", invocation -> null).build();
    assertEquals("\\i '='", registration.name());
    assertEquals("\\i '='", registration.label());
    assertEquals(0, registration.priority());
    assertTrue(registration.consumes());
    assertTrue(registration.permits(null));
    assertTrue(registration.permits("anything"));

    final Registration restricted = Registration
      .on("\\i", invocation -> null)
      .name("ident")
      .displayName("Identifier")
      .allowedCallers("fn")
      .build();
    assertEquals("Identifier", restricted.label());
    assertFalse(restricted.permits(null));
    assertFalse(restricted.permits("class"));
    assertTrue(restricted.permits("fn"));
  }

  @Test
  public void higherPriorityWins() {
    final List<String> fired = new ArrayList<>();
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration.on("\\i", recordName(fired)).name("ident"))
      .register(Registration.on("\\i '='", recordName(fired)).name("assign").priority(5))
      .build();

    dispatcher.visitSource("a = 1; b;");
    assertEquals(List.of("assign", "ident"), fired);
    assertEquals(
      List.of("assign", "ident"),
      dispatcher.registrations().stream().map(Registration::name).collect(Collectors.toList())
    );
  }

  @Test
  public void equalPrioritiesKeepRegistrationOrder() {
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration.on("\\i", recordName(fired)).name("first"))
      .register(Registration.on("\\i", recordName(fired)).name("second"))
      .build()
      .visitSource("a b");
    assertEquals(List.of("first", "first"), fired);
  }

  @Test
  public void consumingSkipsMatchedTokens() {
    final List<String> fired = new ArrayList<>();
    final Handler handler = Handler.of(invocation -> fired.add(invocation.fullMatch().value()));

    Dispatcher.builder().register("\\i \\i", handler).build().visitSource("a b c");
    assertEquals(List.of("ab"), fired);

    fired.clear();
    Dispatcher.builder()
      .register(Registration.on("\\i \\i", handler).consumes(false))
      .build()
      .visitSource("a b c");
    assertEquals(List.of("ab", "bc"), fired);
  }

  @Test
  public void emptyMatchesStillAdvance() {
    final List<Integer> positions = new ArrayList<>();
    Dispatcher.builder()
      .register("\\n*", Handler.of(invocation -> positions.add(invocation.index())))
      .build()
      .visitSource("a 1 2 b");
    assertEquals(List.of(0, 1, 3), positions);
  }

  @Test
  public void endOfInputIsNeverDispatched() {
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register("\\e", recordName(fired))
      .register(".", recordName(fired))
      .build()
      .visitSource("x");
    assertEquals(List.of("."), fired);
  }

  @Test
  public void listenersSeeTheWholeVisit() {
    final List<String> events = new ArrayList<>();
    final DispatchListener listener = new DispatchListener() {
      @Override
      public void onBegin(Traversal traversal) {
        events.add("begin");
      }

      @Override
      public void onEnd(Traversal traversal) {
        events.add("end");
      }

      @Override
      public void onUnmatched(Token token, int index, Traversal traversal) {
        events.add(index + ":" + token.value());
      }
    };

    Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> events.add("ident")))
      .listener(listener)
      .build()
      .visitSource("a = b;");
    assertEquals(List.of("begin", "ident", "1:=", "ident", "3:;", "end"), events);
  }

  @Test
  public void handlerResultsAreRecorded() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration.on("\\k\"const\" (\\i)", invocation -> invocation.capture(1).orElseThrow().value()).name("decl"))
      .register(Registration.on("\\n", invocation -> Integer.valueOf(invocation.fullMatch().value())).name("number"))
      .register(Registration.on("';'", invocation -> null).name("semi"))
      .build();

    final ResultStore results = dispatcher.visitSource("const a = 1; const b = 2;").results();
    assertEquals(List.of("a", "b"), results.all("decl", String.class));
    assertEquals(2, results.last("number", Integer.class).orElseThrow());
    assertEquals(List.of(1, 2), results.allOfType(Integer.class));
    assertTrue(results.all("semi", Object.class).isEmpty());
    assertEquals(4, results.size());
  }

  @Test
  public void nestedTraversalsAreScopedToCallers() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration
        .on("\\k\"function\" \\i \\Bp (\\Bb)", invocation -> {
          invocation.traverse(invocation.capture(1).orElseThrow(), "local");
          return null;
        })
        .name("fn"))
      .register(Registration
        .on("\\k\"class\" \\i (\\Bb)", invocation -> {
          invocation.traverse(invocation.capture(1).orElseThrow(), "local");
          return null;
        })
        .name("cls"))
      .register(Registration
        .on("\\k\"const\" (\\i)", invocation -> {
          invocation.context().append("locals", invocation.capture(1).orElseThrow().value());
          invocation.context().put("callers", invocation.callers());
          return null;
        })
        .name("local")
        .allowedCallers("fn")
        .priority(1))
      .register(Registration
        .on("\\k\"const\" (\\i)", invocation -> {
          invocation.context().append("globals", invocation.capture(1).orElseThrow().value());
          return null;
        })
        .name("global"))
      .build();

    final ContextStore context = dispatcher
      .visitSource("const a = 1; function f() { const b = 2; } class K { const d = 4; } const c = 3;")
      .context();
    assertEquals(List.of("a", "c"), context.list("globals", String.class));
    assertEquals(List.of("b"), context.list("locals", String.class));
    assertEquals(List.of("fn"), context.get("callers", List.class).orElseThrow());
  }

  @Test
  public void callersAreRestoredAfterNestedTraversal() {
    final List<List<String>> seen = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration
        .on("'{' (.*?) '}'", invocation -> {
          seen.add(invocation.callers());
          invocation.traverse(invocation.capture(1).orElseThrow(), "inner");
          seen.add(invocation.callers());
          return null;
        })
        .name("block"))
      .register(Registration
        .on("\\i", invocation -> seen.add(invocation.callers()))
        .name("inner")
        .allowedCallers("block"))
      .build()
      .visitSource("{ a }");
    assertEquals(List.of(List.of(), List.of("block"), List.of()), seen);
  }

  @Test
  public void unknownNamesAreIgnored() {
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration
        .on("'(' .* ')'", invocation -> {
          invocation.traverse("missing", "ident");
          return null;
        })
        .name("call"))
      .register(Registration.on("\\i", recordName(fired)).name("ident"))
      .build()
      .visitSource("(a b)");
    assertEquals(List.of("ident", "ident"), fired);
  }

  @Test
  public void topLevelTraversalWithSomeRegistrations() {
    final List<String> fired = new ArrayList<>();
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration.on("\\i", recordName(fired)).name("ident"))
      .register(Registration.on("\\n", recordName(fired)).name("number"))
      .register(Registration.on("\\s", recordName(fired)).name("string").allowedCallers("ident"))
      .build();

    final var context = new ContextStore();
    final Traversal traversal = dispatcher.traverse(Lexer.tokenize("a 1 'x' b"), List.of("number", "string"), context);
    assertEquals(List.of("number"), fired);
    assertSame(context, traversal.context());
    assertTrue(traversal.callers().isEmpty());
  }

  @Test
  public void nestedRangeMustBeInsideTokens() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> invocation.traverse(0, 100, "x")))
      .build();
    assertThrows(IndexOutOfBoundsException.class, () -> dispatcher.visitSource("a"));
  }

  @Test
  public void skipBalancedHidesFunctionBodies() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration
        .on("\\k\"function\" \\i", invocation -> {
          invocation.context().put("skipped", invocation.skipBalanced(BalancedRegion.BRACES));
          return null;
        })
        .name("fn"))
      .register(Registration
        .on("\\k\"const\" (\\i)", invocation -> {
          invocation.context().append("decls", invocation.capture(1).orElseThrow().value());
          return null;
        })
        .name("decl"))
      .build();

    final ContextStore closed = dispatcher
      .visitSource("const a = 1; function f(x) { const b = 2; if (x) { const c = 3; } } const d = 4;")
      .context();
    assertEquals(List.of("a", "d"), closed.list("decls", String.class));
    assertTrue(closed.get("skipped", Boolean.class).orElseThrow());

    final ContextStore unterminated = dispatcher
      .visitSource("const a = 1; function f() { const b = 2;")
      .context();
    assertEquals(List.of("a"), unterminated.list("decls", String.class));
  }

  @Test
  public void skipBalancedWithoutOpener() {
    final List<Boolean> skipped = new ArrayList<>();
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration
        .on("\\k\"return\"", invocation -> {
          skipped.add(invocation.skipBalanced(BalancedRegion.PARENTHESES));
          return null;
        }))
      .register("\\i", recordName(fired))
      .build()
      .visitSource("return a;");
    assertEquals(List.of(false), skipped);
    assertEquals(List.of("\\i"), fired);
  }

  @Test
  public void skipToToken() {
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration
        .on("\\k\"return\"", invocation -> {
          final Token semicolon = invocation.tokens()
            .stream()
            .filter(token -> token.is(TokenType.PUNCTUATION, ";"))
            .findFirst()
            .orElseThrow();
          assertTrue(invocation.skipTo(semicolon));
          assertFalse(invocation.skipTo(Token.synthetic(TokenType.PUNCTUATION, ";")));
          return null;
        }))
      .register(Registration.on("\\i", Handler.of(invocation -> fired.add(invocation.fullMatch().value()))))
      .build()
      .visitSource("return a + b; c;");
    assertEquals(List.of("c"), fired);
  }

  @Test
  public void skipToIndexBounds() {
    final List<String> fired = new ArrayList<>();
    Dispatcher.builder()
      .register(Registration
        .on("\\k\"return\"", Handler.of(invocation -> invocation.skipToIndex(invocation.index() + 3)))
        .priority(1))
      .register("\\i", Handler.of(invocation -> fired.add(invocation.fullMatch().value())))
      .build()
      .visitSource("return a b c d");
    assertEquals(List.of("c", "d"), fired);

    final Dispatcher outOfBounds = Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> invocation.skipToIndex(-1)))
      .build();
    assertThrows(IndexOutOfBoundsException.class, () -> outOfBounds.visitSource("a"));
  }

  @Test
  public void extractBalancedReturnsInnerTokens() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register(Registration
        .on("\\i '('", invocation -> invocation
          .extractBalanced(BalancedRegion.PARENTHESES)
          .stream()
          .map(Token::value)
          .collect(Collectors.joining(" ")))
        .name("call"))
      .build();

    assertEquals(
      List.of("a , g ( b )", "b"),
      dispatcher.visitSource("f(a, g(b))").results().all("call", String.class)
    );
    assertEquals(List.of(""), dispatcher.visitSource("f(a").results().all("call", String.class));
  }

  @Test
  public void extractBalancedNeedsBrackets() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> invocation.extractBalanced(BalancedRegion.UNTIL_COMMA)))
      .build();
    assertThrows(IllegalArgumentException.class, () -> dispatcher.visitSource("a"));
  }

  @Test
  public void sharedContextAcrossVisits() {
    final var shared = new ContextStore();
    final Dispatcher dispatcher = Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> invocation.context().append("seen", invocation.fullMatch().value())))
      .build();

    final List<Token> first = Lexer.tokenize("a b");
    dispatcher.visit(first, "a b", shared);
    dispatcher.visit(Lexer.tokenize("c"), null, shared);
    assertEquals(List.of("a", "b", "c"), shared.list("seen", String.class));

    // Fresh visits start from an empty store
    assertEquals(2, dispatcher.visit(first).context().list("seen", String.class).size());
  }

  @Test
  public void editsAreReplayedAgainstSource() {
    final Dispatcher dispatcher = Dispatcher.builder()
      .register("\\k\"var\"", Handler.of(invocation -> invocation
        .edits()
        .replace(invocation.match(), Token.synthetic(TokenType.KEYWORD, "let"))))
      .build();

    final String source = "var a = 1; // var\nvar b;";
    final Traversal traversal = dispatcher.visitSource(source);
    assertEquals("let a = 1; // var\nlet b;", traversal.reconstruct());
    assertEquals(2, traversal.edits().size());

    final List<String> modified = traversal
      .modifiedTokens()
      .stream()
      .filter(token -> token.is(TokenType.KEYWORD))
      .map(Token::value)
      .collect(Collectors.toList());
    assertEquals(List.of("let", "let"), modified);

    final Traversal noSource = dispatcher.visit(Lexer.tokenize(source));
    assertThrows(IllegalStateException.class, noSource::reconstruct);
    assertTrue(noSource.source().isEmpty());
  }

  @Test
  public void reconstructWithoutEditsIsIdentity() {
    final String source = "const  x =\t1; /* keep */";
    final Traversal traversal = Dispatcher.builder()
      .register("\\i", Handler.of(invocation -> { }))
      .build()
      .visitSource(source);
    assertSame(source, traversal.reconstruct());
  }
}
