package tokex.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ContextStoreTest {

  @Test
  public void typedAccess() {
    final var store = new ContextStore();
    store.put("name", "x");
    store.put("count", 3);

    assertEquals(Optional.of("x"), store.get("name", String.class));
    assertEquals(Optional.of(3), store.get("count", Integer.class));
    assertEquals(Optional.empty(), store.get("missing", String.class));
    assertEquals("fallback", store.getOrDefault("missing", String.class, "fallback"));
    assertThrows(ClassCastException.class, () -> store.get("count", String.class));
    assertEquals(Set.of("name", "count"), store.keys());
  }

  @Test
  public void nullsAreRejected() {
    final var store = new ContextStore();
    assertThrows(NullPointerException.class, () -> store.put("key", null));
    assertThrows(NullPointerException.class, () -> store.put(null, "value"));
    assertThrows(NullPointerException.class, () -> store.computeIfAbsent("key", String.class, () -> null));
    assertFalse(store.has("key"));
  }

  @Test
  public void removeAndClear() {
    final var store = new ContextStore();
    store.put("a", 1);
    store.put("b", 2);

    assertTrue(store.remove("a"));
    assertFalse(store.remove("a"));
    assertFalse(store.has("a"));
    assertTrue(store.has("b"));

    store.clear();
    assertTrue(store.keys().isEmpty());
  }

  @Test
  public void computeIfAbsentKeepsFirstValue() {
    final var store = new ContextStore();
    final List<String> first = store.computeIfAbsent("scope", List.class, ArrayList::new);
    first.add("x");
    final List<String> second = store.computeIfAbsent("scope", List.class, ArrayList::new);
    assertSame(first, second);
    assertEquals(List.of("x"), second);
  }

  @Test
  public void appendedLists() {
    final var store = new ContextStore();
    assertEquals(List.of(), store.list("names", String.class));

    store.append("names", "a");
    store.append("names", "b");
    final List<String> snapshot = store.list("names", String.class);
    store.append("names", "c");

    assertEquals(List.of("a", "b"), snapshot);
    assertEquals(List.of("a", "b", "c"), store.list("names", String.class));
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add("d"));
  }

  @Test
  public void appendedListsAreNotPlainValues() {
    final var store = new ContextStore();
    store.put("value", "x");
    store.put("list", new ArrayList<>(List.of("a")));

    assertThrows(IllegalStateException.class, () -> store.append("value", "y"));
    assertThrows(IllegalStateException.class, () -> store.list("value", String.class));
    assertThrows(IllegalStateException.class, () -> store.append("list", "b"));
  }
}
