package tokex.dispatch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Values returned by handlers during a traversal, filed under the name of the
 * registration whose handler returned them.
 */
public final class ResultStore {

  private record Entry(String name, Object value) { }

  private final List<Entry> entries = new ArrayList<>();
  private final Map<String, List<Object>> byName = new HashMap<>();

  void record(String name, Object value) {
    entries.add(new Entry(name, value));
    byName.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
  }

  /**
   * Most recent value of a given type returned under a registration name.
   *
   * @param name registration name
   * @param type type of value to look for
   * @return most recent value, or empty if there is none
   */
  public <T> Optional<T> last(String name, Class<T> type) {
    final List<Object> values = byName.getOrDefault(name, List.of());
    for (int i = values.size() - 1; i >= 0; i--) {
      if (type.isInstance(values.get(i))) {
        return Optional.of(type.cast(values.get(i)));
      }
    }
    return Optional.empty();
  }

  /**
   * All values of a given type returned under a registration name, oldest
   * first.
   */
  public <T> List<T> all(String name, Class<T> type) {
    return byName
      .getOrDefault(name, List.of())
      .stream()
      .filter(type::isInstance)
      .map(type::cast)
      .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Most recent value of a given type returned by any handler.
   */
  public <T> Optional<T> lastOfType(Class<T> type) {
    for (int i = entries.size() - 1; i >= 0; i--) {
      final Object value = entries.get(i).value();
      if (type.isInstance(value)) {
        return Optional.of(type.cast(value));
      }
    }
    return Optional.empty();
  }

  /**
   * All values of a given type returned by any handler, oldest first.
   */
  public <T> List<T> allOfType(Class<T> type) {
    return entries
      .stream()
      .map(Entry::value)
      .filter(type::isInstance)
      .map(type::cast)
      .collect(Collectors.toUnmodifiableList());
  }

  public int size() {
    return entries.size();
  }
}
