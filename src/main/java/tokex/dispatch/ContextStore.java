package tokex.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Keyed values shared between the handlers of one traversal.
 *
 * <p>A fresh store is made for every top-level visit unless one is passed in,
 * which is how several dispatchers run one after another can share state.
 */
public final class ContextStore {

  private final Map<String, Object> values = new HashMap<>();

  /**
   * Set a value, replacing any previous value under the key.
   *
   * @param key key to store under
   * @param value non-null value
   */
  public void put(String key, Object value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Get a value.
   *
   * @param key key the value is stored under
   * @param type expected type of the value
   * @return the value, or empty if there is none
   * @throws ClassCastException if the value is not of the expected type
   */
  public <T> Optional<T> get(String key, Class<T> type) {
    return Optional.ofNullable(values.get(key)).map(type::cast);
  }

  public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
    return get(key, type).orElse(defaultValue);
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  /**
   * @return whether there was a value to remove
   */
  public boolean remove(String key) {
    return values.remove(key) != null;
  }

  public void clear() {
    values.clear();
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(values.keySet());
  }

  /**
   * Get a value, storing a fresh one first if there is none.
   *
   * @param key key the value is stored under
   * @param type expected type of the value
   * @param factory makes the value if there is none
   * @return the stored value
   */
  public <T> T computeIfAbsent(String key, Class<T> type, Supplier<? extends T> factory) {
    return type.cast(values.computeIfAbsent(key, k -> Objects.requireNonNull(factory.get(), "value")));
  }

  /**
   * Add a value to the end of the list stored under a key.
   *
   * @param key key the list is stored under
   * @param value value to add
   */
  public void append(String key, Object value) {
    final Object existing = values.computeIfAbsent(key, k -> new ValueList());
    if (!(existing instanceof ValueList list)) {
      throw new IllegalStateException("Value under '" + key + "' is not a list");
    }
    list.add(value);
  }

  /**
   * Get the values added to a key with {@link #append}.
   *
   * @param key key the list is stored under
   * @param type expected type of the values
   * @return snapshot of the list, empty if nothing was added
   */
  public <T> List<T> list(String key, Class<T> type) {
    final Object existing = values.get(key);
    if (existing == null) {
      return List.of();
    }
    if (!(existing instanceof ValueList list)) {
      throw new IllegalStateException("Value under '" + key + "' is not a list");
    }
    final var result = new ArrayList<T>(list.size());
    for (Object value : list) {
      result.add(type.cast(value));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return "ContextStore" + values;
  }

  // Marks lists made by `append`, so they are not confused with list values
  private static final class ValueList extends ArrayList<Object> {
    @java.io.Serial
    private static final long serialVersionUID = 1L;
  }
}
