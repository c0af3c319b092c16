package io.intellixity.paging.paging;

import java.util.*;

/**
 * Immutable, ordered, multi-valued request parameters (the query string of an HTTP request).
 * A key may carry several values, e.g. {@code ?name=ann&name=bob}.
 */
public final class RequestParams {
  private static final RequestParams EMPTY = new RequestParams(Map.of());

  private final Map<String, List<String>> values;

  private RequestParams(Map<String, List<String>> values) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      if (e.getKey() == null) continue;
      List<String> vs = new ArrayList<>();
      if (e.getValue() != null) {
        for (String v : e.getValue()) vs.add(v == null ? "" : v);
      }
      copy.put(e.getKey(), Collections.unmodifiableList(vs));
    }
    this.values = Collections.unmodifiableMap(copy);
  }

  public static RequestParams empty() {
    return EMPTY;
  }

  /** Builds params from alternating keys and values; repeated keys accumulate values. */
  public static RequestParams of(String... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs but got " + keysAndValues.length + " arguments");
    }
    Map<String, List<String>> m = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      m.computeIfAbsent(keysAndValues[i], k -> new ArrayList<>()).add(keysAndValues[i + 1]);
    }
    return new RequestParams(m);
  }

  public static RequestParams fromMultiMap(Map<String, ? extends Collection<String>> params) {
    if (params == null || params.isEmpty()) return EMPTY;
    Map<String, List<String>> m = new LinkedHashMap<>();
    params.forEach((k, v) -> m.put(k, v == null ? List.of() : new ArrayList<>(v)));
    return new RequestParams(m);
  }

  /** Adapts the servlet-style {@code Map<String, String[]>} parameter map. */
  public static RequestParams fromArrays(Map<String, String[]> params) {
    if (params == null || params.isEmpty()) return EMPTY;
    Map<String, List<String>> m = new LinkedHashMap<>();
    params.forEach((k, v) -> m.put(k, v == null ? List.of() : Arrays.asList(v)));
    return new RequestParams(m);
  }

  public Set<String> keys() {
    return values.keySet();
  }

  public boolean containsKey(String key) {
    return values.containsKey(key);
  }

  /** First value of {@code key}, or null if absent. */
  public String first(String key) {
    List<String> vs = values.get(key);
    return (vs == null || vs.isEmpty()) ? null : vs.get(0);
  }

  /** All values of {@code key}, possibly empty. */
  public List<String> all(String key) {
    return values.getOrDefault(key, List.of());
  }

  /** Values of {@code key} that are not blank. */
  public List<String> nonBlank(String key) {
    List<String> out = new ArrayList<>();
    for (String v : all(key)) {
      if (!v.isBlank()) out.add(v);
    }
    return out;
  }

  /** True when {@code key} has at least one non-blank value. */
  public boolean has(String key) {
    for (String v : all(key)) {
      if (!v.isBlank()) return true;
    }
    return false;
  }

  /** First non-blank value of {@code key}, or null. */
  public String value(String key) {
    for (String v : all(key)) {
      if (!v.isBlank()) return v;
    }
    return null;
  }

  public Map<String, List<String>> asMap() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override public boolean equals(Object o) { return o instanceof RequestParams p && values.equals(p.values); }
  @Override public int hashCode() { return values.hashCode(); }
  @Override public String toString() { return values.toString(); }
}
