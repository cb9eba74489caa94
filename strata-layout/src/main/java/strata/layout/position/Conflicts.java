package strata.layout.position;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * An unordered set of node pairs whose segments must not be aligned with each other.
 */
final class Conflicts {
  private final Map<String, Set<String>> pairs = new HashMap<>();

  void add(String v, String w) {
    if (v.compareTo(w) > 0) {
      String tmp = v;
      v = w;
      w = tmp;
    }
    pairs.computeIfAbsent(v, k -> new HashSet<>()).add(w);
  }

  boolean has(String v, String w) {
    if (v.compareTo(w) > 0) {
      String tmp = v;
      v = w;
      w = tmp;
    }
    Set<String> ws = pairs.get(v);
    return ws != null && ws.contains(w);
  }

  void addAll(Conflicts other) {
    other.pairs.forEach((v, ws) -> pairs.computeIfAbsent(v, k -> new HashSet<>()).addAll(ws));
  }

  boolean isEmpty() {
    return pairs.isEmpty();
  }

  @Override
  public String toString() {
    return pairs.toString();
  }
}
