package strata.graph;

import org.immutables.value.Value;
import strata.annotations.Tuple;

import javax.annotation.Nullable;

/**
 * Identifies an edge by its endpoints and, in a multigraph, an optional name distinguishing parallel edges.
 */
@Value.Immutable
@Tuple
public abstract class EdgeKey {
  public static EdgeKey of(String v, String w) {
    return ImmutableEdgeKey.of(v, w, null);
  }

  public static EdgeKey of(String v, String w, @Nullable String name) {
    return ImmutableEdgeKey.of(v, w, name);
  }

  public abstract String v();

  public abstract String w();

  @Nullable
  public abstract String name();

  /**
   * @return the endpoint opposite to {@code node}
   */
  public String other(String node) {
    return v().equals(node) ? w() : v();
  }

  public boolean isSelfLoop() {
    return v().equals(w());
  }

  @Override
  public String toString() {
    return name() == null ? v() + "->" + w() : v() + "->" + w() + "[" + name() + "]";
  }
}
