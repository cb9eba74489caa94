package strata.graph;

import org.immutables.value.Value;

@Value.Immutable
public interface GraphOptions {
  GraphOptions DEFAULT = builder().build();

  static Builder builder() {
    return new Builder();
  }

  @Value.Default
  default boolean directed() {
    return true;
  }

  /**
   * Whether parallel edges between the same pair of nodes may coexist, distinguished by {@link EdgeKey#name}.
   */
  @Value.Default
  default boolean multigraph() {
    return false;
  }

  /**
   * Whether nodes may be nested under a parent node.
   */
  @Value.Default
  default boolean compound() {
    return false;
  }

  class Builder extends ImmutableGraphOptions.Builder {
  }
}
