package strata.layout;

import org.immutables.value.Value;
import strata.annotations.Tuple;
import strata.graph.EdgeKey;

/**
 * A self loop detached from the edge set while its node is being laid out.
 */
@Value.Immutable
@Tuple
public interface SelfEdge {
  static SelfEdge of(EdgeKey edge, EdgeLabel label) {
    return ImmutableSelfEdge.of(edge, label);
  }

  EdgeKey edge();

  EdgeLabel label();
}
