package strata.layout;

/**
 * Tags the synthetic nodes the layout pipeline inserts, so each can be found and removed by the pass that undoes it.
 */
public enum DummyKind {
  /** A link in the chain replacing an edge that spans several ranks. */
  EDGE,
  /** The link of an edge chain that carries the edge's label. */
  EDGE_LABEL,
  /** Temporarily reserves the rank of an edge label during ranking. */
  EDGE_PROXY,
  /** A border node of a subgraph. */
  BORDER,
  /** Reserves space beside a node for a self loop. */
  SELF_EDGE,
  /** The root of the nesting graph. */
  ROOT
}
