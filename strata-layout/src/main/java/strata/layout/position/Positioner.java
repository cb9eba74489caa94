package strata.layout.position;

import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.NodeLabel;

/**
 * Assigns final coordinates to the nodes of a ranked and ordered, non-compound layout graph, laid out top to
 * bottom. Adjacent nodes of a rank are kept at least {@link Separation#sep} apart.
 */
public interface Positioner {
  void position(Graph<NodeLabel, EdgeLabel, GraphLabel> g);
}
