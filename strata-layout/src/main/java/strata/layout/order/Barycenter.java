package strata.layout.order;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.List;

final class Barycenter {
  private Barycenter() {
  }

  /**
   * Computes, for each of {@code movable}, the weighted average order of its predecessors in the layer graph.
   * A node with no incoming edges gets no barycenter. One whose incoming edges all weigh nothing gets a NaN
   * barycenter of weight 0, which sorts level with every other barycenter.
   */
  static List<BarycenterEntry> barycenter(Graph<NodeLabel, EdgeLabel, ?> g, List<String> movable) {
    List<BarycenterEntry> entries = new ArrayList<>(movable.size());
    for (String v : movable) {
      double sum = 0;
      double weight = 0;
      boolean sawEdge = false;
      for (EdgeKey e : g.inEdges(v)) {
        sawEdge = true;
        double edgeWeight = g.edge(e).weight();
        sum += edgeWeight * LayoutGraphs.orderOf(g.node(e.v()));
        weight += edgeWeight;
      }
      entries.add(sawEdge ? new BarycenterEntry(v, sum / weight, weight) : new BarycenterEntry(v));
    }
    return entries;
  }
}
