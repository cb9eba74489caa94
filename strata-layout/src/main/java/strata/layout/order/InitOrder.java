package strata.layout.order;

import strata.graph.Graph;
import strata.graph.GraphTraversals;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class InitOrder {
  private InitOrder() {
  }

  /**
   * Builds an initial layering by walking the graph depth-first from its leaf nodes, taken in rank order, and
   * appending each node to its rank's layer as it is first reached. Subgraph nodes are never placed directly.
   *
   * @return one list of node ids per rank, from rank 0 to the highest rank
   */
  static List<List<String>> initOrder(Graph<NodeLabel, ?, ?> g) {
    List<String> simpleNodes = new ArrayList<>();
    int maxRank = -1;
    for (String v : g.nodes()) {
      if (!g.children(v).isEmpty()) continue;
      simpleNodes.add(v);
      maxRank = Math.max(maxRank, LayoutGraphs.rankOf(g.node(v)));
    }

    List<List<String>> layers = new ArrayList<>();
    for (int r = 0; r <= maxRank; r++) {
      layers.add(new ArrayList<>());
    }

    simpleNodes.sort(Comparator.comparingInt(v -> LayoutGraphs.rankOf(g.node(v))));
    for (String v : GraphTraversals.preorder(g, simpleNodes)) {
      int rank = LayoutGraphs.rankOf(g.node(v));
      if (rank >= 0 && rank < layers.size()) layers.get(rank).add(v);
    }
    return layers;
  }
}
