package strata.layout.order;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphOptions;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-rank graphs the ordering sweeps work on.
 * <p>
 * A layer graph holds the nodes of one rank, every subgraph spanning that rank, and the nodes of the adjacent rank
 * they connect to. All edges point into the rank, so a node's barycenter is always taken over its in-edges. Parallel
 * edges are merged and their weights summed. Nodes without a parent hang from a synthetic root, recorded as
 * {@link GraphLabel#layerRoot()}, so the whole rank can be sorted as a single subgraph.
 * <p>
 * Leaf node labels are shared with the layout graph, so orders assigned in a layer graph land on the layout graph.
 * Subgraph nodes get a fresh label holding only their left and right border nodes at that rank.
 */
final class LayerGraphs {
  enum Relationship {
    /** Sweeping downward: connect each node to its predecessors. */
    IN_EDGES,
    /** Sweeping upward: connect each node to its successors. */
    OUT_EDGES
  }

  private LayerGraphs() {
  }

  static List<Graph<NodeLabel, EdgeLabel, GraphLabel>> buildLayerGraphs(Graph<NodeLabel, EdgeLabel, GraphLabel> g,
                                                                        List<Integer> ranks,
                                                                        Relationship relationship) {
    Map<Integer, List<String>> nodesByRank = new LinkedHashMap<>();
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      Integer rank = node.rank();
      if (rank != null) nodesByRank.computeIfAbsent(rank, r -> new ArrayList<>()).add(v);
      if (node.minRank() != null && node.maxRank() != null) {
        for (int r = node.minRank(); r <= node.maxRank(); r++) {
          if (rank == null || r != rank) nodesByRank.computeIfAbsent(r, k -> new ArrayList<>()).add(v);
        }
      }
    }

    List<Graph<NodeLabel, EdgeLabel, GraphLabel>> layerGraphs = new ArrayList<>(ranks.size());
    for (int rank : ranks) {
      layerGraphs.add(buildLayerGraph(g, rank, relationship, nodesByRank.getOrDefault(rank, List.of())));
    }
    return layerGraphs;
  }

  static Graph<NodeLabel, EdgeLabel, GraphLabel> buildLayerGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> g, int rank,
                                                                 Relationship relationship) {
    return buildLayerGraph(g, rank, relationship, g.nodes());
  }

  private static Graph<NodeLabel, EdgeLabel, GraphLabel> buildLayerGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> g,
                                                                         int rank,
                                                                         Relationship relationship,
                                                                         List<String> candidates) {
    String root = createRootNode(g);
    Graph<NodeLabel, EdgeLabel, GraphLabel> result = new Graph<>(GraphOptions.builder().compound(true).build());
    result.setGraph(new GraphLabel().setLayerRoot(root));
    result.setDefaultNodeLabel(g::node);

    for (String v : candidates) {
      NodeLabel node = g.node(v);
      if (!inRank(node, rank)) continue;

      String parent = g.parent(v);
      result.setNode(v);
      result.setParent(v, parent == null ? root : parent);

      List<EdgeKey> edges = relationship == Relationship.IN_EDGES ? g.inEdges(v) : g.outEdges(v);
      for (EdgeKey e : edges) {
        String u = e.other(v);
        EdgeLabel existing = result.edge(u, v);
        double weight = existing == null ? 0 : existing.weight();
        result.setEdge(u, v, new EdgeLabel(1, g.edge(e).weight() + weight));
      }

      if (node.minRank() != null) {
        NodeLabel borders = new NodeLabel();
        borders.borderLeft().add(borderAt(node.borderLeft(), rank));
        borders.borderRight().add(borderAt(node.borderRight(), rank));
        result.setNode(v, borders);
      }
    }
    return result;
  }

  private static boolean inRank(NodeLabel node, int rank) {
    if (node.rank() != null && node.rank() == rank) return true;
    return node.minRank() != null && node.maxRank() != null && node.minRank() <= rank && rank <= node.maxRank();
  }

  @Nullable
  private static String borderAt(List<String> borders, int rank) {
    return rank < borders.size() ? borders.get(rank) : null;
  }

  private static String createRootNode(Graph<NodeLabel, ?, ?> g) {
    String v;
    do {
      v = LayoutGraphs.uniqueId("_root");
    } while (g.hasNode(v));
    return v;
  }
}
