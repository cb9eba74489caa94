package strata.layout.nesting;

import strata.graph.Graph;
import strata.layout.BorderType;
import strata.layout.DummyKind;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Gives every ranked subgraph a chain of left and right border nodes, one of each per rank it spans. Ordering keeps
 * the subgraph's members between the two chains, and their final positions yield the subgraph's bounding box.
 */
public final class BorderSegments {
  private BorderSegments() {
  }

  public static void add(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.children()) {
      dfs(g, v);
    }
  }

  private static void dfs(Graph<NodeLabel, EdgeLabel, GraphLabel> g, String v) {
    for (String child : g.children(v)) {
      dfs(g, child);
    }

    NodeLabel node = g.node(v);
    if (node == null || node.minRank() == null) return;

    node.borderLeft().clear();
    node.borderRight().clear();
    for (int rank = node.minRank(); rank <= node.maxRank(); rank++) {
      addBorderNode(g, BorderType.LEFT, "_bl", v, node, rank);
      addBorderNode(g, BorderType.RIGHT, "_br", v, node, rank);
    }
  }

  private static void addBorderNode(
          Graph<NodeLabel, EdgeLabel, GraphLabel> g,
          BorderType type,
          String prefix,
          String subgraph,
          NodeLabel subgraphNode,
          int rank
  ) {
    List<String> chain = type == BorderType.LEFT ? subgraphNode.borderLeft() : subgraphNode.borderRight();
    String prev = rank > 0 ? at(chain, rank - 1) : null;
    NodeLabel label = new NodeLabel(0, 0).setRank(rank).setBorderType(type);
    String curr = LayoutGraphs.addDummyNode(g, DummyKind.BORDER, label, prefix);
    setAt(chain, rank, curr);
    g.setParent(curr, subgraph);
    if (prev != null) g.setEdge(prev, curr, new EdgeLabel(1, 1));
  }

  @Nullable
  static String at(List<String> chain, int rank) {
    return rank >= 0 && rank < chain.size() ? chain.get(rank) : null;
  }

  static void setAt(List<String> chain, int rank, String v) {
    while (chain.size() <= rank) {
      chain.add(null);
    }
    chain.set(rank, v);
  }
}
