package strata.layout.rank;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Assigns every node an integer rank such that each edge {@code (v, w)} satisfies
 * {@code rank(w) - rank(v) >= minlen}, using the strategy named by {@link GraphLabel#ranker()}.
 */
public final class Ranks {
  private Ranks() {
  }

  public static void rank(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    switch (g.graph().ranker()) {
      case LONGEST_PATH:
        longestPath(g);
        break;
      case TIGHT_TREE:
        longestPath(g);
        FeasibleTree.build(g);
        break;
      case NONE:
        break;
      case NETWORK_SIMPLEX:
      default:
        NetworkSimplex.run(g);
        break;
    }
  }

  /**
   * Ranks each node as high as its successors allow: {@code rank(v) = min(rank(w) - minlen)} over its out-edges, or 0
   * for a sink. This is quick and feasible but tends to stretch edges out of sources.
   */
  public static void longestPath(Graph<NodeLabel, EdgeLabel, ?> g) {
    Set<String> visited = new HashSet<>();
    for (String v : g.sources()) {
      dfs(g, v, visited);
    }
    for (String v : g.nodes()) {
      dfs(g, v, visited);
    }
  }

  private static void dfs(Graph<NodeLabel, EdgeLabel, ?> g, String root, Set<String> visited) {
    if (!visited.add(root)) return;
    Deque<RankFrame> stack = new ArrayDeque<>();
    stack.push(new RankFrame(g, root));
    while (!stack.isEmpty()) {
      RankFrame top = stack.peek();
      if (top.edges.hasNext()) {
        EdgeKey e = top.edges.next();
        if (visited.add(e.w())) {
          top.pending = e;
          stack.push(new RankFrame(g, e.w()));
        } else {
          top.lower(LayoutGraphs.rankOf(g.node(e.w())) - minlen(g, e));
        }
        continue;
      }
      stack.pop();
      int rank = top.rank == Integer.MAX_VALUE ? 0 : top.rank;
      g.node(top.node).setRank(rank);
      RankFrame parent = stack.peek();
      if (parent != null) parent.lower(rank - minlen(g, parent.pending));
    }
  }

  /**
   * A node whose out-edges are still being walked. {@code pending} is the edge to the successor being ranked.
   */
  private static class RankFrame {
    final String node;
    final Iterator<EdgeKey> edges;
    int rank = Integer.MAX_VALUE;
    EdgeKey pending;

    RankFrame(Graph<?, ?, ?> g, String node) {
      this.node = node;
      this.edges = g.outEdges(node).iterator();
    }

    void lower(int candidate) {
      rank = Math.min(rank, candidate);
    }
  }

  /**
   * @return how much longer the edge is than its minlen; a missing rank counts as 0 and a missing edge as minlen 1
   */
  public static int slack(Graph<NodeLabel, EdgeLabel, ?> g, EdgeKey e) {
    return LayoutGraphs.rankOf(g.node(e.w())) - LayoutGraphs.rankOf(g.node(e.v())) - minlen(g, e);
  }

  static int minlen(Graph<?, EdgeLabel, ?> g, EdgeKey e) {
    EdgeLabel label = g.edge(e);
    return label == null ? 1 : label.minlen();
  }

  static double weight(Graph<?, EdgeLabel, ?> g, EdgeKey e) {
    EdgeLabel label = g.edge(e);
    return label == null ? 0 : label.weight();
  }
}
