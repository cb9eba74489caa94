package strata.layout.rank;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphOptions;
import strata.layout.EdgeLabel;
import strata.layout.NodeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Builds a spanning tree of tight edges (edges whose length equals their minlen), shifting ranks as needed to make
 * more edges tight. Expects {@code g} to carry a feasible ranking already, such as the one from
 * {@link Ranks#longestPath}.
 * <p>
 * Each round grows the tree greedily through tight edges. When it stalls, the incident edge with the least slack is
 * made tight by shifting every tree node's rank by that slack.
 * <p>
 * A disconnected graph yields a forest: when no edge leaves the current tree, a new tree is started at the first
 * node not yet covered.
 */
public final class FeasibleTree {
  private static final Logger LOG = LoggerFactory.getLogger(FeasibleTree.class);
  private static final GraphOptions UNDIRECTED = GraphOptions.builder().directed(false).build();

  private FeasibleTree() {
  }

  public static Graph<TreeNode, TreeEdge, Void> build(Graph<NodeLabel, EdgeLabel, ?> g) {
    Graph<TreeNode, TreeEdge, Void> t = newTree();
    if (g.nodeCount() == 0) return t;

    t.setNode(g.nodes().get(0));
    int size = g.nodeCount();
    while (tightTree(t, g) < size) {
      EdgeKey edge = findMinSlackEdge(t, g);
      if (edge == null) {
        String next = g.nodes().stream().filter(v -> !t.hasNode(v)).findFirst().orElseThrow();
        LOG.warn("Graph is disconnected; starting another tree at {}", next);
        t.setNode(next);
        continue;
      }
      int delta = t.hasNode(edge.v()) ? Ranks.slack(g, edge) : -Ranks.slack(g, edge);
      shiftRanks(t, g, delta);
    }
    return t;
  }

  static Graph<TreeNode, TreeEdge, Void> newTree() {
    Graph<TreeNode, TreeEdge, Void> t = new Graph<>(UNDIRECTED);
    t.setDefaultNodeLabel(v -> new TreeNode());
    t.setDefaultEdgeLabel(TreeEdge::new);
    return t;
  }

  /**
   * Extends the tree through tight edges as far as possible.
   *
   * @return the number of nodes in the tree
   */
  private static int tightTree(Graph<TreeNode, TreeEdge, Void> t, Graph<NodeLabel, EdgeLabel, ?> g) {
    for (String v : t.nodes()) {
      extend(t, g, v);
    }
    return t.nodeCount();
  }

  private static void extend(Graph<TreeNode, TreeEdge, Void> t, Graph<NodeLabel, EdgeLabel, ?> g, String root) {
    Deque<String> path = new ArrayDeque<>();
    Deque<Iterator<EdgeKey>> pending = new ArrayDeque<>();
    path.push(root);
    pending.push(g.nodeEdges(root).iterator());
    while (!pending.isEmpty()) {
      Iterator<EdgeKey> edges = pending.peek();
      if (!edges.hasNext()) {
        path.pop();
        pending.pop();
        continue;
      }
      String v = path.peek();
      EdgeKey e = edges.next();
      String w = e.other(v);
      if (!t.hasNode(w) && Ranks.slack(g, e) == 0) {
        t.setNode(w);
        t.setEdge(v, w);
        path.push(w);
        pending.push(g.nodeEdges(w).iterator());
      }
    }
  }

  /**
   * @return the first edge with exactly one endpoint in the tree having the least slack, or null if none
   */
  @Nullable
  private static EdgeKey findMinSlackEdge(Graph<TreeNode, TreeEdge, Void> t, Graph<NodeLabel, EdgeLabel, ?> g) {
    EdgeKey best = null;
    int bestSlack = Integer.MAX_VALUE;
    for (EdgeKey e : g.edges()) {
      if (t.hasNode(e.v()) == t.hasNode(e.w())) continue;
      int slack = Ranks.slack(g, e);
      if (slack < bestSlack) {
        best = e;
        bestSlack = slack;
      }
    }
    return best;
  }

  private static void shiftRanks(Graph<TreeNode, TreeEdge, Void> t, Graph<NodeLabel, EdgeLabel, ?> g, int delta) {
    for (String v : t.nodes()) {
      NodeLabel node = g.node(v);
      node.setRank((node.rank() == null ? 0 : node.rank()) + delta);
    }
  }
}
