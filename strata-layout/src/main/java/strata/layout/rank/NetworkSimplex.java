package strata.layout.rank;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphTraversals;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * The network simplex ranker of Gansner et al., "A Technique for Drawing Directed Graphs": it minimizes the sum of
 * {@code weight * length} over all edges, subject to every edge's minlen.
 * <p>
 * Starting from a {@link FeasibleTree feasible tree}, each iteration finds a tree edge with a negative cut value and
 * replaces it with the non-tree edge of least slack crossing the same cut, until every cut value is non-negative.
 * Subtree membership tests use postorder {@code low/lim} numbers, so each test takes constant time.
 * <p>
 * The optimum is then shifted so the lowest rank is 0 and, when {@link GraphLabel#balanceRanks()} is set, balanced.
 */
public final class NetworkSimplex {
  private static final Logger LOG = LoggerFactory.getLogger(NetworkSimplex.class);

  private NetworkSimplex() {
  }

  public static void run(Graph<NodeLabel, EdgeLabel, GraphLabel> graph) {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = LayoutGraphs.simplify(graph);
    Ranks.longestPath(g);
    Graph<TreeNode, TreeEdge, Void> t = FeasibleTree.build(g);
    initLowLimValues(t);
    initCutValues(t, g);

    int exchanges = 0;
    EdgeKey e;
    while ((e = leaveEdge(t)) != null) {
      EdgeKey f = enterEdge(t, g, e);
      if (f == null) {
        LOG.warn("No entering edge found for tree edge {}; stopping with a feasible ranking", e);
        break;
      }
      exchangeEdges(t, g, e, f);
      exchanges++;
    }
    LOG.trace("Network simplex finished after {} exchanges", exchanges);

    LayoutGraphs.normalizeRanks(g);
    if (g.graph() != null && g.graph().balanceRanks()) balance(g);
  }

  /**
   * Moves every node whose in-weight equals its out-weight to the middle of the ranks its edges allow. The objective
   * is unchanged by such a move; it only shortens the longer of the node's edges.
   */
  static void balance(Graph<NodeLabel, EdgeLabel, ?> g) {
    for (String v : g.nodes()) {
      List<EdgeKey> inEdges = g.inEdges(v);
      List<EdgeKey> outEdges = g.outEdges(v);
      if (inEdges.isEmpty() || outEdges.isEmpty()) continue;

      double inWeight = 0;
      int low = Integer.MIN_VALUE;
      for (EdgeKey e : inEdges) {
        inWeight += Ranks.weight(g, e);
        low = Math.max(low, LayoutGraphs.rankOf(g.node(e.v())) + Ranks.minlen(g, e));
      }
      double outWeight = 0;
      int high = Integer.MAX_VALUE;
      for (EdgeKey e : outEdges) {
        outWeight += Ranks.weight(g, e);
        high = Math.min(high, LayoutGraphs.rankOf(g.node(e.w())) - Ranks.minlen(g, e));
      }

      if (inWeight == outWeight && low < high) {
        g.node(v).setRank(low + (high - low) / 2);
      }
    }
  }

  /**
   * Numbers every tree node in postorder from 1, recording in {@code low} the smallest number within its subtree, in
   * {@code lim} its own number, and its parent. Each tree of a forest is rooted at its first node.
   */
  static void initLowLimValues(Graph<TreeNode, TreeEdge, ?> tree) {
    Set<String> visited = new HashSet<>();
    int nextLim = 1;
    for (String root : tree.nodes()) {
      if (!visited.contains(root)) nextLim = dfsAssignLowLim(tree, visited, nextLim, root, null);
    }
  }

  static void initLowLimValues(Graph<TreeNode, TreeEdge, ?> tree, String root) {
    dfsAssignLowLim(tree, new HashSet<>(), 1, root, null);
  }

  private static int dfsAssignLowLim(Graph<TreeNode, TreeEdge, ?> tree, Set<String> visited, int nextLim, String root,
                                     @Nullable String rootParent) {
    visited.add(root);
    Deque<LowLimFrame> stack = new ArrayDeque<>();
    stack.push(new LowLimFrame(tree, root, rootParent, nextLim));
    while (!stack.isEmpty()) {
      LowLimFrame top = stack.peek();
      if (top.neighbors.hasNext()) {
        String w = top.neighbors.next();
        if (visited.add(w)) stack.push(new LowLimFrame(tree, w, top.node, nextLim));
        continue;
      }
      stack.pop();
      TreeNode label = tree.node(top.node);
      label.low = top.low;
      label.lim = nextLim++;
      label.parent = top.parent;
    }
    return nextLim;
  }

  private static class LowLimFrame {
    final String node;
    @Nullable final String parent;
    final int low;
    final Iterator<String> neighbors;

    LowLimFrame(Graph<TreeNode, TreeEdge, ?> tree, String node, @Nullable String parent, int low) {
      this.node = node;
      this.parent = parent;
      this.low = low;
      this.neighbors = tree.neighbors(node).iterator();
    }
  }

  /**
   * Assigns cut values bottom-up, so each child's value is known before its parent edge's is computed.
   */
  static void initCutValues(Graph<TreeNode, TreeEdge, ?> t, Graph<NodeLabel, EdgeLabel, ?> g) {
    for (String v : GraphTraversals.postorder(t, t.nodes())) {
      String parent = t.node(v).parent;
      if (parent != null) t.edge(v, parent).cutvalue = calcCutValue(t, g, v);
    }
  }

  /**
   * Computes the cut value of the tree edge between {@code child} and its parent, using the cut values already
   * assigned to the tree edges below {@code child}.
   */
  static double calcCutValue(Graph<TreeNode, TreeEdge, ?> t, Graph<NodeLabel, EdgeLabel, ?> g, String child) {
    String parent = t.node(child).parent;
    // whether the graph edge is oriented child -> parent
    boolean childIsTail = true;
    EdgeLabel graphEdge = g.edge(child, parent);
    if (graphEdge == null) {
      childIsTail = false;
      graphEdge = g.edge(parent, child);
    }

    double cutValue = graphEdge == null ? 0 : graphEdge.weight();

    for (EdgeKey e : g.nodeEdges(child)) {
      boolean isOutEdge = e.v().equals(child);
      String other = isOutEdge ? e.w() : e.v();
      if (other.equals(parent)) continue;

      boolean pointsToHead = isOutEdge == childIsTail;
      double otherWeight = Ranks.weight(g, e);
      cutValue += pointsToHead ? otherWeight : -otherWeight;
      if (t.hasEdge(child, other)) {
        double otherCutValue = t.edge(child, other).cutvalue;
        cutValue += pointsToHead ? -otherCutValue : otherCutValue;
      }
    }
    return cutValue;
  }

  @Nullable
  static EdgeKey leaveEdge(Graph<TreeNode, TreeEdge, ?> tree) {
    for (EdgeKey e : tree.edges()) {
      if (tree.edge(e).cutvalue < 0) return e;
    }
    return null;
  }

  /**
   * Finds the least-slack graph edge that reconnects the two components left by removing tree edge {@code edge},
   * oriented the same way across the cut as {@code edge}.
   */
  @Nullable
  static EdgeKey enterEdge(Graph<TreeNode, TreeEdge, ?> t, Graph<NodeLabel, EdgeLabel, ?> g, EdgeKey edge) {
    String v = edge.v();
    String w = edge.w();

    // tree edges are undirected; orient by the graph
    if (!g.hasEdge(v, w)) {
      v = edge.w();
      w = edge.v();
    }

    TreeNode vLabel = t.node(v);
    TreeNode wLabel = t.node(w);
    TreeNode tailLabel = vLabel;
    boolean flip = false;

    // if the root is on the tail side of the edge, search for an edge from head to tail instead
    if (vLabel.lim > wLabel.lim) {
      tailLabel = wLabel;
      flip = true;
    }

    EdgeKey best = null;
    int bestSlack = Integer.MAX_VALUE;
    for (EdgeKey candidate : g.edges()) {
      TreeNode candidateV = t.node(candidate.v());
      TreeNode candidateW = t.node(candidate.w());
      if (candidateV == null || candidateW == null) continue;
      if (flip == isDescendant(candidateV, tailLabel) && flip != isDescendant(candidateW, tailLabel)) {
        int slack = Ranks.slack(g, candidate);
        if (best == null || slack < bestSlack) {
          best = candidate;
          bestSlack = slack;
        }
      }
    }
    return best;
  }

  static void exchangeEdges(Graph<TreeNode, TreeEdge, ?> t, Graph<NodeLabel, EdgeLabel, ?> g, EdgeKey e, EdgeKey f) {
    t.removeEdge(e.v(), e.w());
    t.setEdge(f.v(), f.w(), new TreeEdge());
    initLowLimValues(t);
    initCutValues(t, g);
    updateRanks(t, g);
  }

  /**
   * Re-derives ranks from the tree: walking down from each root, every node sits exactly minlen away from its parent.
   */
  private static void updateRanks(Graph<TreeNode, TreeEdge, ?> t, Graph<NodeLabel, EdgeLabel, ?> g) {
    List<String> roots = new ArrayList<>();
    for (String v : t.nodes()) {
      if (t.node(v).parent == null) roots.add(v);
    }
    for (String v : GraphTraversals.preorder(t, roots)) {
      String parent = t.node(v).parent;
      if (parent == null) continue;
      EdgeLabel edge = g.edge(v, parent);
      boolean flipped = false;
      if (edge == null) {
        edge = g.edge(parent, v);
        flipped = true;
      }
      int minlen = edge == null ? 1 : edge.minlen();
      int parentRank = LayoutGraphs.rankOf(g.node(parent));
      g.node(v).setRank(parentRank + (flipped ? minlen : -minlen));
    }
  }

  private static boolean isDescendant(TreeNode vLabel, TreeNode rootLabel) {
    return rootLabel.low <= vLabel.lim && vLabel.lim <= rootLabel.lim;
  }
}
