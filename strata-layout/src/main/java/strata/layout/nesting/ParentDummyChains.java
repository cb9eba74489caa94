package strata.layout.nesting;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.NodeLabel;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves every dummy chain into the subgraphs its edge passes through. A chain climbs from its source toward the
 * lowest common ancestor of its endpoints while the enclosing subgraph ends above the current rank, then descends
 * toward the target's subgraph once the next one down has begun.
 */
public final class ParentDummyChains {
  private ParentDummyChains() {
  }

  public static void run(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Map<String, int[]> postorderNums = postorder(g);

    for (String chainStart : g.graph().dummyChains()) {
      String v = chainStart;
      NodeLabel node = g.node(v);
      EdgeKey edgeObj = node.edgeObj();
      PathData pathData = findPath(g, postorderNums, edgeObj.v(), edgeObj.w());
      List<String> path = pathData.path;
      String lca = pathData.lca;
      int pathIdx = 0;
      boolean ascending = true;

      while (!v.equals(edgeObj.w())) {
        node = g.node(v);
        int rank = node.rank();
        String pathV = path.get(pathIdx);

        if (ascending) {
          while (!isSame(pathV = path.get(pathIdx), lca) && maxRankBelow(g, pathV, rank)) {
            pathIdx++;
          }
          if (isSame(pathV, lca)) ascending = false;
        }

        if (!ascending) {
          while (pathIdx < path.size() - 1 && minRankAtMost(g, path.get(pathIdx + 1), rank)) {
            pathIdx++;
          }
          pathV = path.get(pathIdx);
        }

        g.setParent(v, pathV);
        List<String> successors = g.successors(v);
        if (successors.isEmpty()) break;
        v = successors.get(0);
      }
    }
  }

  private static boolean isSame(@Nullable String a, @Nullable String b) {
    return a == null ? b == null : a.equals(b);
  }

  private static boolean maxRankBelow(Graph<NodeLabel, ?, ?> g, @Nullable String v, int rank) {
    NodeLabel node = v == null ? null : g.node(v);
    return node != null && node.maxRank() != null && node.maxRank() < rank;
  }

  private static boolean minRankAtMost(Graph<NodeLabel, ?, ?> g, @Nullable String v, int rank) {
    NodeLabel node = v == null ? null : g.node(v);
    return node != null && node.minRank() != null && node.minRank() <= rank;
  }

  /**
   * The path from {@code v} up to the lowest common ancestor of {@code v} and {@code w} and back down to {@code w},
   * excluding both endpoints. A {@code null} entry stands for the root of the hierarchy.
   */
  private static PathData findPath(Graph<NodeLabel, ?, ?> g, Map<String, int[]> postorderNums, String v, String w) {
    List<String> vPath = new ArrayList<>();
    List<String> wPath = new ArrayList<>();
    int low = Math.min(postorderNums.get(v)[0], postorderNums.get(w)[0]);
    int lim = Math.max(postorderNums.get(v)[1], postorderNums.get(w)[1]);

    String parent = v;
    do {
      parent = g.parent(parent);
      vPath.add(parent);
    } while (parent != null && (postorderNums.get(parent)[0] > low || lim > postorderNums.get(parent)[1]));
    String lca = parent;

    parent = w;
    while (!isSame(parent = g.parent(parent), lca)) {
      wPath.add(parent);
    }
    Collections.reverse(wPath);
    vPath.addAll(wPath);
    return new PathData(vPath, lca);
  }

  private static Map<String, int[]> postorder(Graph<NodeLabel, ?, ?> g) {
    Map<String, int[]> result = new HashMap<>();
    int[] lim = {0};
    for (String v : g.children()) {
      assignPostorder(g, v, lim, result);
    }
    return result;
  }

  private static void assignPostorder(Graph<NodeLabel, ?, ?> g, String v, int[] lim, Map<String, int[]> result) {
    int low = lim[0];
    for (String child : g.children(v)) {
      assignPostorder(g, child, lim, result);
    }
    result.put(v, new int[]{low, lim[0]++});
  }

  private static class PathData {
    final List<String> path;
    @Nullable final String lca;

    PathData(List<String> path, @Nullable String lca) {
      this.path = path;
      this.lca = lca;
    }
  }
}
