package strata.layout.nesting;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.DummyKind;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the nesting graph that keeps each subgraph's descendants in a contiguous band of ranks.
 * <p>
 * Every subgraph gets a top and a bottom border node, and each child hangs between them through a "nesting edge".
 * A single root node links to every top-level node so the whole graph is connected. All original edge lengths are
 * scaled by {@code 2 * height + 1}, where height is the depth of the subgraph tree, which leaves room for the border
 * ranks between them. Nesting edges weigh more than all original edges together, so the ranker prefers to keep
 * subgraphs compact.
 * <p>
 * See Sander, "Layout of Compound Directed Graphs".
 */
public final class NestingGraph {
  private NestingGraph() {
  }

  public static void run(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    String root = LayoutGraphs.addDummyNode(g, DummyKind.ROOT, new NodeLabel(), "_root");
    Map<String, Integer> depths = treeDepths(g);
    int height = depths.values().stream().mapToInt(Integer::intValue).max().orElse(1) - 1;
    int nodeSep = 2 * height + 1;

    g.graph().setNestingRoot(root);

    double weight = 1;
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      edge.setMinlen(edge.minlen() * nodeSep);
      weight += edge.weight();
    }

    for (String child : g.children()) {
      dfs(g, root, nodeSep, weight, height, depths, child);
    }

    g.graph().setNodeRankFactor(nodeSep);
  }

  /**
   * Removes the root and every nesting edge.
   */
  public static void cleanup(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    GraphLabel graphLabel = g.graph();
    if (graphLabel.nestingRoot() != null) g.removeNode(graphLabel.nestingRoot());
    graphLabel.setNestingRoot(null);
    for (EdgeKey e : g.edges()) {
      if (g.edge(e).isNestingEdge()) g.removeEdge(e);
    }
  }

  private static void dfs(
          Graph<NodeLabel, EdgeLabel, GraphLabel> g,
          String root,
          int nodeSep,
          double weight,
          int height,
          Map<String, Integer> depths,
          String v
  ) {
    List<String> children = g.children(v);
    if (children.isEmpty()) {
      if (!v.equals(root)) g.setEdge(root, v, new EdgeLabel(nodeSep, 0));
      return;
    }

    String top = LayoutGraphs.addBorderNode(g, "_bt");
    String bottom = LayoutGraphs.addBorderNode(g, "_bb");
    NodeLabel label = g.node(v);

    g.setParent(top, v);
    label.setBorderTop(top);
    g.setParent(bottom, v);
    label.setBorderBottom(bottom);

    for (String child : children) {
      dfs(g, root, nodeSep, weight, height, depths, child);

      NodeLabel childNode = g.node(child);
      String childTop = childNode.borderTop() != null ? childNode.borderTop() : child;
      String childBottom = childNode.borderBottom() != null ? childNode.borderBottom() : child;
      double thisWeight = childNode.borderTop() != null ? weight : 2 * weight;
      int minlen = !childTop.equals(childBottom) ? 1 : height - depths.get(v) + 1;

      g.setEdge(top, childTop, new EdgeLabel(minlen, thisWeight).setNestingEdge(true));
      g.setEdge(childBottom, bottom, new EdgeLabel(minlen, thisWeight).setNestingEdge(true));
    }

    if (g.parent(v) == null) {
      g.setEdge(root, top, new EdgeLabel(height + depths.get(v), 0));
    }
  }

  private static Map<String, Integer> treeDepths(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Map<String, Integer> depths = new HashMap<>();
    for (String v : g.children()) {
      assignDepths(g, v, 1, depths);
    }
    return depths;
  }

  private static void assignDepths(Graph<NodeLabel, EdgeLabel, GraphLabel> g, String v, int depth,
                                   Map<String, Integer> depths) {
    for (String child : g.children(v)) {
      assignDepths(g, child, depth + 1, depths);
    }
    depths.put(v, depth);
  }
}
