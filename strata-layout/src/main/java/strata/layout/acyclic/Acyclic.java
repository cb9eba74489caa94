package strata.layout.acyclic;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.Acyclicer;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.NodeLabel;
import strata.layout.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Makes a graph acyclic by reversing a feedback arc set, and restores the reversed edges afterward.
 */
public final class Acyclic {
  private static final Logger LOG = LoggerFactory.getLogger(Acyclic.class);

  private Acyclic() {
  }

  /**
   * Reverses a feedback arc set in place. Each reversed edge gets a fresh {@code rev<N>} name so that it can sit
   * beside an existing edge between the same nodes, which needs a multigraph.
   */
  public static void run(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    checkArgument(g.isMultigraph(), "Cycle breaking needs a multigraph to keep reversed edges apart");
    List<EdgeKey> fas = g.graph().acyclicer() == Acyclicer.GREEDY
            ? GreedyFas.feedbackArcSet(g, e -> g.edge(e).weight())
            : dfsFeedbackArcSet(g);

    int nextName = 1;
    for (EdgeKey e : fas) {
      EdgeLabel label = g.edge(e);
      g.removeEdge(e);
      label.setForwardName(e.name());
      label.setReversed(true);
      String name;
      do {
        name = "rev" + nextName++;
      } while (g.hasEdge(e.w(), e.v(), name));
      g.setEdge(e.w(), e.v(), label, name);
    }
    if (!fas.isEmpty()) LOG.debug("Reversed {} edges to break cycles", fas.size());
  }

  /**
   * Restores every reversed edge to its original direction and name, reversing its points to match.
   */
  public static void undo(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (EdgeKey e : g.edges()) {
      EdgeLabel label = g.edge(e);
      if (!label.isReversed()) continue;

      g.removeEdge(e);
      String forwardName = label.forwardName();
      label.setReversed(false);
      label.setForwardName(null);
      List<Point> points = new ArrayList<>(label.points());
      Collections.reverse(points);
      label.setPoints(points);
      g.setEdge(e.w(), e.v(), label, forwardName);
    }
  }

  /**
   * Visits nodes in graph order; an out-edge whose target is on the current DFS path is a back edge.
   * Self loops are never reported.
   */
  static List<EdgeKey> dfsFeedbackArcSet(Graph<?, ?, ?> g) {
    List<EdgeKey> fas = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    Set<String> stack = new HashSet<>();
    for (String v : g.nodes()) {
      dfs(g, v, visited, stack, fas);
    }
    return fas;
  }

  private static void dfs(Graph<?, ?, ?> g, String root, Set<String> visited, Set<String> onPath, List<EdgeKey> fas) {
    if (!visited.add(root)) return;
    Deque<PathEntry> path = new ArrayDeque<>();
    path.push(new PathEntry(root, g.outEdges(root).iterator()));
    onPath.add(root);
    while (!path.isEmpty()) {
      PathEntry top = path.peek();
      if (!top.edges.hasNext()) {
        onPath.remove(path.pop().node);
        continue;
      }
      EdgeKey e = top.edges.next();
      if (e.isSelfLoop()) continue;
      if (onPath.contains(e.w())) {
        fas.add(e);
      } else if (visited.add(e.w())) {
        path.push(new PathEntry(e.w(), g.outEdges(e.w()).iterator()));
        onPath.add(e.w());
      }
    }
  }

  private static class PathEntry {
    final String node;
    final Iterator<EdgeKey> edges;

    PathEntry(String node, Iterator<EdgeKey> edges) {
      this.node = node;
      this.edges = edges;
    }
  }
}
