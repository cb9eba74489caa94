package strata.layout.order;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.DummyKind;
import strata.layout.EdgeLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.List;
import java.util.Objects;

/**
 * A local refinement after the barycenter sweeps: adjacent nodes of a rank are swapped whenever that strictly lowers
 * the weighted crossings of their edges with the ranks above and below. Swapping two neighbours only changes the
 * crossings between their own edges, so every swap lowers the total and the pass reaches a fixed point.
 * <p>
 * Only siblings under the same parent are swapped, and never a subgraph border, so subgraphs stay contiguous.
 */
final class Transpose {
  private Transpose() {
  }

  /**
   * @return the number of swaps made
   */
  static int transpose(Graph<NodeLabel, EdgeLabel, ?> g) {
    List<List<String>> layering = LayoutGraphs.buildLayerMatrix(g);
    int swaps = 0;
    boolean improved = true;
    while (improved) {
      improved = false;
      for (List<String> layer : layering) {
        for (int i = 0; i + 1 < layer.size(); i++) {
          String u = layer.get(i);
          String w = layer.get(i + 1);
          if (!canSwap(g, u, w)) continue;
          if (crossings(g, w, u) < crossings(g, u, w)) {
            layer.set(i, w);
            layer.set(i + 1, u);
            g.node(w).setOrder(i);
            g.node(u).setOrder(i + 1);
            improved = true;
            swaps++;
          }
        }
      }
    }
    return swaps;
  }

  private static boolean canSwap(Graph<NodeLabel, EdgeLabel, ?> g, String u, String w) {
    if (g.node(u).dummy() == DummyKind.BORDER || g.node(w).dummy() == DummyKind.BORDER) return false;
    return Objects.equals(g.parent(u), g.parent(w));
  }

  /**
   * Weighted crossings between the edges of {@code left} and {@code right}, with {@code left} placed first.
   */
  static double crossings(Graph<NodeLabel, EdgeLabel, ?> g, String left, String right) {
    return sideCrossings(g, g.inEdges(left), g.inEdges(right), true)
            + sideCrossings(g, g.outEdges(left), g.outEdges(right), false);
  }

  private static double sideCrossings(Graph<NodeLabel, EdgeLabel, ?> g, List<EdgeKey> leftEdges,
                                      List<EdgeKey> rightEdges, boolean incoming) {
    double cc = 0;
    for (EdgeKey l : leftEdges) {
      int leftPos = LayoutGraphs.orderOf(g.node(incoming ? l.v() : l.w()));
      for (EdgeKey r : rightEdges) {
        int rightPos = LayoutGraphs.orderOf(g.node(incoming ? r.v() : r.w()));
        if (leftPos > rightPos) cc += g.edge(l).weight() * g.edge(r).weight();
      }
    }
    return cc;
  }
}
