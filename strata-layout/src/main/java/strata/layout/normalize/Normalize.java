package strata.layout.normalize;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.DummyKind;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;
import strata.layout.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits every edge that spans more than one rank into a chain of unit-length edges through dummy nodes, and later
 * folds the positions of those dummies back into the original edge's points.
 * <p>
 * The dummy at the edge's {@link EdgeLabel#labelRank()} takes the size of the edge label, so ordering and positioning
 * reserve room for it.
 */
public final class Normalize {
  private Normalize() {
  }

  public static void run(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    g.graph().dummyChains().clear();
    for (EdgeKey e : g.edges()) {
      normalizeEdge(g, e);
    }
  }

  private static void normalizeEdge(Graph<NodeLabel, EdgeLabel, GraphLabel> g, EdgeKey e) {
    String v = e.v();
    int vRank = LayoutGraphs.rankOf(g.node(v));
    String w = e.w();
    int wRank = LayoutGraphs.rankOf(g.node(w));
    EdgeLabel edgeLabel = g.edge(e);
    Integer labelRank = edgeLabel.labelRank();

    if (wRank <= vRank + 1) return;

    g.removeEdge(e);
    edgeLabel.setPoints(new ArrayList<>());

    int i = 0;
    for (int rank = vRank + 1; rank < wRank; rank++, i++) {
      NodeLabel attrs = new NodeLabel(0, 0).setEdgeLabel(edgeLabel).setEdgeObj(e).setRank(rank);
      String dummy = LayoutGraphs.addDummyNode(g, DummyKind.EDGE, attrs, "_d");
      if (labelRank != null && rank == labelRank) {
        attrs.setWidth(edgeLabel.width())
                .setHeight(edgeLabel.height())
                .setDummy(DummyKind.EDGE_LABEL)
                .setLabelpos(edgeLabel.labelpos());
      }
      g.setEdge(v, dummy, chainLink(edgeLabel), e.name());
      if (i == 0) g.graph().dummyChains().add(dummy);
      v = dummy;
    }

    g.setEdge(v, w, chainLink(edgeLabel), e.name());
  }

  private static EdgeLabel chainLink(EdgeLabel edgeLabel) {
    return new EdgeLabel(1, edgeLabel.weight());
  }

  /**
   * Removes every dummy chain, restoring its original edge with one point per removed dummy. The dummy carrying the
   * edge label also gives the label its position and size.
   */
  public static void undo(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String chainStart : g.graph().dummyChains()) {
      String v = chainStart;
      NodeLabel node = g.node(v);
      EdgeLabel origLabel = node.edgeLabel();
      g.setEdge(node.edgeObj(), origLabel);

      List<Point> points = new ArrayList<>(origLabel.points());
      while (node != null && node.isDummy()) {
        List<String> successors = g.successors(v);
        String w = successors.isEmpty() ? null : successors.get(0);
        g.removeNode(v);
        points.add(Point.of(node.x(), node.y()));
        if (node.dummy() == DummyKind.EDGE_LABEL) {
          origLabel.setX(node.x())
                  .setY(node.y())
                  .setWidth(node.width())
                  .setHeight(node.height());
        }
        if (w == null) break;
        v = w;
        node = g.node(v);
      }
      origLabel.setPoints(points);
    }
  }
}
