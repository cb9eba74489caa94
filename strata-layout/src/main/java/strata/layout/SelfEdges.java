package strata.layout;

import strata.graph.EdgeKey;
import strata.graph.Graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Self loops take no part in ranking or ordering. They ride along on their node and come back as a small curve on
 * the node's right-hand side.
 */
final class SelfEdges {
  private SelfEdges() {
  }

  static void remove(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (EdgeKey e : g.edges()) {
      if (!e.isSelfLoop()) continue;
      g.node(e.v()).selfEdges().add(SelfEdge.of(e, g.edge(e)));
      g.removeEdge(e);
    }
  }

  /**
   * Reserves a slot right after each node, in the node's rank, for every loop it carries.
   */
  static void insert(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (List<String> layer : LayoutGraphs.buildLayerMatrix(g)) {
      int orderShift = 0;
      for (int i = 0; i < layer.size(); i++) {
        NodeLabel node = g.node(layer.get(i));
        node.setOrder(i + orderShift);
        for (SelfEdge selfEdge : node.selfEdges()) {
          orderShift++;
          NodeLabel dummy = new NodeLabel(selfEdge.label().width(), selfEdge.label().height())
                  .setRank(node.rank())
                  .setOrder(i + orderShift)
                  .setEdgeObj(selfEdge.edge())
                  .setEdgeLabel(selfEdge.label());
          LayoutGraphs.addDummyNode(g, DummyKind.SELF_EDGE, dummy, "_se");
        }
        node.selfEdges().clear();
      }
    }
  }

  static void position(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.dummy() != DummyKind.SELF_EDGE) continue;

      NodeLabel selfNode = g.node(node.edgeObj().v());
      double x = selfNode.x() + selfNode.width() / 2;
      double y = selfNode.y();
      double dx = node.x() - x;
      double dy = selfNode.height() / 2;
      EdgeLabel label = node.edgeLabel();
      g.setEdge(node.edgeObj(), label);
      g.removeNode(v);

      List<Point> points = new ArrayList<>(5);
      points.add(Point.of(x + 2 * dx / 3, y - dy));
      points.add(Point.of(x + 5 * dx / 6, y - dy));
      points.add(Point.of(x + dx, y));
      points.add(Point.of(x + 5 * dx / 6, y + dy));
      points.add(Point.of(x + 2 * dx / 3, y + dy));
      label.setPoints(points);
      label.setX(node.x());
      label.setY(node.y());
    }
  }
}
