package strata.layout;

import strata.graph.EdgeKey;
import strata.graph.Graph;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Every pass between {@link #adjust} and {@link #undo} lays the graph out top to bottom. These two map the other
 * rank directions onto that one and back.
 */
public final class CoordinateSystem {
  private CoordinateSystem() {
  }

  public static void adjust(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    if (g.graph().rankdir().isHorizontal()) swapWidthHeight(g);
  }

  public static void undo(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    RankDir rankdir = g.graph().rankdir();
    if (rankdir.isReversed()) reverseY(g);
    if (rankdir.isHorizontal()) {
      swapXY(g);
      swapWidthHeight(g);
    }
  }

  private static void swapWidthHeight(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      double width = node.width();
      node.setWidth(node.height()).setHeight(width);
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      double width = edge.width();
      edge.setWidth(edge.height()).setHeight(width);
    }
  }

  private static void reverseY(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.y() != null) node.setY(-node.y());
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      mapPoints(edge, p -> Point.of(p.x(), -p.y()));
      if (edge.y() != null) edge.setY(-edge.y());
    }
  }

  private static void swapXY(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      Double x = node.x();
      node.setX(node.y()).setY(x);
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      mapPoints(edge, Point::transpose);
      if (edge.x() != null) {
        Double x = edge.x();
        edge.setX(edge.y()).setY(x);
      }
    }
  }

  private static void mapPoints(EdgeLabel edge, UnaryOperator<Point> mapping) {
    List<Point> points = edge.points();
    points.replaceAll(mapping);
  }
}
