package strata.layout.position;

import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs each rank from left to right, every node as close to its left neighbour as {@link Separation#sep} allows,
 * then centers each rank under the widest one. Ranks are placed independently of each other, so this is quick but
 * makes no attempt to straighten edges.
 */
public class RankPacker implements Positioner {
  @Override
  public void position(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Position.positionY(g);

    List<List<String>> layering = LayoutGraphs.buildLayerMatrix(g);
    List<double[]> extents = new ArrayList<>(layering.size());
    double maxWidth = 0;
    for (List<String> layer : layering) {
      double[] extent = packLayer(g, layer);
      extents.add(extent);
      maxWidth = Math.max(maxWidth, extent[1] - extent[0]);
    }

    for (int i = 0; i < layering.size(); i++) {
      List<String> layer = layering.get(i);
      if (layer.isEmpty()) continue;
      double[] extent = extents.get(i);
      double shift = (maxWidth - (extent[1] - extent[0])) / 2 - extent[0];
      for (String v : layer) {
        NodeLabel node = g.node(v);
        node.setX(node.x() + shift);
      }
    }
  }

  /**
   * @return the left and right edges of the packed layer
   */
  private static double[] packLayer(Graph<NodeLabel, EdgeLabel, GraphLabel> g, List<String> layer) {
    if (layer.isEmpty()) return new double[]{0, 0};

    double left = 0;
    double right = 0;
    String prev = null;
    for (String v : layer) {
      NodeLabel node = g.node(v);
      double x = prev == null ? node.width() / 2 : g.node(prev).x() + Separation.sep(g, v, prev, false);
      node.setX(x);
      left = Math.min(left, x - node.width() / 2);
      right = Math.max(right, x + node.width() / 2);
      prev = v;
    }
    return new double[]{left, right};
  }
}
