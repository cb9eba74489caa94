package strata.layout.position;

import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;
import strata.layout.PositionerKind;

import java.util.List;

/**
 * Positions the leaf nodes of a layout graph with the {@link Positioner} selected by
 * {@link GraphLabel#positioner()}. Subgraph nodes are skipped; their geometry comes from their border nodes later.
 */
public final class Position {
  private Position() {
  }

  public static void position(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    positioner(g.graph().positioner()).position(LayoutGraphs.asNonCompoundGraph(g));
  }

  public static Positioner positioner(PositionerKind kind) {
    switch (kind) {
      case RANK_PACKER:
        return new RankPacker();
      case BRANDES_KOPF:
      default:
        return new BrandesKopf();
    }
  }

  /**
   * Centers each rank vertically on its tallest node, stacking ranks {@link GraphLabel#ranksep()} apart.
   */
  public static void positionY(Graph<NodeLabel, ?, GraphLabel> g) {
    double rankSep = g.graph().ranksep();
    double prevY = 0;
    for (List<String> layer : LayoutGraphs.buildLayerMatrix(g)) {
      double maxHeight = 0;
      for (String v : layer) {
        maxHeight = Math.max(maxHeight, g.node(v).height());
      }
      for (String v : layer) {
        g.node(v).setY(prevY + maxHeight / 2);
      }
      prevY += maxHeight + rankSep;
    }
  }
}
