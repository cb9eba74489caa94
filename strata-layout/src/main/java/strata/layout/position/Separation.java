package strata.layout.position;

import strata.graph.Graph;
import strata.layout.GraphLabel;
import strata.layout.LabelPos;
import strata.layout.NodeLabel;

final class Separation {
  private Separation() {
  }

  /**
   * The minimum distance between the centers of {@code v} and its left neighbour {@code w}: half of each width,
   * plus half of {@link GraphLabel#nodesep()} for each real node or half of {@link GraphLabel#edgesep()} for each
   * dummy. An edge label pinned to the left or right of its dummy shifts the distance by half its width, in the
   * opposite direction when compacting right to left ({@code reverseSep}).
   */
  static double sep(Graph<NodeLabel, ?, GraphLabel> g, String v, String w, boolean reverseSep) {
    NodeLabel vLabel = labelOf(g, v);
    NodeLabel wLabel = labelOf(g, w);
    double nodesep = g.graph().nodesep();
    double edgesep = g.graph().edgesep();

    double sum = vLabel.width() / 2;
    double delta = 0;
    if (vLabel.labelpos() == LabelPos.L) {
      delta = -vLabel.width() / 2;
    } else if (vLabel.labelpos() == LabelPos.R) {
      delta = vLabel.width() / 2;
    }
    sum += reverseSep ? delta : -delta;

    sum += (vLabel.isDummy() ? edgesep : nodesep) / 2;
    sum += (wLabel.isDummy() ? edgesep : nodesep) / 2;

    sum += wLabel.width() / 2;
    delta = 0;
    if (wLabel.labelpos() == LabelPos.L) {
      delta = wLabel.width() / 2;
    } else if (wLabel.labelpos() == LabelPos.R) {
      delta = -wLabel.width() / 2;
    }
    sum += reverseSep ? delta : -delta;
    return sum;
  }

  static double width(Graph<NodeLabel, ?, ?> g, String v) {
    NodeLabel node = g.node(v);
    return node == null ? 0 : node.width();
  }

  private static NodeLabel labelOf(Graph<NodeLabel, ?, ?> g, String v) {
    NodeLabel node = g.node(v);
    return node == null ? new NodeLabel() : node;
  }
}
