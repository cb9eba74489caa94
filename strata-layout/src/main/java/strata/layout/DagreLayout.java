package strata.layout;

import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.acyclic.Acyclic;
import strata.layout.nesting.BorderSegments;
import strata.layout.nesting.NestingGraph;
import strata.layout.nesting.ParentDummyChains;
import strata.layout.normalize.Normalize;
import strata.layout.order.Order;
import strata.layout.position.Position;
import strata.layout.rank.Ranks;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Lays out a directed graph in ranks, in the manner of Sugiyama et al. and Gansner et al.:
 * <ol>
 *   <li>cycles are broken by reversing a feedback arc set;</li>
 *   <li>nodes are assigned integer ranks, keeping every edge at least its minlen long;</li>
 *   <li>edges spanning several ranks are split into chains of dummy nodes;</li>
 *   <li>nodes are ordered within their ranks to reduce crossings;</li>
 *   <li>nodes get coordinates, and edges get polylines through their dummies.</li>
 * </ol>
 * Every transform that adds synthetic nodes or edges is undone before {@link #layout} returns.
 * <p>
 * The input graph's labels supply node sizes, edge constraints and graph options. The layout itself runs on a
 * private compound multigraph, from which positions, edge points and sizes are copied back.
 */
public final class DagreLayout {
  private static final Logger LOG = LoggerFactory.getLogger(DagreLayout.class);

  private DagreLayout() {
  }

  public static void layout(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Graph<NodeLabel, EdgeLabel, GraphLabel> layoutGraph = buildLayoutGraph(g);
    runLayout(layoutGraph);
    updateInputGraph(g, layoutGraph);
    LOG.debug("Laid out {} nodes and {} edges in {}", g.nodeCount(), g.edgeCount(), stopwatch);
  }

  /**
   * Runs the layout pipeline in place. {@code g} must be a compound multigraph, such as one from
   * {@link LayoutGraphs#newLayoutGraph()}, whose labels are all set.
   */
  public static void runLayout(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    time("makeSpaceForEdgeLabels", () -> makeSpaceForEdgeLabels(g));
    time("removeSelfEdges", () -> SelfEdges.remove(g));
    time("acyclic", () -> Acyclic.run(g));
    time("nestingGraph.run", () -> NestingGraph.run(g));
    time("rank", () -> Ranks.rank(LayoutGraphs.asNonCompoundGraph(g)));
    time("injectEdgeLabelProxies", () -> injectEdgeLabelProxies(g));
    time("removeEmptyRanks", () -> LayoutGraphs.removeEmptyRanks(g));
    time("nestingGraph.cleanup", () -> NestingGraph.cleanup(g));
    time("normalizeRanks", () -> LayoutGraphs.normalizeRanks(g));
    time("assignRankMinMax", () -> assignRankMinMax(g));
    time("removeEdgeLabelProxies", () -> removeEdgeLabelProxies(g));
    time("adjustCoordinateSystem", () -> CoordinateSystem.adjust(g));
    time("normalize.run", () -> Normalize.run(g));
    time("parentDummyChains", () -> ParentDummyChains.run(g));
    time("addBorderSegments", () -> BorderSegments.add(g));
    time("order", () -> Order.order(g));
    time("insertSelfEdges", () -> SelfEdges.insert(g));
    time("position", () -> Position.position(g));
    time("positionSelfEdges", () -> SelfEdges.position(g));
    time("removeBorderNodes", () -> removeBorderNodes(g));
    time("normalize.undo", () -> Normalize.undo(g));
    time("fixupEdgeLabelCoords", () -> fixupEdgeLabelCoords(g));
    time("undoCoordinateSystem", () -> CoordinateSystem.undo(g));
    time("translateGraph", () -> translateGraph(g));
    time("assignNodeIntersects", () -> assignNodeIntersects(g));
    time("acyclic.undo", () -> Acyclic.undo(g));
  }

  private static void time(String name, Runnable pass) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    pass.run();
    LOG.debug("{}: {}", name, stopwatch);
  }

  /**
   * Copies the layout-relevant attributes of {@code inputGraph} into a fresh layout graph, so that none of the
   * pipeline's bookkeeping leaks into the caller's labels.
   */
  static Graph<NodeLabel, EdgeLabel, GraphLabel> buildLayoutGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> inputGraph) {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = LayoutGraphs.newLayoutGraph();
    GraphLabel graphLabel = inputGraph.graph();
    g.setGraph(graphLabel == null ? new GraphLabel() : GraphLabel.copyOptions(graphLabel));

    for (String v : inputGraph.nodes()) {
      NodeLabel node = inputGraph.node(v);
      g.setNode(v, node == null ? new NodeLabel() : new NodeLabel(node.width(), node.height()));
    }
    if (inputGraph.isCompound()) {
      for (String v : inputGraph.nodes()) {
        String parent = inputGraph.parent(v);
        if (parent != null) g.setParent(v, parent);
      }
    }

    for (EdgeKey e : inputGraph.edges()) {
      EdgeLabel edge = inputGraph.edge(e);
      EdgeLabel copy = new EdgeLabel();
      if (edge != null) {
        copy.setMinlen(edge.minlen())
                .setWeight(edge.weight())
                .setWidth(edge.width())
                .setHeight(edge.height())
                .setLabeloffset(edge.labeloffset())
                .setLabelpos(edge.labelpos());
      }
      g.setEdge(e, copy);
    }
    return g;
  }

  /**
   * Copies final coordinates back to the input graph: positions and ranks of nodes, sizes of subgraph nodes, edge
   * points and label positions, and the size of the whole drawing.
   */
  static void updateInputGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> inputGraph,
                               Graph<NodeLabel, EdgeLabel, GraphLabel> layoutGraph) {
    for (String v : inputGraph.nodes()) {
      NodeLabel inputLabel = inputGraph.node(v);
      NodeLabel layoutLabel = layoutGraph.node(v);
      if (inputLabel == null || layoutLabel == null) continue;

      inputLabel.setX(layoutLabel.x()).setY(layoutLabel.y()).setRank(layoutLabel.rank());
      if (!layoutGraph.children(v).isEmpty()) {
        inputLabel.setWidth(layoutLabel.width()).setHeight(layoutLabel.height());
      }
    }

    for (EdgeKey e : inputGraph.edges()) {
      EdgeLabel inputLabel = inputGraph.edge(e);
      EdgeLabel layoutLabel = layoutGraph.edge(e);
      if (inputLabel == null || layoutLabel == null) continue;

      inputLabel.setPoints(layoutLabel.points());
      if (layoutLabel.hasPosition()) {
        inputLabel.setX(layoutLabel.x()).setY(layoutLabel.y());
      }
    }

    GraphLabel inputGraphLabel = inputGraph.graph();
    if (inputGraphLabel != null) {
      inputGraphLabel.setWidth(layoutGraph.graph().width()).setHeight(layoutGraph.graph().height());
    }
  }

  /**
   * Doubles every minlen so that an edge label can take the rank halfway along its edge, and halves
   * {@link GraphLabel#ranksep()} to compensate. A label beside its edge is widened by its offset.
   */
  static void makeSpaceForEdgeLabels(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    GraphLabel graphLabel = g.graph();
    graphLabel.setRanksep(graphLabel.ranksep() / 2);
    boolean horizontal = graphLabel.rankdir().isHorizontal();
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      edge.setMinlen(edge.minlen() * 2);
      if (edge.labelpos() != LabelPos.C) {
        if (horizontal) {
          edge.setHeight(edge.height() + edge.labeloffset());
        } else {
          edge.setWidth(edge.width() + edge.labeloffset());
        }
      }
    }
  }

  /**
   * Pins the rank of each sized edge label with a proxy node halfway between the edge's endpoints, so that the
   * empty-rank removal that follows keeps that rank.
   */
  static void injectEdgeLabelProxies(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      if (edge.width() == 0 || edge.height() == 0) continue;

      int vRank = LayoutGraphs.rankOf(g.node(e.v()));
      int wRank = LayoutGraphs.rankOf(g.node(e.w()));
      int rank = (int) ((wRank - vRank) / 2.0 + vRank);
      LayoutGraphs.addDummyNode(g, DummyKind.EDGE_PROXY, new NodeLabel().setRank(rank).setEdgeObj(e), "_ep");
    }
  }

  static void removeEdgeLabelProxies(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.dummy() != DummyKind.EDGE_PROXY) continue;

      EdgeLabel edge = g.edge(node.edgeObj());
      if (edge != null) edge.setLabelRank(node.rank());
      g.removeNode(v);
    }
  }

  /**
   * Records on each subgraph the ranks of its top and bottom borders, and on the graph the highest such rank.
   */
  static void assignRankMinMax(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    int maxRank = 0;
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.borderTop() == null) continue;

      node.setMinRank(g.node(node.borderTop()).rank());
      node.setMaxRank(g.node(node.borderBottom()).rank());
      maxRank = Math.max(maxRank, LayoutGraphs.rankOf(g.node(node.borderBottom())));
    }
    g.graph().setMaxRank(maxRank);
  }

  /**
   * Sizes and places every subgraph node to enclose its border nodes, then removes all border nodes.
   */
  static void removeBorderNodes(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (String v : g.nodes()) {
      if (g.children(v).isEmpty()) continue;

      NodeLabel node = g.node(v);
      NodeLabel t = nodeOrNull(g, node.borderTop());
      NodeLabel b = nodeOrNull(g, node.borderBottom());
      NodeLabel l = nodeOrNull(g, last(node.borderLeft()));
      NodeLabel r = nodeOrNull(g, last(node.borderRight()));
      if (t == null || b == null || l == null || r == null) continue;

      double width = Math.abs(r.x() - l.x());
      double height = Math.abs(b.y() - t.y());
      node.setWidth(width)
              .setHeight(height)
              .setX(l.x() + width / 2)
              .setY(t.y() + height / 2);
    }

    for (String v : g.nodes()) {
      if (g.node(v).dummy() == DummyKind.BORDER) g.removeNode(v);
    }
  }

  /**
   * Moves a label that sits beside its edge from the edge's line to its side, and gives back the width added by
   * {@link #makeSpaceForEdgeLabels}.
   */
  static void fixupEdgeLabelCoords(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      if (edge.x() == null) continue;

      if (edge.labelpos() == LabelPos.L || edge.labelpos() == LabelPos.R) {
        edge.setWidth(edge.width() - edge.labeloffset());
      }
      if (edge.labelpos() == LabelPos.L) {
        edge.setX(edge.x() - edge.width() / 2 - edge.labeloffset());
      } else if (edge.labelpos() == LabelPos.R) {
        edge.setX(edge.x() + edge.width() / 2 + edge.labeloffset());
      }
    }
  }

  /**
   * Shifts the drawing so that its top-left corner, over nodes and edge labels, sits at the graph's margins, and
   * records the overall size including the margins.
   */
  static void translateGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    double minX = Double.POSITIVE_INFINITY;
    double maxX = 0;
    double minY = Double.POSITIVE_INFINITY;
    double maxY = 0;
    GraphLabel graphLabel = g.graph();
    double marginX = graphLabel.marginx();
    double marginY = graphLabel.marginy();

    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.x() == null || node.y() == null) continue;
      minX = Math.min(minX, node.x() - node.width() / 2);
      maxX = Math.max(maxX, node.x() + node.width() / 2);
      minY = Math.min(minY, node.y() - node.height() / 2);
      maxY = Math.max(maxY, node.y() + node.height() / 2);
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      if (!edge.hasPosition()) continue;
      minX = Math.min(minX, edge.x() - edge.width() / 2);
      maxX = Math.max(maxX, edge.x() + edge.width() / 2);
      minY = Math.min(minY, edge.y() - edge.height() / 2);
      maxY = Math.max(maxY, edge.y() + edge.height() / 2);
    }
    if (minX == Double.POSITIVE_INFINITY) {
      minX = 0;
      minY = 0;
    }

    double dx = minX - marginX;
    double dy = minY - marginY;
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.x() != null) node.setX(node.x() - dx);
      if (node.y() != null) node.setY(node.y() - dy);
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      edge.points().replaceAll(p -> p.translate(-dx, -dy));
      if (edge.x() != null) edge.setX(edge.x() - dx);
      if (edge.y() != null) edge.setY(edge.y() - dy);
    }

    graphLabel.setWidth(maxX - dx + marginX);
    graphLabel.setHeight(maxY - dy + marginY);
  }

  /**
   * Starts and ends every edge's polyline where it leaves its source's box and enters its target's. An edge without
   * bends aims straight from one node's center to the other's.
   */
  static void assignNodeIntersects(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    for (EdgeKey e : g.edges()) {
      EdgeLabel edge = g.edge(e);
      NodeLabel nodeV = g.node(e.v());
      NodeLabel nodeW = g.node(e.w());
      List<Point> points = edge.points();
      Point p1;
      Point p2;
      if (points.isEmpty()) {
        p1 = Point.of(nodeW.x(), nodeW.y());
        p2 = Point.of(nodeV.x(), nodeV.y());
      } else {
        p1 = points.get(0);
        p2 = points.get(points.size() - 1);
      }
      points.add(0, LayoutGraphs.intersectRect(nodeV, p1));
      points.add(LayoutGraphs.intersectRect(nodeW, p2));
    }
  }

  @Nullable
  private static NodeLabel nodeOrNull(Graph<NodeLabel, ?, ?> g, @Nullable String v) {
    return v == null ? null : g.node(v);
  }

  @Nullable
  private static String last(List<String> vs) {
    return vs.isEmpty() ? null : vs.get(vs.size() - 1);
  }
}
