package strata.layout;

import org.junit.jupiter.api.Test;
import strata.graph.EdgeKey;
import strata.graph.Graph;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

class LayoutGraphsTest {
  private static Graph<NodeLabel, EdgeLabel, GraphLabel> newGraph() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = LayoutGraphs.newLayoutGraph();
    g.setGraph(new GraphLabel());
    g.setDefaultNodeLabel(v -> new NodeLabel());
    g.setDefaultEdgeLabel(EdgeLabel::new);
    return g;
  }

  @Test
  void simplifyCopiesWithoutChange() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel(1, 2));
    g.setNode("b");
    g.setEdge("a", "b", new EdgeLabel(1, 1));

    Graph<NodeLabel, EdgeLabel, GraphLabel> simplified = LayoutGraphs.simplify(g);

    assertThat(simplified.node("a")).isSameInstanceAs(g.node("a"));
    assertThat(simplified.edge("a", "b").minlen()).isEqualTo(1);
    assertThat(simplified.edge("a", "b").weight()).isEqualTo(1.0);
    assertThat(simplified.edges()).hasSize(1);
    assertThat(simplified.isMultigraph()).isFalse();
  }

  @Test
  void simplifyCollapsesMultiEdges() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setEdge("a", "b", new EdgeLabel(1, 1));
    g.setEdge("a", "b", new EdgeLabel(2, 2), "multi");

    Graph<NodeLabel, EdgeLabel, GraphLabel> simplified = LayoutGraphs.simplify(g);

    assertThat(simplified.edges()).containsExactly(EdgeKey.of("a", "b"));
    assertThat(simplified.edge("a", "b").minlen()).isEqualTo(2);
    assertThat(simplified.edge("a", "b").weight()).isEqualTo(3.0);
  }

  @Test
  void asNonCompoundGraphDropsSubgraphNodesAndSharesLabels() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setParent("a", "sg1");
    g.setEdge("a", "b", new EdgeLabel(), "multi");

    Graph<NodeLabel, EdgeLabel, GraphLabel> flat = LayoutGraphs.asNonCompoundGraph(g);

    assertThat(flat.nodes()).containsExactly("a", "b");
    assertThat(flat.isCompound()).isFalse();
    assertThat(flat.node("a")).isSameInstanceAs(g.node("a"));
    assertThat(flat.edge("a", "b", "multi")).isSameInstanceAs(g.edge("a", "b", "multi"));
    assertThat(flat.graph()).isSameInstanceAs(g.graph());
  }

  @Test
  void intersectRectFindsTheBoundaryTowardEachPoint() {
    NodeLabel rect = new NodeLabel(1, 1).setPosition(0, 0);
    for (Point point : List.of(Point.of(2, 6), Point.of(2, -6), Point.of(6, 2), Point.of(-6, 2),
            Point.of(5, 0), Point.of(0, 5))) {
      Point cross = LayoutGraphs.intersectRect(rect, point);
      if (cross.x() != point.x()) {
        double m = (cross.y() - point.y()) / (cross.x() - point.x());
        assertThat(cross.y() - rect.y()).isWithin(1e-9).of(m * (cross.x() - rect.x()));
      }
      assertThat(Math.abs(cross.x() - rect.x()) == 0.5 || Math.abs(cross.y() - rect.y()) == 0.5).isTrue();
      assertThat(Math.abs(cross.x() - rect.x())).isAtMost(0.5);
      assertThat(Math.abs(cross.y() - rect.y())).isAtMost(0.5);
    }
  }

  @Test
  void intersectRectFallsBackToTheRightSideAtTheCenter() {
    NodeLabel rect = new NodeLabel(10, 4).setPosition(3, 7);
    assertThat(LayoutGraphs.intersectRect(rect, Point.of(3, 7))).isEqualTo(Point.of(8, 7));
  }

  @Test
  void buildLayerMatrixGroupsByRankInOrder() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel().setRank(0).setOrder(0));
    g.setNode("b", new NodeLabel().setRank(0).setOrder(1));
    g.setNode("c", new NodeLabel().setRank(1).setOrder(0));
    g.setNode("d", new NodeLabel().setRank(1).setOrder(1));
    g.setNode("e", new NodeLabel().setRank(2).setOrder(0));

    assertThat(LayoutGraphs.buildLayerMatrix(g)).containsExactly(
            List.of("a", "b"), List.of("c", "d"), List.of("e")).inOrder();
  }

  @Test
  void buildLayerMatrixKeepsEmptyRanks() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel().setRank(0).setOrder(0));
    g.setNode("b", new NodeLabel().setRank(2).setOrder(0));

    assertThat(LayoutGraphs.buildLayerMatrix(g)).containsExactly(
            List.of("a"), List.of(), List.of("b")).inOrder();
  }

  @Test
  void normalizeRanksShiftsTheSmallestRankToZero() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel().setRank(-3));
    g.setNode("b", new NodeLabel().setRank(-2));
    g.setNode("c", new NodeLabel().setRank(1));

    LayoutGraphs.normalizeRanks(g);

    assertThat(g.node("a").rank()).isEqualTo(0);
    assertThat(g.node("b").rank()).isEqualTo(1);
    assertThat(g.node("c").rank()).isEqualTo(4);
  }

  @Test
  void normalizeRanksIgnoresUnrankedNodes() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel().setRank(3));
    g.setNode("sg");

    LayoutGraphs.normalizeRanks(g);

    assertThat(g.node("a").rank()).isEqualTo(0);
    assertThat(g.node("sg").rank()).isNull();
  }

  @Test
  void removeEmptyRanksClosesGaps() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.graph().setNodeRankFactor(4);
    g.setNode("a", new NodeLabel().setRank(0));
    g.setNode("b", new NodeLabel().setRank(4));
    g.setNode("c", new NodeLabel().setRank(6));

    LayoutGraphs.removeEmptyRanks(g);

    assertThat(g.node("a").rank()).isEqualTo(0);
    assertThat(g.node("b").rank()).isEqualTo(1);
    assertThat(g.node("c").rank()).isEqualTo(2);
  }

  @Test
  void removeEmptyRanksKeepsRanksReservedForBorders() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.graph().setNodeRankFactor(3);
    g.setNode("a", new NodeLabel().setRank(0));
    g.setNode("b", new NodeLabel().setRank(7));

    LayoutGraphs.removeEmptyRanks(g);

    // rank 3 and 6 are multiples of the factor and stay
    assertThat(g.node("b").rank()).isEqualTo(3);
  }

  @Test
  void removeEmptyRanksWithoutAFactorClosesEveryGap() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    g.setNode("a", new NodeLabel().setRank(0));
    g.setNode("b", new NodeLabel().setRank(5));

    LayoutGraphs.removeEmptyRanks(g);

    assertThat(g.node("b").rank()).isEqualTo(1);
  }

  @Test
  void addDummyNodeSkipsTakenIds() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    String first = LayoutGraphs.addDummyNode(g, DummyKind.EDGE, new NodeLabel(), "_d");
    String second = LayoutGraphs.addDummyNode(g, DummyKind.EDGE, new NodeLabel(), "_d");

    assertThat(first).startsWith("_d");
    assertThat(second).isNotEqualTo(first);
    assertThat(g.node(first).dummy()).isEqualTo(DummyKind.EDGE);
  }

  @Test
  void maxRankIgnoresUnrankedNodes() {
    Graph<NodeLabel, EdgeLabel, GraphLabel> g = newGraph();
    assertThat(LayoutGraphs.maxRank(g)).isEqualTo(-1);

    g.setNode("a", new NodeLabel().setRank(1));
    g.setNode("b", new NodeLabel().setRank(4));
    g.setNode("sg");

    assertThat(LayoutGraphs.maxRank(g)).isEqualTo(4);
  }
}
