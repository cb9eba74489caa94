package strata.layout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import strata.graph.EdgeKey;
import strata.graph.Graph;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.truth.Truth.assertThat;

class SelfEdgesTest {
  private Graph<NodeLabel, EdgeLabel, GraphLabel> g;

  @BeforeEach
  void setUp() {
    g = LayoutGraphs.newLayoutGraph();
    g.setGraph(new GraphLabel());
  }

  private List<String> selfEdgeDummies() {
    return g.nodes().stream()
            .filter(v -> g.node(v).dummy() == DummyKind.SELF_EDGE)
            .collect(Collectors.toList());
  }

  @Test
  void detachesSelfLoopsOntoTheirNode() {
    g.setNode("a", new NodeLabel());
    g.setNode("b", new NodeLabel());
    EdgeLabel loop = new EdgeLabel();
    g.setEdge("a", "a", loop);
    g.setEdge("a", "b", new EdgeLabel());

    SelfEdges.remove(g);

    assertThat(g.edges()).containsExactly(EdgeKey.of("a", "b"));
    assertThat(g.node("a").selfEdges()).hasSize(1);
    assertThat(g.node("a").selfEdges().get(0).label()).isSameInstanceAs(loop);
    assertThat(g.node("b").selfEdges()).isEmpty();
  }

  @Test
  void reservesASlotBesideTheNodeForEachLoop() {
    g.setNode("a", new NodeLabel().setRank(0).setOrder(0));
    g.setNode("b", new NodeLabel().setRank(0).setOrder(1));
    g.setEdge("a", "a", new EdgeLabel().setWidth(10).setHeight(20));
    SelfEdges.remove(g);

    SelfEdges.insert(g);

    List<String> dummies = selfEdgeDummies();
    assertThat(dummies).hasSize(1);
    NodeLabel dummy = g.node(dummies.get(0));
    assertThat(dummy.rank()).isEqualTo(0);
    assertThat(dummy.order()).isEqualTo(1);
    assertThat(dummy.width()).isEqualTo(10.0);
    assertThat(dummy.height()).isEqualTo(20.0);
    assertThat(g.node("a").order()).isEqualTo(0);
    assertThat(g.node("b").order()).isEqualTo(2);
    assertThat(g.node("a").selfEdges()).isEmpty();
  }

  @Test
  void restoresTheLoopAsACurveOnTheRightOfItsNode() {
    g.setNode("a", new NodeLabel(40, 20).setRank(0).setOrder(0));
    EdgeLabel loop = new EdgeLabel();
    g.setEdge("a", "a", loop);
    SelfEdges.remove(g);
    SelfEdges.insert(g);
    g.node("a").setPosition(100, 50);
    g.node(selfEdgeDummies().get(0)).setPosition(150, 50);

    SelfEdges.position(g);

    assertThat(selfEdgeDummies()).isEmpty();
    assertThat(g.edge("a", "a")).isSameInstanceAs(loop);
    assertThat(loop.points()).containsExactly(
            Point.of(140, 40),
            Point.of(145, 40),
            Point.of(150, 50),
            Point.of(145, 60),
            Point.of(140, 60)).inOrder();
    assertThat(loop.x()).isEqualTo(150.0);
    assertThat(loop.y()).isEqualTo(50.0);
  }
}
