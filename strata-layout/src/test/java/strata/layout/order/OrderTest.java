package strata.layout.order;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.google.common.truth.Truth.assertThat;

class OrderTest {
  private Graph<NodeLabel, EdgeLabel, GraphLabel> g;

  @BeforeEach
  void setUp() {
    g = LayoutGraphs.newLayoutGraph();
    g.setGraph(new GraphLabel());
    g.setDefaultEdgeLabel(EdgeLabel::new);
  }

  private void rank(int rank, String... vs) {
    for (String v : vs) {
      g.setNode(v, new NodeLabel().setRank(rank));
    }
  }

  /**
   * Fills {@code g} with a properly layered DAG: every edge joins adjacent ranks.
   */
  private void randomLayeredDag(long seed) {
    Random random = new Random(seed);
    int ranks = 3 + random.nextInt(4);
    List<List<String>> layers = new ArrayList<>();
    for (int r = 0; r < ranks; r++) {
      List<String> layer = new ArrayList<>();
      int width = 2 + random.nextInt(6);
      for (int k = 0; k < width; k++) {
        String v = "r" + r + "n" + k;
        rank(r, v);
        layer.add(v);
      }
      layers.add(layer);
    }
    for (int r = 0; r + 1 < ranks; r++) {
      List<String> south = layers.get(r + 1);
      for (String v : layers.get(r)) {
        int fanOut = 1 + random.nextInt(3);
        for (int k = 0; k < fanOut; k++) {
          g.setEdge(v, south.get(random.nextInt(south.size())));
        }
      }
    }
  }

  private double crossings() {
    return CrossCount.crossCount(g, LayoutGraphs.buildLayerMatrix(g));
  }

  @Test
  void addsNoCrossingsToATree() {
    rank(1, "a");
    rank(2, "b", "e");
    rank(3, "c", "d", "f");
    g.setPath("a", "b", "c");
    g.setEdge("b", "d");
    g.setPath("a", "e", "f");

    Order.order(g);

    assertThat(crossings()).isEqualTo(0.0);
  }

  @Test
  void solvesASimpleGraph() {
    rank(1, "a", "d");
    rank(2, "b", "f", "e");
    rank(3, "c", "g");
    g.setPath("a", "b", "c");
    g.setPath("d", "e", "g");
    g.setEdge("a", "f");

    Order.order(g);

    assertThat(crossings()).isEqualTo(0.0);
  }

  @Test
  void canSkipTheOptimalOrderHeuristic() {
    g.graph().setDisableOptimalOrderHeuristic(true);
    rank(1, "a");
    rank(2, "b", "d");
    rank(3, "c", "e");
    g.setPath("a", "b", "c");
    g.setEdge("a", "d");
    g.setEdge("b", "e");
    g.setEdge("d", "c");

    Order.order(g);

    assertThat(crossings()).isEqualTo(1.0);
  }

  @Test
  void givesEachRankDistinctContiguousOrders() {
    rank(0, "a", "b");
    rank(1, "c", "d", "e");
    g.setEdge("a", "e");
    g.setEdge("b", "c");
    g.setEdge("a", "d");

    Order.order(g);

    for (List<String> layer : LayoutGraphs.buildLayerMatrix(g)) {
      List<Integer> orders = new ArrayList<>();
      for (String v : layer) {
        orders.add(g.node(v).order());
      }
      for (int i = 0; i < orders.size(); i++) {
        assertThat(orders.get(i)).isEqualTo(i);
      }
    }
    assertThat(crossings()).isEqualTo(0.0);
  }

  @Test
  void keepsSubgraphMembersContiguous() {
    rank(0, "a", "b", "c");
    rank(1, "x", "y", "z");
    g.setEdge("a", "z");
    g.setEdge("b", "y");
    g.setEdge("c", "x");
    NodeLabel sg = new NodeLabel().setMinRank(1).setMaxRank(1);
    g.setNode("sg", sg);
    g.setParent("x", "sg");
    g.setParent("z", "sg");

    Order.order(g);

    int x = g.node("x").order();
    int y = g.node("y").order();
    int z = g.node("z").order();
    assertThat(Math.abs(x - z)).isEqualTo(1);
    assertThat(y < Math.min(x, z) || y > Math.max(x, z)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 2, 3, 5, 8, 13, 21, 34})
  void neverEndsWithMoreCrossingsThanTheInitialLayering(long seed) {
    randomLayeredDag(seed);
    double initial = CrossCount.crossCount(g, InitOrder.initOrder(g));

    Order.order(g);

    assertThat(crossings()).isAtMost(initial);
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 2, 3, 5, 8})
  void keepsTheInitialLayeringWhenTheHeuristicIsDisabled(long seed) {
    randomLayeredDag(seed);
    g.graph().setDisableOptimalOrderHeuristic(true);
    List<List<String>> initial = InitOrder.initOrder(g);

    Order.order(g);

    assertThat(LayoutGraphs.buildLayerMatrix(g)).isEqualTo(initial);
    assertThat(crossings()).isEqualTo(CrossCount.crossCount(g, initial));
  }
}
