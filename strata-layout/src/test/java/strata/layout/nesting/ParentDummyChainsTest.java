package strata.layout.nesting;

import org.junit.jupiter.api.Test;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphOptions;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;

class ParentDummyChainsTest {
  private final Graph<NodeLabel, EdgeLabel, GraphLabel> g = new Graph<NodeLabel, EdgeLabel, GraphLabel>(
          GraphOptions.builder().compound(true).build())
          .setGraph(new GraphLabel())
          .setDefaultNodeLabel(v -> new NodeLabel())
          .setDefaultEdgeLabel(EdgeLabel::new);

  private void subgraph(String v, int minRank, int maxRank) {
    g.setNode(v, new NodeLabel().setMinRank(minRank).setMaxRank(maxRank));
  }

  /**
   * Adds a chain of dummies from a to b, the first at {@code firstRank}.
   */
  private void chain(int firstRank, int length) {
    List<String> path = new ArrayList<>();
    path.add("a");
    for (int i = 1; i <= length; i++) {
      g.setNode("d" + i, new NodeLabel().setRank(firstRank + i - 1));
      path.add("d" + i);
    }
    path.add("b");
    g.node("d1").setEdgeObj(EdgeKey.of("a", "b"));
    g.graph().dummyChains().add("d1");
    g.setPath(path.toArray(new String[0]));
  }

  @Test
  void leavesTheChainAtTheRootWhenNeitherEndHasAParent() {
    g.setNode("a");
    g.setNode("b");
    chain(1, 1);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isNull();
  }

  @Test
  void usesTheTailsParentForTheFirstNode() {
    g.setParent("a", "sg1");
    subgraph("sg1", 0, 2);
    chain(2, 1);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg1");
  }

  @Test
  void usesTheHeadsParentForTheFirstNodeWhenTheTailIsAtTheRoot() {
    g.setParent("b", "sg1");
    subgraph("sg1", 1, 3);
    chain(1, 1);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg1");
  }

  @Test
  void handlesALongChainStartingInASubgraph() {
    g.setParent("a", "sg1");
    subgraph("sg1", 0, 2);
    chain(2, 3);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg1");
    assertThat(g.parent("d2")).isNull();
    assertThat(g.parent("d3")).isNull();
  }

  @Test
  void handlesALongChainEndingInASubgraph() {
    g.setParent("b", "sg1");
    subgraph("sg1", 3, 5);
    chain(1, 3);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isNull();
    assertThat(g.parent("d2")).isNull();
    assertThat(g.parent("d3")).isEqualTo("sg1");
  }

  @Test
  void handlesNestedSubgraphs() {
    g.setParent("a", "sg2");
    g.setParent("sg2", "sg1");
    subgraph("sg1", 0, 4);
    subgraph("sg2", 1, 3);
    g.setParent("b", "sg4");
    g.setParent("sg4", "sg3");
    subgraph("sg3", 6, 10);
    subgraph("sg4", 7, 9);
    chain(3, 5);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg2");
    assertThat(g.parent("d2")).isEqualTo("sg1");
    assertThat(g.parent("d3")).isNull();
    assertThat(g.parent("d4")).isEqualTo("sg3");
    assertThat(g.parent("d5")).isEqualTo("sg4");
  }

  @Test
  void handlesOverlappingRankRanges() {
    g.setParent("a", "sg1");
    subgraph("sg1", 0, 3);
    g.setParent("b", "sg2");
    subgraph("sg2", 2, 6);
    chain(2, 3);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg1");
    assertThat(g.parent("d2")).isEqualTo("sg1");
    assertThat(g.parent("d3")).isEqualTo("sg2");
  }

  @Test
  void handlesACommonAncestorAboveTheHead() {
    g.setParent("a", "sg1");
    g.setParent("sg2", "sg1");
    subgraph("sg1", 0, 6);
    g.setParent("b", "sg2");
    subgraph("sg2", 3, 5);
    chain(2, 2);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg1");
    assertThat(g.parent("d2")).isEqualTo("sg2");
  }

  @Test
  void handlesACommonAncestorAboveTheTail() {
    g.setParent("a", "sg2");
    g.setParent("sg2", "sg1");
    subgraph("sg1", 0, 6);
    g.setParent("b", "sg1");
    subgraph("sg2", 1, 3);
    chain(3, 2);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isEqualTo("sg2");
    assertThat(g.parent("d2")).isEqualTo("sg1");
  }

  @Test
  void descendsThroughNestedSubgraphsFromTheRoot() {
    g.setNode("a");
    g.setParent("sg2", "sg1");
    g.setParent("b", "sg2");
    subgraph("sg1", 3, 8);
    subgraph("sg2", 5, 7);
    chain(1, 5);

    ParentDummyChains.run(g);

    assertThat(g.parent("d1")).isNull();
    assertThat(g.parent("d2")).isNull();
    assertThat(g.parent("d3")).isEqualTo("sg1");
    assertThat(g.parent("d4")).isEqualTo("sg1");
    assertThat(g.parent("d5")).isEqualTo("sg2");
  }
}
