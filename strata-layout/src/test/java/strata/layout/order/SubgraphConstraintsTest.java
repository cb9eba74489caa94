package strata.layout.order;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphOptions;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;

class SubgraphConstraintsTest {
  private Graph<Void, Void, Void> g;
  private Graph<Void, Void, Void> cg;

  @BeforeEach
  void setUp() {
    g = new Graph<>(GraphOptions.builder().compound(true).build());
    cg = new Graph<>();
  }

  @Test
  void addsNothingForFlatNodes() {
    List<String> vs = ImmutableList.of("a", "b", "c", "d");
    g.setNodes(vs);

    SubgraphConstraints.addSubgraphConstraints(g, cg, vs);

    assertThat(cg.nodeCount()).isEqualTo(0);
    assertThat(cg.edgeCount()).isEqualTo(0);
  }

  @Test
  void addsNothingForAContiguousSubgraph() {
    List<String> vs = ImmutableList.of("a", "b", "c");
    for (String v : vs) {
      g.setParent(v, "sg");
    }

    SubgraphConstraints.addSubgraphConstraints(g, cg, vs);

    assertThat(cg.nodeCount()).isEqualTo(0);
    assertThat(cg.edgeCount()).isEqualTo(0);
  }

  @Test
  void constrainsAdjacentNodesWithDifferentParents() {
    g.setParent("a", "sg1");
    g.setParent("b", "sg2");

    SubgraphConstraints.addSubgraphConstraints(g, cg, ImmutableList.of("a", "b"));

    assertThat(cg.edges()).containsExactly(EdgeKey.of("sg1", "sg2"));
  }

  @Test
  void constrainsSiblingsAtEveryLevel() {
    List<String> vs = ImmutableList.of("a", "b", "c", "d", "e", "f", "g", "h");
    g.setNodes(vs);
    g.setParent("b", "sg2");
    g.setParent("sg2", "sg1");
    g.setParent("c", "sg1");
    g.setParent("d", "sg3");
    g.setParent("sg3", "sg1");
    g.setParent("f", "sg4");
    g.setParent("g", "sg5");
    g.setParent("sg5", "sg4");

    SubgraphConstraints.addSubgraphConstraints(g, cg, vs);

    assertThat(cg.edges()).containsExactly(EdgeKey.of("sg1", "sg4"), EdgeKey.of("sg2", "sg3"));
  }
}
