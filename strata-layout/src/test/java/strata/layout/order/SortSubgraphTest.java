package strata.layout.order;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import strata.graph.Graph;
import strata.graph.GraphOptions;
import strata.layout.EdgeLabel;
import strata.layout.NodeLabel;

import static com.google.common.truth.Truth.assertThat;

class SortSubgraphTest {
  private Graph<NodeLabel, EdgeLabel, Void> g;
  private Graph<Void, Void, Void> cg;

  @BeforeEach
  void setUp() {
    g = new Graph<>(GraphOptions.builder().compound(true).build());
    g.setDefaultNodeLabel(v -> new NodeLabel());
    g.setDefaultEdgeLabel(EdgeLabel::new);
    cg = new Graph<>();
  }

  private void seedFixedLayer() {
    for (int i = 0; i <= 4; i++) {
      g.setNode(String.valueOf(i), new NodeLabel().setOrder(i));
    }
  }

  private void nest(String parent, String... vs) {
    for (String v : vs) {
      g.setParent(v, parent);
    }
  }

  @Test
  void sortsAFlatSubgraphByBarycenter() {
    seedFixedLayer();
    g.setEdge("3", "x");
    g.setEdge("1", "y", new EdgeLabel(1, 2));
    g.setEdge("4", "y");
    nest("movable", "x", "y");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs).containsExactly("y", "x").inOrder();
  }

  @Test
  void keepsTheSlotOfANodeWithoutNeighbours() {
    seedFixedLayer();
    g.setEdge("3", "x");
    g.setNode("y");
    g.setEdge("1", "z", new EdgeLabel(1, 2));
    g.setEdge("4", "z");
    nest("movable", "x", "y", "z");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs).containsExactly("z", "y", "x").inOrder();
  }

  @Test
  void breaksTiesToTheLeftUnlessBiasedRight() {
    seedFixedLayer();
    g.setEdge("1", "x");
    g.setEdge("1", "y");
    nest("movable", "x", "y");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs).containsExactly("x", "y").inOrder();
    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, true).vs).containsExactly("y", "x").inOrder();
  }

  @Test
  void aggregatesTheBarycenterOfTheSubgraph() {
    seedFixedLayer();
    g.setEdge("3", "x");
    g.setEdge("1", "y", new EdgeLabel(1, 2));
    g.setEdge("4", "y");
    nest("movable", "x", "y");

    SortResult result = SortSubgraph.sortSubgraph(g, "movable", cg, false);

    assertThat(result.barycenter).isEqualTo(2.25);
    assertThat(result.weight).isEqualTo(4.0);
  }

  @Test
  void sortsANestedSubgraphWhoseMembersHaveNoBarycenter() {
    seedFixedLayer();
    nest("y", "a", "b", "c");
    g.setEdge("0", "x");
    g.setEdge("1", "z");
    g.setEdge("2", "y");
    nest("movable", "x", "y", "z");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs)
            .containsExactly("x", "z", "a", "b", "c").inOrder();
  }

  @Test
  void sortsANestedSubgraphByItsMembersBarycenter() {
    seedFixedLayer();
    nest("y", "a", "b", "c");
    g.setEdge("0", "a", new EdgeLabel(1, 3));
    g.setEdge("0", "x");
    g.setEdge("1", "z");
    g.setEdge("2", "y");
    nest("movable", "x", "y", "z");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs)
            .containsExactly("x", "a", "b", "c", "z").inOrder();
  }

  @Test
  void sortsANestedSubgraphWithoutInEdgesOfItsOwn() {
    seedFixedLayer();
    nest("y", "a", "b", "c");
    g.setEdge("0", "a");
    g.setEdge("1", "b");
    g.setEdge("0", "x");
    g.setEdge("1", "z");
    nest("movable", "x", "y", "z");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs)
            .containsExactly("x", "a", "b", "c", "z").inOrder();
  }

  @Test
  void pinsBorderNodesToTheEnds() {
    seedFixedLayer();
    g.setEdge("0", "x");
    g.setEdge("1", "y");
    g.setEdge("2", "z");
    NodeLabel sg = new NodeLabel();
    sg.borderLeft().add("bl");
    sg.borderRight().add("br");
    g.setNode("sg1", sg);
    nest("sg1", "x", "y", "z", "bl", "br");

    assertThat(SortSubgraph.sortSubgraph(g, "sg1", cg, false).vs)
            .containsExactly("bl", "x", "y", "z", "br").inOrder();
  }

  @Test
  void derivesASubgraphBarycenterFromTheBordersAbove() {
    g.setNode("bl1", new NodeLabel().setOrder(0));
    g.setNode("br1", new NodeLabel().setOrder(1));
    g.setEdge("bl1", "bl2");
    g.setEdge("br1", "br2");
    nest("sg", "bl2", "br2");
    NodeLabel sg = new NodeLabel();
    sg.borderLeft().add("bl2");
    sg.borderRight().add("br2");
    g.setNode("sg", sg);

    SortResult result = SortSubgraph.sortSubgraph(g, "sg", cg, false);

    assertThat(result.vs).containsExactly("bl2", "br2").inOrder();
    assertThat(result.barycenter).isEqualTo(0.5);
    assertThat(result.weight).isEqualTo(2.0);
  }

  @Test
  void honoursConstraintsBetweenSiblingSubgraphs() {
    seedFixedLayer();
    g.setEdge("3", "a");
    g.setEdge("0", "b");
    nest("sgA", "a");
    nest("sgB", "b");
    nest("movable", "sgA", "sgB");
    cg.setEdge("sgA", "sgB");

    assertThat(SortSubgraph.sortSubgraph(g, "movable", cg, false).vs).containsExactly("a", "b").inOrder();
  }
}
