package strata.layout;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LayoutDefaultsTest {
  private static LayoutDefaults load(String overrides) {
    Config config = ConfigFactory.parseString(overrides).withFallback(ConfigFactory.defaultReference());
    return LayoutDefaults.fromConfig(config);
  }

  @Test
  void readsTheShippedReference() {
    LayoutDefaults defaults = LayoutDefaults.standard();

    assertThat(defaults.rankdir()).isEqualTo(RankDir.TB);
    assertThat(defaults.nodesep()).isEqualTo(50.0);
    assertThat(defaults.edgesep()).isEqualTo(20.0);
    assertThat(defaults.ranksep()).isEqualTo(50.0);
    assertThat(defaults.align().isPresent()).isFalse();
    assertThat(defaults.ranker()).isEqualTo(Ranker.NETWORK_SIMPLEX);
    assertThat(defaults.acyclicer()).isEqualTo(Acyclicer.DFS);
    assertThat(defaults.positioner()).isEqualTo(PositionerKind.BRANDES_KOPF);
    assertThat(defaults.balanceRanks()).isFalse();
    assertThat(defaults.edgeMinlen()).isEqualTo(1);
    assertThat(defaults.edgeWeight()).isEqualTo(1.0);
    assertThat(defaults.edgeLabeloffset()).isEqualTo(10.0);
    assertThat(defaults.edgeLabelpos()).isEqualTo(LabelPos.R);
  }

  @Test
  void overridesFallBackToTheReference() {
    LayoutDefaults defaults = load("strata.layout { nodesep = 10, align = dr, ranker = longest-path, rankdir = lr }");

    assertThat(defaults.nodesep()).isEqualTo(10.0);
    assertThat(defaults.align().orElse(null)).isEqualTo(Alignment.DR);
    assertThat(defaults.ranker()).isEqualTo(Ranker.LONGEST_PATH);
    assertThat(defaults.rankdir()).isEqualTo(RankDir.LR);
    assertThat(defaults.edgesep()).isEqualTo(20.0);
  }

  @Test
  void unknownNamesFallBackToTheDefaultAlgorithms() {
    LayoutDefaults defaults = load("strata.layout { ranker = simulated-annealing, acyclicer = magic, positioner = x }");

    assertThat(defaults.ranker()).isEqualTo(Ranker.NETWORK_SIMPLEX);
    assertThat(defaults.acyclicer()).isEqualTo(Acyclicer.DFS);
    assertThat(defaults.positioner()).isEqualTo(PositionerKind.BRANDES_KOPF);
  }

  @Test
  void rejectsNegativeSeparations() {
    assertThrows(IllegalArgumentException.class, () -> load("strata.layout.nodesep = -1"));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  void rejectsAnEdgeMinlenBelowOne(int minlen) {
    assertThrows(IllegalArgumentException.class, () -> load("strata.layout.edge.minlen = " + minlen));
  }

  @Test
  void acceptsALongerEdgeMinlen() {
    assertThat(load("strata.layout.edge.minlen = 2").edgeMinlen()).isEqualTo(2);
  }

  @Test
  void seedsNewLabels() {
    LayoutDefaults defaults = load("strata.layout { ranksep = 120, positioner = rank-packer }");

    GraphLabel label = new GraphLabel(defaults);

    assertThat(label.ranksep()).isEqualTo(120.0);
    assertThat(label.positioner()).isEqualTo(PositionerKind.RANK_PACKER);
    assertThat(label.align()).isNull();
    assertThat(new EdgeLabel().minlen()).isEqualTo(1);
    assertThat(new EdgeLabel().weight()).isEqualTo(1.0);
  }
}
