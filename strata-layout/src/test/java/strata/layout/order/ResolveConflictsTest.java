package strata.layout.order;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import strata.graph.Graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;

class ResolveConflictsTest {
  private Graph<Void, Void, Void> cg;

  @BeforeEach
  void setUp() {
    cg = new Graph<>();
  }

  private static BarycenterEntry entry(String v, double barycenter, double weight) {
    return new BarycenterEntry(v, barycenter, weight);
  }

  private static List<ResolvedEntry> sortedByFirstNode(List<ResolvedEntry> entries) {
    List<ResolvedEntry> sorted = new ArrayList<>(entries);
    sorted.sort(Comparator.comparing(e -> e.vs.get(0)));
    return sorted;
  }

  private static void assertEntry(ResolvedEntry actual, List<String> vs, int i, Double barycenter, double weight) {
    assertThat(actual.vs).containsExactlyElementsIn(vs).inOrder();
    assertThat(actual.i).isEqualTo(i);
    assertThat(actual.barycenter).isEqualTo(barycenter);
    assertThat(actual.weight).isEqualTo(weight);
  }

  @Test
  void returnsNodesUnchangedWithoutConstraints() {
    List<ResolvedEntry> results = sortedByFirstNode(ResolveConflicts.resolve(
            ImmutableList.of(entry("a", 2, 3), entry("b", 1, 2)), cg));

    assertThat(results).hasSize(2);
    assertEntry(results.get(0), List.of("a"), 0, 2.0, 3);
    assertEntry(results.get(1), List.of("b"), 1, 1.0, 2);
  }

  @Test
  void returnsNodesUnchangedWhenConstraintsAreSatisfied() {
    cg.setEdge("b", "a");

    List<ResolvedEntry> results = sortedByFirstNode(ResolveConflicts.resolve(
            ImmutableList.of(entry("a", 2, 3), entry("b", 1, 2)), cg));

    assertThat(results).hasSize(2);
    assertEntry(results.get(0), List.of("a"), 0, 2.0, 3);
    assertEntry(results.get(1), List.of("b"), 1, 1.0, 2);
  }

  @Test
  void coalescesNodesInConflict() {
    cg.setEdge("a", "b");

    List<ResolvedEntry> results = ResolveConflicts.resolve(
            ImmutableList.of(entry("a", 2, 3), entry("b", 1, 2)), cg);

    assertThat(results).hasSize(1);
    assertEntry(results.get(0), List.of("a", "b"), 0, (3.0 * 2 + 2.0 * 1) / (3 + 2), 3 + 2);
  }

  @Test
  void coalescesAChainOfConflicts() {
    cg.setPath("a", "b", "c", "d");

    List<ResolvedEntry> results = ResolveConflicts.resolve(ImmutableList.of(
            entry("a", 4, 1), entry("b", 3, 1), entry("c", 2, 1), entry("d", 1, 1)), cg);

    assertThat(results).hasSize(1);
    assertEntry(results.get(0), List.of("a", "b", "c", "d"), 0, (4.0 + 3 + 2 + 1) / 4, 4);
  }

  @Test
  void mergesSeveralConstraintsOnTheSameTarget() {
    cg.setEdge("a", "c");
    cg.setEdge("b", "c");

    List<ResolvedEntry> results = ResolveConflicts.resolve(ImmutableList.of(
            entry("a", 4, 1), entry("b", 3, 1), entry("c", 2, 1)), cg);

    assertThat(results).hasSize(1);
    ResolvedEntry merged = results.get(0);
    assertThat(merged.vs.indexOf("c")).isGreaterThan(merged.vs.indexOf("a"));
    assertThat(merged.vs.indexOf("c")).isGreaterThan(merged.vs.indexOf("b"));
    assertThat(merged.i).isEqualTo(0);
    assertThat(merged.barycenter).isEqualTo((4.0 + 3 + 2) / 3);
    assertThat(merged.weight).isEqualTo(3.0);
  }

  @Test
  void mergesOverlappingConstraintChains() {
    cg.setEdge("a", "c");
    cg.setEdge("a", "d");
    cg.setEdge("b", "c");
    cg.setEdge("c", "d");

    List<ResolvedEntry> results = ResolveConflicts.resolve(ImmutableList.of(
            entry("a", 4, 1), entry("b", 3, 1), entry("c", 2, 1), entry("d", 1, 1)), cg);

    assertThat(results).hasSize(1);
    ResolvedEntry merged = results.get(0);
    assertThat(merged.vs.indexOf("c")).isGreaterThan(merged.vs.indexOf("a"));
    assertThat(merged.vs.indexOf("c")).isGreaterThan(merged.vs.indexOf("b"));
    assertThat(merged.vs.indexOf("d")).isGreaterThan(merged.vs.indexOf("c"));
    assertThat(merged.i).isEqualTo(0);
    assertThat(merged.barycenter).isEqualTo((4.0 + 3 + 2 + 1) / 4);
    assertThat(merged.weight).isEqualTo(4.0);
  }

  @Test
  void leavesAnUnconstrainedNodeWithoutBarycenterAlone() {
    List<ResolvedEntry> results = sortedByFirstNode(ResolveConflicts.resolve(
            ImmutableList.of(new BarycenterEntry("a"), entry("b", 1, 2)), cg));

    assertThat(results).hasSize(2);
    assertEntry(results.get(0), List.of("a"), 0, null, 0);
    assertEntry(results.get(1), List.of("b"), 1, 1.0, 2);
  }

  @Test
  void treatsAMissingBarycenterAsViolatingAnOutgoingConstraint() {
    cg.setEdge("a", "b");

    List<ResolvedEntry> results = ResolveConflicts.resolve(
            ImmutableList.of(new BarycenterEntry("a"), entry("b", 1, 2)), cg);

    assertThat(results).hasSize(1);
    assertEntry(results.get(0), List.of("a", "b"), 0, 1.0, 2);
  }

  @Test
  void treatsAMissingBarycenterAsViolatingAnIncomingConstraint() {
    cg.setEdge("b", "a");

    List<ResolvedEntry> results = ResolveConflicts.resolve(
            ImmutableList.of(new BarycenterEntry("a"), entry("b", 1, 2)), cg);

    assertThat(results).hasSize(1);
    assertEntry(results.get(0), List.of("b", "a"), 0, 1.0, 2);
  }

  @Test
  void ignoresConstraintsOnOtherNodes() {
    cg.setEdge("c", "d");

    List<ResolvedEntry> results = sortedByFirstNode(ResolveConflicts.resolve(
            ImmutableList.of(entry("a", 2, 3), entry("b", 1, 2)), cg));

    assertThat(results).hasSize(2);
    assertEntry(results.get(0), List.of("a"), 0, 2.0, 3);
    assertEntry(results.get(1), List.of("b"), 1, 1.0, 2);
  }

  @Test
  void keepsTheTargetsBarycenterWhenMergingWithoutWeight() {
    cg.setEdge("a", "b");

    List<ResolvedEntry> results = ResolveConflicts.resolve(
            ImmutableList.of(new BarycenterEntry("a"), entry("b", 3, 0)), cg);

    assertThat(results).hasSize(1);
    assertEntry(results.get(0), List.of("a", "b"), 0, 3.0, 0);
  }

  @Test
  void neverMergesAcrossANanBarycenter() {
    cg.setEdge("a", "b");

    List<ResolvedEntry> results = sortedByFirstNode(ResolveConflicts.resolve(
            ImmutableList.of(entry("a", Double.NaN, 0), entry("b", 1, 2)), cg));

    assertThat(results).hasSize(2);
    assertThat(results.get(0).barycenter).isNaN();
    assertEntry(results.get(1), List.of("b"), 1, 1.0, 2);
  }
}
