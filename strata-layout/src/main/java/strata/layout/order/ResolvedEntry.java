package strata.layout.order;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * A group of nodes that must stay together, in order, while sorting. {@code i} is the smallest original index of
 * the group's members and breaks ties between equal barycenters.
 */
final class ResolvedEntry {
  List<String> vs;
  int i;
  @Nullable Double barycenter;
  double weight;

  // conflict-resolution state
  int indegree;
  final List<ResolvedEntry> in = new ArrayList<>();
  final List<ResolvedEntry> out = new ArrayList<>();
  boolean merged;

  ResolvedEntry(List<String> vs, int i, @Nullable Double barycenter, double weight) {
    this.vs = vs;
    this.i = i;
    this.barycenter = barycenter;
    this.weight = weight;
  }

  boolean hasBarycenter() {
    return barycenter != null;
  }

  @Override
  public String toString() {
    return "ResolvedEntry{vs=" + vs + ", i=" + i + ", barycenter=" + barycenter + ", weight=" + weight + '}';
  }
}
