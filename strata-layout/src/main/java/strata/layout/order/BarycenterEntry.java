package strata.layout.order;

import javax.annotation.Nullable;

/**
 * A movable node together with the weighted average order of its neighbours in the adjacent layer. Nodes without
 * such neighbours have no barycenter; nodes whose neighbours are joined only by weightless edges have a NaN one.
 */
final class BarycenterEntry {
  final String v;
  @Nullable Double barycenter;
  double weight;

  BarycenterEntry(String v) {
    this.v = v;
  }

  BarycenterEntry(String v, double barycenter, double weight) {
    this.v = v;
    this.barycenter = barycenter;
    this.weight = weight;
  }

  boolean hasBarycenter() {
    return barycenter != null;
  }

  /**
   * Folds a sorted subgraph's barycenter into this entry.
   */
  void merge(SortResult other) {
    if (other.barycenter == null) return;
    if (barycenter != null) {
      barycenter = (barycenter * weight + other.barycenter * other.weight) / (weight + other.weight);
      weight += other.weight;
    } else {
      barycenter = other.barycenter;
      weight = other.weight;
    }
  }

  @Override
  public String toString() {
    return "BarycenterEntry{v=" + v + ", barycenter=" + barycenter + ", weight=" + weight + '}';
  }
}
