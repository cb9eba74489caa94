package strata.layout.order;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The nodes of a (sub)graph in their sorted order, with the barycenter of the group as a whole when one is defined.
 */
final class SortResult {
  final List<String> vs;
  @Nullable Double barycenter;
  double weight;

  SortResult(List<String> vs) {
    this.vs = vs;
  }

  SortResult(List<String> vs, @Nullable Double barycenter, double weight) {
    this.vs = vs;
    this.barycenter = barycenter;
    this.weight = weight;
  }

  @Override
  public String toString() {
    return "SortResult{vs=" + vs + ", barycenter=" + barycenter + ", weight=" + weight + '}';
  }
}
