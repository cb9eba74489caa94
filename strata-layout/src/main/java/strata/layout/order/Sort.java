package strata.layout.order;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class Sort {
  private Sort() {
  }

  /**
   * Sorts entries with a barycenter by that barycenter, breaking ties by original index (reversed when
   * {@code biasRight}). Entries without one are slotted back in at their original index. Only weighted entries
   * contribute to the combined barycenter.
   */
  static SortResult sort(List<ResolvedEntry> entries, boolean biasRight) {
    List<ResolvedEntry> sortable = new ArrayList<>();
    List<ResolvedEntry> unsortable = new ArrayList<>();
    for (ResolvedEntry entry : entries) {
      (entry.hasBarycenter() ? sortable : unsortable).add(entry);
    }
    unsortable.sort(Comparator.comparingInt((ResolvedEntry entry) -> entry.i).reversed());
    insertionSort(sortable, compareWithBias(biasRight));

    List<String> vs = new ArrayList<>();
    double sum = 0;
    double weight = 0;
    int vsIndex = consumeUnsortable(vs, unsortable, 0);
    for (ResolvedEntry entry : sortable) {
      vsIndex += entry.vs.size();
      vs.addAll(entry.vs);
      if (entry.weight != 0) {
        sum += entry.barycenter * entry.weight;
        weight += entry.weight;
      }
      vsIndex = consumeUnsortable(vs, unsortable, vsIndex);
    }

    return weight != 0 ? new SortResult(vs, sum / weight, weight) : new SortResult(vs);
  }

  private static int consumeUnsortable(List<String> vs, List<ResolvedEntry> unsortable, int index) {
    while (!unsortable.isEmpty() && unsortable.get(unsortable.size() - 1).i <= index) {
      vs.addAll(unsortable.remove(unsortable.size() - 1).vs);
      index++;
    }
    return index;
  }

  /**
   * A stable sort that tolerates the NaN barycenters of zero-weight entries, which compare level with everything and
   * so do not form a total order. {@link List#sort} may reject such a comparator.
   */
  private static void insertionSort(List<ResolvedEntry> entries, Comparator<ResolvedEntry> comparator) {
    for (int k = 1; k < entries.size(); k++) {
      ResolvedEntry entry = entries.get(k);
      int j = k - 1;
      while (j >= 0 && comparator.compare(entries.get(j), entry) > 0) {
        entries.set(j + 1, entries.get(j));
        j--;
      }
      entries.set(j + 1, entry);
    }
  }

  private static Comparator<ResolvedEntry> compareWithBias(boolean biasRight) {
    return (v, w) -> {
      if (v.barycenter < w.barycenter) return -1;
      if (v.barycenter > w.barycenter) return 1;
      return biasRight ? Integer.compare(w.i, v.i) : Integer.compare(v.i, w.i);
    };
  }
}
