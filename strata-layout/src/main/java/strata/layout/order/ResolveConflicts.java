package strata.layout.order;

import strata.graph.EdgeKey;
import strata.graph.Graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles barycenter ordering with the "must come before" edges of a constraint graph.
 * <p>
 * The entries are visited in topological order of the constraint graph. Whenever a constrained predecessor would sort
 * at or after its successor, the two are merged into one group whose barycenter is their weighted average, so the
 * later sort can no longer separate them in the wrong order. This is the approach of Forster, "A Fast and Simple
 * Heuristic for Constrained Two-Level Crossing Reduction".
 */
final class ResolveConflicts {
  private ResolveConflicts() {
  }

  static List<ResolvedEntry> resolve(List<BarycenterEntry> entries, Graph<?, ?, ?> cg) {
    Map<String, ResolvedEntry> mapped = new LinkedHashMap<>();
    for (int i = 0; i < entries.size(); i++) {
      BarycenterEntry entry = entries.get(i);
      List<String> vs = new ArrayList<>();
      vs.add(entry.v);
      mapped.put(entry.v, entry.hasBarycenter()
              ? new ResolvedEntry(vs, i, entry.barycenter, entry.weight)
              : new ResolvedEntry(vs, i, null, 0));
    }

    for (EdgeKey e : cg.edges()) {
      ResolvedEntry entryV = mapped.get(e.v());
      ResolvedEntry entryW = mapped.get(e.w());
      if (entryV != null && entryW != null) {
        entryW.indegree++;
        entryV.out.add(entryW);
      }
    }

    List<ResolvedEntry> sourceSet = new ArrayList<>();
    for (ResolvedEntry entry : mapped.values()) {
      if (entry.indegree == 0) sourceSet.add(entry);
    }
    return doResolve(sourceSet);
  }

  private static List<ResolvedEntry> doResolve(List<ResolvedEntry> sourceSet) {
    List<ResolvedEntry> processed = new ArrayList<>();
    while (!sourceSet.isEmpty()) {
      ResolvedEntry entry = sourceSet.remove(sourceSet.size() - 1);
      processed.add(entry);

      for (int k = entry.in.size() - 1; k >= 0; k--) {
        ResolvedEntry u = entry.in.get(k);
        if (u.merged) continue;
        if (u.barycenter == null || entry.barycenter == null || u.barycenter >= entry.barycenter) {
          mergeEntries(entry, u);
        }
      }

      for (ResolvedEntry w : entry.out) {
        w.in.add(entry);
        if (--w.indegree == 0) sourceSet.add(w);
      }
    }

    List<ResolvedEntry> result = new ArrayList<>();
    for (ResolvedEntry entry : processed) {
      if (!entry.merged) result.add(entry);
    }
    return result;
  }

  /**
   * Merges {@code source} into {@code target}, placing source's nodes first. Only weighted members contribute to the
   * merged barycenter; when neither side carries weight, the target keeps its own barycenter.
   */
  private static void mergeEntries(ResolvedEntry target, ResolvedEntry source) {
    double sum = 0;
    double weight = 0;
    if (target.weight != 0 && target.barycenter != null) {
      sum += target.barycenter * target.weight;
      weight += target.weight;
    }
    if (source.weight != 0 && source.barycenter != null) {
      sum += source.barycenter * source.weight;
      weight += source.weight;
    }

    List<String> vs = new ArrayList<>(source.vs);
    vs.addAll(target.vs);
    target.vs = vs;
    if (weight != 0) {
      target.barycenter = sum / weight;
      target.weight = weight;
    }
    target.i = Math.min(source.i, target.i);
    source.merged = true;
  }
}
