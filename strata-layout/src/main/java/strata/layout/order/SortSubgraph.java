package strata.layout.order;

import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class SortSubgraph {
  private SortSubgraph() {
  }

  /**
   * Orders the children of {@code v} in layer graph {@code g}, recursing into nested subgraphs first so that each
   * subgraph is sorted as one unit carrying the barycenter of its members. A subgraph's border nodes are pinned to
   * its two ends.
   */
  static SortResult sortSubgraph(Graph<NodeLabel, EdgeLabel, ?> g, String v, Graph<?, ?, ?> cg, boolean biasRight) {
    NodeLabel node = g.node(v);
    String bl = node == null ? null : first(node.borderLeft());
    String br = node == null ? null : first(node.borderRight());

    List<String> movable = new ArrayList<>();
    for (String w : g.children(v)) {
      if (bl == null || (!w.equals(bl) && !w.equals(br))) movable.add(w);
    }

    Map<String, SortResult> subgraphs = new HashMap<>();
    List<BarycenterEntry> barycenters = Barycenter.barycenter(g, movable);
    for (BarycenterEntry entry : barycenters) {
      if (!g.children(entry.v).isEmpty()) {
        SortResult subgraphResult = sortSubgraph(g, entry.v, cg, biasRight);
        subgraphs.put(entry.v, subgraphResult);
        entry.merge(subgraphResult);
      }
    }

    List<ResolvedEntry> entries = ResolveConflicts.resolve(barycenters, cg);
    expandSubgraphs(entries, subgraphs);
    SortResult result = Sort.sort(entries, biasRight);

    if (bl == null) return result;

    List<String> vs = new ArrayList<>(result.vs.size() + 2);
    vs.add(bl);
    vs.addAll(result.vs);
    vs.add(br);
    SortResult bordered = new SortResult(vs, result.barycenter, result.weight);

    List<String> blPreds = g.predecessors(bl);
    List<String> brPreds = g.predecessors(br);
    if (!blPreds.isEmpty() && !brPreds.isEmpty()) {
      double barycenter = bordered.barycenter == null ? 0 : bordered.barycenter;
      double weight = bordered.barycenter == null ? 0 : bordered.weight;
      double blOrder = LayoutGraphs.orderOf(g.node(blPreds.get(0)));
      double brOrder = LayoutGraphs.orderOf(g.node(brPreds.get(0)));
      bordered.barycenter = (barycenter * weight + blOrder + brOrder) / (weight + 2);
      bordered.weight = weight + 2;
    }
    return bordered;
  }

  private static void expandSubgraphs(List<ResolvedEntry> entries, Map<String, SortResult> subgraphs) {
    for (ResolvedEntry entry : entries) {
      List<String> expanded = new ArrayList<>();
      for (String v : entry.vs) {
        SortResult subgraph = subgraphs.get(v);
        if (subgraph != null) {
          expanded.addAll(subgraph.vs);
        } else {
          expanded.add(v);
        }
      }
      entry.vs = expanded;
    }
  }

  @Nullable
  private static String first(List<String> borders) {
    return borders.isEmpty() ? null : borders.get(0);
  }
}
