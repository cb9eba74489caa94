package strata.layout.order;

import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.EdgeLabel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts weighted edge crossings in a layering, using the accumulator tree of Barth, Jünger and Mutzel, "Simple and
 * Efficient Bilayer Cross Counting". Two crossing edges contribute the product of their weights.
 */
public final class CrossCount {
  private CrossCount() {
  }

  public static double crossCount(Graph<?, EdgeLabel, ?> g, List<List<String>> layering) {
    double cc = 0;
    for (int i = 1; i < layering.size(); i++) {
      cc += twoLayerCrossCount(g, layering.get(i - 1), layering.get(i));
    }
    return cc;
  }

  private static double twoLayerCrossCount(Graph<?, EdgeLabel, ?> g, List<String> northLayer,
                                           List<String> southLayer) {
    Map<String, Integer> southPos = new HashMap<>();
    for (int i = 0; i < southLayer.size(); i++) {
      southPos.put(southLayer.get(i), i);
    }

    List<Integer> positions = new ArrayList<>();
    List<Double> weights = new ArrayList<>();
    for (String v : northLayer) {
      List<Map.Entry<Integer, Double>> southEntries = new ArrayList<>();
      for (EdgeKey e : g.outEdges(v)) {
        Integer pos = southPos.get(e.w());
        if (pos != null) southEntries.add(Map.entry(pos, g.edge(e).weight()));
      }
      southEntries.sort(Map.Entry.comparingByKey());
      for (Map.Entry<Integer, Double> entry : southEntries) {
        positions.add(entry.getKey());
        weights.add(entry.getValue());
      }
    }

    int firstIndex = 1;
    while (firstIndex < southLayer.size()) {
      firstIndex <<= 1;
    }
    double[] tree = new double[2 * firstIndex - 1];
    firstIndex -= 1;

    double cc = 0;
    for (int k = 0; k < positions.size(); k++) {
      double weight = weights.get(k);
      int index = positions.get(k) + firstIndex;
      tree[index] += weight;
      double weightSum = 0;
      while (index > 0) {
        if (index % 2 == 1) weightSum += tree[index + 1];
        index = (index - 1) >> 1;
        tree[index] += weight;
      }
      cc += weight * weightSum;
    }
    return cc;
  }
}
