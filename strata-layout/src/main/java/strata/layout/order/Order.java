package strata.layout.order;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.Graph;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns every ranked leaf node an {@code order} within its rank so as to reduce edge crossings.
 * <p>
 * Starting from a depth-first layering, the pass alternates downward and upward barycenter sweeps, each time sorting
 * every rank by the positions of its neighbours in the rank just swept, with subgraphs kept contiguous. After four
 * sweeps in a row without improvement the best layering seen is kept, and a final transpose pass swaps adjacent
 * nodes while that still removes crossings.
 * <p>
 * With {@link GraphLabel#disableOptimalOrderHeuristic()} set, only the initial layering is applied.
 */
public final class Order {
  private static final Logger LOG = LoggerFactory.getLogger(Order.class);

  private Order() {
  }

  public static void order(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    int maxRank = LayoutGraphs.maxRank(g);
    List<Graph<NodeLabel, EdgeLabel, GraphLabel>> downLayerGraphs =
            LayerGraphs.buildLayerGraphs(g, range(1, maxRank), LayerGraphs.Relationship.IN_EDGES);
    List<Graph<NodeLabel, EdgeLabel, GraphLabel>> upLayerGraphs =
            LayerGraphs.buildLayerGraphs(g, reversedRange(0, maxRank - 1), LayerGraphs.Relationship.OUT_EDGES);

    List<List<String>> layering = InitOrder.initOrder(g);
    assignOrder(g, layering);

    if (g.graph() != null && g.graph().disableOptimalOrderHeuristic()) return;

    List<List<String>> best = layering;
    double bestCC = CrossCount.crossCount(g, LayoutGraphs.buildLayerMatrix(g));
    for (int i = 0, lastBest = 0; lastBest < 4; ++i, ++lastBest) {
      sweepLayerGraphs(i % 2 == 1 ? downLayerGraphs : upLayerGraphs, i % 4 >= 2);

      layering = LayoutGraphs.buildLayerMatrix(g);
      double cc = CrossCount.crossCount(g, layering);
      if (cc < bestCC) {
        lastBest = 0;
        best = layering;
        bestCC = cc;
      }
    }
    assignOrder(g, best);

    int swaps = Transpose.transpose(g);
    LOG.debug("Ordering kept a layering with {} crossings before {} transpositions", bestCC, swaps);
  }

  private static void sweepLayerGraphs(List<Graph<NodeLabel, EdgeLabel, GraphLabel>> layerGraphs, boolean biasRight) {
    Graph<Void, Void, Void> cg = new Graph<>();
    for (Graph<NodeLabel, EdgeLabel, GraphLabel> lg : layerGraphs) {
      String root = lg.graph().layerRoot();
      SortResult sorted = SortSubgraph.sortSubgraph(lg, root, cg, biasRight);
      for (int i = 0; i < sorted.vs.size(); i++) {
        lg.node(sorted.vs.get(i)).setOrder(i);
      }
      SubgraphConstraints.addSubgraphConstraints(lg, cg, sorted.vs);
    }
  }

  static void assignOrder(Graph<NodeLabel, ?, ?> g, List<List<String>> layering) {
    for (List<String> layer : layering) {
      for (int i = 0; i < layer.size(); i++) {
        g.node(layer.get(i)).setOrder(i);
      }
    }
  }

  private static List<Integer> range(int from, int to) {
    List<Integer> ranks = new ArrayList<>();
    for (int r = from; r <= to; r++) {
      ranks.add(r);
    }
    return ranks;
  }

  private static List<Integer> reversedRange(int from, int to) {
    List<Integer> ranks = new ArrayList<>();
    for (int r = to; r >= from; r--) {
      ranks.add(r);
    }
    return ranks;
  }
}
