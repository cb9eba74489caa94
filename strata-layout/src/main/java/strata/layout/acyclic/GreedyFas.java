package strata.layout.acyclic;

import com.google.common.collect.ImmutableList;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.collect.SlotList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * The greedy heuristic of Eades, Lin and Smyth for the weighted feedback arc set problem.
 * <p>
 * Nodes are repeatedly peeled off the graph: sinks first, then sources, and otherwise the node maximizing
 * {@code out-weight - in-weight}, whose remaining in-edges join the feedback set. Nodes wait in buckets keyed by that
 * difference; each bucket is a FIFO {@link SlotList}, so ties resolve in graph order.
 * <p>
 * Weights are rounded to whole numbers. Differences beyond {@value #MAX_BUCKET_SPAN} either way share the outermost
 * interior bucket, which keeps the bucket array small when weights are large.
 */
public final class GreedyFas {
  static final int MAX_BUCKET_SPAN = 1 << 16;

  private GreedyFas() {
  }

  /**
   * Weighs every edge as 1.
   */
  public static List<EdgeKey> feedbackArcSet(Graph<?, ?, ?> g) {
    return feedbackArcSet(g, e -> 1);
  }

  public static List<EdgeKey> feedbackArcSet(Graph<?, ?, ?> g, ToDoubleFunction<EdgeKey> weightFn) {
    if (g.nodeCount() <= 1) return ImmutableList.of();

    State state = new State(g, weightFn);
    List<Integer[]> removed = state.run();

    ImmutableList.Builder<EdgeKey> fas = ImmutableList.builder();
    for (Integer[] pair : removed) {
      fas.addAll(g.outEdges(state.ids.get(pair[0]), state.ids.get(pair[1])));
    }
    return fas.build();
  }

  private static class State {
    final List<String> ids;
    final long[] in;
    final long[] out;
    final boolean[] alive;
    final int[] bucketOf;
    final int[] slotOf;
    final List<List<long[]>> inEdges = new ArrayList<>();
    final List<List<long[]>> outEdges = new ArrayList<>();
    final List<SlotList<Integer>> buckets = new ArrayList<>();
    final long zeroIdx;
    int aliveCount;

    State(Graph<?, ?, ?> g, ToDoubleFunction<EdgeKey> weightFn) {
      ids = g.nodes();
      int n = ids.size();
      Map<String, Integer> index = new LinkedHashMap<>();
      for (int i = 0; i < n; i++) {
        index.put(ids.get(i), i);
        inEdges.add(new ArrayList<>());
        outEdges.add(new ArrayList<>());
      }
      in = new long[n];
      out = new long[n];

      // aggregate parallel edges, keeping the order in which each pair first appears
      Map<List<Integer>, Long> aggregated = new LinkedHashMap<>();
      long maxIn = 0;
      long maxOut = 0;
      for (EdgeKey e : g.edges()) {
        int v = index.get(e.v());
        int w = index.get(e.w());
        long weight = Math.round(weightFn.applyAsDouble(e));
        aggregated.merge(List.of(v, w), weight, Long::sum);
        out[v] += weight;
        maxOut = Math.max(maxOut, out[v]);
        in[w] += weight;
        maxIn = Math.max(maxIn, in[w]);
      }
      aggregated.forEach((pair, weight) -> {
        outEdges.get(pair.get(0)).add(new long[]{pair.get(1), weight});
        inEdges.get(pair.get(1)).add(new long[]{pair.get(0), weight});
      });

      long outSpan = Math.min(maxOut, MAX_BUCKET_SPAN);
      long inSpan = Math.min(maxIn, MAX_BUCKET_SPAN);
      int bucketCount = (int) (outSpan + inSpan + 3);
      for (int i = 0; i < bucketCount; i++) {
        buckets.add(new SlotList<>());
      }
      zeroIdx = inSpan + 1;

      alive = new boolean[n];
      bucketOf = new int[n];
      slotOf = new int[n];
      aliveCount = n;
      for (int v = 0; v < n; v++) {
        alive[v] = true;
        bucketOf[v] = -1;
        assignBucket(v);
      }
    }

    List<Integer[]> run() {
      List<Integer[]> results = new ArrayList<>();
      SlotList<Integer> sinks = buckets.get(0);
      SlotList<Integer> sources = buckets.get(buckets.size() - 1);
      while (aliveCount > 0) {
        Integer v;
        while ((v = sinks.dequeue()) != null) {
          removeNode(v, null);
        }
        while ((v = sources.dequeue()) != null) {
          removeNode(v, null);
        }
        if (aliveCount == 0) break;
        for (int i = buckets.size() - 2; i > 0; i--) {
          v = buckets.get(i).dequeue();
          if (v != null) {
            removeNode(v, results);
            break;
          }
        }
      }
      return results;
    }

    private void removeNode(int v, List<Integer[]> predecessors) {
      alive[v] = false;
      aliveCount--;
      buckets.get(bucketOf[v]).unlink(slotOf[v]);

      for (long[] edge : inEdges.get(v)) {
        int u = (int) edge[0];
        if (!alive[u]) continue;
        if (predecessors != null) predecessors.add(new Integer[]{u, v});
        out[u] -= edge[1];
        assignBucket(u);
      }
      for (long[] edge : outEdges.get(v)) {
        int w = (int) edge[0];
        if (!alive[w]) continue;
        in[w] -= edge[1];
        assignBucket(w);
      }
    }

    private void assignBucket(int v) {
      if (bucketOf[v] >= 0) buckets.get(bucketOf[v]).unlink(slotOf[v]);
      int bucket;
      if (out[v] == 0) {
        bucket = 0;
      } else if (in[v] == 0) {
        bucket = buckets.size() - 1;
      } else {
        // the first and last buckets hold only sinks and sources
        bucket = (int) Math.max(1, Math.min(buckets.size() - 2, out[v] - in[v] + zeroIdx));
      }
      bucketOf[v] = bucket;
      slotOf[v] = buckets.get(bucket).enqueue(v);
    }
  }
}
