package strata.layout;

import com.google.common.collect.ImmutableList;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.graph.GraphOptions;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Helpers shared by the layout passes.
 */
public final class LayoutGraphs {
  private static final AtomicLong ID_COUNTER = new AtomicLong();

  private LayoutGraphs() {
  }

  /**
   * @return the compound multigraph the layout pipeline runs on
   */
  public static Graph<NodeLabel, EdgeLabel, GraphLabel> newLayoutGraph() {
    return new Graph<>(GraphOptions.builder().multigraph(true).compound(true).build());
  }

  public static String uniqueId(String prefix) {
    return prefix + ID_COUNTER.incrementAndGet();
  }

  /**
   * Adds {@code label} under a fresh id starting with {@code prefix}, tagging it as a dummy of the given kind.
   *
   * @return the new node's id
   */
  public static String addDummyNode(Graph<NodeLabel, ?, ?> g, DummyKind kind, NodeLabel label, String prefix) {
    String v;
    do {
      v = uniqueId(prefix);
    } while (g.hasNode(v));
    label.setDummy(kind);
    g.setNode(v, label);
    return v;
  }

  public static String addBorderNode(Graph<NodeLabel, ?, ?> g, String prefix) {
    return addDummyNode(g, DummyKind.BORDER, new NodeLabel(0, 0), prefix);
  }

  public static String addBorderNode(Graph<NodeLabel, ?, ?> g, String prefix, int rank, int order) {
    return addDummyNode(g, DummyKind.BORDER, new NodeLabel(0, 0).setRank(rank).setOrder(order), prefix);
  }

  /**
   * Collapses parallel edges into one edge per ordered pair whose weight is the sum of theirs and whose minlen is
   * the largest of theirs. Node labels are shared with {@code g}.
   */
  public static Graph<NodeLabel, EdgeLabel, GraphLabel> simplify(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Graph<NodeLabel, EdgeLabel, GraphLabel> simplified = new Graph<>();
    simplified.setGraph(g.graph());
    for (String v : g.nodes()) {
      simplified.setNode(v, g.node(v));
    }
    for (EdgeKey e : g.edges()) {
      EdgeLabel label = g.edge(e);
      EdgeLabel simple = simplified.edge(e.v(), e.w());
      double weight = simple == null ? 0 : simple.weight();
      int minlen = simple == null ? 1 : simple.minlen();
      simplified.setEdge(e.v(), e.w(), new EdgeLabel(Math.max(minlen, label.minlen()), weight + label.weight()));
    }
    return simplified;
  }

  /**
   * @return a view of {@code g} without subgraph nodes, sharing node and edge labels with {@code g}
   */
  public static Graph<NodeLabel, EdgeLabel, GraphLabel> asNonCompoundGraph(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Graph<NodeLabel, EdgeLabel, GraphLabel> simplified =
            new Graph<>(GraphOptions.builder().multigraph(g.isMultigraph()).build());
    simplified.setGraph(g.graph());
    for (String v : g.nodes()) {
      if (g.children(v).isEmpty()) simplified.setNode(v, g.node(v));
    }
    for (EdgeKey e : g.edges()) {
      simplified.setEdge(e, g.edge(e));
    }
    return simplified;
  }

  /**
   * Finds where the segment from the center of {@code rect} toward {@code point} leaves the rectangle.
   * A point at the center itself yields the middle of the rectangle's right side.
   */
  public static Point intersectRect(NodeLabel rect, Point point) {
    double x = rect.x();
    double y = rect.y();
    double dx = point.x() - x;
    double dy = point.y() - y;
    double w = rect.width() / 2;
    double h = rect.height() / 2;

    if (dx == 0 && dy == 0) return Point.of(x + w, y);

    double sx;
    double sy;
    if (Math.abs(dy) * w > Math.abs(dx) * h) {
      if (dy < 0) h = -h;
      sx = h * dx / dy;
      sy = h;
    } else {
      if (dx < 0) w = -w;
      sx = w;
      sy = w * dy / dx;
    }
    return Point.of(x + sx, y + sy);
  }

  /**
   * @return the ranked nodes of {@code g}, one list per rank, each sorted by order
   */
  public static List<List<String>> buildLayerMatrix(Graph<NodeLabel, ?, ?> g) {
    TreeMap<Integer, List<String>> byRank = new TreeMap<>();
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node == null || node.rank() == null) continue;
      byRank.computeIfAbsent(node.rank(), r -> new ArrayList<>()).add(v);
    }
    if (byRank.isEmpty()) return ImmutableList.of();

    int lowest = Math.min(0, byRank.firstKey());
    List<List<String>> layering = new ArrayList<>();
    for (int r = lowest; r <= byRank.lastKey(); r++) {
      List<String> layer = byRank.getOrDefault(r, new ArrayList<>());
      layer.sort(Comparator.comparingInt(v -> orderOf(g.node(v))));
      layering.add(layer);
    }
    return layering;
  }

  /**
   * Shifts ranks so that the smallest is 0.
   */
  public static void normalizeRanks(Graph<NodeLabel, ?, ?> g) {
    int min = Integer.MAX_VALUE;
    for (String v : g.nodes()) {
      Integer rank = g.node(v).rank();
      if (rank != null) min = Math.min(min, rank);
    }
    if (min == Integer.MAX_VALUE) return;
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node.rank() != null) node.setRank(node.rank() - min);
    }
  }

  /**
   * Closes the gaps between occupied ranks, except for ranks that are multiples of the graph's
   * {@link GraphLabel#nodeRankFactor()}, which the nesting graph reserves for subgraph borders. Without a factor every
   * gap is closed.
   */
  public static void removeEmptyRanks(Graph<NodeLabel, ?, GraphLabel> g) {
    Integer factor = g.graph().nodeRankFactor();

    int offset = Integer.MAX_VALUE;
    for (String v : g.nodes()) {
      Integer rank = g.node(v).rank();
      if (rank != null) offset = Math.min(offset, rank);
    }
    if (offset == Integer.MAX_VALUE) return;

    TreeMap<Integer, List<String>> layers = new TreeMap<>();
    for (String v : g.nodes()) {
      Integer rank = g.node(v).rank();
      if (rank != null) layers.computeIfAbsent(rank - offset, r -> new ArrayList<>()).add(v);
    }

    int delta = 0;
    for (int i = 0; i <= layers.lastKey(); i++) {
      List<String> vs = layers.get(i);
      if (vs == null) {
        if (factor == null || factor <= 0 || i % factor != 0) delta--;
      } else if (delta != 0) {
        for (String v : vs) {
          NodeLabel node = g.node(v);
          node.setRank(node.rank() + delta);
        }
      }
    }
  }

  public static int maxRank(Graph<NodeLabel, ?, ?> g) {
    int max = Integer.MIN_VALUE;
    for (String v : g.nodes()) {
      NodeLabel node = g.node(v);
      if (node != null && node.rank() != null) max = Math.max(max, node.rank());
    }
    return max == Integer.MIN_VALUE ? -1 : max;
  }

  public static int rankOf(@Nullable NodeLabel node) {
    return node == null || node.rank() == null ? 0 : node.rank();
  }

  public static int orderOf(@Nullable NodeLabel node) {
    return node == null || node.order() == null ? 0 : node.order();
  }
}
