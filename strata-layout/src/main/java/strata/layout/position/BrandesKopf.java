package strata.layout.position;

import com.google.common.collect.Lists;
import strata.graph.EdgeKey;
import strata.graph.Graph;
import strata.layout.Alignment;
import strata.layout.BorderType;
import strata.layout.DummyKind;
import strata.layout.EdgeLabel;
import strata.layout.GraphLabel;
import strata.layout.LayoutGraphs;
import strata.layout.NodeLabel;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Horizontal coordinate assignment after Brandes and Köpf, "Fast and Simple Horizontal Coordinate Assignment".
 * <p>
 * Nodes are first aligned into vertical blocks with their median neighbours in the rank above (or below), skipping
 * alignments that would cross an inner segment (an edge between two dummies). Blocks are then compacted against their
 * left (or right) neighbours. The four combinations of direction give four candidate layouts; they are shifted to line
 * up with the narrowest candidate and then combined by taking, for every node, the average of the two median
 * candidate coordinates, unless {@link GraphLabel#align()} selects one candidate outright.
 */
public class BrandesKopf implements Positioner {
  @Override
  public void position(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    Position.positionY(g);
    positionX(g).forEach((v, x) -> g.node(v).setX(x));
  }

  static Map<String, Double> positionX(Graph<NodeLabel, EdgeLabel, GraphLabel> g) {
    List<List<String>> layering = LayoutGraphs.buildLayerMatrix(g);
    Conflicts conflicts = findType1Conflicts(g, layering);
    conflicts.addAll(findType2Conflicts(g, layering));

    Map<Alignment, Map<String, Double>> xss = new EnumMap<>(Alignment.class);
    for (boolean up : new boolean[]{true, false}) {
      List<List<String>> adjustedLayering = up ? layering : Lists.reverse(layering);
      for (boolean left : new boolean[]{true, false}) {
        if (!left) adjustedLayering = reverseEach(adjustedLayering);

        Function<String, List<String>> neighborFn = up ? g::predecessors : g::successors;
        BlockAlignment alignment = verticalAlignment(adjustedLayering, conflicts, neighborFn);
        Map<String, Double> xs = horizontalCompaction(g, adjustedLayering, alignment.root, alignment.align, !left);
        if (!left) xs.replaceAll((v, x) -> -x);
        xss.put(alignmentOf(up, left), xs);
      }
    }

    Map<String, Double> smallestWidth = findSmallestWidthAlignment(g, xss);
    alignCoordinates(xss, smallestWidth);
    return balance(xss, g.graph().align());
  }

  /**
   * Finds the non-inner segments that cross an inner segment. Aligning along them would bend a long edge, so they lose
   * to the inner segment.
   */
  static Conflicts findType1Conflicts(Graph<NodeLabel, ?, ?> g, List<List<String>> layering) {
    Conflicts conflicts = new Conflicts();
    for (int i = 1; i < layering.size(); i++) {
      List<String> prevLayer = layering.get(i - 1);
      List<String> layer = layering.get(i);

      // k0 and k1 bound, in the previous layer, the positions between two consecutive inner segments
      int k0 = 0;
      int scanPos = 0;
      String lastNode = layer.isEmpty() ? null : layer.get(layer.size() - 1);
      for (int idx = 0; idx < layer.size(); idx++) {
        String v = layer.get(idx);
        String w = findOtherInnerSegmentNode(g, v);
        int k1 = w != null ? LayoutGraphs.orderOf(g.node(w)) : prevLayer.size();

        if (w != null || v.equals(lastNode)) {
          for (String scanNode : layer.subList(scanPos, idx + 1)) {
            for (String u : g.predecessors(scanNode)) {
              NodeLabel uLabel = g.node(u);
              int uPos = LayoutGraphs.orderOf(uLabel);
              if ((uPos < k0 || k1 < uPos) && !(uLabel.isDummy() && g.node(scanNode).isDummy())) {
                conflicts.add(u, scanNode);
              }
            }
          }
          scanPos = idx + 1;
          k0 = k1;
        }
      }
    }
    return conflicts;
  }

  /**
   * Finds the inner segments that cross a subgraph border segment. The border wins, keeping subgraphs rectangular.
   */
  static Conflicts findType2Conflicts(Graph<NodeLabel, ?, ?> g, List<List<String>> layering) {
    Conflicts conflicts = new Conflicts();
    for (int i = 1; i < layering.size(); i++) {
      List<String> north = layering.get(i - 1);
      List<String> south = layering.get(i);

      int prevNorthPos = -1;
      int nextNorthPos = -1;
      int southPos = 0;
      for (int southLookahead = 0; southLookahead < south.size(); southLookahead++) {
        String v = south.get(southLookahead);
        if (g.node(v).dummy() == DummyKind.BORDER) {
          List<String> predecessors = g.predecessors(v);
          if (!predecessors.isEmpty()) {
            nextNorthPos = LayoutGraphs.orderOf(g.node(predecessors.get(0)));
            scan(g, conflicts, south, southPos, southLookahead, prevNorthPos, nextNorthPos);
            southPos = southLookahead;
            prevNorthPos = nextNorthPos;
          }
        }
        scan(g, conflicts, south, southPos, south.size(), nextNorthPos, north.size());
      }
    }
    return conflicts;
  }

  private static void scan(Graph<NodeLabel, ?, ?> g, Conflicts conflicts, List<String> south, int southPos,
                           int southEnd, int prevNorthBorder, int nextNorthBorder) {
    for (String v : south.subList(southPos, southEnd)) {
      if (!g.node(v).isDummy()) continue;
      for (String u : g.predecessors(v)) {
        NodeLabel uNode = g.node(u);
        if (uNode.isDummy()) {
          int uOrder = LayoutGraphs.orderOf(uNode);
          if (uOrder < prevNorthBorder || uOrder > nextNorthBorder) conflicts.add(u, v);
        }
      }
    }
  }

  @Nullable
  private static String findOtherInnerSegmentNode(Graph<NodeLabel, ?, ?> g, String v) {
    if (!g.node(v).isDummy()) return null;
    for (String u : g.predecessors(v)) {
      if (g.node(u).isDummy()) return u;
    }
    return null;
  }

  /**
   * Aligns each node with its median neighbour(s) in the previously visited layer, unless that would cross a
   * conflicting segment or an alignment already made further right in this layer. Each resulting block is a cycle
   * through {@code align}, and every node maps in {@code root} to the topmost node of its block.
   */
  static BlockAlignment verticalAlignment(List<List<String>> layering, Conflicts conflicts,
                                          Function<String, List<String>> neighborFn) {
    Map<String, String> root = new LinkedHashMap<>();
    Map<String, String> align = new LinkedHashMap<>();
    Map<String, Integer> pos = new HashMap<>();

    for (List<String> layer : layering) {
      for (int order = 0; order < layer.size(); order++) {
        String v = layer.get(order);
        root.put(v, v);
        align.put(v, v);
        pos.put(v, order);
      }
    }

    for (List<String> layer : layering) {
      int prevIdx = -1;
      for (String v : layer) {
        List<String> ws = new ArrayList<>(neighborFn.apply(v));
        if (ws.isEmpty()) continue;
        ws.sort((a, b) -> Integer.compare(pos.getOrDefault(a, Integer.MAX_VALUE), pos.getOrDefault(b, Integer.MAX_VALUE)));

        double mp = (ws.size() - 1) / 2.0;
        for (int i = (int) Math.floor(mp), il = (int) Math.ceil(mp); i <= il; i++) {
          String w = ws.get(i);
          int wPos = pos.getOrDefault(w, Integer.MAX_VALUE);
          if (align.get(v).equals(v) && prevIdx < wPos && !conflicts.has(v, w)) {
            align.put(w, v);
            String wRoot = root.get(w);
            align.put(v, wRoot);
            root.put(v, wRoot);
            prevIdx = wPos;
          }
        }
      }
    }
    return new BlockAlignment(root, align);
  }

  /**
   * Places every block as far left as the blocks to its left allow, then pulls each block right toward its right
   * neighbours where that leaves room, except for right-hand subgraph borders, which stay put. Every node takes the
   * coordinate of its block's root.
   */
  static Map<String, Double> horizontalCompaction(Graph<NodeLabel, ?, GraphLabel> g, List<List<String>> layering,
                                                  Map<String, String> root, Map<String, String> align,
                                                  boolean reverseSep) {
    Map<String, Double> xs = new HashMap<>();
    Graph<Void, Double, Void> blockG = buildBlockGraph(g, layering, root, reverseSep);
    BorderType borderType = reverseSep ? BorderType.LEFT : BorderType.RIGHT;

    iterate(blockG, elem -> {
      double x = 0;
      for (EdgeKey e : blockG.inEdges(elem)) {
        x = Math.max(x, xs.getOrDefault(e.v(), 0.0) + blockG.edge(e));
      }
      xs.put(elem, x);
    }, blockG::predecessors);

    iterate(blockG, elem -> {
      double min = Double.POSITIVE_INFINITY;
      for (EdgeKey e : blockG.outEdges(elem)) {
        min = Math.min(min, xs.getOrDefault(e.w(), 0.0) - blockG.edge(e));
      }
      NodeLabel node = g.node(elem);
      if (min != Double.POSITIVE_INFINITY && node != null && node.borderType() != borderType) {
        xs.put(elem, Math.max(xs.getOrDefault(elem, 0.0), min));
      }
    }, blockG::successors);

    Map<String, Double> result = new LinkedHashMap<>();
    for (String v : align.keySet()) {
      result.put(v, xs.getOrDefault(root.getOrDefault(v, v), 0.0));
    }
    return result;
  }

  /**
   * Visits every node of {@code blockG} depth first, applying {@code setXs} once all of its {@code nextNodes} have
   * been visited. A node reached again after it has been visited is set again.
   */
  private static void iterate(Graph<Void, Double, Void> blockG, Consumer<String> setXs,
                              Function<String, List<String>> nextNodes) {
    List<String> stack = new ArrayList<>(blockG.nodes());
    Set<String> visited = new HashSet<>();
    while (!stack.isEmpty()) {
      String elem = stack.remove(stack.size() - 1);
      if (visited.contains(elem)) {
        setXs.accept(elem);
      } else {
        visited.add(elem);
        stack.add(elem);
        stack.addAll(nextNodes.apply(elem));
      }
    }
  }

  /**
   * Connects the roots of horizontally adjacent blocks, weighted by the largest separation required between any two
   * of their members.
   */
  static Graph<Void, Double, Void> buildBlockGraph(Graph<NodeLabel, ?, GraphLabel> g, List<List<String>> layering,
                                                   Map<String, String> root, boolean reverseSep) {
    Graph<Void, Double, Void> blockGraph = new Graph<>();
    for (List<String> layer : layering) {
      String u = null;
      for (String v : layer) {
        String vRoot = root.getOrDefault(v, v);
        blockGraph.setNode(vRoot);
        if (u != null) {
          String uRoot = root.getOrDefault(u, u);
          Double prevMax = blockGraph.edge(uRoot, vRoot);
          double sep = Separation.sep(g, v, u, reverseSep);
          blockGraph.setEdge(uRoot, vRoot, Math.max(sep, prevMax == null ? 0 : prevMax));
        }
        u = v;
      }
    }
    return blockGraph;
  }

  /**
   * @return the candidate with the smallest overall width, the first one on ties
   */
  static Map<String, Double> findSmallestWidthAlignment(Graph<NodeLabel, ?, ?> g,
                                                        Map<Alignment, Map<String, Double>> xss) {
    double bestWidth = Double.POSITIVE_INFINITY;
    Map<String, Double> best = Collections.emptyMap();
    for (Map<String, Double> xs : xss.values()) {
      double max = Double.NEGATIVE_INFINITY;
      double min = Double.POSITIVE_INFINITY;
      for (Map.Entry<String, Double> entry : xs.entrySet()) {
        double halfWidth = Separation.width(g, entry.getKey()) / 2;
        max = Math.max(max, entry.getValue() + halfWidth);
        min = Math.min(min, entry.getValue() - halfWidth);
      }
      double width = max - min;
      if (width < bestWidth) {
        bestWidth = width;
        best = xs;
      }
    }
    return best;
  }

  /**
   * Shifts each candidate so that its left edge (for left-compacted candidates) or right edge (for right-compacted
   * ones) lines up with that of {@code alignTo}.
   */
  static void alignCoordinates(Map<Alignment, Map<String, Double>> xss, Map<String, Double> alignTo) {
    double alignToMin = min(alignTo.values());
    double alignToMax = max(alignTo.values());

    for (Alignment alignment : Alignment.values()) {
      Map<String, Double> xs = xss.get(alignment);
      if (xs == null || xs == alignTo) continue;

      double delta = alignment.isLeft() ? alignToMin - min(xs.values()) : alignToMax - max(xs.values());
      if (delta != 0) {
        Map<String, Double> shifted = new LinkedHashMap<>();
        xs.forEach((v, x) -> shifted.put(v, x + delta));
        xss.put(alignment, shifted);
      }
    }
  }

  /**
   * Combines the candidates: the chosen one when {@code align} is set, otherwise the mean of the two middle values.
   */
  static Map<String, Double> balance(Map<Alignment, Map<String, Double>> xss, @Nullable Alignment align) {
    Map<String, Double> ul = xss.get(Alignment.UL);
    Map<String, Double> result = new LinkedHashMap<>();
    if (ul == null) return result;

    for (String v : ul.keySet()) {
      if (align != null) {
        result.put(v, xss.get(align).getOrDefault(v, 0.0));
        continue;
      }
      double[] values = new double[xss.size()];
      int n = 0;
      for (Map<String, Double> xs : xss.values()) {
        Double x = xs.get(v);
        if (x != null) values[n++] = x;
      }
      if (n < 4) continue;
      Arrays.sort(values, 0, n);
      result.put(v, (values[1] + values[2]) / 2);
    }
    return result;
  }

  private static Alignment alignmentOf(boolean up, boolean left) {
    if (up) return left ? Alignment.UL : Alignment.UR;
    return left ? Alignment.DL : Alignment.DR;
  }

  private static List<List<String>> reverseEach(List<List<String>> layering) {
    List<List<String>> reversed = new ArrayList<>(layering.size());
    for (List<String> layer : layering) {
      reversed.add(Lists.reverse(layer));
    }
    return reversed;
  }

  private static double min(Iterable<Double> values) {
    double min = Double.POSITIVE_INFINITY;
    for (double value : values) {
      min = Math.min(min, value);
    }
    return min;
  }

  private static double max(Iterable<Double> values) {
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      max = Math.max(max, value);
    }
    return max;
  }

  static class BlockAlignment {
    final Map<String, String> root;
    final Map<String, String> align;

    BlockAlignment(Map<String, String> root, Map<String, String> align) {
      this.root = root;
      this.align = align;
    }
  }
}
