package strata.graph;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A mutable graph of string-identified nodes carrying labels of type {@link N}, edges carrying labels of type
 * {@link E}, and a graph-wide label of type {@link G}.
 * <p>
 * Depending on its {@link GraphOptions}, a graph may be undirected, may hold parallel edges (a multigraph), and may
 * nest nodes under parent nodes (a compound graph).
 * <p>
 * Nodes live in a dense table of slots: a node keeps its slot index until it is removed, and a removed node that is
 * added again is appended at the end. Every query that enumerates nodes or edges reflects insertion order; downstream
 * algorithms depend on this for deterministic tie-breaking.
 * <p>
 * Adjacency lists and child lists are not maintained on every mutation. They are rebuilt lazily on the first query
 * after any structural change, detected by comparing the generation they were built at against the graph's
 * mutation counter.
 * <p>
 * Lookups of nodes that don't exist return {@code null} or empty lists rather than failing.
 * <p>
 * Instances are not thread-safe.
 */
public class Graph<N, E, G> {
  private static final int COMPACTION_THRESHOLD = 64;

  private final GraphOptions options;
  @Nullable private G label;
  private Function<String, ? extends N> defaultNodeLabel = v -> null;
  private Supplier<? extends E> defaultEdgeLabel = () -> null;

  // node table; removed slots hold null ids until the table is compacted
  private final List<String> nodeIds = new ArrayList<>();
  private final List<N> nodeLabels = new ArrayList<>();
  private final Map<String, Integer> nodeIndex = new HashMap<>();
  private int removedSlots = 0;

  private final Map<EdgeKey, E> edgeLabels = new LinkedHashMap<>();
  private final Map<String, String> parents = new HashMap<>();

  private long generation = 0;
  @Nullable private Adjacency adjacency;
  @Nullable private Hierarchy hierarchy;

  public Graph() {
    this(GraphOptions.DEFAULT);
  }

  public Graph(GraphOptions options) {
    this.options = options;
  }

  public GraphOptions options() {
    return options;
  }

  public boolean isDirected() {
    return options.directed();
  }

  public boolean isMultigraph() {
    return options.multigraph();
  }

  public boolean isCompound() {
    return options.compound();
  }

  @Nullable
  public G graph() {
    return label;
  }

  public Graph<N, E, G> setGraph(G label) {
    this.label = label;
    return this;
  }

  /**
   * Sets the factory used to produce the label of a node created without an explicit label.
   */
  public Graph<N, E, G> setDefaultNodeLabel(Function<String, ? extends N> factory) {
    defaultNodeLabel = factory;
    return this;
  }

  /**
   * Sets the factory used to produce the label of an edge created without an explicit label.
   */
  public Graph<N, E, G> setDefaultEdgeLabel(Supplier<? extends E> factory) {
    defaultEdgeLabel = factory;
    return this;
  }

  // ---------------------------------------------------------------- nodes

  public int nodeCount() {
    return nodeIndex.size();
  }

  public List<String> nodes() {
    ImmutableList.Builder<String> builder = ImmutableList.builderWithExpectedSize(nodeIndex.size());
    for (String id : nodeIds) {
      if (id != null) builder.add(id);
    }
    return builder.build();
  }

  public List<String> sources() {
    return filterNodes(v -> inEdgeList(v).isEmpty());
  }

  public List<String> sinks() {
    return filterNodes(v -> outEdgeList(v).isEmpty());
  }

  public boolean hasNode(String v) {
    return nodeIndex.containsKey(v);
  }

  @Nullable
  public N node(String v) {
    Integer index = nodeIndex.get(v);
    return index == null ? null : nodeLabels.get(index);
  }

  /**
   * Adds {@code v} with a default label if it is absent. An existing node keeps its current label.
   */
  public Graph<N, E, G> setNode(String v) {
    if (!hasNode(v)) addNode(v, defaultNodeLabel.apply(v));
    return this;
  }

  /**
   * Adds {@code v}, or replaces its label if it is already present.
   */
  public Graph<N, E, G> setNode(String v, N label) {
    Integer index = nodeIndex.get(v);
    if (index == null) {
      addNode(v, label);
    } else {
      nodeLabels.set(index, label);
    }
    return this;
  }

  public Graph<N, E, G> setNodes(Iterable<String> vs) {
    for (String v : vs) {
      setNode(v);
    }
    return this;
  }

  /**
   * Removes {@code v} and every edge incident on it. Children of {@code v} are promoted to the root of the
   * hierarchy rather than removed.
   */
  public Graph<N, E, G> removeNode(String v) {
    Integer index = nodeIndex.get(v);
    if (index == null) return this;

    if (isCompound()) {
      for (String child : children(v)) {
        parents.remove(child);
      }
      parents.remove(v);
    }
    for (EdgeKey e : nodeEdges(v)) {
      edgeLabels.remove(e);
    }

    nodeIndex.remove(v);
    nodeIds.set(index, null);
    nodeLabels.set(index, null);
    removedSlots++;
    if (removedSlots > COMPACTION_THRESHOLD && removedSlots > nodeIds.size() / 2) compact();
    mutated();
    return this;
  }

  public boolean isLeaf(String v) {
    List<EdgeKey> edges = isDirected() ? outEdgeList(v) : incidentEdgeList(v);
    return edges.isEmpty();
  }

  private void addNode(String v, N label) {
    nodeIndex.put(v, nodeIds.size());
    nodeIds.add(v);
    nodeLabels.add(label);
    mutated();
  }

  private void compact() {
    int next = 0;
    for (int i = 0; i < nodeIds.size(); i++) {
      String id = nodeIds.get(i);
      if (id == null) continue;
      nodeIds.set(next, id);
      nodeLabels.set(next, nodeLabels.get(i));
      nodeIndex.put(id, next);
      next++;
    }
    nodeIds.subList(next, nodeIds.size()).clear();
    nodeLabels.subList(next, nodeLabels.size()).clear();
    removedSlots = 0;
  }

  private List<String> filterNodes(Predicate<String> filter) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String id : nodeIds) {
      if (id != null && filter.test(id)) builder.add(id);
    }
    return builder.build();
  }

  // ---------------------------------------------------------------- hierarchy

  @Nullable
  public String parent(String v) {
    return isCompound() ? parents.get(v) : null;
  }

  /**
   * @return the children of {@code v}, in node insertion order
   */
  public List<String> children(String v) {
    if (!isCompound()) return ImmutableList.of();
    return hierarchy().children.getOrDefault(v, ImmutableList.of());
  }

  /**
   * @return the nodes at the top of the hierarchy (every node, if the graph is not compound)
   */
  public List<String> children() {
    if (!isCompound()) return nodes();
    return hierarchy().roots;
  }

  /**
   * Nests {@code v} under {@code parent}, creating either node if needed. A {@code null} parent moves {@code v} to
   * the top of the hierarchy.
   *
   * @throws IllegalStateException if the graph is not compound
   * @throws IllegalArgumentException if {@code parent} is {@code v} or one of its descendants
   */
  public Graph<N, E, G> setParent(String v, @Nullable String parent) {
    checkState(isCompound(), "Cannot set parent in a non-compound graph");
    if (parent == null) return clearParent(v);

    for (String ancestor = parent; ancestor != null; ancestor = parents.get(ancestor)) {
      checkArgument(!ancestor.equals(v), "Setting %s as parent of %s would create a cycle", parent, v);
    }

    setNode(parent);
    setNode(v);
    parents.put(v, parent);
    mutated();
    return this;
  }

  public Graph<N, E, G> clearParent(String v) {
    checkState(isCompound(), "Cannot set parent in a non-compound graph");
    setNode(v);
    if (parents.remove(v) != null) mutated();
    return this;
  }

  // ---------------------------------------------------------------- edges

  public int edgeCount() {
    return edgeLabels.size();
  }

  public List<EdgeKey> edges() {
    return ImmutableList.copyOf(edgeLabels.keySet());
  }

  public boolean hasEdge(String v, String w) {
    return hasEdge(v, w, null);
  }

  public boolean hasEdge(String v, String w, @Nullable String name) {
    return edgeLabels.containsKey(key(v, w, name));
  }

  public boolean hasEdge(EdgeKey e) {
    return hasEdge(e.v(), e.w(), e.name());
  }

  @Nullable
  public E edge(String v, String w) {
    return edge(v, w, null);
  }

  @Nullable
  public E edge(String v, String w, @Nullable String name) {
    return edgeLabels.get(key(v, w, name));
  }

  @Nullable
  public E edge(EdgeKey e) {
    return edge(e.v(), e.w(), e.name());
  }

  /**
   * Adds an edge with a default label, or leaves an existing edge untouched.
   */
  public Graph<N, E, G> setEdge(String v, String w) {
    EdgeKey key = key(v, w, null);
    if (!edgeLabels.containsKey(key)) addEdge(key, defaultEdgeLabel.get());
    return this;
  }

  public Graph<N, E, G> setEdge(String v, String w, E label) {
    return setEdge(v, w, label, null);
  }

  /**
   * Adds an edge, or replaces the label of an existing one. The name is ignored unless the graph is a multigraph.
   */
  public Graph<N, E, G> setEdge(String v, String w, E label, @Nullable String name) {
    EdgeKey key = key(v, w, name);
    if (edgeLabels.containsKey(key)) {
      edgeLabels.put(key, label);
    } else {
      addEdge(key, label);
    }
    return this;
  }

  public Graph<N, E, G> setEdge(EdgeKey e, E label) {
    return setEdge(e.v(), e.w(), label, e.name());
  }

  /**
   * Connects each consecutive pair of {@code vs} with a default-labelled edge.
   */
  public Graph<N, E, G> setPath(String... vs) {
    for (int i = 1; i < vs.length; i++) {
      setEdge(vs[i - 1], vs[i]);
    }
    return this;
  }

  public Graph<N, E, G> removeEdge(String v, String w) {
    return removeEdge(v, w, null);
  }

  public Graph<N, E, G> removeEdge(String v, String w, @Nullable String name) {
    if (edgeLabels.remove(key(v, w, name)) != null) mutated();
    return this;
  }

  public Graph<N, E, G> removeEdge(EdgeKey e) {
    return removeEdge(e.v(), e.w(), e.name());
  }

  private void addEdge(EdgeKey key, E label) {
    setNode(key.v());
    setNode(key.w());
    edgeLabels.put(key, label);
    mutated();
  }

  private EdgeKey key(String v, String w, @Nullable String name) {
    String edgeName = isMultigraph() ? name : null;
    if (!isDirected() && v.compareTo(w) > 0) {
      return EdgeKey.of(w, v, edgeName);
    }
    return EdgeKey.of(v, w, edgeName);
  }

  // ---------------------------------------------------------------- adjacency

  public List<EdgeKey> inEdges(String v) {
    return isDirected() ? inEdgeList(v) : incidentEdgeList(v);
  }

  /**
   * @return the edges into {@code v} whose other endpoint is {@code u}
   */
  public List<EdgeKey> inEdges(String v, String u) {
    return filterEdges(inEdges(v), e -> e.other(v).equals(u) && (!isDirected() || e.v().equals(u)));
  }

  public List<EdgeKey> outEdges(String v) {
    return isDirected() ? outEdgeList(v) : incidentEdgeList(v);
  }

  /**
   * @return the edges out of {@code v} whose other endpoint is {@code w}
   */
  public List<EdgeKey> outEdges(String v, String w) {
    return filterEdges(outEdges(v), e -> e.other(v).equals(w) && (!isDirected() || e.w().equals(w)));
  }

  /**
   * @return every edge incident on {@code v}: in-edges first, then out-edges
   */
  public List<EdgeKey> nodeEdges(String v) {
    if (!isDirected()) return incidentEdgeList(v);
    return ImmutableList.<EdgeKey>builder().addAll(inEdgeList(v)).addAll(outEdgeList(v)).build();
  }

  /**
   * @return every edge between {@code v} and {@code w}, in either direction
   */
  public List<EdgeKey> nodeEdges(String v, String w) {
    if (!isDirected()) return outEdges(v, w);
    return ImmutableList.<EdgeKey>builder().addAll(inEdges(v, w)).addAll(outEdges(v, w)).build();
  }

  public List<String> successors(String v) {
    if (!isDirected()) return neighbors(v);
    Set<String> result = new LinkedHashSet<>();
    for (EdgeKey e : outEdgeList(v)) {
      result.add(e.w());
    }
    return ImmutableList.copyOf(result);
  }

  public List<String> predecessors(String v) {
    if (!isDirected()) return neighbors(v);
    Set<String> result = new LinkedHashSet<>();
    for (EdgeKey e : inEdgeList(v)) {
      result.add(e.v());
    }
    return ImmutableList.copyOf(result);
  }

  public List<String> neighbors(String v) {
    Set<String> result = new LinkedHashSet<>();
    if (isDirected()) {
      result.addAll(predecessors(v));
      result.addAll(successors(v));
    } else {
      for (EdgeKey e : incidentEdgeList(v)) {
        result.add(e.other(v));
      }
    }
    return ImmutableList.copyOf(result);
  }

  private static List<EdgeKey> filterEdges(List<EdgeKey> edges, Predicate<EdgeKey> filter) {
    ImmutableList.Builder<EdgeKey> builder = ImmutableList.builder();
    for (EdgeKey e : edges) {
      if (filter.test(e)) builder.add(e);
    }
    return builder.build();
  }

  private List<EdgeKey> inEdgeList(String v) {
    Integer index = nodeIndex.get(v);
    return index == null ? ImmutableList.of() : adjacency().in.get(index);
  }

  private List<EdgeKey> outEdgeList(String v) {
    Integer index = nodeIndex.get(v);
    return index == null ? ImmutableList.of() : adjacency().out.get(index);
  }

  private List<EdgeKey> incidentEdgeList(String v) {
    return outEdgeList(v);
  }

  // ---------------------------------------------------------------- caches

  private void mutated() {
    generation++;
  }

  private Adjacency adjacency() {
    if (adjacency == null || adjacency.generation != generation) {
      adjacency = new Adjacency(generation);
    }
    return adjacency;
  }

  private Hierarchy hierarchy() {
    if (hierarchy == null || hierarchy.generation != generation) {
      hierarchy = new Hierarchy(generation);
    }
    return hierarchy;
  }

  /**
   * Per-slot edge lists. A directed graph keeps separate in/out lists; an undirected graph keeps one symmetric list
   * of incident edges, shared by both fields.
   */
  private class Adjacency {
    final long generation;
    final List<List<EdgeKey>> out;
    final List<List<EdgeKey>> in;

    Adjacency(long generation) {
      this.generation = generation;
      int slots = nodeIds.size();
      List<ImmutableList.Builder<EdgeKey>> outBuilders = newBuilders(slots);
      List<ImmutableList.Builder<EdgeKey>> inBuilders = isDirected() ? newBuilders(slots) : outBuilders;
      for (EdgeKey e : edgeLabels.keySet()) {
        int v = nodeIndex.get(e.v());
        int w = nodeIndex.get(e.w());
        outBuilders.get(v).add(e);
        if (isDirected() || v != w) inBuilders.get(w).add(e);
      }
      out = build(outBuilders);
      in = isDirected() ? build(inBuilders) : out;
    }

    private List<ImmutableList.Builder<EdgeKey>> newBuilders(int slots) {
      List<ImmutableList.Builder<EdgeKey>> builders = new ArrayList<>(slots);
      for (int i = 0; i < slots; i++) {
        builders.add(ImmutableList.builder());
      }
      return builders;
    }

    private List<List<EdgeKey>> build(List<ImmutableList.Builder<EdgeKey>> builders) {
      List<List<EdgeKey>> lists = new ArrayList<>(builders.size());
      for (ImmutableList.Builder<EdgeKey> builder : builders) {
        lists.add(builder.build());
      }
      return lists;
    }
  }

  private class Hierarchy {
    final long generation;
    final Map<String, List<String>> children;
    final List<String> roots;

    Hierarchy(long generation) {
      this.generation = generation;
      Map<String, ImmutableList.Builder<String>> builders = new HashMap<>();
      ImmutableList.Builder<String> rootBuilder = ImmutableList.builder();
      for (String id : nodeIds) {
        if (id == null) continue;
        String parent = parents.get(id);
        if (parent == null) {
          rootBuilder.add(id);
        } else {
          builders.computeIfAbsent(parent, p -> ImmutableList.builder()).add(id);
        }
      }
      children = new HashMap<>(builders.size());
      builders.forEach((parent, builder) -> children.put(parent, builder.build()));
      roots = rootBuilder.build();
    }
  }
}
