package strata.layout;

import strata.graph.EdgeKey;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * The layout attributes of a node. Callers set {@link #width} and {@link #height}; the layout fills in the
 * coordinates, and the remaining fields are bookkeeping for the synthetic nodes the pipeline inserts and removes.
 */
public class NodeLabel {
  private double width;
  private double height;
  @Nullable private Double x;
  @Nullable private Double y;
  @Nullable private Integer rank;
  @Nullable private Integer order;

  @Nullable private DummyKind dummy;
  @Nullable private LabelPos labelpos;
  @Nullable private EdgeLabel edgeLabel;
  @Nullable private EdgeKey edgeObj;

  @Nullable private Integer minRank;
  @Nullable private Integer maxRank;
  @Nullable private BorderType borderType;
  @Nullable private String borderTop;
  @Nullable private String borderBottom;
  // indexed by rank; ranks outside the subgraph hold null
  private final List<String> borderLeft = new ArrayList<>();
  private final List<String> borderRight = new ArrayList<>();

  private final List<SelfEdge> selfEdges = new ArrayList<>();

  public NodeLabel() {
  }

  public NodeLabel(double width, double height) {
    this.width = width;
    this.height = height;
  }

  public static NodeLabel dummy(DummyKind kind) {
    return new NodeLabel().setDummy(kind);
  }

  public double width() {
    return width;
  }

  public NodeLabel setWidth(double width) {
    this.width = width;
    return this;
  }

  public double height() {
    return height;
  }

  public NodeLabel setHeight(double height) {
    this.height = height;
    return this;
  }

  @Nullable
  public Double x() {
    return x;
  }

  public NodeLabel setX(@Nullable Double x) {
    this.x = x;
    return this;
  }

  @Nullable
  public Double y() {
    return y;
  }

  public NodeLabel setY(@Nullable Double y) {
    this.y = y;
    return this;
  }

  public NodeLabel setPosition(double x, double y) {
    this.x = x;
    this.y = y;
    return this;
  }

  @Nullable
  public Integer rank() {
    return rank;
  }

  public NodeLabel setRank(@Nullable Integer rank) {
    this.rank = rank;
    return this;
  }

  @Nullable
  public Integer order() {
    return order;
  }

  public NodeLabel setOrder(@Nullable Integer order) {
    this.order = order;
    return this;
  }

  @Nullable
  public DummyKind dummy() {
    return dummy;
  }

  public boolean isDummy() {
    return dummy != null;
  }

  public NodeLabel setDummy(@Nullable DummyKind dummy) {
    this.dummy = dummy;
    return this;
  }

  @Nullable
  public LabelPos labelpos() {
    return labelpos;
  }

  public NodeLabel setLabelpos(@Nullable LabelPos labelpos) {
    this.labelpos = labelpos;
    return this;
  }

  /**
   * For a dummy standing in for (part of) an edge: that edge's label.
   */
  @Nullable
  public EdgeLabel edgeLabel() {
    return edgeLabel;
  }

  public NodeLabel setEdgeLabel(@Nullable EdgeLabel edgeLabel) {
    this.edgeLabel = edgeLabel;
    return this;
  }

  /**
   * For a dummy standing in for (part of) an edge: the key of that edge.
   */
  @Nullable
  public EdgeKey edgeObj() {
    return edgeObj;
  }

  public NodeLabel setEdgeObj(@Nullable EdgeKey edgeObj) {
    this.edgeObj = edgeObj;
    return this;
  }

  @Nullable
  public Integer minRank() {
    return minRank;
  }

  public NodeLabel setMinRank(@Nullable Integer minRank) {
    this.minRank = minRank;
    return this;
  }

  @Nullable
  public Integer maxRank() {
    return maxRank;
  }

  public NodeLabel setMaxRank(@Nullable Integer maxRank) {
    this.maxRank = maxRank;
    return this;
  }

  @Nullable
  public BorderType borderType() {
    return borderType;
  }

  public NodeLabel setBorderType(@Nullable BorderType borderType) {
    this.borderType = borderType;
    return this;
  }

  @Nullable
  public String borderTop() {
    return borderTop;
  }

  public NodeLabel setBorderTop(@Nullable String borderTop) {
    this.borderTop = borderTop;
    return this;
  }

  @Nullable
  public String borderBottom() {
    return borderBottom;
  }

  public NodeLabel setBorderBottom(@Nullable String borderBottom) {
    this.borderBottom = borderBottom;
    return this;
  }

  /**
   * The left border node of this subgraph at each rank; a mutable list indexed by rank.
   */
  public List<String> borderLeft() {
    return borderLeft;
  }

  /**
   * The right border node of this subgraph at each rank; a mutable list indexed by rank.
   */
  public List<String> borderRight() {
    return borderRight;
  }

  public List<SelfEdge> selfEdges() {
    return selfEdges;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("NodeLabel{width=").append(width).append(", height=").append(height);
    if (x != null) sb.append(", x=").append(x);
    if (y != null) sb.append(", y=").append(y);
    if (rank != null) sb.append(", rank=").append(rank);
    if (order != null) sb.append(", order=").append(order);
    if (dummy != null) sb.append(", dummy=").append(dummy);
    return sb.append('}').toString();
  }
}
