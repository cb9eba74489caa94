package strata.layout;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The layout attributes of an edge: its ranking constraints, the geometry of its label, and, once laid out, its
 * polyline and label position.
 */
public class EdgeLabel {
  private double width;
  private double height;
  private LabelPos labelpos;
  private double labeloffset;
  @Nullable private Integer labelRank;

  private int minlen;
  private double weight;

  private boolean nestingEdge;
  private boolean reversed;
  @Nullable private String forwardName;

  @Nullable private Double x;
  @Nullable private Double y;
  private List<Point> points = new ArrayList<>();

  /**
   * Creates a label with the configured {@link LayoutDefaults#standard() defaults}.
   */
  public EdgeLabel() {
    LayoutDefaults defaults = LayoutDefaults.standard();
    minlen = defaults.edgeMinlen();
    weight = defaults.edgeWeight();
    labeloffset = defaults.edgeLabeloffset();
    labelpos = defaults.edgeLabelpos();
  }

  public EdgeLabel(int minlen, double weight) {
    this();
    setMinlen(minlen);
    setWeight(weight);
  }

  public double width() {
    return width;
  }

  public EdgeLabel setWidth(double width) {
    this.width = width;
    return this;
  }

  public double height() {
    return height;
  }

  public EdgeLabel setHeight(double height) {
    this.height = height;
    return this;
  }

  public LabelPos labelpos() {
    return labelpos;
  }

  public EdgeLabel setLabelpos(LabelPos labelpos) {
    this.labelpos = labelpos;
    return this;
  }

  public double labeloffset() {
    return labeloffset;
  }

  public EdgeLabel setLabeloffset(double labeloffset) {
    this.labeloffset = labeloffset;
    return this;
  }

  /**
   * The rank at which the label's dummy node is placed, once ranks are known.
   */
  @Nullable
  public Integer labelRank() {
    return labelRank;
  }

  public EdgeLabel setLabelRank(@Nullable Integer labelRank) {
    this.labelRank = labelRank;
    return this;
  }

  public int minlen() {
    return minlen;
  }

  /**
   * @throws IllegalArgumentException if {@code minlen} is negative
   */
  public EdgeLabel setMinlen(int minlen) {
    checkArgument(minlen >= 0, "minlen must be non-negative: %s", minlen);
    this.minlen = minlen;
    return this;
  }

  public double weight() {
    return weight;
  }

  public EdgeLabel setWeight(double weight) {
    this.weight = weight;
    return this;
  }

  public boolean isNestingEdge() {
    return nestingEdge;
  }

  public EdgeLabel setNestingEdge(boolean nestingEdge) {
    this.nestingEdge = nestingEdge;
    return this;
  }

  public boolean isReversed() {
    return reversed;
  }

  public EdgeLabel setReversed(boolean reversed) {
    this.reversed = reversed;
    return this;
  }

  /**
   * The multigraph name this edge had before it was reversed.
   */
  @Nullable
  public String forwardName() {
    return forwardName;
  }

  public EdgeLabel setForwardName(@Nullable String forwardName) {
    this.forwardName = forwardName;
    return this;
  }

  @Nullable
  public Double x() {
    return x;
  }

  public EdgeLabel setX(@Nullable Double x) {
    this.x = x;
    return this;
  }

  @Nullable
  public Double y() {
    return y;
  }

  public EdgeLabel setY(@Nullable Double y) {
    this.y = y;
    return this;
  }

  public boolean hasPosition() {
    return x != null && y != null;
  }

  public List<Point> points() {
    return points;
  }

  public EdgeLabel setPoints(List<Point> points) {
    this.points = new ArrayList<>(points);
    return this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("EdgeLabel{minlen=").append(minlen).append(", weight=").append(weight);
    if (width != 0 || height != 0) sb.append(", width=").append(width).append(", height=").append(height);
    if (reversed) sb.append(", reversed, forwardName=").append(forwardName);
    if (!points.isEmpty()) sb.append(", points=").append(points);
    return sb.append('}').toString();
  }
}
