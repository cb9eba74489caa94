package strata.layout;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Graph-wide layout options, initialized from {@link LayoutDefaults#standard()}, together with the bookkeeping the
 * pipeline records about its own synthetic nodes and the overall size of the finished layout.
 */
public class GraphLabel {
  private RankDir rankdir;
  private double nodesep;
  private double edgesep;
  private double ranksep;
  private double marginx;
  private double marginy;
  @Nullable private Alignment align;
  private Ranker ranker;
  private Acyclicer acyclicer;
  private PositionerKind positioner;
  private boolean disableOptimalOrderHeuristic;
  private boolean balanceRanks;

  private final List<String> dummyChains = new ArrayList<>();
  @Nullable private String nestingRoot;
  @Nullable private Integer nodeRankFactor;
  private int maxRank;
  @Nullable private String layerRoot;

  @Nullable private Double width;
  @Nullable private Double height;

  public GraphLabel() {
    this(LayoutDefaults.standard());
  }

  public GraphLabel(LayoutDefaults defaults) {
    rankdir = defaults.rankdir();
    nodesep = defaults.nodesep();
    edgesep = defaults.edgesep();
    ranksep = defaults.ranksep();
    marginx = defaults.marginx();
    marginy = defaults.marginy();
    align = defaults.align().orElse(null);
    ranker = defaults.ranker();
    acyclicer = defaults.acyclicer();
    positioner = defaults.positioner();
    balanceRanks = defaults.balanceRanks();
  }

  /**
   * Copies the options of {@code other}, but none of its bookkeeping or results.
   */
  public static GraphLabel copyOptions(GraphLabel other) {
    return new GraphLabel()
            .setRankdir(other.rankdir)
            .setNodesep(other.nodesep)
            .setEdgesep(other.edgesep)
            .setRanksep(other.ranksep)
            .setMarginx(other.marginx)
            .setMarginy(other.marginy)
            .setAlign(other.align)
            .setRanker(other.ranker)
            .setAcyclicer(other.acyclicer)
            .setPositioner(other.positioner)
            .setDisableOptimalOrderHeuristic(other.disableOptimalOrderHeuristic)
            .setBalanceRanks(other.balanceRanks);
  }

  public RankDir rankdir() {
    return rankdir;
  }

  public GraphLabel setRankdir(RankDir rankdir) {
    this.rankdir = rankdir;
    return this;
  }

  public double nodesep() {
    return nodesep;
  }

  public GraphLabel setNodesep(double nodesep) {
    this.nodesep = nodesep;
    return this;
  }

  public double edgesep() {
    return edgesep;
  }

  public GraphLabel setEdgesep(double edgesep) {
    this.edgesep = edgesep;
    return this;
  }

  public double ranksep() {
    return ranksep;
  }

  public GraphLabel setRanksep(double ranksep) {
    this.ranksep = ranksep;
    return this;
  }

  public double marginx() {
    return marginx;
  }

  public GraphLabel setMarginx(double marginx) {
    this.marginx = marginx;
    return this;
  }

  public double marginy() {
    return marginy;
  }

  public GraphLabel setMarginy(double marginy) {
    this.marginy = marginy;
    return this;
  }

  @Nullable
  public Alignment align() {
    return align;
  }

  public GraphLabel setAlign(@Nullable Alignment align) {
    this.align = align;
    return this;
  }

  public Ranker ranker() {
    return ranker;
  }

  public GraphLabel setRanker(Ranker ranker) {
    this.ranker = ranker;
    return this;
  }

  public GraphLabel setRanker(String ranker) {
    return setRanker(Ranker.fromName(ranker));
  }

  public Acyclicer acyclicer() {
    return acyclicer;
  }

  public GraphLabel setAcyclicer(Acyclicer acyclicer) {
    this.acyclicer = acyclicer;
    return this;
  }

  public GraphLabel setAcyclicer(String acyclicer) {
    return setAcyclicer(Acyclicer.fromName(acyclicer));
  }

  public PositionerKind positioner() {
    return positioner;
  }

  public GraphLabel setPositioner(PositionerKind positioner) {
    this.positioner = positioner;
    return this;
  }

  public boolean disableOptimalOrderHeuristic() {
    return disableOptimalOrderHeuristic;
  }

  public GraphLabel setDisableOptimalOrderHeuristic(boolean disableOptimalOrderHeuristic) {
    this.disableOptimalOrderHeuristic = disableOptimalOrderHeuristic;
    return this;
  }

  /**
   * Whether network simplex moves nodes with equal in and out weight to the middle of their feasible rank range.
   */
  public boolean balanceRanks() {
    return balanceRanks;
  }

  public GraphLabel setBalanceRanks(boolean balanceRanks) {
    this.balanceRanks = balanceRanks;
    return this;
  }

  /**
   * The first dummy node of every chain created when long edges were split.
   */
  public List<String> dummyChains() {
    return dummyChains;
  }

  @Nullable
  public String nestingRoot() {
    return nestingRoot;
  }

  public GraphLabel setNestingRoot(@Nullable String nestingRoot) {
    this.nestingRoot = nestingRoot;
    return this;
  }

  @Nullable
  public Integer nodeRankFactor() {
    return nodeRankFactor;
  }

  public GraphLabel setNodeRankFactor(@Nullable Integer nodeRankFactor) {
    this.nodeRankFactor = nodeRankFactor;
    return this;
  }

  public int maxRank() {
    return maxRank;
  }

  public GraphLabel setMaxRank(int maxRank) {
    this.maxRank = maxRank;
    return this;
  }

  /**
   * In a layer graph built during ordering: the synthetic root all top-level nodes hang from.
   */
  @Nullable
  public String layerRoot() {
    return layerRoot;
  }

  public GraphLabel setLayerRoot(@Nullable String layerRoot) {
    this.layerRoot = layerRoot;
    return this;
  }

  @Nullable
  public Double width() {
    return width;
  }

  public GraphLabel setWidth(@Nullable Double width) {
    this.width = width;
    return this;
  }

  @Nullable
  public Double height() {
    return height;
  }

  public GraphLabel setHeight(@Nullable Double height) {
    this.height = height;
    return this;
  }
}
