package strata.layout;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.immutables.value.Value;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Default values for {@link GraphLabel} and {@link EdgeLabel} fields, read from the {@value #CONFIG_PATH} block of
 * the application's Typesafe config. The shipped {@code reference.conf} provides every value.
 */
@Value.Immutable
public interface LayoutDefaults {
  String CONFIG_PATH = "strata.layout";

  Supplier<LayoutDefaults> STANDARD = Suppliers.memoize(() -> fromConfig(ConfigFactory.load()));

  /**
   * @return the defaults resolved from the classpath configuration, loaded once
   */
  static LayoutDefaults standard() {
    return STANDARD.get();
  }

  static Builder builder() {
    return new Builder();
  }

  static LayoutDefaults fromConfig(Config root) {
    Config config = root.getConfig(CONFIG_PATH);
    Config edge = config.getConfig("edge");
    return builder()
            .rankdir(RankDir.fromName(config.getString("rankdir")))
            .nodesep(config.getDouble("nodesep"))
            .edgesep(config.getDouble("edgesep"))
            .ranksep(config.getDouble("ranksep"))
            .marginx(config.getDouble("marginx"))
            .marginy(config.getDouble("marginy"))
            .align(config.hasPath("align")
                    ? Optional.of(Alignment.fromName(config.getString("align")))
                    : Optional.empty())
            .ranker(Ranker.fromName(config.getString("ranker")))
            .acyclicer(Acyclicer.fromName(config.getString("acyclicer")))
            .positioner(PositionerKind.fromName(config.getString("positioner")))
            .balanceRanks(config.getBoolean("balance-ranks"))
            .edgeMinlen(edge.getInt("minlen"))
            .edgeWeight(edge.getDouble("weight"))
            .edgeLabeloffset(edge.getDouble("labeloffset"))
            .edgeLabelpos(LabelPos.fromName(edge.getString("labelpos")))
            .build();
  }

  RankDir rankdir();

  double nodesep();

  double edgesep();

  double ranksep();

  double marginx();

  double marginy();

  Optional<Alignment> align();

  Ranker ranker();

  Acyclicer acyclicer();

  PositionerKind positioner();

  boolean balanceRanks();

  int edgeMinlen();

  double edgeWeight();

  double edgeLabeloffset();

  LabelPos edgeLabelpos();

  @Value.Check
  default void checkValues() {
    checkArgument(nodesep() >= 0 && edgesep() >= 0 && ranksep() >= 0, "Separations must be non-negative: %s", this);
    checkArgument(edgeMinlen() >= 1, "Edge minlen must be at least 1: %s", this);
    checkArgument(edgeWeight() >= 0, "Edge weight must be non-negative: %s", this);
  }

  class Builder extends ImmutableLayoutDefaults.Builder {
  }
}
