package strata.layout;

/**
 * The direction in which ranks flow.
 */
public enum RankDir {
  TB,
  BT,
  LR,
  RL;

  /**
   * Whether ranks run horizontally, so that width and height trade places while the core lays out top-to-bottom.
   */
  public boolean isHorizontal() {
    return this == LR || this == RL;
  }

  /**
   * Whether the vertical axis is mirrored after the core layout.
   */
  public boolean isReversed() {
    return this == BT || this == RL;
  }

  public static RankDir fromName(String name) {
    return valueOf(name.trim().toUpperCase());
  }
}
