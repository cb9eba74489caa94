package strata.layout;

public enum Ranker {
  NETWORK_SIMPLEX("network-simplex"),
  TIGHT_TREE("tight-tree"),
  LONGEST_PATH("longest-path"),
  NONE("none");

  private final String configName;

  Ranker(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  /**
   * Unrecognized names select {@link #NETWORK_SIMPLEX}.
   */
  public static Ranker fromName(String name) {
    for (Ranker ranker : values()) {
      if (ranker.configName.equalsIgnoreCase(name.trim())) return ranker;
    }
    return NETWORK_SIMPLEX;
  }
}
