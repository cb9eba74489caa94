package strata.layout;

/**
 * Where an edge label sits relative to its edge.
 */
public enum LabelPos {
  L,
  C,
  R;

  public static LabelPos fromName(String name) {
    switch (name.trim().toLowerCase()) {
      case "l":
      case "left":
        return L;
      case "r":
      case "right":
        return R;
      default:
        return C;
    }
  }
}
