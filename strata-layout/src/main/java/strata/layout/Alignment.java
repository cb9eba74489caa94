package strata.layout;

/**
 * One of the four vertical/horizontal sweep combinations of the Brandes-Köpf positioner.
 */
public enum Alignment {
  UL(true, true),
  UR(true, false),
  DL(false, true),
  DR(false, false);

  private final boolean up;
  private final boolean left;

  Alignment(boolean up, boolean left) {
    this.up = up;
    this.left = left;
  }

  public boolean isUp() {
    return up;
  }

  public boolean isLeft() {
    return left;
  }

  public static Alignment fromName(String name) {
    return valueOf(name.trim().toUpperCase());
  }
}
