package strata.layout;

public enum Acyclicer {
  /** Reverses the back edges found by a depth-first search. */
  DFS,
  /** Reverses a weighted greedy feedback arc set. */
  GREEDY;

  public static Acyclicer fromName(String name) {
    return "greedy".equalsIgnoreCase(name.trim()) ? GREEDY : DFS;
  }
}
