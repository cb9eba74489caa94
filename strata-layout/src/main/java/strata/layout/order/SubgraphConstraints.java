package strata.layout.order;

import strata.graph.Graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class SubgraphConstraints {
  private SubgraphConstraints() {
  }

  /**
   * Records in {@code cg} the left-to-right order of sibling subgraphs as they appear in {@code vs}, so that later
   * sweeps keep them from interleaving. Walking up from each node, the first ancestor level whose previous child
   * differs gets a constraint edge; levels above it are already consistent.
   */
  static void addSubgraphConstraints(Graph<?, ?, ?> g, Graph<?, ?, ?> cg, List<String> vs) {
    Map<String, String> prev = new HashMap<>();
    String rootPrev = null;

    for (String v : vs) {
      String child = g.parent(v);
      while (child != null) {
        String parent = g.parent(child);
        String prevChild;
        if (parent != null) {
          prevChild = prev.put(parent, child);
        } else {
          prevChild = rootPrev;
          rootPrev = child;
        }
        if (prevChild != null && !prevChild.equals(child)) {
          cg.setEdge(prevChild, child);
          break;
        }
        child = parent;
      }
    }
  }
}
