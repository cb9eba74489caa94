package strata.graph;

import com.google.common.collect.ImmutableList;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Depth-first traversals over a {@link Graph}, following successors in a directed graph and neighbors in an
 * undirected one. Each traversal starts from every root in turn, sharing a single visited set, so nodes reachable
 * from an earlier root are not revisited.
 * <p>
 * Traversals use explicit stacks but produce exactly the order of their recursive formulations.
 */
public final class GraphTraversals {
  private GraphTraversals() {
  }

  public static List<String> preorder(Graph<?, ?, ?> g, Iterable<String> roots) {
    ImmutableList.Builder<String> acc = ImmutableList.builder();
    Set<String> visited = new HashSet<>();
    for (String root : roots) {
      if (!g.hasNode(root)) continue;
      Deque<String> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        String v = stack.pop();
        if (!visited.add(v)) continue;
        acc.add(v);
        List<String> next = navigate(g, v);
        for (int i = next.size() - 1; i >= 0; i--) {
          stack.push(next.get(i));
        }
      }
    }
    return acc.build();
  }

  public static List<String> preorder(Graph<?, ?, ?> g, String root) {
    return preorder(g, ImmutableList.of(root));
  }

  public static List<String> postorder(Graph<?, ?, ?> g, Iterable<String> roots) {
    ImmutableList.Builder<String> acc = ImmutableList.builder();
    Set<String> visited = new HashSet<>();
    for (String root : roots) {
      if (!g.hasNode(root)) continue;
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(new Frame(root, false));
      while (!stack.isEmpty()) {
        Frame frame = stack.pop();
        if (frame.finished) {
          acc.add(frame.node);
        } else if (visited.add(frame.node)) {
          stack.push(new Frame(frame.node, true));
          List<String> next = navigate(g, frame.node);
          for (int i = next.size() - 1; i >= 0; i--) {
            stack.push(new Frame(next.get(i), false));
          }
        }
      }
    }
    return acc.build();
  }

  public static List<String> postorder(Graph<?, ?, ?> g, String root) {
    return postorder(g, ImmutableList.of(root));
  }

  private static List<String> navigate(Graph<?, ?, ?> g, String v) {
    return g.isDirected() ? g.successors(v) : g.neighbors(v);
  }

  private static class Frame {
    final String node;
    final boolean finished;

    Frame(String node, boolean finished) {
      this.node = node;
      this.finished = finished;
    }
  }
}
