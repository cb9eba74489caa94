package strata.layout.rank;

import javax.annotation.Nullable;

/**
 * Node label of a spanning tree: postorder numbers of the subtree rooted here ({@code low..lim}) and the parent in
 * the rooted tree.
 */
public class TreeNode {
  int low;
  int lim;
  @Nullable String parent;

  public int low() {
    return low;
  }

  public int lim() {
    return lim;
  }

  @Nullable
  public String parent() {
    return parent;
  }

  @Override
  public String toString() {
    return "TreeNode{low=" + low + ", lim=" + lim + ", parent=" + parent + "}";
  }
}
