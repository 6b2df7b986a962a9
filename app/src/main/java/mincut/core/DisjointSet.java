package mincut.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Union-find over the vertex ids {@code [0, n)}.
 *
 * <p>Uses union by size and two-phase path compression: {@link #find(int)} first walks to the
 * root without touching the structure, then relinks every node on the walked path directly to
 * that root.
 *
 * <p>Ids outside {@code [0, size())} are a caller error and surface as {@link
 * IndexOutOfBoundsException}.
 */
public final class DisjointSet {
  private final int[] parent;
  private final int[] sizes;
  private int subsetCount;

  public DisjointSet(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("element count must be non-negative: " + n);
    }
    parent = new int[n];
    sizes = new int[n];
    for (int i = 0; i < n; i++) {
      parent[i] = i;
      sizes[i] = 1;
    }
    subsetCount = n;
  }

  /** Creates an independent copy of {@code other}. */
  public DisjointSet(DisjointSet other) {
    Objects.requireNonNull(other, "other");
    parent = other.parent.clone();
    sizes = other.sizes.clone();
    subsetCount = other.subsetCount;
  }

  public int find(int x) {
    int root = x;
    while (parent[root] != root) {
      root = parent[root];
    }
    while (parent[x] != root) {
      int next = parent[x];
      parent[x] = root;
      x = next;
    }
    return root;
  }

  /**
   * Merges the subsets containing {@code x} and {@code y}.
   *
   * @return {@code true} if two distinct subsets were merged, {@code false} if they were already
   *     connected
   */
  public boolean union(int x, int y) {
    int rootX = find(x);
    int rootY = find(y);
    if (rootX == rootY) {
      return false;
    }
    if (sizes[rootX] < sizes[rootY]) {
      parent[rootX] = rootY;
      sizes[rootY] += sizes[rootX];
    } else {
      parent[rootY] = rootX;
      sizes[rootX] += sizes[rootY];
    }
    subsetCount--;
    return true;
  }

  public boolean connected(int x, int y) {
    return find(x) == find(y);
  }

  /** Number of distinct subsets currently tracked. */
  public int subsetCount() {
    return subsetCount;
  }

  /** Number of elements, i.e. the {@code n} this set was created with. */
  public int size() {
    return parent.length;
  }

  public int subsetSize(int x) {
    return sizes[find(x)];
  }

  @Override
  public String toString() {
    return "DisjointSet{size="
        + parent.length
        + ", subsets="
        + subsetCount
        + ", parent="
        + Arrays.toString(parent)
        + "}";
  }
}
