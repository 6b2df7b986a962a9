package mincut.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;
import org.junit.jupiter.api.Test;

final class DisjointSetTest {

  @Test
  void startsWithSingletons() {
    DisjointSet set = new DisjointSet(5);
    assertEquals(5, set.size());
    assertEquals(5, set.subsetCount());
    for (int i = 0; i < 5; i++) {
      assertEquals(i, set.find(i));
      assertEquals(1, set.subsetSize(i));
    }
  }

  @Test
  void unionMergesAndCountsOnlyDistinctSubsets() {
    DisjointSet set = new DisjointSet(6);
    assertTrue(set.union(0, 1));
    assertTrue(set.union(2, 3));
    assertTrue(set.union(1, 3));
    assertEquals(3, set.subsetCount());

    assertFalse(set.union(0, 2), "0 and 2 are already connected");
    assertEquals(3, set.subsetCount(), "a no-op union keeps the count");

    assertTrue(set.connected(0, 3));
    assertFalse(set.connected(0, 4));
    assertEquals(4, set.subsetSize(2));
  }

  @Test
  void smallerTreeGoesUnderLarger() {
    DisjointSet set = new DisjointSet(4);
    set.union(1, 2);
    set.union(1, 3);
    set.union(0, 1);
    assertEquals(set.find(1), set.find(0), "singleton 0 is attached under the larger root");
  }

  @Test
  void tiesAttachSecondRootUnderFirst() {
    DisjointSet set = new DisjointSet(2);
    set.union(0, 1);
    assertEquals(0, set.find(1));
  }

  @Test
  void findCompressesThePath() {
    DisjointSet set = new DisjointSet(8);
    // chains built from equal-sized merges: 0 <- 1, 2 <- 3, 0 <- 2, ...
    set.union(0, 1);
    set.union(2, 3);
    set.union(4, 5);
    set.union(6, 7);
    set.union(0, 2);
    set.union(4, 6);
    set.union(0, 4);
    int root = set.find(7);
    assertEquals(0, root);
    String afterFirstFind = set.toString();
    assertEquals(root, set.find(7));
    assertEquals(afterFirstFind, set.toString(), "find is idempotent once compressed");
    assertTrue(afterFirstFind.contains("parent=[0, 0, 0, 2, 0, 4, 0, 0]"), afterFirstFind);
  }

  @Test
  void copiesAreIndependent() {
    DisjointSet original = new DisjointSet(4);
    original.union(0, 1);
    DisjointSet copy = new DisjointSet(original);
    copy.union(2, 3);

    assertEquals(3, original.subsetCount());
    assertFalse(original.connected(2, 3));
    assertEquals(2, copy.subsetCount());
    assertTrue(copy.connected(0, 1));
  }

  @Test
  void subsetCountMatchesSuccessfulUnions() {
    Random random = new Random(11);
    int n = 200;
    DisjointSet set = new DisjointSet(n);
    int[] naive = new int[n];
    for (int i = 0; i < n; i++) {
      naive[i] = i;
    }
    int successful = 0;
    for (int step = 0; step < 300; step++) {
      int x = random.nextInt(n);
      int y = random.nextInt(n);
      if (set.union(x, y)) {
        successful++;
      }
      int from = naive[y];
      int to = naive[x];
      for (int i = 0; i < n; i++) {
        if (naive[i] == from) {
          naive[i] = to;
        }
      }
    }
    assertEquals(n - successful, set.subsetCount());
    for (int x = 0; x < n; x++) {
      for (int y = 0; y < n; y++) {
        assertEquals(naive[x] == naive[y], set.connected(x, y), x + " ~ " + y);
      }
    }
  }

  @Test
  void rejectsOutOfRangeIds() {
    DisjointSet set = new DisjointSet(3);
    assertThrows(IndexOutOfBoundsException.class, () -> set.find(3));
    assertThrows(IndexOutOfBoundsException.class, () -> set.union(-1, 0));
    assertThrows(IllegalArgumentException.class, () -> new DisjointSet(-1));
  }
}
