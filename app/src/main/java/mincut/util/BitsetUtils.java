package mincut.util;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/** Helpers for {@link BitSet} based vertex sets. */
public final class BitsetUtils {
  private BitsetUtils() {}

  public static List<Integer> toIndexList(BitSet bitSet) {
    List<Integer> indices = new ArrayList<>(bitSet.cardinality());
    for (int i = bitSet.nextSetBit(0); i >= 0; i = bitSet.nextSetBit(i + 1)) {
      indices.add(i);
    }
    return indices;
  }

  /** Renders the set bits as {@code [a,b,c]}, shifted by {@code offset} (1 for DIMACS ids). */
  public static String signature(BitSet bitSet, int sizeHint, int offset) {
    StringBuilder builder = new StringBuilder(sizeHint);
    builder.append('[');
    boolean first = true;
    for (int i = bitSet.nextSetBit(0); i >= 0; i = bitSet.nextSetBit(i + 1)) {
      if (!first) {
        builder.append(',');
      }
      builder.append(i + offset);
      first = false;
    }
    return builder.append(']').toString();
  }

  public static String signature(BitSet bitSet, int sizeHint) {
    return signature(bitSet, sizeHint, 0);
  }
}
