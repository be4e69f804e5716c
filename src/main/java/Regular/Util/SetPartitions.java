package Regular.Util;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Partition of the elements {@code 0..n-1} into disjoint blocks that can be refined by marking
 * and splitting, the usual substrate of Hopcroft / Valmari style refinement.
 * <p>
 * All elements live in one array. Each block owns the contiguous range {@code [first, last)} of
 * it, split at {@code mid}: marked elements in {@code [first, mid)}, unmarked elements in
 * {@code [mid, last)}, both sub-ranges ascending.
 */
public final class SetPartitions {
  public static final int NO_SPLIT = -1;

  private final int[] elements;
  private final int[] blockOf;
  private final FixedBitSet marked;
  private final IntList first;
  private final IntList mid;
  private final IntList last;

  /**
   * A single block (id 0) containing every element of {@code 0..size-1}.
   */
  public SetPartitions(int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size < 0: " + size);
    }
    this.elements = new int[size];
    for (int i = 0; i < size; i++) {
      elements[i] = i;
    }
    this.blockOf = new int[size]; // everything in block 0
    this.marked = new FixedBitSet(size);
    this.first = new IntArrayList();
    this.mid = new IntArrayList();
    this.last = new IntArrayList();
    first.add(0);
    mid.add(0);
    last.add(size);
  }

  public int numElements() {
    return elements.length;
  }

  public int numBlocks() {
    return first.size();
  }

  public int size(int block) {
    return last.getInt(block) - first.getInt(block);
  }

  public int blockOf(int element) {
    return blockOf[element];
  }

  public boolean isMarked(int element) {
    return marked.contains(element);
  }

  public boolean noMarks(int block) {
    return mid.getInt(block) == first.getInt(block);
  }

  /**
   * Moves {@code element} from the unmarked to the marked part of its block.
   * Marking an already marked element does nothing.
   */
  public void mark(int element) {
    if (marked.contains(element)) {
      return;
    }
    final int block = blockOf[element];
    final int lo = first.getInt(block);
    final int m = mid.getInt(block);
    final int hi = last.getInt(block);

    final int loc = Arrays.binarySearch(elements, m, hi, element);
    if (loc < 0) {
      throw new IllegalStateException("unmarked element " + element + " not found in block " + block);
    }
    // insertion point inside the marked prefix keeps it ascending
    final int ins = -Arrays.binarySearch(elements, lo, m, element) - 1;

    // shift [ins, loc) one to the right, overwriting the old location of element
    System.arraycopy(elements, ins, elements, ins + 1, loc - ins);
    elements[ins] = element;
    mid.set(block, m + 1);
    marked.set(element);
  }

  /**
   * Detaches the marked part of {@code block} into a new block.
   * <p>
   * If nothing is marked, or everything is, no block is created and {@link #NO_SPLIT} is
   * returned; in the latter case the marks of the block are dropped.
   *
   * @return the id of the new block holding the formerly marked elements, or {@link #NO_SPLIT}
   */
  public int split(int block) {
    final int lo = first.getInt(block);
    final int m = mid.getInt(block);
    final int hi = last.getInt(block);

    if (m == lo) {
      return NO_SPLIT;
    }
    if (m == hi) {
      // whole block marked: it stays as is, unmarked again
      mid.set(block, lo);
      resetRange(lo, hi, block);
      return NO_SPLIT;
    }

    final int newBlock = first.size();
    first.add(lo);
    mid.add(lo);
    last.add(m);
    first.set(block, m);

    resetRange(lo, m, newBlock);
    return newBlock;
  }

  private void resetRange(int from, int to, int owner) {
    Arrays.sort(elements, from, to);
    for (int loc = from; loc < to; loc++) {
      final int e = elements[loc];
      marked.clear(e);
      blockOf[e] = owner;
    }
  }

  public int[] marked(int block) {
    return Arrays.copyOfRange(elements, first.getInt(block), mid.getInt(block));
  }

  public int[] unmarked(int block) {
    return Arrays.copyOfRange(elements, mid.getInt(block), last.getInt(block));
  }

  /**
   * Ascending iteration over all elements of a block, marked or not.
   */
  public IntIterator elements(int block) {
    final IntList markedPart = IntArrayList.wrap(marked(block));
    final IntList unmarkedPart = IntArrayList.wrap(unmarked(block));
    final Join<Integer> merged = new Join<>(markedPart, unmarkedPart, (l, r) -> {
      final Integer a = l.peek();
      final Integer b = r.peek();
      if (a == null) return r.next();
      if (b == null || a < b) return l.next();
      return r.next();
    });
    return new IntIterator() {
      @Override
      public boolean hasNext() {
        return merged.hasNext();
      }

      @Override
      public int nextInt() {
        return merged.next();
      }
    };
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    for (int b = 0; b < numBlocks(); b++) {
      if (b > 0) sb.append(' ');
      sb.append(b).append(':').append(Arrays.toString(marked(b)))
          .append(Arrays.toString(unmarked(b)));
    }
    return sb.toString();
  }
}
