package Regular.Util;

import java.util.Arrays;
import java.util.NoSuchElementException;

import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * BitSet of fixed length (size), packed into 64-bit blocks.
 * Bit {@code i} lives in block {@code i >> 6} at offset {@code i & 63}.
 * Indices outside {@code [0, size)} are never stored; mutators report them instead of throwing.
 */
public final class FixedBitSet {
  public static final int BLOCK_WIDTH = 64;

  final long[] bits; // Array of longs holding the bits
  private final int size;
  private final long lastBlockMask; // mask off bits beyond size in the last block

  /**
   * Creates a new FixedBitSet with all bits clear. The internally allocated long array will be
   * exactly the size needed to accommodate the requested number of bits.
   *
   * @param size the number of bits needed
   */
  public FixedBitSet(final int size) {
    if (size < 0) {
      throw new IllegalArgumentException("size < 0: " + size);
    }
    this.size = size;
    this.bits = new long[blocksForBits(size)];
    final int r = size & 63;
    this.lastBlockMask = (r == 0) ? -1L : (-1L >>> (64 - r));
  }

  private FixedBitSet(final FixedBitSet other) {
    this.size = other.size;
    this.bits = other.bits.clone();
    this.lastBlockMask = other.lastBlockMask;
  }

  static int blocksForBits(final int size) {
    return (size + BLOCK_WIDTH - 1) >>> 6;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int blockCount() {
    return bits.length;
  }

  private boolean inRange(final int index) {
    return index >= 0 && index < size;
  }

  /**
   * @return whether bit {@code index} is set, or {@code null} if the index is out of range
   */
  public Boolean get(final int index) {
    if (!inRange(index)) {
      return null;
    }
    return (bits[index >> 6] & (1L << (index & 63))) != 0;
  }

  /**
   * Same as {@link #get(int)}, but an out of range index is simply not contained.
   */
  public boolean contains(final int index) {
    return inRange(index) && (bits[index >> 6] & (1L << (index & 63))) != 0;
  }

  /**
   * @return false (and do nothing) if the index is out of range
   */
  public boolean set(final int index) {
    if (!inRange(index)) {
      return false;
    }
    bits[index >> 6] |= 1L << (index & 63);
    return true;
  }

  /**
   * @return false (and do nothing) if the index is out of range
   */
  public boolean clear(final int index) {
    if (!inRange(index)) {
      return false;
    }
    bits[index >> 6] &= ~(1L << (index & 63));
    return true;
  }

  public void clearAll() {
    Arrays.fill(bits, 0L);
  }

  public int cardinality() {
    int count = 0;
    for (long block : bits) {
      count += Long.bitCount(block);
    }
    return count;
  }

  /**
   * Determine if this is a subset of {@code other}, comparing block by block.
   * Only meaningful when both sets have the same block layout; blocks missing on either side are
   * ignored.
   */
  public boolean isSubset(final FixedBitSet other) {
    final int common = Math.min(bits.length, other.bits.length);
    for (int i = 0; i < common; i++) {
      if ((bits[i] & ~other.bits[i]) != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the next set bit at or after {@code index}.
   * If no such bit exists, returns -1.
   */
  public int nextSetBit(final int index) {
    if (index < 0) {
      return nextSetBit(0);
    }
    int i = index >> 6;
    final int numBlocks = bits.length;
    if (i >= numBlocks) {
      return -1;
    }

    // discard the bits below 'index' in the first block
    long block = bits[i] & (-1L << (index & 63));
    while (true) {
      if (i == numBlocks - 1) block &= lastBlockMask;
      if (block != 0) {
        // lowest set bit of the block
        return (i << 6) + Long.numberOfTrailingZeros(block);
      }
      if (++i >= numBlocks) {
        return -1;
      }
      block = bits[i];
    }
  }

  /**
   * Ascending iteration over the indices of the set bits. Each block is drained by repeatedly
   * extracting its lowest set bit.
   */
  public IntIterator iterator() {
    return new IntIterator() {
      private int blockIdx = 0;
      private long remaining = bits.length == 0 ? 0L : maskedBlock(0);

      private void advance() {
        while (remaining == 0 && blockIdx + 1 < bits.length) {
          remaining = maskedBlock(++blockIdx);
        }
      }

      @Override
      public boolean hasNext() {
        advance();
        return remaining != 0;
      }

      @Override
      public int nextInt() {
        advance();
        if (remaining == 0) {
          throw new NoSuchElementException();
        }
        final int offset = Long.numberOfTrailingZeros(remaining);
        remaining &= remaining - 1; // drop lowest set bit
        return (blockIdx << 6) + offset;
      }
    };
  }

  private long maskedBlock(final int i) {
    return i == bits.length - 1 ? bits[i] & lastBlockMask : bits[i];
  }

  public FixedBitSet copy() {
    return new FixedBitSet(this);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof FixedBitSet)) return false;
    final FixedBitSet other = (FixedBitSet) o;
    return size == other.size && Arrays.equals(bits, other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * size + Arrays.hashCode(bits);
  }

  /**
   * Binary rendering of the blocks, lowest block first.
   */
  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < bits.length; i++) {
      if (i > 0) sb.append(", ");
      sb.append(Long.toBinaryString(bits[i]));
    }
    return sb.append(']').toString();
  }
}
