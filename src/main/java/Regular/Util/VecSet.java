package Regular.Util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Set backed by an ascending, duplicate-free list.
 * Every mutator restores that ordering, so membership is a binary search and the set algebra is
 * a linear merge of two sorted sequences (see {@link Join}).
 *
 * @param <A> element type
 */
public final class VecSet<A extends Comparable<? super A>> implements Iterable<A> {
  private final ArrayList<A> inner;

  public VecSet() {
    this.inner = new ArrayList<>();
  }

  private VecSet(ArrayList<A> inner) {
    this.inner = inner;
  }

  @SafeVarargs
  public static <A extends Comparable<? super A>> VecSet<A> of(A... items) {
    final VecSet<A> result = new VecSet<>();
    Collections.addAll(result.inner, items);
    result.sortAndDedup();
    return result;
  }

  public static <A extends Comparable<? super A>> VecSet<A> copyOf(Iterable<? extends A> items) {
    final VecSet<A> result = new VecSet<>();
    result.addAll(items);
    return result;
  }

  private void sortAndDedup() {
    inner.sort(Comparator.naturalOrder());
    int write = 0;
    for (int read = 0; read < inner.size(); read++) {
      if (write == 0 || inner.get(write - 1).compareTo(inner.get(read)) != 0) {
        inner.set(write++, inner.get(read));
      }
    }
    inner.subList(write, inner.size()).clear();
  }

  public int size() {
    return inner.size();
  }

  public boolean isEmpty() {
    return inner.isEmpty();
  }

  public boolean contains(A item) {
    return Collections.binarySearch(inner, item) >= 0;
  }

  /**
   * @return true if the item was not yet present
   */
  public boolean insert(A item) {
    final int idx = Collections.binarySearch(inner, item);
    if (idx >= 0) {
      return false;
    }
    inner.add(-idx - 1, item);
    return true;
  }

  /**
   * @return true if the item was present
   */
  public boolean remove(A item) {
    final int idx = Collections.binarySearch(inner, item);
    if (idx < 0) {
      return false;
    }
    inner.remove(idx);
    return true;
  }

  /**
   * Bulk insertion: appends everything, then sorts and deduplicates once.
   */
  public void addAll(Iterable<? extends A> items) {
    if (items instanceof Collection) {
      inner.addAll((Collection<? extends A>) items);
    } else {
      for (A item : items) {
        inner.add(item);
      }
    }
    sortAndDedup();
  }

  public void retain(Predicate<? super A> keep) {
    inner.removeIf(keep.negate());
  }

  public void clear() {
    inner.clear();
  }

  public A get(int index) {
    return inner.get(index);
  }

  /**
   * @return unmodifiable ascending view
   */
  public List<A> asList() {
    return Collections.unmodifiableList(inner);
  }

  public VecSet<A> copy() {
    return new VecSet<>(new ArrayList<>(inner));
  }

  @Override
  public Iterator<A> iterator() {
    return asList().iterator();
  }

  public Iterator<A> intersection(VecSet<A> other) {
    return new Join<>(this, other, VecSet::intersectionLogic);
  }

  public Iterator<A> difference(VecSet<A> other) {
    return new Join<>(this, other, VecSet::differenceLogic);
  }

  public Iterator<A> union(VecSet<A> other) {
    return new Join<>(this, other, (left, right) -> {
      final int cmp = compare(left.peek(), right.peek());
      if (cmp < 0) {
        return left.next();
      } else if (cmp == 0) {
        right.next();
        return left.next();
      }
      return right.next();
    });
  }

  public Iterator<A> symmetricDifference(VecSet<A> other) {
    return new Join<>(this, other, (left, right) -> {
      while (true) {
        final int cmp = compare(left.peek(), right.peek());
        if (cmp < 0) {
          return left.next();
        } else if (cmp > 0) {
          return right.next();
        }
        if (left.next() == null) {
          return null; // both exhausted
        }
        right.next();
      }
    });
  }

  /**
   * Compares two cursor heads, an exhausted side ({@code null}) ordering after everything.
   * Two exhausted sides compare equal.
   */
  private static <A extends Comparable<? super A>> int compare(A left, A right) {
    if (left == null) {
      return right == null ? 0 : 1;
    }
    if (right == null) {
      return -1;
    }
    return left.compareTo(right);
  }

  static <A extends Comparable<? super A>> A intersectionLogic(Join.Cursor<A> left, Join.Cursor<A> right) {
    while (true) {
      final A l = left.peek();
      final A r = right.peek();
      if (l == null || r == null) {
        return null;
      }
      final int cmp = l.compareTo(r);
      if (cmp == 0) {
        left.next();
        return right.next();
      } else if (cmp < 0) {
        left.next();
      } else {
        right.next();
      }
    }
  }

  static <A extends Comparable<? super A>> A differenceLogic(Join.Cursor<A> left, Join.Cursor<A> right) {
    while (true) {
      final A l = left.peek();
      if (l == null) {
        return null;
      }
      final A r = right.peek();
      if (r == null) {
        return left.next();
      }
      final int cmp = l.compareTo(r);
      if (cmp < 0) {
        return left.next();
      } else if (cmp == 0) {
        left.next();
        right.next();
      } else {
        right.next();
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof VecSet)) return false;
    return inner.equals(((VecSet<?>) o).inner);
  }

  @Override
  public int hashCode() {
    return inner.hashCode();
  }

  @Override
  public String toString() {
    return inner.toString();
  }
}
