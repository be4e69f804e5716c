package Regular.Util;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Merges two iterators through a pluggable join logic.
 * The logic sees both sides as peekable cursors, decides which to advance and what to emit;
 * returning {@code null} ends the join. Elements themselves must not be null.
 *
 * @param <T> element type
 */
public final class Join<T> implements Iterator<T> {

  /**
   * One step of a join: advance either cursor, return the next emitted element or {@code null}
   * if the join is exhausted.
   */
  @FunctionalInterface
  public interface Logic<T> {
    T next(Cursor<T> left, Cursor<T> right);
  }

  /**
   * Iterator with a one element look-ahead.
   */
  public static final class Cursor<T> {
    private final Iterator<? extends T> it;
    private T peeked;

    Cursor(Iterator<? extends T> it) {
      this.it = it;
    }

    /**
     * @return the next element without consuming it, or {@code null} at the end
     */
    public T peek() {
      if (peeked == null && it.hasNext()) {
        peeked = it.next();
      }
      return peeked;
    }

    /**
     * @return the next element, or {@code null} at the end
     */
    public T next() {
      final T result = peek();
      peeked = null;
      return result;
    }
  }

  private final Cursor<T> left;
  private final Cursor<T> right;
  private final Logic<T> logic;
  private T pending;
  private boolean done;

  public Join(Iterator<? extends T> left, Iterator<? extends T> right, Logic<T> logic) {
    this.left = new Cursor<>(left);
    this.right = new Cursor<>(right);
    this.logic = logic;
  }

  public Join(Iterable<? extends T> left, Iterable<? extends T> right, Logic<T> logic) {
    this(left.iterator(), right.iterator(), logic);
  }

  @Override
  public boolean hasNext() {
    if (pending == null && !done) {
      pending = logic.next(left, right);
      done = pending == null;
    }
    return pending != null;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final T result = pending;
    pending = null;
    return result;
  }
}
