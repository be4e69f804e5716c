package Regular.Alphabet;

import java.util.Comparator;

/**
 * Successor / predecessor arithmetic over an ordered scalar type.
 * <p>
 * Counts and distances are non-negative {@code long}s. For any {@code a}, {@code b} and
 * {@code n}:
 * <ul>
 *   <li>{@code stepsBetween(a, b) == n} iff {@code forward(a, n)} equals {@code b}</li>
 *   <li>{@code stepsBetween(a, b) == n} iff {@code backward(b, n)} equals {@code a}</li>
 *   <li>{@code stepsBetween(a, b) == -1} if {@code a > b}, or if the distance does not fit</li>
 * </ul>
 * Implementations for the supported types are in {@link Steps}.
 *
 * @param <T> scalar type
 */
public interface Step<T> extends Comparator<T> {

    /**
     * Number of successor steps from {@code start} to {@code end}.
     *
     * @return the distance, or -1 if {@code start > end} or the distance overflows a {@code long}
     */
    long stepsBetween(T start, T end);

    /**
     * The value {@code count} successors after {@code value}.
     *
     * @return the value, or {@code null} if this would overflow the type
     * @throws IllegalArgumentException if {@code count} is negative
     */
    T forward(T value, long count);

    /**
     * The value {@code count} predecessors before {@code value}.
     *
     * @return the value, or {@code null} if this would underflow the type
     * @throws IllegalArgumentException if {@code count} is negative
     */
    T backward(T value, long count);

    /** Smallest valid value. */
    T min();

    /** Largest valid value. */
    T max();

    /**
     * Whether {@code value} is a legal member of the type. Values the arithmetic never produces
     * (e.g. surrogate code units) are not.
     */
    default boolean isValid(T value) {
        return true;
    }

    /**
     * @throws ArithmeticException on overflow
     */
    default T successor(T value) {
        final T next = forward(value, 1);
        if (next == null) {
            throw new ArithmeticException("overflow in successor of " + value);
        }
        return next;
    }

    /**
     * Like {@link #successor(Object)}, but returns {@code value} itself on overflow.
     */
    default T successorSaturating(T value) {
        final T next = forward(value, 1);
        return next == null ? value : next;
    }

    /**
     * @throws ArithmeticException on underflow
     */
    default T predecessor(T value) {
        final T prev = backward(value, 1);
        if (prev == null) {
            throw new ArithmeticException("underflow in predecessor of " + value);
        }
        return prev;
    }

    /**
     * Like {@link #predecessor(Object)}, but returns {@code value} itself on underflow.
     */
    default T predecessorSaturating(T value) {
        final T prev = backward(value, 1);
        return prev == null ? value : prev;
    }
}
