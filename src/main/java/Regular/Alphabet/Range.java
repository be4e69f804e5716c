package Regular.Alphabet;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Alphabet of all values in a closed interval {@code [start, end]}, enumerated with a
 * {@link Step}. A range is either empty or has {@code start <= end}.
 *
 * @param <T> symbol type
 */
public final class Range<T> implements Alphabet<T> {
    private final Step<T> step;
    private final T start; // null iff empty
    private final T end;

    private Range(Step<T> step, T start, T end) {
        this.step = Objects.requireNonNull(step);
        this.start = start;
        this.end = end;
    }

    public static <T> Range<T> empty(Step<T> step) {
        return new Range<>(step, null, null);
    }

    /**
     * {@code [start, end]}; empty if {@code start > end}.
     *
     * @throws IllegalArgumentException if either endpoint is not a valid value of the step
     */
    public static <T> Range<T> inclusive(Step<T> step, T start, T end) {
        requireValid(step, start);
        requireValid(step, end);
        if (step.compare(start, end) > 0) {
            return empty(step);
        }
        return new Range<>(step, start, end);
    }

    /**
     * {@code [start, end)}; empty if {@code start >= end}.
     *
     * @throws IllegalArgumentException if either endpoint is not a valid value of the step
     */
    public static <T> Range<T> exclusive(Step<T> step, T start, T end) {
        requireValid(step, start);
        requireValid(step, end);
        if (step.compare(start, end) >= 0) {
            return empty(step);
        }
        return new Range<>(step, start, step.predecessor(end));
    }

    /** {@code [start, max]}. */
    public static <T> Range<T> from(Step<T> step, T start) {
        return inclusive(step, start, step.max());
    }

    /** {@code [min, end)}. */
    public static <T> Range<T> to(Step<T> step, T end) {
        return exclusive(step, step.min(), end);
    }

    /** {@code [min, end]}. */
    public static <T> Range<T> toInclusive(Step<T> step, T end) {
        return inclusive(step, step.min(), end);
    }

    /** Every valid value of the type. */
    public static <T> Range<T> full(Step<T> step) {
        return new Range<>(step, step.min(), step.max());
    }

    /** Shorthand for {@code inclusive(Steps.CHARACTERS, from, to)}. */
    public static Range<Character> characters(char from, char to) {
        return inclusive(Steps.CHARACTERS, from, to);
    }

    /** Shorthand for {@code inclusive(Steps.INTEGERS, from, to)}. */
    public static Range<Integer> integers(int from, int to) {
        return inclusive(Steps.INTEGERS, from, to);
    }

    private static <T> void requireValid(Step<T> step, T value) {
        if (value == null || !step.isValid(value)) {
            throw new IllegalArgumentException("Not a valid " + step + " value: " + value);
        }
    }

    public Step<T> step() {
        return step;
    }

    public boolean isEmpty() {
        return start == null;
    }

    /**
     * @return the first value, or {@code null} if empty
     */
    public T start() {
        return start;
    }

    /**
     * @return the last value, or {@code null} if empty
     */
    public T end() {
        return end;
    }

    @Override
    public boolean contains(T sym) {
        if (isEmpty() || sym == null) {
            return false;
        }
        return step.compare(start, sym) <= 0 && step.compare(sym, end) <= 0 && step.isValid(sym);
    }

    @Override
    public long size() {
        if (isEmpty()) {
            return 0;
        }
        final long steps = step.stepsBetween(start, end);
        if (steps < 0 || steps == Long.MAX_VALUE) {
            return UNBOUNDED;
        }
        return steps + 1;
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private T next = start;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public T next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                final T current = next;
                // forward() is null at the top of the type
                final T following = step.compare(current, end) >= 0 ? null : step.forward(current, 1);
                next = following != null && step.compare(following, end) <= 0 ? following : null;
                return current;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Range)) return false;
        final Range<?> other = (Range<?>) o;
        return step.equals(other.step) && Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, start, end);
    }

    @Override
    public String toString() {
        return isEmpty() ? "[]" : "[" + start + ", " + end + "]";
    }
}
