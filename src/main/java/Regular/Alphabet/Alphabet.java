package Regular.Alphabet;

/**
 * A set of symbols.
 * <p>
 * Iteration yields every symbol exactly once, in no particular order. Implementations must
 * provide structural {@code equals}/{@code hashCode}: automata can only be combined when their
 * alphabets are equal.
 *
 * @param <I> symbol type
 */
public interface Alphabet<I> extends Iterable<I> {
    int UNBOUNDED = -1;

    /**
     * Return {@code true} if the given symbol is a member of this alphabet.
     */
    boolean contains(I sym);

    /**
     * @return the number of symbols, or {@link #UNBOUNDED} if that number is infinite or does not
     *         fit in a non-negative {@code long}
     */
    long size();

    default boolean isFinite() {
        return size() != UNBOUNDED;
    }
}
