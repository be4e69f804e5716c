package Regular.Storage;

import java.util.List;

import Regular.Alphabet.Alphabet;

/**
 * Backend holding the states and the (possibly partial) transition function of a DFA.
 * <p>
 * State handles are opaque values handed out by {@link #addState()}; a handle is valid only for
 * the storage that allocated it. Lookups through {@link #transition(Object, Object)} classify any
 * input, foreign handles and non-alphabet symbols included.
 *
 * @param <S> state handle type
 * @param <I> symbol type
 */
public interface DFAStorage<S, I> {

    Alphabet<I> alphabet();

    /**
     * @return every state allocated so far, in allocation order
     */
    List<S> allStates();

    List<Transition<S, I>> allTransitions();

    boolean containsState(S state);

    /**
     * @return the successor of {@code current} on {@code sym}, or {@code null} if there is none,
     *         {@code current} is not a state of this storage or {@code sym} is not in the alphabet
     */
    S transition(S current, I sym);

    /**
     * Successor lookup without validating its arguments.
     * <p>
     * The caller guarantees that {@code current} was allocated by this storage and that {@code sym}
     * is a member of {@link #alphabet()}. Otherwise the result is unspecified: the method may throw
     * any runtime exception or return an arbitrary value. A missing transition still yields
     * {@code null}.
     */
    default S transitionUnchecked(S current, I sym) {
        return transition(current, sym);
    }

    S addState();

    /**
     * Records {@code from --sym--> to}, replacing an earlier transition on the same pair.
     * Arguments are not validated here; {@code DFABuilder} does that.
     */
    void addTransition(S from, I sym, S to);

    /**
     * @return the number of states
     */
    int size();

    /**
     * Deep copy. Every handle of this storage denotes the same state in the copy.
     */
    DFAStorage<S, I> copy();
}
