package Regular;

import java.util.List;

import Regular.Alphabet.Alphabet;
import Regular.Storage.DFAStorage;
import Regular.Storage.DefaultDFAStorage;
import Regular.Storage.StorageCreator;
import Regular.Storage.Transition;
import Regular.Util.VecSet;

/**
 * An immutable deterministic finite automaton over a {@link DFAStorage} backend.
 * <p>
 * Start, accept and dead states are all valid states of the storage. Instances are produced by
 * {@link DFABuilder#build()} or by the operations in {@link DFAOperations}; none of the methods
 * here modify the automaton.
 *
 * @param <S> state type
 * @param <I> symbol type
 */
public final class DFA<S extends Comparable<? super S>, I> implements Acceptor<I> {
    private final S startState;
    private final VecSet<S> acceptStates;
    private final S deadState;
    private final DFAStorage<S, I> storage;

    DFA(S startState, VecSet<S> acceptStates, S deadState, DFAStorage<S, I> storage) {
        this.startState = startState;
        this.acceptStates = acceptStates;
        this.deadState = deadState;
        this.storage = storage;
    }

    public S startState() {
        return startState;
    }

    /**
     * @return ascending, unmodifiable list of accept states
     */
    public List<S> acceptStates() {
        return acceptStates.asList();
    }

    /**
     * A state from which no accept state is reachable; reading stops once it is entered.
     *
     * @return the dead state, or {@code null} if none was configured
     */
    public S deadState() {
        return deadState;
    }

    public Alphabet<I> alphabet() {
        return storage.alphabet();
    }

    public int numStates() {
        return storage.size();
    }

    public List<S> allStates() {
        return storage.allStates();
    }

    public List<Transition<S, I>> allTransitions() {
        return storage.allTransitions();
    }

    public boolean containsState(S state) {
        return storage.containsState(state);
    }

    /**
     * @return the successor, or {@code null} if undefined
     */
    public S transition(S current, I sym) {
        return storage.transition(current, sym);
    }

    public boolean isAccepting(S state) {
        return acceptStates.contains(state);
    }

    DFAStorage<S, I> storage() {
        return storage;
    }

    /**
     * Runs the automaton on {@code string}. A symbol outside the alphabet, or a missing
     * transition, rejects immediately.
     */
    @Override
    public boolean accept(Iterable<? extends I> string) {
        S current = startState;
        for (I sym : string) {
            if (deadState != null && deadState.equals(current)) {
                break;
            }
            current = storage.transition(current, sym);
            if (current == null) {
                return false;
            }
        }
        return acceptStates.contains(current);
    }

    /**
     * Like {@link #accept(Iterable)}, but without checking the symbols.
     * <p>
     * Every symbol of {@code string} must be a member of {@link #alphabet()}; otherwise the
     * result is unspecified and the backend may throw.
     */
    public boolean acceptUnchecked(Iterable<? extends I> string) {
        S current = startState;
        for (I sym : string) {
            if (deadState != null && deadState.equals(current)) {
                break;
            }
            // current comes from this storage, sym is an alphabet member by contract
            current = storage.transitionUnchecked(current, sym);
            if (current == null) {
                return false;
            }
        }
        return acceptStates.contains(current);
    }

    /**
     * @return a builder over a deep copy of this automaton, pre-populated with its start,
     *         accept and dead states
     */
    public DFABuilder<S, I> toBuilder() {
        return new DFABuilder<>(storage.copy(), startState, acceptStates.copy(), deadState);
    }

    public DFA<S, I> complement() {
        return DFAOperations.complement(this);
    }

    public DFA<Integer, I> intersection(DFA<?, I> other) throws DFAException {
        return intersection(other, DefaultDFAStorage::new);
    }

    public <T extends Comparable<? super T>> DFA<T, I> intersection(DFA<?, I> other,
                                                                   StorageCreator<T, I> creator) throws DFAException {
        return DFAOperations.intersection(this, other, creator);
    }

    public DFA<Integer, I> union(DFA<?, I> other) throws DFAException {
        return union(other, DefaultDFAStorage::new);
    }

    public <T extends Comparable<? super T>> DFA<T, I> union(DFA<?, I> other,
                                                            StorageCreator<T, I> creator) throws DFAException {
        return DFAOperations.union(this, other, creator);
    }

    public DFA<Integer, I> difference(DFA<?, I> other) throws DFAException {
        return difference(other, DefaultDFAStorage::new);
    }

    public <T extends Comparable<? super T>> DFA<T, I> difference(DFA<?, I> other,
                                                                 StorageCreator<T, I> creator) throws DFAException {
        return DFAOperations.difference(this, other, creator);
    }

    @Override
    public String toString() {
        return "DFA{start=" + startState + ", accept=" + acceptStates + ", dead=" + deadState
                + ", storage=" + storage + "}";
    }
}
