package Regular;

import Regular.Alphabet.Alphabet;
import Regular.DFAException.Kind;
import Regular.Storage.DFAStorage;
import Regular.Storage.DefaultDFAStorage;
import Regular.Storage.Transition;
import Regular.Util.VecSet;

/**
 * Mutable construction site for a {@link DFA}.
 * <p>
 * States are allocated with {@link #newState()}; transitions are validated as they are added,
 * start, accept and dead states when {@link #build()} is called. A builder is single use: any
 * call after {@code build()} throws {@link IllegalStateException}.
 *
 * @param <S> state type
 * @param <I> symbol type
 */
public final class DFABuilder<S extends Comparable<? super S>, I> {
    private final DFAStorage<S, I> storage;
    private final VecSet<S> acceptStates;
    private S startState;
    private S deadState;
    private boolean built;

    DFABuilder(DFAStorage<S, I> storage, S startState, VecSet<S> acceptStates, S deadState) {
        this.storage = storage;
        this.startState = startState;
        this.acceptStates = acceptStates;
        this.deadState = deadState;
    }

    /**
     * Builder over a fresh {@link DefaultDFAStorage}.
     */
    public static <I> DFABuilder<Integer, I> create(Alphabet<I> alphabet) {
        return withStorage(new DefaultDFAStorage<>(alphabet));
    }

    /**
     * Builder over a caller supplied, normally empty, backend.
     */
    public static <S extends Comparable<? super S>, I> DFABuilder<S, I> withStorage(DFAStorage<S, I> storage) {
        return new DFABuilder<>(storage, null, new VecSet<>(), null);
    }

    public Alphabet<I> alphabet() {
        checkNotBuilt();
        return storage.alphabet();
    }

    public S newState() {
        checkNotBuilt();
        return storage.addState();
    }

    /**
     * Records {@code from --sym--> to}, replacing any earlier transition from {@code from} on
     * {@code sym}.
     *
     * @throws DFAException {@link Kind#INVALID_STATE} if either state was not allocated by this
     *         builder, otherwise {@link Kind#SYMBOL_NOT_IN_ALPHABET} if {@code sym} is not in the
     *         alphabet
     */
    public DFABuilder<S, I> transition(S from, I sym, S to) throws DFAException {
        checkNotBuilt();
        if (!storage.containsState(from) || !storage.containsState(to)) {
            throw new DFAException(Kind.INVALID_STATE);
        }
        if (!storage.alphabet().contains(sym)) {
            throw new DFAException(Kind.SYMBOL_NOT_IN_ALPHABET);
        }
        storage.addTransition(from, sym, to);
        return this;
    }

    /**
     * Adds transitions in order, stopping at the first invalid one. Transitions before it stay
     * recorded.
     */
    public DFABuilder<S, I> transitions(Iterable<Transition<S, I>> transitions) throws DFAException {
        for (Transition<S, I> t : transitions) {
            transition(t.from(), t.symbol(), t.to());
        }
        return this;
    }

    /**
     * Adds to the accept set.
     */
    public DFABuilder<S, I> acceptStates(Iterable<? extends S> states) {
        checkNotBuilt();
        acceptStates.addAll(states);
        return this;
    }

    public DFABuilder<S, I> acceptState(S state) {
        checkNotBuilt();
        acceptStates.insert(state);
        return this;
    }

    public DFABuilder<S, I> startState(S state) {
        checkNotBuilt();
        this.startState = state;
        return this;
    }

    /**
     * @param state the dead state, or {@code null} to clear it
     */
    public DFABuilder<S, I> deadState(S state) {
        checkNotBuilt();
        this.deadState = state;
        return this;
    }

    /**
     * Validates and freezes the automaton. The builder cannot be used afterwards.
     *
     * @throws DFAException {@link Kind#MISSING_START_STATE} if no start state was given,
     *         {@link Kind#INVALID_STATE} if the start, dead or any accept state is not a state of
     *         this builder
     */
    public DFA<S, I> build() throws DFAException {
        checkNotBuilt();
        if (startState == null) {
            throw new DFAException(Kind.MISSING_START_STATE);
        }
        if (!storage.containsState(startState)) {
            throw new DFAException(Kind.INVALID_STATE);
        }
        if (deadState != null && !storage.containsState(deadState)) {
            throw new DFAException(Kind.INVALID_STATE);
        }
        for (S state : acceptStates) {
            if (!storage.containsState(state)) {
                throw new DFAException(Kind.INVALID_STATE);
            }
        }
        built = true;
        return new DFA<>(startState, acceptStates, deadState, storage);
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("DFABuilder was already consumed by build()");
        }
    }
}
