package Regular.Storage;

import java.util.ArrayList;
import java.util.List;

import Regular.Alphabet.Alphabet;
import Regular.Alphabet.AutomataLibAlphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Dense storage for small finite alphabets: the transition function is AutomataLib's
 * {@link CompactDFA} array of {@code states * |alphabet|} successor slots. States are the
 * integers {@code 0, 1, 2, ...} in allocation order. Acceptance is kept by the {@code DFA},
 * so every state of the backing automaton is rejecting.
 */
public class CompactDFAStorage<I> implements DFAStorage<Integer, I> {
    private final Alphabet<I> alphabet;
    private final net.automatalib.alphabet.Alphabet<I> indexed;
    private final CompactDFA<I> dfa;

    /**
     * @throws IllegalArgumentException if the alphabet is not finite
     */
    public CompactDFAStorage(Alphabet<I> alphabet) {
        this(alphabet, AutomataLibAlphabets.toAutomataLib(alphabet));
    }

    private CompactDFAStorage(Alphabet<I> alphabet, net.automatalib.alphabet.Alphabet<I> indexed) {
        this.alphabet = alphabet;
        this.indexed = indexed;
        this.dfa = new CompactDFA<>(indexed);
    }

    @Override
    public Alphabet<I> alphabet() {
        return alphabet;
    }

    @Override
    public List<Integer> allStates() {
        return new ArrayList<>(dfa.getStates());
    }

    @Override
    public List<Transition<Integer, I>> allTransitions() {
        final List<Transition<Integer, I>> result = new ArrayList<>();
        for (Integer state : dfa.getStates()) {
            for (I sym : indexed) {
                final Integer succ = dfa.getSuccessor(state, sym);
                if (succ != null) {
                    result.add(new Transition<>(state, sym, succ));
                }
            }
        }
        return result;
    }

    @Override
    public boolean containsState(Integer state) {
        return state != null && state >= 0 && state < dfa.size();
    }

    @Override
    public Integer transition(Integer current, I sym) {
        if (!containsState(current) || !indexed.containsSymbol(sym)) {
            return null;
        }
        return dfa.getSuccessor(current, sym);
    }

    /**
     * Skips validation; a foreign handle or symbol may throw an index or lookup exception.
     */
    @Override
    public Integer transitionUnchecked(Integer current, I sym) {
        return dfa.getSuccessor(current, sym);
    }

    @Override
    public Integer addState() {
        return dfa.addState(false);
    }

    @Override
    public void addTransition(Integer from, I sym, Integer to) {
        dfa.setTransition(from, sym, to);
    }

    @Override
    public int size() {
        return dfa.size();
    }

    @Override
    public CompactDFAStorage<I> copy() {
        final CompactDFAStorage<I> result = new CompactDFAStorage<>(alphabet, indexed);
        for (int i = 0; i < dfa.size(); i++) {
            result.addState();
        }
        for (Transition<Integer, I> t : allTransitions()) {
            result.addTransition(t.from(), t.symbol(), t.to());
        }
        return result;
    }

    @Override
    public String toString() {
        return "CompactDFAStorage{states=" + dfa.size() + ", inputs=" + indexed.size() + "}";
    }
}
