package Regular.Storage;

import java.util.ArrayList;
import java.util.List;

import Regular.Alphabet.Alphabet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Hash based storage: states are the integers {@code 0, 1, 2, ...} in allocation order and the
 * transition function is a map from {@code (state, symbol)} to the target state.
 * Works for any alphabet, including unbounded ones.
 */
public class DefaultDFAStorage<I> implements DFAStorage<Integer, I> {
    private static final int MISSING_STATE = -1;

    private final Alphabet<I> alphabet;
    private final Object2IntOpenHashMap<Key<I>> transitions;
    private int numStates;

    public DefaultDFAStorage(Alphabet<I> alphabet) {
        this.alphabet = alphabet;
        this.transitions = new Object2IntOpenHashMap<>();
        this.transitions.defaultReturnValue(MISSING_STATE);
        this.numStates = 0;
    }

    private DefaultDFAStorage(DefaultDFAStorage<I> other) {
        this.alphabet = other.alphabet;
        this.transitions = new Object2IntOpenHashMap<>(other.transitions);
        this.transitions.defaultReturnValue(MISSING_STATE);
        this.numStates = other.numStates;
    }

    @Override
    public Alphabet<I> alphabet() {
        return alphabet;
    }

    @Override
    public List<Integer> allStates() {
        final List<Integer> states = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            states.add(i);
        }
        return states;
    }

    @Override
    public List<Transition<Integer, I>> allTransitions() {
        final List<Transition<Integer, I>> result = new ArrayList<>(transitions.size());
        for (Object2IntMap.Entry<Key<I>> e : transitions.object2IntEntrySet()) {
            result.add(new Transition<>(e.getKey().state(), e.getKey().symbol(), e.getIntValue()));
        }
        return result;
    }

    @Override
    public boolean containsState(Integer state) {
        return state != null && state >= 0 && state < numStates;
    }

    @Override
    public Integer transition(Integer current, I sym) {
        if (!containsState(current) || !alphabet.contains(sym)) {
            return null;
        }
        return transitionUnchecked(current, sym);
    }

    @Override
    public Integer transitionUnchecked(Integer current, I sym) {
        final int to = transitions.getInt(new Key<>(current, sym));
        return to == MISSING_STATE ? null : to;
    }

    @Override
    public Integer addState() {
        return numStates++;
    }

    @Override
    public void addTransition(Integer from, I sym, Integer to) {
        transitions.put(new Key<>(from, sym), (int) to);
    }

    @Override
    public int size() {
        return numStates;
    }

    @Override
    public DefaultDFAStorage<I> copy() {
        return new DefaultDFAStorage<>(this);
    }

    @Override
    public String toString() {
        return "DefaultDFAStorage{states=" + numStates + ", transitions=" + transitions.size() + "}";
    }

    private record Key<I>(int state, I symbol) { }
}
