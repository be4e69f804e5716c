package Regular;

import java.util.HashMap;
import java.util.Map;

import Regular.Alphabet.Alphabet;
import Regular.Alphabet.AutomataLibAlphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Conversions to and from AutomataLib automata, so its algorithms (minimization, equivalence
 * checks, ...) can run on a {@link DFA}.
 */
public final class AutomataLibDFAs {
    private AutomataLibDFAs() {}

    /**
     * Copies {@code dfa} into a {@link CompactDFA} over the indexed version of its alphabet.
     * Missing transitions stay undefined; the dead state is an ordinary rejecting or accepting
     * state.
     *
     * @throws IllegalArgumentException if the alphabet is not finite
     */
    public static <S extends Comparable<? super S>, I> CompactDFA<I> toCompactDFA(DFA<S, I> dfa) {
        final CompactDFA<I> out = new CompactDFA<>(AutomataLibAlphabets.toAutomataLib(dfa.alphabet()));
        final Map<S, Integer> ids = new HashMap<>();
        for (S state : dfa.allStates()) {
            final Integer id = state.equals(dfa.startState())
                    ? out.addInitialState(dfa.isAccepting(state))
                    : out.addState(dfa.isAccepting(state));
            ids.put(state, id);
        }
        for (S state : dfa.allStates()) {
            for (I sym : dfa.alphabet()) {
                final S succ = dfa.transition(state, sym);
                if (succ != null) {
                    out.setTransition(ids.get(state), sym, ids.get(succ));
                }
            }
        }
        return out;
    }

    /**
     * Imports an AutomataLib DFA over a {@link Regular.Alphabet.SetAlphabet} of its inputs.
     */
    public static <S, I> DFA<Integer, I> fromAutomataLib(net.automatalib.automaton.fsa.DFA<S, I> dfa,
                                                         net.automatalib.alphabet.Alphabet<I> inputs) throws DFAException {
        return fromAutomataLib(dfa, inputs, AutomataLibAlphabets.fromAutomataLib(inputs));
    }

    /**
     * Imports an AutomataLib DFA, reading its transitions on {@code inputs}, into a DFA over
     * {@code alphabet}. States are renumbered in the order AutomataLib enumerates them.
     *
     * @throws DFAException {@link DFAException.Kind#MISSING_START_STATE} if {@code dfa} has no
     *         initial state, {@link DFAException.Kind#SYMBOL_NOT_IN_ALPHABET} if a transition
     *         symbol is missing from {@code alphabet}
     */
    public static <S, I> DFA<Integer, I> fromAutomataLib(net.automatalib.automaton.fsa.DFA<S, I> dfa,
                                                         Iterable<I> inputs,
                                                         Alphabet<I> alphabet) throws DFAException {
        final DFABuilder<Integer, I> builder = DFABuilder.create(alphabet);
        final Map<S, Integer> ids = new HashMap<>();
        for (S state : dfa.getStates()) {
            final Integer id = builder.newState();
            ids.put(state, id);
            if (dfa.isAccepting(state)) {
                builder.acceptState(id);
            }
        }
        final S init = dfa.getInitialState();
        if (init != null) {
            builder.startState(ids.get(init));
        }
        for (S state : dfa.getStates()) {
            for (I sym : inputs) {
                final S succ = dfa.getSuccessor(state, sym);
                if (succ != null) {
                    builder.transition(ids.get(state), sym, ids.get(succ));
                }
            }
        }
        return builder.build();
    }
}
