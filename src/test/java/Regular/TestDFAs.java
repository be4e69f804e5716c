package Regular;

import Regular.Alphabet.Alphabet;
import Regular.Alphabet.BooleanAlphabet;
import Regular.Alphabet.Range;
import Regular.Storage.Transition;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared automata and string helpers for the tests.
 */
final class TestDFAs {
    static final Range<Character> ABC = Range.characters('a', 'c');

    private TestDFAs() {}

    static List<Character> chars(String s) {
        final List<Character> out = new ArrayList<>(s.length());
        for (char c : s.toCharArray()) {
            out.add(c);
        }
        return out;
    }

    /**
     * '0' is false, '1' is true, anything else is skipped.
     */
    static List<Boolean> bits(String s) {
        final List<Boolean> out = new ArrayList<>(s.length());
        for (char c : s.toCharArray()) {
            if (c == '0') {
                out.add(false);
            } else if (c == '1') {
                out.add(true);
            }
        }
        return out;
    }

    /**
     * Accepts a*b*c*. State 3 is the dead state and has no outgoing transitions.
     * <pre>
     * 0 -a-> 0   0 -b-> 1   0 -c-> 2
     * 1 -a-> 3   1 -b-> 1   1 -c-> 2
     * 2 -a-> 3   2 -b-> 3   2 -c-> 2
     * </pre>
     */
    static DFA<Integer, Character> simpleDFA() throws DFAException {
        return simpleBuilder().build();
    }

    /**
     * {@link #simpleDFA()} with self loops on the dead state, so every transition is defined.
     */
    static DFA<Integer, Character> simpleTotalDFA() throws DFAException {
        final DFABuilder<Integer, Character> builder = simpleBuilder();
        for (char c = 'a'; c <= 'c'; c++) {
            builder.transition(3, c, 3);
        }
        return builder.build();
    }

    private static DFABuilder<Integer, Character> simpleBuilder() throws DFAException {
        final DFABuilder<Integer, Character> builder = DFABuilder.create(ABC);
        final Integer s0 = builder.newState();
        final Integer s1 = builder.newState();
        final Integer s2 = builder.newState();
        final Integer dead = builder.newState();

        builder.transitions(List.of(
                new Transition<>(s0, 'a', s0),
                new Transition<>(s0, 'b', s1),
                new Transition<>(s0, 'c', s2),
                new Transition<>(s1, 'a', dead),
                new Transition<>(s1, 'b', s1),
                new Transition<>(s1, 'c', s2),
                new Transition<>(s2, 'a', dead),
                new Transition<>(s2, 'b', dead),
                new Transition<>(s2, 'c', s2)));

        return builder.startState(s0)
                .deadState(dead)
                .acceptStates(List.of(s0, s1, s2));
    }

    /**
     * Accepts boolean strings containing two consecutive {@code false}. The accepting sink doubles
     * as dead state.
     */
    static DFA<Integer, Boolean> containsTwoFalse() throws DFAException {
        final DFABuilder<Integer, Boolean> builder = DFABuilder.create(BooleanAlphabet.INSTANCE);
        final Integer q0 = builder.newState();
        final Integer q1 = builder.newState();
        final Integer q2 = builder.newState();

        builder.transition(q0, false, q1)
                .transition(q0, true, q0)
                .transition(q1, false, q2)
                .transition(q1, true, q0)
                .transition(q2, false, q2)
                .transition(q2, true, q2);

        return builder.startState(q0)
                .acceptState(q2)
                .deadState(q2)
                .build();
    }

    /**
     * Accepts boolean strings with an even number of {@code true}.
     */
    static DFA<Integer, Boolean> containsEvenTrues() throws DFAException {
        final DFABuilder<Integer, Boolean> builder = DFABuilder.create(BooleanAlphabet.INSTANCE);
        final Integer q0 = builder.newState();
        final Integer q1 = builder.newState();

        builder.transition(q0, false, q0)
                .transition(q0, true, q1)
                .transition(q1, false, q1)
                .transition(q1, true, q0);

        return builder.startState(q0)
                .acceptState(q0)
                .build();
    }

    /**
     * A random total DFA: every transition target uniform, each state accepting with probability
     * one half, state 0 initial.
     */
    static DFA<Integer, Integer> randomDFA(Random r, int size, Alphabet<Integer> alphabet) throws DFAException {
        final DFABuilder<Integer, Integer> builder = DFABuilder.create(alphabet);
        final List<Integer> states = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            states.add(builder.newState());
        }
        for (Integer from : states) {
            for (Integer sym : alphabet) {
                builder.transition(from, sym, states.get(r.nextInt(size)));
            }
            if (r.nextBoolean()) {
                builder.acceptState(from);
            }
        }
        return builder.startState(states.get(0)).build();
    }

    /**
     * Every string over {@code symbols} of length at most {@code maxLength}.
     */
    static <I> List<List<I>> allStrings(Iterable<I> symbols, int maxLength) {
        final List<List<I>> result = new ArrayList<>();
        List<List<I>> layer = new ArrayList<>();
        layer.add(new ArrayList<>());
        result.addAll(layer);
        for (int len = 1; len <= maxLength; len++) {
            final List<List<I>> next = new ArrayList<>();
            for (List<I> prefix : layer) {
                for (I sym : symbols) {
                    final List<I> word = new ArrayList<>(prefix);
                    word.add(sym);
                    next.add(word);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
