package Regular;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import Regular.Alphabet.Alphabet;
import Regular.DFAException.Kind;
import Regular.Storage.DFAStorage;
import Regular.Storage.StorageCreator;
import Regular.Util.VecSet;

/**
 * Boolean operations on DFAs.
 * <p>
 * Intersection, union and difference use the cross-product construction: the result has one
 * state per pair {@code (l, r)} of operand states, and steps both components independently.
 * This costs {@code O(|L| * |R| * |alphabet|)} time, so the alphabet has to be finite.
 */
public final class DFAOperations {
    public static boolean DEBUG = false;

    private DFAOperations() {}

    private enum AcceptPolicy {
        INTERSECTION {
            @Override
            boolean accepts(boolean left, boolean right) {
                return left && right;
            }
        },
        UNION {
            @Override
            boolean accepts(boolean left, boolean right) {
                return left || right;
            }
        },
        DIFFERENCE {
            @Override
            boolean accepts(boolean left, boolean right) {
                return left && !right;
            }
        };

        abstract boolean accepts(boolean left, boolean right);
    }

    private record StatePair<L, R>(L left, R right) { }

    /**
     * Swaps accept and non-accept states on a deep copy; transitions and dead state are kept.
     * <p>
     * Only a total automaton is complemented as a language: strings that run into a missing
     * transition, or contain symbols outside the alphabet, are rejected by both.
     */
    public static <S extends Comparable<? super S>, I> DFA<S, I> complement(DFA<S, I> dfa) {
        final DFAStorage<S, I> storage = dfa.storage().copy();
        final VecSet<S> accept = VecSet.copyOf(storage.allStates());
        accept.retain(s -> !dfa.isAccepting(s));
        return new DFA<>(dfa.startState(), accept, dfa.deadState(), storage);
    }

    /**
     * Accepts the strings accepted by both operands.
     */
    public static <L extends Comparable<? super L>, R extends Comparable<? super R>, T extends Comparable<? super T>, I>
    DFA<T, I> intersection(DFA<L, I> left, DFA<R, I> right, StorageCreator<T, I> creator) throws DFAException {
        return crossProduct(left, right, creator, AcceptPolicy.INTERSECTION);
    }

    /**
     * Accepts the strings accepted by either operand.
     */
    public static <L extends Comparable<? super L>, R extends Comparable<? super R>, T extends Comparable<? super T>, I>
    DFA<T, I> union(DFA<L, I> left, DFA<R, I> right, StorageCreator<T, I> creator) throws DFAException {
        return crossProduct(left, right, creator, AcceptPolicy.UNION);
    }

    /**
     * Accepts the strings accepted by {@code left} but not by {@code right}.
     */
    public static <L extends Comparable<? super L>, R extends Comparable<? super R>, T extends Comparable<? super T>, I>
    DFA<T, I> difference(DFA<L, I> left, DFA<R, I> right, StorageCreator<T, I> creator) throws DFAException {
        return crossProduct(left, right, creator, AcceptPolicy.DIFFERENCE);
    }

    private static <L extends Comparable<? super L>, R extends Comparable<? super R>, T extends Comparable<? super T>, I>
    DFA<T, I> crossProduct(DFA<L, I> left,
                           DFA<R, I> right,
                           StorageCreator<T, I> creator,
                           AcceptPolicy policy) throws DFAException {
        if (!left.alphabet().equals(right.alphabet())) {
            throw new DFAException(Kind.OPERATION_WITH_NON_EQUAL_ALPHABETS);
        }
        final List<I> symbols = symbolsOf(left.alphabet());
        final List<L> leftStates = left.allStates();
        final List<R> rightStates = right.allStates();

        if (DEBUG) {
            System.out.println("DEBUG: " + policy + " of " + leftStates.size() + " x " + rightStates.size()
                    + " states over " + symbols.size() + " symbols");
        }

        final DFABuilder<T, I> builder = DFABuilder.withStorage(creator.createStorage(left.alphabet()));
        final Map<StatePair<L, R>, T> stateMapping = new HashMap<>();
        final List<T> accept = new ArrayList<>();

        for (L l : leftStates) {
            for (R r : rightStates) {
                final T state = builder.newState();
                stateMapping.put(new StatePair<>(l, r), state);
                if (policy.accepts(left.isAccepting(l), right.isAccepting(r))) {
                    accept.add(state);
                }
            }
        }

        builder.startState(lookup(stateMapping, left.startState(), right.startState()));
        if (left.deadState() != null && right.deadState() != null) {
            builder.deadState(lookup(stateMapping, left.deadState(), right.deadState()));
        }
        builder.acceptStates(accept);

        for (L l : leftStates) {
            for (R r : rightStates) {
                final T from = stateMapping.get(new StatePair<>(l, r));
                for (I sym : symbols) {
                    // l comes from left's storage and sym from its alphabet
                    final L leftNext = left.storage().transitionUnchecked(l, sym);
                    // both alphabets are equal, checked above
                    final R rightNext = right.storage().transitionUnchecked(r, sym);
                    builder.transition(from, sym, lookup(stateMapping, leftNext, rightNext));
                }
            }
        }

        final DFA<T, I> result = builder.build();
        if (DEBUG) {
            System.out.println("DEBUG: " + policy + " result has " + result.numStates() + " states, "
                    + result.acceptStates().size() + " accepting");
        }
        return result;
    }

    /**
     * A pair with a {@code null} component, from a missing transition in a partial operand, is
     * never mapped.
     */
    private static <L, R, T> T lookup(Map<StatePair<L, R>, T> stateMapping, L left, R right) throws DFAException {
        final T state = stateMapping.get(new StatePair<>(left, right));
        if (state == null) {
            throw new DFAException(Kind.STATE_NOT_FOUND);
        }
        return state;
    }

    private static <I> List<I> symbolsOf(Alphabet<I> alphabet) {
        final long size = alphabet.size();
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Cross product needs a finite alphabet, size: " + size);
        }
        final List<I> symbols = new ArrayList<>((int) size);
        for (I sym : alphabet) {
            symbols.add(sym);
        }
        return symbols;
    }
}
