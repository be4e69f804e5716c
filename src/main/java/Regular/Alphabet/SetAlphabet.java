package Regular.Alphabet;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Alphabet over an explicit, finite set of symbols.
 * Two set alphabets are equal when they hold the same symbols, whatever their insertion order.
 *
 * @param <I> symbol type
 */
public final class SetAlphabet<I> implements Alphabet<I> {
    private final Set<I> symbols;

    private SetAlphabet(Set<I> symbols) {
        this.symbols = Collections.unmodifiableSet(symbols);
    }

    @SafeVarargs
    public static <I> SetAlphabet<I> of(I... symbols) {
        final Set<I> set = new LinkedHashSet<>();
        Collections.addAll(set, symbols);
        return new SetAlphabet<>(set);
    }

    public static <I> SetAlphabet<I> copyOf(Iterable<? extends I> symbols) {
        final Set<I> set = new LinkedHashSet<>();
        for (I sym : symbols) {
            set.add(sym);
        }
        return new SetAlphabet<>(set);
    }

    public Set<I> symbols() {
        return symbols;
    }

    @Override
    public boolean contains(I sym) {
        return symbols.contains(sym);
    }

    @Override
    public long size() {
        return symbols.size();
    }

    @Override
    public Iterator<I> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetAlphabet)) return false;
        return symbols.equals(((SetAlphabet<?>) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
