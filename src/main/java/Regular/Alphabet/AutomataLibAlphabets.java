package Regular.Alphabet;

import java.util.ArrayList;
import java.util.List;

import net.automatalib.alphabet.impl.Alphabets;

/**
 * Conversions between these alphabets and AutomataLib's indexed ones.
 */
public final class AutomataLibAlphabets {
    private AutomataLibAlphabets() {}

    /**
     * Indexes the symbols of a finite alphabet, in iteration order.
     *
     * @throws IllegalArgumentException if the alphabet is not finite or too large to index
     */
    public static <I> net.automatalib.alphabet.Alphabet<I> toAutomataLib(Alphabet<I> alphabet) {
        final long size = alphabet.size();
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Alphabet cannot be indexed, size: " + size);
        }
        final List<I> symbols = new ArrayList<>((int) size);
        for (I sym : alphabet) {
            symbols.add(sym);
        }
        return Alphabets.fromCollection(symbols);
    }

    public static <I> SetAlphabet<I> fromAutomataLib(net.automatalib.alphabet.Alphabet<I> alphabet) {
        return SetAlphabet.copyOf(alphabet);
    }
}
