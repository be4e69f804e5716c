package Regular.Alphabet;

import java.util.Iterator;
import java.util.List;

/**
 * The two-symbol alphabet {@code {false, true}}.
 */
public enum BooleanAlphabet implements Alphabet<Boolean> {
    INSTANCE;

    private static final List<Boolean> VALUES = List.of(false, true);

    @Override
    public boolean contains(Boolean sym) {
        return sym != null;
    }

    @Override
    public long size() {
        return 2;
    }

    @Override
    public Iterator<Boolean> iterator() {
        return VALUES.iterator();
    }
}
