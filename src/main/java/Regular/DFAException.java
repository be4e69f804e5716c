package Regular;

/**
 * Failure while building or combining automata. No partially constructed automaton escapes
 * when one of these is thrown.
 */
public class DFAException extends Exception {

    public enum Kind {
        MISSING_START_STATE("Start state was not specified."),
        INVALID_STATE("State specified was not valid for this automaton."),
        SYMBOL_NOT_IN_ALPHABET("Symbol not found in alphabet."),
        STATE_NOT_FOUND("State not found."),
        OPERATION_WITH_NON_EQUAL_ALPHABETS("Attempted to perform operation with two different alphabets.");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Kind kind;

    public DFAException(Kind kind) {
        super(kind.message());
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
