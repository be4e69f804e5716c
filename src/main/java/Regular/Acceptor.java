package Regular;

/**
 * Anything that decides membership of symbol strings.
 */
@FunctionalInterface
public interface Acceptor<I> {
    boolean accept(Iterable<? extends I> string);

    /**
     * Same as {@code acceptor.accept(string)}, read from the input's side.
     */
    static <I> boolean isAcceptedBy(Iterable<? extends I> string, Acceptor<? super I> acceptor) {
        return acceptor.accept(string);
    }
}
