package Regular.Storage;

/**
 * A single edge {@code from --symbol--> to} of a transition function.
 */
public record Transition<S, I>(S from, I symbol, S to) { }
