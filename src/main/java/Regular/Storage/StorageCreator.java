package Regular.Storage;

import Regular.Alphabet.Alphabet;

/**
 * Creates an empty {@link DFAStorage} over a given alphabet, e.g. {@code DefaultDFAStorage::new}.
 */
@FunctionalInterface
public interface StorageCreator<S, I> {
    DFAStorage<S, I> createStorage(Alphabet<I> alphabet);
}
