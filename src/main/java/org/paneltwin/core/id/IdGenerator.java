package org.paneltwin.core.id;

/**
 * Source of store-unique string identifiers.
 */
public interface IdGenerator {

    /**
     * Returns the next identifier for a prefix, for example {@code MCB_3}.
     *
     * @param prefix non-blank identifier prefix.
     * @return identifier never handed out before by this generator.
     */
    String next(String prefix);

    /**
     * Registers an identifier created elsewhere (for example restored from a snapshot) so
     * that later calls to {@link #next(String)} never collide with it.
     *
     * @param id identifier to reserve.
     */
    void reserve(String id);

    /**
     * Forgets every issued and reserved identifier.
     */
    void reset();

    /**
     * Factory method for the default sequential implementation.
     */
    static IdGenerator sequential() {
        return new SequentialIdGenerator();
    }
}
