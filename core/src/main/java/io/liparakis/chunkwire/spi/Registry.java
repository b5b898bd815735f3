package io.liparakis.chunkwire.spi;

/**
 * Read-only lookup from a namespaced name to its numeric protocol id.
 * <p>
 * Implementations are loaded once and never change afterwards, so they may be shared by
 * concurrent packet builds.
 */
public interface Registry {

    /** Returned by {@link #getId(String)} for names the registry does not know. */
    int MISSING_ID = -1;

    /** Gets the numeric id for the name, or {@link #MISSING_ID}. */
    int getId(String name);

    /** Number of registered names. */
    int size();
}
