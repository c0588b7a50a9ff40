package com.questrail.coord.api;

/**
 * Shared read access to the value guarded by an {@code RwLock}.
 *
 * <p>Usable with try-with-resources; {@link #close()} releases the guard.</p>
 */
public interface ReadGuard<V> extends AutoCloseable
{
    V value();

    /**
     * Releases read access.
     *
     * @throws IllegalStateException if the guard was already released
     */
    void release();

    @Override
    default void close()
    {
        release();
    }
}
