package com.questrail.coord.api;

/**
 * Exclusive write access to the value guarded by an {@code RwLock}.
 *
 * <p>Releasing is the only way to replace the guarded value, so there is never
 * more than one live copy of it.</p>
 */
public interface WriteGuard<V>
{
    V value();

    /**
     * Stores {@code newValue} as the guarded value and releases write access.
     *
     * @throws IllegalStateException if the guard was already released
     */
    void release(V newValue);
}
