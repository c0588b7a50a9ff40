package com.questrail.coord.internal.time;

import java.time.Instant;

/**
 * {@link WallClock} backed by {@link Instant#now()}.
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
