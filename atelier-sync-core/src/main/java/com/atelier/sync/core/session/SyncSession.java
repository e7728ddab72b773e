package com.atelier.sync.core.session;

import com.atelier.sync.spi.identity.UserIdentity;

/**
 * One signed-in period of the engine. Work started under a session whose epoch is no longer current is discarded.
 */
public record SyncSession(UserIdentity identity, long epoch) {

    public String uid() {
        return identity.uid();
    }
}
