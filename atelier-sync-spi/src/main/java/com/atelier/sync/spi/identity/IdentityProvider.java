package com.atelier.sync.spi.identity;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authentication collaborator. Listeners receive the new identity, or empty on sign-out.
 */
public interface IdentityProvider {

    Optional<UserIdentity> current();

    /** Registers a listener and returns a handle that unregisters it. */
    Runnable onChange(Consumer<Optional<UserIdentity>> listener);
}
