package com.atelier.sync.testkit;

import com.atelier.sync.spi.identity.IdentityProvider;
import com.atelier.sync.spi.identity.UserIdentity;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/** Identity provider whose identity is switched by the test. Listeners run on the calling thread. */
public class SwitchableIdentityProvider implements IdentityProvider {
    private final AtomicReference<UserIdentity> current = new AtomicReference<>();
    private final List<Consumer<Optional<UserIdentity>>> listeners = new CopyOnWriteArrayList<>();

    public SwitchableIdentityProvider() {}

    public SwitchableIdentityProvider(UserIdentity initial) {
        current.set(initial);
    }

    @Override
    public Optional<UserIdentity> current() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public Runnable onChange(Consumer<Optional<UserIdentity>> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void signIn(UserIdentity identity) {
        current.set(identity);
        listeners.forEach(l -> l.accept(Optional.of(identity)));
    }

    public void signOut() {
        current.set(null);
        listeners.forEach(l -> l.accept(Optional.empty()));
    }
}
