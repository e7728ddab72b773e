package com.atelier.sync.spi;

/** Handle to a live remote watch. Closing twice is a no-op. */
@FunctionalInterface
public interface RemoteSubscription extends AutoCloseable {

    @Override
    void close();
}
