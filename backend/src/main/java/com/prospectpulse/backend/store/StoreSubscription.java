package com.prospectpulse.backend.store;

/**
 * Handle to an active channel subscription. Closing it stops delivery.
 */
public interface StoreSubscription extends AutoCloseable {

    @Override
    void close();
}
