package com.glimpse.common.redis;

/**
 * Handle for a channel subscription.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
