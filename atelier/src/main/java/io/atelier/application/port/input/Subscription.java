package io.atelier.application.port.input;

/**
 * Returned by the subscribe operations; removes the listener when invoked.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
