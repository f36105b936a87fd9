package com.fintech.escrow.service;

/**
 * Receives completed escrow transitions. Delivery to users (email, push,
 * in-app) lives behind this interface.
 */
public interface EscrowNotificationSink {

    void onTransition(EscrowTransitionEvent event);
}
