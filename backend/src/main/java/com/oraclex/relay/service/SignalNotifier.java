package com.oraclex.relay.service;

import com.oraclex.relay.model.PendingSignal;

/**
 * Tells the operator that a signal is waiting for approval.
 */
public interface SignalNotifier {

    void signalPending(PendingSignal pending, long approvalWindowSeconds);
}
