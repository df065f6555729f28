package com.questrail.disttest.observability;

/**
 * Receives lifecycle and error events from the rendezvous harness.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface HarnessObservabilitySink {
    /**
     * Called once per lifecycle phase the harness enters or completes.
     * @param event the phase and the identity it concerns
     */
    void onLifecycle(HarnessLifecycleEvent event);

    /**
     * Called when a phase fails, including teardown failures that are
     * attached to a primary test failure rather than surfaced.
     * @param event the error event
     */
    void onError(HarnessErrorEvent event);
}
