package com.questrail.disttest.observability;

/**
 * No-op implementation of HarnessObservabilitySink.
 */
public final class NullObservabilitySink implements HarnessObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycle(HarnessLifecycleEvent event) {}

    @Override
    public void onError(HarnessErrorEvent event) {}
}
