package com.questrail.disttest.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of HarnessObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jHarnessObservabilitySink implements HarnessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jHarnessObservabilitySink.class);

    @Override
    public void onLifecycle(HarnessLifecycleEvent event) {
        switch (event.phase()) {
            case COMMUNICATION_READY, RPC_READY, BODY_FAILED, RPC_CLOSED ->
                log.info("Rank {}/{}: {} ({})",
                    event.rank(), event.worldSize(), event.phase(), event.descriptor());
            default ->
                log.debug("Rank {}/{}: {} ({})",
                    event.rank(), event.worldSize(), event.phase(), event.descriptor());
        }
    }

    @Override
    public void onError(HarnessErrorEvent event) {
        if (event.suppressed()) {
            log.warn("Rank {}: {} (suppressed by test failure)", event.rank(), event.message(), event.cause());
        }
        else {
            log.error("Rank {}: {}", event.rank(), event.message(), event.cause());
        }
    }
}
