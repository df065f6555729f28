package com.questrail.disttest.error;

/**
 * Invalid rank, world size, rendezvous path or environment override.
 *
 * <p>Always detected locally, before any transport call. Never retried.</p>
 */
public final class ConfigurationException extends DistributedTestException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
