package com.questrail.disttest.config;

import com.questrail.disttest.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Backend selector for the RPC context.
 *
 * <ul>
 *   <li>{@link #PROCESS_GROUP} - membership is carried entirely by the
 *       communication context's store. Default.</li>
 *   <li>{@link #DATAGRAM} - each worker additionally binds a UDP endpoint and
 *       proves reachability to every peer before the context is usable.</li>
 * </ul>
 */
public enum RpcBackend
{
    PROCESS_GROUP,
    DATAGRAM;

    public static final RpcBackend DEFAULT = PROCESS_GROUP;

    /**
     * Case-insensitive lookup used for environment overrides.
     *
     * @throws ConfigurationException if {@code raw} names no known backend
     */
    public static RpcBackend parse(String raw)
    {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("RPC backend must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RpcBackend backend : values()) {
            if (backend.name().equals(normalized)) {
                return backend;
            }
        }
        throw new ConfigurationException("Unknown RPC backend '" + raw + "', expected one of "
                + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
    }
}
