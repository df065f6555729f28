package com.questrail.disttest.rpc;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * A named participant of an RPC context.
 *
 * @param address UDP address for the {@code DATAGRAM} backend; {@code null} otherwise
 */
public record WorkerInfo(String name, int rank, InetSocketAddress address)
{
    public WorkerInfo {
        Objects.requireNonNull(name, "name");
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
    }

    public Optional<InetSocketAddress> datagramAddress() {
        return Optional.ofNullable(address);
    }
}
