package com.questrail.disttest.config;

import com.questrail.disttest.error.ConfigurationException;
import com.questrail.disttest.error.RendezvousException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RendezvousDescriptor
 * =============================================================================
 * The URL every participant uses to locate its peers:
 *
 * <pre>
 *   file://&lt;path&gt;?rank=&lt;rank&gt;&amp;world_size=&lt;worldSize&gt;
 * </pre>
 *
 * <p>The format must match exactly; distributed runners that follow the same
 * convention build the URL with the same template. The path is carried as
 * given, it is not normalized.</p>
 *
 * <p>Built fresh per test invocation and discarded once the contexts are up.</p>
 */
public record RendezvousDescriptor(String path, int rank, int worldSize)
{
    public static final String SCHEME_PREFIX = "file://";
    private static final String URL_TEMPLATE = SCHEME_PREFIX + "%s?rank=%d&world_size=%d";

    public RendezvousDescriptor {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new ConfigurationException("Rendezvous path must not be blank");
        }
        if (worldSize < 1) {
            throw new ConfigurationException("worldSize must be >= 1, was " + worldSize);
        }
        if (rank < 0 || rank >= worldSize) {
            throw new ConfigurationException(
                    "rank must satisfy 0 <= rank < worldSize, was rank=" + rank + " worldSize=" + worldSize);
        }
    }

    public String toUrl() {
        return String.format(URL_TEMPLATE, path, rank, worldSize);
    }

    /**
     * Parse a descriptor produced by {@link #toUrl()}.
     *
     * <p>Query parameters may appear in any order; unknown parameters are
     * ignored. Missing or non-numeric {@code rank}/{@code world_size} are
     * rejected.</p>
     *
     * @throws RendezvousException if the descriptor is malformed
     */
    public static RendezvousDescriptor parse(String url)
    {
        if (url == null || !url.startsWith(SCHEME_PREFIX)) {
            throw new RendezvousException("Malformed rendezvous descriptor (expected file:// URL): " + url);
        }
        int query = url.indexOf('?');
        if (query < 0) {
            throw new RendezvousException("Malformed rendezvous descriptor (missing query): " + url);
        }

        String path = url.substring(SCHEME_PREFIX.length(), query);
        Map<String, String> params = new HashMap<>();
        for (String pair : url.substring(query + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new RendezvousException("Malformed rendezvous descriptor parameter '" + pair + "': " + url);
            }
            params.put(pair.substring(0, eq), pair.substring(eq + 1));
        }

        try {
            return new RendezvousDescriptor(
                    path,
                    requireInt(params, "rank", url),
                    requireInt(params, "world_size", url));
        } catch (ConfigurationException e) {
            throw new RendezvousException("Malformed rendezvous descriptor: " + url, e);
        }
    }

    private static int requireInt(Map<String, String> params, String name, String url)
    {
        String raw = params.get(name);
        if (raw == null) {
            throw new RendezvousException("Rendezvous descriptor is missing '" + name + "': " + url);
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new RendezvousException("Rendezvous descriptor has non-numeric '" + name + "': " + url, e);
        }
    }

    @Override
    public String toString() {
        return toUrl();
    }
}
