package com.questrail.disttest.store;

import com.questrail.disttest.error.RendezvousException;
import com.questrail.disttest.time.MonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * FileStore
 * =============================================================================
 * {@link RendezvousStore} backed by a single file on a filesystem that every
 * participant can reach.
 *
 * <h2>On-disk layout</h2>
 * The file is an append-only log of records:
 *
 * <pre>
 *   int32 keyLength | key (UTF-8) | int32 valueLength | value
 * </pre>
 *
 * The latest record for a key wins. A value length of {@code -1} with no value
 * bytes is a tombstone that removes the key. An empty or absent file is an
 * empty store.
 *
 * <h2>Concurrency</h2>
 * Every operation holds an exclusive {@link FileLock} for its whole
 * read-modify-append cycle, so counters are atomic across processes. File locks
 * are held per JVM, not per thread, so an in-process {@link ReentrantLock} keyed
 * by path serializes participants that share one JVM.
 *
 * <h2>Waiting</h2>
 * Blocking operations poll at a fixed interval against a {@link MonotonicClock}
 * deadline. The lock is released between polls.
 */
public final class FileStore implements RendezvousStore
{
    private static final Logger log = LoggerFactory.getLogger(FileStore.class);

    private static final int TOMBSTONE = -1;

    private static final ConcurrentHashMap<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();

    private final Path file;
    private final MonotonicClock clock;
    private final Duration pollInterval;

    public FileStore(Path file, MonotonicClock clock, Duration pollInterval)
    {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public void set(String key, byte[] value)
    {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        locked(channel -> {
            append(channel, key, value);
            return null;
        });
    }

    @Override
    public void remove(String key)
    {
        Objects.requireNonNull(key, "key");
        locked(channel -> {
            if (readAll(channel).containsKey(key)) {
                appendTombstone(channel, key);
            }
            return null;
        });
    }

    @Override
    public Optional<byte[]> tryGet(String key)
    {
        Objects.requireNonNull(key, "key");
        return locked(channel -> Optional.ofNullable(readAll(channel).get(key)));
    }

    @Override
    public byte[] get(String key, Duration timeout)
    {
        return poll(timeout, () -> tryGet(key), () -> "key '" + key + "'");
    }

    @Override
    public long add(String key, long delta)
    {
        Objects.requireNonNull(key, "key");
        return locked(channel -> {
            byte[] current = readAll(channel).get(key);
            long next = (current == null ? 0L : decodeCounter(key, current)) + delta;
            append(channel, key, Long.toString(next).getBytes(StandardCharsets.UTF_8));
            return next;
        });
    }

    @Override
    public boolean check(Collection<String> keys)
    {
        Objects.requireNonNull(keys, "keys");
        return locked(channel -> readAll(channel).keySet().containsAll(keys));
    }

    @Override
    public void await(Collection<String> keys, Duration timeout)
    {
        List<String> wanted = List.copyOf(keys);
        poll(timeout,
                () -> check(wanted) ? Optional.of(Boolean.TRUE) : Optional.empty(),
                () -> "keys " + wanted);
    }

    @Override
    public long awaitCount(String key, long target, Duration timeout)
    {
        return poll(timeout, () -> {
            long observed = tryGet(key).map(v -> decodeCounter(key, v)).orElse(0L);
            return observed >= target ? Optional.of(observed) : Optional.empty();
        }, () -> "counter '" + key + "' to reach " + target);
    }

    @Override
    public Map<String, byte[]> entriesWithPrefix(String prefix)
    {
        Objects.requireNonNull(prefix, "prefix");
        return locked(channel -> {
            Map<String, byte[]> matching = new LinkedHashMap<>();
            readAll(channel).forEach((k, v) -> {
                if (k.startsWith(prefix)) {
                    matching.put(k, v);
                }
            });
            return matching;
        });
    }

    /**
     * Remove the backing file. Used by the last participant to leave so that
     * the path can host a fresh rendezvous.
     */
    public void delete()
    {
        ReentrantLock jvmLock = JVM_LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        jvmLock.lock();
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted rendezvous store {}", file);
            }
        } catch (IOException e) {
            throw new RendezvousException("Could not delete rendezvous store " + file, e);
        } finally {
            jvmLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    @FunctionalInterface
    private interface ChannelAction<T> {
        T apply(FileChannel channel) throws IOException;
    }

    private <T> T locked(ChannelAction<T> action)
    {
        ReentrantLock jvmLock = JVM_LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        jvmLock.lock();
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return action.apply(channel);
        } catch (IOException e) {
            throw new RendezvousException("Rendezvous store " + file + " is unusable", e);
        } finally {
            jvmLock.unlock();
        }
    }

    private <T> T poll(Duration timeout, Supplier<Optional<T>> probe, Supplier<String> what)
    {
        Objects.requireNonNull(timeout, "timeout");
        long deadline = clock.deadlineAfter(timeout);
        while (true) {
            Optional<T> result = probe.get();
            if (result.isPresent()) {
                return result.get();
            }
            if (clock.nowNanos() - deadline >= 0) {
                throw new RendezvousException(
                        "Timed out after " + timeout.toMillis() + " ms waiting for " + what.get() + " in " + file);
            }
            try {
                Thread.sleep(pollInterval.toMillis(), (int) (pollInterval.toNanos() % 1_000_000L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RendezvousException("Interrupted while waiting for " + what.get() + " in " + file, e);
            }
        }
    }

    private Map<String, byte[]> readAll(FileChannel channel) throws IOException
    {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        long size = channel.size();
        if (size == 0) {
            return entries;
        }
        if (size > Integer.MAX_VALUE) {
            throw new RendezvousException("Rendezvous store " + file + " is too large: " + size + " bytes");
        }

        ByteBuffer buf = ByteBuffer.allocate((int) size);
        while (buf.hasRemaining()) {
            if (channel.read(buf, buf.position()) < 0) {
                break;
            }
        }
        buf.flip();

        while (buf.hasRemaining()) {
            String key = new String(readChunk(buf), StandardCharsets.UTF_8);
            entries.remove(key);
            if (peekLength(buf) == TOMBSTONE) {
                buf.getInt();
                continue;
            }
            entries.put(key, readChunk(buf));
        }
        return entries;
    }

    private int peekLength(ByteBuffer buf)
    {
        if (buf.remaining() < Integer.BYTES) {
            throw new RendezvousException("Rendezvous store " + file + " is truncated");
        }
        return buf.getInt(buf.position());
    }

    private byte[] readChunk(ByteBuffer buf)
    {
        if (buf.remaining() < Integer.BYTES) {
            throw new RendezvousException("Rendezvous store " + file + " is truncated");
        }
        int length = buf.getInt();
        if (length < 0 || length > buf.remaining()) {
            throw new RendezvousException("Rendezvous store " + file + " is corrupt (chunk length " + length + ")");
        }
        byte[] chunk = new byte[length];
        buf.get(chunk);
        return chunk;
    }

    private static void append(FileChannel channel, String key, byte[] value) throws IOException
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer record = ByteBuffer.allocate(Integer.BYTES * 2 + keyBytes.length + value.length);
        record.putInt(keyBytes.length).put(keyBytes).putInt(value.length).put(value);
        write(channel, record);
    }

    private static void appendTombstone(FileChannel channel, String key) throws IOException
    {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        ByteBuffer record = ByteBuffer.allocate(Integer.BYTES * 2 + keyBytes.length);
        record.putInt(keyBytes.length).put(keyBytes).putInt(TOMBSTONE);
        write(channel, record);
    }

    private static void write(FileChannel channel, ByteBuffer record) throws IOException
    {
        record.flip();
        long position = channel.size();
        while (record.hasRemaining()) {
            position += channel.write(record, position);
        }
        channel.force(false);
    }

    private long decodeCounter(String key, byte[] raw)
    {
        String text = new String(raw, StandardCharsets.UTF_8);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RendezvousException("Key '" + key + "' in " + file + " is not a counter: '" + text + "'", e);
        }
    }
}
