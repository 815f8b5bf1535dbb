package gr.imsi.athenarc.historian.datasource.connection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * A fixed-size pool of connections circulating through a {@link BlockingQueue}. All connections
 * are opened up front; a failure to open any of them fails the pool.
 * <p>
 * Returned connections are health-checked. A connection that fails the check is closed and
 * replaced through the factory, so a broken handle is never lent out twice.
 *
 * @param <C> the connection type
 */
public class ConnectionPool<C extends DatabaseConnection> implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionPool.class);

    private final String name;
    private final Supplier<C> factory;
    private final Duration acquireTimeout;
    private final BlockingQueue<C> idle;
    /** Connections currently lent out, compared by identity. */
    private final Set<C> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
    private volatile boolean closed;
    private volatile int size;

    /**
     * @param name used in log messages
     * @param size number of connections, at least one
     * @param factory opens a new, connected handle; may throw on failure
     * @param acquireTimeout how long {@link #acquire()} waits for a free connection
     */
    public ConnectionPool(String name, int size, Supplier<C> factory, Duration acquireTimeout) {
        Preconditions.checkArgument(size > 0, "Pool size must be positive, got %s", size);
        Preconditions.checkNotNull(factory, "No connection factory specified.");
        Preconditions.checkArgument(acquireTimeout != null && !acquireTimeout.isNegative(),
                "Acquire timeout must not be negative");
        this.name = name;
        this.factory = factory;
        this.acquireTimeout = acquireTimeout;
        this.idle = new ArrayBlockingQueue<>(size);

        List<C> opened = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            try {
                opened.add(factory.get());
            } catch (RuntimeException e) {
                opened.forEach(this::closeQuietly);
                throw new ConnectionPoolException("Failed to open connection " + (i + 1) + " of " + size
                        + " for pool " + name, e);
            }
        }
        idle.addAll(opened);
        this.size = size;
        LOG.info("Initialized connection pool {} with {} connections", name, size);
    }

    /**
     * Borrows a connection, waiting up to the acquire timeout. Close the returned lease to give the
     * connection back.
     *
     * @throws ConnectionPoolException if the pool is closed, no connection became available in
     *         time, or the calling thread was interrupted
     */
    public PooledConnection<C> acquire() {
        if (closed) {
            throw new ConnectionPoolException("Connection pool " + name + " is closed");
        }
        C connection;
        try {
            connection = idle.poll(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionPoolException("Interrupted while waiting for a connection from pool " + name, e);
        }
        if (connection == null) {
            throw new ConnectionPoolException("Timed out after " + acquireTimeout
                    + " waiting for a connection from pool " + name);
        }
        synchronized (borrowed) {
            borrowed.add(connection);
        }
        return new PooledConnection<>(this, connection);
    }

    /**
     * Gives a borrowed connection back to the pool.
     *
     * @throws IllegalStateException if the connection is not currently borrowed from this pool
     */
    public void release(C connection) {
        release(connection, false);
    }

    /**
     * Gives a borrowed connection back to the pool. A connection reported as broken is replaced
     * without a health check.
     *
     * @throws IllegalStateException if the connection is not currently borrowed from this pool
     */
    public void release(C connection, boolean broken) {
        synchronized (borrowed) {
            if (!borrowed.remove(connection)) {
                throw new IllegalStateException("Connection is not borrowed from pool " + name);
            }
        }
        if (closed) {
            closeQuietly(connection);
            return;
        }
        if (!broken && connection.isValid()) {
            idle.offer(connection);
            return;
        }
        LOG.warn("Discarding broken connection from pool {}", name);
        closeQuietly(connection);
        replace();
    }

    private void replace() {
        C replacement;
        try {
            replacement = factory.get();
        } catch (RuntimeException e) {
            synchronized (this) {
                size--;
            }
            LOG.error("Could not replace broken connection in pool {}, {} connections left", name, size, e);
            return;
        }
        if (closed) {
            closeQuietly(replacement);
        } else {
            idle.offer(replacement);
        }
    }

    public int size() {
        return size;
    }

    public int available() {
        return idle.size();
    }

    public int borrowedCount() {
        synchronized (borrowed) {
            return borrowed.size();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes idle connections. Borrowed connections are closed when they are released.
     */
    @Override
    public void close() {
        closed = true;
        List<C> drained = new ArrayList<>();
        idle.drainTo(drained);
        drained.forEach(this::closeQuietly);
        LOG.info("Closed connection pool {}", name);
    }

    private void closeQuietly(C connection) {
        try {
            connection.closeConnection();
        } catch (RuntimeException e) {
            LOG.warn("Error closing connection of pool {}: {}", name, e.getMessage());
        }
    }
}
