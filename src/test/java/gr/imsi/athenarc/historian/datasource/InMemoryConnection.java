package gr.imsi.athenarc.historian.datasource;

import java.util.concurrent.atomic.AtomicInteger;

import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;

/**
 * Connection to an {@link InMemoryTagStore}. Validity can be switched off to simulate a dropped
 * link.
 */
public class InMemoryConnection implements DatabaseConnection {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    private final int id = COUNTER.incrementAndGet();
    private volatile boolean valid = true;
    private volatile boolean closed;

    @Override
    public InMemoryConnection connect() {
        return this;
    }

    @Override
    public boolean isValid() {
        return valid && !closed;
    }

    @Override
    public void closeConnection() {
        closed = true;
    }

    public void invalidate() {
        valid = false;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "InMemoryConnection#" + id;
    }
}
