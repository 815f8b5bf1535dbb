package gr.imsi.athenarc.historian.datasource.connection;

/**
 * A connection lent out by a {@link ConnectionPool}. Closing the lease returns the connection;
 * closing it again has no effect.
 */
public final class PooledConnection<C extends DatabaseConnection> implements AutoCloseable {

    private final ConnectionPool<C> pool;
    private final C connection;
    private boolean released;
    private boolean broken;

    PooledConnection(ConnectionPool<C> pool, C connection) {
        this.pool = pool;
        this.connection = connection;
    }

    public C get() {
        if (released) {
            throw new IllegalStateException("Connection has already been returned to the pool");
        }
        return connection;
    }

    /**
     * Reports that the connection failed with a transport or driver error, so the pool replaces it
     * on release.
     */
    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            pool.release(connection, broken);
        }
    }
}
