package gr.imsi.athenarc.historian.datasource;

import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;

/**
 * A tag store together with the pool of connections its queries run on.
 */
public class HistorianDataSource<C extends DatabaseConnection> implements AutoCloseable {

    private final TagStore<C> store;
    private final ConnectionPool<C> pool;

    public HistorianDataSource(TagStore<C> store, ConnectionPool<C> pool) {
        this.store = store;
        this.pool = pool;
    }

    public TagStore<C> getStore() {
        return store;
    }

    public ConnectionPool<C> getPool() {
        return pool;
    }

    @Override
    public void close() {
        pool.close();
    }
}
