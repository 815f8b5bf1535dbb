package gr.imsi.athenarc.historian.datasource.connection;

/**
 * A single handle to the remote store.
 */
public interface DatabaseConnection {

    /**
     * Opens the underlying connection.
     *
     * @return this connection, ready for use
     * @throws gr.imsi.athenarc.historian.datasource.DataSourceException if the store cannot be reached
     */
    DatabaseConnection connect();

    /**
     * Health check used by the pool before a returned connection is lent out again.
     */
    boolean isValid();

    void closeConnection();

}
