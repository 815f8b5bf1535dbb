package gr.imsi.athenarc.historian.datasource.connection;

import gr.imsi.athenarc.historian.HistorianExportException;

public class ConnectionPoolException extends HistorianExportException {

    public ConnectionPoolException(String message) {
        super(message);
    }

    public ConnectionPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
