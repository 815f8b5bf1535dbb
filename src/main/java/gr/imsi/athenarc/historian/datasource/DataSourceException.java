package gr.imsi.athenarc.historian.datasource;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * A query against the remote store failed.
 */
public class DataSourceException extends HistorianExportException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
