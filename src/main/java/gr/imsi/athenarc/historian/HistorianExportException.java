package gr.imsi.athenarc.historian;

/**
 * Base class of the errors raised while exporting historian data.
 */
public class HistorianExportException extends RuntimeException {

    public HistorianExportException(String message) {
        super(message);
    }

    public HistorianExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
