package gr.imsi.athenarc.historian.export;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * Thrown when an export file or report cannot be written.
 */
public class ExportException extends HistorianExportException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
