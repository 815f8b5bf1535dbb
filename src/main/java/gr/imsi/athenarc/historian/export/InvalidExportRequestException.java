package gr.imsi.athenarc.historian.export;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * Thrown for a request that cannot run: no tags, a blank tag, an empty range or a missing
 * interval. Raised before the store is contacted.
 */
public class InvalidExportRequestException extends HistorianExportException {

    public InvalidExportRequestException(String message) {
        super(message);
    }

    public InvalidExportRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
