package gr.imsi.athenarc.historian.merge;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * Thrown when tag series cannot be aligned into one table.
 */
public class MergeException extends HistorianExportException {

    public MergeException(String message) {
        super(message);
    }
}
