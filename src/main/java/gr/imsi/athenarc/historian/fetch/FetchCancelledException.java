package gr.imsi.athenarc.historian.fetch;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * Thrown when the fetching thread is interrupted before all chunks of a tag were read.
 */
public class FetchCancelledException extends HistorianExportException {

    public FetchCancelledException(String message) {
        super(message);
    }
}
