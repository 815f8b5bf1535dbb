package gr.imsi.athenarc.historian.export;

import java.nio.file.Path;

import gr.imsi.athenarc.historian.merge.MergedTable;

/**
 * Persists a merged table. Implementations never leave a partially written file at the target.
 */
public interface ExportSink {

    /**
     * @throws ExportException if the table cannot be written
     */
    void write(MergedTable table, Path target);

    /**
     * @return extension of the files this sink writes, including the dot
     */
    String getExtension();
}
