package gr.imsi.athenarc.historian.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.merge.MergedTable;

/**
 * Writes a merged table as CSV: a {@code timestamp} column followed by one column per tag,
 * headed by the tag's display name. The file is written next to the target and moved into place
 * when complete.
 */
public class CsvExportSink implements ExportSink {

    private static final Logger LOG = LoggerFactory.getLogger(CsvExportSink.class);

    public static final String TIMESTAMP_HEADER = "timestamp";

    private final DateTimeFormatter timestampFormatter;

    public CsvExportSink() {
        this(DateTimeUtil.EXPORT_FORMATTER);
    }

    public CsvExportSink(DateTimeFormatter timestampFormatter) {
        this.timestampFormatter = timestampFormatter;
    }

    @Override
    public void write(MergedTable table, Path target) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                writeTo(table, writer);
            }
            move(temp, target);
            LOG.info("Wrote {} rows and {} tag columns to {}", table.getRowCount(), table.getColumnCount(), target);
        } catch (IOException e) {
            deleteTemp(temp, e);
            throw new ExportException("Failed to write " + target, e);
        } catch (RuntimeException e) {
            deleteTemp(temp, e);
            throw e;
        }
    }

    void writeTo(MergedTable table, Writer writer) {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");
        CsvWriter csvWriter = new CsvWriter(writer, settings);

        String[] headers = new String[table.getColumnCount() + 1];
        headers[0] = TIMESTAMP_HEADER;
        for (int c = 0; c < table.getColumnCount(); c++) {
            headers[c + 1] = table.getColumns().get(c).getDisplayName();
        }
        csvWriter.writeHeaders(headers);

        for (int row = 0; row < table.getRowCount(); row++) {
            csvWriter.addValue(DateTimeUtil.format(table.getTimestamp(row), timestampFormatter));
            for (int c = 0; c < table.getColumnCount(); c++) {
                double value = table.getValue(row, c);
                csvWriter.addValue(Double.isNaN(value) ? null : String.valueOf(value));
            }
            csvWriter.writeValuesToRow();
        }
        csvWriter.flush();
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, Exception failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    @Override
    public String getExtension() {
        return ".csv";
    }
}
