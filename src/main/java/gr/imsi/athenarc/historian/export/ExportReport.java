package gr.imsi.athenarc.historian.export;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.tag.DroppedTag;

/**
 * JSON summary of an export, written next to the CSV file. Tags appear under the names used in the
 * CSV header.
 */
public class ExportReport {

    private static final Logger LOG = LoggerFactory.getLogger(ExportReport.class);

    public static final String EXTENSION = ".report.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ExportReport() {}

    public static Path reportPath(Path output) {
        return output.resolveSibling(output.getFileName() + EXTENSION);
    }

    static Map<String, Object> toMap(ExportResult result) {
        ExportRequest request = result.getRequest();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("name", request.getName());
        report.put("start", DateTimeUtil.format(request.getStart()));
        report.put("end", DateTimeUtil.format(request.getEnd()));
        report.put("interval", request.getInterval().toString());
        report.put("output", result.getOutput().getFileName().toString());
        report.put("rows", result.getRowCount());
        List<String> included = new ArrayList<>();
        for (Tag tag : result.getIncludedTags()) {
            included.add(tag.getDisplayName());
        }
        report.put("includedTags", included);
        List<Map<String, String>> dropped = new ArrayList<>();
        for (DroppedTag droppedTag : result.getDroppedTags()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("tag", droppedTag.getTag().getDisplayName());
            entry.put("reason", droppedTag.getReason().name());
            entry.put("detail", droppedTag.getDetail());
            dropped.add(entry);
        }
        report.put("droppedTags", dropped);
        report.put("skippedChunks", result.getSkippedChunks());
        report.put("elapsedMillis", result.getElapsed().toMillis());
        return report;
    }

    /**
     * Writes the report of {@code result} to {@code <output>.report.json}.
     *
     * @return the report file
     */
    public static Path write(ExportResult result) {
        Path reportFile = reportPath(result.getOutput());
        try {
            mapper.writeValue(reportFile.toFile(), toMap(result));
        } catch (IOException e) {
            throw new ExportException("Failed to write report " + reportFile, e);
        }
        LOG.info("Wrote export report to {}", reportFile);
        return reportFile;
    }
}
