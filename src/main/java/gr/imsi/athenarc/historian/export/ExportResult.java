package gr.imsi.athenarc.historian.export;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import gr.imsi.athenarc.historian.domain.Tag;
import gr.imsi.athenarc.historian.tag.DroppedTag;

/**
 * What an export produced and what it left out.
 */
public class ExportResult {

    private final ExportRequest request;
    private final Path output;
    private final int rowCount;
    private final List<Tag> includedTags;
    private final List<DroppedTag> droppedTags;
    private final int skippedChunks;
    private final Duration elapsed;

    public ExportResult(ExportRequest request, Path output, int rowCount, List<Tag> includedTags,
                        List<DroppedTag> droppedTags, int skippedChunks, Duration elapsed) {
        this.request = request;
        this.output = output;
        this.rowCount = rowCount;
        this.includedTags = List.copyOf(includedTags);
        this.droppedTags = List.copyOf(droppedTags);
        this.skippedChunks = skippedChunks;
        this.elapsed = elapsed;
    }

    public ExportRequest getRequest() {
        return request;
    }

    public Path getOutput() {
        return output;
    }

    public int getRowCount() {
        return rowCount;
    }

    public List<Tag> getIncludedTags() {
        return includedTags;
    }

    public List<DroppedTag> getDroppedTags() {
        return droppedTags;
    }

    public int getSkippedChunks() {
        return skippedChunks;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "ExportResult{" +
                "output=" + output +
                ", rows=" + rowCount +
                ", includedTags=" + includedTags.size() +
                ", droppedTags=" + droppedTags.size() +
                ", skippedChunks=" + skippedChunks +
                '}';
    }
}
