package gr.imsi.athenarc.historian.export;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gr.imsi.athenarc.historian.domain.AggregateInterval;
import gr.imsi.athenarc.historian.domain.DateTimeUtil;
import gr.imsi.athenarc.historian.domain.TimeRange;
import gr.imsi.athenarc.historian.fetch.FetchMode;
import gr.imsi.athenarc.historian.merge.FillPolicy;

/**
 * One export: raw tags, a half-open time range, the bucket interval and the name used for the
 * output file. Fill policy and fetch mode fall back to the pipeline defaults when not set.
 */
public class ExportRequest {

    private final String name;
    private final List<String> tags;
    private final long start;
    private final long end;
    private final AggregateInterval interval;
    private final FillPolicy fillPolicy;
    private final FetchMode mode;

    private ExportRequest(Builder builder) {
        this.name = builder.name;
        this.tags = Collections.unmodifiableList(new ArrayList<>(builder.tags));
        this.start = builder.start;
        this.end = builder.end;
        this.interval = builder.interval;
        this.fillPolicy = builder.fillPolicy;
        this.mode = builder.mode;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws InvalidExportRequestException if the request cannot run
     */
    public void validate() {
        if (tags.isEmpty()) {
            throw new InvalidExportRequestException("No tags given");
        }
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new InvalidExportRequestException("Tag list contains a blank tag");
            }
        }
        if (interval == null) {
            throw new InvalidExportRequestException("No interval given");
        }
        if (start >= end) {
            throw new InvalidExportRequestException("Start " + DateTimeUtil.format(start)
                    + " must be before end " + DateTimeUtil.format(end));
        }
    }

    public String getName() {
        return name;
    }

    public List<String> getTags() {
        return tags;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public TimeRange getRange() {
        return new TimeRange(start, end);
    }

    public AggregateInterval getInterval() {
        return interval;
    }

    /**
     * @return the requested fill policy, {@code null} for the default
     */
    public FillPolicy getFillPolicy() {
        return fillPolicy;
    }

    /**
     * @return the requested fetch mode, {@code null} for the default
     */
    public FetchMode getMode() {
        return mode;
    }

    @Override
    public String toString() {
        return "ExportRequest{" +
                "name='" + name + '\'' +
                ", tags=" + tags.size() +
                ", start=" + DateTimeUtil.format(start) +
                ", end=" + DateTimeUtil.format(end) +
                ", interval=" + interval +
                '}';
    }

    public static class Builder {
        private String name = "export";
        private List<String> tags = new ArrayList<>();
        private long start;
        private long end;
        private AggregateInterval interval;
        private FillPolicy fillPolicy;
        private FetchMode mode;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public Builder start(long start) {
            this.start = start;
            return this;
        }

        public Builder end(long end) {
            this.end = end;
            return this;
        }

        public Builder interval(AggregateInterval interval) {
            this.interval = interval;
            return this;
        }

        public Builder fillPolicy(FillPolicy fillPolicy) {
            this.fillPolicy = fillPolicy;
            return this;
        }

        public Builder mode(FetchMode mode) {
            this.mode = mode;
            return this;
        }

        public ExportRequest build() {
            if (name == null || name.isBlank()) {
                throw new InvalidExportRequestException("Export name is required");
            }
            if (name.contains("/") || name.contains("\\") || name.contains("..")) {
                throw new InvalidExportRequestException("Export name must be a plain file name: " + name);
            }
            return new ExportRequest(this);
        }
    }
}
