package gr.imsi.athenarc.historian.merge;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import gr.imsi.athenarc.historian.domain.Tag;

/**
 * Tag values aligned on bucket timestamps. Rows are ascending and unique; an empty cell is
 * {@code NaN}.
 */
public class MergedTable {

    private final long[] timestamps;
    private final List<Tag> columns;
    // columns x rows
    private final double[][] values;
    private final List<Tag> excludedTags;

    MergedTable(long[] timestamps, List<Tag> columns, double[][] values, List<Tag> excludedTags) {
        this.timestamps = timestamps;
        this.columns = Collections.unmodifiableList(columns);
        this.values = values;
        this.excludedTags = Collections.unmodifiableList(excludedTags);
    }

    public int getRowCount() {
        return timestamps.length;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public long getTimestamp(int row) {
        return timestamps[row];
    }

    public long[] getTimestamps() {
        return Arrays.copyOf(timestamps, timestamps.length);
    }

    public List<Tag> getColumns() {
        return columns;
    }

    public double getValue(int row, int column) {
        return values[column][row];
    }

    public double[] getColumn(int column) {
        return Arrays.copyOf(values[column], values[column].length);
    }

    /**
     * @return tags left out of the table because they had no buckets
     */
    public List<Tag> getExcludedTags() {
        return excludedTags;
    }

    public boolean isEmpty() {
        return timestamps.length == 0 || columns.isEmpty();
    }

    @Override
    public String toString() {
        return "MergedTable{" +
                "rows=" + timestamps.length +
                ", columns=" + columns +
                ", excludedTags=" + excludedTags +
                '}';
    }
}
