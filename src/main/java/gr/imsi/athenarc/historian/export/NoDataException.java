package gr.imsi.athenarc.historian.export;

import java.util.List;

import gr.imsi.athenarc.historian.HistorianExportException;
import gr.imsi.athenarc.historian.tag.DroppedTag;

/**
 * Thrown when none of the valid tags returned any bucket in the requested range.
 */
public class NoDataException extends HistorianExportException {

    private final List<DroppedTag> droppedTags;

    public NoDataException(List<DroppedTag> droppedTags) {
        super("No data found for any tag (" + droppedTags.size() + " dropped)");
        this.droppedTags = List.copyOf(droppedTags);
    }

    public List<DroppedTag> getDroppedTags() {
        return droppedTags;
    }
}
