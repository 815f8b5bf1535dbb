package gr.imsi.athenarc.historian.tag;

import java.util.List;

import gr.imsi.athenarc.historian.HistorianExportException;

/**
 * None of the requested tags passed validation.
 */
public class NoValidTagsException extends HistorianExportException {

    private final List<DroppedTag> droppedTags;

    public NoValidTagsException(List<DroppedTag> droppedTags) {
        super("No valid tags found, dropped: " + droppedTags);
        this.droppedTags = List.copyOf(droppedTags);
    }

    public List<DroppedTag> getDroppedTags() {
        return droppedTags;
    }
}
