package gr.imsi.athenarc.historian.tag;

import java.util.List;

import gr.imsi.athenarc.historian.domain.Tag;

public final class TagResolution {

    private final List<Tag> validTags;
    private final List<DroppedTag> droppedTags;

    public TagResolution(List<Tag> validTags, List<DroppedTag> droppedTags) {
        this.validTags = List.copyOf(validTags);
        this.droppedTags = List.copyOf(droppedTags);
    }

    public List<Tag> getValidTags() {
        return validTags;
    }

    public List<DroppedTag> getDroppedTags() {
        return droppedTags;
    }
}
