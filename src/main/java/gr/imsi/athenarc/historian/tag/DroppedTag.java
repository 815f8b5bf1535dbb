package gr.imsi.athenarc.historian.tag;

import gr.imsi.athenarc.historian.domain.Tag;

public final class DroppedTag {

    private final Tag tag;
    private final DropReason reason;
    private final String detail;

    public DroppedTag(Tag tag, DropReason reason, String detail) {
        this.tag = tag;
        this.reason = reason;
        this.detail = detail;
    }

    public Tag getTag() {
        return tag;
    }

    public DropReason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return tag + " (" + reason + (detail == null ? "" : ": " + detail) + ")";
    }
}
