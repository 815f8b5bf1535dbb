package gr.imsi.athenarc.historian.tag;

import java.util.List;

/**
 * One page of a tag search. Pages are numbered from 1.
 */
public final class TagPage {

    private final List<String> tags;
    private final int total;
    private final int page;
    private final int perPage;
    private final boolean hasMore;

    public TagPage(List<String> tags, int total, int page, int perPage, boolean hasMore) {
        this.tags = List.copyOf(tags);
        this.total = total;
        this.page = page;
        this.perPage = perPage;
        this.hasMore = hasMore;
    }

    public List<String> getTags() { return tags; }
    public int getTotal() { return total; }
    public int getPage() { return page; }
    public int getPerPage() { return perPage; }
    public boolean isHasMore() { return hasMore; }
}
