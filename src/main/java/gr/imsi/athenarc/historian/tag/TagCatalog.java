package gr.imsi.athenarc.historian.tag;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.datasource.connection.PooledConnection;

/**
 * Searchable listing of the tags available in the store. Every search reads the list afresh.
 */
public class TagCatalog<C extends DatabaseConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(TagCatalog.class);

    private final TagStore<C> store;
    private final ConnectionPool<C> pool;

    public TagCatalog(TagStore<C> store, ConnectionPool<C> pool) {
        this.store = store;
        this.pool = pool;
    }

    /**
     * @param search case-insensitive substring, {@code null} or blank for all tags
     * @param page page number, starting at 1
     * @param perPage page size
     */
    public TagPage search(String search, int page, int perPage) {
        Preconditions.checkArgument(page >= 1, "Page must be at least 1, got %s", page);
        Preconditions.checkArgument(perPage >= 1, "Page size must be at least 1, got %s", perPage);

        List<String> allTags;
        try (PooledConnection<C> lease = pool.acquire()) {
            try {
                allTags = store.listTags(lease.get());
            } catch (DataSourceException e) {
                lease.markBroken();
                throw e;
            }
        }
        List<String> filtered = allTags;
        if (search != null && !search.isBlank()) {
            String needle = search.trim().toLowerCase(Locale.ROOT);
            filtered = allTags.stream()
                    .filter(tag -> tag.toLowerCase(Locale.ROOT).contains(needle))
                    .collect(Collectors.toList());
        }
        long start = (long) (page - 1) * perPage;
        long end = start + perPage;
        List<String> pageTags = start >= filtered.size()
                ? List.of() : filtered.subList((int) start, (int) Math.min(end, filtered.size()));
        LOG.debug("Tag search '{}' matched {} of {} tags", search, filtered.size(), allTags.size());
        return new TagPage(pageTags, filtered.size(), page, perPage, end < filtered.size());
    }
}
