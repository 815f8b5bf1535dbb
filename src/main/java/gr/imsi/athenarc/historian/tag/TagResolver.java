package gr.imsi.athenarc.historian.tag;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.historian.datasource.DataSourceException;
import gr.imsi.athenarc.historian.datasource.TagStore;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPoolException;
import gr.imsi.athenarc.historian.datasource.connection.DatabaseConnection;
import gr.imsi.athenarc.historian.datasource.connection.PooledConnection;
import gr.imsi.athenarc.historian.domain.Tag;

/**
 * Turns raw tag strings into canonical tags and checks them against the store. Tags that fail
 * the check are dropped with a warning; only an empty result is an error.
 */
public class TagResolver<C extends DatabaseConnection> {

    private static final Logger LOG = LoggerFactory.getLogger(TagResolver.class);

    private final TagNaming naming;
    private final TagStore<C> store;
    private final ConnectionPool<C> pool;

    public TagResolver(TagNaming naming, TagStore<C> store, ConnectionPool<C> pool) {
        this.naming = naming;
        this.store = store;
        this.pool = pool;
    }

    public Tag normalize(String rawTag) {
        return naming.canonicalize(rawTag);
    }

    /**
     * Normalizes every raw tag and removes duplicates, keeping the first occurrence.
     */
    public List<Tag> normalizeAll(List<String> rawTags) {
        Set<Tag> tags = new LinkedHashSet<>();
        for (String rawTag : rawTags) {
            Tag tag = normalize(rawTag);
            if (!tags.add(tag)) {
                LOG.debug("Ignoring duplicate tag {}", rawTag);
            }
        }
        return new ArrayList<>(tags);
    }

    /**
     * Keeps the tags the store knows, in input order.
     *
     * @throws NoValidTagsException if no tag is left
     */
    public TagResolution validate(List<Tag> tags) {
        TagResolution resolution = store.supportsBatchLookup() ? validateBatch(tags) : validateEach(tags);
        for (DroppedTag dropped : resolution.getDroppedTags()) {
            LOG.warn("Dropping tag {}", dropped);
        }
        if (resolution.getValidTags().isEmpty()) {
            throw new NoValidTagsException(resolution.getDroppedTags());
        }
        LOG.info("Validated {} of {} tags", resolution.getValidTags().size(), tags.size());
        return resolution;
    }

    private TagResolution validateBatch(List<Tag> tags) {
        List<Tag> valid = new ArrayList<>();
        List<DroppedTag> dropped = new ArrayList<>();
        Set<String> existing;
        try (PooledConnection<C> lease = pool.acquire()) {
            try {
                existing = store.existingTags(lease.get(),
                        tags.stream().map(Tag::getName).collect(Collectors.toList()));
            } catch (DataSourceException e) {
                lease.markBroken();
                throw e;
            }
        } catch (DataSourceException | ConnectionPoolException e) {
            for (Tag tag : tags) {
                dropped.add(new DroppedTag(tag, DropReason.LOOKUP_FAILED, e.getMessage()));
            }
            return new TagResolution(valid, dropped);
        }
        Map<String, String> storedNames = new HashMap<>();
        for (String name : existing) {
            storedNames.put(Tag.normalizeKey(name), name);
        }
        for (Tag tag : tags) {
            String storedName = storedNames.get(Tag.normalizeKey(tag.getName()));
            if (storedName == null) {
                dropped.add(new DroppedTag(tag, DropReason.NOT_FOUND, "Tag not found in database"));
            } else {
                valid.add(new Tag(storedName, naming.displayName(storedName)));
            }
        }
        return new TagResolution(valid, dropped);
    }

    private TagResolution validateEach(List<Tag> tags) {
        List<Tag> valid = new ArrayList<>();
        List<DroppedTag> dropped = new ArrayList<>();
        PooledConnection<C> lease = null;
        try {
            for (Tag tag : tags) {
                try {
                    if (lease == null) {
                        lease = pool.acquire();
                    }
                    if (store.tagExists(lease.get(), tag.getName())) {
                        valid.add(tag);
                    } else {
                        dropped.add(new DroppedTag(tag, DropReason.NOT_FOUND, "Tag not found in database"));
                    }
                } catch (DataSourceException e) {
                    dropped.add(new DroppedTag(tag, DropReason.LOOKUP_FAILED, e.getMessage()));
                    lease.markBroken();
                    lease.close();
                    lease = null;
                } catch (ConnectionPoolException e) {
                    dropped.add(new DroppedTag(tag, DropReason.LOOKUP_FAILED, e.getMessage()));
                }
            }
        } finally {
            if (lease != null) {
                lease.close();
            }
        }
        return new TagResolution(valid, dropped);
    }
}
