package gr.imsi.athenarc.historian.tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.historian.datasource.InMemoryConnection;
import gr.imsi.athenarc.historian.datasource.InMemoryTagStore;
import gr.imsi.athenarc.historian.datasource.connection.ConnectionPool;
import gr.imsi.athenarc.historian.domain.Tag;

public class TagResolverTest {

    private InMemoryTagStore store;
    private ConnectionPool<InMemoryConnection> pool;

    @BeforeEach
    public void setUp() {
        store = new InMemoryTagStore().add("X", 0, 1.0).add("Y", 0, 2.0);
        pool = new ConnectionPool<>("test", 2, InMemoryConnection::new, Duration.ofMillis(100));
    }

    @AfterEach
    public void tearDown() {
        pool.close();
    }

    private TagResolver<InMemoryConnection> resolver() {
        return new TagResolver<>(TagNaming.undecorated(), store, pool);
    }

    @Test
    public void testDropsMissingTagWithWarning() {
        TagResolver<InMemoryConnection> resolver = resolver();
        TagResolution resolution = resolver.validate(resolver.normalizeAll(List.of("X", "nonexistent")));

        assertEquals(List.of(Tag.of("X")), resolution.getValidTags());
        assertEquals(1, resolution.getDroppedTags().size());
        assertEquals("nonexistent", resolution.getDroppedTags().get(0).getTag().getName());
        assertEquals(DropReason.NOT_FOUND, resolution.getDroppedTags().get(0).getReason());
    }

    @Test
    public void testBatchLookupKeepsInputOrder() {
        store.withBatchLookup();
        TagResolver<InMemoryConnection> resolver = resolver();
        TagResolution resolution = resolver.validate(resolver.normalizeAll(List.of("Y", "missing", "X")));

        assertEquals(List.of(Tag.of("Y"), Tag.of("X")), resolution.getValidTags());
        assertEquals(DropReason.NOT_FOUND, resolution.getDroppedTags().get(0).getReason());
    }

    @Test
    public void testBatchLookupUsesStoredSpelling() {
        store.withBatchLookup();
        TagResolver<InMemoryConnection> resolver = resolver();
        TagResolution resolution = resolver.validate(List.of(Tag.of(" x ")));
        assertEquals("X", resolution.getValidTags().get(0).getName());
    }

    @Test
    public void testFailedLookupDropsOnlyThatTag() {
        store.failLookup("Y");
        TagResolver<InMemoryConnection> resolver = resolver();
        TagResolution resolution = resolver.validate(resolver.normalizeAll(List.of("Y", "X")));

        assertEquals(List.of(Tag.of("X")), resolution.getValidTags());
        assertEquals(DropReason.LOOKUP_FAILED, resolution.getDroppedTags().get(0).getReason());
        assertEquals(2, pool.available());
    }

    @Test
    public void testNoValidTagsIsAnError() {
        TagResolver<InMemoryConnection> resolver = resolver();
        NoValidTagsException e = assertThrows(NoValidTagsException.class,
                () -> resolver.validate(resolver.normalizeAll(List.of("a", "b"))));
        assertEquals(2, e.getDroppedTags().size());
    }

    @Test
    public void testNormalizeAllRemovesDuplicates() {
        List<Tag> tags = resolver().normalizeAll(List.of("x", " X ", "Y", "x"));
        assertEquals(2, tags.size());
        assertEquals("x", tags.get(0).getName());
    }
}
