package gr.imsi.athenarc.historian.domain;

import java.util.Locale;

/**
 * A measurement stream. {@code name} is the decorated key sent to the store, {@code displayName}
 * the undecorated form used in exports. Two tags are equal when their names match ignoring case and
 * surrounding or repeated whitespace.
 */
public final class Tag {

    private final String name;
    private final String displayName;
    private final String key;

    public Tag(String name, String displayName) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name must not be empty");
        }
        this.name = name;
        this.displayName = displayName == null || displayName.isBlank() ? name : displayName;
        this.key = normalizeKey(name);
    }

    public static Tag of(String name) {
        return new Tag(name, name);
    }

    public static String normalizeKey(String name) {
        return name.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tag)) return false;
        return key.equals(((Tag) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
