package gr.imsi.athenarc.historian.tag;

import java.util.Locale;

import gr.imsi.athenarc.historian.domain.Tag;

/**
 * Decoration rules for tag names. Tags are queried with a namespace prefix and a value suffix and
 * presented without them. A file suffix left over from exported file names is removed first.
 */
public class TagNaming {

    private final String prefix;
    private final String suffix;
    private final String fileSuffix;

    public TagNaming(String prefix, String suffix, String fileSuffix) {
        this.prefix = prefix == null ? "" : prefix.trim();
        this.suffix = suffix == null ? "" : suffix.trim();
        this.fileSuffix = fileSuffix == null ? "" : fileSuffix.trim();
    }

    public static TagNaming undecorated() {
        return new TagNaming("", "", "");
    }

    /**
     * @throws IllegalArgumentException if {@code rawTag} is blank or only consists of decoration
     */
    public Tag canonicalize(String rawTag) {
        if (rawTag == null || rawTag.isBlank()) {
            throw new IllegalArgumentException("Tag must not be empty");
        }
        String name = rawTag.trim();
        if (endsWithIgnoreCase(name, fileSuffix)) {
            name = name.substring(0, name.length() - fileSuffix.length()).trim();
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Tag must not be empty: '" + rawTag + "'");
        }
        if (!startsWithIgnoreCase(name, prefix)) {
            name = prefix + name;
        }
        if (!endsWithIgnoreCase(name, suffix)) {
            name = name + suffix;
        }
        return new Tag(name, displayName(name));
    }

    /**
     * Strips the prefix and suffix from a stored tag name.
     */
    public String displayName(String name) {
        String display = name.trim();
        if (startsWithIgnoreCase(display, prefix) && display.length() > prefix.length()) {
            display = display.substring(prefix.length());
        }
        if (endsWithIgnoreCase(display, suffix) && display.length() > suffix.length()) {
            display = display.substring(0, display.length() - suffix.length());
        }
        return display;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getSuffix() {
        return suffix;
    }

    private static boolean startsWithIgnoreCase(String s, String start) {
        return !start.isEmpty() && s.toUpperCase(Locale.ROOT).startsWith(start.toUpperCase(Locale.ROOT));
    }

    private static boolean endsWithIgnoreCase(String s, String end) {
        return !end.isEmpty() && s.toUpperCase(Locale.ROOT).endsWith(end.toUpperCase(Locale.ROOT));
    }
}
