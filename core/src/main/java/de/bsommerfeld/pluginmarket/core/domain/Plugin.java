package de.bsommerfeld.pluginmarket.core.domain;

/**
 * Immutable view of one plugin, either a remote catalog entry or a file found
 * in the local plugin directory. Instances are never mutated; a fetch or scan
 * replaces the whole collection they belong to.
 *
 * @param name        display name, first field of every filename grammar
 * @param version     free-form version string, ordered by
 *                    {@link de.bsommerfeld.pluginmarket.core.util.VersionComparator}
 * @param author      author or publisher
 * @param description free text, empty if the source has none
 * @param size        human-readable size; for local plugins always derived
 *                    from the actual file length
 * @param file        on-disk filename, empty for catalog entries that carry
 *                    none
 * @param link        download URL, empty for local plugins
 * @param modified    last-modified timestamp as shown to the user, empty if
 *                    the source has none
 */
public record Plugin(
        String name,
        String version,
        String author,
        String description,
        String size,
        String file,
        String link,
        String modified) {

    public Plugin {
        name = orEmpty(name);
        version = orEmpty(version);
        author = orEmpty(author);
        description = orEmpty(description);
        size = orEmpty(size);
        file = orEmpty(file);
        link = orEmpty(link);
        modified = orEmpty(modified);
    }

    /** Convenience constructor for entries without a modification timestamp. */
    public Plugin(String name, String version, String author, String description,
            String size, String file, String link) {
        this(name, version, author, description, size, file, link, "");
    }

    /** Correlates a catalog entry with an installed file. */
    public PluginIdentity identity() {
        return new PluginIdentity(name, author);
    }

    /** Collapses duplicate catalog or local entries. */
    public DedupKey dedupKey() {
        return new DedupKey(name, version, author, size);
    }

    public Plugin withSize(String newSize) {
        return new Plugin(name, version, author, description, newSize, file, link, modified);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Composite of the fields that make two entries "the same upload".
     */
    public record DedupKey(String name, String version, String author, String size) {
    }
}
