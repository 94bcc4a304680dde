package de.bsommerfeld.pluginmarket.core.domain;

import java.util.List;

/**
 * Result of one scan of the local plugin directory. Always replaced as a
 * whole, never patched.
 */
public record LocalSnapshot(List<Plugin> enabled, List<Plugin> disabled) {

    private static final LocalSnapshot EMPTY = new LocalSnapshot(List.of(), List.of());

    public LocalSnapshot {
        enabled = List.copyOf(enabled);
        disabled = List.copyOf(disabled);
    }

    public static LocalSnapshot empty() {
        return EMPTY;
    }
}
