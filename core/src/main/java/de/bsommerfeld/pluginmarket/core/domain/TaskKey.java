package de.bsommerfeld.pluginmarket.core.domain;

import java.util.Locale;

/**
 * Key of an in-flight operation. At most one task per key runs at a time.
 */
public record TaskKey(PluginIdentity identity, OperationKind kind) {

    public static TaskKey of(Plugin plugin, OperationKind kind) {
        return new TaskKey(plugin.identity(), kind);
    }

    @Override
    public String toString() {
        return identity + "_" + kind.name().toLowerCase(Locale.ROOT);
    }
}
