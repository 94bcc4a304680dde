package de.bsommerfeld.pluginmarket.core.domain;

/**
 * Whether a local plugin file is loaded by the boot environment.
 */
public enum PluginState {
    ENABLED,
    DISABLED
}
