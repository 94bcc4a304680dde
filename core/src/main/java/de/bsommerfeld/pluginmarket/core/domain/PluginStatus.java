package de.bsommerfeld.pluginmarket.core.domain;

/**
 * Install state of a catalog entry relative to the enabled local plugins.
 */
public enum PluginStatus {
    NOT_INSTALLED,
    INSTALLED,
    UPDATE_AVAILABLE
}
