package de.bsommerfeld.pluginmarket.core.mode;

/**
 * Metadata fields that can appear in an on-disk plugin filename.
 */
public enum PluginField {
    NAME,
    VERSION,
    AUTHOR,
    DESCRIPTION
}
