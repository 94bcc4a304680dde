package de.bsommerfeld.pluginmarket.core.mode;

/**
 * Wire format of a remote plugin catalog.
 */
public enum CatalogSchema {

    /**
     * {@code {code, message, data: [{class, icon?, list: [plugin]}]}} where
     * every list entry already carries name, version, author and description.
     */
    CODED,

    /**
     * {@code {state, data: [{class, icon?, list: [{name, size, modified, link}]}]}}
     * where {@code name} is the full module filename and the metadata has to
     * be split out of it.
     */
    FILE_LISTING,

    /** No remote catalog exists for this mode. */
    NONE
}
