package de.bsommerfeld.pluginmarket.core.domain;

/**
 * Background operations that are tracked per plugin identity.
 */
public enum OperationKind {
    INSTALL,
    UPDATE,
    ENABLE,
    DISABLE,
    /** Download to a user directory outside the boot root. */
    DOWNLOAD
}
