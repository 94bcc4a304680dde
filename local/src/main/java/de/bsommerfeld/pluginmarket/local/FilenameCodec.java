package de.bsommerfeld.pluginmarket.local;

import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginState;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.core.mode.PluginField;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Translates between plugins and their on-disk filenames.
 *
 * <p>
 * The filename is the only metadata a local plugin carries: its fields are
 * joined with {@code _} in the order given by the mode
 * ({@link ModeProfile#fieldOrder()}) and followed by the enabled or disabled
 * suffix. Decoding reverses this, encoding produces the canonical name a
 * freshly installed plugin is stored under.
 *
 * <h3>Classification</h3>
 * A file is enabled or disabled by its suffix alone. For plain suffixes the
 * last extension is compared case-insensitively. A compound disabled suffix
 * (HotPE's {@code .hpm.off}) is matched on the full filename, and such a
 * file is never considered enabled even though its stem ends in the enabled
 * extension.
 */
public final class FilenameCodec {

    private static final char[] UNSAFE_CHARS = {' ', '/', '\\', ':', '*', '?', '"', '<', '>', '|'};

    private FilenameCodec() {
    }

    /**
     * Decides whether {@code fileName} is an enabled or disabled plugin of
     * {@code mode}.
     *
     * @return the state, or empty if the file belongs to neither
     */
    public static Optional<PluginState> classify(String fileName, ModeProfile mode) {
        if (mode.isSelector()) {
            return Optional.empty();
        }
        if (mode.hasCompoundDisabledSuffix()) {
            if (fileName.endsWith(mode.disabledSuffix())) {
                return Optional.of(PluginState.DISABLED);
            }
            return mode.enabledExtension().equals(extension(fileName))
                    ? Optional.of(PluginState.ENABLED)
                    : Optional.empty();
        }

        String ext = extension(fileName);
        if (ext.equals(mode.enabledExtension())) {
            return Optional.of(PluginState.ENABLED);
        }
        if (ext.equals(mode.disabledExtension())) {
            return Optional.of(PluginState.DISABLED);
        }
        return Optional.empty();
    }

    /**
     * Recovers plugin metadata from a filename. The returned plugin has
     * {@code file} set to {@code fileName} and an empty size; the caller
     * fills the size from the actual file length.
     *
     * @return the decoded plugin, or empty if the name has fewer tokens than
     *         the mode requires
     */
    public static Optional<Plugin> decode(String fileName, ModeProfile mode) {
        if (mode.isSelector()) {
            return Optional.empty();
        }
        String stem = stripSuffix(fileName, mode);
        String[] tokens = stem.split(ModeProfile.FIELD_DELIMITER, -1);
        if (tokens.length < mode.minTokens()) {
            return Optional.empty();
        }

        List<PluginField> order = mode.fieldOrder();
        Map<PluginField, String> values = new EnumMap<>(PluginField.class);
        for (int i = 0; i < order.size(); i++) {
            String value;
            if (i >= tokens.length) {
                value = "";
            } else if (i == order.size() - 1) {
                value = String.join(ModeProfile.FIELD_DELIMITER, Arrays.copyOfRange(tokens, i, tokens.length));
            } else {
                value = tokens[i];
            }
            values.put(order.get(i), value);
        }

        return Optional.of(new Plugin(
                values.getOrDefault(PluginField.NAME, ""),
                values.getOrDefault(PluginField.VERSION, ""),
                values.getOrDefault(PluginField.AUTHOR, ""),
                values.getOrDefault(PluginField.DESCRIPTION, ""),
                "",
                fileName,
                ""));
    }

    /**
     * Builds the canonical filename, including the enabled suffix, under
     * which {@code plugin} is installed.
     */
    public static String encode(Plugin plugin, ModeProfile mode) {
        if (mode.isSelector()) {
            throw new IllegalArgumentException("Selector mode has no filename grammar");
        }
        String description = sanitize(plugin.description());
        if (description.isEmpty() && mode.nameFillsEmptyDescription()) {
            description = plugin.name();
        }

        StringBuilder name = new StringBuilder();
        for (PluginField field : mode.fieldOrder()) {
            if (name.length() > 0) {
                name.append(ModeProfile.FIELD_DELIMITER);
            }
            name.append(switch (field) {
                case NAME -> plugin.name();
                case VERSION -> plugin.version();
                case AUTHOR -> plugin.author();
                case DESCRIPTION -> description;
            });
        }
        return name.append(mode.enabledSuffix()).toString();
    }

    /**
     * Filename after enabling: the disabled suffix is swapped for the enabled
     * one. Names without the disabled suffix are returned unchanged.
     */
    public static String toEnabledName(String fileName, ModeProfile mode) {
        if (endsWithIgnoreCase(fileName, mode.disabledSuffix())) {
            return swapSuffix(fileName, mode.disabledSuffix(), mode.enabledSuffix());
        }
        return fileName;
    }

    /**
     * Filename after disabling: the enabled suffix is swapped for the
     * disabled one. If the name lacks the enabled suffix, modes with a
     * fallback suffix append it; all others return the name unchanged.
     */
    public static String toDisabledName(String fileName, ModeProfile mode) {
        if (endsWithIgnoreCase(fileName, mode.enabledSuffix())) {
            return swapSuffix(fileName, mode.enabledSuffix(), mode.disabledSuffix());
        }
        if (mode.disableFallbackSuffix() != null) {
            return fileName + mode.disableFallbackSuffix();
        }
        return fileName;
    }

    /** Replaces characters that are not allowed in Windows filenames with {@code _}. */
    static String sanitize(String value) {
        String result = value;
        for (char c : UNSAFE_CHARS) {
            result = result.replace(c, '_');
        }
        return result;
    }

    private static String stripSuffix(String fileName, ModeProfile mode) {
        // longest first, so ".hpm.off" is not mistaken for a bare ".off"
        String longer = mode.disabledSuffix().length() >= mode.enabledSuffix().length()
                ? mode.disabledSuffix() : mode.enabledSuffix();
        String shorter = longer.equals(mode.disabledSuffix()) ? mode.enabledSuffix() : mode.disabledSuffix();
        if (endsWithIgnoreCase(fileName, longer)) {
            return fileName.substring(0, fileName.length() - longer.length());
        }
        if (endsWithIgnoreCase(fileName, shorter)) {
            return fileName.substring(0, fileName.length() - shorter.length());
        }
        return fileName;
    }

    private static String swapSuffix(String fileName, String from, String to) {
        return fileName.substring(0, fileName.length() - from.length()) + to;
    }

    private static boolean endsWithIgnoreCase(String value, String suffix) {
        return !suffix.isEmpty() && value.regionMatches(true, value.length() - suffix.length(), suffix, 0, suffix.length());
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
