package de.bsommerfeld.pluginmarket.core.mode;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static de.bsommerfeld.pluginmarket.core.mode.PluginField.AUTHOR;
import static de.bsommerfeld.pluginmarket.core.mode.PluginField.DESCRIPTION;
import static de.bsommerfeld.pluginmarket.core.mode.PluginField.NAME;
import static de.bsommerfeld.pluginmarket.core.mode.PluginField.VERSION;

/**
 * Static rules of one plugin ecosystem. Every per-ecosystem branch in the
 * application (endpoints, plugin folder, file extensions, filename grammar,
 * display strings) reads from this table instead of switching on the mode.
 *
 * <h3>Filename grammar</h3>
 * A plugin file is named {@code field_field_field[_field].<suffix>}. The
 * {@link #fieldOrder()} lists which field sits at which position; the last
 * field absorbs any surplus tokens. Files with fewer than
 * {@link #minTokens()} tokens are not plugins of this mode.
 *
 * <h3>Suffixes</h3>
 * Enabled and disabled plugins differ only in their suffix. HotPE is the odd
 * one out: its disabled suffix {@code .hpm.off} is compound, so it cannot be
 * told apart by looking at the last extension alone.
 *
 * <table>
 * <caption>Profiles</caption>
 * <tr><th>Mode</th><th>Folder</th><th>Enabled</th><th>Disabled</th><th>Grammar</th></tr>
 * <tr><td>CLOUD_PE</td><td>ce-apps</td><td>.ce</td><td>.CBK</td><td>name_version_author_description</td></tr>
 * <tr><td>HOT_PE</td><td>HotPEModule</td><td>.HPM</td><td>.hpm.off</td><td>name_author_version_description</td></tr>
 * <tr><td>EDGELESS</td><td>Edgeless/Resource</td><td>.7z</td><td>.7zf</td><td>name_version_author</td></tr>
 * </table>
 */
public enum ModeProfile {

    CLOUD_PE(
            "Cloud-PE",
            "Cloud-PE 插件市场",
            "插件市场",
            "插件管理",
            "",
            "https://api.cloud-pe.cn/GetPlugins/",
            "https://api.cloud-pe.cn/connecttest/",
            List.of("ce-apps"),
            ".ce",
            ".CBK",
            CatalogSchema.CODED,
            List.of(NAME, VERSION, AUTHOR, DESCRIPTION),
            4,
            false,
            null),

    HOT_PE(
            "HotPE",
            "HotPE 模块下载",
            "模块市场",
            "模块管理",
            "--hpm",
            "https://api.hotpe.top/API/HotPE/GetHPMList/",
            "https://api.hotpe.top/API/HotPE/GetHPMList/",
            List.of("HotPEModule"),
            ".HPM",
            ".hpm.off",
            CatalogSchema.FILE_LISTING,
            List.of(NAME, AUTHOR, VERSION, DESCRIPTION),
            3,
            true,
            ".off"),

    EDGELESS(
            "Edgeless",
            "Edgeless 插件下载",
            "插件市场",
            "插件管理",
            "--edgeless",
            "https://api.cloud-pe.cn/EdgelessPlugins/",
            "https://api.cloud-pe.cn/EdgelessPlugins/",
            List.of("Edgeless", "Resource"),
            ".7z",
            ".7zf",
            CatalogSchema.CODED,
            List.of(NAME, VERSION, AUTHOR),
            3,
            false,
            null),

    /** Placeholder for the source picker; it has no catalog and no plugin files. */
    SELECT(
            "",
            "选择插件源",
            "插件市场",
            "插件管理",
            "--select",
            "",
            "",
            List.of(),
            "",
            "",
            CatalogSchema.NONE,
            List.of(),
            Integer.MAX_VALUE,
            false,
            null);

    public static final String FIELD_DELIMITER = "_";

    private final String serverName;
    private final String title;
    private final String marketLabel;
    private final String manageLabel;
    private final String flag;
    private final String catalogUrl;
    private final String connectivityUrl;
    private final List<String> folder;
    private final String enabledSuffix;
    private final String disabledSuffix;
    private final CatalogSchema schema;
    private final List<PluginField> fieldOrder;
    private final int minTokens;
    private final boolean nameFillsEmptyDescription;
    private final String disableFallbackSuffix;

    ModeProfile(String serverName, String title, String marketLabel, String manageLabel, String flag,
            String catalogUrl, String connectivityUrl, List<String> folder,
            String enabledSuffix, String disabledSuffix, CatalogSchema schema,
            List<PluginField> fieldOrder, int minTokens, boolean nameFillsEmptyDescription,
            String disableFallbackSuffix) {
        this.serverName = serverName;
        this.title = title;
        this.marketLabel = marketLabel;
        this.manageLabel = manageLabel;
        this.flag = flag;
        this.catalogUrl = catalogUrl;
        this.connectivityUrl = connectivityUrl;
        this.folder = folder;
        this.enabledSuffix = enabledSuffix;
        this.disabledSuffix = disabledSuffix;
        this.schema = schema;
        this.fieldOrder = fieldOrder;
        this.minTokens = minTokens;
        this.nameFillsEmptyDescription = nameFillsEmptyDescription;
        this.disableFallbackSuffix = disableFallbackSuffix;
    }

    /**
     * Resolves a command-line flag ({@code --hpm}, {@code --edgeless},
     * {@code --select}) to its mode. Anything else, including {@code null},
     * selects {@link #CLOUD_PE}.
     */
    public static ModeProfile fromFlag(String flag) {
        if (flag != null && !flag.isEmpty()) {
            for (ModeProfile mode : values()) {
                if (mode.flag.equals(flag))
                    return mode;
            }
        }
        return CLOUD_PE;
    }

    /** The three real ecosystems, in display order. */
    public static List<ModeProfile> ecosystems() {
        return List.of(CLOUD_PE, HOT_PE, EDGELESS);
    }

    /**
     * Resolves the plugin directory below a boot root, e.g.
     * {@code E:\Edgeless\Resource}.
     *
     * @throws IllegalStateException for {@link #SELECT}, which has no folder
     */
    public Path pluginDirectory(Path bootRoot) {
        if (folder.isEmpty())
            throw new IllegalStateException(name() + " has no plugin directory");
        Path dir = bootRoot;
        for (String segment : folder) {
            dir = dir.resolve(segment);
        }
        return dir;
    }

    public boolean isSelector() {
        return this == SELECT;
    }

    /** Whether the disabled suffix spans more than one extension. */
    public boolean hasCompoundDisabledSuffix() {
        return disabledSuffix.indexOf('.', 1) > 0;
    }

    /** Whether the filename grammar contains a description field. */
    public boolean carriesDescription() {
        return fieldOrder.contains(DESCRIPTION);
    }

    /** Last extension of the enabled suffix, lower-cased, without the dot. */
    public String enabledExtension() {
        return lastExtension(enabledSuffix);
    }

    /** Last extension of the disabled suffix, lower-cased, without the dot. */
    public String disabledExtension() {
        return lastExtension(disabledSuffix);
    }

    private static String lastExtension(String suffix) {
        int dot = suffix.lastIndexOf('.');
        return (dot >= 0 ? suffix.substring(dot + 1) : suffix).toLowerCase(Locale.ROOT);
    }

    public String serverName() {
        return serverName;
    }

    public String title() {
        return title;
    }

    public String marketLabel() {
        return marketLabel;
    }

    public String manageLabel() {
        return manageLabel;
    }

    public String flag() {
        return flag;
    }

    public String catalogUrl() {
        return catalogUrl;
    }

    public String connectivityUrl() {
        return connectivityUrl;
    }

    /** Folder path segments below the boot root. */
    public List<String> folder() {
        return folder;
    }

    public String enabledSuffix() {
        return enabledSuffix;
    }

    public String disabledSuffix() {
        return disabledSuffix;
    }

    public CatalogSchema schema() {
        return schema;
    }

    public List<PluginField> fieldOrder() {
        return fieldOrder;
    }

    public int minTokens() {
        return minTokens;
    }

    /**
     * Whether an empty description is replaced by the plugin name when a
     * filename is generated. HotPE does this so the description slot is
     * never an empty trailing token.
     */
    public boolean nameFillsEmptyDescription() {
        return nameFillsEmptyDescription;
    }

    /**
     * Suffix appended on disable when the file does not carry the expected
     * enabled suffix, or {@code null} if the mode has no such fallback.
     */
    public String disableFallbackSuffix() {
        return disableFallbackSuffix;
    }
}
