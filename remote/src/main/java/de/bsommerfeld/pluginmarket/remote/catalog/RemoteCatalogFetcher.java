package de.bsommerfeld.pluginmarket.remote.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.pluginmarket.core.domain.Plugin;
import de.bsommerfeld.pluginmarket.core.domain.PluginCategory;
import de.bsommerfeld.pluginmarket.core.error.NetworkException;
import de.bsommerfeld.pluginmarket.core.error.ProtocolException.Reason;
import de.bsommerfeld.pluginmarket.core.error.ProtocolException;
import de.bsommerfeld.pluginmarket.core.mode.CatalogSchema;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.core.util.SizeFormatter;
import de.bsommerfeld.pluginmarket.remote.net.MarketHttpClient;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Downloads the remote plugin catalog of a mode and normalizes it into
 * {@link PluginCategory} lists.
 *
 * <h3>Coded schema (Cloud-PE, Edgeless)</h3>
 * <pre>{@code {"code": 200, "message": "...", "data": [{"class": "...", "icon": "...", "list": [plugin...]}]}}</pre>
 * Plugins carry {@code name, size, version, author, link} and optionally
 * {@code describe} and {@code file}. Any {@code code} other than 200 is a
 * rejection carrying the server's message.
 *
 * <h3>File-listing schema (HotPE)</h3>
 * <pre>{@code {"state": "success", "data": [{"class": "...", "list": [{"name", "size", "modified", "link"}]}]}}</pre>
 * Entries only carry a filename such as {@code Tool_alice_1.0_Desc.HPM};
 * name, author, version and description are recovered from it.
 *
 * <p>
 * Within every category duplicate uploads (same name, version, author and
 * size) are dropped; the first occurrence wins and order is kept.
 */
@Singleton
public class RemoteCatalogFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteCatalogFetcher.class);

    static final int SUCCESS_CODE = 200;
    static final String SUCCESS_STATE = "success";
    static final String HOT_PE_FILE_SUFFIX = ".HPM";
    static final String UNKNOWN_SIZE = "未知大小";

    private static final DateTimeFormatter MODIFIED_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final MarketHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public RemoteCatalogFetcher(MarketHttpClient http) {
        this.http = http;
    }

    /** Fetches the catalog from the mode's own endpoint. */
    public List<PluginCategory> fetch(ModeProfile mode) throws NetworkException, ProtocolException {
        return fetch(mode, mode.catalogUrl());
    }

    /**
     * Fetches the catalog from an explicit endpoint, parsed with the rules of
     * {@code mode}.
     */
    public List<PluginCategory> fetch(ModeProfile mode, String url) throws NetworkException, ProtocolException {
        if (mode.schema() == CatalogSchema.NONE) {
            throw new ProtocolException(Reason.MALFORMED, mode + " has no plugin catalog");
        }
        LOG.info("Fetching {} catalog from {}", mode.serverName(), url);
        String body = http.getString(url);
        List<PluginCategory> categories = parse(mode, body);
        LOG.info("Loaded {} categories from {}", categories.size(), mode.serverName());
        return categories;
    }

    /**
     * Parses a catalog body. Exposed for callers that obtain the JSON by
     * other means.
     */
    public List<PluginCategory> parse(ModeProfile mode, String body) throws ProtocolException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(Reason.MALFORMED, "Catalog is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(Reason.MALFORMED, "Catalog root is not a JSON object");
        }

        return switch (mode.schema()) {
            case CODED -> parseCoded(root);
            case FILE_LISTING -> parseFileListing(root);
            case NONE -> throw new ProtocolException(Reason.MALFORMED, mode + " has no plugin catalog");
        };
    }

    // =====================================================================
    // Coded schema
    // =====================================================================

    private List<PluginCategory> parseCoded(JsonNode root) throws ProtocolException {
        JsonNode code = root.get("code");
        if (code == null || !code.isIntegralNumber()) {
            throw new ProtocolException(Reason.MALFORMED, "Catalog has no numeric 'code'");
        }
        if (!code.canConvertToInt() || code.intValue() != SUCCESS_CODE) {
            String message = root.path("message").asText("");
            throw new ProtocolException(Reason.REJECTED, "Failed to load plugin list: " + message);
        }

        List<PluginCategory> categories = new ArrayList<>();
        for (JsonNode category : requireArray(root, "data")) {
            List<Plugin> plugins = new ArrayList<>();
            for (JsonNode item : requireArray(category, "list")) {
                plugins.add(new Plugin(
                        requireText(item, "name"),
                        requireText(item, "version"),
                        requireText(item, "author"),
                        optionalText(item, "describe"),
                        requireText(item, "size"),
                        optionalText(item, "file"),
                        requireText(item, "link")));
            }
            categories.add(new PluginCategory(requireText(category, "class"), optionalIcon(category), dedup(plugins)));
        }
        return categories;
    }

    // =====================================================================
    // File-listing schema
    // =====================================================================

    private List<PluginCategory> parseFileListing(JsonNode root) throws ProtocolException {
        String state = requireText(root, "state");
        if (!SUCCESS_STATE.equals(state)) {
            throw new ProtocolException(Reason.REJECTED, "Server reported state '" + state + "'");
        }

        List<PluginCategory> categories = new ArrayList<>();
        for (JsonNode category : requireArray(root, "data")) {
            List<Plugin> plugins = new ArrayList<>();
            for (JsonNode item : requireArray(category, "list")) {
                String fileName = requireText(item, "name");
                String[] fields = splitHotPeName(fileName);
                plugins.add(new Plugin(
                        fields[0],
                        fields[2],
                        fields[1],
                        fields[3],
                        formatSize(item.get("size")),
                        fileName,
                        requireText(item, "link"),
                        formatModified(item.get("modified"))));
            }
            categories.add(new PluginCategory(requireText(category, "class"), optionalIcon(category), dedup(plugins)));
        }
        return categories;
    }

    /**
     * Splits a HotPE module filename into {@code [name, author, version, description]}.
     * Names with fewer than three tokens are kept whole as the name.
     */
    static String[] splitHotPeName(String fileName) {
        String stem = fileName;
        while (stem.endsWith(HOT_PE_FILE_SUFFIX)) {
            stem = stem.substring(0, stem.length() - HOT_PE_FILE_SUFFIX.length());
        }
        String[] parts = stem.split(ModeProfile.FIELD_DELIMITER, -1);

        if (parts.length >= 4) {
            String description = String.join(ModeProfile.FIELD_DELIMITER, Arrays.copyOfRange(parts, 3, parts.length));
            return new String[]{parts[0], parts[1], parts[2], description};
        }
        if (parts.length == 3) {
            return new String[]{parts[0], parts[1], parts[2], ""};
        }
        return new String[]{fileName, "", "", ""};
    }

    static String formatSize(JsonNode size) {
        if (size == null) {
            return UNKNOWN_SIZE;
        }
        if (size.isIntegralNumber() && size.canConvertToLong()) {
            return SizeFormatter.format(size.asLong());
        }
        if (size.isNumber()) {
            return SizeFormatter.format((long) size.asDouble());
        }
        if (size.isTextual()) {
            return size.asText();
        }
        return UNKNOWN_SIZE;
    }

    static String formatModified(JsonNode modified) throws ProtocolException {
        if (modified == null || modified.isNull()) {
            throw new ProtocolException(Reason.MALFORMED, "Catalog entry has no 'modified'");
        }
        if (modified.isTextual()) {
            return modified.asText();
        }
        if (modified.isIntegralNumber() && modified.canConvertToLong()) {
            long seconds = modified.asLong();
            try {
                return MODIFIED_FORMAT.format(Instant.ofEpochSecond(seconds));
            } catch (DateTimeException e) {
                return Long.toString(seconds);
            }
        }
        if (modified.isNumber()) {
            return modified.decimalValue().toPlainString();
        }
        throw new ProtocolException(Reason.MALFORMED, "Expected string or number for 'modified', got " + modified.getNodeType());
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    static List<Plugin> dedup(List<Plugin> plugins) {
        Set<Plugin.DedupKey> seen = new HashSet<>();
        List<Plugin> unique = new ArrayList<>(plugins.size());
        for (Plugin plugin : plugins) {
            if (seen.add(plugin.dedupKey())) {
                unique.add(plugin);
            }
        }
        if (unique.size() < plugins.size()) {
            LOG.debug("Dropped {} duplicate catalog entries", plugins.size() - unique.size());
        }
        return unique;
    }

    private static JsonNode requireArray(JsonNode node, String field) throws ProtocolException {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            throw new ProtocolException(Reason.MALFORMED, "Expected array '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field) throws ProtocolException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ProtocolException(Reason.MALFORMED, "Expected string '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : "";
    }

    private static String optionalIcon(JsonNode category) {
        JsonNode icon = category.get("icon");
        return icon != null && icon.isTextual() ? icon.asText() : null;
    }
}
