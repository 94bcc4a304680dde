package de.bsommerfeld.pluginmarket.core.domain;

import java.util.List;

/**
 * A named group of catalog entries in catalog order.
 *
 * @param label   category label as sent by the server
 * @param icon    icon identifier, {@code null} if the server sent none
 * @param plugins entries in catalog order, duplicates already removed
 */
public record PluginCategory(String label, String icon, List<Plugin> plugins) {

    public PluginCategory {
        plugins = List.copyOf(plugins);
    }
}
