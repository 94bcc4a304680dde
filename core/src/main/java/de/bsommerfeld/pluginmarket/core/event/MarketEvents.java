package de.bsommerfeld.pluginmarket.core.event;

import de.bsommerfeld.pluginmarket.core.domain.TaskKey;
import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;

/**
 * Events published on the {@link ApplicationEventBus} by the market core.
 */
public class MarketEvents {

    private MarketEvents() {
    }

    /** The remote catalog was fetched and installed into the registry. */
    public record CatalogLoadedEvent(ModeProfile mode, int categoryCount) {
    }

    /**
     * The catalog could not be loaded. The registry keeps an empty catalog
     * until the next successful load.
     */
    public record CatalogLoadFailedEvent(ModeProfile mode, String message) {
    }

    /** A local rescan replaced the enabled/disabled snapshot. */
    public record LocalPluginsChangedEvent(int enabledCount, int disabledCount) {
    }

    /**
     * A background lifecycle operation ended. The task entry is already gone
     * when this is posted. {@code message} is {@code null} on success.
     */
    public record OperationFinishedEvent(TaskKey key, boolean success, String message) {

        public static OperationFinishedEvent succeeded(TaskKey key) {
            return new OperationFinishedEvent(key, true, null);
        }

        public static OperationFinishedEvent failed(TaskKey key, String message) {
            return new OperationFinishedEvent(key, false, message);
        }
    }
}
