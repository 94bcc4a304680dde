package de.bsommerfeld.pluginmarket.core.mode;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModeProfileTest {

    @Test
    void fromFlag_shouldResolveKnownFlags() {
        assertEquals(ModeProfile.HOT_PE, ModeProfile.fromFlag("--hpm"));
        assertEquals(ModeProfile.EDGELESS, ModeProfile.fromFlag("--edgeless"));
        assertEquals(ModeProfile.SELECT, ModeProfile.fromFlag("--select"));
    }

    @Test
    void fromFlag_shouldDefaultToCloudPe() {
        assertEquals(ModeProfile.CLOUD_PE, ModeProfile.fromFlag(null));
        assertEquals(ModeProfile.CLOUD_PE, ModeProfile.fromFlag(""));
        assertEquals(ModeProfile.CLOUD_PE, ModeProfile.fromFlag("--unknown"));
    }

    @Test
    void pluginDirectory_shouldResolveFolderSegments() {
        Path root = Path.of("boot");
        assertEquals(root.resolve("ce-apps"), ModeProfile.CLOUD_PE.pluginDirectory(root));
        assertEquals(root.resolve("HotPEModule"), ModeProfile.HOT_PE.pluginDirectory(root));
        assertEquals(root.resolve("Edgeless").resolve("Resource"), ModeProfile.EDGELESS.pluginDirectory(root));
    }

    @Test
    void pluginDirectory_shouldRejectSelector() {
        assertThrows(IllegalStateException.class, () -> ModeProfile.SELECT.pluginDirectory(Path.of("boot")));
    }

    @Test
    void extensions_shouldBeLowerCaseWithoutDot() {
        assertEquals("ce", ModeProfile.CLOUD_PE.enabledExtension());
        assertEquals("cbk", ModeProfile.CLOUD_PE.disabledExtension());
        assertEquals("hpm", ModeProfile.HOT_PE.enabledExtension());
        assertEquals("off", ModeProfile.HOT_PE.disabledExtension());
        assertEquals("7zf", ModeProfile.EDGELESS.disabledExtension());
    }

    @Test
    void hasCompoundDisabledSuffix_shouldOnlyHoldForHotPe() {
        assertTrue(ModeProfile.HOT_PE.hasCompoundDisabledSuffix());
        assertFalse(ModeProfile.CLOUD_PE.hasCompoundDisabledSuffix());
        assertFalse(ModeProfile.EDGELESS.hasCompoundDisabledSuffix());
    }

    @Test
    void fieldOrder_shouldMatchFilenameGrammars() {
        assertEquals(List.of(PluginField.NAME, PluginField.VERSION, PluginField.AUTHOR, PluginField.DESCRIPTION),
                ModeProfile.CLOUD_PE.fieldOrder());
        assertEquals(List.of(PluginField.NAME, PluginField.AUTHOR, PluginField.VERSION, PluginField.DESCRIPTION),
                ModeProfile.HOT_PE.fieldOrder());
        assertFalse(ModeProfile.EDGELESS.carriesDescription());
    }

    @Test
    void ecosystems_shouldExcludeSelector() {
        assertEquals(3, ModeProfile.ecosystems().size());
        assertFalse(ModeProfile.ecosystems().contains(ModeProfile.SELECT));
        assertTrue(ModeProfile.SELECT.isSelector());
    }
}
