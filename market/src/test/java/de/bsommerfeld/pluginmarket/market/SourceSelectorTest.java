package de.bsommerfeld.pluginmarket.market;

import de.bsommerfeld.pluginmarket.core.mode.ModeProfile;
import de.bsommerfeld.pluginmarket.remote.catalog.ConnectivityProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SourceSelectorTest {

    private ConnectivityProbe probe;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        probe = mock(ConnectivityProbe.class);
        pool = new WorkerPool(Executors.newFixedThreadPool(3));
    }

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    @Test
    void checkAvailability_shouldProbeEveryEcosystem() throws Exception {
        when(probe.probe(ModeProfile.CLOUD_PE)).thenReturn(true);
        when(probe.probe(ModeProfile.HOT_PE)).thenReturn(false);
        when(probe.probe(ModeProfile.EDGELESS)).thenReturn(true);
        SourceSelector selector = new SourceSelector(probe, pool);

        Map<ModeProfile, Boolean> result = selector.checkAvailability().orElseThrow().get(5, TimeUnit.SECONDS);

        assertEquals(List.of(ModeProfile.CLOUD_PE, ModeProfile.HOT_PE, ModeProfile.EDGELESS),
                List.copyOf(result.keySet()));
        assertTrue(result.get(ModeProfile.CLOUD_PE));
        assertFalse(result.get(ModeProfile.HOT_PE));
        assertEquals(true, selector.availability(ModeProfile.EDGELESS).orElseThrow());
        assertFalse(selector.isChecking());
        verify(probe, never()).probe(ModeProfile.SELECT);
    }

    @Test
    void checkAvailability_shouldIgnoreSecondRequestWhileRunning() throws Exception {
        when(probe.probe(any(ModeProfile.class))).thenAnswer(invocation -> {
            Thread.sleep(200);
            return true;
        });
        SourceSelector selector = new SourceSelector(probe, pool);

        var first = selector.checkAvailability();
        var second = selector.checkAvailability();

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        first.get().get(5, TimeUnit.SECONDS);
        assertTrue(selector.checkAvailability().isPresent());
    }

    @Test
    void launchArguments_shouldUseModeFlag() {
        assertEquals(List.of(), SourceSelector.launchArguments(ModeProfile.CLOUD_PE));
        assertEquals(List.of("--hpm"), SourceSelector.launchArguments(ModeProfile.HOT_PE));
        assertThrows(IllegalArgumentException.class, () -> SourceSelector.launchArguments(ModeProfile.SELECT));
    }
}
