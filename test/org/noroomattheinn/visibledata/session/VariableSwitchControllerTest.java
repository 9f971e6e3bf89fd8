/*
 * VariableSwitchControllerTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 18, 2015
 */

package org.noroomattheinn.visibledata.session;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.noroomattheinn.visibledata.Fixtures;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.plot.PlotSlot;
import org.noroomattheinn.visibledata.preset.Preset;
import org.noroomattheinn.visibledata.render.FakeRenderer;
import org.noroomattheinn.visibledata.render.FakeRenderer.FakeHandle;

import static org.junit.jupiter.api.Assertions.*;
import static org.noroomattheinn.visibledata.plot.DimensionIndexState.Free;

public class VariableSwitchControllerTest {
    private static final Map<String,Integer> Nowhere = Collections.emptyMap();

    private FakeRenderer renderer;
    private RecordingShell shell;
    private SessionState state;
    private VariableSwitchController switcher;
    private final List<PlotSlot> inspected = new ArrayList<>();

    @BeforeEach public void setUp() {
        renderer = new FakeRenderer();
        shell = new RecordingShell();
        state = new SessionState(
                Fixtures.registry(Fixtures.climate()), renderer, PlotMethod.MapPlot, 500);
        state.setDatasetID(0);
        switcher = new VariableSwitchController(renderer, shell,
                new VariableSwitchController.PointInspector() {
                    @Override public void inspectPoint(PlotSlot slot, double x, double y) {
                        inspected.add(slot);
                    }
                });
    }

    @Test public void variablesNoMethodCanShowAreRejected() {
        assertTrue(switcher.availableMethods(state, state.currentDataset().variable("flag")).isEmpty());
        try {
            switcher.activate(state, "flag", PlotMethod.MapPlot);
            fail("Activated flag");
        } catch (NoPlotMethodException e) {
            assertEquals("flag", e.getVariable());
        }
        assertEquals(VariableSwitchController.State.NoPlot, switcher.getState(state));
        assertTrue(state.getArrays().isEmpty());
        assertNull(state.getVariable());
        assertTrue(renderer.handles.isEmpty());
    }

    @Test public void theUserPicksAnotherMethod() throws NoPlotMethodException {
        assertNull(switcher.activate(state, "series", PlotMethod.MapPlot));
        assertEquals(Collections.singletonList(Collections.singletonList(PlotMethod.LinePlot)),
                shell.offered);
        assertTrue(state.getArrays().isEmpty());
        assertEquals(PlotMethod.MapPlot, state.getMethod());

        shell.choice = PlotMethod.LinePlot;
        PlotSlot slot = switcher.activate(state, "series", PlotMethod.MapPlot);
        assertEquals(PlotMethod.LinePlot, slot.getMethod());
        assertEquals(PlotMethod.LinePlot, state.getMethod());
        assertEquals("series", state.getVariable());
        assertSame(slot, state.currentSlot());
    }

    @Test public void compatibleVariablesAreSwitchedInPlace() throws NoPlotMethodException {
        PlotSlot slot = switcher.activate(state, "t2m", PlotMethod.MapPlot);
        slot.update(ImmutableMap.of("time", 2));
        assertEquals(VariableSwitchController.State.PlotActive, switcher.getState(state));

        assertSame(slot, switcher.activate(state, "u", PlotMethod.MapPlot));
        assertEquals(1, renderer.handles.size());
        assertEquals("u", slot.getVariable().getName());
        assertEquals(ImmutableMap.of("time", 2, "lev", 0, "lat", Free, "lon", Free),
                slot.getIdims().asMap());
        assertEquals(2, renderer.last().index("time"));
        assertFalse(renderer.last().closed);
        assertEquals("u", state.getVariable());
    }

    @Test public void incompatibleVariablesGetANewPlot() throws NoPlotMethodException {
        PlotSlot old = switcher.activate(state, "t2m", PlotMethod.MapPlot);
        FakeHandle oldHandle = renderer.last();

        PlotSlot slot = switcher.activate(state, "zonal", PlotMethod.MapPlot);
        assertNotSame(old, slot);
        assertTrue(old.isClosed());
        assertTrue(oldHandle.closed);
        assertTrue(oldHandle.listeners.isEmpty());
        assertEquals(2, renderer.handles.size());
        assertEquals(1, state.getArrays().size());
        assertEquals(slot.getName(), state.getCurrentArray(PlotMethod.MapPlot));
        assertEquals(Arrays.asList("time", "lat"), slot.getIdims().freeDims());
        assertEquals(1, renderer.last().shows);
    }

    @Test public void newPlotsStartAtTheGivenIndices() throws NoPlotMethodException {
        Map<String,Integer> at = new HashMap<>();
        at.put("time", 3);
        at.put("lev", 2);
        at.put("lat", 1);
        at.put("depth", 7);
        PlotSlot slot = switcher.createSlot(
                state, PlotMethod.MapPlot, state.currentDataset().variable("u"), at);
        assertEquals(ImmutableMap.of("time", 3, "lev", 2, "lat", Free, "lon", Free),
                slot.getIdims().asMap());
        assertEquals(Arrays.asList("lat", "lon"),
                state.handler(PlotMethod.MapPlot).getRememberedAxisDims());
    }

    @Test public void aPendingPresetIsUsedOnce() throws NoPlotMethodException {
        Map<PlotMethod,Map<String,Object>> perMethod = new HashMap<>();
        perMethod.put(PlotMethod.MapPlot, ImmutableMap.<String,Object>of("projection", "robin"));
        state.setPreset(new Preset("p.json",
                ImmutableMap.<String,Object>of("cmap", "RdBu_r"), perMethod));

        PlotSlot first = switcher.createSlot(
                state, PlotMethod.MapPlot, state.currentDataset().variable("t2m"), Nowhere);
        assertEquals("RdBu_r", renderer.last().formatoptions.get("cmap"));
        assertEquals("robin", first.getFormatoptions().get("projection"));
        assertNull(state.getPreset());

        switcher.createSlot(state, PlotMethod.MapPlot, state.currentDataset().variable("t2m"), Nowhere);
        assertEquals("viridis", renderer.last().formatoptions.get("cmap"));
    }

    @Test public void closingSelectsTheNeighbour() throws NoPlotMethodException {
        PlotSlot a = switcher.createSlot(state, PlotMethod.MapPlot, state.currentDataset().variable("t2m"), Nowhere);
        PlotSlot b = switcher.createSlot(state, PlotMethod.MapPlot, state.currentDataset().variable("u"), Nowhere);
        PlotSlot c = switcher.createSlot(state, PlotMethod.MapPlot, state.currentDataset().variable("zonal"), Nowhere);
        assertSame(c, state.currentSlot());

        switcher.closeSlot(state, c);
        assertSame(b, state.currentSlot());

        state.setCurrentArray(PlotMethod.MapPlot, a.getName());
        switcher.closeSlot(state, a);
        assertSame(b, state.currentSlot());

        switcher.closeSlot(state, b);
        assertNull(state.currentSlot());
        assertNull(state.getCurrentArray(PlotMethod.MapPlot));
        assertTrue(state.getArrays().isEmpty());
    }

    @Test public void clicksReachTheInspector() throws NoPlotMethodException {
        PlotSlot map = switcher.activate(state, "t2m", PlotMethod.MapPlot);
        FakeHandle handle = renderer.last();
        assertEquals(1, handle.listeners.size());
        handle.click(10, 20);
        assertEquals(Collections.singletonList(map), inspected);

        switcher.activate(state, "series", PlotMethod.LinePlot);
        assertTrue(renderer.last().listeners.isEmpty());
    }
}
