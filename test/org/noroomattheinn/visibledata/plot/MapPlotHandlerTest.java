/*
 * MapPlotHandlerTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 17, 2015
 */

package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.noroomattheinn.visibledata.Fixtures;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.render.FakeRenderer;

import static org.junit.jupiter.api.Assertions.*;

public class MapPlotHandlerTest {
    private Dataset ds;
    private MapPlotHandler map, plot2d;
    private final List<PlotEvent> events = new ArrayList<>();

    @BeforeEach public void setUp() {
        ds = Fixtures.climate();
        FakeRenderer renderer = new FakeRenderer();
        map = (MapPlotHandler)PlotMethodHandler.create(PlotMethod.MapPlot, renderer);
        plot2d = (MapPlotHandler)PlotMethodHandler.create(PlotMethod.Plot2D, renderer);
        PlotEvent.Listener l = new PlotEvent.Listener() {
            @Override public void handle(PlotEvent event) { events.add(event); }
        };
        map.addListener(l);
        plot2d.addListener(l);
    }

    @Test public void formatoptionsDescribeTheVariable() {
        Map<String,Object> fmts = map.getFmts(ds.variable("t2m"));
        assertEquals(MapPlotHandler.DefaultCmap, fmts.get("cmap"));
        assertEquals(MapPlotHandler.DefaultProjection, fmts.get("projection"));
        assertEquals("%(time)s", fmts.get("title"));
        assertEquals("%(long_name)s %(units)s", fmts.get("clabel"));

        fmts = plot2d.getFmts(ds.variable("u"));
        assertFalse(fmts.containsKey("projection"));
        assertEquals("%(name)s %(units)s", fmts.get("clabel"));
    }

    @Test public void clicksOnAMapWrapLongitudes() {
        PlotSlot slot = ArrayCollectionTest.slot(ds, "t2m", PlotMethod.MapPlot);
        assertEquals(ImmutableMap.of("lat", 2, "lon", 7), map.getSlice(slot, -45, 20));
        assertEquals(ImmutableMap.of("lat", 0, "lon", 2), map.getSlice(slot, 100, -80));
    }

    @Test public void clicksOnA2DPlotUseTheRawPosition() {
        PlotSlot slot = ArrayCollectionTest.slot(ds, "t2m", PlotMethod.Plot2D);
        assertEquals(ImmutableMap.of("lat", 2, "lon", 0), plot2d.getSlice(slot, -45, 20));
    }

    @Test public void dimsWithoutNumericCoordsUseIndices() {
        PlotSlot slot = ArrayCollectionTest.slot(ds, "zonal", PlotMethod.Plot2D);
        assertEquals(ImmutableMap.of("time", 3, "lat", 0), plot2d.getSlice(slot, -50, 2.6));
        assertEquals(ImmutableMap.of("time", 4, "lat", 3), plot2d.getSlice(slot, 90, 17));
    }

    @Test public void chosenAxisDimsRestrictTheVariables() throws IncompatibleAxisDimsException {
        map.setAxisDims("lon", "lev");
        assertEquals(Collections.singletonList(new PlotEvent(PlotEvent.Type.Reset, PlotMethod.MapPlot)), events);
        assertEquals(Collections.singletonList("u"), map.validVariables(ds, null));
        assertEquals(Arrays.asList("lev", "lon"), map.initDims(ds.variable("u")).freeDims());

        map.setAxisDims(null, null);
        assertEquals(Arrays.asList("t2m", "u", "zonal"), map.validVariables(ds, null));
    }

    @Test public void rememberedAxisDimsArePreferred() throws IncompatibleAxisDimsException {
        plot2d.rememberAxisDims(Arrays.asList("lev", "lat"));
        assertEquals(Arrays.asList("lev", "lat"), plot2d.initDims(ds.variable("u")).freeDims());
        assertEquals(Arrays.asList("lat", "lon"), plot2d.initDims(ds.variable("t2m")).freeDims());
    }

    @Test public void styleChangesAskForAReplot() {
        map.setCmap("RdBu_r");
        plot2d.setProjection("robin");
        map.setProjection(" ");
        assertEquals(Arrays.asList(
                new PlotEvent(PlotEvent.Type.Replot, PlotMethod.MapPlot),
                new PlotEvent(PlotEvent.Type.Replot, PlotMethod.MapPlot)), events);
        assertEquals("RdBu_r", map.getCmap());
        assertEquals(MapPlotHandler.DefaultProjection, map.getProjection());
    }

    @Test public void someVariablesCantBeMapped() {
        assertFalse(map.canPlot(ds.variable("flag")));
        assertFalse(map.canPlot(ds.variable("series")));
        assertTrue(map.canPlot(ds.variable("zonal")));
    }
}
