/*
 * AnimationDriverTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 18, 2015
 */

package org.noroomattheinn.visibledata.animation;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.noroomattheinn.visibledata.Fixtures;
import org.noroomattheinn.visibledata.animation.AnimationState.Direction;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.plot.ArrayCollection;
import org.noroomattheinn.visibledata.plot.DimensionIndexState;
import org.noroomattheinn.visibledata.plot.IncompatibleAxisDimsException;
import org.noroomattheinn.visibledata.plot.Line;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.plot.PlotSlot;
import org.noroomattheinn.visibledata.render.FakeRenderer;

import static org.junit.jupiter.api.Assertions.*;

public class AnimationDriverTest {
    private Dataset ds;
    private ArrayCollection arrays;
    private FakeRenderer renderer;
    private ManualScheduler scheduler;
    private AnimationState state;
    private AnimationDriver driver;

    private PlotSlot current;
    private final List<Boolean> locks = new ArrayList<>();
    private int frames = 0;

    @BeforeEach public void setUp() throws IncompatibleAxisDimsException {
        ds = Fixtures.registry(Fixtures.climate()).get(0);
        arrays = new ArrayCollection();
        renderer = new FakeRenderer();
        scheduler = new ManualScheduler();
        state = new AnimationState();
        driver = new AnimationDriver(state, scheduler, new AnimationDriver.Host() {
            @Override public PlotSlot currentSlot() { return current; }
            @Override public void setControlsLocked(boolean locked) { locks.add(locked); }
            @Override public void framesChanged() { frames++; }
        });
        current = show("t2m");
    }

    @Test public void forwardWrapsToTheFirstStep() {
        current.update(ImmutableMap.of("time", 3));
        assertTrue(driver.start(Direction.Forward));
        assertEquals(Collections.singletonList(Boolean.TRUE), locks);
        assertEquals(Collections.singletonList((long)AnimationState.DefaultIntervalMS),
                scheduler.intervals);

        scheduler.fire(1);
        assertEquals(3, time());
        scheduler.fire(1);
        assertEquals(4, time());
        scheduler.fire(1);
        assertEquals(0, time());
        assertTrue(driver.isRunning());
        assertEquals(3, frames);
    }

    @Test public void backwardWrapsToTheLastStep() {
        driver.start(Direction.Backward);
        scheduler.fire(2);
        assertEquals(4, time());
        scheduler.fire(1);
        assertEquals(3, time());
    }

    @Test public void theFirstTickRedrawsTheCurrentFrame() {
        int updates = renderer.last().updates;
        driver.start(Direction.Forward);
        scheduler.fire(1);
        assertEquals(updates + 1, renderer.last().updates);
        assertEquals(0, time());
        assertEquals(0, state.getReplay());
    }

    @Test public void boundedAnimationsStopByThemselves() {
        driver.start(Direction.Forward, 3);
        scheduler.fire(10);
        assertFalse(driver.isRunning());
        assertEquals(2, time());
        assertEquals(Arrays.asList(Boolean.TRUE, Boolean.FALSE), locks);
        assertEquals(4, frames);
        assertEquals(1, scheduler.cancelled);
    }

    @Test public void zeroFramesDrawNothing() {
        driver.start(Direction.Forward, 0);
        scheduler.fire(1);
        assertFalse(driver.isRunning());
        assertEquals(0, time());
        assertEquals(0, renderer.last().updates);
    }

    @Test public void ticksForAClosedPlotStopTheAnimation() {
        driver.start(Direction.Forward);
        scheduler.fire(2);
        arrays.remove(current);
        scheduler.fire(1);
        assertFalse(driver.isRunning());
        assertEquals(1, time());
        assertFalse(locks.get(locks.size() - 1));
    }

    @Test public void intervalsAreClamped() {
        driver.setInterval(5);
        assertEquals(AnimationState.MinIntervalMS, state.getIntervalMS());
        driver.setInterval(60000);
        assertEquals(AnimationState.MaxIntervalMS, state.getIntervalMS());
        assertTrue(scheduler.scheduled.isEmpty());
    }

    @Test public void newIntervalsApplyWhileRunning() {
        driver.start(Direction.Forward);
        scheduler.fire(2);
        driver.setInterval(1000);
        assertEquals(Arrays.asList((long)AnimationState.DefaultIntervalMS, 1000L), scheduler.intervals);
        assertEquals(1, scheduler.cancelled);

        scheduler.fireStale(0);
        assertEquals(1, time());
        scheduler.fire(1);
        assertEquals(2, time());
    }

    @Test public void startingTwiceDoesNothing() {
        assertTrue(driver.start(Direction.Forward));
        assertFalse(driver.start(Direction.Backward));
        assertEquals(Direction.Forward, state.getDirection());
        assertEquals(1, scheduler.scheduled.size());
    }

    @Test public void somethingIsNeededToAnimate() throws IncompatibleAxisDimsException {
        current = null;
        assertFalse(driver.start(Direction.Forward));
        current = show("zonal");
        assertFalse(driver.start(Direction.Forward));
        assertTrue(scheduler.scheduled.isEmpty());
        assertTrue(locks.isEmpty());
    }

    @Test public void theSelectedDimensionIsAnimated() throws IncompatibleAxisDimsException {
        current = show("u");
        state.setDim("lev");
        driver.start(Direction.Forward);
        scheduler.fire(2);
        assertEquals(1, current.getIdims().get("lev"));
        assertEquals(0, current.getIdims().get("time"));

        driver.stop();
        state.setDim("lon");
        driver.start(Direction.Forward);
        assertEquals("time", state.getDim());
    }

    @Test public void togglingStartsAndStops() {
        assertTrue(driver.toggle(Direction.Backward));
        assertTrue(driver.isRunning());
        assertFalse(driver.toggle(Direction.Backward));
        assertFalse(driver.isRunning());
        assertFalse(scheduler.isActive());
        assertNull(state.getTarget());
    }

    private int time() { return current.getIdims().get("time"); }

    private PlotSlot show(String name) throws IncompatibleAxisDimsException {
        DimensionIndexState idims = DimensionIndexState.init(ds.variable(name), PlotMethod.MapPlot, null);
        PlotSlot slot = arrays.add(new PlotSlot(PlotMethod.MapPlot, new Line(ds.variable(name), idims)));
        slot.attach(renderer.render(slot.getSlices(), PlotMethod.MapPlot,
                Collections.<String,Object>emptyMap()), Collections.<String,Object>emptyMap());
        return slot;
    }
}
