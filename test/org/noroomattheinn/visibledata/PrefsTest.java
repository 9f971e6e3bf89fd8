/*
 * PrefsTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 18, 2015
 */

package org.noroomattheinn.visibledata;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.noroomattheinn.visibledata.animation.AnimationState;
import org.noroomattheinn.visibledata.plot.PlotMethod;

import static org.junit.jupiter.api.Assertions.*;

public class PrefsTest {
    private Preferences node;

    @BeforeEach public void setUp() {
        node = Preferences.userRoot().node("org/noroomattheinn/visibledata-test/" + System.nanoTime());
    }

    @AfterEach public void tearDown() throws BackingStoreException {
        node.removeNode();
    }

    @Test public void defaults() {
        Prefs prefs = new Prefs(node);
        assertEquals(AnimationState.DefaultIntervalMS, prefs.getAnimationInterval());
        assertEquals(PlotMethod.MapPlot, prefs.getPlotMethod());
        assertEquals(Level.INFO, prefs.getLogLevel());
        assertEquals(Arrays.asList("cf", "cyl", "robin", "ortho", "moll", "northpole", "southpole"),
                prefs.getProjections());
        assertEquals("", prefs.lastPreset.get());
    }

    @Test public void changesAreStored() {
        Prefs prefs = new Prefs(node);
        prefs.animationInterval.set(250);
        prefs.defaultPlotMethod.set("lineplot");
        prefs.logLevel.set("Fine");
        prefs.projections.set(" cyl, ,robin ");

        Prefs reloaded = new Prefs(node);
        assertEquals(250, reloaded.getAnimationInterval());
        assertEquals(PlotMethod.LinePlot, reloaded.getPlotMethod());
        assertEquals(Level.FINE, reloaded.getLogLevel());
        assertEquals(Arrays.asList("cyl", "robin"), reloaded.getProjections());
    }

    @Test public void badValuesFallBack() {
        node.putInt("APP_ANIMATION_INTERVAL", 1);
        node.put("APP_PLOT_METHOD", "contour");
        node.put("APP_LOG_LEVEL", "Chatty");
        Prefs prefs = new Prefs(node);
        assertEquals(AnimationState.MinIntervalMS, prefs.getAnimationInterval());
        assertEquals(PlotMethod.MapPlot, prefs.getPlotMethod());
        assertEquals(Level.INFO, prefs.getLogLevel());
    }
}
