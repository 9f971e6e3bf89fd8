/*
 * PlotMethod.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 09, 2015
 */
package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;

/**
 * PlotMethod: The ways in which a variable can be visualized. Each method
 * renders a fixed number of the variable's dimensions along its own axes.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public enum PlotMethod {
    MapPlot("mapplot", 2),
    Plot2D("plot2d", 2),
    LinePlot("lineplot", 1);

    private static final BiMap<String,PlotMethod> nameToMethod = HashBiMap.create();
    static {
        for (PlotMethod m : values()) { nameToMethod.put(m.label, m); }
    }

    private final String label;
    private final int nAxes;

    PlotMethod(String label, int nAxes) {
        this.label = label;
        this.nAxes = nAxes;
    }

    /**
     * The name under which the method is known to users and presets
     */
    public String label() { return label; }

    /**
     * The number of free dimensions a plot of this kind requires
     */
    public int nAxes() { return nAxes; }

    /**
     * Whether a click in a plot of this kind can be mapped back to a grid cell
     */
    public boolean isGridded() { return nAxes == 2; }

    /**
     * Look up a method by its label (e.g. "mapplot")
     * @return The method, or null if there is none with that label
     */
    public static PlotMethod fromLabel(String label) {
        return label == null ? null : nameToMethod.get(label.toLowerCase());
    }

    @Override public String toString() { return label; }
}
