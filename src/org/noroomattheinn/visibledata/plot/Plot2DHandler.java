/*
 * Plot2DHandler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */

package org.noroomattheinn.visibledata.plot;

import org.noroomattheinn.visibledata.render.Renderer;

/**
 * Plot2DHandler: Gridded plots on plain cartesian axes.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Plot2DHandler extends MapPlotHandler {

    Plot2DHandler(Renderer renderer) { super(PlotMethod.Plot2D, renderer); }

    @Override protected boolean hasProjection() { return false; }

    @Override protected double transformX(double[] xs, double x) { return x; }
}
