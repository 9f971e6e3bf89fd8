/*
 * Renderer.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 10, 2015
 */
package org.noroomattheinn.visibledata.render;

import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.data.Slice;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * Renderer: Interface to the plotting engine.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface Renderer {

    /**
     * Can the given variable be visualized with the given method at all?
     * This is a check on the dimensionality of the variable only.
     *
     * @param method    The plot method
     * @param variable  The variable
     * @return          true if a plot could be made
     */
    public boolean supports(PlotMethod method, Variable variable);

    /**
     * Create a new plot.
     *
     * @param slices        The data to show. Gridded methods get exactly one
     *                      slice, line plots one per line.
     * @param method        The plot method
     * @param formatoptions Options controlling the appearance of the plot
     * @return              A handle used to update and close the plot
     */
    public RendererHandle render(
            List<Slice> slices, PlotMethod method, Map<String,Object> formatoptions);
}
