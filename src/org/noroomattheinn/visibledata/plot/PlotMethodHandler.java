/*
 * PlotMethodHandler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */

package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.render.Renderer;

/**
 * PlotMethodHandler: Base class of the handlers for the individual plot
 * methods. There is exactly one handler per PlotMethod and it lives as long
 * as the session. It holds the choices a user made for the method (axis
 * dimensions, colors, ...) which outlive any individual plot.
 *
 * The set of handlers is closed: MapPlotHandler, Plot2DHandler and
 * LinePlotHandler. Use create() to get one.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public abstract class PlotMethodHandler implements PlotCapabilities {

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    protected final PlotMethod method;
    protected final Renderer renderer;
    private final List<PlotEvent.Listener> listeners = new ArrayList<>(2);
    private List<String> rememberedAxisDims = Collections.emptyList();

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    PlotMethodHandler(PlotMethod method, Renderer renderer) {
        this.method = method;
        this.renderer = renderer;
    }

    public static PlotMethodHandler create(PlotMethod method, Renderer renderer) {
        switch (method) {
            case MapPlot: return new MapPlotHandler(renderer);
            case Plot2D: return new Plot2DHandler(renderer);
            case LinePlot: return new LinePlotHandler(renderer);
            default:
                throw new IllegalArgumentException("Unknown plot method: " + method);
        }
    }

    public PlotMethod getMethod() { return method; }

    public void addListener(PlotEvent.Listener l) { listeners.add(l); }

    /**
     * The axis dimensions of the last plot made with this method. New plots
     * prefer them if the variable has them.
     */
    public List<String> getRememberedAxisDims() { return rememberedAxisDims; }

    public void rememberAxisDims(List<String> dims) {
        rememberedAxisDims = ImmutableList.copyOf(dims);
    }

    /**
     * Can this method show the variable at all?
     */
    public boolean canPlot(Variable v) {
        return v.ndim() >= method.nAxes() && renderer.supports(method, v);
    }

/*------------------------------------------------------------------------------
 *
 * Default implementation of PlotCapabilities
 *
 *----------------------------------------------------------------------------*/

    @Override public DimensionIndexState initDims(Variable v) throws IncompatibleAxisDimsException {
        return DimensionIndexState.init(v, method, preferredAxisDims());
    }

    @Override public Map<String,Object> getFmts(Variable v) {
        return Collections.emptyMap();
    }

    @Override public List<String> validVariables(Dataset ds, PlotSlot current) {
        List<String> valid = new ArrayList<>();
        for (Variable v : ds.getVariables()) {
            if (canPlot(v)) valid.add(v.getName());
        }
        return valid;
    }

    @Override public Map<String,Integer> getSlice(PlotSlot slot, double x, double y) {
        return null;
    }

/*------------------------------------------------------------------------------
 *
 * Methods for subclasses
 *
 *----------------------------------------------------------------------------*/

    /**
     * The axis dimensions to try first when a new plot is initialized
     */
    protected List<String> preferredAxisDims() { return rememberedAxisDims; }

    void fire(PlotEvent.Type type) {
        PlotEvent event = new PlotEvent(type, method);
        for (PlotEvent.Listener l : new ArrayList<>(listeners)) { l.handle(event); }
    }
}
