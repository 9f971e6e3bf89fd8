/*
 * MapPlotHandler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */

package org.noroomattheinn.visibledata.plot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.render.Renderer;

/**
 * MapPlotHandler: Capabilities of georeferenced gridded plots. Also the base
 * of Plot2DHandler which differs only in the lack of a projection.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class MapPlotHandler extends PlotMethodHandler {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.plot");

/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final String DefaultCmap = "viridis";
    public static final String DefaultProjection = "cf";

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private String xdim = null;
    private String ydim = null;
    private String cmap = DefaultCmap;
    private String projection = DefaultProjection;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    MapPlotHandler(Renderer renderer) { this(PlotMethod.MapPlot, renderer); }

    MapPlotHandler(PlotMethod method, Renderer renderer) { super(method, renderer); }

    public String getXDim() { return xdim; }
    public String getYDim() { return ydim; }
    public String getCmap() { return cmap; }
    public String getProjection() { return projection; }

    /**
     * Choose the dimensions to draw along the x and y axis. Null means the
     * default. Triggers a Reset since the plot has to be set up again.
     */
    public void setAxisDims(String xdim, String ydim) {
        this.xdim = StringUtils.trimToNull(xdim);
        this.ydim = StringUtils.trimToNull(ydim);
        List<String> axes = new ArrayList<>(2);
        if (this.ydim != null) axes.add(this.ydim);
        if (this.xdim != null) axes.add(this.xdim);
        rememberAxisDims(axes);
        fire(PlotEvent.Type.Reset);
    }

    public void setCmap(String cmap) {
        this.cmap = StringUtils.defaultIfBlank(cmap, DefaultCmap);
        fire(PlotEvent.Type.Replot);
    }

    public void setProjection(String projection) {
        this.projection = StringUtils.defaultIfBlank(projection, DefaultProjection);
        if (hasProjection()) fire(PlotEvent.Type.Replot);
    }

/*------------------------------------------------------------------------------
 *
 * Implementation of PlotCapabilities
 *
 *----------------------------------------------------------------------------*/

    @Override public Map<String,Object> getFmts(Variable v) {
        Map<String,Object> fmts = new LinkedHashMap<>();
        fmts.put("cmap", cmap);
        if (hasProjection()) fmts.put("projection", projection);
        if (v.hasDim("time")) fmts.put("title", "%(time)s");
        String label = v.getLongName() != null ? "%(long_name)s" : "%(name)s";
        if (v.getUnits() != null) label += " %(units)s";
        fmts.put("clabel", label);
        return fmts;
    }

    @Override public List<String> validVariables(Dataset ds, PlotSlot current) {
        List<String> valid = new ArrayList<>();
        for (Variable v : ds.getVariables()) {
            if (!canPlot(v)) continue;
            if (xdim != null && !v.hasDim(xdim)) continue;
            if (ydim != null && !v.hasDim(ydim)) continue;
            valid.add(v.getName());
        }
        return valid;
    }

    /**
     * Find the grid cell nearest to a click. The first free dimension of the
     * slot is drawn along y, the second along x.
     * @return  {ydim: iy, xdim: ix} or null if the slot has no two axes
     */
    @Override public Map<String,Integer> getSlice(PlotSlot slot, double x, double y) {
        List<String> free = slot.getIdims().freeDims();
        if (free.size() != 2) {
            logger.warning("Can't map a click into " + slot);
            return null;
        }
        Dataset ds = slot.getDataset();
        String yd = free.get(0), xd = free.get(1);
        double[] xs = ds.coordValues(xd);
        Map<String,Integer> sl = new LinkedHashMap<>();
        sl.put(yd, nearest(ds.coordValues(yd), y, ds.size(yd)));
        sl.put(xd, nearest(xs, transformX(xs, x), ds.size(xd)));
        return sl;
    }

/*------------------------------------------------------------------------------
 *
 * Methods for subclasses
 *
 *----------------------------------------------------------------------------*/

    @Override protected List<String> preferredAxisDims() {
        if (xdim == null && ydim == null) return super.preferredAxisDims();
        List<String> axes = new ArrayList<>(getRememberedAxisDims());
        if (xdim != null && !axes.contains(xdim)) axes.add(0, xdim);
        if (ydim != null && !axes.contains(ydim)) axes.add(0, ydim);
        return axes;
    }

    protected boolean hasProjection() { return true; }

    /**
     * Bring a longitude into the range of the coordinate values. Clicks on a
     * map come in [-180, 180] while the data may use [0, 360] or vice versa.
     */
    protected double transformX(double[] xs, double x) {
        if (xs == null || xs.length == 0) return x;
        double min = Double.MAX_VALUE, max = -Double.MAX_VALUE;
        for (double v : xs) { min = Math.min(min, v); max = Math.max(max, v); }
        if (min >= 0 && x < 0) return x + 360;
        if (max <= 180 && x > 180) return x - 360;
        return x;
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private static int nearest(double[] values, double target, int size) {
        if (values == null) {
            long i = Math.round(target);
            return (int)Math.max(0, Math.min(size - 1, i));
        }
        int best = 0;
        double bestDist = Double.MAX_VALUE;
        for (int i = 0; i < values.length; i++) {
            double d = Math.abs(values[i] - target);
            if (d < bestDist) { bestDist = d; best = i; }
        }
        return best;
    }
}
