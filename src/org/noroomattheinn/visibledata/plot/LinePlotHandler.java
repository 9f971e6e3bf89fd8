/*
 * LinePlotHandler.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */

package org.noroomattheinn.visibledata.plot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.render.Renderer;

/**
 * LinePlotHandler: Capabilities of line plots. The lines of a plot are
 * managed by a LineSeriesManager.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class LinePlotHandler extends PlotMethodHandler {
    private final LineSeriesManager lines;

    LinePlotHandler(Renderer renderer) {
        super(PlotMethod.LinePlot, renderer);
        this.lines = new LineSeriesManager(this);
    }

    public LineSeriesManager getLines() { return lines; }

    @Override public Map<String,Object> getFmts(Variable v) {
        Map<String,Object> fmts = new LinkedHashMap<>();
        fmts.put("legendlabels", "%(name)s");
        if (v.getUnits() != null) fmts.put("ylabel", "%(units)s");
        return fmts;
    }

    /**
     * With fewer than two lines any variable the method can show is valid,
     * otherwise it must share the x dimension of the plot.
     */
    @Override public List<String> validVariables(Dataset ds, PlotSlot current) {
        if (current == null || current.nLines() < 2) return super.validVariables(ds, current);
        List<String> valid = new ArrayList<>();
        for (String name : lines.validVariables(current, ds)) {
            if (canPlot(ds.variable(name))) valid.add(name);
        }
        return valid;
    }

    @Override protected List<String> preferredAxisDims() {
        String xdim = lines.getPreferredXDim();
        if (xdim == null) return super.preferredAxisDims();
        return Collections.singletonList(xdim);
    }
}
