/*
 * PlotCapabilities.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 11, 2015
 */
package org.noroomattheinn.visibledata.plot;

import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;

/**
 * PlotCapabilities: What the session needs to know about a plot method.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface PlotCapabilities {

    /**
     * Build the index state for a new plot of the given variable.
     * @throws IncompatibleAxisDimsException If the variable can't be shown
     */
    public DimensionIndexState initDims(Variable v) throws IncompatibleAxisDimsException;

    /**
     * The format options for a new plot of the given variable.
     */
    public Map<String,Object> getFmts(Variable v);

    /**
     * The variables of a dataset that can be selected for this method.
     * @param ds        The dataset
     * @param current   The current plot of this method, may be null
     */
    public List<String> validVariables(Dataset ds, PlotSlot current);

    /**
     * Map a click into a plot back to indices of the displayed variable.
     * @param slot  The plot that was clicked
     * @param x     x position in data coordinates
     * @param y     y position in data coordinates
     * @return      Map from axis dimension to index, or null if the method
     *              doesn't support this
     */
    public Map<String,Integer> getSlice(PlotSlot slot, double x, double y);
}
