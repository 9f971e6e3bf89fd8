/*
 * LineSeriesManager.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 12, 2015
 */

package org.noroomattheinn.visibledata.plot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;

/**
 * LineSeriesManager: Add, remove and re-axis the sibling lines of a line
 * plot. All lines of a plot share the dimension drawn along the x axis.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class LineSeriesManager {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.plot");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final LinePlotHandler handler;
    private String preferredXDim = null;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    LineSeriesManager(LinePlotHandler handler) {
        this.handler = handler;
    }

    /**
     * The x dimension new line plots start with, or null for the default
     */
    public String getPreferredXDim() { return preferredXDim; }

    /**
     * @return  The dimension drawn along the x axis of a line plot
     */
    public String xDim(PlotSlot slot) {
        List<String> free = slot.primaryLine().getIdims().freeDims();
        return free.isEmpty() ? null : free.get(0);
    }

    /**
     * Add a line to a plot and make it the current one. Indices come from
     * sl if given there, else from the primary line if it has the dimension,
     * else 0. Entries of sl for dimensions v lacks, or for the x dimension,
     * are ignored.
     *
     * @param slot  The line plot
     * @param v     Variable of the new line
     * @param sl    Explicit indices. May be empty.
     * @return      The new line
     * @throws IncompatibleAxisDimsException If v lacks the x dimension
     * @throws DimensionOutOfRangeException If sl holds an invalid index
     */
    public Line addLine(PlotSlot slot, Variable v, Map<String,Integer> sl)
            throws IncompatibleAxisDimsException {
        checkSlot(slot);
        String xdim = xDim(slot);
        Map<String,Integer> reuse = new HashMap<>(slot.primaryLine().getIdims().scalarIndices());
        DimensionIndexState idims = DimensionIndexState.forLine(v, xdim, reuse);
        Map<String,Integer> explicit = new HashMap<>();
        for (Map.Entry<String,Integer> e : sl.entrySet()) {
            if (v.hasDim(e.getKey()) && !e.getKey().equals(xdim)) explicit.put(e.getKey(), e.getValue());
        }
        idims.update(explicit);

        Line line = new Line(v, idims);
        slot.addLine(line);
        slot.setCurrentLine(slot.nLines() - 1);
        logger.fine("Added " + line + " to " + slot.getName());
        handler.fire(PlotEvent.Type.Replot);
        return line;
    }

    /**
     * Remove a line. The line before it becomes the current one.
     * @throws IllegalStateException If it is the only line
     */
    public void removeLine(PlotSlot slot, int index) {
        checkSlot(slot);
        Line removed = slot.removeLine(index);
        slot.setCurrentLine(Math.max(0, index - 1));
        logger.fine("Removed " + removed + " from " + slot.getName());
        handler.fire(PlotEvent.Type.Replot);
    }

    /**
     * Is v a candidate for another line in the plot?
     */
    public boolean isValid(PlotSlot slot, Variable v) {
        String xdim = xDim(slot);
        return xdim != null && v.hasDim(xdim);
    }

    /**
     * The variables of a dataset that can be added as lines. While the plot
     * has fewer than two lines every variable is valid.
     */
    public List<String> validVariables(PlotSlot slot, Dataset ds) {
        List<String> valid = new ArrayList<>();
        boolean all = slot == null || slot.nLines() < 2;
        for (Variable v : ds.getVariables()) {
            if (all || isValid(slot, v)) valid.add(v.getName());
        }
        return valid;
    }

    /**
     * Draw all lines of a plot along another dimension. Other indices are
     * kept where possible. Emits a Reset.
     *
     * @throws IncompatibleAxisDimsException If one of the lines lacks dim.
     *         Nothing changes in that case.
     */
    public void setXDim(PlotSlot slot, String dim) throws IncompatibleAxisDimsException {
        if (slot == null) {
            preferredXDim = dim;
            return;
        }
        checkSlot(slot);
        List<Line> rebuilt = new ArrayList<>();
        for (Line line : slot.getLines()) {
            DimensionIndexState idims = DimensionIndexState.forLine(
                    line.getVariable(), dim, line.getIdims().scalarIndices());
            rebuilt.add(new Line(line.getVariable(), idims));
        }
        for (int i = 0; i < rebuilt.size(); i++) { slot.replaceLine(i, rebuilt.get(i)); }
        preferredXDim = dim;
        handler.rememberAxisDims(Collections.singletonList(dim));
        handler.fire(PlotEvent.Type.Reset);
    }

    /**
     * The dimensions with more than one entry that all lines have, in the
     * order they are first seen.
     */
    public List<String> candidateXDims(PlotSlot slot) {
        List<String> candidates = new ArrayList<>();
        for (String dim : slot.primaryLine().getVariable().getDims()) {
            if (slot.primaryLine().getVariable().size(dim) <= 1) continue;
            boolean shared = true;
            for (Line line : slot.getLines()) {
                if (!line.getVariable().hasDim(dim)) { shared = false; break; }
            }
            if (shared) candidates.add(dim);
        }
        return candidates;
    }

    public List<String> lineDescriptions(PlotSlot slot) {
        List<String> descriptions = new ArrayList<>();
        List<Line> lines = slot.getLines();
        for (int i = 0; i < lines.size(); i++) {
            descriptions.add("Line " + i + ": " + lines.get(i));
        }
        return descriptions;
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private static void checkSlot(PlotSlot slot) {
        if (slot.getMethod() != PlotMethod.LinePlot) {
            throw new IllegalArgumentException(slot + " is not a line plot");
        }
    }
}
