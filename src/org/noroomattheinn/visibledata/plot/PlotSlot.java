/*
 * PlotSlot.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 10, 2015
 */

package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Slice;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.render.RendererHandle;

/**
 * PlotSlot: One live visualization of a variable with one plot method. The
 * slot owns the index state of what is shown and the handle of the rendered
 * plot. Line plots may show several lines; all other methods show one.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class PlotSlot {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.plot");

/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final int NoConnection = -1;

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final PlotMethod method;
    private final Dataset dataset;
    private final List<Line> lines = new ArrayList<>();
    private final Map<String,Object> formatoptions = new LinkedHashMap<>();
    private int currentLine = 0;

    private ArrayCollection owner = null;
    private String name = null;
    private RendererHandle handle = null;
    private int inspectorID = NoConnection;
    private boolean closed = false;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public PlotSlot(PlotMethod method, Line primary) {
        this.method = method;
        this.dataset = primary.getVariable().getDataset();
        this.lines.add(primary);
    }

    public PlotMethod getMethod() { return method; }
    public Dataset getDataset() { return dataset; }
    public String getName() { return name; }
    public ArrayCollection getOwner() { return owner; }
    public boolean isClosed() { return closed; }

    /**
     * Is this slot still part of the collection that owns it? Timers and
     * click handlers check this before touching a slot.
     */
    public boolean isRegistered() {
        return !closed && owner != null && owner.contains(this);
    }

/*------------------------------------------------------------------------------
 *
 * Access to the lines of this slot
 *
 *----------------------------------------------------------------------------*/

    public List<Line> getLines() { return Collections.unmodifiableList(lines); }
    public int nLines() { return lines.size(); }
    public Line primaryLine() { return lines.get(0); }
    public Line currentLine() { return lines.get(currentLine); }
    public int getCurrentLineIndex() { return currentLine; }

    public void setCurrentLine(int index) {
        if (index < 0 || index >= lines.size()) {
            throw new IndexOutOfBoundsException("No line " + index + " in " + this);
        }
        currentLine = index;
    }

    /**
     * The variable of the current line
     */
    public Variable getVariable() { return currentLine().getVariable(); }

    /**
     * The index state of the current line
     */
    public DimensionIndexState getIdims() { return currentLine().getIdims(); }

    public List<Slice> getSlices() {
        ImmutableList.Builder<Slice> b = ImmutableList.builder();
        for (Line line : lines) { b.add(line.slice()); }
        return b.build();
    }

    public Map<String,Object> getFormatoptions() { return ImmutableMap.copyOf(formatoptions); }

/*------------------------------------------------------------------------------
 *
 * State changes
 *
 *----------------------------------------------------------------------------*/

    /**
     * Change the indices of the current line and refresh the plot.
     *
     * @param dims  Map from dimension to index
     * @return      true if anything changed. The plot is refreshed only then.
     * @throws DimensionOutOfRangeException If the update is invalid. Nothing
     *         changes in that case.
     */
    public boolean update(Map<String,Integer> dims) throws DimensionOutOfRangeException {
        boolean changed = getIdims().update(dims);
        if (changed) refresh();
        return changed;
    }

    /**
     * Step a dimension of the current line by the given amount, wrapping
     * around at either end.
     * @return  The new index
     */
    public int increaseDim(String dim, int step) {
        DimensionIndexState idims = getIdims();
        if (!idims.contains(dim) || idims.isFree(dim)) {
            throw new DimensionOutOfRangeException(dim, step, idims.size(dim),
                    "Dimension " + dim + " can't be stepped in " + idims);
        }
        int size = idims.size(dim);
        int next = Math.floorMod(idims.get(dim) + step, size);
        update(Collections.singletonMap(dim, next));
        return next;
    }

    /**
     * Show another variable in the current line, keeping as much of the
     * index state as possible, and refresh the plot in place.
     *
     * @throws IncompatibleAxisDimsException If the variable lacks one of the
     *         axis dimensions. The slot is unchanged and has to be recreated.
     */
    public void switchVariable(Variable v) throws IncompatibleAxisDimsException {
        if (v.getDataset() != dataset) {
            throw new IncompatibleAxisDimsException(v.getName(), getIdims().freeDims(),
                    "Variable " + v + " is not part of dataset " + dataset);
        }
        currentLine().switchVariable(v);
        refresh();
    }

    /**
     * Show the variable of a map or 2D plot along other axis dimensions.
     * Indices of dimensions that stay fixed are carried over.
     *
     * @param idims A fresh index state for the variable of this slot
     * @throws IllegalStateException If the slot has more than one line
     */
    public void reinitDims(DimensionIndexState idims) {
        if (lines.size() != 1) {
            throw new IllegalStateException("Can't change the axes of " + this + " in place");
        }
        Map<String,Integer> keep = new LinkedHashMap<>();
        for (Map.Entry<String,Integer> e : getIdims().scalarIndices().entrySet()) {
            if (idims.contains(e.getKey()) && !idims.isFree(e.getKey())) {
                keep.put(e.getKey(), e.getValue());
            }
        }
        idims.update(keep);
        lines.set(0, new Line(getVariable(), idims));
        logger.fine("Axes of " + name + " are now " + idims.freeDims());
    }

    /**
     * The dimensions an animation can iterate over: those that are shown at
     * a fixed index and have more than one entry.
     */
    public List<String> dimsToIterate() {
        List<String> dims = new ArrayList<>();
        DimensionIndexState idims = getIdims();
        for (String dim : idims.scalarDims()) {
            if (idims.size(dim) > 1) dims.add(dim);
        }
        return dims;
    }

    /**
     * A one line description for selector lists
     */
    public String shortInfo() {
        StringBuilder sb = new StringBuilder();
        if (name != null) sb.append(name).append(": ");
        sb.append(method).append(" of ").append(getIdims());
        if (lines.size() > 1) sb.append(" (").append(lines.size()).append(" lines)");
        return sb.toString();
    }

    @Override public String toString() { return shortInfo(); }

/*------------------------------------------------------------------------------
 *
 * Renderer plumbing
 *
 *----------------------------------------------------------------------------*/

    public RendererHandle getHandle() { return handle; }

    public void attach(RendererHandle handle, Map<String,Object> fmts) {
        this.handle = handle;
        this.formatoptions.clear();
        this.formatoptions.putAll(fmts);
    }

    public void setInspectorID(int id) { this.inspectorID = id; }
    public int getInspectorID() { return inspectorID; }

    public void show() {
        if (handle != null) handle.show();
    }

    /**
     * Refresh the plot in place with the current slices
     */
    public void refresh() {
        if (handle != null) handle.update(getSlices(), Collections.<String,Object>emptyMap());
    }

    /**
     * Redraw the plot from scratch with the current slices and options
     */
    public void replot() {
        if (handle != null) handle.replot(getSlices(), getFormatoptions());
    }

    /**
     * Merge new format options and redraw the plot from scratch
     */
    public void replot(Map<String,Object> fmts) {
        formatoptions.putAll(fmts);
        replot();
    }

    /**
     * Merge new format options into the plot and refresh it.
     */
    public void updateFormatoptions(Map<String,Object> fmts) {
        if (fmts.isEmpty()) return;
        formatoptions.putAll(fmts);
        if (handle != null) handle.update(getSlices(), ImmutableMap.copyOf(fmts));
    }

    /**
     * Release the renderer and any click listener but keep the slot's state.
     * Used when a plot is regenerated from scratch.
     */
    public void release() {
        if (handle != null) {
            if (inspectorID != NoConnection) handle.disconnect(inspectorID);
            handle.close();
        }
        handle = null;
        inspectorID = NoConnection;
    }

    /**
     * Release the renderer and mark this slot as closed. Closing twice is
     * harmless.
     */
    public void close() {
        if (closed) return;
        release();
        closed = true;
        logger.fine("Closed " + this);
    }

/*------------------------------------------------------------------------------
 *
 * PACKAGE - Used by ArrayCollection and LineSeriesManager
 *
 *----------------------------------------------------------------------------*/

    void setName(String name) { this.name = name; }
    void setOwner(ArrayCollection owner) { this.owner = owner; }

    void addLine(Line line) {
        if (line.getVariable().getDataset() != dataset) {
            throw new IllegalArgumentException(line + " is not part of dataset " + dataset);
        }
        lines.add(line);
    }

    Line removeLine(int index) {
        if (lines.size() <= 1) {
            throw new IllegalStateException("Can't remove the only line of " + this);
        }
        Line removed = lines.remove(index);
        if (currentLine >= lines.size()) currentLine = lines.size() - 1;
        return removed;
    }

    void replaceLine(int index, Line line) {
        lines.set(index, line);
    }
}
