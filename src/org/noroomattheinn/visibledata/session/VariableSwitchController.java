/*
 * VariableSwitchController.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.plot.ArrayCollection;
import org.noroomattheinn.visibledata.plot.DimensionIndexState;
import org.noroomattheinn.visibledata.plot.IncompatibleAxisDimsException;
import org.noroomattheinn.visibledata.plot.Line;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.plot.PlotMethodHandler;
import org.noroomattheinn.visibledata.plot.PlotSlot;
import org.noroomattheinn.visibledata.preset.Preset;
import org.noroomattheinn.visibledata.render.Renderer;
import org.noroomattheinn.visibledata.render.RendererHandle;

/**
 * VariableSwitchController: Reconcile the plots with the variable the user
 * selects. A plot is switched to the new variable in place if it can be,
 * otherwise it is closed and a new one is made.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class VariableSwitchController {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.session");

/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public enum State { NoPlot, PlotActive, VariableChanging }

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final Renderer renderer;
    private final UIShell shell;
    private final PointInspector inspector;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    /**
     * Interface to whoever handles clicks into gridded plots
     */
    public interface PointInspector {
        public void inspectPoint(PlotSlot slot, double x, double y);
    }

    public VariableSwitchController(Renderer renderer, UIShell shell, PointInspector inspector) {
        this.renderer = renderer;
        this.shell = shell;
        this.inspector = inspector;
    }

    public State getState(SessionState s) {
        if (s.isChanging()) return State.VariableChanging;
        return s.currentSlot() == null ? State.NoPlot : State.PlotActive;
    }

    /**
     * The plot methods that can show a variable, in PlotMethod order
     */
    public List<PlotMethod> availableMethods(SessionState s, Variable v) {
        List<PlotMethod> available = new ArrayList<>();
        for (PlotMethod m : PlotMethod.values()) {
            if (s.handler(m).canPlot(v)) available.add(m);
        }
        return available;
    }

    /**
     * Show a variable with a plot method. If the method can't show the
     * variable the shell is asked for another one.
     *
     * @param s         The session
     * @param name      Name of a variable of the current dataset
     * @param m         The requested plot method
     * @return          The slot showing the variable, or null if the user
     *                  cancelled the choice of another method
     * @throws NoPlotMethodException If no method can show the variable.
     *                  Nothing changes in that case.
     */
    public PlotSlot activate(SessionState s, String name, PlotMethod m)
            throws NoPlotMethodException {
        Variable v = currentDataset(s).variable(name);
        List<PlotMethod> available = availableMethods(s, v);
        if (available.isEmpty()) throw new NoPlotMethodException(name);
        if (!available.contains(m)) {
            PlotMethod chosen = shell.choosePlotMethod(name, available);
            if (chosen == null || !available.contains(chosen)) {
                logger.fine("No plot method chosen for " + name);
                return null;
            }
            m = chosen;
        }

        s.setChanging(true);
        try {
            s.setMethod(m);
            s.setVariable(name);
            PlotSlot slot = s.slot(m);
            if (slot != null) {
                try {
                    slot.switchVariable(v);
                    logger.fine("Switched " + slot.getName() + " to " + name);
                    return slot;
                } catch (IncompatibleAxisDimsException e) {
                    logger.fine("Recreating " + slot.getName() + ": " + e.getMessage());
                    closeSlot(s, slot);
                }
            }
            return createSlot(s, m, v, Collections.<String,Integer>emptyMap());
        } finally {
            s.setChanging(false);
        }
    }

    /**
     * Make a new plot of a variable, even if the method has one already.
     *
     * @param s     The session
     * @param m     The plot method
     * @param v     The variable
     * @param at    Indices to start at. Entries for dims the variable lacks
     *              or that are drawn along an axis are ignored.
     * @return      The new slot, registered in the session's collection
     * @throws NoPlotMethodException If the method can't show the variable
     */
    public PlotSlot createSlot(SessionState s, PlotMethod m, Variable v, Map<String,Integer> at)
            throws NoPlotMethodException {
        PlotMethodHandler h = s.handler(m);
        if (!h.canPlot(v)) throw new NoPlotMethodException(v.getName());
        DimensionIndexState idims;
        try {
            idims = h.initDims(v);
        } catch (IncompatibleAxisDimsException e) {
            throw new NoPlotMethodException(v.getName());
        }
        Map<String,Integer> start = new HashMap<>();
        for (Map.Entry<String,Integer> e : at.entrySet()) {
            if (idims.contains(e.getKey()) && !idims.isFree(e.getKey())) {
                start.put(e.getKey(), e.getValue());
            }
        }
        idims.update(start);

        PlotSlot slot = new PlotSlot(m, new Line(v, idims));
        Map<String,Object> fmts = new LinkedHashMap<>(h.getFmts(v));
        Preset preset = s.takePreset();
        if (preset != null) fmts.putAll(preset.fmtsFor(m));

        s.getArrays().add(slot);
        s.setCurrentArray(m, slot.getName());
        h.rememberAxisDims(idims.freeDims());
        render(slot, fmts);
        slot.show();
        logger.info("Created " + slot.shortInfo());
        return slot;
    }

    /**
     * Close a plot and drop it from the session. The plot before it (of the
     * same method and dataset) becomes the current one.
     */
    public void closeSlot(SessionState s, PlotSlot slot) {
        PlotMethod m = slot.getMethod();
        ArrayCollection siblings = s.getArrays().filter(slot.getDataset().getID()).byMethod(m);
        int index = siblings.indexOf(slot);
        boolean wasCurrent = slot.getName() != null && slot.getName().equals(s.getCurrentArray(m));

        slot.close();
        s.getArrays().remove(slot);

        if (wasCurrent) {
            String next = null;
            if (siblings.size() > 1) {
                next = siblings.get(index > 0 ? index - 1 : 1).getName();
            }
            s.setCurrentArray(m, next);
        }
        logger.info("Closed " + slot.getName());
    }

    /**
     * Render a slot with the given options and connect the point inspector.
     * Any previous rendering of the slot must have been released.
     */
    public void render(final PlotSlot slot, Map<String,Object> fmts) {
        RendererHandle handle = renderer.render(slot.getSlices(), slot.getMethod(), fmts);
        slot.attach(handle, fmts);
        if (slot.getMethod().isGridded()) {
            int cid = handle.connect(new RendererHandle.ClickListener() {
                @Override public void clicked(double x, double y) {
                    inspector.inspectPoint(slot, x, y);
                }
            });
            slot.setInspectorID(cid);
        }
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private static Dataset currentDataset(SessionState s) {
        Dataset ds = s.currentDataset();
        if (ds == null) throw new IllegalStateException("No dataset is open");
        return ds;
    }
}
