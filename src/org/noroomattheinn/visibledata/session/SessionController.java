/*
 * SessionController.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 14, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.animation.AnimationDriver;
import org.noroomattheinn.visibledata.animation.AnimationState.Direction;
import org.noroomattheinn.visibledata.animation.TickScheduler;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.DatasetRegistry;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.plot.ArrayCollection;
import org.noroomattheinn.visibledata.plot.DimensionIndexState;
import org.noroomattheinn.visibledata.plot.DimensionOutOfRangeException;
import org.noroomattheinn.visibledata.plot.IncompatibleAxisDimsException;
import org.noroomattheinn.visibledata.plot.LineSeriesManager;
import org.noroomattheinn.visibledata.plot.PlotEvent;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.plot.PlotMethodHandler;
import org.noroomattheinn.visibledata.plot.PlotSlot;
import org.noroomattheinn.visibledata.preset.Preset;
import org.noroomattheinn.visibledata.preset.PresetLoadException;
import org.noroomattheinn.visibledata.preset.PresetStore;
import org.noroomattheinn.visibledata.render.Renderer;

/**
 * SessionController: The entry point for everything the user does in a
 * viewing session. Each operation runs on the event loop, mutates the
 * SessionState, and ends by telling the UIShell what changed.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class SessionController implements PlotEvent.Listener,
        VariableSwitchController.PointInspector {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.session");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final SessionState state;
    private final UIShell shell;
    private final VariableSwitchController switcher;
    private final AnimationDriver animation;
    private final PresetStore presets = new PresetStore();

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public SessionController(
            DatasetRegistry registry, Renderer renderer, UIShell shell,
            TickScheduler scheduler, PlotMethod method, int intervalMS) {
        this.state = new SessionState(registry, renderer, method, intervalMS);
        this.shell = shell;
        this.switcher = new VariableSwitchController(renderer, shell, this);
        this.animation = new AnimationDriver(state.getAnimation(), scheduler, new AnimationHost());
        for (PlotMethod m : PlotMethod.values()) {
            state.handler(m).addListener(this);
        }
    }

    public SessionState getState() { return state; }
    public AnimationDriver getAnimation() { return animation; }
    public VariableSwitchController.State getSwitchState() { return switcher.getState(state); }

    public PlotSlot currentSlot() { return state.currentSlot(); }

/*------------------------------------------------------------------------------
 *
 * Datasets
 *
 *----------------------------------------------------------------------------*/

    /**
     * Open a dataset, register it and make it the current one
     * @throws IOException If the dataset can't be read
     */
    public Dataset openDataset(String path) throws IOException {
        Dataset ds = state.getRegistry().open(path);
        setDataset(ds.getID());
        return ds;
    }

    /**
     * Make a dataset the current one. For each plot method the dataset's
     * selected plot, or else its first one, becomes the current plot.
     */
    public void setDataset(int id) {
        if (!state.getRegistry().contains(id)) {
            throw new IllegalArgumentException("No dataset with id " + id);
        }
        animation.stop();
        state.setDatasetID(id);
        for (PlotMethod m : PlotMethod.values()) {
            ArrayCollection mine = state.arrays(m);
            if (state.slot(m) == null && !mine.isEmpty()) {
                state.setCurrentArray(m, mine.get(0).getName());
            }
        }
        PlotSlot slot = state.currentSlot();
        if (slot != null) {
            state.setVariable(slot.getVariable().getName());
        } else if (!state.currentDataset().hasVariable(state.getVariable())) {
            state.setVariable(null);
        }
        refresh();
    }

/*------------------------------------------------------------------------------
 *
 * Variables and plots
 *
 *----------------------------------------------------------------------------*/

    /**
     * Show a variable with the current plot method
     * @return  true if the variable is shown afterwards
     */
    public boolean activate(String variable) {
        return activate(variable, state.getMethod());
    }

    public boolean activate(String variable, PlotMethod m) {
        try {
            PlotSlot slot = switcher.activate(state, variable, m);
            return slot != null;
        } catch (NoPlotMethodException e) {
            logger.warning(e.getMessage());
            shell.reportError(e.getMessage(), e);
            return false;
        } finally {
            refresh();
        }
    }

    /**
     * The user deselected a variable. If the current plot shows it, the plot
     * is closed.
     */
    public void deactivate(String variable) {
        PlotSlot slot = state.currentSlot();
        if (slot == null || !slot.getVariable().getName().equals(variable)) return;
        closePlot(slot);
    }

    /**
     * Make an additional plot of a variable with the current method
     * @return  The new plot, or null if it couldn't be made
     */
    public PlotSlot newPlot(String variable) {
        Dataset ds = requireDataset();
        try {
            PlotSlot slot = switcher.createSlot(
                    state, state.getMethod(), ds.variable(variable),
                    Collections.<String,Integer>emptyMap());
            state.setVariable(variable);
            return slot;
        } catch (NoPlotMethodException e) {
            logger.warning(e.getMessage());
            shell.reportError(e.getMessage(), e);
            return null;
        } finally {
            refresh();
        }
    }

    public void closeCurrentPlot() {
        PlotSlot slot = state.currentSlot();
        if (slot != null) closePlot(slot);
    }

    /**
     * Make a plot from the array selector the current one. The session
     * follows it into its dataset and plot method.
     */
    public void selectArray(String name) {
        PlotSlot slot = state.getArrays().get(name);
        if (slot == null) throw new IllegalArgumentException("No plot named " + name);
        animation.stop();
        state.setMethod(slot.getMethod());
        state.setDatasetID(slot.getDataset().getID());
        state.setCurrentArray(slot.getMethod(), name);
        state.setVariable(slot.getVariable().getName());
        slot.show();
        refresh();
    }

    public void switchMethod(PlotMethod m) {
        animation.stop();
        state.setMethod(m);
        PlotSlot slot = state.currentSlot();
        if (slot != null) state.setVariable(slot.getVariable().getName());
        refresh();
    }

    /**
     * Draw the current plot of a method again from scratch, with the current
     * options of the method.
     */
    public void replot(PlotMethod m) {
        PlotSlot slot = state.slot(m);
        if (slot != null) {
            slot.replot(state.handler(m).getFmts(slot.getVariable()));
        }
        refresh();
    }

    /**
     * Close the renderer of the current plot of a method and make it again.
     * Map and 2D plots pick their axis dimensions again. The plot keeps its
     * name and place in the array selector.
     */
    public void reset(PlotMethod m) {
        PlotSlot slot = state.slot(m);
        if (slot != null) {
            if (m != PlotMethod.LinePlot) reinitAxes(slot);
            Map<String,Object> fmts = new LinkedHashMap<>(slot.getFormatoptions());
            fmts.putAll(state.handler(m).getFmts(slot.getVariable()));
            slot.release();
            switcher.render(slot, fmts);
            slot.show();
        }
        refresh();
    }

    @Override public void handle(PlotEvent event) {
        switch (event.type) {
            case Replot: replot(event.method); break;
            case Reset: reset(event.method); break;
            case Changed: refresh(); break;
            default: break;
        }
    }

/*------------------------------------------------------------------------------
 *
 * Navigation
 *
 *----------------------------------------------------------------------------*/

    /**
     * Step a dimension of the current plot (dimension buttons: +1 on a left
     * click, -1 on a right click)
     * @return  The new index
     */
    public int increaseDim(String dim, int step) {
        PlotSlot slot = requireSlot();
        int i = slot.increaseDim(dim, step);
        refresh();
        return i;
    }

    /**
     * Set indices of the current plot directly
     * @throws DimensionOutOfRangeException If an index is invalid
     */
    public void updateDims(Map<String,Integer> dims) {
        PlotSlot slot = requireSlot();
        slot.update(dims);
        refresh();
    }

    public void goToNextStep() { step(1); }

    public void goToPreviousStep() { step(-1); }

    /**
     * Select the dimension used by the step buttons and animations
     */
    public void selectAnimationDim(String dim) {
        state.getAnimation().setDim(dim);
    }

    /**
     * The dimension the step buttons and animations work on: the selected
     * one if the current plot can iterate it, else the first it can.
     * @return  The dimension or null if there is none
     */
    public String animationDim() {
        PlotSlot slot = state.currentSlot();
        if (slot == null) return null;
        List<String> dims = slot.dimsToIterate();
        if (dims.isEmpty()) return null;
        String selected = state.getAnimation().getDim();
        return dims.contains(selected) ? selected : dims.get(0);
    }

    /**
     * The rows of the dimension table of the current plot
     */
    public List<DimensionRow> describeDimensions() {
        PlotSlot slot = state.currentSlot();
        if (slot == null) return Collections.emptyList();
        Dataset ds = slot.getDataset();
        DimensionIndexState idims = slot.getIdims();
        List<DimensionRow> rows = new ArrayList<>();
        for (String dim : idims.dims()) {
            int size = idims.size(dim);
            String current = idims.isFree(dim) ? null : ds.coordLabel(dim, idims.get(dim));
            rows.add(new DimensionRow(
                    dim, ds.axisOf(dim), ds.coordLabel(dim, 0), current,
                    ds.coordLabel(dim, size - 1), ds.coordUnits(dim)));
        }
        return rows;
    }

/*------------------------------------------------------------------------------
 *
 * Point inspection
 *
 *----------------------------------------------------------------------------*/

    /**
     * A click into a gridded plot. If its variable has more dimensions than
     * the plot shows, the values at the clicked cell are shown in a line
     * plot: a line is added to the current line plot if there is one that
     * can take it, otherwise a new line plot is made.
     */
    @Override public void inspectPoint(PlotSlot slot, double x, double y) {
        if (!slot.isRegistered() || !slot.getMethod().isGridded()) return;
        Variable v = slot.getVariable();
        if (v.ndim() <= 2) return;
        Map<String,Integer> sl = state.handler(slot.getMethod()).getSlice(slot, x, y);
        if (sl == null) return;
        Map<String,Integer> at = new LinkedHashMap<>(slot.getIdims().scalarIndices());
        at.putAll(sl);

        LineSeriesManager lines = state.lineHandler().getLines();
        PlotSlot lineSlot = state.slot(PlotMethod.LinePlot);
        try {
            if (lineSlot != null && lines.isValid(lineSlot, v)) {
                lines.addLine(lineSlot, v, at);
            } else {
                String xdim = pointXDim(slot);
                if (xdim == null) return;
                lines.setXDim(null, xdim);
                switcher.createSlot(state, PlotMethod.LinePlot, v, at);
            }
        } catch (IncompatibleAxisDimsException e) {
            logger.log(Level.WARNING, "Can't add a line for " + v.getName(), e);
            shell.reportError("Can't show the values at the selected point", e);
        } catch (NoPlotMethodException e) {
            logger.log(Level.WARNING, "Can't make a line plot of " + v.getName(), e);
            shell.reportError(e.getMessage(), e);
        }
        refresh();
    }

/*------------------------------------------------------------------------------
 *
 * Animation
 *
 *----------------------------------------------------------------------------*/

    public boolean toggleAnimation(Direction direction) {
        return animation.toggle(direction);
    }

    public boolean startAnimation(Direction direction, int frames) {
        selectAnimationDim(animationDim());
        return animation.start(direction, frames);
    }

    public void stopAnimation() { animation.stop(); }

    public void setAnimationInterval(int ms) { animation.setInterval(ms); }

/*------------------------------------------------------------------------------
 *
 * Presets
 *
 *----------------------------------------------------------------------------*/

    /**
     * Use a preset for the next plot and apply it to the current one
     */
    public void applyPreset(Preset preset) {
        state.setPreset(preset);
        PlotSlot slot = state.currentSlot();
        if (slot != null && preset != null) {
            slot.updateFormatoptions(preset.fmtsFor(slot.getMethod()));
        }
        refresh();
    }

    /**
     * @return  true if the preset was loaded. Errors are reported to the shell.
     */
    public boolean loadPreset(String path) {
        try {
            applyPreset(presets.load(path));
            return true;
        } catch (PresetLoadException e) {
            logger.warning(e.getMessage());
            shell.reportError(e.getMessage(), e);
            return false;
        }
    }

    public void unloadPreset() { state.setPreset(null); }

/*------------------------------------------------------------------------------
 *
 * Telling the shell what changed
 *
 *----------------------------------------------------------------------------*/

    /**
     * Push the state of the session to the shell
     */
    public void refresh() {
        Dataset ds = state.currentDataset();
        PlotMethod m = state.getMethod();
        PlotSlot slot = state.slot(m);
        if (ds != null && !animation.isRunning()) {
            shell.setValidVariables(state.handler(m).validVariables(ds, slot));
        }
        shell.populateDimensions(describeDimensions());
        List<String> descriptions = state.arrays(m).descriptions();
        shell.populateArrays(descriptions, slot == null ? -1 : state.arrays(m).indexOf(slot));
        shell.handle(new PlotEvent(PlotEvent.Type.Changed, m));
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private void closePlot(PlotSlot slot) {
        if (animation.isRunning() && state.getAnimation().getTarget() == slot) animation.stop();
        switcher.closeSlot(state, slot);
        PlotSlot current = state.currentSlot();
        state.setVariable(current == null ? null : current.getVariable().getName());
        refresh();
    }

    private void reinitAxes(PlotSlot slot) {
        PlotMethodHandler h = state.handler(slot.getMethod());
        try {
            slot.reinitDims(h.initDims(slot.getVariable()));
            h.rememberAxisDims(slot.getIdims().freeDims());
        } catch (IncompatibleAxisDimsException e) {
            logger.log(Level.WARNING, "Keeping the axes of " + slot.getName(), e);
        }
    }

    private void step(int by) {
        String dim = animationDim();
        if (dim == null) {
            logger.fine("No dimension to step");
            return;
        }
        increaseDim(dim, by);
    }

    /**
     * The dimension to draw along x in a line plot made from a click: the
     * selected animation dimension if the clicked plot has it, else its
     * first iterable one.
     */
    private String pointXDim(PlotSlot slot) {
        List<String> dims = slot.dimsToIterate();
        if (dims.isEmpty()) return null;
        String selected = state.getAnimation().getDim();
        return dims.contains(selected) ? selected : dims.get(0);
    }

    private Dataset requireDataset() {
        Dataset ds = state.currentDataset();
        if (ds == null) throw new IllegalStateException("No dataset is open");
        return ds;
    }

    private PlotSlot requireSlot() {
        PlotSlot slot = state.currentSlot();
        if (slot == null) throw new IllegalStateException("There is no current plot");
        return slot;
    }

    private class AnimationHost implements AnimationDriver.Host {
        @Override public PlotSlot currentSlot() { return state.currentSlot(); }

        @Override public void setControlsLocked(boolean locked) {
            shell.setEnabled(UIShell.ControlSet.Variables, !locked);
            shell.setEnabled(UIShell.ControlSet.PlotMethods, !locked);
        }

        @Override public void framesChanged() { refresh(); }
    }
}
