/*
 * SessionState.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.util.EnumMap;
import java.util.Map;
import org.noroomattheinn.visibledata.animation.AnimationState;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.DatasetRegistry;
import org.noroomattheinn.visibledata.plot.ArrayCollection;
import org.noroomattheinn.visibledata.plot.LinePlotHandler;
import org.noroomattheinn.visibledata.plot.PlotMethod;
import org.noroomattheinn.visibledata.plot.PlotMethodHandler;
import org.noroomattheinn.visibledata.plot.PlotSlot;
import org.noroomattheinn.visibledata.preset.Preset;
import org.noroomattheinn.visibledata.render.Renderer;

/**
 * SessionState: Everything a viewing session knows. The controllers are
 * stateless and work on an instance of this class.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class SessionState {

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final DatasetRegistry registry;
    private final ArrayCollection arrays = new ArrayCollection();
    private final Map<PlotMethod,PlotMethodHandler> handlers = new EnumMap<>(PlotMethod.class);
    private final Map<PlotMethod,String> currentArrays = new EnumMap<>(PlotMethod.class);
    private final AnimationState animation;

    private PlotMethod method;
    private int datasetID = Dataset.Unregistered;
    private String variable = null;
    private Preset preset = null;
    private boolean changing = false;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public SessionState(
            DatasetRegistry registry, Renderer renderer, PlotMethod method, int intervalMS) {
        this.registry = registry;
        this.method = method;
        this.animation = new AnimationState(intervalMS);
        for (PlotMethod m : PlotMethod.values()) {
            handlers.put(m, PlotMethodHandler.create(m, renderer));
        }
    }

    public DatasetRegistry getRegistry() { return registry; }
    public ArrayCollection getArrays() { return arrays; }
    public AnimationState getAnimation() { return animation; }

    public PlotMethodHandler handler(PlotMethod m) { return handlers.get(m); }

    public LinePlotHandler lineHandler() {
        return (LinePlotHandler)handlers.get(PlotMethod.LinePlot);
    }

    public PlotMethod getMethod() { return method; }
    public void setMethod(PlotMethod method) { this.method = method; }

    public int getDatasetID() { return datasetID; }
    public void setDatasetID(int id) { this.datasetID = id; }

    /**
     * @return  The current dataset or null if none is open
     */
    public Dataset currentDataset() { return registry.get(datasetID); }

    /**
     * The variable selected by the user. May be null.
     */
    public String getVariable() { return variable; }
    public void setVariable(String variable) { this.variable = variable; }

    /**
     * The preset to apply to the next plot that is created. May be null.
     */
    public Preset getPreset() { return preset; }
    public void setPreset(Preset preset) { this.preset = preset; }

    /**
     * Return the pending preset and forget about it
     */
    public Preset takePreset() {
        Preset p = preset;
        preset = null;
        return p;
    }

    public boolean isChanging() { return changing; }
    void setChanging(boolean changing) { this.changing = changing; }

/*------------------------------------------------------------------------------
 *
 * The current plot of each method
 *
 *----------------------------------------------------------------------------*/

    public String getCurrentArray(PlotMethod m) { return currentArrays.get(m); }

    public void setCurrentArray(PlotMethod m, String name) {
        if (name == null) currentArrays.remove(m);
        else currentArrays.put(m, name);
    }

    /**
     * The current plot of a method in the current dataset
     * @return  The slot or null if there is none
     */
    public PlotSlot slot(PlotMethod m) {
        PlotSlot slot = arrays.get(currentArrays.get(m));
        if (slot == null || slot.getMethod() != m) return null;
        if (slot.getDataset().getID() != datasetID) return null;
        return slot;
    }

    /**
     * The current plot of the current method
     */
    public PlotSlot currentSlot() { return slot(method); }

    /**
     * The plots of a method in the current dataset, in order
     */
    public ArrayCollection arrays(PlotMethod m) {
        return arrays.filter(datasetID).byMethod(m);
    }
}
