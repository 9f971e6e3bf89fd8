/*
 * RendererHandle.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 10, 2015
 */
package org.noroomattheinn.visibledata.render;

import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.data.Slice;

/**
 * RendererHandle: A live plot created by a Renderer. All calls are fire and
 * forget; they are made after the corresponding state change is complete.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface RendererHandle {

    /**
     * Refresh the plot in place, reusing what was drawn before.
     * @param slices        The (possibly changed) data to show
     * @param formatoptions Options that changed. May be empty.
     */
    public void update(List<Slice> slices, Map<String,Object> formatoptions);

    /**
     * Redraw the plot from scratch (e.g. because legend or axes change).
     */
    public void replot(List<Slice> slices, Map<String,Object> formatoptions);

    /**
     * Show the plot and raise its window.
     */
    public void show();

    /**
     * Register a listener for clicks into the plot.
     * @return  A connection id to be passed to disconnect
     */
    public int connect(ClickListener listener);

    public void disconnect(int connectionID);

    /**
     * Release the plot. The handle must not be used afterwards.
     */
    public void close();

    /**
     * Interface to anything that wants to know where the user clicked, in
     * data coordinates of the plot.
     */
    public interface ClickListener {
        public void clicked(double x, double y);
    }
}
