/*
 * PlotEvent.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 10, 2015
 */
package org.noroomattheinn.visibledata.plot;

/**
 * PlotEvent: Notification that something about the plot of a plot method
 * changed and the session (and the UI) need to react.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class PlotEvent {
    public enum Type {
        /** Regenerate the plot without closing it */
        Replot,
        /** Close the plot and regenerate it */
        Reset,
        /** State changed, widgets need to be refreshed */
        Changed
    };

    public final Type type;
    public final PlotMethod method;

    public PlotEvent(Type type, PlotMethod method) {
        this.type = type;
        this.method = method;
    }

    @Override public String toString() { return type + "(" + method + ")"; }

    @Override public boolean equals(Object o) {
        if (!(o instanceof PlotEvent)) return false;
        PlotEvent other = (PlotEvent)o;
        return type == other.type && method == other.method;
    }

    @Override public int hashCode() { return type.hashCode() * 31 + (method == null ? 0 : method.hashCode()); }

    /**
     * Interface to anything that wants to hear about PlotEvents
     */
    public interface Listener {
        public void handle(PlotEvent event);
    }
}
