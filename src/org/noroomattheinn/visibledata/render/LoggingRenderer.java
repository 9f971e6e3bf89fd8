/*
 * LoggingRenderer.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.render;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.noroomattheinn.visibledata.data.Slice;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * LoggingRenderer: A headless Renderer that logs what it would draw.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class LoggingRenderer implements Renderer {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.render");

    private int nextPlot = 0;

    /**
     * A variable can be shown if it has at least as many dimensions with
     * more than one entry as the method has axes.
     */
    @Override public boolean supports(PlotMethod method, Variable variable) {
        int varying = 0;
        for (int size : variable.getShape()) {
            if (size > 1) varying++;
        }
        return varying >= method.nAxes();
    }

    @Override public RendererHandle render(
            List<Slice> slices, PlotMethod method, Map<String,Object> formatoptions) {
        Handle h = new Handle(nextPlot++, method);
        logger.info("Plot " + h.id + ": " + method + " of " + describe(slices) + " " + formatoptions);
        return h;
    }

    private static String describe(List<Slice> slices) {
        StringBuilder sb = new StringBuilder();
        for (Slice s : slices) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(s.getName()).append(s.indices);
        }
        return sb.toString();
    }

    private static class Handle implements RendererHandle {
        private final int id;
        private final PlotMethod method;
        private final Map<Integer,ClickListener> listeners = new HashMap<>();
        private int nextConnection = 0;
        private boolean closed = false;

        Handle(int id, PlotMethod method) {
            this.id = id;
            this.method = method;
        }

        @Override public void update(List<Slice> slices, Map<String,Object> formatoptions) {
            if (closed) { logger.warning("Update of closed plot " + id); return; }
            logger.info("Plot " + id + ": update to " + describe(slices) +
                    (formatoptions.isEmpty() ? "" : " " + formatoptions));
        }

        @Override public void replot(List<Slice> slices, Map<String,Object> formatoptions) {
            if (closed) { logger.warning("Replot of closed plot " + id); return; }
            logger.info("Plot " + id + ": replot " + method + " of " + describe(slices) + " " + formatoptions);
        }

        @Override public void show() { logger.fine("Plot " + id + ": show"); }

        @Override public int connect(ClickListener listener) {
            int cid = nextConnection++;
            listeners.put(cid, listener);
            logger.fine("Plot " + id + ": connected listener " + cid);
            return cid;
        }

        @Override public void disconnect(int connectionID) {
            listeners.remove(connectionID);
            logger.fine("Plot " + id + ": disconnected listener " + connectionID);
        }

        @Override public void close() {
            listeners.clear();
            closed = true;
            logger.info("Plot " + id + ": closed");
        }
    }
}
