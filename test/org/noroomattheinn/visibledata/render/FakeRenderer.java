/*
 * FakeRenderer.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 17, 2015
 */

package org.noroomattheinn.visibledata.render;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.noroomattheinn.visibledata.data.Slice;
import org.noroomattheinn.visibledata.data.Variable;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * FakeRenderer: A Renderer that records every call for the tests.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class FakeRenderer implements Renderer {
    private final LoggingRenderer dims = new LoggingRenderer();

    public final Set<PlotMethod> unsupported = EnumSet.noneOf(PlotMethod.class);
    public final List<FakeHandle> handles = new ArrayList<>();

    @Override public boolean supports(PlotMethod method, Variable variable) {
        return !unsupported.contains(method) && dims.supports(method, variable);
    }

    @Override public RendererHandle render(
            List<Slice> slices, PlotMethod method, Map<String,Object> formatoptions) {
        FakeHandle h = new FakeHandle(method, slices, formatoptions);
        handles.add(h);
        return h;
    }

    public FakeHandle last() { return handles.get(handles.size() - 1); }

    public static class FakeHandle implements RendererHandle {
        public final PlotMethod method;
        public List<Slice> slices;
        public final Map<String,Object> formatoptions = new LinkedHashMap<>();
        public final Map<Integer,ClickListener> listeners = new LinkedHashMap<>();
        public int updates = 0;
        public int replots = 0;
        public int shows = 0;
        public boolean closed = false;
        private int nextConnection = 0;

        FakeHandle(PlotMethod method, List<Slice> slices, Map<String,Object> formatoptions) {
            this.method = method;
            this.slices = slices;
            this.formatoptions.putAll(formatoptions);
        }

        @Override public void update(List<Slice> slices, Map<String,Object> formatoptions) {
            this.slices = slices;
            this.formatoptions.putAll(formatoptions);
            updates++;
        }

        @Override public void replot(List<Slice> slices, Map<String,Object> formatoptions) {
            this.slices = slices;
            this.formatoptions.putAll(formatoptions);
            replots++;
        }

        @Override public void show() { shows++; }

        @Override public int connect(ClickListener listener) {
            int cid = nextConnection++;
            listeners.put(cid, listener);
            return cid;
        }

        @Override public void disconnect(int connectionID) { listeners.remove(connectionID); }

        @Override public void close() { closed = true; }

        /**
         * Simulate a click into the plot
         */
        public void click(double x, double y) {
            for (ClickListener l : new ArrayList<>(listeners.values())) { l.clicked(x, y); }
        }

        public int index(String dim) { return slices.get(0).indices.get(dim); }
    }
}
