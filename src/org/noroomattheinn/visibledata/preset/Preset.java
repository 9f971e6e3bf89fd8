/*
 * Preset.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 14, 2015
 */

package org.noroomattheinn.visibledata.preset;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * Preset: A named bundle of format options. Generic options apply to every
 * plot method; method specific ones override them for that method.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Preset {
    private final String source;
    private final ImmutableMap<String,Object> generic;
    private final Map<PlotMethod,ImmutableMap<String,Object>> perMethod;

    public Preset(
            String source, Map<String,Object> generic,
            Map<PlotMethod,Map<String,Object>> perMethod) {
        this.source = source;
        this.generic = ImmutableMap.copyOf(generic);
        this.perMethod = new EnumMap<>(PlotMethod.class);
        for (Map.Entry<PlotMethod,Map<String,Object>> e : perMethod.entrySet()) {
            this.perMethod.put(e.getKey(), ImmutableMap.copyOf(e.getValue()));
        }
    }

    public String getSource() { return source; }

    public Map<String,Object> getGeneric() { return generic; }

    /**
     * @return  The options to apply to a plot of the given method
     */
    public Map<String,Object> fmtsFor(PlotMethod method) {
        Map<String,Object> fmts = new LinkedHashMap<>(generic);
        ImmutableMap<String,Object> specific = perMethod.get(method);
        if (specific != null) fmts.putAll(specific);
        return fmts;
    }

    public boolean isEmpty() {
        if (!generic.isEmpty()) return false;
        for (ImmutableMap<String,Object> m : perMethod.values()) {
            if (!m.isEmpty()) return false;
        }
        return true;
    }

    @Override public String toString() { return "Preset(" + source + ")"; }
}
