/*
 * Slice.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 07, 2015
 */

package org.noroomattheinn.visibledata.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Slice: An immutable description of the part of a Variable that is handed to
 * the renderer.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Slice {

    /**
     * The variable being sliced
     */
    public final Variable variable;

    /**
     * Index of each dimension. Free dimensions carry DimensionIndexState.Free
     */
    public final ImmutableMap<String,Integer> indices;

    /**
     * The dimensions which are kept whole, in the variable's order
     */
    public final ImmutableList<String> freeDims;

    Slice(Variable variable, Map<String,Integer> indices, List<String> freeDims) {
        this.variable = variable;
        this.indices = ImmutableMap.copyOf(indices);
        this.freeDims = ImmutableList.copyOf(freeDims);
    }

    public String getName() { return variable.getName(); }

    @Override public String toString() {
        return variable.getName() + indices;
    }
}
