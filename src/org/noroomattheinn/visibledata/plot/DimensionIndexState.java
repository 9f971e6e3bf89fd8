/*
 * DimensionIndexState.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 09, 2015
 */

package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.noroomattheinn.visibledata.data.Variable;

/**
 * DimensionIndexState ("idims"): For each dimension of a displayed variable,
 * either the index that is shown or the Free marker if the dimension is drawn
 * along one of the plot's axes.
 *
 * NOTES
 * - Every dimension of the variable appears exactly once, in the variable's
 *   order. The number of free dimensions never changes after creation.
 * - Updates are validated completely before anything is applied, so a failed
 *   update leaves the state as it was.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class DimensionIndexState {
/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final int Free = -1;

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private String variable;
    private LinkedHashMap<String,Integer> indices;
    private Map<String,Integer> sizes;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    private DimensionIndexState(
            String variable, LinkedHashMap<String,Integer> indices, Map<String,Integer> sizes) {
        this.variable = variable;
        this.indices = indices;
        this.sizes = sizes;
    }

    /**
     * Create the initial index state for displaying a variable with a plot
     * method. The free dimensions are chosen from (in order of preference):
     * the preferred axis dimensions that the variable has, the conventional
     * axes of the method (the last two dimensions for gridded plots, the last
     * dimension with more than one entry for line plots), and finally the
     * first remaining dimensions. All other dimensions start at index 0.
     *
     * @param v                 The variable to display
     * @param m                 The plot method
     * @param preferredAxisDims Axis dimensions chosen earlier. May be null.
     * @return                  The new state
     * @throws IncompatibleAxisDimsException If the variable has fewer
     *                          dimensions than the method needs
     */
    public static DimensionIndexState init(
            Variable v, PlotMethod m, List<String> preferredAxisDims)
            throws IncompatibleAxisDimsException {
        List<String> axes = chooseAxisDims(v, m, preferredAxisDims);
        return build(v, axes, Collections.<String,Integer>emptyMap());
    }

    /**
     * Create the index state for one line of a line plot.
     *
     * @param v     The variable of the line
     * @param xdim  The dimension drawn along the x axis
     * @param reuse Indices to carry over (typically those of another line).
     *              Entries for dimensions the variable lacks are ignored.
     * @return      The new state
     * @throws IncompatibleAxisDimsException If the variable lacks xdim
     */
    public static DimensionIndexState forLine(
            Variable v, String xdim, Map<String,Integer> reuse)
            throws IncompatibleAxisDimsException {
        if (xdim == null || !v.hasDim(xdim)) {
            throw new IncompatibleAxisDimsException(
                    v.getName(), Collections.singletonList(String.valueOf(xdim)),
                    "Variable " + v + " has no dimension " + xdim);
        }
        return build(v, Collections.singletonList(xdim), reuse);
    }

    public String getVariable() { return variable; }

    public int get(String dim) {
        Integer i = indices.get(dim);
        if (i == null) throw new IllegalArgumentException("No dimension " + dim + " in " + this);
        return i;
    }

    public boolean contains(String dim) { return indices.containsKey(dim); }

    public boolean isFree(String dim) {
        Integer i = indices.get(dim);
        return i != null && i == Free;
    }

    public int size(String dim) {
        Integer s = sizes.get(dim);
        return s == null ? 0 : s;
    }

    public List<String> dims() { return ImmutableList.copyOf(indices.keySet()); }

    public List<String> freeDims() {
        List<String> free = new ArrayList<>();
        for (Map.Entry<String,Integer> e : indices.entrySet()) {
            if (e.getValue() == Free) free.add(e.getKey());
        }
        return free;
    }

    public List<String> scalarDims() {
        List<String> scalar = new ArrayList<>();
        for (Map.Entry<String,Integer> e : indices.entrySet()) {
            if (e.getValue() != Free) scalar.add(e.getKey());
        }
        return scalar;
    }

    /**
     * @return  An immutable snapshot of all indices (Free for free dims)
     */
    public ImmutableMap<String,Integer> asMap() { return ImmutableMap.copyOf(indices); }

    /**
     * @return  An immutable snapshot of the indices of the non-free dims
     */
    public ImmutableMap<String,Integer> scalarIndices() {
        ImmutableMap.Builder<String,Integer> b = ImmutableMap.builder();
        for (Map.Entry<String,Integer> e : indices.entrySet()) {
            if (e.getValue() != Free) b.put(e.getKey(), e.getValue());
        }
        return b.build();
    }

    /**
     * Merge new indices into this state. Passing Free for a dimension that is
     * already free is allowed (and has no effect), so a state can always be
     * updated with its own asMap().
     *
     * @param partial   Map from dimension to new index
     * @return          true if any index actually changed
     * @throws DimensionOutOfRangeException If a dimension is unknown, free,
     *                  or the index is outside [0, size). Nothing is changed.
     */
    public boolean update(Map<String,Integer> partial) throws DimensionOutOfRangeException {
        for (Map.Entry<String,Integer> e : partial.entrySet()) {
            validate(e.getKey(), e.getValue());
        }
        boolean changed = false;
        for (Map.Entry<String,Integer> e : partial.entrySet()) {
            Integer old = indices.put(e.getKey(), e.getValue());
            if (!e.getValue().equals(old)) changed = true;
        }
        return changed;
    }

    /**
     * Can this state be carried over to another variable?
     * @return true if all free dimensions exist in the variable
     */
    public boolean canSwitchTo(Variable v) {
        for (String dim : freeDims()) {
            if (!v.hasDim(dim)) return false;
        }
        return true;
    }

    /**
     * Carry this state over to another variable. Shared dimensions keep their
     * index (clamped to the new bounds), new dimensions start at 0 and
     * dimensions the new variable lacks are dropped.
     *
     * @param v The new variable
     * @throws IncompatibleAxisDimsException If the new variable lacks one of
     *         the free dimensions. The state is unchanged in that case.
     */
    public void switchVariable(Variable v) throws IncompatibleAxisDimsException {
        List<String> free = freeDims();
        if (!canSwitchTo(v)) {
            throw new IncompatibleAxisDimsException(v.getName(), free,
                    "Variable " + v + " lacks axis dimensions " + free);
        }
        DimensionIndexState switched = build(v, free, indices);
        this.variable = switched.variable;
        this.indices = switched.indices;
        this.sizes = switched.sizes;
    }

    public DimensionIndexState copy() {
        return new DimensionIndexState(
                variable, new LinkedHashMap<>(indices), new HashMap<>(sizes));
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof DimensionIndexState)) return false;
        DimensionIndexState other = (DimensionIndexState)o;
        return Objects.equals(variable, other.variable) && indices.equals(other.indices);
    }

    @Override public int hashCode() { return Objects.hash(variable, indices); }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder(variable).append('(');
        boolean first = true;
        for (Map.Entry<String,Integer> e : indices.entrySet()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(e.getKey());
            if (e.getValue() != Free) sb.append('=').append(e.getValue());
        }
        return sb.append(')').toString();
    }

/*------------------------------------------------------------------------------
 *
 * PRIVATE - Utility Methods
 *
 *----------------------------------------------------------------------------*/

    private void validate(String dim, Integer index) {
        Integer current = indices.get(dim);
        int size = size(dim);
        if (current == null) {
            throw new DimensionOutOfRangeException(dim, index == null ? 0 : index, 0,
                    "Variable " + variable + " has no dimension " + dim);
        }
        if (index == null) {
            throw new DimensionOutOfRangeException(dim, 0, size, "No index given for " + dim);
        }
        if (current == Free || index == Free) {
            if (current == Free && index == Free) return;
            throw new DimensionOutOfRangeException(dim, index, size,
                    "Dimension " + dim + " of " + variable + " is " +
                    (current == Free ? "an axis dimension and can't be fixed" : "not an axis dimension"));
        }
        if (index < 0 || index >= size) {
            throw new DimensionOutOfRangeException(dim, index, size,
                    "Index " + index + " is out of range for dimension " + dim + " of size " + size);
        }
    }

    private static DimensionIndexState build(
            Variable v, Collection<String> axes, Map<String,Integer> reuse) {
        LinkedHashMap<String,Integer> indices = new LinkedHashMap<>();
        Map<String,Integer> sizes = new HashMap<>();
        for (String dim : v.getDims()) {
            int size = v.size(dim);
            sizes.put(dim, size);
            if (axes.contains(dim)) {
                indices.put(dim, Free);
            } else {
                Integer old = reuse.get(dim);
                int index = (old == null || old == Free) ? 0 : Math.max(0, Math.min(old, size - 1));
                indices.put(dim, index);
            }
        }
        return new DimensionIndexState(v.getName(), indices, sizes);
    }

    private static List<String> chooseAxisDims(
            Variable v, PlotMethod m, List<String> preferred)
            throws IncompatibleAxisDimsException {
        int n = m.nAxes();
        List<String> dims = v.getDims();
        if (dims.size() < n) {
            throw new IncompatibleAxisDimsException(v.getName(),
                    preferred == null ? Collections.<String>emptyList() : preferred,
                    "Variable " + v + " has fewer than " + n + " dimensions, " +
                    "it can't be shown with " + m);
        }

        Set<String> chosen = new LinkedHashSet<>();
        if (preferred != null) {
            for (String dim : preferred) {
                if (chosen.size() < n && dim != null && v.hasDim(dim)) chosen.add(dim);
            }
        }

        if (chosen.size() < n) {
            if (m.isGridded()) {
                for (String dim : dims.subList(dims.size() - 2, dims.size())) {
                    if (chosen.size() < n) chosen.add(dim);
                }
            } else {
                for (int i = dims.size() - 1; i >= 0; i--) {
                    if (v.getShape().get(i) > 1 && !chosen.contains(dims.get(i))) {
                        chosen.add(dims.get(i));
                        break;
                    }
                }
            }
        }

        for (String dim : dims) {
            if (chosen.size() >= n) break;
            chosen.add(dim);
        }

        List<String> ordered = new ArrayList<>();
        for (String dim : dims) {
            if (chosen.contains(dim)) ordered.add(dim);
        }
        return ordered;
    }
}
