/*
 * Dataset.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 07, 2015
 */

package org.noroomattheinn.visibledata.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Dataset: A collection of dimensions and the variables defined on them.
 * Datasets are built with a Dataset.Builder and receive their id when they
 * are registered with the DatasetRegistry.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Dataset {
/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final int Unregistered = -1;

    private static final List<String> XNames = Arrays.asList("lon", "longitude", "x", "rlon");
    private static final List<String> YNames = Arrays.asList("lat", "latitude", "y", "rlat");
    private static final List<String> TNames = Arrays.asList("time", "t", "date");
    private static final List<String> ZNames = Arrays.asList(
            "lev", "level", "plev", "height", "depth", "z", "altitude");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private int id = Unregistered;
    private final String source;
    private final ImmutableMap<String,Integer> dims;
    private final Map<String,Variable> variables = new LinkedHashMap<>();
    private final Map<String,Coordinate> coords;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    private Dataset(Builder b) {
        this.source = b.source;
        this.dims = ImmutableMap.copyOf(b.dims);
        this.coords = new HashMap<>(b.coords);
        for (Map.Entry<String,VarSpec> e : b.variables.entrySet()) {
            variables.put(e.getKey(), new Variable(this, e.getKey(), e.getValue().dims, e.getValue().attrs));
        }
    }

    public int getID() { return id; }
    public String getSource() { return source; }
    public boolean isRegistered() { return id != Unregistered; }

    /**
     * The dimensions of this dataset, in the order they were declared
     * @return An immutable map from dimension name to size
     */
    public Map<String,Integer> getDims() { return dims; }

    public int size(String dim) {
        Integer size = dims.get(dim);
        return size == null ? 0 : size;
    }

    public boolean hasVariable(String name) { return variables.containsKey(name); }

    public Variable getVariable(String name) { return variables.get(name); }

    /**
     * Like getVariable, but complains if the variable is unknown
     * @param name  The variable name
     * @return      The variable
     * @throws IllegalArgumentException if there is no such variable
     */
    public Variable variable(String name) {
        Variable v = variables.get(name);
        if (v == null) {
            throw new IllegalArgumentException("No variable " + name + " in dataset " + this);
        }
        return v;
    }

    public Collection<Variable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public List<String> variableNames() { return ImmutableList.copyOf(variables.keySet()); }

/*------------------------------------------------------------------------------
 *
 * Coordinate information for the dimension table
 *
 *----------------------------------------------------------------------------*/

    /**
     * Return a printable label for the index-th entry along a dimension. If
     * the dataset carries no coordinate for the dimension the index itself
     * is used.
     */
    public String coordLabel(String dim, int index) {
        Coordinate c = coords.get(dim);
        if (c == null || index < 0 || index >= c.labels.size()) return String.valueOf(index);
        return c.labels.get(index);
    }

    /**
     * Numeric coordinate values for a dimension
     * @return  The values, or null if the coordinate is missing or not numeric
     */
    public double[] coordValues(String dim) {
        Coordinate c = coords.get(dim);
        return c == null ? null : c.values;
    }

    public String coordUnits(String dim) {
        Coordinate c = coords.get(dim);
        return c == null ? null : c.units;
    }

    /**
     * Guess the CF axis (X, Y, Z or T) of a dimension. An explicit axis on
     * the coordinate wins, otherwise the dimension name decides.
     * @return  The axis letter or an empty string if it can't be determined
     */
    public String axisOf(String dim) {
        Coordinate c = coords.get(dim);
        if (c != null && StringUtils.isNotBlank(c.axis)) return c.axis.toUpperCase();
        String lower = StringUtils.lowerCase(dim);
        if (XNames.contains(lower)) return "X";
        if (YNames.contains(lower)) return "Y";
        if (TNames.contains(lower)) return "T";
        if (ZNames.contains(lower)) return "Z";
        return "";
    }

    @Override public String toString() {
        return (isRegistered() ? id + ": " : "") + StringUtils.defaultString(source, "<memory>");
    }

/*------------------------------------------------------------------------------
 *
 * PACKAGE - Methods used by the DatasetRegistry
 *
 *----------------------------------------------------------------------------*/

    void assignID(int id) {
        Preconditions.checkState(this.id == Unregistered, "Dataset %s is already registered", this);
        this.id = id;
    }

/*------------------------------------------------------------------------------
 *
 * Builder
 *
 *----------------------------------------------------------------------------*/

    private static class VarSpec {
        final List<String> dims;
        final Map<String,String> attrs;
        VarSpec(List<String> dims, Map<String,String> attrs) { this.dims = dims; this.attrs = attrs; }
    }

    private static class Coordinate {
        final List<String> labels;
        final double[] values;
        final String units;
        final String axis;
        Coordinate(List<String> labels, double[] values, String units, String axis) {
            this.labels = labels; this.values = values; this.units = units; this.axis = axis;
        }
    }

    public static class Builder {
        private final String source;
        private final Map<String,Integer> dims = new LinkedHashMap<>();
        private final Map<String,VarSpec> variables = new LinkedHashMap<>();
        private final Map<String,Coordinate> coords = new HashMap<>();

        public Builder(String source) { this.source = source; }

        public Builder dim(String name, int size) {
            Preconditions.checkArgument(size > 0, "Dimension %s must have a positive size", name);
            dims.put(name, size);
            return this;
        }

        public Builder variable(String name, String... dimNames) {
            return variable(name, Collections.<String,String>emptyMap(), dimNames);
        }

        public Builder variable(String name, Map<String,String> attrs, String... dimNames) {
            return variable(name, attrs, Arrays.asList(dimNames));
        }

        public Builder variable(String name, Map<String,String> attrs, List<String> dimNames) {
            for (String dim : dimNames) {
                Preconditions.checkArgument(dims.containsKey(dim),
                        "Variable %s uses undeclared dimension %s", name, dim);
            }
            Preconditions.checkArgument(
                    dimNames.size() == new HashSet<>(dimNames).size(),
                    "Variable %s repeats a dimension", name);
            variables.put(name, new VarSpec(new ArrayList<>(dimNames), attrs));
            return this;
        }

        /**
         * Attach coordinate labels to a dimension. Labels that all parse as
         * numbers also provide numeric values used to locate clicked points.
         */
        public Builder coord(String dim, List<String> labels, String units, String axis) {
            Preconditions.checkArgument(dims.containsKey(dim), "Unknown dimension %s", dim);
            Preconditions.checkArgument(labels.size() == dims.get(dim),
                    "Coordinate %s has %s labels but the dimension has size %s",
                    dim, labels.size(), dims.get(dim));
            double[] values = new double[labels.size()];
            for (int i = 0; values != null && i < values.length; i++) {
                try {
                    values[i] = Double.parseDouble(labels.get(i));
                } catch (NumberFormatException e) {
                    values = null;
                }
            }
            coords.put(dim, new Coordinate(ImmutableList.copyOf(labels), values, units, axis));
            return this;
        }

        public Dataset build() { return new Dataset(this); }
    }
}
