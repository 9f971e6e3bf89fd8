/*
 * Variable.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 07, 2015
 */

package org.noroomattheinn.visibledata.data;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.noroomattheinn.visibledata.plot.DimensionIndexState;

/**
 * Variable: A named, multi-dimensional array in a Dataset. A Variable only
 * describes the array (its dimensions, shape and attributes). Reading the
 * actual values is the business of the renderer.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */

public class Variable implements Comparable<Variable> {
/*------------------------------------------------------------------------------
 *
 * Constants and Enums
 *
 *----------------------------------------------------------------------------*/

    public static final String UnitsAttr = "units";
    public static final String LongNameAttr = "long_name";

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final Dataset dataset;
    private final String name;
    private final ImmutableList<String> dims;
    private final ImmutableList<Integer> shape;
    private final ImmutableMap<String,String> attrs;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    Variable(Dataset dataset, String name, List<String> dims, Map<String,String> attrs) {
        this.dataset = dataset;
        this.name = name;
        this.dims = ImmutableList.copyOf(dims);
        ImmutableList.Builder<Integer> sb = ImmutableList.builder();
        for (String dim : dims) { sb.add(dataset.size(dim)); }
        this.shape = sb.build();
        this.attrs = ImmutableMap.copyOf(attrs);
    }

    public String getName() { return name; }
    public Dataset getDataset() { return dataset; }
    public List<String> getDims() { return dims; }
    public List<Integer> getShape() { return shape; }
    public Map<String,String> getAttrs() { return attrs; }
    public int ndim() { return dims.size(); }

    public boolean hasDim(String dim) { return dims.contains(dim); }

    /**
     * Return the size of the given dimension
     * @param dim   The dimension of interest
     * @return      Its size, or 0 if the variable doesn't have that dimension
     */
    public int size(String dim) {
        int index = dims.indexOf(dim);
        return index < 0 ? 0 : shape.get(index);
    }

    public String getUnits() { return attrs.get(UnitsAttr); }
    public String getLongName() { return attrs.get(LongNameAttr); }

    /**
     * Select a slice of this variable. Free dimensions stay whole, all other
     * dimensions are reduced to the given index.
     *
     * @param idims The index state describing the slice. It must describe
     *              exactly the dimensions of this variable.
     * @return      The Slice
     * @throws IllegalArgumentException if idims doesn't match this variable
     */
    public Slice select(DimensionIndexState idims) {
        if (!idims.dims().equals(dims)) {
            throw new IllegalArgumentException(
                    "Index state " + idims + " does not match dims of " + name + dims);
        }
        return new Slice(this, idims.asMap(), idims.freeDims());
    }

    @Override public int compareTo(Variable o) {
        return name.compareTo(o.name);
    }

    @Override public String toString() {
        return name + dims;
    }
}
