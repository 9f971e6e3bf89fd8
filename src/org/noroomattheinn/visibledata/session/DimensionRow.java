/*
 * DimensionRow.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.util.Objects;

/**
 * DimensionRow: One row of the dimension table shown next to a plot.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class DimensionRow {
    public final String dim;
    public final String axis;
    public final String first;
    public final String current;    // null for axis dimensions
    public final String last;
    public final String units;

    public DimensionRow(
            String dim, String axis, String first, String current, String last, String units) {
        this.dim = dim;
        this.axis = axis;
        this.first = first;
        this.current = current;
        this.last = last;
        this.units = units;
    }

    public boolean isFree() { return current == null; }

    @Override public boolean equals(Object o) {
        if (!(o instanceof DimensionRow)) return false;
        DimensionRow r = (DimensionRow)o;
        return Objects.equals(dim, r.dim) && Objects.equals(axis, r.axis) &&
               Objects.equals(first, r.first) && Objects.equals(current, r.current) &&
               Objects.equals(last, r.last) && Objects.equals(units, r.units);
    }

    @Override public int hashCode() { return Objects.hash(dim, axis, first, current, last, units); }

    @Override public String toString() {
        return dim + " [" + axis + "] " + first + " .. " +
               (current == null ? "(axis)" : current) + " .. " + last +
               (units == null ? "" : " " + units);
    }
}
