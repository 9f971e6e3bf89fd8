/*
 * DimensionOutOfRangeException.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 09, 2015
 */
package org.noroomattheinn.visibledata.plot;

/**
 * Thrown when an index update names an unknown dimension, tries to fix a free
 * dimension, or is outside of the dimension's bounds.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class DimensionOutOfRangeException extends IllegalArgumentException {
    private final String dim;
    private final int index;
    private final int size;

    public DimensionOutOfRangeException(String dim, int index, int size, String message) {
        super(message);
        this.dim = dim;
        this.index = index;
        this.size = size;
    }

    public String getDim() { return dim; }
    public int getIndex() { return index; }

    /**
     * @return  The size of the dimension, 0 if the dimension is unknown
     */
    public int getSize() { return size; }
}
