/*
 * Line.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 10, 2015
 */
package org.noroomattheinn.visibledata.plot;

import org.noroomattheinn.visibledata.data.Slice;
import org.noroomattheinn.visibledata.data.Variable;

/**
 * Line: A variable together with the index state it is displayed with. Map
 * and 2D plots show a single Line, line plots may show several.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Line {
    private Variable variable;
    private final DimensionIndexState idims;

    public Line(Variable variable, DimensionIndexState idims) {
        if (!idims.dims().equals(variable.getDims())) {
            throw new IllegalArgumentException(idims + " does not describe " + variable);
        }
        this.variable = variable;
        this.idims = idims;
    }

    public Variable getVariable() { return variable; }
    public DimensionIndexState getIdims() { return idims; }

    public Slice slice() { return variable.select(idims); }

    /**
     * Switch this line to another variable, carrying over its index state
     * @throws IncompatibleAxisDimsException If the variable lacks an axis dim
     */
    void switchVariable(Variable v) throws IncompatibleAxisDimsException {
        idims.switchVariable(v);
        this.variable = v;
    }

    @Override public String toString() { return idims.toString(); }
}
