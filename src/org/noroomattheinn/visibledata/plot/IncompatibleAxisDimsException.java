/*
 * IncompatibleAxisDimsException.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 09, 2015
 */
package org.noroomattheinn.visibledata.plot;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown when a variable does not have the axis dimensions a plot needs.
 * Callers recover by closing the plot and creating a new one.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class IncompatibleAxisDimsException extends Exception {
    private final String variable;
    private final ImmutableList<String> axisDims;

    public IncompatibleAxisDimsException(String variable, List<String> axisDims, String message) {
        super(message);
        this.variable = variable;
        this.axisDims = ImmutableList.copyOf(axisDims);
    }

    public String getVariable() { return variable; }

    /**
     * @return  The axis dimensions that were required
     */
    public List<String> getAxisDims() { return axisDims; }
}
