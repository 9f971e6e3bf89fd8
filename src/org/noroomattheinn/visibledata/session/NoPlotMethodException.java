/*
 * NoPlotMethodException.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.session;

/**
 * NoPlotMethodException: None of the plot methods can show a variable.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class NoPlotMethodException extends Exception {
    private final String variable;

    public NoPlotMethodException(String variable) {
        super("No plot method can show variable " + variable);
        this.variable = variable;
    }

    public String getVariable() { return variable; }
}
