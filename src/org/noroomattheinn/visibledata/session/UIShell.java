/*
 * UIShell.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 13, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.util.List;
import org.noroomattheinn.visibledata.plot.PlotEvent;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * UIShell: The widgets around the plots. The session tells the shell what to
 * show; the shell calls back into the SessionController on user actions.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface UIShell extends PlotEvent.Listener {

    public enum ControlSet { Variables, Navigation, PlotMethods }

    public void setEnabled(ControlSet controls, boolean enabled);

    /**
     * Enable the buttons of exactly these variables
     */
    public void setValidVariables(List<String> names);

    public void populateDimensions(List<DimensionRow> rows);

    /**
     * Fill the array selector
     * @param descriptions  One entry per plot
     * @param current       Index of the selected entry or -1
     */
    public void populateArrays(List<String> descriptions, int current);

    /**
     * Ask the user for another plot method.
     * @param variable  The variable the current method can't show
     * @param options   The methods that can show it
     * @return          The choice, or null if the user cancelled
     */
    public PlotMethod choosePlotMethod(String variable, List<PlotMethod> options);

    public void reportError(String message, Exception cause);
}
