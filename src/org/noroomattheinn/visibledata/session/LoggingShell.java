/*
 * LoggingShell.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 16, 2015
 */

package org.noroomattheinn.visibledata.session;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import org.noroomattheinn.visibledata.plot.PlotEvent;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * LoggingShell: A UIShell without widgets. It logs what a real shell would
 * show and always picks the first plot method offered.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class LoggingShell implements UIShell {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.shell");

    @Override public void setEnabled(ControlSet controls, boolean enabled) {
        logger.fine(controls + (enabled ? " enabled" : " disabled"));
    }

    @Override public void setValidVariables(List<String> names) {
        logger.fine("Variables: " + StringUtils.join(names, ", "));
    }

    @Override public void populateDimensions(List<DimensionRow> rows) {
        for (DimensionRow row : rows) { logger.info("  " + row); }
    }

    @Override public void populateArrays(List<String> descriptions, int current) {
        for (int i = 0; i < descriptions.size(); i++) {
            logger.fine((i == current ? "* " : "  ") + descriptions.get(i));
        }
    }

    @Override public PlotMethod choosePlotMethod(String variable, List<PlotMethod> options) {
        PlotMethod m = options.isEmpty() ? null : options.get(0);
        logger.info("Showing " + variable + " with " + m);
        return m;
    }

    @Override public void reportError(String message, Exception cause) {
        logger.log(Level.WARNING, message, cause);
    }

    @Override public void handle(PlotEvent event) {
        logger.finest("Event: " + event);
    }
}
