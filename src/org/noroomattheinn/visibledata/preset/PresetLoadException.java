/*
 * PresetLoadException.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 14, 2015
 */

package org.noroomattheinn.visibledata.preset;

import java.io.IOException;

/**
 * PresetLoadException: A preset file could not be read or parsed.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class PresetLoadException extends IOException {
    private final String source;

    public PresetLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() { return source; }
}
