/*
 * PresetStore.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 14, 2015
 */

package org.noroomattheinn.visibledata.preset;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.noroomattheinn.visibledata.plot.PlotMethod;

/**
 * PresetStore: Read presets from JSON files. Top level keys are generic
 * options, except for keys named after a plot method (mapplot, plot2d,
 * lineplot) whose object values hold the options for that method:
 * <pre>
 * {
 *   "title": "My plot",
 *   "mapplot": {"cmap": "RdBu_r", "projection": "robin"},
 *   "lineplot": {"legend": false}
 * }
 * </pre>
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class PresetStore {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.preset");
    private static final Gson gson = new Gson();

    /**
     * Load a preset from a file
     * @throws PresetLoadException If the file can't be read or isn't a preset
     */
    public Preset load(String path) throws PresetLoadException {
        String json;
        try {
            json = FileUtils.readFileToString(new File(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PresetLoadException(path, "Can't read preset " + path + ": " + e.getMessage(), e);
        }
        Preset p = fromJSON(path, json);
        logger.info("Loaded preset " + path);
        return p;
    }

    public static Preset fromJSON(String source, String json) throws PresetLoadException {
        JsonObject root;
        try {
            JsonElement e = JsonParser.parseString(json);
            if (!e.isJsonObject()) {
                throw new PresetLoadException(source, "Preset " + source + " is not a JSON object", null);
            }
            root = e.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new PresetLoadException(source, "Malformed preset " + source + ": " + e.getMessage(), e);
        }

        Map<String,Object> generic = new LinkedHashMap<>();
        Map<PlotMethod,Map<String,Object>> perMethod = new EnumMap<>(PlotMethod.class);
        for (Map.Entry<String,JsonElement> e : root.entrySet()) {
            PlotMethod m = PlotMethod.fromLabel(e.getKey());
            if (m != null) {
                if (!e.getValue().isJsonObject()) {
                    throw new PresetLoadException(source,
                            "Options for " + m + " in preset " + source + " must be an object", null);
                }
                perMethod.put(m, toMap(e.getValue().getAsJsonObject()));
            } else if (!e.getValue().isJsonNull()) {
                generic.put(e.getKey(), toValue(e.getValue()));
            }
        }
        return new Preset(source, generic, perMethod);
    }

    private static Map<String,Object> toMap(JsonObject o) {
        Map<String,Object> m = new LinkedHashMap<>();
        for (Map.Entry<String,JsonElement> e : o.entrySet()) {
            if (!e.getValue().isJsonNull()) m.put(e.getKey(), toValue(e.getValue()));
        }
        return m;
    }

    private static Object toValue(JsonElement e) {
        return gson.fromJson(e, Object.class);
    }
}
