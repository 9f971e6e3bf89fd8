/*
 * DescriptorDataSource.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 08, 2015
 */

package org.noroomattheinn.visibledata.data;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.apache.commons.io.FileUtils;

/**
 * DescriptorDataSource: Builds a Dataset from a JSON descriptor. The descriptor
 * lists the dimensions, optional coordinate labels and the variables:
 * <pre>
 * {
 *   "dims": {"time": 5, "lat": 3, "lon": 4},
 *   "coords": {"lat": {"values": ["-30", "0", "30"], "units": "degrees_north"}},
 *   "variables": {
 *     "t2m": {"dims": ["time", "lat", "lon"], "attrs": {"units": "K"}}
 *   }
 * }
 * </pre>
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class DescriptorDataSource implements DataSource {
    private static final Gson gson = new Gson();

/*------------------------------------------------------------------------------
 *
 * The shape of the descriptor, as seen by Gson
 *
 *----------------------------------------------------------------------------*/

    private static class Descriptor {
        Map<String,Integer> dims;
        Map<String,CoordSpec> coords;
        Map<String,VariableSpec> variables;
    }

    private static class CoordSpec {
        List<String> values;
        String units;
        String axis;
    }

    private static class VariableSpec {
        List<String> dims;
        Map<String,String> attrs;
    }

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    @Override public Dataset open(String path) throws IOException {
        File f = new File(path);
        String json = FileUtils.readFileToString(f, StandardCharsets.UTF_8);
        return fromJSON(path, json);
    }

    /**
     * Build a Dataset from the text of a descriptor
     * @param source    A name for the dataset (usually the path)
     * @param json      The descriptor
     * @return          The (unregistered) Dataset
     * @throws IOException If the descriptor is malformed
     */
    public Dataset fromJSON(String source, String json) throws IOException {
        Descriptor d;
        try {
            d = gson.fromJson(json, Descriptor.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed dataset descriptor " + source + ": " + e.getMessage(), e);
        }
        if (d == null || d.dims == null || d.dims.isEmpty()) {
            throw new IOException("Dataset descriptor " + source + " declares no dimensions");
        }

        try {
            Dataset.Builder b = new Dataset.Builder(source);
            for (Map.Entry<String,Integer> e : d.dims.entrySet()) {
                if (e.getValue() == null) {
                    throw new IOException("Inconsistent dataset descriptor " + source +
                            ": dimension " + e.getKey() + " has no size");
                }
                b.dim(e.getKey(), e.getValue());
            }
            if (d.coords != null) {
                for (Map.Entry<String,CoordSpec> e : d.coords.entrySet()) {
                    CoordSpec c = e.getValue();
                    if (c == null || c.values == null) continue;
                    b.coord(e.getKey(), c.values, c.units, c.axis);
                }
            }
            if (d.variables != null) {
                for (Map.Entry<String,VariableSpec> e : d.variables.entrySet()) {
                    VariableSpec v = e.getValue();
                    List<String> dims = (v == null || v.dims == null)
                            ? Collections.<String>emptyList() : v.dims;
                    Map<String,String> attrs = (v == null || v.attrs == null)
                            ? Collections.<String,String>emptyMap() : v.attrs;
                    b.variable(e.getKey(), attrs, dims);
                }
            }
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Inconsistent dataset descriptor " + source + ": " + e.getMessage(), e);
        }
    }
}
