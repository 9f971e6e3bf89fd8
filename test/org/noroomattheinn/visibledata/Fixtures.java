/*
 * Fixtures.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 17, 2015
 */

package org.noroomattheinn.visibledata;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import org.noroomattheinn.visibledata.data.Dataset;
import org.noroomattheinn.visibledata.data.DatasetRegistry;

/**
 * Fixtures: Datasets shared by the tests.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class Fixtures {

    /**
     * A small climate dataset:
     * t2m(time, lat, lon), u(time, lev, lat, lon), zonal(time, lat),
     * series(time), profile(lat) and flag(one) which no method can show.
     */
    public static Dataset climate() {
        return climate("climate.json");
    }

    public static Dataset climate(String source) {
        return new Dataset.Builder(source)
                .dim("time", 5).dim("lev", 3).dim("lat", 4).dim("lon", 8).dim("one", 1)
                .coord("time", Arrays.asList(
                        "2000-01", "2000-02", "2000-03", "2000-04", "2000-05"), null, "T")
                .coord("lev", Arrays.asList("1000", "850", "500"), "hPa", "Z")
                .coord("lat", Arrays.asList("-45", "-15", "15", "45"), "degrees_north", null)
                .coord("lon", Arrays.asList(
                        "0", "45", "90", "135", "180", "225", "270", "315"), "degrees_east", null)
                .variable("t2m", ImmutableMap.of("units", "K", "long_name", "2m temperature"),
                        "time", "lat", "lon")
                .variable("u", ImmutableMap.of("units", "m/s"), "time", "lev", "lat", "lon")
                .variable("zonal", "time", "lat")
                .variable("series", "time")
                .variable("profile", "lat")
                .variable("flag", "one")
                .build();
    }

    /**
     * A registry holding the given datasets, which have ids 0, 1, ...
     */
    public static DatasetRegistry registry(Dataset... datasets) {
        DatasetRegistry r = new DatasetRegistry(null);
        for (Dataset ds : datasets) { r.register(ds); }
        return r;
    }
}
