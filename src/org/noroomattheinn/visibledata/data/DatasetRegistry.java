/*
 * DatasetRegistry.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 08, 2015
 */

package org.noroomattheinn.visibledata.data;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * DatasetRegistry: Keeps track of all open datasets, keyed by a numeric id.
 * Entries are never evicted.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public class DatasetRegistry {
    private static final Logger logger = Logger.getLogger("org.noroomattheinn.visibledata.data");

/*------------------------------------------------------------------------------
 *
 * Internal State
 *
 *----------------------------------------------------------------------------*/

    private final DataSource source;
    private final Map<Integer,Dataset> datasets = new LinkedHashMap<>();
    private int nextID = 0;

/*==============================================================================
 * -------                                                               -------
 * -------              Public Interface To This Class                   -------
 * -------                                                               -------
 *============================================================================*/

    public DatasetRegistry(DataSource source) {
        this.source = source;
    }

    /**
     * Open a dataset using the DataSource and register it.
     * @param path  The location of the dataset
     * @return      The registered dataset
     * @throws IOException If the DataSource can't open it
     */
    public Dataset open(String path) throws IOException {
        if (source == null) {
            throw new IOException("No data source available to open " + path);
        }
        Dataset ds = source.open(path);
        register(ds);
        logger.info("Opened dataset " + ds + " with dims " + ds.getDims());
        return ds;
    }

    /**
     * Register a dataset that was created elsewhere.
     * @param ds    The dataset. It must not have been registered before.
     * @return      The id assigned to the dataset
     */
    public int register(Dataset ds) {
        int id = nextID++;
        ds.assignID(id);
        datasets.put(id, ds);
        return id;
    }

    public Dataset get(int id) { return datasets.get(id); }

    public boolean contains(int id) { return datasets.containsKey(id); }

    public List<Dataset> all() { return ImmutableList.copyOf(datasets.values()); }

    public int size() { return datasets.size(); }

    /**
     * Resolve a variable name in a registered dataset
     * @throws IllegalArgumentException If the dataset or the variable is unknown
     */
    public Variable resolve(int id, String variable) {
        Dataset ds = datasets.get(id);
        if (ds == null) throw new IllegalArgumentException("No dataset with id " + id);
        return ds.variable(variable);
    }
}
