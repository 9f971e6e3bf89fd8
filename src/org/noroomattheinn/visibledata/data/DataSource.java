/*
 * DataSource.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 08, 2015
 */
package org.noroomattheinn.visibledata.data;

import java.io.IOException;

/**
 * DataSource: Interface to anything that can produce a Dataset from a path.
 *
 * @author Joe Pasqua <joe at NoRoomAtTheInn dot org>
 */
public interface DataSource {

    /**
     * Open the dataset at the given location. The returned Dataset is not
     * yet registered.
     *
     * @param path  The location of the dataset
     * @return      The dataset
     * @throws IOException If the dataset can't be read or is malformed
     */
    public Dataset open(String path) throws IOException;
}
