/*
 * DatasetRegistryTest.java - Copyright(c) 2015 Joe Pasqua
 * Provided under the MIT License. See the LICENSE file for details.
 * Created: Feb 17, 2015
 */

package org.noroomattheinn.visibledata.data;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.noroomattheinn.visibledata.Fixtures;

import static org.junit.jupiter.api.Assertions.*;

public class DatasetRegistryTest {

    @Test public void assignsSequentialIDs() {
        DatasetRegistry r = new DatasetRegistry(null);
        Dataset a = Fixtures.climate("a"), b = Fixtures.climate("b");
        assertEquals(0, r.register(a));
        assertEquals(1, r.register(b));
        assertSame(b, r.get(1));
        assertTrue(r.contains(0));
        assertFalse(r.contains(2));
        assertNull(r.get(Dataset.Unregistered));
        assertEquals(2, r.size());
        assertEquals(0, r.all().indexOf(a));
    }

    @Test public void aDatasetIsRegisteredOnce() {
        DatasetRegistry r = new DatasetRegistry(null);
        Dataset a = Fixtures.climate();
        r.register(a);
        try {
            r.register(a);
            fail("Registered twice");
        } catch (IllegalStateException expected) {
        }
        assertEquals(1, r.size());
    }

    @Test public void opensThroughTheDataSource() throws IOException {
        DatasetRegistry r = new DatasetRegistry(new DataSource() {
            @Override public Dataset open(String path) { return Fixtures.climate(path); }
        });
        Dataset ds = r.open("x.json");
        assertEquals(0, ds.getID());
        assertEquals("x.json", ds.getSource());
    }

    @Test public void openWithoutDataSourceFails() {
        try {
            new DatasetRegistry(null).open("x.json");
            fail("Opened without a data source");
        } catch (IOException expected) {
        }
    }

    @Test public void unknownVariablesAreRejected() {
        Dataset ds = Fixtures.climate();
        assertNull(ds.getVariable("v10"));
        try {
            ds.variable("v10");
            fail("Found a missing variable");
        } catch (IllegalArgumentException expected) {
        }
    }
}
