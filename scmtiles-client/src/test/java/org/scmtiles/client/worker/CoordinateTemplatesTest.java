package org.scmtiles.client.worker;

import org.junit.Assert;
import org.junit.Test;
import org.scmtiles.client.GridTestFixtures;
import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.dataset.DataArray;
import org.scmtiles.grid.dataset.LabeledDataset;

/**
 * Tests the {@link CoordinateTemplates} class.
 */
public class CoordinateTemplatesTest {

    @Test
    public void testCellCoordinates() throws Exception {
        final CoordinateTemplates templates =
                CoordinateTemplates.fromDataset(GridTestFixtures.buildInput(), "lon", "lat", 2, 2);
        Assert.assertEquals("invalid longitude", 110.0, templates.getXCoordinate(1).getScalarValue(), 0.0);
        Assert.assertEquals("invalid latitude", 20.0, templates.getYCoordinate(1).getScalarValue(), 0.0);
        Assert.assertEquals("latitude attributes should be kept",
                            "degrees_north", templates.getYCoordinate(0).getAttribute("units"));
        Assert.assertFalse("ascending latitudes reported as descending", templates.isYDescending());
    }

    @Test
    public void testDescendingRows() throws Exception {
        final LabeledDataset input = GridTestFixtures.buildInput()
                .withCoordinate("lat", DataArray.vector("lat", new double[] { 20.0, 10.0 }, DataArray.ValueType.DOUBLE));
        final CoordinateTemplates templates = CoordinateTemplates.fromDataset(input, "lon", "lat", 2, 2);
        Assert.assertTrue("descending latitudes not detected", templates.isYDescending());
    }

    @Test(expected = GridAssemblyException.class)
    public void testSizeMismatch() throws Exception {
        CoordinateTemplates.fromDataset(GridTestFixtures.buildInput(), "lon", "lat", 3, 2);
    }
}
