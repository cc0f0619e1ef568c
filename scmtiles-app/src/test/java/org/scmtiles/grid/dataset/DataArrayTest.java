package org.scmtiles.grid.dataset;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DataArray} class.
 */
public class DataArrayTest {

    // 2 x 3 array: time by lon
    private static final DataArray GRID = new DataArray(Arrays.asList("time", "lon"),
                                                        new int[] { 2, 3 },
                                                        new double[] { 1, 2, 3, 4, 5, 6 },
                                                        DataArray.ValueType.DOUBLE,
                                                        null);

    @Test
    public void testSelectIndex() {
        final DataArray column = GRID.selectIndex("lon", 1);
        Assert.assertEquals("invalid dimensions", Arrays.asList("time"), column.getDimensions());
        Assert.assertArrayEquals("invalid values", new double[] { 2, 5 }, column.getValues(), 0.0);

        final DataArray row = GRID.selectIndex("time", 1);
        Assert.assertArrayEquals("invalid values", new double[] { 4, 5, 6 }, row.getValues(), 0.0);
    }

    @Test
    public void testTranspose() {
        final DataArray transposed = GRID.transpose(Arrays.asList("lon", "time"));
        Assert.assertArrayEquals("invalid shape", new int[] { 3, 2 }, transposed.getShape());
        Assert.assertArrayEquals("invalid values", new double[] { 1, 4, 2, 5, 3, 6 }, transposed.getValues(), 0.0);
        Assert.assertEquals("invalid value lookup", 6.0, transposed.getValue(2, 1), 0.0);
    }

    @Test
    public void testConcatenateAlongInnerDimension() {
        final DataArray extra = new DataArray(Arrays.asList("time", "lon"),
                                              new int[] { 2, 1 },
                                              new double[] { 7, 8 },
                                              DataArray.ValueType.INT,
                                              null);
        final DataArray joined = DataArray.concatenate(Arrays.asList(GRID, extra), "lon");
        Assert.assertArrayEquals("invalid shape", new int[] { 2, 4 }, joined.getShape());
        Assert.assertArrayEquals("invalid values",
                                 new double[] { 1, 2, 3, 7, 4, 5, 6, 8 }, joined.getValues(), 0.0);
        Assert.assertEquals("mixed types should be promoted", DataArray.ValueType.DOUBLE, joined.getValueType());
    }

    @Test
    public void testReindexFillsMissingWithNaN() {
        final DataArray ints = DataArray.vector("lon", new double[] { 10, 20 }, DataArray.ValueType.INT);
        final DataArray reindexed = ints.reindex("lon", new int[] { 1, -1, 0 });
        Assert.assertArrayEquals("invalid values", new double[] { 20, Double.NaN, 10 }, reindexed.getValues(), 0.0);
        Assert.assertEquals("filled ints should become doubles", DataArray.ValueType.DOUBLE, reindexed.getValueType());
        Assert.assertEquals("NaN should be ignored for max", 20.0, reindexed.getMaxValue(), 0.0);
    }

    @Test
    public void testExpandDimension() {
        final DataArray scalar = DataArray.scalar(42.5, DataArray.ValueType.DOUBLE).withAttribute("units", "degrees_north");
        final DataArray expanded = scalar.expandDimension("lat");
        Assert.assertEquals("invalid dimensions", Arrays.asList("lat"), expanded.getDimensions());
        Assert.assertEquals("invalid value", 42.5, expanded.getValue(0), 0.0);
        Assert.assertEquals("attributes should be kept", "degrees_north", expanded.getAttribute("units"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInconsistentShape() {
        new DataArray(Arrays.asList("time"), new int[] { 3 }, new double[] { 1, 2 }, DataArray.ValueType.DOUBLE, null);
    }

}
