package org.scmtiles.grid.dataset;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LabeledDataset} class.
 */
public class LabeledDatasetTest {

    @Test
    public void testConcatenateCellsAlongColumns() {

        final LabeledDataset joined = LabeledDataset.concatenate(Arrays.asList(buildCell(0.0, 100.0, 1.0),
                                                                               buildCell(0.0, 110.0, 2.0)),
                                                                 "lon");

        Assert.assertEquals("invalid lon length", 2, joined.getDimensionLength("lon"));
        Assert.assertTrue("lon should be a dimension coordinate", joined.isDimensionCoordinate("lon"));
        Assert.assertEquals("lat should stay scalar", 0, joined.getVariable("lat").getRank());
        Assert.assertEquals("time coordinate should be kept once", 3, joined.getVariable("time").getSize());
        Assert.assertEquals("invalid t dimensions",
                            Arrays.asList("lon", "time"), joined.getVariable("t").getDimensions());
        Assert.assertEquals("invalid value", 2.0, valueAt(joined, 0.0, 110.0, 60.0), 0.0);
    }

    @Test
    public void testConcatenateRowsWithMissingCell() {

        final LabeledDataset fullRow = LabeledDataset.concatenate(Arrays.asList(buildCell(0.0, 100.0, 1.0),
                                                                                buildCell(0.0, 110.0, 2.0)),
                                                                  "lon");
        // the cell at lon 100 failed in the second row
        final LabeledDataset partialRow = LabeledDataset.concatenate(Arrays.asList(buildCell(10.0, 110.0, 4.0)),
                                                                     "lon");

        final LabeledDataset grid = LabeledDataset.concatenate(Arrays.asList(fullRow, partialRow), "lat");

        Assert.assertArrayEquals("invalid lat values",
                                 new double[] { 0.0, 10.0 }, grid.getVariable("lat").getValues(), 0.0);
        Assert.assertArrayEquals("invalid lon values",
                                 new double[] { 100.0, 110.0 }, grid.getVariable("lon").getValues(), 0.0);
        Assert.assertEquals("invalid value", 1.0, valueAt(grid, 0.0, 100.0, 0.0), 0.0);
        Assert.assertEquals("invalid value", 4.0, valueAt(grid, 10.0, 110.0, 120.0), 0.0);
        Assert.assertTrue("missing cell should be NaN", Double.isNaN(valueAt(grid, 10.0, 100.0, 0.0)));
    }

    @Test
    public void testOuterAlignmentKeepsDescendingOrder() {
        final LabeledDataset first = LabeledDataset.concatenate(Arrays.asList(buildCell(5.0, 30.0, 1.0),
                                                                              buildCell(5.0, 20.0, 1.0)),
                                                                "lon");
        final LabeledDataset second = LabeledDataset.concatenate(Arrays.asList(buildCell(4.0, 10.0, 1.0)),
                                                                 "lon");
        final LabeledDataset grid = LabeledDataset.concatenate(Arrays.asList(first, second), "lat");
        Assert.assertArrayEquals("union should follow the first dataset's direction",
                                 new double[] { 30.0, 20.0, 10.0 }, grid.getVariable("lon").getValues(), 0.0);
    }

    @Test
    public void testTransposeAndSelect() {
        final LabeledDataset row = LabeledDataset.concatenate(Arrays.asList(buildCell(0.0, 100.0, 1.0),
                                                                            buildCell(0.0, 110.0, 2.0)),
                                                              "lon");
        final LabeledDataset transposed = row.transpose(Arrays.asList("time", "nlev", "lat", "lon"));
        Assert.assertEquals("invalid t dimensions",
                            Arrays.asList("time", "lon"), transposed.getVariable("t").getDimensions());

        final LabeledDataset cell = transposed.selectIndex("lon", 1);
        Assert.assertEquals("lon should become scalar", 110.0, cell.getVariable("lon").getScalarValue(), 0.0);
        Assert.assertTrue("selected cell should equal the original", cell.hasSameContent(buildCell(0.0, 110.0, 2.0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTransposeRequiresAllDimensions() {
        buildCell(0.0, 100.0, 1.0).transpose(Arrays.asList("lon"));
    }

    @Test
    public void testMerge() {
        final LabeledDataset cell = buildCell(0.0, 100.0, 1.0);
        final LabeledDataset other = new LabeledDataset()
                .withCoordinate("time", cell.getVariable("time"))
                .withVariable("q", DataArray.vector("time", new double[] { 7, 8, 9 }, DataArray.ValueType.DOUBLE));

        final LabeledDataset merged = LabeledDataset.merge(Arrays.asList(cell, other));
        Assert.assertTrue("merged dataset should have t", merged.hasVariable("t"));
        Assert.assertTrue("merged dataset should have q", merged.hasVariable("q"));
        Assert.assertTrue("time should stay a coordinate", merged.isCoordinate("time"));

        final LabeledDataset conflicting = other.withVariable(
                "t", DataArray.vector("time", new double[] { 0, 0, 0 }, DataArray.ValueType.DOUBLE));
        try {
            LabeledDataset.merge(Arrays.asList(cell, conflicting));
            Assert.fail("conflicting values should not be merged");
        } catch (final IllegalArgumentException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInconsistentDimensionLength() {
        buildCell(0.0, 100.0, 1.0)
                .withVariable("bad", DataArray.vector("time", new double[] { 1, 2 }, DataArray.ValueType.DOUBLE));
    }

    static LabeledDataset buildCell(final double lat,
                                    final double lon,
                                    final double baseValue) {
        return new LabeledDataset()
                .withCoordinate("time", DataArray.vector("time", new double[] { 0, 60, 120 }, DataArray.ValueType.DOUBLE)
                        .withAttribute("units", "seconds"))
                .withCoordinate("lat", DataArray.scalar(lat, DataArray.ValueType.DOUBLE))
                .withCoordinate("lon", DataArray.scalar(lon, DataArray.ValueType.DOUBLE))
                .withVariable("t", DataArray.vector("time",
                                                    new double[] { baseValue, baseValue, baseValue },
                                                    DataArray.ValueType.DOUBLE));
    }

    private static double valueAt(final LabeledDataset dataset,
                                  final double lat,
                                  final double lon,
                                  final double time) {
        final Map<String, Double> coordinates = new HashMap<>();
        coordinates.put("lat", lat);
        coordinates.put("lon", lon);
        coordinates.put("time", time);
        return dataset.getValueAt("t", coordinates);
    }
}
