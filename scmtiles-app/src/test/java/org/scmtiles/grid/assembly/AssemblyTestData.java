package org.scmtiles.grid.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.scmtiles.grid.dataset.DataArray;
import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.spec.Cell;
import org.scmtiles.grid.spec.Tile;

/**
 * Builds cell results for assembly tests.
 * Each cell has a level dimension so that dimension reordering can be checked,
 * and values derived from the cell position so that misplaced cells are detected.
 */
class AssemblyTestData {

    static final double[] LATITUDES = { 40.0, 50.0, 60.0 };
    static final double[] DESCENDING_LATITUDES = { 60.0, 50.0, 40.0 };
    static final double[] LONGITUDES = { -10.0, 0.0, 10.0, 20.0 };

    static double expectedValue(final int x,
                                final int y,
                                final int timeIndex,
                                final int level) {
        return (y * 1000) + (x * 100) + (timeIndex * 10) + level;
    }

    static CellDataset buildCell(final Cell cell) {
        return buildCell(cell, LATITUDES);
    }

    static CellDataset buildCell(final Cell cell,
                                 final double[] latitudes) {
        final int x = cell.getXGlobal();
        final int y = cell.getYGlobal();
        final double[] values = new double[2 * 3];
        for (int level = 0; level < 2; level++) {
            for (int t = 0; t < 3; t++) {
                values[(level * 3) + t] = expectedValue(x, y, t, level);
            }
        }
        final LabeledDataset dataset = new LabeledDataset()
                .withCoordinate("time", DataArray.vector("time", new double[] { 0, 900, 1800 }, DataArray.ValueType.DOUBLE)
                        .withAttribute("units", "seconds"))
                .withCoordinate("nlev", DataArray.vector("nlev", new double[] { 0, 1 }, DataArray.ValueType.INT))
                .withCoordinate("lat", DataArray.scalar(latitudes[y], DataArray.ValueType.DOUBLE))
                .withCoordinate("lon", DataArray.scalar(LONGITUDES[x], DataArray.ValueType.DOUBLE))
                .withVariable("t", new DataArray(Arrays.asList("nlev", "time"),
                                                 new int[] { 2, 3 },
                                                 values,
                                                 DataArray.ValueType.DOUBLE,
                                                 null));
        return new CellDataset(cell, dataset);
    }

    static List<CellDataset> buildCells(final Tile tile) {
        return buildCells(tile, LATITUDES);
    }

    static List<CellDataset> buildCells(final Tile tile,
                                        final double[] latitudes) {
        final List<CellDataset> cells = new ArrayList<>();
        for (final Cell cell : tile.getCells()) {
            cells.add(buildCell(cell, latitudes));
        }
        return cells;
    }

}
