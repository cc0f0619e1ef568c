package org.scmtiles.client.worker;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.scmtiles.client.GridTestFixtures;
import org.scmtiles.client.run.CellResultSource;
import org.scmtiles.client.run.FailureKind;
import org.scmtiles.client.run.RunResult;
import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.assembly.TileAssembler;
import org.scmtiles.grid.dataset.DropList;
import org.scmtiles.grid.spec.Cell;
import org.scmtiles.grid.spec.GridDecomposer;
import org.scmtiles.grid.spec.Tile;

/**
 * Tests the {@link TileTaskScheduler} class.
 */
public class TileTaskSchedulerTest {

    private CellDatasetLoader cellDatasetLoader;
    private List<Tile> tiles;

    @Before
    public void setup() throws Exception {
        final CoordinateTemplates coordinateTemplates =
                CoordinateTemplates.fromDataset(GridTestFixtures.buildInput(), "lon", "lat", 2, 2);
        cellDatasetLoader = new CellDatasetLoader(DropList.absent(), coordinateTemplates, "lon", "lat");
        tiles = new GridDecomposer(2, 2).decomposeByRows(1);
    }

    @Test
    public void testEveryCellIsRequested() throws Exception {

        final Set<Cell> requestedCells = ConcurrentHashMap.newKeySet();
        final CellResultSource source = cell -> {
            requestedCells.add(cell);
            return RunResult.failure(cell, FailureKind.NONZERO_EXIT, "test failure", null);
        };

        final List<TileResult> tileResults =
                new TileTaskScheduler(2).processTiles(tiles, buildWorker(source));

        Assert.assertEquals("invalid number of tile results", 2, tileResults.size());
        Assert.assertEquals("invalid number of requested cells", 4, requestedCells.size());
        for (final TileResult tileResult : tileResults) {
            Assert.assertEquals("invalid failure count for " + tileResult, 2, tileResult.getFailureCount());
            Assert.assertFalse("tile without successful cells should have no dataset",
                               tileResult.getTileDataset().isPresent());
        }
    }

    @Test
    public void testMissingTileResult() throws Exception {

        final Set<Cell> requestedCells = ConcurrentHashMap.newKeySet();
        final CellResultSource source = cell -> {
            requestedCells.add(cell);
            if (cell.getYGlobal() == 0) {
                throw new IllegalStateException("test worker crash");
            }
            return RunResult.failure(cell, FailureKind.VERIFICATION, "test failure", null);
        };

        try {
            new TileTaskScheduler(1).processTiles(tiles, buildWorker(source));
            Assert.fail("missing tile result should fail the job");
        } catch (final GridAssemblyException e) {
            Assert.assertTrue("other tile should still be processed",
                              requestedCells.contains(new Cell(1, 1)));
        }
    }

    @Test
    public void testNoTiles() throws Exception {
        final List<TileResult> tileResults =
                new TileTaskScheduler(3).processTiles(Collections.emptyList(),
                                                      buildWorker(cell -> null));
        Assert.assertTrue("no tiles should give no results", tileResults.isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidWorkerCount() {
        new TileTaskScheduler(0);
    }

    private TileWorker buildWorker(final CellResultSource source) {
        return new TileWorker(source, cellDatasetLoader, new TileAssembler("lon", "lat"));
    }
}
