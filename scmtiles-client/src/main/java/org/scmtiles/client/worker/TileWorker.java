package org.scmtiles.client.worker;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.scmtiles.client.run.CellResultSource;
import org.scmtiles.client.run.FailureKind;
import org.scmtiles.client.run.RunResult;
import org.scmtiles.grid.assembly.CellDataset;
import org.scmtiles.grid.assembly.TileAssembler;
import org.scmtiles.grid.assembly.TileDataset;
import org.scmtiles.grid.spec.Cell;
import org.scmtiles.grid.spec.Tile;
import org.scmtiles.grid.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes the cells of a tile one after another and merges their results into a tile dataset.
 * Workers share only read-only collaborators, so one instance can process tiles on several threads.
 */
public class TileWorker {

    private final CellResultSource cellResultSource;
    private final CellDatasetLoader cellDatasetLoader;
    private final TileAssembler tileAssembler;

    public TileWorker(final CellResultSource cellResultSource,
                      final CellDatasetLoader cellDatasetLoader,
                      final TileAssembler tileAssembler) {
        this.cellResultSource = cellResultSource;
        this.cellDatasetLoader = cellDatasetLoader;
        this.tileAssembler = tileAssembler;
    }

    /**
     * @throws IllegalArgumentException
     *   if the loaded cell datasets cannot be merged.
     */
    public TileResult processTile(final Tile tile)
            throws IllegalArgumentException {

        LOG.info("processTile: entry, tile {} with {} cells", tile.getId(), tile.size());

        final ProcessTimer timer = new ProcessTimer();
        final List<RunResult> runResults = new ArrayList<>(tile.size());
        final List<CellDataset> cellDatasets = new ArrayList<>(tile.size());

        for (final Cell cell : tile.getCells()) {
            RunResult runResult = cellResultSource.getResult(cell);
            if (runResult.isSuccessful()) {
                try {
                    cellDatasets.add(cellDatasetLoader.load(cell, runResult.getArchivedFiles()));
                } catch (final IOException e) {
                    LOG.error("processTile: cell {} failed with {}", cell, FailureKind.LOADING, e);
                    runResult = RunResult.failure(cell, FailureKind.LOADING, e.getMessage(), null);
                }
            }
            runResults.add(runResult);
        }

        final Optional<TileDataset> tileDataset = tileAssembler.assemble(tile.getId(), cellDatasets);
        final TileResult tileResult = new TileResult(tile.getId(), runResults, tileDataset.orElse(null));

        if (tileDataset.isPresent()) {
            LOG.info("processTile: exit, tile {} completed in {}, {} of {} cells succeeded",
                     tile.getId(), timer, tileResult.getSuccessCount(), tile.size());
        } else {
            LOG.error("processTile: exit, tile {} has no usable cells after {}", tile.getId(), timer);
        }

        return tileResult;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileWorker.class);
}
