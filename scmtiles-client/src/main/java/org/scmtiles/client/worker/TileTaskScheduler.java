package org.scmtiles.client.worker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.spec.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches tiles to a fixed-size pool of worker threads and collects the tile results
 * in completion order.
 */
public class TileTaskScheduler {

    private final int numWorkers;

    public TileTaskScheduler(final int numWorkers)
            throws IllegalArgumentException {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("number of workers must be positive");
        }
        this.numWorkers = numWorkers;
    }

    /**
     * Processes every tile and waits for all of them to finish.
     *
     * @return tile results in completion order.
     *
     * @throws GridAssemblyException
     *   if any tile failed to return a result (all other tiles are still processed first)
     *   or the calling thread was interrupted.
     */
    public List<TileResult> processTiles(final List<Tile> tiles,
                                         final TileWorker worker)
            throws GridAssemblyException {

        LOG.info("processTiles: dispatching {} tiles to {} workers", tiles.size(), numWorkers);

        final ExecutorService executorService = Executors.newFixedThreadPool(numWorkers);
        final CompletionService<TileResult> completionService = new ExecutorCompletionService<>(executorService);

        final List<TileResult> tileResults = new ArrayList<>(tiles.size());
        int missingResultCount = 0;

        try {
            for (final Tile tile : tiles) {
                completionService.submit(() -> worker.processTile(tile));
            }

            for (int i = 0; i < tiles.size(); i++) {
                final Future<TileResult> future = completionService.take();
                try {
                    final TileResult tileResult = future.get();
                    tileResults.add(tileResult);
                    LOG.info("processTiles: collected result for tile {} ({} of {})",
                             tileResult.getTileId(), i + 1, tiles.size());
                } catch (final ExecutionException e) {
                    missingResultCount++;
                    LOG.error("processTiles: worker failed to return a tile result", e.getCause());
                }
            }

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GridAssemblyException("interrupted while waiting for tile results", e);
        } finally {
            executorService.shutdownNow();
        }

        if (missingResultCount > 0) {
            throw new GridAssemblyException(missingResultCount + " of " + tiles.size() +
                                            " tiles did not return a result, see log for details");
        }

        return tileResults;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileTaskScheduler.class);
}
