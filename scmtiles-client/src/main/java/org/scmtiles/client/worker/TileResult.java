package org.scmtiles.client.worker;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.scmtiles.client.run.RunResult;
import org.scmtiles.grid.assembly.TileDataset;

/**
 * Per-cell outcomes of one tile plus the tile's merged dataset (absent when every cell failed).
 */
public class TileResult {

    private final int tileId;
    private final List<RunResult> runResults;
    private final TileDataset tileDataset;

    public TileResult(final int tileId,
                      final List<RunResult> runResults,
                      final TileDataset tileDataset) {
        this.tileId = tileId;
        this.runResults = Collections.unmodifiableList(runResults);
        this.tileDataset = tileDataset;
    }

    public int getTileId() {
        return tileId;
    }

    public List<RunResult> getRunResults() {
        return runResults;
    }

    public Optional<TileDataset> getTileDataset() {
        return Optional.ofNullable(tileDataset);
    }

    public int getSuccessCount() {
        int count = 0;
        for (final RunResult runResult : runResults) {
            if (runResult.isSuccessful()) {
                count++;
            }
        }
        return count;
    }

    public int getFailureCount() {
        return runResults.size() - getSuccessCount();
    }

    @Override
    public String toString() {
        return "TileResult{tileId=" + tileId + ", successCount=" + getSuccessCount() +
               ", failureCount=" + getFailureCount() + ", hasDataset=" + (tileDataset != null) + '}';
    }
}
