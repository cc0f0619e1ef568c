package org.scmtiles.grid.assembly;

import java.io.Serializable;

import org.scmtiles.grid.dataset.LabeledDataset;

/**
 * Merged results for the cells of one tile.
 * The maximum row coordinate value is the key used to order tiles during grid assembly.
 */
public class TileDataset
        implements Serializable {

    private final int tileId;
    private final double maxRowCoordinate;
    private final LabeledDataset dataset;

    public TileDataset(final int tileId,
                       final double maxRowCoordinate,
                       final LabeledDataset dataset) {
        this.tileId = tileId;
        this.maxRowCoordinate = maxRowCoordinate;
        this.dataset = dataset;
    }

    public int getTileId() {
        return tileId;
    }

    public double getMaxRowCoordinate() {
        return maxRowCoordinate;
    }

    public LabeledDataset getDataset() {
        return dataset;
    }

    @Override
    public String toString() {
        return "TileDataset{tileId=" + tileId + ", maxRowCoordinate=" + maxRowCoordinate + '}';
    }
}
